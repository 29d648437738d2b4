package com.transmuter.api.dto;

public record BalanceResponse(String token, String holder, String balance) {
}
