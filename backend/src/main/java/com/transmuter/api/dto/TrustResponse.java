package com.transmuter.api.dto;

public record TrustResponse(String address, boolean trusted, boolean trustedSeller) {
}
