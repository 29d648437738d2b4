package com.transmuter.api.dto;

public record OracleValuesResponse(String mint, String burn, String deviation) {
}
