package com.transmuter.api.dto;

public record NormalizerResponse(String normalizer) {
}
