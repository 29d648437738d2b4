package com.transmuter.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * POST /api/v1/ledger/normalizer body. {@code caller} must be a trusted address.
 */
public record NormalizerRequest(
        @NotBlank(message = "INVALID_ADDRESS")
        String caller,

        @NotNull(message = "INVALID_AMOUNT")
        @Pattern(regexp = Amounts.PATTERN, message = "INVALID_AMOUNT")
        String amount,

        boolean increase
) {
}
