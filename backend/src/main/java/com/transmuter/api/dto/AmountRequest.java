package com.transmuter.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Single-amount body: stablecoin cap, pushed oracle price.
 */
public record AmountRequest(
        @NotNull(message = "INVALID_AMOUNT")
        @Pattern(regexp = Amounts.PATTERN, message = "INVALID_AMOUNT")
        String value
) {
}
