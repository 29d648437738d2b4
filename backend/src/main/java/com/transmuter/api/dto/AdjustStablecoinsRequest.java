package com.transmuter.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public record AdjustStablecoinsRequest(
        @NotNull(message = "INVALID_AMOUNT")
        @Pattern(regexp = Amounts.PATTERN, message = "INVALID_AMOUNT")
        String amount,

        boolean increase
) {
}
