package com.transmuter.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public record DepositRequest(
        @NotBlank(message = "INVALID_TOKENS")
        String token,

        @NotBlank(message = "INVALID_ADDRESS")
        String holder,

        @NotNull(message = "INVALID_AMOUNT")
        @Pattern(regexp = Amounts.PATTERN, message = "INVALID_AMOUNT")
        String amount
) {
}
