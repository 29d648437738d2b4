package com.transmuter.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.time.Instant;

/**
 * POST /api/v1/swaps/exact-input and /exact-output body. {@code amount} is the fixed side (input for exact-input,
 * output for exact-output); {@code limit} the slippage bound on the other side (minimum output, maximum input).
 */
public record SwapRequest(
        @NotNull(message = "INVALID_AMOUNT")
        @Pattern(regexp = Amounts.PATTERN, message = "INVALID_AMOUNT")
        String amount,

        @NotNull(message = "INVALID_AMOUNT")
        @Pattern(regexp = Amounts.PATTERN, message = "INVALID_AMOUNT")
        String limit,

        @NotBlank(message = "INVALID_TOKENS")
        String tokenIn,

        @NotBlank(message = "INVALID_TOKENS")
        String tokenOut,

        @NotBlank(message = "INVALID_ADDRESS")
        String to,

        @NotBlank(message = "INVALID_ADDRESS")
        String sender,

        @NotNull(message = "INVALID_DEADLINE")
        Instant deadline
) {
}
