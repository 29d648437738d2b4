package com.transmuter.api.dto;

public record SwapResponse(String tokenIn, String tokenOut, String amountIn, String amountOut) {
}
