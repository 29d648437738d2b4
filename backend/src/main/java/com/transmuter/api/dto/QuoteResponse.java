package com.transmuter.api.dto;

/**
 * GET /api/v1/quotes/in and /out response. One of the amounts echoes the request, the other is quoted.
 */
public record QuoteResponse(String tokenIn, String tokenOut, String amountIn, String amountOut) {
}
