package com.transmuter.swap;

import java.math.BigInteger;

/**
 * Settled (or quoted) amounts of a swap, in the units of the token on each side.
 */
public record SwapResult(String tokenIn, String tokenOut, BigInteger amountIn, BigInteger amountOut) {
}
