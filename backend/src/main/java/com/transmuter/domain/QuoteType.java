package com.transmuter.domain;

/**
 * Direction plus the side of the swap that is fixed by the caller.
 */
public enum QuoteType {
    MINT_EXACT_INPUT,
    MINT_EXACT_OUTPUT,
    BURN_EXACT_INPUT,
    BURN_EXACT_OUTPUT;

    public boolean isMint() {
        return this == MINT_EXACT_INPUT || this == MINT_EXACT_OUTPUT;
    }

    /**
     * True when the amount handed to the fee curve is a stablecoin amount (the minted output or the burnt
     * input), so the curve breakpoints can be compared to it directly.
     */
    public boolean isStablecoinDenominated() {
        return this == MINT_EXACT_OUTPUT || this == BURN_EXACT_INPUT;
    }
}
