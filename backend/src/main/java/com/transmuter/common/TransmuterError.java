package com.transmuter.common;

/**
 * Error codes surfaced by the quoting and settlement core. API layer maps them to HTTP statuses.
 */
public enum TransmuterError {

    /** Direction disabled for the asset. */
    PAUSED,
    /** Neither side of the pair is the stablecoin. */
    INVALID_TOKENS,
    /** Asset not registered (zero decimals). */
    NOT_COLLATERAL,
    /** Deadline passed. */
    TOO_LATE,
    TOO_SMALL_AMOUNT_OUT,
    TOO_BIG_AMOUNT_IN,
    /** Not enough idle liquidity, an infinite fee, or a cap reached. */
    INVALID_SWAP,
    NOT_TRUSTED,
    ALREADY_ADDED,
    /** Revocation of a collateral that still backs stablecoins. */
    COLLATERAL_BACKED,
    INVALID_PARAMS,
    INVALID_NEGATIVE_FEES,
    INVALID_ORACLE_VALUE
}
