package com.transmuter.domain;

/**
 * How the spot price of a collateral is obtained.
 */
public enum OracleReadType {
    /** Spot equals the target: the collateral is valued at peg. */
    NO_ORACLE,
    /** Spot is the last price pushed into the oracle storage. */
    PUSHED
}
