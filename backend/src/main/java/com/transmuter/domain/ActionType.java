package com.transmuter.domain;

/**
 * Swap direction from the protocol's point of view: issuing or redeeming stablecoins.
 */
public enum ActionType {
    MINT,
    BURN
}
