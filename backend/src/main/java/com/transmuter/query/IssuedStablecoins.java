package com.transmuter.query;

import java.math.BigInteger;

/**
 * Stablecoins issued against one collateral alongside the total supply.
 */
public record IssuedStablecoins(BigInteger stablecoinsFromCollateral, BigInteger stablecoinsIssued) {
}
