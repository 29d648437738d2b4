package com.transmuter.quoter;

import java.math.BigInteger;

/**
 * Price of the collateral being redeemed and the worst deviation among the collaterals that share its oracle.
 */
public record BurnPrice(BigInteger price, BigInteger deviation) {
}
