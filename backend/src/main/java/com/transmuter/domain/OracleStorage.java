package com.transmuter.domain;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Oracle-owned cache on the collateral record: last pushed BASE_18 spot price.
 */
public record OracleStorage(BigInteger spotPrice, Instant updatedAt) {
}
