package com.transmuter.query;

import java.math.BigInteger;

public record OracleValues(BigInteger mint, BigInteger burn, BigInteger deviation) {
}
