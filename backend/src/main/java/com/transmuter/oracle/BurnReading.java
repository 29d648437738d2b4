package com.transmuter.oracle;

import java.math.BigInteger;

public record BurnReading(BigInteger price, BigInteger deviation) {
}
