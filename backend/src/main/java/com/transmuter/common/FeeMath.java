package com.transmuter.common;

import java.math.BigInteger;

import static com.transmuter.common.FixedPoint.BASE_12;
import static com.transmuter.common.FixedPoint.BASE_9;

/**
 * Signed fee application at the BASE_9 fee base. Fees are bounded by configuration so that every divisor
 * below stays strictly positive; a fee outside that bound reaching these helpers is a programming error.
 * <p>
 * Burn-side fees scale the amount by {@code (1 - fee)}; mint-side fees divide it by {@code (1 + fee)}.
 * A negative fee is a rebate in both cases.
 */
public final class FeeMath {

    private FeeMath() {
    }

    /**
     * {@code amount * (1 - fee)} for {@code fee >= 0}, {@code amount * (1 + |fee|)} otherwise. Rounds down.
     */
    public static BigInteger applyFee(BigInteger amount, long fee) {
        return FixedPoint.mulDiv(amount, oneMinus(fee), BASE_9);
    }

    /**
     * Inverse of {@link #applyFee}: the amount that yields {@code amount} once the fee is applied. Rounds up.
     */
    public static BigInteger invertFee(BigInteger amount, long fee) {
        return FixedPoint.mulDiv(amount, BASE_9, oneMinus(fee), FixedPoint.Rounding.UP);
    }

    /**
     * {@code amount / (1 + fee)}. Rounds down. Fees of {@code BASE_12} and more count as infinite.
     */
    public static BigInteger applyFeeMint(BigInteger amount, long fee) {
        return FixedPoint.mulDiv(amount, BASE_9, onePlusMint(fee));
    }

    /**
     * Inverse of {@link #applyFeeMint}: {@code amount * (1 + fee)}. Rounds up.
     */
    public static BigInteger invertFeeMint(BigInteger amount, long fee) {
        return FixedPoint.mulDiv(amount, onePlusMint(fee), BASE_9, FixedPoint.Rounding.UP);
    }

    private static BigInteger oneMinus(long fee) {
        BigInteger factor = BASE_9.subtract(BigInteger.valueOf(fee));
        if (factor.signum() <= 0) {
            throw new ArithmeticException("burn fee out of range: " + fee);
        }
        return factor;
    }

    private static BigInteger onePlusMint(long fee) {
        BigInteger castedFee = BigInteger.valueOf(fee);
        if (castedFee.compareTo(BASE_12) >= 0) {
            throw new TransmuterException(TransmuterError.INVALID_SWAP, "Mint fee is infinite: " + fee);
        }
        BigInteger factor = BASE_9.add(castedFee);
        if (factor.signum() <= 0) {
            throw new ArithmeticException("mint fee out of range: " + fee);
        }
        return factor;
    }
}
