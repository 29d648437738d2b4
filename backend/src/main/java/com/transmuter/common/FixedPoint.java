package com.transmuter.common;

import java.math.BigInteger;

/**
 * Unsigned fixed-point arithmetic over uint256-bounded integers.
 * Every operation fails closed with {@link ArithmeticException} instead of wrapping: a silent wraparound
 * would corrupt the reserve counters.
 */
public final class FixedPoint {

    public static final BigInteger BASE_6 = BigInteger.TEN.pow(6);
    public static final BigInteger BASE_9 = BigInteger.TEN.pow(9);
    public static final BigInteger BASE_12 = BigInteger.TEN.pow(12);
    public static final BigInteger BASE_18 = BigInteger.TEN.pow(18);
    public static final BigInteger BASE_27 = BigInteger.TEN.pow(27);
    public static final BigInteger BASE_36 = BigInteger.TEN.pow(36);

    /** Fee and exposure base as a primitive, for curve breakpoints. */
    public static final long BASE_9_LONG = 1_000_000_000L;

    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private FixedPoint() {
    }

    public enum Rounding {
        DOWN, UP
    }

    /**
     * {@code a * b / denominator} with the requested rounding. Fails on a zero denominator or a result
     * that does not fit in 256 bits.
     */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger denominator, Rounding rounding) {
        requireNonNegative(a);
        requireNonNegative(b);
        if (denominator.signum() <= 0) {
            throw new ArithmeticException("division by zero");
        }
        BigInteger[] qr = a.multiply(b).divideAndRemainder(denominator);
        BigInteger result = qr[0];
        if (rounding == Rounding.UP && qr[1].signum() > 0) {
            result = result.add(BigInteger.ONE);
        }
        return checkUint(result, 256);
    }

    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger denominator) {
        return mulDiv(a, b, denominator, Rounding.DOWN);
    }

    public static BigInteger add(BigInteger a, BigInteger b) {
        return checkUint(requireNonNegative(a).add(requireNonNegative(b)), 256);
    }

    /**
     * {@code a - b}, failing when {@code b > a}.
     */
    public static BigInteger sub(BigInteger a, BigInteger b) {
        BigInteger result = a.subtract(b);
        if (result.signum() < 0) {
            throw new ArithmeticException("underflow: " + a + " - " + b);
        }
        return result;
    }

    /**
     * {@code max(a - b, 0)}. Only for positions where integer rounding of two derived quantities can leave
     * the subtrahend one unit ahead.
     */
    public static BigInteger subOrZero(BigInteger a, BigInteger b) {
        BigInteger result = a.subtract(b);
        return result.signum() < 0 ? BigInteger.ZERO : result;
    }

    /**
     * Returns {@code value} if it is an unsigned integer of at most {@code bits} bits.
     */
    public static BigInteger checkUint(BigInteger value, int bits) {
        requireNonNegative(value);
        if (value.bitLength() > bits) {
            throw new ArithmeticException("value does not fit in uint" + bits + ": " + value);
        }
        return value;
    }

    /**
     * Square root with the requested rounding.
     */
    public static BigInteger sqrt(BigInteger value, Rounding rounding) {
        requireNonNegative(value);
        BigInteger root = value.sqrt();
        if (rounding == Rounding.UP && root.multiply(root).compareTo(value) < 0) {
            root = root.add(BigInteger.ONE);
        }
        return root;
    }

    /**
     * Rescales {@code amount} from {@code fromDecimals} to {@code toDecimals}, truncating when precision
     * is dropped.
     */
    public static BigInteger convertDecimalTo(BigInteger amount, int fromDecimals, int toDecimals) {
        if (fromDecimals > toDecimals) {
            return amount.divide(BigInteger.TEN.pow(fromDecimals - toDecimals));
        }
        if (fromDecimals < toDecimals) {
            return checkUint(amount.multiply(BigInteger.TEN.pow(toDecimals - fromDecimals)), 256);
        }
        return amount;
    }

    public static BigInteger min(BigInteger a, BigInteger b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static BigInteger requireNonNegative(BigInteger value) {
        if (value.signum() < 0) {
            throw new ArithmeticException("negative value: " + value);
        }
        return value;
    }
}
