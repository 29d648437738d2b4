package com.transmuter.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FixedPointTest {

    @Test
    @DisplayName("mulDiv rounds down by default and up on request")
    void mulDivRounding() {
        BigInteger seven = BigInteger.valueOf(7);
        BigInteger two = BigInteger.TWO;

        assertThat(FixedPoint.mulDiv(seven, BigInteger.ONE, two)).isEqualTo(3);
        assertThat(FixedPoint.mulDiv(seven, BigInteger.ONE, two, FixedPoint.Rounding.UP)).isEqualTo(4);
        assertThat(FixedPoint.mulDiv(BigInteger.valueOf(8), BigInteger.ONE, two, FixedPoint.Rounding.UP)).isEqualTo(4);
    }

    @Test
    @DisplayName("mulDiv fails on zero denominator and on results above uint256")
    void mulDivFailsClosed() {
        assertThatThrownBy(() -> FixedPoint.mulDiv(BigInteger.ONE, BigInteger.ONE, BigInteger.ZERO))
                .isInstanceOf(ArithmeticException.class);
        assertThatThrownBy(() -> FixedPoint.mulDiv(FixedPoint.MAX_UINT256, BigInteger.TWO, BigInteger.ONE))
                .isInstanceOf(ArithmeticException.class);
    }

    @Test
    @DisplayName("sub fails on underflow, subOrZero clamps")
    void subtraction() {
        assertThat(FixedPoint.sub(BigInteger.TEN, BigInteger.ONE)).isEqualTo(9);
        assertThatThrownBy(() -> FixedPoint.sub(BigInteger.ONE, BigInteger.TEN))
                .isInstanceOf(ArithmeticException.class);
        assertThat(FixedPoint.subOrZero(BigInteger.ONE, BigInteger.TEN)).isZero();
    }

    @Test
    void checkUintRejectsWideValues() {
        BigInteger max128 = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

        assertThat(FixedPoint.checkUint(max128, 128)).isEqualTo(max128);
        assertThatThrownBy(() -> FixedPoint.checkUint(max128.add(BigInteger.ONE), 128))
                .isInstanceOf(ArithmeticException.class);
        assertThatThrownBy(() -> FixedPoint.checkUint(BigInteger.ONE.negate(), 128))
                .isInstanceOf(ArithmeticException.class);
    }

    @Test
    void sqrtRoundsUpOnlyWhenInexact() {
        assertThat(FixedPoint.sqrt(BigInteger.valueOf(16), FixedPoint.Rounding.UP)).isEqualTo(4);
        assertThat(FixedPoint.sqrt(BigInteger.valueOf(17), FixedPoint.Rounding.UP)).isEqualTo(5);
        assertThat(FixedPoint.sqrt(BigInteger.valueOf(17), FixedPoint.Rounding.DOWN)).isEqualTo(4);
    }

    @Test
    @DisplayName("convertDecimalTo scales up exactly and truncates when scaling down")
    void convertDecimals() {
        assertThat(FixedPoint.convertDecimalTo(BigInteger.valueOf(1_500_000), 6, 18))
                .isEqualTo(new BigInteger("1500000000000000000"));
        assertThat(FixedPoint.convertDecimalTo(new BigInteger("1500000999999999999"), 18, 6))
                .isEqualTo(1_500_000);
        assertThat(FixedPoint.convertDecimalTo(BigInteger.TEN, 8, 8)).isEqualTo(10);
    }
}
