package com.transmuter.api.dto;

import com.transmuter.common.FixedPoint;
import com.transmuter.common.TransmuterError;
import com.transmuter.common.TransmuterException;

import java.math.BigInteger;

/**
 * Amounts travel as base-10 strings so that uint256 values survive JSON clients.
 */
public final class Amounts {

    /** Non-negative integer without sign or separators. */
    public static final String PATTERN = "\\d{1,78}";

    private Amounts() {
    }

    public static BigInteger parse(String value) {
        if (value == null || !value.matches(PATTERN)) {
            throw new TransmuterException(TransmuterError.INVALID_PARAMS, "Invalid amount: " + value);
        }
        return FixedPoint.checkUint(new BigInteger(value), 256);
    }

    public static String format(BigInteger value) {
        return value == null ? null : value.toString();
    }
}
