package com.transmuter.query;

import com.transmuter.domain.FeeCurve;
import com.transmuter.domain.ManagerConfig;
import com.transmuter.domain.OracleConfig;

import java.math.BigInteger;

/**
 * Read view of a collateral. {@code issued} is in stablecoin units, {@code normalizedStables} in normalized units.
 */
public record CollateralInfo(
        String asset,
        int decimals,
        BigInteger issued,
        BigInteger normalizedStables,
        FeeCurve mintFees,
        FeeCurve burnFees,
        boolean mintPaused,
        boolean burnPaused,
        boolean managed,
        ManagerConfig managerConfig,
        OracleConfig oracleConfig,
        BigInteger stablecoinCap
) {
}
