package com.transmuter.api.dto;

import com.transmuter.domain.ManagerConfig;
import com.transmuter.query.CollateralInfo;

public record CollateralResponse(
        String asset,
        int decimals,
        String issued,
        String normalizedStables,
        FeeCurveDto mintFees,
        FeeCurveDto burnFees,
        boolean mintPaused,
        boolean burnPaused,
        boolean managed,
        ManagerConfig manager,
        OracleConfigDto oracle,
        String stablecoinCap
) {

    public static CollateralResponse from(CollateralInfo info) {
        return new CollateralResponse(
                info.asset(),
                info.decimals(),
                Amounts.format(info.issued()),
                Amounts.format(info.normalizedStables()),
                FeeCurveDto.from(info.mintFees()),
                FeeCurveDto.from(info.burnFees()),
                info.mintPaused(),
                info.burnPaused(),
                info.managed(),
                info.managerConfig(),
                OracleConfigDto.from(info.oracleConfig()),
                Amounts.format(info.stablecoinCap()));
    }
}
