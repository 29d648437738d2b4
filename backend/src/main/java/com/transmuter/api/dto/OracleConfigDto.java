package com.transmuter.api.dto;

import com.transmuter.domain.OracleConfig;
import com.transmuter.domain.OracleReadType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public record OracleConfigDto(
        @NotNull(message = "INVALID_ORACLE")
        OracleReadType readType,

        String peg,

        @NotNull(message = "INVALID_ORACLE")
        @Pattern(regexp = Amounts.PATTERN, message = "INVALID_ORACLE")
        String targetPrice
) {

    public OracleConfig toDomain() {
        return new OracleConfig(readType, peg, Amounts.parse(targetPrice));
    }

    public static OracleConfigDto from(OracleConfig config) {
        return config == null ? null
                : new OracleConfigDto(config.readType(), config.peg(), Amounts.format(config.targetPrice()));
    }
}
