package com.transmuter.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * POST /api/v1/admin/collaterals body.
 */
public record AddCollateralRequest(
        @NotBlank(message = "INVALID_PARAMS")
        String asset,

        @Min(value = 1, message = "INVALID_PARAMS")
        int decimals,

        @NotNull(message = "INVALID_ORACLE")
        @Valid
        OracleConfigDto oracle
) {
}
