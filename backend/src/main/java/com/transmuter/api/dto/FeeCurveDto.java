package com.transmuter.api.dto;

import com.transmuter.domain.FeeCurve;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Breakpoints as BASE_9 exposures and signed BASE_9 fees.
 */
public record FeeCurveDto(
        @NotEmpty(message = "INVALID_PARAMS")
        List<Long> exposures,

        @NotEmpty(message = "INVALID_PARAMS")
        List<Long> fees
) {

    public FeeCurve toDomain() {
        return new FeeCurve(exposures, fees);
    }

    public static FeeCurveDto from(FeeCurve curve) {
        return new FeeCurveDto(curve.exposures(), curve.fees());
    }
}
