package com.transmuter.api.dto;

import com.transmuter.domain.TrustType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record TrustedRequest(
        @NotBlank(message = "INVALID_ADDRESS")
        String address,

        @NotNull(message = "INVALID_PARAMS")
        TrustType type
) {
}
