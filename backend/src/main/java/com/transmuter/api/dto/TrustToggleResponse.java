package com.transmuter.api.dto;

import com.transmuter.domain.TrustType;

public record TrustToggleResponse(String address, TrustType type, boolean trusted) {
}
