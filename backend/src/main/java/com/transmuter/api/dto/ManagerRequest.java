package com.transmuter.api.dto;

import com.transmuter.domain.ManagerConfig;

/**
 * PUT /api/v1/admin/collaterals/{asset}/manager body. A null target detaches the current manager.
 */
public record ManagerRequest(String target, String strategy) {

    public ManagerConfig toDomain() {
        return target == null || target.isBlank() ? null : new ManagerConfig(target, strategy);
    }
}
