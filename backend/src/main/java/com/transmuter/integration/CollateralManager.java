package com.transmuter.integration;

import com.transmuter.domain.ManagerConfig;

import java.math.BigInteger;

/**
 * Idle-capital manager that may deploy part of a collateral's reserve to yield strategies.
 */
public interface CollateralManager {

    /**
     * Collateral immediately withdrawable for a payout, in collateral token units.
     */
    BigInteger maxAvailable(String asset, ManagerConfig config);

    /**
     * Brings every deployed unit of {@code asset} back to the reserve. Used when detaching a manager.
     */
    void pullAll(String asset, ManagerConfig config);
}
