package com.transmuter.swap;

import com.transmuter.common.TransmuterError;
import com.transmuter.common.TransmuterException;
import com.transmuter.domain.Collateral;
import com.transmuter.integration.CollateralManager;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Rejects burns that a managed collateral cannot pay out right now.
 */
@Component
@RequiredArgsConstructor
public class AvailabilityGuard {

    private final CollateralManager collateralManager;

    public void checkAvailable(Collateral collateral, BigInteger amountOut) {
        if (!collateral.isManaged()) {
            return;
        }
        BigInteger available = collateralManager.maxAvailable(collateral.getAsset(), collateral.getManagerConfig());
        if (available.compareTo(amountOut) < 0) {
            throw new TransmuterException(TransmuterError.INVALID_SWAP,
                    "Only " + available + " of " + collateral.getAsset() + " available, " + amountOut + " requested");
        }
    }
}
