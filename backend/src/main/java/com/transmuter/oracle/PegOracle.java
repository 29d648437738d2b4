package com.transmuter.oracle;

import com.transmuter.common.FixedPoint;
import com.transmuter.common.TransmuterError;
import com.transmuter.common.TransmuterException;
import com.transmuter.domain.OracleConfig;
import com.transmuter.domain.OracleStorage;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

import static com.transmuter.common.FixedPoint.BASE_18;

/**
 * Values collateral against its peg target. Mints never pay more than the target; burns are priced at the
 * target and report how far below it the spot sits, which the burn-price selector uses to scale redemptions.
 */
@Component
public class PegOracle implements TransmuterOracle {

    @Override
    public BigInteger readMint(OracleConfig config, OracleStorage storage) {
        BigInteger target = target(config);
        return FixedPoint.min(spot(config, storage, target), target);
    }

    @Override
    public BurnReading readBurn(OracleConfig config, OracleStorage storage) {
        BigInteger target = target(config);
        BigInteger spot = spot(config, storage, target);
        if (spot.compareTo(target) < 0) {
            return new BurnReading(target, FixedPoint.mulDiv(spot, BASE_18, target));
        }
        return new BurnReading(spot, BASE_18);
    }

    private static BigInteger target(OracleConfig config) {
        if (config == null || config.targetPrice() == null || config.targetPrice().signum() <= 0) {
            throw new TransmuterException(TransmuterError.INVALID_ORACLE_VALUE, "Oracle target not configured");
        }
        return config.targetPrice();
    }

    private static BigInteger spot(OracleConfig config, OracleStorage storage, BigInteger target) {
        return switch (config.readType()) {
            case NO_ORACLE -> target;
            case PUSHED -> {
                if (storage == null || storage.spotPrice() == null || storage.spotPrice().signum() <= 0) {
                    throw new TransmuterException(TransmuterError.INVALID_ORACLE_VALUE, "No spot price pushed");
                }
                yield storage.spotPrice();
            }
        };
    }
}
