package com.transmuter.quoter;

import com.transmuter.domain.Collateral;
import com.transmuter.oracle.BurnReading;
import com.transmuter.oracle.TransmuterOracle;
import com.transmuter.state.TransmuterState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

import static com.transmuter.common.FixedPoint.BASE_18;

/**
 * Prices a burn with the lowest deviation found among every registered collateral reading the same oracle
 * configuration, so a depeg on one correlated asset cannot be arbitraged out through another. Readings are
 * taken fresh on each call; a peer whose read fails fails the whole burn.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BurnPriceSelector {

    private final TransmuterOracle oracle;

    public BurnPrice select(TransmuterState state, Collateral collateral) {
        BurnReading own = oracle.readBurn(collateral.getOracleConfig(), collateral.getOracleStorage());
        BigInteger minDeviation = BASE_18.min(own.deviation());
        String configHash = collateral.getOracleConfig().configHash();
        for (Collateral peer : state.collaterals()) {
            if (peer.getAsset().equals(collateral.getAsset()) || peer.getOracleConfig() == null
                    || !configHash.equals(peer.getOracleConfig().configHash())) {
                continue;
            }
            BurnReading reading = oracle.readBurn(peer.getOracleConfig(), peer.getOracleStorage());
            minDeviation = minDeviation.min(reading.deviation());
        }
        log.debug("Burn price for {}: price={}, deviation={}", collateral.getAsset(), own.price(), minDeviation);
        return new BurnPrice(own.price(), minDeviation);
    }
}
