package com.transmuter.integration;

import com.transmuter.domain.ManagerConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Manager whose idle liquidity is whatever its target address holds in the balance book.
 */
@RequiredArgsConstructor
@Slf4j
public class BalanceBookCollateralManager implements CollateralManager {

    private final BalanceBookTokenGateway tokenGateway;
    private final String reserve;

    @Override
    public BigInteger maxAvailable(String asset, ManagerConfig config) {
        return tokenGateway.balanceOf(asset, config.target());
    }

    @Override
    public void pullAll(String asset, ManagerConfig config) {
        BigInteger balance = tokenGateway.balanceOf(asset, config.target());
        if (balance.signum() > 0) {
            tokenGateway.transfer(asset, config.target(), reserve, balance);
        }
        log.info("Pulled {} of {} back from manager {}", balance, asset, config.target());
    }
}
