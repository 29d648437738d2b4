package com.transmuter.admin;

import com.transmuter.common.TransmuterError;
import com.transmuter.common.TransmuterException;
import com.transmuter.integration.TokenGateway;
import com.transmuter.state.TransmuterStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Funds holders with collateral tokens and reads their balances. Stablecoins only enter circulation through
 * swaps, so they cannot be deposited.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DepositService {

    private final TransmuterStateStore stateStore;
    private final TokenGateway tokenGateway;

    /**
     * @return the holder's balance after the deposit
     */
    public BigInteger deposit(String token, String holder, BigInteger amount) {
        if (amount.signum() <= 0) {
            throw new TransmuterException(TransmuterError.INVALID_PARAMS, "Deposit must be positive: " + amount);
        }
        return stateStore.write(state -> {
            if (token.equalsIgnoreCase(state.stablecoin())) {
                throw new TransmuterException(TransmuterError.INVALID_TOKENS, "Stablecoins cannot be deposited");
            }
            tokenGateway.deposit(token, holder, amount);
            return tokenGateway.balanceOf(token, holder);
        });
    }

    public BigInteger balanceOf(String token, String holder) {
        return stateStore.read(state -> tokenGateway.balanceOf(token, holder));
    }
}
