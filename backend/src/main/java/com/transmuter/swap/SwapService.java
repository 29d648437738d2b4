package com.transmuter.swap;

import com.transmuter.common.FixedPoint;
import com.transmuter.common.TransmuterError;
import com.transmuter.common.TransmuterException;
import com.transmuter.domain.ActionType;
import com.transmuter.domain.Collateral;
import com.transmuter.domain.TransmuterLedger;
import com.transmuter.integration.TokenGateway;
import com.transmuter.integration.TokenTransferException;
import com.transmuter.quoter.Quoter;
import com.transmuter.state.TransmuterState;
import com.transmuter.state.TransmuterStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.function.Function;

import static com.transmuter.common.FixedPoint.BASE_27;

/**
 * Mints stablecoins against collateral and redeems them for collateral. Every check (deadline, pair, pause,
 * slippage, availability, cap, balances) runs before the counters or any token move; counters and token
 * movements are committed together by the state store, or not at all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SwapService {

    private final TransmuterStateStore stateStore;
    private final Quoter quoter;
    private final AvailabilityGuard availabilityGuard;
    private final TokenGateway tokenGateway;
    private final Clock clock;

    /**
     * Swaps exactly {@code amountIn} of {@code tokenIn}; fails with TOO_SMALL_AMOUNT_OUT when the output is
     * below {@code amountOutMin}.
     */
    public SwapResult swapExactInput(BigInteger amountIn, BigInteger amountOutMin, String tokenIn, String tokenOut,
                                     String to, String sender, Instant deadline) {
        return settle(tokenIn, tokenOut, deadline, state -> {
            Pair pair = resolve(state, tokenIn, tokenOut);
            BigInteger amountOut = quoteIn(state, pair, amountIn);
            if (amountOut.compareTo(amountOutMin) < 0) {
                throw new TransmuterException(TransmuterError.TOO_SMALL_AMOUNT_OUT,
                        "Output " + amountOut + " below minimum " + amountOutMin);
            }
            apply(state, pair, amountIn, amountOut, to, sender);
            return new SwapResult(tokenIn, tokenOut, amountIn, amountOut);
        });
    }

    /**
     * Swaps for exactly {@code amountOut} of {@code tokenOut}; fails with TOO_BIG_AMOUNT_IN when the required
     * input exceeds {@code amountInMax}.
     */
    public SwapResult swapExactOutput(BigInteger amountOut, BigInteger amountInMax, String tokenIn, String tokenOut,
                                      String to, String sender, Instant deadline) {
        return settle(tokenIn, tokenOut, deadline, state -> {
            Pair pair = resolve(state, tokenIn, tokenOut);
            BigInteger amountIn = quoteOut(state, pair, amountOut);
            if (amountIn.compareTo(amountInMax) > 0) {
                throw new TransmuterException(TransmuterError.TOO_BIG_AMOUNT_IN,
                        "Input " + amountIn + " above maximum " + amountInMax);
            }
            apply(state, pair, amountIn, amountOut, to, sender);
            return new SwapResult(tokenIn, tokenOut, amountIn, amountOut);
        });
    }

    /**
     * Output of swapping {@code amountIn}, without settling.
     */
    public BigInteger quoteIn(BigInteger amountIn, String tokenIn, String tokenOut) {
        return stateStore.read(state -> quoteIn(state, resolve(state, tokenIn, tokenOut), amountIn));
    }

    /**
     * Input needed to receive {@code amountOut}, without settling.
     */
    public BigInteger quoteOut(BigInteger amountOut, String tokenIn, String tokenOut) {
        return stateStore.read(state -> quoteOut(state, resolve(state, tokenIn, tokenOut), amountOut));
    }

    private SwapResult settle(String tokenIn, String tokenOut, Instant deadline,
                              Function<TransmuterState, SwapResult> settlement) {
        if (Instant.now(clock).isAfter(deadline)) {
            log.warn("Rejected swap {} -> {}: deadline {} passed", tokenIn, tokenOut, deadline);
            throw new TransmuterException(TransmuterError.TOO_LATE, "Deadline passed: " + deadline);
        }
        try {
            SwapResult result = stateStore.write(settlement);
            log.info("Settled swap {} {} -> {} {}", result.amountIn(), tokenIn, result.amountOut(), tokenOut);
            return result;
        } catch (TransmuterException e) {
            log.warn("Rejected swap {} -> {}: {} {}", tokenIn, tokenOut, e.getError(), e.getMessage());
            throw e;
        }
    }

    private BigInteger quoteIn(TransmuterState state, Pair pair, BigInteger amountIn) {
        if (pair.mint()) {
            return quoter.quoteMintExactInput(state, pair.collateral(), amountIn);
        }
        BigInteger amountOut = quoter.quoteBurnExactInput(state, pair.collateral(), amountIn);
        availabilityGuard.checkAvailable(pair.collateral(), amountOut);
        return amountOut;
    }

    private BigInteger quoteOut(TransmuterState state, Pair pair, BigInteger amountOut) {
        if (pair.mint()) {
            return quoter.quoteMintExactOutput(state, pair.collateral(), amountOut);
        }
        availabilityGuard.checkAvailable(pair.collateral(), amountOut);
        return quoter.quoteBurnExactOutput(state, pair.collateral(), amountOut);
    }

    private Pair resolve(TransmuterState state, String tokenIn, String tokenOut) {
        String stablecoin = state.stablecoin();
        boolean mint = stablecoin.equals(tokenOut);
        boolean burn = stablecoin.equals(tokenIn);
        if (mint == burn) {
            throw new TransmuterException(TransmuterError.INVALID_TOKENS,
                    "Exactly one side must be " + stablecoin + ": " + tokenIn + " -> " + tokenOut);
        }
        Collateral collateral = state.requireCollateral(mint ? tokenIn : tokenOut);
        ActionType action = mint ? ActionType.MINT : ActionType.BURN;
        if (collateral.isPaused(action)) {
            throw new TransmuterException(TransmuterError.PAUSED, action + " paused for " + collateral.getAsset());
        }
        return new Pair(collateral, mint);
    }

    private void apply(TransmuterState state, Pair pair, BigInteger amountIn, BigInteger amountOut,
                       String to, String sender) {
        Collateral collateral = pair.collateral();
        TransmuterLedger ledger = state.ledger();
        BigInteger normalizer = state.normalizer();
        String managerTarget = collateral.isManaged() && collateral.getManagerConfig() != null
                ? collateral.getManagerConfig().target()
                : null;

        // Every debit is checked before the first token moves
        if (pair.mint()) {
            BigInteger delta = FixedPoint.checkUint(
                    FixedPoint.mulDiv(amountOut, BASE_27, normalizer, FixedPoint.Rounding.UP), 128);
            BigInteger collateralStables = FixedPoint.checkUint(
                    FixedPoint.add(collateral.getNormalizedStables(), delta), 216);
            checkCap(collateral, collateralStables, normalizer);
            BigInteger totalStables = FixedPoint.checkUint(FixedPoint.add(ledger.getNormalizedStables(), delta), 128);
            requireBalance(collateral.getAsset(), sender, amountIn);
            collateral.setNormalizedStables(collateralStables);
            ledger.setNormalizedStables(totalStables);
            tokenGateway.transferCollateral(collateral.getAsset(), managerTarget, sender, amountIn, true);
            tokenGateway.mint(to, amountOut);
        } else {
            BigInteger delta = FixedPoint.mulDiv(amountIn, BASE_27, normalizer);
            BigInteger collateralStables = FixedPoint.sub(collateral.getNormalizedStables(), delta);
            BigInteger totalStables = FixedPoint.sub(ledger.getNormalizedStables(), delta);
            requireBalance(state.stablecoin(), sender, amountIn);
            BigInteger held = tokenGateway.collateralHeld(collateral.getAsset(), managerTarget);
            if (held.compareTo(amountOut) < 0) {
                throw new TokenTransferException("Only " + held + " of " + collateral.getAsset()
                        + " held for payouts, " + amountOut + " due");
            }
            collateral.setNormalizedStables(collateralStables);
            ledger.setNormalizedStables(totalStables);
            tokenGateway.burnSelf(amountIn, sender);
            tokenGateway.transferCollateral(collateral.getAsset(), managerTarget, to, amountOut, false);
        }
    }

    private void requireBalance(String token, String holder, BigInteger amount) {
        BigInteger balance = tokenGateway.balanceOf(token, holder);
        if (balance.compareTo(amount) < 0) {
            throw new TokenTransferException("Insufficient " + token + " balance for " + holder
                    + ": " + balance + " < " + amount);
        }
    }

    private static void checkCap(Collateral collateral, BigInteger normalizedAfter, BigInteger normalizer) {
        BigInteger cap = collateral.getStablecoinCap();
        if (cap == null || cap.signum() == 0) {
            return;
        }
        BigInteger issuedAfter = FixedPoint.mulDiv(normalizedAfter, normalizer, BASE_27);
        if (issuedAfter.compareTo(cap) > 0) {
            throw new TransmuterException(TransmuterError.INVALID_SWAP,
                    "Stablecoin cap " + cap + " reached for " + collateral.getAsset());
        }
    }

    private record Pair(Collateral collateral, boolean mint) {
    }
}
