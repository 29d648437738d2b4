package com.transmuter.admin;

import com.transmuter.common.FixedPoint;
import com.transmuter.common.TransmuterError;
import com.transmuter.common.TransmuterException;
import com.transmuter.domain.Collateral;
import com.transmuter.domain.TransmuterLedger;
import com.transmuter.state.TransmuterState;
import com.transmuter.state.TransmuterStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

import static com.transmuter.common.FixedPoint.BASE_18;
import static com.transmuter.common.FixedPoint.BASE_27;
import static com.transmuter.common.FixedPoint.BASE_36;

/**
 * Rebases the stablecoin supply by moving the normalizer, so that every collateral's issued amount grows or
 * shrinks pro rata without touching the normalized counters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NormalizerService {

    private final TransmuterStateStore stateStore;

    /**
     * Grows (or shrinks) the total supply by {@code amount} stablecoins. Only trusted callers may do this.
     *
     * @return the normalizer in force after the update
     */
    public BigInteger updateNormalizer(String caller, BigInteger amount, boolean increase) {
        return stateStore.write(state -> {
            if (!state.ledger().getTrusted().contains(caller)) {
                throw new TransmuterException(TransmuterError.NOT_TRUSTED, "Not trusted: " + caller);
            }
            return rebase(state, amount, increase);
        });
    }

    private static BigInteger rebase(TransmuterState state, BigInteger amount, boolean increase) {
        TransmuterLedger ledger = state.ledger();
        BigInteger total = ledger.getNormalizedStables();
        if (total.signum() == 0) {
            ledger.setNormalizer(BASE_27);
            log.info("No supply to rebase, normalizer reset to {}", BASE_27);
            return BASE_27;
        }
        BigInteger normalizer = ledger.getNormalizer();
        BigInteger change = FixedPoint.mulDiv(amount, BASE_27, total);
        BigInteger newNormalizer = increase ? FixedPoint.add(normalizer, change) : FixedPoint.sub(normalizer, change);

        if (newNormalizer.compareTo(BASE_18) <= 0 || newNormalizer.compareTo(BASE_36) >= 0) {
            // Fold the normalizer into the counters to keep its precision
            BigInteger sum = BigInteger.ZERO;
            for (Collateral collateral : state.collaterals()) {
                BigInteger rescaled = FixedPoint.mulDiv(collateral.getNormalizedStables(), newNormalizer, BASE_27);
                collateral.setNormalizedStables(FixedPoint.checkUint(rescaled, 216));
                sum = sum.add(rescaled);
            }
            ledger.setNormalizedStables(FixedPoint.checkUint(sum, 128));
            log.info("Renormalized counters: normalizer {} folded into supply {}", newNormalizer, sum);
            newNormalizer = BASE_27;
        }
        ledger.setNormalizer(newNormalizer);
        log.info("Normalizer updated by {}{} to {}", increase ? "+" : "-", amount, newNormalizer);
        return newNormalizer;
    }
}
