package com.transmuter.state;

import com.transmuter.common.TransmuterError;
import com.transmuter.common.TransmuterException;
import com.transmuter.domain.Collateral;
import com.transmuter.domain.TransmuterLedger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The ledger and its collateral records as one aggregate. Handed by exclusive reference to a single operation
 * by {@link TransmuterStateStore}; never shared between operations.
 */
public class TransmuterState {

    private final TransmuterLedger ledger;
    private final Map<String, Collateral> collaterals = new LinkedHashMap<>();
    private final Set<String> removed = new HashSet<>();

    public TransmuterState(TransmuterLedger ledger, Collection<Collateral> collaterals) {
        this.ledger = ledger;
        for (Collateral collateral : collaterals) {
            this.collaterals.put(collateral.getAsset(), collateral);
        }
    }

    public TransmuterLedger ledger() {
        return ledger;
    }

    public String stablecoin() {
        return ledger.getStablecoin();
    }

    public BigInteger normalizer() {
        return ledger.getNormalizer();
    }

    public BigInteger normalizedStables() {
        return ledger.getNormalizedStables();
    }

    public Optional<Collateral> findCollateral(String asset) {
        return Optional.ofNullable(collaterals.get(asset)).filter(Collateral::isRegistered);
    }

    public Collateral requireCollateral(String asset) {
        return findCollateral(asset)
                .orElseThrow(() -> new TransmuterException(TransmuterError.NOT_COLLATERAL, "Not a collateral: " + asset));
    }

    /**
     * Registered collaterals in registration-list order.
     */
    public List<Collateral> collaterals() {
        List<Collateral> ordered = new ArrayList<>();
        for (String asset : ledger.getCollateralList()) {
            Collateral collateral = collaterals.get(asset);
            if (collateral != null) {
                ordered.add(collateral);
            }
        }
        return ordered;
    }

    public void register(Collateral collateral) {
        collaterals.put(collateral.getAsset(), collateral);
        ledger.getCollateralList().add(collateral.getAsset());
        removed.remove(collateral.getAsset());
    }

    /**
     * Drops the collateral record and removes it from the list by moving the last entry into its slot.
     */
    public void remove(String asset) {
        List<String> list = ledger.getCollateralList();
        int index = list.indexOf(asset);
        if (index >= 0) {
            int last = list.size() - 1;
            list.set(index, list.get(last));
            list.remove(last);
        }
        collaterals.remove(asset);
        removed.add(asset);
    }

    Set<String> removedAssets() {
        return removed;
    }

    /**
     * Fails when the per-collateral normalized balances no longer add up to the global counter.
     */
    public void checkReserveInvariant() {
        BigInteger sum = BigInteger.ZERO;
        for (Collateral collateral : collaterals()) {
            sum = sum.add(collateral.getNormalizedStables());
        }
        if (sum.compareTo(ledger.getNormalizedStables()) != 0) {
            throw new IllegalStateException("Reserve invariant broken: collaterals sum to " + sum
                    + " but ledger holds " + ledger.getNormalizedStables());
        }
    }
}
