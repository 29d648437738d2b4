package com.transmuter.state;

import com.transmuter.common.FixedPoint;
import com.transmuter.domain.Collateral;
import com.transmuter.domain.CollateralRepository;
import com.transmuter.domain.TransmuterLedger;
import com.transmuter.domain.TransmuterLedgerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Serializes every access to the transmuter state. Each operation gets a freshly loaded aggregate; writes are
 * persisted only when the operation returns normally and the reserve invariant holds, so a failed operation
 * leaves nothing behind. A write runs in one transaction committed before the lock is released, so everything
 * stored during the operation, collaborators included, commits together or not at all.
 * Collaborators invoked from inside an operation must not call back into the store.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransmuterStateStore {

    private final TransmuterLedgerRepository ledgerRepository;
    private final CollateralRepository collateralRepository;
    private final TransactionOperations transactionOperations;
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Creates the ledger document on first start. No-op when it already exists.
     */
    public void initialize(String stablecoin, Collection<String> trusted) {
        locked(() -> {
            if (ledgerRepository.existsById(TransmuterLedger.SINGLETON_ID)) {
                return null;
            }
            TransmuterLedger ledger = new TransmuterLedger();
            ledger.setStablecoin(stablecoin);
            ledger.setNormalizer(FixedPoint.BASE_27);
            ledger.getTrusted().addAll(trusted);
            ledgerRepository.save(ledger);
            log.info("Ledger initialised for stablecoin {} with {} trusted addresses", stablecoin, trusted.size());
            return null;
        });
    }

    public <T> T read(Function<TransmuterState, T> operation) {
        return locked(() -> operation.apply(load()));
    }

    public <T> T write(Function<TransmuterState, T> operation) {
        return locked(() -> transactionOperations.execute(status -> {
            TransmuterState state = load();
            T result = operation.apply(state);
            state.checkReserveInvariant();
            persist(state);
            return result;
        }));
    }

    private TransmuterState load() {
        TransmuterLedger ledger = ledgerRepository.findById(TransmuterLedger.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Ledger not initialised"));
        List<String> assets = ledger.getCollateralList();
        Iterable<Collateral> collaterals = assets.isEmpty() ? List.of() : collateralRepository.findAllById(assets);
        List<Collateral> loaded = new ArrayList<>();
        collaterals.forEach(loaded::add);
        return new TransmuterState(ledger, loaded);
    }

    private void persist(TransmuterState state) {
        ledgerRepository.save(state.ledger());
        List<Collateral> collaterals = state.collaterals();
        if (!collaterals.isEmpty()) {
            collateralRepository.saveAll(collaterals);
        }
        Set<String> removed = state.removedAssets();
        if (!removed.isEmpty()) {
            collateralRepository.deleteAllById(removed);
        }
    }

    private <T> T locked(Supplier<T> body) {
        if (lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Reentrant access to transmuter state");
        }
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }
}
