package com.transmuter.admin;

import com.transmuter.common.FixedPoint;
import com.transmuter.common.TransmuterError;
import com.transmuter.common.TransmuterException;
import com.transmuter.domain.ActionType;
import com.transmuter.domain.Collateral;
import com.transmuter.domain.FeeCurve;
import com.transmuter.domain.ManagerConfig;
import com.transmuter.domain.OracleConfig;
import com.transmuter.domain.OracleStorage;
import com.transmuter.domain.TransmuterLedger;
import com.transmuter.domain.TrustType;
import com.transmuter.integration.CollateralManager;
import com.transmuter.state.TransmuterStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.Set;

import static com.transmuter.common.FixedPoint.BASE_27;

/**
 * Governance operations on the collateral set. Callers are assumed to be authorized upstream.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CollateralAdminService {

    private final TransmuterStateStore stateStore;
    private final FeeCurveValidator feeCurveValidator;
    private final CollateralManager collateralManager;
    private final Clock clock;

    /**
     * Registers {@code asset}. It starts paused in both directions, with no fee curve.
     */
    public Collateral addCollateral(String asset, int decimals, OracleConfig oracleConfig) {
        if (decimals <= 0) {
            throw new TransmuterException(TransmuterError.INVALID_PARAMS, "Collateral decimals must be positive");
        }
        return stateStore.write(state -> {
            if (state.findCollateral(asset).isPresent()) {
                throw new TransmuterException(TransmuterError.ALREADY_ADDED, "Collateral already added: " + asset);
            }
            Collateral collateral = new Collateral(asset, decimals);
            collateral.setOracleConfig(oracleConfig);
            state.register(collateral);
            log.info("Added collateral {} with {} decimals", asset, decimals);
            return collateral;
        });
    }

    /**
     * Removes {@code asset} once nothing is issued against it. Managed reserves are pulled back first.
     */
    public void revokeCollateral(String asset) {
        stateStore.write(state -> {
            Collateral collateral = state.requireCollateral(asset);
            if (collateral.getNormalizedStables().signum() != 0) {
                throw new TransmuterException(TransmuterError.COLLATERAL_BACKED,
                        "Stablecoins still issued against " + asset);
            }
            if (collateral.isManaged()) {
                collateralManager.pullAll(asset, collateral.getManagerConfig());
            }
            state.remove(asset);
            log.info("Revoked collateral {}", asset);
            return null;
        });
    }

    public void setFees(String asset, ActionType action, FeeCurve curve) {
        feeCurveValidator.validate(action, curve);
        stateStore.write(state -> {
            Collateral collateral = state.requireCollateral(asset);
            feeCurveValidator.checkNegativeFees(action, curve, state.collaterals());
            if (action == ActionType.MINT) {
                collateral.setMintFees(curve);
            } else {
                collateral.setBurnFees(curve);
            }
            log.info("Set {} fees for {}: x={}, y={}", action, asset, curve.exposures(), curve.fees());
            return null;
        });
    }

    /**
     * Flips the pause flag of one direction and returns the new value. Unpausing requires a fee curve.
     */
    public boolean togglePause(String asset, ActionType action) {
        return stateStore.write(state -> {
            Collateral collateral = state.requireCollateral(asset);
            boolean paused = !collateral.isPaused(action);
            if (!paused && collateral.fees(action).isEmpty()) {
                throw new TransmuterException(TransmuterError.INVALID_PARAMS,
                        "Cannot unpause " + action + " for " + asset + " without fees");
            }
            if (action == ActionType.MINT) {
                collateral.setMintPaused(paused);
            } else {
                collateral.setBurnPaused(paused);
            }
            log.info("{} {} for {}", paused ? "Paused" : "Unpaused", action, asset);
            return paused;
        });
    }

    /**
     * Books {@code amount} stablecoins as issued (or no longer issued) against {@code asset} without a swap.
     */
    public void adjustStablecoins(String asset, BigInteger amount, boolean increase) {
        stateStore.write(state -> {
            Collateral collateral = state.requireCollateral(asset);
            TransmuterLedger ledger = state.ledger();
            BigInteger delta = FixedPoint.mulDiv(amount, BASE_27, state.normalizer());
            if (increase) {
                collateral.setNormalizedStables(FixedPoint.checkUint(
                        FixedPoint.add(collateral.getNormalizedStables(), delta), 216));
                ledger.setNormalizedStables(FixedPoint.checkUint(
                        FixedPoint.add(ledger.getNormalizedStables(), delta), 128));
            } else {
                collateral.setNormalizedStables(FixedPoint.sub(collateral.getNormalizedStables(), delta));
                ledger.setNormalizedStables(FixedPoint.sub(ledger.getNormalizedStables(), delta));
            }
            log.info("Adjusted stablecoins of {} by {}{}", asset, increase ? "+" : "-", amount);
            return null;
        });
    }

    /**
     * Zero lifts the cap.
     */
    public void setStablecoinCap(String asset, BigInteger cap) {
        stateStore.write(state -> {
            state.requireCollateral(asset).setStablecoinCap(cap);
            log.info("Set stablecoin cap of {} to {}", asset, cap);
            return null;
        });
    }

    /**
     * Attaches {@code config} as the manager of {@code asset}, or detaches the current one when null. The
     * previous manager's funds are pulled back to the reserve.
     */
    public void setCollateralManager(String asset, ManagerConfig config) {
        stateStore.write(state -> {
            Collateral collateral = state.requireCollateral(asset);
            if (collateral.isManaged()) {
                collateralManager.pullAll(asset, collateral.getManagerConfig());
            }
            collateral.setManaged(config != null);
            collateral.setManagerConfig(config);
            log.info("Set manager of {} to {}", asset, config);
            return null;
        });
    }

    public void setOracle(String asset, OracleConfig oracleConfig) {
        stateStore.write(state -> {
            state.requireCollateral(asset).setOracleConfig(oracleConfig);
            log.info("Set oracle of {} to {}", asset, oracleConfig);
            return null;
        });
    }

    /**
     * Records a spot price for collaterals read through {@code PUSHED} oracles.
     */
    public OracleStorage pushOraclePrice(String asset, BigInteger spotPrice) {
        if (spotPrice == null || spotPrice.signum() <= 0) {
            throw new TransmuterException(TransmuterError.INVALID_ORACLE_VALUE, "Spot price must be positive");
        }
        return stateStore.write(state -> {
            OracleStorage storage = new OracleStorage(spotPrice, Instant.now(clock));
            state.requireCollateral(asset).setOracleStorage(storage);
            log.debug("Pushed price {} for {}", spotPrice, asset);
            return storage;
        });
    }

    /**
     * Adds or removes {@code address} from the given trust set; returns whether it is trusted afterwards.
     */
    public boolean toggleTrusted(String address, TrustType type) {
        return stateStore.write(state -> {
            Set<String> trustSet = state.ledger().trustSet(type);
            boolean trusted = !trustSet.contains(address);
            if (trusted) {
                trustSet.add(address);
            } else {
                trustSet.remove(address);
            }
            log.info("{} {} as {}", trusted ? "Trusted" : "Untrusted", address, type);
            return trusted;
        });
    }
}
