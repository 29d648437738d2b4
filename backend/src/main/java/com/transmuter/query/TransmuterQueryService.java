package com.transmuter.query;

import com.transmuter.common.FixedPoint;
import com.transmuter.domain.ActionType;
import com.transmuter.domain.Collateral;
import com.transmuter.domain.FeeCurve;
import com.transmuter.domain.TrustType;
import com.transmuter.oracle.TransmuterOracle;
import com.transmuter.quoter.BurnPrice;
import com.transmuter.quoter.BurnPriceSelector;
import com.transmuter.state.TransmuterState;
import com.transmuter.state.TransmuterStateStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;

import static com.transmuter.common.FixedPoint.BASE_27;

/**
 * Read-only views over the ledger. Issued amounts are converted to stablecoin units with the current normalizer.
 */
@Service
@RequiredArgsConstructor
public class TransmuterQueryService {

    private final TransmuterStateStore stateStore;
    private final TransmuterOracle oracle;
    private final BurnPriceSelector burnPriceSelector;

    public IssuedStablecoins getIssuedByCollateral(String asset) {
        return stateStore.read(state -> {
            Collateral collateral = state.requireCollateral(asset);
            return new IssuedStablecoins(issued(state, collateral.getNormalizedStables()),
                    issued(state, state.normalizedStables()));
        });
    }

    public BigInteger getTotalIssued() {
        return stateStore.read(state -> issued(state, state.normalizedStables()));
    }

    public List<String> getCollateralList() {
        return stateStore.read(state -> List.copyOf(state.ledger().getCollateralList()));
    }

    public CollateralInfo getCollateralInfo(String asset) {
        return stateStore.read(state -> {
            Collateral c = state.requireCollateral(asset);
            return new CollateralInfo(c.getAsset(), c.getDecimals(), issued(state, c.getNormalizedStables()),
                    c.getNormalizedStables(), c.getMintFees(), c.getBurnFees(), c.isMintPaused(), c.isBurnPaused(),
                    c.isManaged(), c.getManagerConfig(), c.getOracleConfig(), c.getStablecoinCap());
        });
    }

    public int getCollateralDecimals(String asset) {
        return stateStore.read(state -> state.requireCollateral(asset).getDecimals());
    }

    public FeeCurve getCollateralMintFees(String asset) {
        return stateStore.read(state -> state.requireCollateral(asset).getMintFees());
    }

    public FeeCurve getCollateralBurnFees(String asset) {
        return stateStore.read(state -> state.requireCollateral(asset).getBurnFees());
    }

    public boolean isPaused(String asset, ActionType action) {
        return stateStore.read(state -> state.requireCollateral(asset).isPaused(action));
    }

    public boolean isTrusted(String address) {
        return stateStore.read(state -> state.ledger().trustSet(TrustType.TRUSTED).contains(address));
    }

    public boolean isTrustedSeller(String address) {
        return stateStore.read(state -> state.ledger().trustSet(TrustType.SELLER).contains(address));
    }

    /**
     * Mint price, burn price and the deviation a burn of {@code asset} would be scaled by.
     */
    public OracleValues getOracleValues(String asset) {
        return stateStore.read(state -> {
            Collateral collateral = state.requireCollateral(asset);
            BigInteger mint = oracle.readMint(collateral.getOracleConfig(), collateral.getOracleStorage());
            BurnPrice burn = burnPriceSelector.select(state, collateral);
            return new OracleValues(mint, burn.price(), burn.deviation());
        });
    }

    private static BigInteger issued(TransmuterState state, BigInteger normalized) {
        return FixedPoint.mulDiv(normalized, state.normalizer(), BASE_27);
    }
}
