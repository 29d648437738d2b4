package com.transmuter.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;

/**
 * Registered collateral asset. {@code decimals == 0} marks an unregistered asset.
 * Invariant held by the ledger: the sum of {@code normalizedStables} over all collaterals equals
 * {@link TransmuterLedger#getNormalizedStables()}.
 */
@Document(collection = "collaterals")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Collateral {

    @Id
    @EqualsAndHashCode.Include
    private String asset;
    private int decimals;
    private BigInteger normalizedStables = BigInteger.ZERO;
    private OracleConfig oracleConfig;
    private OracleStorage oracleStorage;
    private FeeCurve mintFees = FeeCurve.empty();
    private FeeCurve burnFees = FeeCurve.empty();
    private boolean mintPaused = true;
    private boolean burnPaused = true;
    private boolean managed;
    private ManagerConfig managerConfig;
    /** Cap on stablecoins issued against this collateral; zero when uncapped. */
    private BigInteger stablecoinCap = BigInteger.ZERO;

    public Collateral(String asset, int decimals) {
        this.asset = asset;
        this.decimals = decimals;
    }

    public boolean isRegistered() {
        return decimals > 0;
    }

    public FeeCurve fees(ActionType action) {
        return action == ActionType.MINT ? mintFees : burnFees;
    }

    public boolean isPaused(ActionType action) {
        return action == ActionType.MINT ? mintPaused : burnPaused;
    }
}
