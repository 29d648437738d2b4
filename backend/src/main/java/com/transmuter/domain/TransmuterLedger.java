package com.transmuter.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Global ledger: normalized stablecoin supply, the normalizer that scales it to token units, the registered
 * collateral list and the trusted address sets. A single document per deployment.
 */
@Document(collection = "ledger")
@NoArgsConstructor
@Getter
@Setter
public class TransmuterLedger {

    public static final String SINGLETON_ID = "transmuter";

    @Id
    private String id = SINGLETON_ID;
    private String stablecoin;
    private BigInteger normalizedStables = BigInteger.ZERO;
    private BigInteger normalizer;
    private List<String> collateralList = new ArrayList<>();
    private Set<String> trusted = new HashSet<>();
    private Set<String> sellerTrusted = new HashSet<>();

    public Set<String> trustSet(TrustType type) {
        return type == TrustType.TRUSTED ? trusted : sellerTrusted;
    }
}
