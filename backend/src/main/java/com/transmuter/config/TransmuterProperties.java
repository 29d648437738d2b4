package com.transmuter.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Transmuter deployment settings. Documented in application.yml under transmuter.
 */
@ConfigurationProperties(prefix = "transmuter")
@NoArgsConstructor
@Getter
@Setter
public class TransmuterProperties {

    /**
     * Identifier of the stablecoin token minted and burnt by swaps.
     */
    private String stablecoin = "agEUR";

    /**
     * Address holding collateral that is not handed to a manager.
     */
    private String reserve = "reserve";

    /** Addresses trusted to update the normalizer when the ledger is first created. */
    private List<String> trusted = new ArrayList<>();
}
