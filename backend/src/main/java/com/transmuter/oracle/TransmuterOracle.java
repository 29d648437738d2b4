package com.transmuter.oracle;

import com.transmuter.domain.OracleConfig;
import com.transmuter.domain.OracleStorage;

import java.math.BigInteger;

/**
 * Price feed contract consumed by the quoter. Prices are BASE_18 stablecoins per whole collateral unit.
 */
public interface TransmuterOracle {

    /**
     * Price used to value collateral coming in on a mint.
     */
    BigInteger readMint(OracleConfig config, OracleStorage storage);

    /**
     * Price used on a burn, with the BASE_18 deviation of the feed from its peg (BASE_18 = on peg).
     */
    BurnReading readBurn(OracleConfig config, OracleStorage storage);
}
