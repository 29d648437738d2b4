package com.transmuter.quoter;

import com.transmuter.common.TransmuterError;
import com.transmuter.common.TransmuterException;
import com.transmuter.domain.Collateral;
import com.transmuter.oracle.PegOracle;
import com.transmuter.state.TransmuterState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.transmuter.TransmuterFixtures.ONE;
import static com.transmuter.TransmuterFixtures.collateral;
import static com.transmuter.TransmuterFixtures.ledger;
import static com.transmuter.TransmuterFixtures.peggedTo;
import static com.transmuter.TransmuterFixtures.pushedFor;
import static com.transmuter.TransmuterFixtures.spot;
import static com.transmuter.TransmuterFixtures.state;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BurnPriceSelectorTest {

    private static final BigInteger POINT_NINE = new BigInteger("900000000000000000");
    private static final BigInteger HALF = new BigInteger("500000000000000000");

    private final BurnPriceSelector selector = new BurnPriceSelector(new PegOracle());

    @Test
    @DisplayName("a correlated peer at 0.9 prices the burn at 0.9")
    void correlatedPeerDeviationApplies() {
        Collateral euroc = collateral("EUROC", 6, peggedTo("EUR"));
        Collateral eurt = collateral("EURT", 6, pushedFor("EUR"));
        eurt.setOracleStorage(spot(POINT_NINE));
        TransmuterState state = state(ledger(), euroc, eurt);

        BurnPrice price = selector.select(state, euroc);

        assertThat(price.price()).isEqualTo(ONE);
        assertThat(price.deviation()).isEqualTo(POINT_NINE);
    }

    @Test
    @DisplayName("collaterals on another peg do not move the deviation")
    void uncorrelatedPeerIgnored() {
        Collateral euroc = collateral("EUROC", 6, peggedTo("EUR"));
        Collateral usdc = collateral("USDC", 6, pushedFor("USD"));
        usdc.setOracleStorage(spot(HALF));
        TransmuterState state = state(ledger(), euroc, usdc);

        assertThat(selector.select(state, euroc)).isEqualTo(new BurnPrice(ONE, ONE));
    }

    @Test
    void ownDeviationCounts() {
        Collateral eurt = collateral("EURT", 6, pushedFor("EUR"));
        eurt.setOracleStorage(spot(POINT_NINE));
        TransmuterState state = state(ledger(), eurt);

        assertThat(selector.select(state, eurt)).isEqualTo(new BurnPrice(ONE, POINT_NINE));
    }

    @Test
    @DisplayName("a correlated peer whose feed cannot be read fails the burn")
    void failingPeerFailsClosed() {
        Collateral euroc = collateral("EUROC", 6, peggedTo("EUR"));
        Collateral eurt = collateral("EURT", 6, pushedFor("EUR"));
        TransmuterState state = state(ledger(), euroc, eurt);

        assertThatThrownBy(() -> selector.select(state, euroc))
                .isInstanceOf(TransmuterException.class)
                .satisfies(e -> assertThat(((TransmuterException) e).getError()).isEqualTo(TransmuterError.INVALID_ORACLE_VALUE));
    }
}
