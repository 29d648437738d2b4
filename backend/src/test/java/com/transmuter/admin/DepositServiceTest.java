package com.transmuter.admin;

import com.transmuter.TransmuterFixtures;
import com.transmuter.common.TransmuterError;
import com.transmuter.common.TransmuterException;
import com.transmuter.integration.BalanceBookTokenGateway;
import org.assertj.core.api.ThrowableAssert;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.transmuter.TransmuterFixtures.STABLECOIN;
import static com.transmuter.TransmuterFixtures.collateral;
import static com.transmuter.TransmuterFixtures.ledger;
import static com.transmuter.TransmuterFixtures.peggedTo;
import static com.transmuter.TransmuterFixtures.units;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DepositServiceTest {

    private BalanceBookTokenGateway gateway;
    private DepositService depositService;

    @BeforeEach
    void setUp() {
        TransmuterFixtures.Repositories repositories =
                TransmuterFixtures.repositories(ledger(), collateral("EUROC", 6, peggedTo("EUR")));
        gateway = TransmuterFixtures.balanceBook("reserve");
        depositService = new DepositService(repositories.store(), gateway);
    }

    @Test
    @DisplayName("deposits accumulate on the holder's balance")
    void depositsAccumulate() {
        assertThat(depositService.deposit("EUROC", "0xalice", units(100, 6))).isEqualTo(units(100, 6));
        assertThat(depositService.deposit("EUROC", "0xalice", units(25, 6))).isEqualTo(units(125, 6));

        assertThat(depositService.balanceOf("EUROC", "0xalice")).isEqualTo(units(125, 6));
        assertThat(depositService.balanceOf("EUROC", "0xbob")).isZero();
    }

    @Test
    @DisplayName("stablecoins only enter circulation through swaps")
    void stablecoinRejected() {
        assertError(() -> depositService.deposit(STABLECOIN, "0xalice", BigInteger.ONE), TransmuterError.INVALID_TOKENS);
        assertError(() -> depositService.deposit("ageur", "0xalice", BigInteger.ONE), TransmuterError.INVALID_TOKENS);

        assertThat(gateway.balanceOf(STABLECOIN, "0xalice")).isZero();
    }

    @Test
    void nonPositiveAmountRejected() {
        assertError(() -> depositService.deposit("EUROC", "0xalice", BigInteger.ZERO), TransmuterError.INVALID_PARAMS);
        assertError(() -> depositService.deposit("EUROC", "0xalice", BigInteger.valueOf(-1)),
                TransmuterError.INVALID_PARAMS);
    }

    private static void assertError(ThrowableAssert.ThrowingCallable call, TransmuterError error) {
        assertThatThrownBy(call)
                .isInstanceOf(TransmuterException.class)
                .satisfies(e -> assertThat(((TransmuterException) e).getError()).isEqualTo(error));
    }
}
