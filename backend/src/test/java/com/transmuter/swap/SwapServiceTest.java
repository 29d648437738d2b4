package com.transmuter.swap;

import com.transmuter.TransmuterFixtures;
import com.transmuter.common.FixedPoint;
import com.transmuter.common.TransmuterError;
import com.transmuter.common.TransmuterException;
import com.transmuter.domain.Collateral;
import com.transmuter.domain.FeeCurve;
import com.transmuter.domain.ManagerConfig;
import com.transmuter.domain.TransmuterLedger;
import com.transmuter.integration.BalanceBookCollateralManager;
import com.transmuter.integration.BalanceBookTokenGateway;
import com.transmuter.integration.TokenTransferException;
import com.transmuter.oracle.PegOracle;
import com.transmuter.quoter.BurnPriceSelector;
import com.transmuter.quoter.ExposureCurveEvaluator;
import com.transmuter.quoter.Quoter;
import org.assertj.core.api.ThrowableAssert;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.transmuter.TransmuterFixtures.STABLECOIN;
import static com.transmuter.TransmuterFixtures.collateral;
import static com.transmuter.TransmuterFixtures.issue;
import static com.transmuter.TransmuterFixtures.ledger;
import static com.transmuter.TransmuterFixtures.peggedTo;
import static com.transmuter.TransmuterFixtures.stables;
import static com.transmuter.TransmuterFixtures.units;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class SwapServiceTest {

    private static final String RESERVE = "reserve";
    private static final String ALICE = "0xalice";
    private static final String BOB = "0xbob";
    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");
    private static final Instant DEADLINE = NOW.plusSeconds(60);

    private TransmuterLedger ledger;
    private Collateral euroc;
    private Collateral eurt;
    private TransmuterFixtures.Repositories repositories;
    private BalanceBookTokenGateway gateway;
    private SwapService swapService;

    @BeforeEach
    void setUp() {
        ledger = ledger();
        euroc = collateral("EUROC", 6, peggedTo("EUR"));
        eurt = collateral("EURT", 6, peggedTo("EUR"));
        repositories = TransmuterFixtures.repositories(ledger, euroc, eurt);
        gateway = TransmuterFixtures.balanceBook(RESERVE);
        PegOracle oracle = new PegOracle();
        Quoter quoter = new Quoter(oracle, new BurnPriceSelector(oracle), new ExposureCurveEvaluator());
        swapService = new SwapService(
                repositories.store(),
                quoter,
                new AvailabilityGuard(new BalanceBookCollateralManager(gateway, RESERVE)),
                gateway,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("mint exact input pulls collateral, mints stablecoins and books the same delta twice")
    void mintExactInput() {
        gateway.deposit("EUROC", ALICE, units(100, 6));

        SwapResult result = swapService.swapExactInput(units(100, 6), stables(99), "EUROC", STABLECOIN,
                BOB, ALICE, DEADLINE);

        assertThat(result.amountOut()).isEqualTo(stables(100));
        assertThat(euroc.getNormalizedStables()).isEqualTo(stables(100));
        assertThat(ledger.getNormalizedStables()).isEqualTo(stables(100));
        assertThat(gateway.balanceOf(STABLECOIN, BOB)).isEqualTo(stables(100));
        assertThat(gateway.balanceOf("EUROC", RESERVE)).isEqualTo(units(100, 6));
        assertThat(gateway.balanceOf("EUROC", ALICE)).isZero();
        verify(repositories.ledgerRepository()).save(ledger);
    }

    @Test
    @DisplayName("burn exact input burns from the sender and pays collateral to the recipient")
    void burnExactInput() {
        gateway.deposit("EUROC", ALICE, units(100, 6));
        swapService.swapExactInput(units(100, 6), BigInteger.ZERO, "EUROC", STABLECOIN, BOB, ALICE, DEADLINE);

        SwapResult result = swapService.swapExactInput(stables(40), units(40, 6), STABLECOIN, "EUROC",
                ALICE, BOB, DEADLINE);

        assertThat(result.amountOut()).isEqualTo(units(40, 6));
        assertThat(euroc.getNormalizedStables()).isEqualTo(stables(60));
        assertThat(ledger.getNormalizedStables()).isEqualTo(stables(60));
        assertThat(gateway.balanceOf(STABLECOIN, BOB)).isEqualTo(stables(60));
        assertThat(gateway.balanceOf("EUROC", ALICE)).isEqualTo(units(40, 6));
    }

    @Test
    void mintExactOutput() {
        gateway.deposit("EUROC", ALICE, units(100, 6));

        SwapResult result = swapService.swapExactOutput(stables(50), units(50, 6), "EUROC", STABLECOIN,
                BOB, ALICE, DEADLINE);

        assertThat(result.amountIn()).isEqualTo(units(50, 6));
        assertThat(gateway.balanceOf("EUROC", ALICE)).isEqualTo(units(50, 6));
        assertThat(ledger.getNormalizedStables()).isEqualTo(stables(50));
    }

    @Test
    @DisplayName("output below the minimum rejects the swap before anything moves")
    void tooSmallAmountOut() {
        gateway.deposit("EUROC", ALICE, units(100, 6));

        assertError(() -> swapService.swapExactInput(units(100, 6), stables(101), "EUROC", STABLECOIN,
                BOB, ALICE, DEADLINE), TransmuterError.TOO_SMALL_AMOUNT_OUT);

        assertThat(ledger.getNormalizedStables()).isZero();
        assertThat(gateway.balanceOf("EUROC", ALICE)).isEqualTo(units(100, 6));
        verify(repositories.ledgerRepository(), never()).save(any());
    }

    @Test
    void tooBigAmountIn() {
        gateway.deposit("EUROC", ALICE, units(100, 6));

        assertError(() -> swapService.swapExactOutput(stables(50), units(49, 6), "EUROC", STABLECOIN,
                BOB, ALICE, DEADLINE), TransmuterError.TOO_BIG_AMOUNT_IN);
    }

    @Test
    void deadlinePassed() {
        assertError(() -> swapService.swapExactInput(units(1, 6), BigInteger.ZERO, "EUROC", STABLECOIN,
                BOB, ALICE, NOW.minusSeconds(1)), TransmuterError.TOO_LATE);
    }

    @Test
    void pausedDirection() {
        euroc.setMintPaused(true);

        assertError(() -> swapService.swapExactInput(units(1, 6), BigInteger.ZERO, "EUROC", STABLECOIN,
                BOB, ALICE, DEADLINE), TransmuterError.PAUSED);
        assertError(() -> swapService.quoteIn(units(1, 6), "EUROC", STABLECOIN), TransmuterError.PAUSED);
    }

    @Test
    @DisplayName("exactly one side of the pair must be the stablecoin")
    void invalidTokens() {
        assertError(() -> swapService.quoteIn(units(1, 6), "EUROC", "EURT"), TransmuterError.INVALID_TOKENS);
        assertError(() -> swapService.quoteIn(stables(1), STABLECOIN, STABLECOIN), TransmuterError.INVALID_TOKENS);
    }

    @Test
    void unknownCollateral() {
        assertError(() -> swapService.quoteIn(units(1, 6), "DAI", STABLECOIN), TransmuterError.NOT_COLLATERAL);
    }

    @Test
    @DisplayName("stablecoin cap blocks mints that would exceed it")
    void stablecoinCap() {
        euroc.setStablecoinCap(stables(50));
        gateway.deposit("EUROC", ALICE, units(100, 6));

        assertError(() -> swapService.swapExactInput(units(100, 6), BigInteger.ZERO, "EUROC", STABLECOIN,
                BOB, ALICE, DEADLINE), TransmuterError.INVALID_SWAP);

        swapService.swapExactInput(units(50, 6), BigInteger.ZERO, "EUROC", STABLECOIN, BOB, ALICE, DEADLINE);
        assertThat(ledger.getNormalizedStables()).isEqualTo(stables(50));
    }

    @Test
    @DisplayName("managed collateral cannot pay out more than its manager holds")
    void availabilityGuard() {
        euroc.setManaged(true);
        euroc.setManagerConfig(new ManagerConfig("0xvault", "lending"));
        gateway.deposit("EUROC", ALICE, units(100, 6));
        swapService.swapExactInput(units(100, 6), BigInteger.ZERO, "EUROC", STABLECOIN, BOB, ALICE, DEADLINE);
        assertThat(gateway.balanceOf("EUROC", "0xvault")).isEqualTo(units(100, 6));
        // 70 deployed to a strategy, 30 left idle
        gateway.transfer("EUROC", "0xvault", "0xstrategy", units(70, 6));

        assertError(() -> swapService.quoteIn(stables(40), STABLECOIN, "EUROC"), TransmuterError.INVALID_SWAP);
        assertError(() -> swapService.swapExactOutput(units(40, 6), stables(100), STABLECOIN, "EUROC",
                ALICE, BOB, DEADLINE), TransmuterError.INVALID_SWAP);

        SwapResult result = swapService.swapExactInput(stables(20), BigInteger.ZERO, STABLECOIN, "EUROC",
                ALICE, BOB, DEADLINE);
        assertThat(result.amountOut()).isEqualTo(units(20, 6));
        assertThat(gateway.balanceOf("EUROC", "0xvault")).isEqualTo(units(10, 6));
    }

    @Test
    @DisplayName("a failed token movement leaves nothing persisted")
    void failedTransferNotPersisted() {
        assertThatThrownBy(() -> swapService.swapExactInput(units(10, 6), BigInteger.ZERO, "EUROC", STABLECOIN,
                BOB, ALICE, DEADLINE))
                .isInstanceOf(TokenTransferException.class);

        assertThat(ledger.getNormalizedStables()).isZero();
        assertThat(euroc.getNormalizedStables()).isZero();
        verify(repositories.ledgerRepository(), never()).save(any());
    }

    @Test
    @DisplayName("a burn the reserve cannot pay out keeps the sender's stablecoins")
    void failedPayoutKeepsStablecoins() {
        issue(ledger, euroc, stables(100));
        gateway.mint(ALICE, stables(50));

        assertThatThrownBy(() -> swapService.swapExactInput(stables(50), BigInteger.ZERO, STABLECOIN, "EUROC",
                ALICE, ALICE, DEADLINE))
                .isInstanceOf(TokenTransferException.class)
                .hasMessageContaining("held for payouts");

        assertThat(gateway.balanceOf(STABLECOIN, ALICE)).isEqualTo(stables(50));
        assertThat(gateway.balanceOf("EUROC", ALICE)).isZero();
        assertThat(euroc.getNormalizedStables()).isEqualTo(stables(100));
        assertThat(ledger.getNormalizedStables()).isEqualTo(stables(100));
        verify(repositories.ledgerRepository(), never()).save(any());
    }

    @Test
    @DisplayName("a burn larger than the sender's stablecoin balance pays nothing out")
    void burnBeyondBalanceRejected() {
        gateway.deposit("EUROC", ALICE, units(100, 6));
        swapService.swapExactInput(units(100, 6), BigInteger.ZERO, "EUROC", STABLECOIN, BOB, ALICE, DEADLINE);

        assertThatThrownBy(() -> swapService.swapExactOutput(units(70, 6), stables(1_000), STABLECOIN, "EUROC",
                ALICE, ALICE, DEADLINE))
                .isInstanceOf(TokenTransferException.class)
                .hasMessageContaining("Insufficient " + STABLECOIN);

        assertThat(gateway.balanceOf("EUROC", RESERVE)).isEqualTo(units(100, 6));
        assertThat(gateway.balanceOf("EUROC", ALICE)).isZero();
        assertThat(ledger.getNormalizedStables()).isEqualTo(stables(100));
    }

    @Test
    @DisplayName("collateral counters sum to the global counter after every settlement")
    void sumInvariantOverSequence() {
        ledger.setNormalizer(FixedPoint.BASE_27.multiply(BigInteger.valueOf(3)).divide(BigInteger.TWO));
        euroc.setMintFees(FeeCurve.of(new long[]{0, 400_000_000, 700_000_000}, new long[]{1_000_000, 4_000_000, 30_000_000}));
        eurt.setBurnFees(FeeCurve.of(new long[]{1_000_000_000, 300_000_000}, new long[]{2_000_000, 15_000_000}));
        gateway.deposit("EUROC", ALICE, units(1_000, 6));
        gateway.deposit("EURT", ALICE, units(1_000, 6));

        swapService.swapExactInput(units(300, 6), BigInteger.ZERO, "EUROC", STABLECOIN, ALICE, ALICE, DEADLINE);
        assertSumInvariant();
        swapService.swapExactInput(units(500, 6), BigInteger.ZERO, "EURT", STABLECOIN, ALICE, ALICE, DEADLINE);
        assertSumInvariant();
        swapService.swapExactOutput(stables(123), units(1_000, 6), "EUROC", STABLECOIN, ALICE, ALICE, DEADLINE);
        assertSumInvariant();
        swapService.swapExactInput(stables(77), BigInteger.ZERO, STABLECOIN, "EURT", ALICE, ALICE, DEADLINE);
        assertSumInvariant();
        swapService.swapExactOutput(units(100, 6), stables(1_000), STABLECOIN, "EUROC", ALICE, ALICE, DEADLINE);
        assertSumInvariant();

        assertThat(ledger.getNormalizedStables()).isPositive();
    }

    private void assertSumInvariant() {
        assertThat(euroc.getNormalizedStables().add(eurt.getNormalizedStables()))
                .isEqualTo(ledger.getNormalizedStables());
    }

    private static void assertError(ThrowableAssert.ThrowingCallable call, TransmuterError error) {
        assertThatThrownBy(call)
                .isInstanceOf(TransmuterException.class)
                .satisfies(e -> assertThat(((TransmuterException) e).getError()).isEqualTo(error));
    }
}
