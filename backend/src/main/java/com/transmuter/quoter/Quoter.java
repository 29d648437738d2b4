package com.transmuter.quoter;

import com.transmuter.common.FixedPoint;
import com.transmuter.domain.ActionType;
import com.transmuter.domain.Collateral;
import com.transmuter.domain.QuoteType;
import com.transmuter.oracle.TransmuterOracle;
import com.transmuter.state.TransmuterState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

import static com.transmuter.common.FixedPoint.BASE_18;

/**
 * Converts between collateral amounts (in the collateral's own decimals) and stablecoin amounts. Oracle
 * conversion happens on the collateral side of the fee step so that the curve always sees stablecoin values.
 * Amounts a caller has to provide round up.
 */
@Component
@RequiredArgsConstructor
public class Quoter {

    private static final int STABLECOIN_DECIMALS = 18;

    private final TransmuterOracle oracle;
    private final BurnPriceSelector burnPriceSelector;
    private final ExposureCurveEvaluator curveEvaluator;

    /**
     * Stablecoins minted for {@code amountIn} collateral.
     */
    public BigInteger quoteMintExactInput(TransmuterState state, Collateral collateral, BigInteger amountIn) {
        BigInteger price = oracle.readMint(collateral.getOracleConfig(), collateral.getOracleStorage());
        BigInteger value = FixedPoint.mulDiv(
                FixedPoint.convertDecimalTo(amountIn, collateral.getDecimals(), STABLECOIN_DECIMALS), price, BASE_18);
        return evaluate(QuoteType.MINT_EXACT_INPUT, state, collateral, value);
    }

    /**
     * Collateral needed to mint exactly {@code amountOut} stablecoins.
     */
    public BigInteger quoteMintExactOutput(TransmuterState state, Collateral collateral, BigInteger amountOut) {
        BigInteger price = oracle.readMint(collateral.getOracleConfig(), collateral.getOracleStorage());
        BigInteger value = evaluate(QuoteType.MINT_EXACT_OUTPUT, state, collateral, amountOut);
        // value * 10^decimals / price: BASE_18 price over an 18-decimal value, rounded up once
        return FixedPoint.mulDiv(value, BigInteger.TEN.pow(collateral.getDecimals()), price, FixedPoint.Rounding.UP);
    }

    /**
     * Collateral received for burning {@code amountIn} stablecoins.
     */
    public BigInteger quoteBurnExactInput(TransmuterState state, Collateral collateral, BigInteger amountIn) {
        BurnPrice burnPrice = burnPriceSelector.select(state, collateral);
        BigInteger value = evaluate(QuoteType.BURN_EXACT_INPUT, state, collateral, amountIn);
        BigInteger amountOut = FixedPoint.mulDiv(value, burnPrice.deviation(), burnPrice.price());
        return FixedPoint.convertDecimalTo(amountOut, STABLECOIN_DECIMALS, collateral.getDecimals());
    }

    /**
     * Stablecoins to burn to receive exactly {@code amountOut} collateral.
     */
    public BigInteger quoteBurnExactOutput(TransmuterState state, Collateral collateral, BigInteger amountOut) {
        BurnPrice burnPrice = burnPriceSelector.select(state, collateral);
        BigInteger scaled = FixedPoint.convertDecimalTo(amountOut, collateral.getDecimals(), STABLECOIN_DECIMALS);
        BigInteger value = FixedPoint.mulDiv(scaled, burnPrice.price(), burnPrice.deviation(), FixedPoint.Rounding.UP);
        return evaluate(QuoteType.BURN_EXACT_OUTPUT, state, collateral, value);
    }

    private BigInteger evaluate(QuoteType quoteType, TransmuterState state, Collateral collateral,
                                BigInteger amountStable) {
        ActionType action = quoteType.isMint() ? ActionType.MINT : ActionType.BURN;
        return curveEvaluator.quote(quoteType, collateral.fees(action), collateral.getNormalizedStables(),
                state.normalizedStables(), state.normalizer(), amountStable);
    }
}
