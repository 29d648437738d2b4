package com.transmuter.quoter;

import com.transmuter.common.FeeMath;
import com.transmuter.common.FixedPoint;
import com.transmuter.domain.FeeCurve;
import com.transmuter.domain.QuoteType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

import static com.transmuter.common.FixedPoint.BASE_27;
import static com.transmuter.common.FixedPoint.BASE_9;
import static com.transmuter.common.FixedPoint.BASE_9_LONG;

/**
 * Integrates a collateral's piecewise-linear fee curve over the amount being swapped.
 * <p>
 * The fee at the current exposure is interpolated linearly between the two breakpoints around it. From there to
 * the next breakpoint the fee is taken as linear in the stablecoins swapped, so the fee paid over a span is the
 * average of the fees at its ends. The walk consumes whole segments while the requested amount exceeds their
 * capacity and settles the remainder at the blended fee of the sub-span it actually covers. A segment ending at
 * 100% exposure cannot be exhausted: the remainder is charged the average of the current fee and the fee at the
 * exposure reached after the swap. Mint curves are read with increasing exposures, burn curves with decreasing
 * ones; both are walked in index order.
 * <p>
 * Blended fees round up, in favour of the reserves.
 * <p>
 * All amounts are stablecoin-side amounts at 18 decimals; the result is the counter-amount, also in stablecoin
 * units: the output for exact-input quotes, the input for exact-output quotes.
 */
@Component
@Slf4j
public class ExposureCurveEvaluator {

    /**
     * @param quoteType              direction and fixed side of the swap
     * @param curve                  the collateral's mint curve for mints, burn curve for burns
     * @param collateralNormalized   normalized stablecoins issued against the collateral
     * @param totalNormalized        normalized stablecoins issued against all collaterals
     * @param normalizer             BASE_27 normalizer
     * @param amountStable           requested amount
     */
    public BigInteger quote(QuoteType quoteType, FeeCurve curve, BigInteger collateralNormalized,
                            BigInteger totalNormalized, BigInteger normalizer, BigInteger amountStable) {
        if (curve.isEmpty()) {
            throw new IllegalStateException("Fee curve not configured");
        }
        if (amountStable.signum() == 0) {
            return BigInteger.ZERO;
        }
        int n = curve.size();
        // Nothing issued yet, or a flat curve: the first fee applies to the whole amount
        if (totalNormalized.signum() == 0 || n == 1) {
            return computeFee(quoteType, amountStable, curve.fee(0));
        }

        boolean isMint = quoteType.isMint();
        boolean isExact = quoteType.isStablecoinDenominated();

        long currentExposure = collateralNormalized.multiply(BASE_9).divide(totalNormalized).longValueExact();
        BigInteger stablecoinsIssued = FixedPoint.mulDiv(collateralNormalized, normalizer, BASE_27);
        BigInteger otherStablecoinSupply = FixedPoint.sub(
                FixedPoint.mulDiv(totalNormalized, normalizer, BASE_27), stablecoinsIssued);

        BigInteger amount = BigInteger.ZERO;
        int i = curve.findLowerBound(isMint, currentExposure);

        while (i < n - 1) {
            long lowerExposure = curve.exposure(i);
            long upperExposure = curve.exposure(i + 1);
            long lowerFee = curve.fee(i);
            long upperFee = curve.fee(i + 1);

            long currentFee;
            if (lowerExposure == currentExposure || lowerFee == upperFee) {
                currentFee = lowerFee;
            } else {
                currentFee = interpolate(lowerExposure, upperExposure, lowerFee, upperFee, currentExposure);
            }

            if (isMint && upperExposure >= BASE_9_LONG) {
                long midFee = openSegmentFee(isExact, amountStable, stablecoinsIssued, otherStablecoinSupply,
                        lowerExposure, upperExposure, lowerFee, upperFee, currentFee);
                log.debug("Open segment {} settles the rest of the swap at blended fee {}", i, midFee);
                return amount.add(computeFee(quoteType, amountStable, midFee));
            }

            // Stablecoins to issue (mint) or redeem (burn) for the exposure to reach the upper breakpoint
            BigInteger atUpper = issuedAtExposure(otherStablecoinSupply, upperExposure);
            BigInteger amountToNextBreakPoint = isMint
                    ? FixedPoint.subOrZero(atUpper, stablecoinsIssued)
                    : FixedPoint.subOrZero(stablecoinsIssued, atUpper);
            long segmentFee = ceilHalf(upperFee + currentFee);

            BigInteger capacity = isExact
                    ? amountToNextBreakPoint
                    : collateralValueOf(isMint, amountToNextBreakPoint, segmentFee);

            if (capacity.compareTo(amountStable) >= 0) {
                long midFee = isExact
                        ? stablecoinMidFee(currentFee, upperFee, amountStable, capacity)
                        : collateralMidFee(isMint, currentFee, upperFee, amountStable, amountToNextBreakPoint);
                log.debug("Segment {} covers the rest of the swap at blended fee {}", i, midFee);
                return amount.add(computeFee(quoteType, amountStable, midFee));
            }

            amountStable = amountStable.subtract(capacity);
            amount = amount.add(isExact ? computeFee(quoteType, amountToNextBreakPoint, segmentFee) : amountToNextBreakPoint);
            stablecoinsIssued = isMint
                    ? stablecoinsIssued.add(amountToNextBreakPoint)
                    : FixedPoint.sub(stablecoinsIssued, amountToNextBreakPoint);
            currentExposure = upperExposure;
            ++i;
        }
        // Exposure went past the last breakpoint: flat fee from there on
        return amount.add(computeFee(quoteType, amountStable, curve.fee(n - 1)));
    }

    /**
     * Applies or inverts {@code fee} on {@code amount} according to the quote type.
     */
    public static BigInteger computeFee(QuoteType quoteType, BigInteger amount, long fee) {
        return switch (quoteType) {
            case MINT_EXACT_INPUT -> FeeMath.applyFeeMint(amount, fee);
            case MINT_EXACT_OUTPUT -> FeeMath.invertFeeMint(amount, fee);
            case BURN_EXACT_INPUT -> FeeMath.applyFee(amount, fee);
            case BURN_EXACT_OUTPUT -> FeeMath.invertFee(amount, fee);
        };
    }

    /**
     * Collateral value exchanged for {@code stablecoins} at {@code fee}: paid in on a mint, received on a burn.
     */
    private static BigInteger collateralValueOf(boolean isMint, BigInteger stablecoins, long fee) {
        return isMint ? FeeMath.invertFeeMint(stablecoins, fee) : FeeMath.applyFee(stablecoins, fee);
    }

    /**
     * Stablecoins issued against a collateral when its exposure is {@code exposure} and the other collaterals
     * back {@code otherSupply}: {@code other * x / (1 - x)}.
     */
    private static BigInteger issuedAtExposure(BigInteger otherSupply, long exposure) {
        return FixedPoint.mulDiv(otherSupply, BigInteger.valueOf(exposure), BigInteger.valueOf(BASE_9_LONG - exposure));
    }

    /**
     * Blended fee over a mint that stays inside a segment ending at 100% exposure. The stablecoins minted are
     * taken at face value for exact-output quotes; for exact-input quotes they are bounded from above by
     * pricing the whole value at the current fee, which can only overstate the exposure reached.
     */
    private static long openSegmentFee(boolean isExact, BigInteger amountStable, BigInteger stablecoinsIssued,
                                       BigInteger otherStablecoinSupply, long lowerExposure, long upperExposure,
                                       long lowerFee, long upperFee, long currentFee) {
        BigInteger minted = isExact ? amountStable : FeeMath.applyFeeMint(amountStable, currentFee);
        BigInteger issuedAfter = stablecoinsIssued.add(minted);
        long exposureAfter = FixedPoint.mulDiv(issuedAfter, BASE_9, issuedAfter.add(otherStablecoinSupply),
                FixedPoint.Rounding.UP).longValueExact();
        long feeAfter = interpolate(lowerExposure, upperExposure, lowerFee, upperFee,
                Math.min(exposureAfter, upperExposure));
        return ceilHalf(currentFee + feeAfter);
    }

    /** {@code ceil(sum / 2)}, also for negative sums. */
    private static long ceilHalf(long sum) {
        return Math.floorDiv(sum + 1, 2);
    }

    private static long interpolate(long lowerExposure, long upperExposure, long lowerFee, long upperFee,
                                    long currentExposure) {
        BigInteger travelled = BigInteger.valueOf(Math.abs(currentExposure - lowerExposure));
        BigInteger width = BigInteger.valueOf(Math.abs(upperExposure - lowerExposure));
        BigInteger feeSpan = BigInteger.valueOf(upperFee - lowerFee);
        return lowerFee + feeSpan.multiply(travelled).divide(width).longValueExact();
    }

    /**
     * Average fee over the first {@code amount} stablecoins of a segment holding {@code capacity} stablecoins:
     * {@code g0 + (f - g0) * amount / (2 * capacity)}, rounded up.
     */
    private static long stablecoinMidFee(long currentFee, long upperFee, BigInteger amount, BigInteger capacity) {
        BigInteger increment = FixedPoint.mulDiv(BigInteger.valueOf(upperFee - currentFee), amount,
                capacity.shiftLeft(1), FixedPoint.Rounding.UP);
        return currentFee + increment.longValueExact();
    }

    /**
     * Average fee when the requested amount is a collateral value: the stablecoin span {@code m} it buys solves
     * {@code amount = m * (1 ± (g0 + (f - g0) * m / (2b)))}, whose fee root is taken in closed form.
     */
    private static long collateralMidFee(boolean isMint, long currentFee, long upperFee, BigInteger amount,
                                         BigInteger amountToNextBreakPoint) {
        BigInteger current = BigInteger.valueOf(currentFee);
        BigInteger ac4 = FixedPoint.mulDiv(BASE_9,
                amount.shiftLeft(1).multiply(BigInteger.valueOf(upperFee - currentFee)),
                amountToNextBreakPoint, FixedPoint.Rounding.UP);
        if (isMint) {
            BigInteger basePlusCurrent = BASE_9.add(current);
            BigInteger root = FixedPoint.sqrt(basePlusCurrent.multiply(basePlusCurrent).add(ac4), FixedPoint.Rounding.UP);
            return ceilHalf(root.add(current).subtract(BASE_9).longValueExact());
        }
        BigInteger baseMinusCurrent = BASE_9.subtract(current);
        BigInteger squared = baseMinusCurrent.multiply(baseMinusCurrent);
        if (squared.compareTo(ac4) < 0) {
            // Only reachable through rounding: the root is taken as zero
            return ceilHalf(BASE_9.add(current).longValueExact());
        }
        BigInteger root = FixedPoint.sqrt(squared.subtract(ac4), FixedPoint.Rounding.DOWN);
        return ceilHalf(BASE_9.add(current).subtract(root).longValueExact());
    }
}
