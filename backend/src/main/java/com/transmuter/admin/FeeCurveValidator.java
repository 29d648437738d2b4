package com.transmuter.admin;

import com.transmuter.common.TransmuterError;
import com.transmuter.common.TransmuterException;
import com.transmuter.domain.ActionType;
import com.transmuter.domain.Collateral;
import com.transmuter.domain.FeeCurve;
import org.springframework.stereotype.Component;

import java.util.Collection;

import static com.transmuter.common.FixedPoint.BASE_9_LONG;

/**
 * Checks a fee curve before it is stored. Mint curves start at exposure 0 and increase strictly below 100%;
 * burn curves start at 100% and decrease strictly. Fees never decrease along the curve. Mint fees may reach
 * 1000x (treated as infinite by the quoter); burn fees stay below 100%.
 */
@Component
public class FeeCurveValidator {

    private static final long MAX_MINT_FEE = 1_000_000_000_000L;

    public void validate(ActionType action, FeeCurve curve) {
        int n = curve.size();
        if (n == 0 || n != curve.fees().size()) {
            throw invalid("Fee curve needs as many fees as exposures, and at least one");
        }
        boolean mint = action == ActionType.MINT;
        if (mint ? curve.exposure(0) != 0 : curve.exposure(0) != BASE_9_LONG) {
            throw invalid(action + " curve must start at exposure " + (mint ? 0 : BASE_9_LONG));
        }
        if (mint && curve.exposure(n - 1) >= BASE_9_LONG) {
            throw invalid("Mint curve exposures must stay below " + BASE_9_LONG);
        }
        checkFeeBounds(mint, curve.fee(0));
        for (int i = 0; i < n - 1; i++) {
            long x = curve.exposure(i);
            long next = curve.exposure(i + 1);
            if (mint ? x >= next : x <= next) {
                throw invalid(action + " curve exposures must be strictly " + (mint ? "increasing" : "decreasing"));
            }
            if (curve.fee(i) > curve.fee(i + 1)) {
                throw invalid("Fees must be non-decreasing along the curve");
            }
            checkFeeBounds(mint, curve.fee(i + 1));
        }
    }

    /**
     * A rebate on one side must be covered by the fee on the opposite side of every collateral, otherwise a
     * mint followed by a burn would extract value.
     */
    public void checkNegativeFees(ActionType action, FeeCurve curve, Collection<Collateral> collaterals) {
        long firstFee = curve.fee(0);
        if (firstFee >= 0) {
            return;
        }
        ActionType opposite = action == ActionType.MINT ? ActionType.BURN : ActionType.MINT;
        for (Collateral collateral : collaterals) {
            FeeCurve other = collateral.fees(opposite);
            if (!other.isEmpty() && firstFee + other.fee(0) < 0) {
                throw new TransmuterException(TransmuterError.INVALID_NEGATIVE_FEES,
                        "First " + action + " fee " + firstFee + " not covered by " + opposite + " fee "
                                + other.fee(0) + " of " + collateral.getAsset());
            }
        }
    }

    private static void checkFeeBounds(boolean mint, long fee) {
        if (fee <= -BASE_9_LONG || (mint ? fee > MAX_MINT_FEE : fee >= BASE_9_LONG)) {
            throw invalid("Fee out of bounds: " + fee);
        }
    }

    private static TransmuterException invalid(String message) {
        return new TransmuterException(TransmuterError.INVALID_PARAMS, message);
    }
}
