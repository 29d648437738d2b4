package com.transmuter.domain;

import java.util.Arrays;
import java.util.List;

/**
 * Piecewise-linear fee curve. {@code exposures} are BASE_9 exposure breakpoints (increasing for mint curves,
 * decreasing for burn curves), {@code fees} the signed BASE_9 fee at each breakpoint, non-decreasing along
 * the index order.
 */
public record FeeCurve(List<Long> exposures, List<Long> fees) {

    private static final FeeCurve EMPTY = new FeeCurve(List.of(), List.of());

    public FeeCurve {
        exposures = exposures == null ? List.of() : List.copyOf(exposures);
        fees = fees == null ? List.of() : List.copyOf(fees);
    }

    public static FeeCurve empty() {
        return EMPTY;
    }

    public static FeeCurve of(long[] exposures, long[] fees) {
        return new FeeCurve(
                Arrays.stream(exposures).boxed().toList(),
                Arrays.stream(fees).boxed().toList());
    }

    public int size() {
        return exposures.size();
    }

    public boolean isEmpty() {
        return exposures.isEmpty();
    }

    public long exposure(int i) {
        return exposures.get(i);
    }

    public long fee(int i) {
        return fees.get(i);
    }

    /**
     * Index of the segment holding {@code exposure}: the greatest {@code i} with {@code exposures[i] <= exposure}
     * on increasing curves ({@code >=} on decreasing ones), clamped to the last breakpoint. Index 0 is never
     * searched past, the curve conventions guarantee it bounds every exposure.
     */
    public int findLowerBound(boolean increasing, long exposure) {
        int n = exposures.size();
        if (n == 0) {
            return 0;
        }
        long last = exposures.get(n - 1);
        if ((increasing && last <= exposure) || (!increasing && last >= exposure)) {
            return n - 1;
        }
        int low = 1;
        int high = n;
        while (low < high) {
            int mid = (low + high) >>> 1;
            long value = exposures.get(mid);
            if (increasing ? value > exposure : value < exposure) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low - 1;
    }
}
