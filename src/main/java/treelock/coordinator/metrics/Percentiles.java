package treelock.coordinator.metrics;

import java.util.Arrays;

/**
 * Nearest-rank percentiles: the value at 1-based rank {@code ceil(p/100 * n)}
 * of the sorted sample. Over the durations 1..100 this yields exactly
 * p50=50, p95=95 and p99=99.
 */
public final class Percentiles {

    private Percentiles() {
    }

    public static long percentile(long[] sorted, double p) {
        if (sorted.length == 0) {
            return 0;
        }
        if (p <= 0) {
            return sorted[0];
        }
        int rank = (int) Math.ceil(p / 100.0 * sorted.length);
        int index = Math.min(sorted.length, Math.max(1, rank)) - 1;
        return sorted[index];
    }

    public static LatencyStats stats(long[] durations) {
        if (durations.length == 0) {
            return LatencyStats.EMPTY;
        }
        long[] sorted = durations.clone();
        Arrays.sort(sorted);
        return new LatencyStats(
                sorted.length,
                percentile(sorted, 50),
                percentile(sorted, 95),
                percentile(sorted, 99),
                sorted[sorted.length - 1]);
    }
}
