package com.flowlens.analyzer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Latency statistics over raw observations.
 */
public final class Percentiles {

    private Percentiles() {
    }

    /**
     * Nearest-rank percentile: sorts ascending and takes index {@code ceil(p/100 * n) - 1}, clamped
     * to the list bounds.
     *
     * @return the percentile value, or 0 for an empty input
     */
    public static long nearestRank(Collection<Long> values, double percentile) {
        if (values == null || values.isEmpty()) {
            return 0L;
        }
        List<Long> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int index = (int) Math.ceil(percentile / 100.0 * sorted.size()) - 1;
        index = Math.max(0, Math.min(index, sorted.size() - 1));
        return sorted.get(index);
    }

    /**
     * @return the rounded mean, or 0 when {@code count} is 0
     */
    public static long average(long total, long count) {
        return count > 0 ? Math.round((double) total / count) : 0L;
    }

    /**
     * @return {@code errors / calls}, or 0 when {@code calls} is 0
     */
    public static double rate(long errors, long calls) {
        return calls > 0 ? (double) errors / calls : 0.0;
    }
}
