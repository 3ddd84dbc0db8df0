package com.pipemon.core;

/**
 * Latency summary over the successful measurements of one window. {@link #empty()} stands for a window
 * without any successful measurement.
 */
public record LatencyStats(
    int count,
    double meanMs,
    double medianMs,
    double p95Ms,
    double p99Ms,
    double minMs,
    double maxMs,
    double successRate
) {
    private static final LatencyStats EMPTY = new LatencyStats(0, 0, 0, 0, 0, 0, 0, 0);

    public LatencyStats {
        if (count < 0) throw new IllegalArgumentException("count must be >= 0");
    }

    public static LatencyStats empty() {
        return EMPTY;
    }

    public boolean hasData() {
        return count > 0;
    }
}
