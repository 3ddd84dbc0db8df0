package com.pipemon.core;

public record ThroughputStats(
    int count,
    double meanThroughput,
    double maxThroughput,
    long totalItems,
    long totalErrors,
    double errorRate
) {
    private static final ThroughputStats EMPTY = new ThroughputStats(0, 0, 0, 0, 0, 0);

    public ThroughputStats {
        if (count < 0) throw new IllegalArgumentException("count must be >= 0");
    }

    public static ThroughputStats empty() {
        return EMPTY;
    }

    public boolean hasData() {
        return count > 0;
    }
}
