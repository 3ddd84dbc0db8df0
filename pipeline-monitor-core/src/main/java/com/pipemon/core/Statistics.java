package com.pipemon.core;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * Window statistics over measurement snapshots. Pure functions: callers copy the buffer first and
 * compute here without holding any lock.
 */
public final class Statistics {
    private Statistics() {}

    /**
     * Latency statistics over the measurements that started at or after {@code cutoff}.
     * Only successful durations feed the distribution; the success rate is successes over every
     * in-window measurement.
     */
    public static LatencyStats latency(Collection<LatencyMeasurement> snapshot, Instant cutoff) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(cutoff, "cutoff");

        double[] durations = new double[snapshot.size()];
        int successes = 0;
        int inWindow = 0;
        for (LatencyMeasurement m : snapshot) {
            if (m.startTime().isBefore(cutoff)) continue;
            inWindow++;
            if (m.success()) durations[successes++] = m.durationMs();
        }
        if (successes == 0) return LatencyStats.empty();

        double[] sorted = Arrays.copyOf(durations, successes);
        Arrays.sort(sorted);

        double sum = 0.0;
        for (double d : sorted) sum += d;

        return new LatencyStats(
            successes,
            sum / successes,
            median(sorted),
            percentile(sorted, 95),
            percentile(sorted, 99),
            sorted[0],
            sorted[successes - 1],
            (double) successes / inWindow
        );
    }

    /** Throughput statistics over the measurements stamped at or after {@code cutoff}. */
    public static ThroughputStats throughput(Collection<ThroughputMeasurement> snapshot, Instant cutoff) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(cutoff, "cutoff");

        int count = 0;
        double rateSum = 0.0;
        double maxRate = 0.0;
        long totalItems = 0;
        long totalErrors = 0;
        for (ThroughputMeasurement m : snapshot) {
            if (m.timestamp().isBefore(cutoff)) continue;
            double rate = m.throughputPerSecond();
            maxRate = (count == 0) ? rate : Math.max(maxRate, rate);
            rateSum += rate;
            totalItems += m.itemsProcessed();
            totalErrors += m.errors();
            count++;
        }
        if (count == 0) return ThroughputStats.empty();

        double errorRate = (totalItems > 0) ? (double) totalErrors / totalItems : 0.0;
        return new ThroughputStats(count, rateSum / count, maxRate, totalItems, totalErrors, errorRate);
    }

    /**
     * Nearest-rank percentile over ascending {@code sorted} values: {@code sorted[floor(n * p / 100)]},
     * clamped to the last index. Returns 0 for an empty array.
     */
    public static double percentile(double[] sorted, double percentile) {
        Objects.requireNonNull(sorted, "sorted");
        if (percentile < 0 || percentile > 100) throw new IllegalArgumentException("percentile must be in [0,100]");
        if (sorted.length == 0) return 0.0;
        int index = (int) Math.floor(sorted.length * percentile / 100.0);
        return sorted[Math.min(index, sorted.length - 1)];
    }

    /** Middle value of ascending {@code sorted}, or the mean of the two middle values for even lengths. */
    public static double median(double[] sorted) {
        Objects.requireNonNull(sorted, "sorted");
        int n = sorted.length;
        if (n == 0) return 0.0;
        int mid = n / 2;
        return (n % 2 == 1) ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
}
