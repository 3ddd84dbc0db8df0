package com.pipemon.core;

import java.time.Instant;
import java.util.Objects;

public record ThroughputMeasurement(
    PipelineStage stage,
    Instant timestamp,
    long itemsProcessed,
    int windowSeconds,
    double throughputPerSecond,
    long errors
) {
    public ThroughputMeasurement {
        stage = Objects.requireNonNull(stage, "stage");
        timestamp = Objects.requireNonNull(timestamp, "timestamp");
        if (itemsProcessed < 0) throw new IllegalArgumentException("itemsProcessed must be >= 0");
        if (windowSeconds <= 0) throw new IllegalArgumentException("windowSeconds must be > 0");
        if (errors < 0) throw new IllegalArgumentException("errors must be >= 0");
    }

    /** Builds a measurement whose rate is derived from {@code itemsProcessed / windowSeconds}. */
    public static ThroughputMeasurement of(PipelineStage stage, Instant timestamp, long itemsProcessed,
                                           int windowSeconds, long errors) {
        if (windowSeconds <= 0) throw new IllegalArgumentException("windowSeconds must be > 0");
        return new ThroughputMeasurement(stage, timestamp, itemsProcessed, windowSeconds,
            (double) itemsProcessed / windowSeconds, errors);
    }
}
