package com.pipemon.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record LatencyMeasurement(
    PipelineStage stage,
    Instant startTime,
    Instant endTime,
    double durationMs,
    boolean success,
    String errorMessage,
    Map<String, Object> metadata
) {
    public LatencyMeasurement {
        stage = Objects.requireNonNull(stage, "stage");
        startTime = Objects.requireNonNull(startTime, "startTime");
        endTime = Objects.requireNonNull(endTime, "endTime");
        if (durationMs < 0 || Double.isNaN(durationMs)) {
            throw new IllegalArgumentException("durationMs must be >= 0");
        }
        metadata = (metadata == null || metadata.isEmpty())
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static LatencyMeasurement succeeded(PipelineStage stage, Instant startTime, Instant endTime, double durationMs) {
        return new LatencyMeasurement(stage, startTime, endTime, durationMs, true, null, Map.of());
    }

    public static LatencyMeasurement failed(PipelineStage stage, Instant startTime, Instant endTime, double durationMs,
                                            String errorMessage) {
        return new LatencyMeasurement(stage, startTime, endTime, durationMs, false, errorMessage, Map.of());
    }
}
