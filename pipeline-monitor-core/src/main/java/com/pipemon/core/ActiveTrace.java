package com.pipemon.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** An in-flight traced stage execution that has not closed yet. */
public record ActiveTrace(
    String traceId,
    PipelineStage stage,
    Instant startTime,
    Map<String, Object> metadata
) {
    public ActiveTrace {
        traceId = Objects.requireNonNull(traceId, "traceId");
        stage = Objects.requireNonNull(stage, "stage");
        startTime = Objects.requireNonNull(startTime, "startTime");
        metadata = (metadata == null || metadata.isEmpty())
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
