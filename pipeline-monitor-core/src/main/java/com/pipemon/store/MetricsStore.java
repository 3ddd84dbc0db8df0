package com.pipemon.store;

import com.pipemon.core.LatencyMeasurement;
import com.pipemon.core.PipelineStage;
import com.pipemon.core.ThroughputMeasurement;
import com.pipemon.slo.ViolationRecord;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * Durable home for measurements and violations beyond the in-memory window. The monitor only appends and
 * treats every failure as non-fatal; queries serve historical lookups by time range.
 */
public interface MetricsStore {
    void appendLatency(List<LatencyMeasurement> measurements) throws IOException;
    void appendThroughput(List<ThroughputMeasurement> measurements) throws IOException;
    void appendViolations(List<ViolationRecord> violations) throws IOException;

    /** Latency measurements of {@code stage} (all stages when null) that started in {@code [from, to)}. */
    List<LatencyMeasurement> latencyBetween(PipelineStage stage, Instant from, Instant to) throws IOException;

    List<ThroughputMeasurement> throughputBetween(PipelineStage stage, Instant from, Instant to) throws IOException;

    List<ViolationRecord> violationsBetween(Instant from, Instant to) throws IOException;
}
