package com.pipemon.store;

import com.pipemon.core.LatencyMeasurement;
import com.pipemon.core.PipelineStage;
import com.pipemon.core.ThroughputMeasurement;
import com.pipemon.slo.ViolationRecord;

import java.time.Instant;
import java.util.List;

public final class NoopMetricsStore implements MetricsStore {
    public static final NoopMetricsStore INSTANCE = new NoopMetricsStore();

    private NoopMetricsStore() {}

    @Override public void appendLatency(List<LatencyMeasurement> measurements) {}
    @Override public void appendThroughput(List<ThroughputMeasurement> measurements) {}
    @Override public void appendViolations(List<ViolationRecord> violations) {}
    @Override public List<LatencyMeasurement> latencyBetween(PipelineStage stage, Instant from, Instant to) { return List.of(); }
    @Override public List<ThroughputMeasurement> throughputBetween(PipelineStage stage, Instant from, Instant to) { return List.of(); }
    @Override public List<ViolationRecord> violationsBetween(Instant from, Instant to) { return List.of(); }
}
