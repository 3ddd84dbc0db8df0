package com.pipemon.store;

import com.pipemon.core.LatencyMeasurement;
import com.pipemon.core.PipelineStage;
import com.pipemon.core.ThroughputMeasurement;
import com.pipemon.slo.ViolationRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/** Unbounded list-backed store. Meant for tests and short-lived tools. */
public final class InMemoryMetricsStore implements MetricsStore {
    private final List<LatencyMeasurement> latency = new CopyOnWriteArrayList<>();
    private final List<ThroughputMeasurement> throughput = new CopyOnWriteArrayList<>();
    private final List<ViolationRecord> violations = new CopyOnWriteArrayList<>();

    @Override
    public void appendLatency(List<LatencyMeasurement> measurements) {
        latency.addAll(Objects.requireNonNull(measurements, "measurements"));
    }

    @Override
    public void appendThroughput(List<ThroughputMeasurement> measurements) {
        throughput.addAll(Objects.requireNonNull(measurements, "measurements"));
    }

    @Override
    public void appendViolations(List<ViolationRecord> records) {
        violations.addAll(Objects.requireNonNull(records, "records"));
    }

    @Override
    public List<LatencyMeasurement> latencyBetween(PipelineStage stage, Instant from, Instant to) {
        List<LatencyMeasurement> out = new ArrayList<>();
        for (LatencyMeasurement m : latency) {
            if ((stage == null || m.stage() == stage) && inRange(m.startTime(), from, to)) out.add(m);
        }
        return out;
    }

    @Override
    public List<ThroughputMeasurement> throughputBetween(PipelineStage stage, Instant from, Instant to) {
        List<ThroughputMeasurement> out = new ArrayList<>();
        for (ThroughputMeasurement m : throughput) {
            if ((stage == null || m.stage() == stage) && inRange(m.timestamp(), from, to)) out.add(m);
        }
        return out;
    }

    @Override
    public List<ViolationRecord> violationsBetween(Instant from, Instant to) {
        List<ViolationRecord> out = new ArrayList<>();
        for (ViolationRecord v : violations) {
            if (inRange(v.timestamp(), from, to)) out.add(v);
        }
        return out;
    }

    public List<LatencyMeasurement> latency() { return List.copyOf(latency); }
    public List<ThroughputMeasurement> throughput() { return List.copyOf(throughput); }
    public List<ViolationRecord> violations() { return List.copyOf(violations); }

    /** True when {@code t} lies in {@code [from, to)}. */
    public static boolean inRange(Instant t, Instant from, Instant to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        return !t.isBefore(from) && t.isBefore(to);
    }
}
