package com.pipemon.slo;

import com.pipemon.core.LatencyStats;
import com.pipemon.core.PerformanceCollector;
import com.pipemon.core.ThroughputStats;
import com.pipemon.metrics.StageMetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compares current collector statistics with each registered SLO. Every evaluation derives the status
 * from scratch; the only history is the {@link ViolationTracker}.
 */
public final class SloEvaluator {
    private static final Logger log = LoggerFactory.getLogger(SloEvaluator.class);

    private final SloRegistry registry;
    private final PerformanceCollector collector;
    private final ViolationTracker tracker;
    private final StageMetricsRecorder recorder;

    public SloEvaluator(SloRegistry registry, PerformanceCollector collector, ViolationTracker tracker) {
        this(registry, collector, tracker, collector.recorder());
    }

    public SloEvaluator(SloRegistry registry, PerformanceCollector collector, ViolationTracker tracker,
                        StageMetricsRecorder recorder) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.collector = Objects.requireNonNull(collector, "collector");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.recorder = Objects.requireNonNull(recorder, "recorder");
    }

    /** Evaluates every SLO and records the warning/critical results in the violation tracker. */
    public Evaluation evaluateAll() {
        List<SloStatus> statuses = new ArrayList<>(registry.size());
        List<ViolationRecord> recorded = new ArrayList<>();
        for (SloDefinition slo : registry.definitions()) {
            SloStatus status = evaluate(slo);
            statuses.add(status);
            if (status.isViolation()) {
                recorded.add(tracker.record(slo, status));
                try {
                    recorder.onViolation(slo.name(), status.status());
                } catch (RuntimeException e) {
                    log.warn("metrics recorder failed for SLO {}", slo.name(), e);
                }
            }
        }
        return new Evaluation(statuses, recorded);
    }

    /** Evaluates every SLO without touching the violation history. */
    public List<SloStatus> preview() {
        List<SloStatus> statuses = new ArrayList<>(registry.size());
        for (SloDefinition slo : registry.definitions()) {
            statuses.add(evaluate(slo));
        }
        return statuses;
    }

    /** Evaluates one SLO; never throws, degrading to {@link SloHealth#UNKNOWN} instead. */
    public SloStatus evaluate(SloDefinition slo) {
        Objects.requireNonNull(slo, "slo");
        try {
            double current;
            switch (slo.metricKind()) {
                case LATENCY -> {
                    LatencyStats stats = collector.latencyStats(slo.stage(), slo.measurementWindowMinutes());
                    if (!stats.hasData()) {
                        log.debug("SLO {}: no successful {} measurements in the last {} min",
                            slo.name(), slo.stage().value(), slo.measurementWindowMinutes());
                        return SloStatus.unknown(slo);
                    }
                    current = stats.p95Ms();
                }
                case THROUGHPUT -> {
                    ThroughputStats stats = collector.throughputStats(slo.stage(), slo.measurementWindowMinutes());
                    if (!stats.hasData()) {
                        log.debug("SLO {}: no {} throughput reports in the last {} min",
                            slo.name(), slo.stage().value(), slo.measurementWindowMinutes());
                        return SloStatus.unknown(slo);
                    }
                    current = stats.meanThroughput();
                }
                default -> throw new IllegalStateException("Unhandled metric kind: " + slo.metricKind());
            }

            return new SloStatus(
                slo.name(),
                classify(slo, current),
                current,
                slo.targetValue(),
                compliance(slo, current),
                tracker.countInLast24h(slo.name())
            );
        } catch (RuntimeException e) {
            log.error("Failed to evaluate SLO {}", slo.name(), e);
            return SloStatus.unknown(slo);
        }
    }

    /** Maps {@code current} onto the SLO's healthy / warning / critical bands. */
    public static SloHealth classify(SloDefinition slo, double current) {
        if (Double.isNaN(current)) return SloHealth.UNKNOWN;
        if (slo.metricKind().lowerIsBetter()) {
            if (current <= slo.targetValue()) return SloHealth.HEALTHY;
            if (current <= slo.warningThreshold()) return SloHealth.WARNING;
            return SloHealth.CRITICAL;
        }
        if (current >= slo.targetValue()) return SloHealth.HEALTHY;
        if (current >= slo.warningThreshold()) return SloHealth.WARNING;
        return SloHealth.CRITICAL;
    }

    /** How close {@code current} is to target, in [0,100]. */
    public static double compliance(SloDefinition slo, double current) {
        double raw;
        if (slo.metricKind().lowerIsBetter()) {
            raw = (current > 0) ? slo.targetValue() / current * 100.0 : 100.0;
        } else {
            raw = (slo.targetValue() > 0) ? current / slo.targetValue() * 100.0 : 100.0;
        }
        if (Double.isNaN(raw)) return 0.0;
        return Math.max(0.0, Math.min(100.0, raw));
    }

    public SloRegistry registry() {
        return registry;
    }

    public ViolationTracker tracker() {
        return tracker;
    }

    /** Statuses of one evaluation round and the violation records it appended. */
    public record Evaluation(List<SloStatus> statuses, List<ViolationRecord> recorded) {
        public Evaluation {
            statuses = List.copyOf(statuses);
            recorded = List.copyOf(recorded);
        }

        public List<SloStatus> violations() {
            return statuses.stream().filter(SloStatus::isViolation).toList();
        }
    }
}
