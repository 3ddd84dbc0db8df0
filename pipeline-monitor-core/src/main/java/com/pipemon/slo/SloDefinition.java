package com.pipemon.slo;

import com.pipemon.core.PipelineStage;

import java.util.Objects;

/**
 * A target/warning/critical threshold triple for one metric of one stage.
 *
 * <p>Latency objectives need {@code target <= warning <= critical}; throughput objectives need
 * {@code target >= warning >= critical}.
 */
public record SloDefinition(
    String name,
    PipelineStage stage,
    MetricKind metricKind,
    double targetValue,
    double warningThreshold,
    double criticalThreshold,
    int measurementWindowMinutes,
    String description
) {
    public SloDefinition {
        name = Objects.requireNonNull(name, "name").trim();
        if (name.isEmpty()) throw new IllegalArgumentException("SLO name must not be blank");
        stage = Objects.requireNonNull(stage, "stage");
        metricKind = Objects.requireNonNull(metricKind, "metricKind");
        requireThreshold(name, "targetValue", targetValue);
        requireThreshold(name, "warningThreshold", warningThreshold);
        requireThreshold(name, "criticalThreshold", criticalThreshold);
        if (measurementWindowMinutes <= 0) {
            throw new IllegalArgumentException("SLO '" + name + "': measurementWindowMinutes must be > 0");
        }
        if (metricKind.lowerIsBetter()) {
            if (!(targetValue <= warningThreshold && warningThreshold <= criticalThreshold)) {
                throw new IllegalArgumentException("Latency SLO '" + name
                    + "' requires target <= warning <= critical, got " + targetValue + " / " + warningThreshold
                    + " / " + criticalThreshold);
            }
        } else if (!(targetValue >= warningThreshold && warningThreshold >= criticalThreshold)) {
            throw new IllegalArgumentException("Throughput SLO '" + name
                + "' requires target >= warning >= critical, got " + targetValue + " / " + warningThreshold
                + " / " + criticalThreshold);
        }
        description = (description == null) ? "" : description;
    }

    public static SloDefinition latency(String name, PipelineStage stage, double targetMs, double warningMs,
                                        double criticalMs, int windowMinutes, String description) {
        return new SloDefinition(name, stage, MetricKind.LATENCY, targetMs, warningMs, criticalMs, windowMinutes,
            description);
    }

    public static SloDefinition throughput(String name, PipelineStage stage, double targetPerSecond,
                                           double warningPerSecond, double criticalPerSecond, int windowMinutes,
                                           String description) {
        return new SloDefinition(name, stage, MetricKind.THROUGHPUT, targetPerSecond, warningPerSecond,
            criticalPerSecond, windowMinutes, description);
    }

    private static void requireThreshold(String name, String field, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new IllegalArgumentException("SLO '" + name + "': " + field + " must be a finite value >= 0, got "
                + value);
        }
    }
}
