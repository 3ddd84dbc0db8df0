package com.pipemon.metrics;

import com.pipemon.core.PipelineStage;
import com.pipemon.slo.SloHealth;
import io.micrometer.core.instrument.MeterRegistry;

/** Mirrors collector and evaluator activity into a Micrometer registry. Implementations must be thread-safe. */
public interface StageMetricsRecorder {
    void onTraceSuccess(PipelineStage stage, long nanos);
    void onTraceError(PipelineStage stage, long nanos, Throwable error);
    void onThroughput(PipelineStage stage, long itemsProcessed, long errors);
    void onViolation(String sloName, SloHealth status);
    MeterRegistry registry();
}
