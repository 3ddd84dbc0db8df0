package com.pipemon.metrics;

import com.pipemon.core.PipelineStage;
import com.pipemon.slo.SloHealth;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public final class NoopStageMetricsRecorder implements StageMetricsRecorder {
    public static final NoopStageMetricsRecorder INSTANCE = new NoopStageMetricsRecorder();

    private final MeterRegistry emptyRegistry = new SimpleMeterRegistry();

    private NoopStageMetricsRecorder() {}

    @Override public void onTraceSuccess(PipelineStage stage, long nanos) {}
    @Override public void onTraceError(PipelineStage stage, long nanos, Throwable error) {}
    @Override public void onThroughput(PipelineStage stage, long itemsProcessed, long errors) {}
    @Override public void onViolation(String sloName, SloHealth status) {}
    @Override public MeterRegistry registry() { return emptyRegistry; }
}
