package com.pipemon.metrics;

import com.pipemon.core.PipelineStage;
import com.pipemon.slo.SloHealth;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

public final class SimpleStageMetricsRecorder implements StageMetricsRecorder {
    private final MeterRegistry registry;

    public SimpleStageMetricsRecorder() {
        this(new SimpleMeterRegistry());
    }

    public SimpleStageMetricsRecorder(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public void onTraceSuccess(PipelineStage stage, long nanos) {
        Timer.builder(stageMetric(stage, "latency"))
                .tag("outcome", "success")
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void onTraceError(PipelineStage stage, long nanos, Throwable error) {
        Timer.builder(stageMetric(stage, "latency"))
                .tag("outcome", "error")
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
        Counter.builder(stageMetric(stage, "errors")).register(registry).increment();
    }

    @Override
    public void onThroughput(PipelineStage stage, long itemsProcessed, long errors) {
        Counter.builder(stageMetric(stage, "items")).register(registry).increment(itemsProcessed);
        if (errors > 0) {
            Counter.builder(stageMetric(stage, "item_errors")).register(registry).increment(errors);
        }
    }

    @Override
    public void onViolation(String sloName, SloHealth status) {
        Counter.builder("pipemon.slo." + sloName + ".violations")
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    private static String stageMetric(PipelineStage stage, String name) {
        return "pipemon.stage." + stage.value() + "." + name;
    }
}
