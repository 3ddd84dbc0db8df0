package com.pipemon.core;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One timed execution of a stage. Closing the trace emits exactly one {@link LatencyMeasurement} and
 * releases its active-trace slot; later calls to {@link #close()} do nothing.
 *
 * <p>A trace counts as failed unless {@link #succeed()} was called before it closed, so an exception
 * leaving the scope is never recorded as a success.
 *
 * <pre>{@code
 * try (StageTrace trace = collector.trace(PipelineStage.ORDER_EXECUTION)) {
 *     broker.submit(order);
 *     trace.succeed();
 * }
 * }</pre>
 *
 * {@link PerformanceCollector#call} and {@link PerformanceCollector#run} mark the outcome for you.
 */
public final class StageTrace implements AutoCloseable {
    private final PerformanceCollector collector;
    private final String traceId;
    private final PipelineStage stage;
    private final Instant startTime;
    private final long startNanos;
    private final Map<String, Object> metadata;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Throwable failure;
    private volatile boolean succeeded;

    StageTrace(PerformanceCollector collector, String traceId, PipelineStage stage, Instant startTime,
               long startNanos, Map<String, Object> metadata) {
        this.collector = Objects.requireNonNull(collector, "collector");
        this.traceId = Objects.requireNonNull(traceId, "traceId");
        this.stage = Objects.requireNonNull(stage, "stage");
        this.startTime = Objects.requireNonNull(startTime, "startTime");
        this.startNanos = startNanos;
        this.metadata = metadata;
    }

    public String traceId() { return traceId; }
    public PipelineStage stage() { return stage; }
    public Instant startTime() { return startTime; }

    /** Marks this execution as successful. A prior {@link #fail(Throwable)} still wins. */
    public void succeed() {
        this.succeeded = true;
    }

    /** Marks this execution as failed; the measurement emitted on close carries {@code error}. */
    public void fail(Throwable error) {
        this.failure = Objects.requireNonNull(error, "error");
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        Throwable outcome = failure;
        if (outcome == null && !succeeded) {
            outcome = new IllegalStateException("stage " + stage.value() + " exited without succeed()");
        }
        collector.complete(this, startNanos, metadata, outcome);
    }
}
