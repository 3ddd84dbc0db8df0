package com.pipemon.core;

import com.pipemon.metrics.NoopStageMetricsRecorder;
import com.pipemon.metrics.StageMetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Captures stage latency and throughput from any number of producer threads into bounded per-stage
 * buffers and answers windowed statistics queries.
 *
 * <p>A single lock guards every buffer and the active-trace registry. It is held for buffer bookkeeping
 * only; statistics run on copies taken under the lock.
 */
public final class PerformanceCollector {
    private static final Logger log = LoggerFactory.getLogger(PerformanceCollector.class);

    public static final int DEFAULT_LATENCY_CAPACITY = 10_000;
    public static final int DEFAULT_THROUGHPUT_CAPACITY = 1_000;
    public static final int DEFAULT_THROUGHPUT_WINDOW_SECONDS = 60;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<PipelineStage, StageBuffer<LatencyMeasurement>> latency = new EnumMap<>(PipelineStage.class);
    private final Map<PipelineStage, StageBuffer<ThroughputMeasurement>> throughput = new EnumMap<>(PipelineStage.class);
    private final Map<String, ActiveTrace> activeTraces = new LinkedHashMap<>();

    private final Clock clock;
    private final LongSupplier nanoClock;
    private final StageMetricsRecorder recorder;
    private final AtomicLong traceSequence = new AtomicLong();

    public PerformanceCollector() {
        this(DEFAULT_LATENCY_CAPACITY, DEFAULT_THROUGHPUT_CAPACITY, Clock.systemUTC(), System::nanoTime,
            NoopStageMetricsRecorder.INSTANCE);
    }

    public PerformanceCollector(int latencyCapacity, int throughputCapacity, Clock clock, LongSupplier nanoClock,
                                StageMetricsRecorder recorder) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        for (PipelineStage stage : PipelineStage.values()) {
            latency.put(stage, new StageBuffer<>(latencyCapacity));
            throughput.put(stage, new StageBuffer<>(throughputCapacity));
        }
    }

    public StageTrace trace(PipelineStage stage) {
        return trace(stage, null, null);
    }

    public StageTrace trace(PipelineStage stage, String traceId) {
        return trace(stage, traceId, null);
    }

    /**
     * Opens a trace scope for {@code stage}. A null {@code traceId} is replaced by
     * {@code <stage>_<nanos>_<sequence>}; an id already in flight gets a {@code _<sequence>} suffix. The
     * scope records a failure unless {@link StageTrace#succeed()} is called before it closes.
     */
    public StageTrace trace(PipelineStage stage, String traceId, Map<String, Object> metadata) {
        Objects.requireNonNull(stage, "stage");
        String id = (traceId == null || traceId.isBlank()) ? nextTraceId(stage) : traceId;
        Instant startTime = clock.instant();
        long startNanos = nanoClock.getAsLong();

        ActiveTrace active;
        lock.lock();
        try {
            // an id still in flight gets a sequence suffix so neither trace loses its slot
            while (activeTraces.containsKey(id)) {
                id = id + "_" + traceSequence.incrementAndGet();
            }
            active = new ActiveTrace(id, stage, startTime, metadata);
            activeTraces.put(id, active);
        } finally {
            lock.unlock();
        }
        return new StageTrace(this, id, stage, startTime, startNanos, active.metadata());
    }

    /** Runs {@code work} inside a trace of {@code stage}; whatever it throws is rethrown unchanged. */
    public <T> T call(PipelineStage stage, ThrowingCallable<T> work) throws Exception {
        return call(stage, null, null, work);
    }

    public <T> T call(PipelineStage stage, String traceId, Map<String, Object> metadata, ThrowingCallable<T> work)
        throws Exception {
        Objects.requireNonNull(work, "work");
        try (StageTrace trace = trace(stage, traceId, metadata)) {
            try {
                T result = work.call();
                trace.succeed();
                return result;
            } catch (Exception | Error e) {
                trace.fail(e);
                throw e;
            }
        }
    }

    public void run(PipelineStage stage, ThrowingRunnable work) throws Exception {
        Objects.requireNonNull(work, "work");
        call(stage, null, null, () -> {
            work.run();
            return null;
        });
    }

    void complete(StageTrace trace, long startNanos, Map<String, Object> metadata, Throwable failure) {
        long elapsedNanos = Math.max(0L, nanoClock.getAsLong() - startNanos);
        Instant endTime = clock.instant();
        LatencyMeasurement measurement = new LatencyMeasurement(
            trace.stage(),
            trace.startTime(),
            endTime,
            elapsedNanos / 1_000_000.0,
            failure == null,
            (failure == null) ? null : describe(failure),
            metadata
        );

        lock.lock();
        try {
            latency.get(trace.stage()).add(measurement);
            activeTraces.remove(trace.traceId());
        } finally {
            lock.unlock();
        }

        try {
            if (failure == null) {
                recorder.onTraceSuccess(trace.stage(), elapsedNanos);
            } else {
                recorder.onTraceError(trace.stage(), elapsedNanos, failure);
            }
        } catch (RuntimeException e) {
            log.warn("metrics recorder failed for stage {}", trace.stage().value(), e);
        }
    }

    public void recordThroughput(PipelineStage stage, long itemsProcessed) {
        recordThroughput(stage, itemsProcessed, DEFAULT_THROUGHPUT_WINDOW_SECONDS, 0);
    }

    /**
     * Records {@code itemsProcessed} items handled over the last {@code windowSeconds}.
     *
     * @throws IllegalArgumentException for negative counts or a non-positive window
     */
    public void recordThroughput(PipelineStage stage, long itemsProcessed, int windowSeconds, long errors) {
        Objects.requireNonNull(stage, "stage");
        if (itemsProcessed < 0) throw new IllegalArgumentException("itemsProcessed must be >= 0, got " + itemsProcessed);
        if (windowSeconds <= 0) throw new IllegalArgumentException("windowSeconds must be > 0, got " + windowSeconds);
        if (errors < 0) throw new IllegalArgumentException("errors must be >= 0, got " + errors);

        ThroughputMeasurement measurement =
            ThroughputMeasurement.of(stage, clock.instant(), itemsProcessed, windowSeconds, errors);
        lock.lock();
        try {
            throughput.get(stage).add(measurement);
        } finally {
            lock.unlock();
        }

        try {
            recorder.onThroughput(stage, itemsProcessed, errors);
        } catch (RuntimeException e) {
            log.warn("metrics recorder failed for stage {}", stage.value(), e);
        }
    }

    public LatencyStats latencyStats(PipelineStage stage, int windowMinutes) {
        return Statistics.latency(latencySnapshot(stage), cutoff(windowMinutes));
    }

    public ThroughputStats throughputStats(PipelineStage stage, int windowMinutes) {
        return Statistics.throughput(throughputSnapshot(stage), cutoff(windowMinutes));
    }

    /** Copy of the retained latency measurements of {@code stage}, in close order. */
    public List<LatencyMeasurement> latencySnapshot(PipelineStage stage) {
        Objects.requireNonNull(stage, "stage");
        lock.lock();
        try {
            return latency.get(stage).snapshot();
        } finally {
            lock.unlock();
        }
    }

    public List<ThroughputMeasurement> throughputSnapshot(PipelineStage stage) {
        Objects.requireNonNull(stage, "stage");
        lock.lock();
        try {
            return throughput.get(stage).snapshot();
        } finally {
            lock.unlock();
        }
    }

    /** Latency measurements appended after {@code mark}, at most the {@code limit} most recent ones. */
    public Slice<LatencyMeasurement> latencySince(PipelineStage stage, long mark, int limit) {
        Objects.requireNonNull(stage, "stage");
        lock.lock();
        try {
            StageBuffer<LatencyMeasurement> buffer = latency.get(stage);
            return new Slice<>(buffer.since(mark, limit), buffer.appendedCount());
        } finally {
            lock.unlock();
        }
    }

    public Slice<ThroughputMeasurement> throughputSince(PipelineStage stage, long mark, int limit) {
        Objects.requireNonNull(stage, "stage");
        lock.lock();
        try {
            StageBuffer<ThroughputMeasurement> buffer = throughput.get(stage);
            return new Slice<>(buffer.since(mark, limit), buffer.appendedCount());
        } finally {
            lock.unlock();
        }
    }

    /** In-flight traces, oldest first. */
    public List<ActiveTrace> activeTraces() {
        lock.lock();
        try {
            return new ArrayList<>(activeTraces.values());
        } finally {
            lock.unlock();
        }
    }

    public StageMetricsRecorder recorder() {
        return recorder;
    }

    private Instant cutoff(int windowMinutes) {
        if (windowMinutes <= 0) throw new IllegalArgumentException("windowMinutes must be > 0, got " + windowMinutes);
        return clock.instant().minus(Duration.ofMinutes(windowMinutes));
    }

    private String nextTraceId(PipelineStage stage) {
        return stage.value() + "_" + nanoClock.getAsLong() + "_" + traceSequence.incrementAndGet();
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return (message == null || message.isBlank())
            ? error.getClass().getSimpleName()
            : error.getClass().getSimpleName() + ": " + message;
    }

    /** Measurements read past a mark, plus the mark to pass on the next read. */
    public record Slice<T>(List<T> items, long nextMark) {
        public Slice {
            items = List.copyOf(Objects.requireNonNull(items, "items"));
        }
    }
}
