package com.pipemon.monitor;

import com.pipemon.alert.AlertSink;
import com.pipemon.alert.LoggingAlertSink;
import com.pipemon.core.LatencyMeasurement;
import com.pipemon.core.PerformanceCollector;
import com.pipemon.core.PipelineStage;
import com.pipemon.core.ThroughputMeasurement;
import com.pipemon.metrics.NoopStageMetricsRecorder;
import com.pipemon.metrics.StageMetricsRecorder;
import com.pipemon.slo.SloDefinition;
import com.pipemon.slo.SloEvaluator;
import com.pipemon.slo.SloRegistry;
import com.pipemon.slo.SloStatus;
import com.pipemon.slo.ViolationRecord;
import com.pipemon.slo.ViolationTracker;
import com.pipemon.store.MetricsStore;
import com.pipemon.store.NoopMetricsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Owns the collector, the SLO evaluator and the violation history, and drives them from one background
 * loop. Each tick evaluates every SLO, mirrors fresh measurements to the {@link MetricsStore} and hands
 * the tick's violations to the {@link AlertSink}. Store and sink failures are logged and never stop the
 * loop; an interrupt raised while alerting is kept on the thread and ends the background loop.
 *
 * <p>Tick bodies are serialized by a loop lock, so a {@link #stop()} whose wait timed out followed by
 * {@link #start()} still never runs two ticks at once.
 */
public final class PipelineMonitor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PipelineMonitor.class);

    private final MonitorConfig config;
    private final PerformanceCollector collector;
    private final ViolationTracker tracker;
    private final SloEvaluator evaluator;
    private final MetricsStore store;
    private final AlertSink alertSink;
    private final Clock clock;

    private final Object lifecycle = new Object();
    private final ReentrantLock loopLock = new ReentrantLock();
    private final AtomicLong ticks = new AtomicLong();

    // guarded by loopLock
    private final Map<PipelineStage, Long> latencyMarks = new EnumMap<>(PipelineStage.class);
    private final Map<PipelineStage, Long> throughputMarks = new EnumMap<>(PipelineStage.class);
    private final Map<String, Instant> lastAlerted = new HashMap<>();

    // guarded by lifecycle
    private Worker worker;
    private int generation;

    public PipelineMonitor(MonitorConfig config, List<SloDefinition> slos) {
        this(builder(config).slos(slos));
    }

    private PipelineMonitor(Builder b) {
        this.config = b.config;
        this.clock = b.clock;
        this.store = b.store;
        this.alertSink = b.alertSink;
        this.collector = new PerformanceCollector(config.latencyCapacity(), config.throughputCapacity(), clock,
            b.nanoClock, b.recorder);
        this.tracker = new ViolationTracker(config.violationCapacity(), clock);
        this.evaluator = new SloEvaluator(new SloRegistry(b.slos), collector, tracker, b.recorder);
    }

    public static Builder builder(MonitorConfig config) {
        return new Builder(config);
    }

    /** Starts the background loop; a no-op while it is already running. */
    public void start() {
        synchronized (lifecycle) {
            if (worker != null) return;
            Worker w = new Worker("pipeline-monitor-" + (++generation));
            worker = w;
            w.executor.execute(() -> loop(w));
            // no further tasks; the thread exits once the loop returns
            w.executor.shutdown();
        }
        log.info("Pipeline monitoring started (interval={}ms, slos={})",
            config.checkInterval().toMillis(), evaluator.registry().size());
    }

    /**
     * Signals the loop to exit at its next tick boundary and waits up to the configured stop timeout for
     * it to finish. A tick in progress is never interrupted.
     */
    public void stop() {
        Worker w;
        synchronized (lifecycle) {
            w = worker;
            if (w == null) return;
            worker = null;
            w.running = false;
            w.wakeup.countDown();
        }
        try {
            if (!w.executor.awaitTermination(config.stopTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Pipeline monitor thread {} still finishing a tick after {}ms",
                    w.name, config.stopTimeout().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Pipeline monitoring stopped");
    }

    public boolean isRunning() {
        synchronized (lifecycle) {
            return worker != null;
        }
    }

    @Override
    public void close() {
        stop();
    }

    /** Runs one tick on the calling thread, serialized with the background loop. */
    public TickResult tickNow() {
        loopLock.lock();
        try {
            return tick();
        } finally {
            loopLock.unlock();
        }
    }

    /**
     * Health of every SLO and stage right now. Computed on each call; does not add to the violation
     * history.
     */
    public HealthSummary healthSummary() {
        List<SloStatus> statuses = evaluator.preview();
        Map<PipelineStage, StagePerformance> stages = new EnumMap<>(PipelineStage.class);
        for (PipelineStage stage : PipelineStage.values()) {
            stages.put(stage, new StagePerformance(
                collector.latencyStats(stage, config.healthWindowMinutes()),
                collector.throughputStats(stage, config.healthWindowMinutes())));
        }
        return HealthSummary.of(clock.instant(), statuses, stages);
    }

    public PerformanceCollector collector() { return collector; }
    public SloEvaluator evaluator() { return evaluator; }
    public ViolationTracker violations() { return tracker; }
    public MonitorConfig config() { return config; }
    public long tickCount() { return ticks.get(); }

    private void loop(Worker self) {
        long intervalMillis = config.checkInterval().toMillis();
        try {
            while (self.running) {
                loopLock.lock();
                try {
                    if (!self.running) break;
                    tick();
                } catch (RuntimeException e) {
                    log.error("Error in monitoring loop", e);
                } finally {
                    loopLock.unlock();
                }

                if (Thread.currentThread().isInterrupted()) {
                    log.warn("Pipeline monitor loop {} interrupted, exiting", self.name);
                    break;
                }
                try {
                    if (self.wakeup.await(intervalMillis, TimeUnit.MILLISECONDS)) break;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        } finally {
            synchronized (lifecycle) {
                if (worker == self) worker = null;
            }
        }
        log.debug("Pipeline monitor loop {} exited", self.name);
    }

    private TickResult tick() {
        SloEvaluator.Evaluation evaluation = evaluator.evaluateAll();
        persist(evaluation.recorded());

        List<SloStatus> violations = evaluation.violations();
        List<SloStatus> alerted = alert(violations);

        long n = ticks.incrementAndGet();
        log.debug("tick {} evaluated={} violations={} alerted={}",
            n, evaluation.statuses().size(), violations.size(), alerted.size());
        return new TickResult(clock.instant(), evaluation.statuses(), evaluation.recorded(), alerted);
    }

    private void persist(List<ViolationRecord> recorded) {
        List<LatencyMeasurement> latency = new ArrayList<>();
        List<ThroughputMeasurement> throughput = new ArrayList<>();
        for (PipelineStage stage : PipelineStage.values()) {
            PerformanceCollector.Slice<LatencyMeasurement> l =
                collector.latencySince(stage, latencyMarks.getOrDefault(stage, 0L), config.persistLatencyPerStage());
            latency.addAll(l.items());
            latencyMarks.put(stage, l.nextMark());

            PerformanceCollector.Slice<ThroughputMeasurement> t =
                collector.throughputSince(stage, throughputMarks.getOrDefault(stage, 0L),
                    config.persistThroughputPerStage());
            throughput.addAll(t.items());
            throughputMarks.put(stage, t.nextMark());
        }

        if (!latency.isEmpty()) {
            try {
                store.appendLatency(latency);
            } catch (IOException | RuntimeException e) {
                log.error("Failed to store {} latency measurements", latency.size(), e);
            }
        }
        if (!throughput.isEmpty()) {
            try {
                store.appendThroughput(throughput);
            } catch (IOException | RuntimeException e) {
                log.error("Failed to store {} throughput measurements", throughput.size(), e);
            }
        }
        if (!recorded.isEmpty()) {
            try {
                store.appendViolations(recorded);
            } catch (IOException | RuntimeException e) {
                log.error("Failed to store {} SLO violations", recorded.size(), e);
            }
        }
    }

    private List<SloStatus> alert(List<SloStatus> violations) {
        if (!config.alertingEnabled() || violations.isEmpty()) return List.of();

        Instant now = clock.instant();
        Duration cooldown = config.alertCooldown();
        List<SloStatus> batch = new ArrayList<>(violations.size());
        for (SloStatus v : violations) {
            Instant previous = lastAlerted.get(v.sloName());
            if (!cooldown.isZero() && previous != null && previous.plus(cooldown).isAfter(now)) {
                log.debug("SLO {} alerted at {}, still cooling down", v.sloName(), previous);
                continue;
            }
            batch.add(v);
        }
        if (batch.isEmpty()) return List.of();

        for (SloStatus v : batch) lastAlerted.put(v.sloName(), now);
        try {
            alertSink.send(batch);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while sending SLO alerts for {} violations", batch.size());
        } catch (Exception e) {
            log.error("Failed to send SLO alerts for {} violations", batch.size(), e);
        }
        return List.copyOf(batch);
    }

    private static final class Worker {
        private final String name;
        private final ExecutorService executor;
        private final CountDownLatch wakeup = new CountDownLatch(1);
        private volatile boolean running = true;

        Worker(String name) {
            this.name = name;
            this.executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, name);
                t.setDaemon(true);
                return t;
            });
        }
    }

    /** Outcome of one tick: every status, the violations it recorded, and the batch sent to the sink. */
    public record TickResult(
        Instant timestamp,
        List<SloStatus> statuses,
        List<ViolationRecord> recorded,
        List<SloStatus> alerted
    ) {
        public TickResult {
            statuses = List.copyOf(statuses);
            recorded = List.copyOf(recorded);
            alerted = List.copyOf(alerted);
        }
    }

    public static final class Builder {
        private final MonitorConfig config;
        private List<SloDefinition> slos = List.of();
        private MetricsStore store = NoopMetricsStore.INSTANCE;
        private AlertSink alertSink = new LoggingAlertSink();
        private StageMetricsRecorder recorder = NoopStageMetricsRecorder.INSTANCE;
        private Clock clock = Clock.systemUTC();
        private LongSupplier nanoClock = System::nanoTime;

        private Builder(MonitorConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder slos(List<SloDefinition> slos) {
            this.slos = List.copyOf(Objects.requireNonNull(slos, "slos"));
            return this;
        }
        public Builder store(MetricsStore store) { this.store = Objects.requireNonNull(store, "store"); return this; }
        public Builder alertSink(AlertSink sink) { this.alertSink = Objects.requireNonNull(sink, "alertSink"); return this; }
        public Builder recorder(StageMetricsRecorder r) { this.recorder = Objects.requireNonNull(r, "recorder"); return this; }
        public Builder clock(Clock clock) { this.clock = Objects.requireNonNull(clock, "clock"); return this; }
        public Builder nanoClock(LongSupplier nanoClock) { this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock"); return this; }

        public PipelineMonitor build() {
            return new PipelineMonitor(this);
        }
    }
}
