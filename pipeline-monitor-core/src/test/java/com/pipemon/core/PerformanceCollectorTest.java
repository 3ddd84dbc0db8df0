package com.pipemon.core;

import com.pipemon.metrics.NoopStageMetricsRecorder;
import com.pipemon.metrics.SimpleStageMetricsRecorder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class PerformanceCollectorTest {
    private TestClock clock;
    private PerformanceCollector collector;

    @BeforeEach
    void setup() {
        clock = new TestClock();
        collector = new PerformanceCollector(5, 3, clock, clock::nanos, NoopStageMetricsRecorder.INSTANCE);
    }

    @Test
    void traceRecordsOneSuccessfulMeasurementWithDuration() {
        try (StageTrace trace = collector.trace(PipelineStage.SIGNAL_GENERATION)) {
            assertEquals(1, collector.activeTraces().size());
            assertEquals(trace.traceId(), collector.activeTraces().get(0).traceId());
            clock.advanceMillis(250);
            trace.succeed();
        }

        List<LatencyMeasurement> recorded = collector.latencySnapshot(PipelineStage.SIGNAL_GENERATION);
        assertEquals(1, recorded.size());
        LatencyMeasurement m = recorded.get(0);
        assertTrue(m.success());
        assertNull(m.errorMessage());
        assertEquals(250.0, m.durationMs(), 1e-9);
        assertEquals(Duration.ofMillis(250), Duration.between(m.startTime(), m.endTime()));
        assertTrue(collector.activeTraces().isEmpty());
    }

    @Test
    void failingCallIsRecordedAndTheSameExceptionReachesTheCaller() {
        IOException boom = new IOException("feed disconnected");

        IOException seen = assertThrows(IOException.class, () -> collector.call(PipelineStage.DATA_INGESTION, () -> {
            clock.advanceMillis(40);
            throw boom;
        }));

        assertSame(boom, seen);
        List<LatencyMeasurement> recorded = collector.latencySnapshot(PipelineStage.DATA_INGESTION);
        assertEquals(1, recorded.size());
        assertFalse(recorded.get(0).success());
        assertEquals("IOException: feed disconnected", recorded.get(0).errorMessage());
        assertEquals(40.0, recorded.get(0).durationMs(), 1e-9);
        assertTrue(collector.activeTraces().isEmpty());
    }

    @Test
    void errorsPropagateUnchangedFromRun() {
        AssertionError error = new AssertionError("position limit breached");
        AssertionError seen = assertThrows(AssertionError.class,
            () -> collector.run(PipelineStage.RISK_VALIDATION, () -> { throw error; }));
        assertSame(error, seen);
        assertFalse(collector.latencySnapshot(PipelineStage.RISK_VALIDATION).get(0).success());
    }

    @Test
    void callReturnsTheWorkResult() throws Exception {
        String result = collector.call(PipelineStage.ORDER_CREATION, () -> "order-1");
        assertEquals("order-1", result);
        assertTrue(collector.latencySnapshot(PipelineStage.ORDER_CREATION).get(0).success());
    }

    @Test
    void closingTwiceEmitsOneMeasurement() {
        StageTrace trace = collector.trace(PipelineStage.PORTFOLIO_UPDATE);
        trace.close();
        trace.close();
        assertEquals(1, collector.latencySnapshot(PipelineStage.PORTFOLIO_UPDATE).size());
    }

    @Test
    void exceptionLeavingARawTraceScopeIsRecordedAsAFailure() {
        assertThrows(IllegalStateException.class, () -> {
            try (StageTrace trace = collector.trace(PipelineStage.ORDER_EXECUTION)) {
                clock.advanceMillis(30);
                submitRejectedOrder();
                trace.succeed();
            }
        });

        LatencyMeasurement m = collector.latencySnapshot(PipelineStage.ORDER_EXECUTION).get(0);
        assertFalse(m.success());
        assertTrue(m.errorMessage().contains("without succeed()"), m.errorMessage());
        assertEquals(30.0, m.durationMs(), 1e-9);
        assertTrue(collector.activeTraces().isEmpty());
    }

    private static void submitRejectedOrder() {
        throw new IllegalStateException("broker rejected order");
    }

    @Test
    void explicitFailureWinsOverALaterSucceed() {
        try (StageTrace trace = collector.trace(PipelineStage.RISK_VALIDATION)) {
            trace.fail(new IllegalArgumentException("exposure over limit"));
            trace.succeed();
        }
        LatencyMeasurement m = collector.latencySnapshot(PipelineStage.RISK_VALIDATION).get(0);
        assertFalse(m.success());
        assertEquals("IllegalArgumentException: exposure over limit", m.errorMessage());
    }

    @Test
    void reusedInFlightTraceIdIsSuffixedAndBothTracesStayVisible() {
        StageTrace first = collector.trace(PipelineStage.ORDER_EXECUTION, "ord-42");
        StageTrace second = collector.trace(PipelineStage.ORDER_EXECUTION, "ord-42");

        assertEquals("ord-42", first.traceId());
        assertNotEquals(first.traceId(), second.traceId());
        assertTrue(second.traceId().startsWith("ord-42_"));
        assertEquals(2, collector.activeTraces().size());

        first.succeed();
        first.close();
        List<ActiveTrace> remaining = collector.activeTraces();
        assertEquals(1, remaining.size());
        assertEquals(second.traceId(), remaining.get(0).traceId());

        second.succeed();
        second.close();
        assertTrue(collector.activeTraces().isEmpty());
        assertEquals(2, collector.latencySnapshot(PipelineStage.ORDER_EXECUTION).size());

        // once the first trace is gone its id can be used again unchanged
        try (StageTrace again = collector.trace(PipelineStage.ORDER_EXECUTION, "ord-42")) {
            assertEquals("ord-42", again.traceId());
            again.succeed();
        }
    }

    @Test
    void unfinishedTraceStaysVisibleWithItsMetadata() {
        StageTrace open = collector.trace(PipelineStage.ORDER_EXECUTION, "ord-42", Map.of("symbol", "NIFTY"));

        List<ActiveTrace> active = collector.activeTraces();
        assertEquals(1, active.size());
        assertEquals("ord-42", active.get(0).traceId());
        assertEquals(PipelineStage.ORDER_EXECUTION, active.get(0).stage());
        assertEquals("NIFTY", active.get(0).metadata().get("symbol"));
        assertTrue(collector.latencySnapshot(PipelineStage.ORDER_EXECUTION).isEmpty());

        open.close();
        assertEquals(Map.of("symbol", "NIFTY"), collector.latencySnapshot(PipelineStage.ORDER_EXECUTION).get(0).metadata());
    }

    @Test
    void generatedTraceIdsAreUniqueAndNamedAfterTheStage() {
        StageTrace a = collector.trace(PipelineStage.TRADE_CONFIRMATION);
        StageTrace b = collector.trace(PipelineStage.TRADE_CONFIRMATION);
        assertNotEquals(a.traceId(), b.traceId());
        assertTrue(a.traceId().startsWith("trade_confirmation_"));
        assertEquals(2, collector.activeTraces().size());
        a.close();
        b.close();
    }

    @Test
    void capacityPlusOneLeavesCapacityEntriesWithOldestEvicted() {
        for (int i = 0; i < 6; i++) {
            try (StageTrace trace = collector.trace(PipelineStage.DATA_PROCESSING)) {
                clock.advanceMillis(i + 1);
                trace.succeed();
            }
        }
        List<LatencyMeasurement> recorded = collector.latencySnapshot(PipelineStage.DATA_PROCESSING);
        assertEquals(5, recorded.size());
        assertEquals(2.0, recorded.get(0).durationMs(), 1e-9);
        assertEquals(6.0, recorded.get(4).durationMs(), 1e-9);
    }

    @Test
    void countIsBoundedByCapacityAndPercentilesStayOrdered() {
        for (int i = 0; i < 12; i++) {
            try (StageTrace trace = collector.trace(PipelineStage.FEATURE_EXTRACTION)) {
                clock.advanceMillis((i * 37) % 11 + 1);
                trace.succeed();
            }
        }
        LatencyStats stats = collector.latencyStats(PipelineStage.FEATURE_EXTRACTION, 60);
        assertEquals(5, stats.count());
        assertTrue(stats.p99Ms() >= stats.p95Ms());
        assertTrue(stats.p95Ms() >= stats.medianMs());
    }

    @Test
    void windowExcludesMeasurementsThatStartedBeforeTheCutoff() {
        try (StageTrace trace = collector.trace(PipelineStage.SIGNAL_GENERATION)) {
            clock.advanceMillis(900);
            trace.succeed();
        }
        clock.advance(Duration.ofMinutes(20));
        try (StageTrace trace = collector.trace(PipelineStage.SIGNAL_GENERATION)) {
            clock.advanceMillis(100);
            trace.succeed();
        }

        assertEquals(1, collector.latencyStats(PipelineStage.SIGNAL_GENERATION, 15).count());
        assertEquals(100.0, collector.latencyStats(PipelineStage.SIGNAL_GENERATION, 15).p95Ms(), 1e-9);
        assertEquals(2, collector.latencyStats(PipelineStage.SIGNAL_GENERATION, 60).count());
        assertFalse(collector.latencyStats(PipelineStage.ORDER_EXECUTION, 60).hasData());
    }

    @Test
    void throughputIsRecordedAndEvictedByCapacity() {
        for (int i = 1; i <= 4; i++) {
            collector.recordThroughput(PipelineStage.DATA_PROCESSING, i * 60L, 60, 0);
        }
        List<ThroughputMeasurement> recorded = collector.throughputSnapshot(PipelineStage.DATA_PROCESSING);
        assertEquals(3, recorded.size());
        assertEquals(2.0, recorded.get(0).throughputPerSecond(), 1e-9);

        ThroughputStats stats = collector.throughputStats(PipelineStage.DATA_PROCESSING, 5);
        assertEquals(3.0, stats.meanThroughput(), 1e-9);
        assertEquals(540, stats.totalItems());
    }

    @Test
    void defaultThroughputWindowIsSixtySeconds() {
        collector.recordThroughput(PipelineStage.DATA_INGESTION, 120);
        ThroughputMeasurement m = collector.throughputSnapshot(PipelineStage.DATA_INGESTION).get(0);
        assertEquals(60, m.windowSeconds());
        assertEquals(2.0, m.throughputPerSecond(), 1e-9);
        assertEquals(0, m.errors());
    }

    @Test
    void invalidThroughputInputIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> collector.recordThroughput(PipelineStage.DATA_PROCESSING, -1, 60, 0));
        assertThrows(IllegalArgumentException.class,
            () -> collector.recordThroughput(PipelineStage.DATA_PROCESSING, 10, 0, 0));
        assertThrows(IllegalArgumentException.class,
            () -> collector.recordThroughput(PipelineStage.DATA_PROCESSING, 10, 60, -2));
        assertTrue(collector.throughputSnapshot(PipelineStage.DATA_PROCESSING).isEmpty());
    }

    @Test
    void sliceReadsAdvanceTheMark() {
        for (int i = 0; i < 3; i++) collector.recordThroughput(PipelineStage.ORDER_EXECUTION, 10, 1, 0);

        PerformanceCollector.Slice<ThroughputMeasurement> first = collector.throughputSince(PipelineStage.ORDER_EXECUTION, 0, 50);
        assertEquals(3, first.items().size());
        assertEquals(3, first.nextMark());

        collector.recordThroughput(PipelineStage.ORDER_EXECUTION, 20, 1, 0);
        PerformanceCollector.Slice<ThroughputMeasurement> second =
            collector.throughputSince(PipelineStage.ORDER_EXECUTION, first.nextMark(), 50);
        assertEquals(1, second.items().size());
        assertEquals(20, second.items().get(0).itemsProcessed());
    }

    @Test
    void recorderMirrorsTracesAndThroughput() throws Exception {
        SimpleStageMetricsRecorder recorder = new SimpleStageMetricsRecorder();
        PerformanceCollector mirrored = new PerformanceCollector(10, 10, clock, clock::nanos, recorder);

        mirrored.call(PipelineStage.ORDER_EXECUTION, () -> {
            clock.advanceMillis(12);
            return "filled";
        });
        assertThrows(IllegalStateException.class, () -> mirrored.run(PipelineStage.ORDER_EXECUTION, () -> {
            throw new IllegalStateException("rejected");
        }));
        mirrored.recordThroughput(PipelineStage.ORDER_EXECUTION, 30, 10, 2);

        Timer ok = recorder.registry().find("pipemon.stage.order_execution.latency").tag("outcome", "success").timer();
        assertNotNull(ok);
        assertEquals(1, ok.count());
        assertEquals(12.0, ok.totalTime(TimeUnit.MILLISECONDS), 1e-6);

        Counter errors = recorder.registry().find("pipemon.stage.order_execution.errors").counter();
        assertNotNull(errors);
        assertEquals(1.0, errors.count());

        Counter items = recorder.registry().find("pipemon.stage.order_execution.items").counter();
        assertNotNull(items);
        assertEquals(30.0, items.count());
    }

    @Test
    void concurrentProducersNeverLoseMeasurements() throws Exception {
        PerformanceCollector shared = new PerformanceCollector();
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger failures = new AtomicInteger();
        try {
            for (int t = 0; t < threads; t++) {
                final int id = t;
                pool.execute(() -> {
                    try {
                        start.await();
                        for (int i = 0; i < perThread; i++) {
                            try (StageTrace trace = shared.trace(PipelineStage.DATA_PROCESSING)) {
                                if ((i + id) % 10 == 0) trace.fail(new IllegalStateException("bad tick"));
                                else trace.succeed();
                            }
                            shared.recordThroughput(PipelineStage.DATA_PROCESSING, 1, 1, 0);
                        }
                    } catch (Exception e) {
                        failures.incrementAndGet();
                    }
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
        }
        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals(0, failures.get());
        assertEquals(threads * perThread, shared.latencySnapshot(PipelineStage.DATA_PROCESSING).size());
        assertEquals(1_000, shared.throughputSnapshot(PipelineStage.DATA_PROCESSING).size());
        assertTrue(shared.activeTraces().isEmpty());
        assertEquals(threads * perThread * 9 / 10,
            shared.latencyStats(PipelineStage.DATA_PROCESSING, 60).count());
    }
}
