package com.pipemon.store.jsonl;

import com.pipemon.core.LatencyMeasurement;
import com.pipemon.core.PipelineStage;
import com.pipemon.core.ThroughputMeasurement;
import com.pipemon.slo.SloHealth;
import com.pipemon.slo.ViolationRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class JsonLinesMetricsStoreTest {
    private static final Instant T0 = Instant.parse("2026-01-05T09:00:00Z");

    @TempDir
    Path dir;

    @Test
    void latencyRowsKeepErrorsAndMetadata() throws Exception {
        JsonLinesMetricsStore store = new JsonLinesMetricsStore(dir);
        store.appendLatency(List.of(
            new LatencyMeasurement(PipelineStage.ORDER_EXECUTION, T0, T0.plusMillis(1500), 1500.25, false,
                "TimeoutException: broker did not answer", Map.of("symbol", "NIFTY", "qty", 50)),
            LatencyMeasurement.succeeded(PipelineStage.ORDER_EXECUTION, T0.plusSeconds(5), T0.plusSeconds(6), 1000.0)
        ));

        List<LatencyMeasurement> read = store.latencyBetween(PipelineStage.ORDER_EXECUTION, T0, T0.plusSeconds(60));

        assertEquals(2, read.size());
        LatencyMeasurement failed = read.get(0);
        assertEquals(T0, failed.startTime());
        assertEquals(T0.plusMillis(1500), failed.endTime());
        assertEquals(1500.25, failed.durationMs(), 1e-9);
        assertFalse(failed.success());
        assertEquals("TimeoutException: broker did not answer", failed.errorMessage());
        assertEquals("NIFTY", failed.metadata().get("symbol"));
        assertEquals(50, failed.metadata().get("qty"));
        assertTrue(read.get(1).success());
        assertNull(read.get(1).errorMessage());
        assertTrue(read.get(1).metadata().isEmpty());
    }

    @Test
    void rowsAreWrittenWithWireNamesAndIsoTimestamps() throws Exception {
        JsonLinesMetricsStore store = new JsonLinesMetricsStore(dir);
        store.appendLatency(List.of(LatencyMeasurement.succeeded(PipelineStage.SIGNAL_GENERATION, T0, T0, 0.0)));
        store.appendViolations(List.of(new ViolationRecord(T0, "signal_generation_latency", SloHealth.WARNING,
            2000, 1000, 50)));

        String latency = Files.readString(dir.resolve(JsonLinesMetricsStore.LATENCY_FILE));
        assertTrue(latency.contains("\"stage\":\"signal_generation\""), latency);
        assertTrue(latency.contains("\"start_time\":\"2026-01-05T09:00:00Z\""), latency);

        String violations = Files.readString(dir.resolve(JsonLinesMetricsStore.VIOLATIONS_FILE));
        assertTrue(violations.contains("\"status\":\"warning\""), violations);
    }

    @Test
    void queriesFilterByStageAndHalfOpenRange() throws Exception {
        JsonLinesMetricsStore store = new JsonLinesMetricsStore(dir);
        store.appendThroughput(List.of(
            ThroughputMeasurement.of(PipelineStage.DATA_PROCESSING, T0, 6000, 60, 3),
            ThroughputMeasurement.of(PipelineStage.DATA_INGESTION, T0.plusSeconds(30), 600, 60, 0),
            ThroughputMeasurement.of(PipelineStage.DATA_PROCESSING, T0.plusSeconds(60), 1200, 60, 0)
        ));

        List<ThroughputMeasurement> processing =
            store.throughputBetween(PipelineStage.DATA_PROCESSING, T0, T0.plusSeconds(60));
        assertEquals(1, processing.size());
        assertEquals(100.0, processing.get(0).throughputPerSecond(), 1e-9);
        assertEquals(3, processing.get(0).errors());
        assertEquals(60, processing.get(0).windowSeconds());

        assertEquals(2, store.throughputBetween(null, T0, T0.plusSeconds(60)).size());
        assertEquals(3, store.throughputBetween(null, T0, T0.plusSeconds(61)).size());
    }

    @Test
    void violationsRoundTripThroughAReopenedStore() throws Exception {
        new JsonLinesMetricsStore(dir).appendViolations(List.of(
            new ViolationRecord(T0, "order_execution_latency", SloHealth.CRITICAL, 12000, 2000, 16.67),
            new ViolationRecord(T0.plusSeconds(3600), "data_processing_throughput", SloHealth.WARNING, 60, 100, 60)
        ));

        List<ViolationRecord> read = new JsonLinesMetricsStore(dir).violationsBetween(T0, T0.plusSeconds(3600));
        assertEquals(1, read.size());
        assertEquals("order_execution_latency", read.get(0).sloName());
        assertEquals(SloHealth.CRITICAL, read.get(0).status());
        assertEquals(16.67, read.get(0).compliancePercentage(), 1e-9);
    }

    @Test
    void malformedLinesAreSkipped() throws Exception {
        JsonLinesMetricsStore store = new JsonLinesMetricsStore(dir);
        store.appendThroughput(List.of(ThroughputMeasurement.of(PipelineStage.DATA_PROCESSING, T0, 60, 60, 0)));
        Files.writeString(dir.resolve(JsonLinesMetricsStore.THROUGHPUT_FILE),
            "not json at all\n"
                + "{\"stage\":\"warp_drive\",\"timestamp\":\"2026-01-05T09:00:01Z\",\"window_seconds\":60}\n"
                + "{\"stage\":\"data_processing\",\"timestamp\":\"yesterday\",\"window_seconds\":60}\n"
                + "{\"stage\":\"data_processing\",\"timestamp\":\"2026-01-05T09:00:02Z\",\"window_seconds\":0}\n"
                + "\n",
            StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        store.appendThroughput(List.of(ThroughputMeasurement.of(PipelineStage.DATA_PROCESSING, T0.plusSeconds(3), 120, 60, 0)));

        List<ThroughputMeasurement> read = store.throughputBetween(null, T0, T0.plusSeconds(60));
        assertEquals(2, read.size());
        assertEquals(120, read.get(1).itemsProcessed());
    }

    @Test
    void emptyDirectoryHasNoRows() throws Exception {
        JsonLinesMetricsStore store = new JsonLinesMetricsStore(dir.resolve("nested/store"));
        assertTrue(store.latencyBetween(null, T0, T0.plusSeconds(1)).isEmpty());
        assertTrue(store.violationsBetween(T0, T0.plusSeconds(1)).isEmpty());
        assertTrue(Files.isDirectory(dir.resolve("nested/store")));
    }
}
