package com.pipemon.store;

import com.pipemon.core.LatencyMeasurement;
import com.pipemon.core.PipelineStage;
import com.pipemon.core.ThroughputMeasurement;
import com.pipemon.slo.SloHealth;
import com.pipemon.slo.ViolationRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class InMemoryMetricsStoreTest {
    private static final Instant T0 = Instant.parse("2026-01-05T09:00:00Z");

    @Test
    void rangeQueriesAreHalfOpenAndFilterByStage() {
        InMemoryMetricsStore store = new InMemoryMetricsStore();
        store.appendLatency(List.of(
            LatencyMeasurement.succeeded(PipelineStage.ORDER_EXECUTION, T0, T0.plusMillis(30), 30),
            LatencyMeasurement.succeeded(PipelineStage.ORDER_EXECUTION, T0.plusSeconds(60), T0.plusSeconds(61), 1000),
            LatencyMeasurement.succeeded(PipelineStage.DATA_INGESTION, T0.plusSeconds(10), T0.plusSeconds(11), 1000)
        ));

        assertEquals(1, store.latencyBetween(PipelineStage.ORDER_EXECUTION, T0, T0.plusSeconds(60)).size());
        assertEquals(2, store.latencyBetween(null, T0, T0.plusSeconds(60)).size());
        assertEquals(3, store.latencyBetween(null, T0, T0.plusSeconds(61)).size());
    }

    @Test
    void keepsThroughputAndViolations() {
        InMemoryMetricsStore store = new InMemoryMetricsStore();
        store.appendThroughput(List.of(ThroughputMeasurement.of(PipelineStage.DATA_PROCESSING, T0, 600, 60, 1)));
        store.appendViolations(List.of(new ViolationRecord(T0, "rate", SloHealth.CRITICAL, 10, 100, 10)));

        assertEquals(1, store.throughputBetween(PipelineStage.DATA_PROCESSING, T0, T0.plusSeconds(1)).size());
        assertTrue(store.throughputBetween(PipelineStage.DATA_INGESTION, T0, T0.plusSeconds(1)).isEmpty());
        assertEquals(1, store.violationsBetween(T0.minusSeconds(1), T0.plusSeconds(1)).size());
        assertTrue(store.violationsBetween(T0.plusSeconds(1), T0.plusSeconds(2)).isEmpty());
    }
}
