package com.pipemon.alert;

import com.pipemon.slo.SloHealth;
import com.pipemon.slo.SloStatus;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CompositeAlertSinkTest {
    private static final List<SloStatus> BATCH =
        List.of(new SloStatus("signal_generation_latency", SloHealth.WARNING, 1200, 1000, 83.3, 0));

    @Test
    void everySinkSeesTheBatchEvenWhenOneFails() {
        List<List<SloStatus>> delivered = new ArrayList<>();
        IOException webhookDown = new IOException("connection refused");
        IllegalStateException chatDown = new IllegalStateException("rate limited");

        CompositeAlertSink sink = CompositeAlertSink.of(
            v -> { throw webhookDown; },
            delivered::add,
            v -> { throw chatDown; },
            new LoggingAlertSink()
        );

        Exception thrown = assertThrows(Exception.class, () -> sink.send(BATCH));
        assertSame(webhookDown, thrown);
        assertEquals(1, thrown.getSuppressed().length);
        assertSame(chatDown, thrown.getSuppressed()[0]);
        assertEquals(List.of(BATCH), delivered);
    }

    @Test
    void succeedsWhenAllSinksDo() throws Exception {
        List<List<SloStatus>> delivered = new ArrayList<>();
        CompositeAlertSink.of(delivered::add, delivered::add).send(BATCH);
        assertEquals(2, delivered.size());
    }
}
