package com.pipemon.examples;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pipemon.alert.AlertSink;
import com.pipemon.alert.CompositeAlertSink;
import com.pipemon.alert.LoggingAlertSink;
import com.pipemon.config.MonitorJsonLoader;
import com.pipemon.config.MonitorSettings;
import com.pipemon.core.PerformanceCollector;
import com.pipemon.core.PipelineStage;
import com.pipemon.examples.steps.TradingSteps;
import com.pipemon.monitor.PipelineMonitor;
import com.pipemon.remote.http.WebhookAlertSink;
import com.pipemon.store.MetricsStore;
import com.pipemon.store.jsonl.JsonLinesMetricsStore;

import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/** Loads the monitor from {@code monitor-example.json}, persists to JSON lines and prints the health summary as JSON. */
public final class Example02JsonConfiguredMonitor {
    private Example02JsonConfiguredMonitor() {}

    public static void main(String[] args) throws Exception {
        run();
    }

    public static void run() throws Exception {
        MonitorSettings settings;
        try (InputStream in = Example02JsonConfiguredMonitor.class.getResourceAsStream("/monitor-example.json")) {
            settings = MonitorJsonLoader.load(in);
        }

        MetricsStore store = new JsonLinesMetricsStore(Path.of(settings.config().storePath()));
        WebhookAlertSink webhook = WebhookAlertSink.fromConfig(settings.config());
        AlertSink sink = (webhook == null) ? new LoggingAlertSink() : CompositeAlertSink.of(new LoggingAlertSink(), webhook);

        try (PipelineMonitor monitor = PipelineMonitor.builder(settings.config())
            .slos(settings.slos())
            .store(store)
            .alertSink(sink)
            .build()) {
            monitor.start();
            PerformanceCollector collector = monitor.collector();

            Instant started = Instant.now();
            while (Duration.between(started, Instant.now()).toSeconds() < 3) {
                collector.call(PipelineStage.SIGNAL_GENERATION, () -> TradingSteps.generateSignal("BANKNIFTY"));
                collector.recordThroughput(PipelineStage.DATA_PROCESSING, TradingSteps.processBatch(30), 1, 0);
            }

            ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
            System.out.println(mapper.writeValueAsString(monitor.healthSummary().sloSummary()));
            System.out.println("violations retained: " + monitor.violations().size());
        }
    }
}
