package com.pipemon.examples;

import com.pipemon.core.PerformanceCollector;
import com.pipemon.core.PipelineStage;
import com.pipemon.core.StageTrace;
import com.pipemon.examples.steps.TradingSteps;
import com.pipemon.metrics.SimpleStageMetricsRecorder;
import com.pipemon.monitor.HealthSummary;
import com.pipemon.monitor.MonitorConfig;
import com.pipemon.monitor.PipelineMonitor;
import com.pipemon.slo.SloDefinition;
import com.pipemon.slo.SloStatus;
import com.pipemon.store.InMemoryMetricsStore;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public final class Example01TracedTradingPipeline {
    private Example01TracedTradingPipeline() {}

    public static void main(String[] args) throws Exception {
        run();
    }

    public static HealthSummary run() throws Exception {
        MonitorConfig config = MonitorConfig.builder()
            .checkInterval(Duration.ofMillis(500))
            .build();
        List<SloDefinition> slos = List.of(
            SloDefinition.latency("signal_generation_latency", PipelineStage.SIGNAL_GENERATION,
                50, 80, 200, 15, "Signal generation within 50 ms"),
            SloDefinition.latency("order_execution_latency", PipelineStage.ORDER_EXECUTION,
                20, 40, 100, 15, "Order execution within 20 ms"),
            SloDefinition.throughput("data_processing_throughput", PipelineStage.DATA_PROCESSING,
                100, 50, 20, 5, "Data processing at 100 items/s"));

        SimpleStageMetricsRecorder recorder = new SimpleStageMetricsRecorder();
        InMemoryMetricsStore store = new InMemoryMetricsStore();

        try (PipelineMonitor monitor = PipelineMonitor.builder(config)
            .slos(slos)
            .recorder(recorder)
            .store(store)
            .build()) {
            monitor.start();
            PerformanceCollector collector = monitor.collector();

            for (int i = 0; i < 40; i++) {
                String signal = collector.call(PipelineStage.SIGNAL_GENERATION,
                    () -> TradingSteps.generateSignal("NIFTY"));

                try (StageTrace trace = collector.trace(PipelineStage.ORDER_EXECUTION, null, Map.of("signal", signal))) {
                    try {
                        TradingSteps.executeOrder(signal);
                        trace.succeed();
                    } catch (IllegalStateException rejected) {
                        trace.fail(rejected);
                    }
                }

                int processed = TradingSteps.processBatch(150);
                collector.recordThroughput(PipelineStage.DATA_PROCESSING, processed, 1, 0);
            }

            monitor.tickNow();
            HealthSummary health = monitor.healthSummary();
            System.out.printf("overall health: %.1f%%%n", health.overallHealthPercentage());
            for (SloStatus s : health.sloDetails()) {
                System.out.printf("  %-28s %-8s current=%.2f target=%.2f compliance=%.1f%%%n",
                    s.sloName(), s.status(), s.currentValue(), s.targetValue(), s.compliancePercentage());
            }
            System.out.println("stored latency rows: " + store.latency().size());

            Timer timer = recorder.registry().find("pipemon.stage.order_execution.latency").tag("outcome", "success").timer();
            if (timer != null) {
                System.out.printf("micrometer order_execution count=%d mean=%.2fms%n",
                    timer.count(), timer.mean(TimeUnit.MILLISECONDS));
            }
            return health;
        }
    }
}
