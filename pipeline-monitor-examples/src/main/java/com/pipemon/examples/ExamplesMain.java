package com.pipemon.examples;

public final class ExamplesMain {
    public static void main(String[] args) throws Exception {
        // Programmatic SLOs, in-memory store, Micrometer mirror
        Example01TracedTradingPipeline.run();

        // JSON-configured monitor with a JSON lines store
        Example02JsonConfiguredMonitor.run();
    }
}
