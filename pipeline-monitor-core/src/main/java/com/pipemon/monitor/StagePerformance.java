package com.pipemon.monitor;

import com.pipemon.core.LatencyStats;
import com.pipemon.core.ThroughputStats;

import java.util.Objects;

public record StagePerformance(LatencyStats latency, ThroughputStats throughput) {
    public StagePerformance {
        latency = Objects.requireNonNull(latency, "latency");
        throughput = Objects.requireNonNull(throughput, "throughput");
    }
}
