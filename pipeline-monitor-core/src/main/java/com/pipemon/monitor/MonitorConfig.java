package com.pipemon.monitor;

import com.pipemon.core.PerformanceCollector;
import com.pipemon.slo.ViolationTracker;

import java.time.Duration;
import java.util.Objects;

/**
 * Startup settings of a {@link PipelineMonitor}. Built once and passed in explicitly; nothing here is
 * global.
 */
public record MonitorConfig(
    Duration checkInterval,
    Duration stopTimeout,
    int latencyCapacity,
    int throughputCapacity,
    int violationCapacity,
    int persistLatencyPerStage,
    int persistThroughputPerStage,
    boolean alertingEnabled,
    Duration alertCooldown,
    int healthWindowMinutes,
    String webhookUrl,
    Duration webhookTimeout,
    int webhookRetries,
    String storePath
) {
    public MonitorConfig {
        requirePositive(checkInterval, "checkInterval");
        requirePositive(stopTimeout, "stopTimeout");
        if (latencyCapacity < 1) throw new IllegalArgumentException("latencyCapacity must be >= 1");
        if (throughputCapacity < 1) throw new IllegalArgumentException("throughputCapacity must be >= 1");
        if (violationCapacity < 1) throw new IllegalArgumentException("violationCapacity must be >= 1");
        if (persistLatencyPerStage < 0) throw new IllegalArgumentException("persistLatencyPerStage must be >= 0");
        if (persistThroughputPerStage < 0) throw new IllegalArgumentException("persistThroughputPerStage must be >= 0");
        alertCooldown = Objects.requireNonNull(alertCooldown, "alertCooldown");
        if (alertCooldown.isNegative()) throw new IllegalArgumentException("alertCooldown must be >= 0");
        if (healthWindowMinutes < 1) throw new IllegalArgumentException("healthWindowMinutes must be >= 1");
        requirePositive(webhookTimeout, "webhookTimeout");
        if (webhookRetries < 0) throw new IllegalArgumentException("webhookRetries must be >= 0");
        webhookUrl = blankToNull(webhookUrl);
        storePath = blankToNull(storePath);
    }

    public static MonitorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) throw new IllegalArgumentException(name + " must be > 0");
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    public static final class Builder {
        private Duration checkInterval = Duration.ofSeconds(30);
        private Duration stopTimeout = Duration.ofSeconds(5);
        private int latencyCapacity = PerformanceCollector.DEFAULT_LATENCY_CAPACITY;
        private int throughputCapacity = PerformanceCollector.DEFAULT_THROUGHPUT_CAPACITY;
        private int violationCapacity = ViolationTracker.DEFAULT_CAPACITY;
        private int persistLatencyPerStage = 100;
        private int persistThroughputPerStage = 50;
        private boolean alertingEnabled = true;
        private Duration alertCooldown = Duration.ZERO;
        private int healthWindowMinutes = 60;
        private String webhookUrl;
        private Duration webhookTimeout = Duration.ofSeconds(10);
        private int webhookRetries = 0;
        private String storePath;

        private Builder() {}

        public Builder checkInterval(Duration d) { this.checkInterval = d; return this; }
        public Builder stopTimeout(Duration d) { this.stopTimeout = d; return this; }
        public Builder latencyCapacity(int n) { this.latencyCapacity = n; return this; }
        public Builder throughputCapacity(int n) { this.throughputCapacity = n; return this; }
        public Builder violationCapacity(int n) { this.violationCapacity = n; return this; }
        public Builder persistLatencyPerStage(int n) { this.persistLatencyPerStage = n; return this; }
        public Builder persistThroughputPerStage(int n) { this.persistThroughputPerStage = n; return this; }
        public Builder alertingEnabled(boolean b) { this.alertingEnabled = b; return this; }
        public Builder alertCooldown(Duration d) { this.alertCooldown = d; return this; }
        public Builder healthWindowMinutes(int n) { this.healthWindowMinutes = n; return this; }
        public Builder webhookUrl(String url) { this.webhookUrl = url; return this; }
        public Builder webhookTimeout(Duration d) { this.webhookTimeout = d; return this; }
        public Builder webhookRetries(int n) { this.webhookRetries = n; return this; }
        public Builder storePath(String path) { this.storePath = path; return this; }

        public MonitorConfig build() {
            return new MonitorConfig(checkInterval, stopTimeout, latencyCapacity, throughputCapacity,
                violationCapacity, persistLatencyPerStage, persistThroughputPerStage, alertingEnabled, alertCooldown,
                healthWindowMinutes, webhookUrl, webhookTimeout, webhookRetries, storePath);
        }
    }
}
