package com.pipemon.slo;

import java.util.Locale;
import java.util.Objects;

public enum MetricKind {
    /** Stage latency in milliseconds; lower is better. */
    LATENCY("latency"),
    /** Items per second; higher is better. */
    THROUGHPUT("throughput");

    private final String value;

    MetricKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean lowerIsBetter() {
        return this == LATENCY;
    }

    public static MetricKind fromValue(String value) {
        Objects.requireNonNull(value, "value");
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MetricKind kind : values()) {
            if (kind.value.equals(normalized)) return kind;
        }
        throw new IllegalArgumentException("Unsupported metric type: " + value);
    }
}
