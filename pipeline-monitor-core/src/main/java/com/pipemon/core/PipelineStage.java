package com.pipemon.core;

import java.util.Locale;
import java.util.Objects;

/** Named steps a unit of work passes through, in pipeline order. */
public enum PipelineStage {
    DATA_INGESTION("data_ingestion"),
    DATA_PROCESSING("data_processing"),
    FEATURE_EXTRACTION("feature_extraction"),
    SIGNAL_GENERATION("signal_generation"),
    RISK_VALIDATION("risk_validation"),
    ORDER_CREATION("order_creation"),
    ORDER_EXECUTION("order_execution"),
    TRADE_CONFIRMATION("trade_confirmation"),
    PORTFOLIO_UPDATE("portfolio_update");

    private final String value;

    PipelineStage(String value) {
        this.value = value;
    }

    /** Wire name used in configuration files and persisted records. */
    public String value() {
        return value;
    }

    /**
     * Resolves a stage from its wire name ({@code order_execution}) or its constant name
     * ({@code ORDER_EXECUTION}).
     */
    public static PipelineStage fromValue(String value) {
        Objects.requireNonNull(value, "value");
        String normalized = value.trim();
        for (PipelineStage stage : values()) {
            if (stage.value.equals(normalized) || stage.name().equals(normalized.toUpperCase(Locale.ROOT))) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown pipeline stage: " + value);
    }
}
