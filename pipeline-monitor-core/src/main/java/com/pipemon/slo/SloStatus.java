package com.pipemon.slo;

import java.util.Objects;

/** Result of evaluating one SLO against the current window. */
public record SloStatus(
    String sloName,
    SloHealth status,
    double currentValue,
    double targetValue,
    double compliancePercentage,
    int violationCount24h
) {
    public SloStatus {
        sloName = Objects.requireNonNull(sloName, "sloName");
        status = Objects.requireNonNull(status, "status");
        if (compliancePercentage < 0 || compliancePercentage > 100 || Double.isNaN(compliancePercentage)) {
            throw new IllegalArgumentException("compliancePercentage must be in [0,100], got " + compliancePercentage);
        }
        if (violationCount24h < 0) throw new IllegalArgumentException("violationCount24h must be >= 0");
    }

    public static SloStatus unknown(SloDefinition slo) {
        return new SloStatus(slo.name(), SloHealth.UNKNOWN, 0.0, slo.targetValue(), 0.0, 0);
    }

    public boolean isViolation() {
        return status.isViolation();
    }
}
