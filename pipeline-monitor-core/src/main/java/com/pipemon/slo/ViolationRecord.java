package com.pipemon.slo;

import java.time.Instant;
import java.util.Objects;

public record ViolationRecord(
    Instant timestamp,
    String sloName,
    SloHealth status,
    double currentValue,
    double targetValue,
    double compliancePercentage
) {
    public ViolationRecord {
        timestamp = Objects.requireNonNull(timestamp, "timestamp");
        sloName = Objects.requireNonNull(sloName, "sloName");
        status = Objects.requireNonNull(status, "status");
    }
}
