package com.pipemon.slo;

public enum SloHealth {
    HEALTHY,
    WARNING,
    CRITICAL,
    /** Evaluation failed or the window held no data. */
    UNKNOWN;

    public boolean isViolation() {
        return this == WARNING || this == CRITICAL;
    }
}
