package com.pipemon.slo;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bounded, append-only history of SLO breaches. Once {@code capacity} is reached the oldest record is
 * dropped for every new one. Thread-safe.
 */
public final class ViolationTracker {
    public static final int DEFAULT_CAPACITY = 1_000;
    private static final Duration DAY = Duration.ofHours(24);

    private final int capacity;
    private final Clock clock;
    private final ArrayDeque<ViolationRecord> history;

    public ViolationTracker() {
        this(DEFAULT_CAPACITY, Clock.systemUTC());
    }

    public ViolationTracker(int capacity, Clock clock) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.history = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public ViolationRecord record(SloDefinition slo, SloStatus status) {
        Objects.requireNonNull(slo, "slo");
        Objects.requireNonNull(status, "status");
        ViolationRecord violation = new ViolationRecord(
            clock.instant(),
            slo.name(),
            status.status(),
            status.currentValue(),
            status.targetValue(),
            status.compliancePercentage()
        );
        append(violation);
        return violation;
    }

    /** Appends an already stamped record, e.g. one restored from an external store. */
    public void append(ViolationRecord violation) {
        Objects.requireNonNull(violation, "violation");
        synchronized (history) {
            if (history.size() == capacity) history.pollFirst();
            history.addLast(violation);
        }
    }

    /** Violations of {@code sloName} stamped within the last 24 hours (cutoff inclusive). */
    public int countInLast24h(String sloName) {
        Objects.requireNonNull(sloName, "sloName");
        Instant cutoff = clock.instant().minus(DAY);
        int count = 0;
        synchronized (history) {
            for (ViolationRecord v : history) {
                if (v.sloName().equals(sloName) && !v.timestamp().isBefore(cutoff)) count++;
            }
        }
        return count;
    }

    /** Retained records, oldest first. */
    public List<ViolationRecord> snapshot() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    public int size() {
        synchronized (history) {
            return history.size();
        }
    }
}
