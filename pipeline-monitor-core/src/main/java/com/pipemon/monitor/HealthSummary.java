package com.pipemon.monitor;

import com.pipemon.core.PipelineStage;
import com.pipemon.slo.SloHealth;
import com.pipemon.slo.SloStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Point-in-time view of pipeline health, built on demand by {@link PipelineMonitor#healthSummary()}. */
public record HealthSummary(
    Instant timestamp,
    double overallHealthPercentage,
    SloSummary sloSummary,
    List<SloStatus> sloDetails,
    Map<PipelineStage, StagePerformance> stagePerformance
) {
    public HealthSummary {
        timestamp = Objects.requireNonNull(timestamp, "timestamp");
        sloSummary = Objects.requireNonNull(sloSummary, "sloSummary");
        sloDetails = List.copyOf(sloDetails);
        Map<PipelineStage, StagePerformance> copy = new EnumMap<>(PipelineStage.class);
        copy.putAll(stagePerformance);
        stagePerformance = Collections.unmodifiableMap(copy);
    }

    static HealthSummary of(Instant timestamp, List<SloStatus> statuses,
                            Map<PipelineStage, StagePerformance> stagePerformance) {
        SloSummary summary = SloSummary.of(statuses);
        double overall = (summary.total() > 0) ? summary.healthy() * 100.0 / summary.total() : 100.0;
        return new HealthSummary(timestamp, overall, summary, statuses, stagePerformance);
    }

    public record SloSummary(int total, int healthy, int warning, int critical, int unknown) {
        static SloSummary of(List<SloStatus> statuses) {
            int healthy = 0, warning = 0, critical = 0, unknown = 0;
            for (SloStatus s : statuses) {
                switch (s.status()) {
                    case HEALTHY -> healthy++;
                    case WARNING -> warning++;
                    case CRITICAL -> critical++;
                    case UNKNOWN -> unknown++;
                }
            }
            return new SloSummary(statuses.size(), healthy, warning, critical, unknown);
        }

        public int count(SloHealth health) {
            return switch (health) {
                case HEALTHY -> healthy;
                case WARNING -> warning;
                case CRITICAL -> critical;
                case UNKNOWN -> unknown;
            };
        }
    }
}
