package com.pipemon.alert;

import com.pipemon.slo.SloStatus;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/** Human-readable rendering of a violation batch. */
public final class AlertMessages {
    private static final DateTimeFormatter TIME =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT).withZone(ZoneId.of("UTC"));

    private AlertMessages() {}

    public static String format(List<SloStatus> violations, Instant at) {
        StringBuilder sb = new StringBuilder();
        sb.append("SLO Violations Detected\n");
        sb.append("Time: ").append(TIME.format(at)).append(" UTC\n");
        sb.append("Violations: ").append(violations.size()).append('\n');
        for (SloStatus v : violations) {
            sb.append('\n');
            sb.append("- ").append(v.sloName()).append(":\n");
            sb.append("  Status: ").append(v.status().name()).append('\n');
            sb.append("  Current: ").append(String.format(Locale.ROOT, "%.2f", v.currentValue())).append('\n');
            sb.append("  Target: ").append(String.format(Locale.ROOT, "%.2f", v.targetValue())).append('\n');
            sb.append("  Compliance: ").append(String.format(Locale.ROOT, "%.1f", v.compliancePercentage())).append("%\n");
        }
        return sb.toString();
    }
}
