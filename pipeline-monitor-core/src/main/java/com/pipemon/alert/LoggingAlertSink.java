package com.pipemon.alert;

import com.pipemon.slo.SloStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Writes one warn line per violation. */
public final class LoggingAlertSink implements AlertSink {
    private final Logger log;

    public LoggingAlertSink() {
        this(LoggerFactory.getLogger("pipemon.alerts"));
    }

    public LoggingAlertSink(Logger log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    @Override
    public void send(List<SloStatus> violations) {
        for (SloStatus v : violations) {
            log.warn("SLO violation: {} - {} current={} target={} compliance={}%",
                v.sloName(),
                v.status().name().toLowerCase(Locale.ROOT),
                String.format(Locale.ROOT, "%.2f", v.currentValue()),
                String.format(Locale.ROOT, "%.2f", v.targetValue()),
                String.format(Locale.ROOT, "%.1f", v.compliancePercentage()));
        }
    }
}
