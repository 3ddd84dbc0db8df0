package com.pipemon.alert;

import com.pipemon.slo.SloStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Fans a batch out to several sinks. A failing member is logged and does not keep the batch from the
 * others; if any member failed, the first failure is rethrown once all were tried.
 */
public final class CompositeAlertSink implements AlertSink {
    private static final Logger log = LoggerFactory.getLogger(CompositeAlertSink.class);

    private final List<AlertSink> sinks;

    public CompositeAlertSink(List<AlertSink> sinks) {
        this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
    }

    public static CompositeAlertSink of(AlertSink... sinks) {
        return new CompositeAlertSink(List.of(sinks));
    }

    @Override
    public void send(List<SloStatus> violations) throws Exception {
        Exception first = null;
        for (AlertSink sink : sinks) {
            try {
                sink.send(violations);
            } catch (Exception e) {
                log.warn("alert sink {} failed", sink.getClass().getSimpleName(), e);
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
