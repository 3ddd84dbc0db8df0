package com.pipemon.alert;

import com.pipemon.slo.SloStatus;

import java.util.List;

/** Receives the warning/critical results of one monitor tick. Delivery is fire-and-forget. */
@FunctionalInterface
public interface AlertSink {
    void send(List<SloStatus> violations) throws Exception;
}
