package com.pipemon.config;

import com.pipemon.monitor.MonitorConfig;
import com.pipemon.slo.SloDefinition;

import java.util.List;
import java.util.Objects;

/** Everything a monitor needs at startup, as read from one configuration document. */
public record MonitorSettings(MonitorConfig config, List<SloDefinition> slos) {
    public MonitorSettings {
        config = Objects.requireNonNull(config, "config");
        slos = List.copyOf(Objects.requireNonNull(slos, "slos"));
    }
}
