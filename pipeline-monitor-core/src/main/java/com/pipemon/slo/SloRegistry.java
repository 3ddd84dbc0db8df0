package com.pipemon.slo;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Immutable, ordered set of SLO definitions keyed by unique name. */
public final class SloRegistry {
    private final Map<String, SloDefinition> byName;

    public SloRegistry(Collection<SloDefinition> definitions) {
        Objects.requireNonNull(definitions, "definitions");
        Map<String, SloDefinition> ordered = new LinkedHashMap<>();
        for (SloDefinition definition : definitions) {
            Objects.requireNonNull(definition, "definition");
            if (ordered.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("Duplicate SLO name: " + definition.name());
            }
        }
        this.byName = ordered;
    }

    public static SloRegistry of(SloDefinition... definitions) {
        return new SloRegistry(List.of(definitions));
    }

    public List<SloDefinition> definitions() {
        return List.copyOf(byName.values());
    }

    public int size() {
        return byName.size();
    }
}
