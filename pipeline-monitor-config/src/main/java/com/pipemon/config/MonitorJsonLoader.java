package com.pipemon.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipemon.core.PipelineStage;
import com.pipemon.monitor.MonitorConfig;
import com.pipemon.slo.MetricKind;
import com.pipemon.slo.SloDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads monitor settings and SLO definitions from JSON.
 *
 * <p>Keys are camelCase; the snake_case spellings of older configuration files
 * ({@code check_interval_seconds}, {@code target_value}, ...) are accepted as aliases. A document without
 * an {@code slos} section gets the bundled default objectives.
 */
public final class MonitorJsonLoader {
    private static final Logger log = LoggerFactory.getLogger(MonitorJsonLoader.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final String DEFAULT_SLOS_RESOURCE = "default-slos.json";

    private MonitorJsonLoader() {}

    public static MonitorSettings load(Path filePath) throws IOException {
        Objects.requireNonNull(filePath, "filePath");
        try (InputStream in = Files.newInputStream(filePath)) {
            return load(in);
        }
    }

    public static MonitorSettings load(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in");
        JsonNode root = OBJECT_MAPPER.readTree(in);
        if (root == null || !root.isObject()) throw new IOException("Monitor configuration must be a JSON object");

        MonitorConfig config = parseConfig(root);
        JsonNode slosNode = root.get("slos");
        List<SloDefinition> slos = (slosNode == null || slosNode.isNull()) ? defaultSlos() : parseSlos(slosNode);
        return new MonitorSettings(config, slos);
    }

    /**
     * Like {@link #load(Path)}, but a missing or unreadable file falls back to defaults. Invalid content is
     * still an error.
     */
    public static MonitorSettings loadOrDefaults(Path filePath) throws IOException {
        Objects.requireNonNull(filePath, "filePath");
        if (!Files.isReadable(filePath)) {
            log.warn("Monitor configuration {} not readable, using defaults", filePath);
            return new MonitorSettings(MonitorConfig.defaults(), defaultSlos());
        }
        return load(filePath);
    }

    /** Signal-generation and order-execution latency plus data-processing throughput objectives. */
    public static List<SloDefinition> defaultSlos() {
        try (InputStream in = MonitorJsonLoader.class.getResourceAsStream(DEFAULT_SLOS_RESOURCE)) {
            if (in == null) throw new IOException("Missing bundled resource " + DEFAULT_SLOS_RESOURCE);
            return parseSlos(req(OBJECT_MAPPER.readTree(in), "slos"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static List<SloDefinition> loadSlos(InputStream in) throws IOException {
        JsonNode root = OBJECT_MAPPER.readTree(in);
        JsonNode slos = (root != null && root.isArray()) ? root : req(root, "slos");
        return parseSlos(slos);
    }

    static MonitorConfig parseConfig(JsonNode root) throws IOException {
        MonitorConfig.Builder b = MonitorConfig.builder();

        JsonNode monitoring = section(root, "monitoring");
        if (monitoring != null) {
            JsonNode n;
            if ((n = field(monitoring, "checkIntervalSeconds", "check_interval_seconds")) != null) {
                b.checkInterval(Duration.ofMillis(Math.round(number(n, "monitoring.checkIntervalSeconds") * 1000)));
            }
            if ((n = field(monitoring, "stopTimeoutSeconds", "stop_timeout_seconds")) != null) {
                b.stopTimeout(Duration.ofMillis(Math.round(number(n, "monitoring.stopTimeoutSeconds") * 1000)));
            }
            if ((n = field(monitoring, "alertCooldownMinutes", "alert_cooldown_minutes")) != null) {
                b.alertCooldown(Duration.ofSeconds(Math.round(number(n, "monitoring.alertCooldownMinutes") * 60)));
            }
            if ((n = field(monitoring, "latencyBufferCapacity", "latency_buffer_capacity")) != null) {
                b.latencyCapacity(integer(n, "monitoring.latencyBufferCapacity"));
            }
            if ((n = field(monitoring, "throughputBufferCapacity", "throughput_buffer_capacity")) != null) {
                b.throughputCapacity(integer(n, "monitoring.throughputBufferCapacity"));
            }
            if ((n = field(monitoring, "violationHistoryCapacity", "violation_history_capacity")) != null) {
                b.violationCapacity(integer(n, "monitoring.violationHistoryCapacity"));
            }
            if ((n = field(monitoring, "persistLatencyPerStage", "persist_latency_per_stage")) != null) {
                b.persistLatencyPerStage(integer(n, "monitoring.persistLatencyPerStage"));
            }
            if ((n = field(monitoring, "persistThroughputPerStage", "persist_throughput_per_stage")) != null) {
                b.persistThroughputPerStage(integer(n, "monitoring.persistThroughputPerStage"));
            }
            if ((n = field(monitoring, "healthWindowMinutes", "health_window_minutes")) != null) {
                b.healthWindowMinutes(integer(n, "monitoring.healthWindowMinutes"));
            }
        }

        JsonNode alerting = section(root, "alerting");
        if (alerting != null) {
            JsonNode n;
            if ((n = field(alerting, "enabled", "enabled")) != null) {
                if (!n.isBoolean()) throw new IOException("alerting.enabled must be a boolean");
                b.alertingEnabled(n.asBoolean());
            }
            if ((n = field(alerting, "webhookUrl", "webhook_url")) != null) {
                b.webhookUrl(text(n, "alerting.webhookUrl"));
            }
            if ((n = field(alerting, "timeoutMillis", "timeout_millis")) != null) {
                b.webhookTimeout(Duration.ofMillis(integer(n, "alerting.timeoutMillis")));
            }
            if ((n = field(alerting, "retries", "retries")) != null) {
                b.webhookRetries(integer(n, "alerting.retries"));
            }
        }

        JsonNode database = section(root, "database");
        if (database != null) {
            JsonNode n = field(database, "path", "path");
            if (n != null) b.storePath(text(n, "database.path"));
        }

        try {
            return b.build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid monitor configuration: " + e.getMessage(), e);
        }
    }

    static List<SloDefinition> parseSlos(JsonNode slosNode) throws IOException {
        if (!slosNode.isArray()) throw new IOException("Section 'slos' must be an array");
        List<SloDefinition> slos = new ArrayList<>(slosNode.size());
        int index = 0;
        for (JsonNode sloNode : slosNode) {
            slos.add(parseSlo(sloNode, index++));
        }
        return slos;
    }

    private static SloDefinition parseSlo(JsonNode node, int index) throws IOException {
        if (node == null || !node.isObject()) throw new IOException("slos[" + index + "] must be a JSON object");
        String at = "slos[" + index + "]";

        String name = text(req(node, "name"), at + ".name");
        PipelineStage stage;
        MetricKind kind;
        try {
            stage = PipelineStage.fromValue(text(req(node, "stage"), at + ".stage"));
            kind = MetricKind.fromValue(text(reqField(node, "metricType", "metric_type"), at + ".metricType"));
        } catch (IllegalArgumentException e) {
            throw new IOException(at + " (" + name + "): " + e.getMessage(), e);
        }

        double target = number(reqField(node, "targetValue", "target_value"), at + ".targetValue");
        double warning = number(reqField(node, "warningThreshold", "warning_threshold"), at + ".warningThreshold");
        double critical = number(reqField(node, "criticalThreshold", "critical_threshold"), at + ".criticalThreshold");
        int window = integer(reqField(node, "measurementWindowMinutes", "measurement_window_minutes"),
            at + ".measurementWindowMinutes");
        JsonNode descriptionNode = node.get("description");
        String description = (descriptionNode == null || descriptionNode.isNull()) ? "" : descriptionNode.asText();

        try {
            return new SloDefinition(name, stage, kind, target, warning, critical, window, description);
        } catch (IllegalArgumentException e) {
            throw new IOException(at + ": " + e.getMessage(), e);
        }
    }

    private static JsonNode section(JsonNode root, String name) throws IOException {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) return null;
        if (!node.isObject()) throw new IOException("Section '" + name + "' must be an object");
        return node;
    }

    private static JsonNode field(JsonNode node, String preferred, String legacy) {
        JsonNode value = node.has(preferred) ? node.get(preferred) : node.get(legacy);
        return (value == null || value.isNull()) ? null : value;
    }

    private static JsonNode req(JsonNode node, String name) throws IOException {
        if (node == null || !node.has(name) || node.get(name).isNull()) {
            throw new IOException("Missing required field: " + name);
        }
        return node.get(name);
    }

    private static JsonNode reqField(JsonNode node, String preferred, String legacy) throws IOException {
        JsonNode value = field(node, preferred, legacy);
        if (value == null) throw new IOException("Missing required field: " + preferred);
        return value;
    }

    private static String text(JsonNode node, String at) throws IOException {
        if (!node.isTextual()) throw new IOException(at + " must be a string");
        return node.asText();
    }

    private static double number(JsonNode node, String at) throws IOException {
        if (!node.isNumber()) throw new IOException(at + " must be a number");
        return node.asDouble();
    }

    private static int integer(JsonNode node, String at) throws IOException {
        if (!node.isIntegralNumber() || !node.canConvertToInt()) throw new IOException(at + " must be an integer");
        return node.asInt();
    }
}
