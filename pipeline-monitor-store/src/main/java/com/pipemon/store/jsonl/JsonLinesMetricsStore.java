package com.pipemon.store.jsonl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pipemon.core.LatencyMeasurement;
import com.pipemon.core.PipelineStage;
import com.pipemon.core.ThroughputMeasurement;
import com.pipemon.slo.SloHealth;
import com.pipemon.slo.ViolationRecord;
import com.pipemon.store.MetricsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only store keeping one JSON document per line in {@code latency.jsonl},
 * {@code throughput.jsonl} and {@code violations.jsonl} under a directory. Stages are written by wire
 * name, timestamps as ISO-8601. Range queries scan the whole file; lines that fail to parse are skipped
 * with a warning.
 */
public final class JsonLinesMetricsStore implements MetricsStore {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesMetricsStore.class);
    private static final TypeReference<Map<String, Object>> METADATA = new TypeReference<>() {};

    static final String LATENCY_FILE = "latency.jsonl";
    static final String THROUGHPUT_FILE = "throughput.jsonl";
    static final String VIOLATIONS_FILE = "violations.jsonl";

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Path latencyFile;
    private final Path throughputFile;
    private final Path violationsFile;
    private final Object writeLock = new Object();

    public JsonLinesMetricsStore(Path directory) throws IOException {
        Objects.requireNonNull(directory, "directory");
        Files.createDirectories(directory);
        this.latencyFile = directory.resolve(LATENCY_FILE);
        this.throughputFile = directory.resolve(THROUGHPUT_FILE);
        this.violationsFile = directory.resolve(VIOLATIONS_FILE);
        log.info("Pipeline monitoring store initialized at {}", directory.toAbsolutePath());
    }

    @Override
    public void appendLatency(List<LatencyMeasurement> measurements) throws IOException {
        List<JsonNode> rows = new ArrayList<>(measurements.size());
        for (LatencyMeasurement m : measurements) {
            ObjectNode row = objectMapper.createObjectNode();
            row.put("stage", m.stage().value());
            row.putPOJO("start_time", m.startTime());
            row.putPOJO("end_time", m.endTime());
            row.put("duration_ms", m.durationMs());
            row.put("success", m.success());
            if (m.errorMessage() != null) row.put("error_message", m.errorMessage());
            if (!m.metadata().isEmpty()) row.set("metadata", objectMapper.valueToTree(m.metadata()));
            rows.add(row);
        }
        append(latencyFile, rows);
    }

    @Override
    public void appendThroughput(List<ThroughputMeasurement> measurements) throws IOException {
        List<JsonNode> rows = new ArrayList<>(measurements.size());
        for (ThroughputMeasurement m : measurements) {
            ObjectNode row = objectMapper.createObjectNode();
            row.put("stage", m.stage().value());
            row.putPOJO("timestamp", m.timestamp());
            row.put("items_processed", m.itemsProcessed());
            row.put("window_seconds", m.windowSeconds());
            row.put("throughput_per_second", m.throughputPerSecond());
            row.put("errors", m.errors());
            rows.add(row);
        }
        append(throughputFile, rows);
    }

    @Override
    public void appendViolations(List<ViolationRecord> violations) throws IOException {
        List<JsonNode> rows = new ArrayList<>(violations.size());
        for (ViolationRecord v : violations) {
            ObjectNode row = objectMapper.createObjectNode();
            row.putPOJO("timestamp", v.timestamp());
            row.put("slo_name", v.sloName());
            row.put("status", v.status().name().toLowerCase(Locale.ROOT));
            row.put("current_value", v.currentValue());
            row.put("target_value", v.targetValue());
            row.put("compliance_percentage", v.compliancePercentage());
            rows.add(row);
        }
        append(violationsFile, rows);
    }

    @Override
    public List<LatencyMeasurement> latencyBetween(PipelineStage stage, Instant from, Instant to) throws IOException {
        List<LatencyMeasurement> out = new ArrayList<>();
        for (JsonNode row : read(latencyFile)) {
            try {
                PipelineStage rowStage = PipelineStage.fromValue(row.path("stage").asText());
                Instant start = instant(row, "start_time");
                if ((stage != null && rowStage != stage) || !inRange(start, from, to)) continue;
                Map<String, Object> metadata = row.hasNonNull("metadata")
                    ? objectMapper.convertValue(row.get("metadata"), METADATA)
                    : Map.of();
                out.add(new LatencyMeasurement(
                    rowStage,
                    start,
                    instant(row, "end_time"),
                    row.path("duration_ms").asDouble(),
                    row.path("success").asBoolean(),
                    row.hasNonNull("error_message") ? row.get("error_message").asText() : null,
                    metadata));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed latency row in {}: {}", latencyFile, e.getMessage());
            }
        }
        return out;
    }

    @Override
    public List<ThroughputMeasurement> throughputBetween(PipelineStage stage, Instant from, Instant to)
        throws IOException {
        List<ThroughputMeasurement> out = new ArrayList<>();
        for (JsonNode row : read(throughputFile)) {
            try {
                PipelineStage rowStage = PipelineStage.fromValue(row.path("stage").asText());
                Instant timestamp = instant(row, "timestamp");
                if ((stage != null && rowStage != stage) || !inRange(timestamp, from, to)) continue;
                out.add(new ThroughputMeasurement(
                    rowStage,
                    timestamp,
                    row.path("items_processed").asLong(),
                    row.path("window_seconds").asInt(),
                    row.path("throughput_per_second").asDouble(),
                    row.path("errors").asLong()));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed throughput row in {}: {}", throughputFile, e.getMessage());
            }
        }
        return out;
    }

    @Override
    public List<ViolationRecord> violationsBetween(Instant from, Instant to) throws IOException {
        List<ViolationRecord> out = new ArrayList<>();
        for (JsonNode row : read(violationsFile)) {
            try {
                Instant timestamp = instant(row, "timestamp");
                if (!inRange(timestamp, from, to)) continue;
                out.add(new ViolationRecord(
                    timestamp,
                    row.path("slo_name").asText(),
                    SloHealth.valueOf(row.path("status").asText().toUpperCase(Locale.ROOT)),
                    row.path("current_value").asDouble(),
                    row.path("target_value").asDouble(),
                    row.path("compliance_percentage").asDouble()));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed violation row in {}: {}", violationsFile, e.getMessage());
            }
        }
        return out;
    }

    private void append(Path file, List<JsonNode> rows) throws IOException {
        if (rows.isEmpty()) return;
        synchronized (writeLock) {
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                for (JsonNode row : rows) {
                    writer.write(objectMapper.writeValueAsString(row));
                    writer.newLine();
                }
            }
        }
    }

    private List<JsonNode> read(Path file) throws IOException {
        if (!Files.exists(file)) return List.of();
        List<JsonNode> rows = new ArrayList<>();
        synchronized (writeLock) {
            try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.isBlank()) continue;
                    try {
                        rows.add(objectMapper.readTree(line));
                    } catch (IOException e) {
                        log.warn("Skipping unreadable line in {}: {}", file, e.getMessage());
                    }
                }
            }
        }
        return rows;
    }

    private Instant instant(JsonNode row, String field) {
        JsonNode node = row.get(field);
        if (node == null || node.isNull()) throw new IllegalArgumentException("missing " + field);
        try {
            return objectMapper.treeToValue(node, Instant.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("bad " + field + ": " + node, e);
        }
    }

    private static boolean inRange(Instant t, Instant from, Instant to) {
        return !t.isBefore(Objects.requireNonNull(from, "from")) && t.isBefore(Objects.requireNonNull(to, "to"));
    }
}
