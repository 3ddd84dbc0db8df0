package com.pipemon.remote.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pipemon.alert.AlertMessages;
import com.pipemon.alert.AlertSink;
import com.pipemon.monitor.MonitorConfig;
import com.pipemon.slo.SloStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Posts each violation batch as JSON to a webhook:
 * {@code {"text": ..., "timestamp": ..., "alert_type": "slo_violation", "violations": [...]}}.
 * Non-2xx responses and I/O errors are retried up to {@code retries} extra times, then rethrown.
 */
public final class WebhookAlertSink implements AlertSink {
    private static final Logger log = LoggerFactory.getLogger(WebhookAlertSink.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final WebhookSpec spec;
    private final HttpClient client;
    private final Clock clock;

    public WebhookAlertSink(WebhookSpec spec) {
        this(spec, Clock.systemUTC());
    }

    public WebhookAlertSink(WebhookSpec spec, Clock clock) {
        this.spec = Objects.requireNonNull(spec, "spec");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (spec.endpoint == null || spec.endpoint.isBlank()) throw new IllegalArgumentException("endpoint is required");
        if (spec.timeoutMillis <= 0) throw new IllegalArgumentException("timeoutMillis must be > 0");
        if (spec.retries < 0) throw new IllegalArgumentException("retries must be >= 0");
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(spec.timeoutMillis))
                .build();
    }

    /** Sink for {@code config.webhookUrl()}, or null when the config names no webhook. */
    public static WebhookAlertSink fromConfig(MonitorConfig config) {
        if (config.webhookUrl() == null) return null;
        WebhookSpec spec = new WebhookSpec();
        spec.endpoint = config.webhookUrl();
        spec.timeoutMillis = (int) Math.min(Integer.MAX_VALUE, config.webhookTimeout().toMillis());
        spec.retries = config.webhookRetries();
        return new WebhookAlertSink(spec);
    }

    @Override
    public void send(List<SloStatus> violations) throws IOException, InterruptedException {
        if (violations.isEmpty()) return;
        String body = OBJECT_MAPPER.writeValueAsString(payload(violations, clock.instant()));

        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(spec.endpoint))
                .timeout(Duration.ofMillis(spec.timeoutMillis))
                .POST(HttpRequest.BodyPublishers.ofString(body));
        for (Map.Entry<String, String> e : spec.headers.entrySet()) {
            b.header(e.getKey(), e.getValue());
        }
        b.header("Content-Type", "application/json");
        HttpRequest request = b.build();

        IOException last = null;
        for (int attempt = 0; attempt <= spec.retries; attempt++) {
            try {
                HttpResponse<String> resp = client.send(request, HttpResponse.BodyHandlers.ofString());
                int code = resp.statusCode();
                if (code >= 200 && code < 300) {
                    log.debug("webhook accepted {} violations (HTTP {})", violations.size(), code);
                    return;
                }
                last = new IOException("HTTP " + code + ": " + resp.body());
            } catch (IOException ioe) {
                last = ioe;
            }
            if (attempt < spec.retries) {
                log.debug("webhook attempt {} failed, retrying", attempt + 1, last);
            }
        }
        throw last != null ? last : new IOException("Unknown HTTP error");
    }

    static ObjectNode payload(List<SloStatus> violations, Instant at) {
        ObjectNode root = OBJECT_MAPPER.createObjectNode();
        root.put("text", AlertMessages.format(violations, at));
        root.put("timestamp", at.toString());
        root.put("alert_type", "slo_violation");
        ArrayNode items = root.putArray("violations");
        for (SloStatus v : violations) {
            ObjectNode item = items.addObject();
            item.put("slo_name", v.sloName());
            item.put("status", v.status().name().toLowerCase(Locale.ROOT));
            item.put("current_value", v.currentValue());
            item.put("target_value", v.targetValue());
            item.put("compliance_percentage", v.compliancePercentage());
            item.put("violation_count_24h", v.violationCount24h());
        }
        return root;
    }

    public static final class WebhookSpec {
        public String endpoint;
        public int timeoutMillis = 10_000;
        public int retries = 0;
        public Map<String, String> headers = Map.of();
    }
}
