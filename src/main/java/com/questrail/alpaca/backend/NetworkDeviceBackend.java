package com.questrail.alpaca.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.alpaca.api.AlpacaForms;
import com.questrail.alpaca.time.MonotonicClock;
import com.questrail.alpaca.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * NetworkDeviceBackend
 * =============================================================================
 * Forwards Alpaca member calls to a device on another Alpaca server.
 *
 * <h2>Request shape</h2>
 * {@code {serverUrl}/api/v1/{remoteType}/{remoteNumber}/{member}}. GET sends
 * parameters in the query string, PUT in a form-encoded body. The reflector
 * adds its own {@code ClientID} and {@code ClientTransactionID}.
 *
 * <h2>Retries</h2>
 * Up to {@code retryAttempts} retries after the first attempt, sleeping
 * {@code retryDelay * 2^attempt} between attempts. Only transport failures,
 * timeouts and non-200 statuses are retried; an ASCOM error in the body is
 * returned at once.
 */
public final class NetworkDeviceBackend implements DeviceBackend {

    private static final Logger log = LoggerFactory.getLogger(NetworkDeviceBackend.class);

    /** ClientID the reflector presents to remote servers. */
    public static final int REFLECTOR_CLIENT_ID = 1;

    private final BackendDeviceConfig.NetworkBackend config;
    private final HttpClient http;
    private final ObjectMapper mapper;
    private final BackendMetricsRecorder metrics;
    private final AtomicInteger transactionIds = new AtomicInteger();

    private volatile boolean connected;

    public NetworkDeviceBackend(BackendDeviceConfig.NetworkBackend config,
                                HttpClient http,
                                ObjectMapper mapper,
                                MonotonicClock clock,
                                WallClock wallClock) {
        this.config = Objects.requireNonNull(config, "config");
        this.http = Objects.requireNonNull(http, "http");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.metrics = new BackendMetricsRecorder(clock, wallClock);
    }

    @Override
    public void connect() throws BackendException {
        try {
            healthCheck();
        } catch (BackendException e) {
            metrics.connectionState(BackendMetricsRecorder.ERROR, e.getMessage());
            throw new BackendException(e.kind(), "connect to " + config.serverUrl() + " failed: " + e.getMessage(),
                    e.remoteErrorNumber(), e);
        }
        connected = true;
        metrics.connectionState(BackendMetricsRecorder.CONNECTED, null);
        log.info("Network backend connected: {}/{}/{}", config.serverUrl(), config.remoteType(), config.remoteNumber());
    }

    @Override
    public void disconnect() {
        connected = false;
        metrics.connectionState(BackendMetricsRecorder.DISCONNECTED, null);
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public JsonNode get(String member, Map<String, String> params) throws BackendException {
        return executeWithRetry("GET", member, params);
    }

    @Override
    public JsonNode put(String member, Map<String, String> params) throws BackendException {
        return executeWithRetry("PUT", member, params);
    }

    @Override
    public void healthCheck() throws BackendException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("ClientID", Integer.toString(REFLECTOR_CLIENT_ID));
        params.put("ClientTransactionID", "0");
        long start = metrics.startNanos();
        try {
            execute("GET", "connected", params);
            metrics.record(start, true);
        } catch (BackendException e) {
            metrics.record(start, false);
            throw e;
        }
    }

    @Override
    public BackendMetrics metrics() {
        return metrics.snapshot();
    }

    public BackendDeviceConfig.NetworkBackend config() {
        return config;
    }

    private JsonNode executeWithRetry(String httpMethod, String member, Map<String, String> params)
            throws BackendException {
        Map<String, String> outbound = new LinkedHashMap<>(params);
        outbound.put("ClientID", Integer.toString(REFLECTOR_CLIENT_ID));
        outbound.put("ClientTransactionID", Integer.toString(transactionIds.incrementAndGet()));

        long start = metrics.startNanos();
        BackendException last = null;
        for (int attempt = 0; attempt <= config.retryAttempts(); attempt++) {
            if (attempt > 0) {
                sleepBeforeRetry(attempt - 1);
            }
            try {
                JsonNode value = execute(httpMethod, member, outbound);
                metrics.record(start, true);
                return value;
            } catch (BackendException e) {
                last = e;
                if (!e.isRetryable()) {
                    break;
                }
                log.debug("{} {} attempt {} failed: {}", httpMethod, member, attempt + 1, e.getMessage());
            }
        }

        metrics.record(start, false);
        metrics.connectionState(connected ? BackendMetricsRecorder.CONNECTED : BackendMetricsRecorder.ERROR,
                last.getMessage());
        throw last;
    }

    private void sleepBeforeRetry(int exponent) throws BackendException {
        Duration delay = config.retryDelay().multipliedBy(1L << Math.min(exponent, 16));
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(BackendException.Kind.INTERRUPTED, "interrupted during retry delay", e);
        }
    }

    private JsonNode execute(String httpMethod, String member, Map<String, String> params) throws BackendException {
        String base = config.serverUrl() + "/api/v1/" + config.remoteType() + "/" + config.remoteNumber() + "/" + member;
        String form = AlpacaForms.encode(params);

        boolean put = "PUT".equals(httpMethod);
        URI uri;
        try {
            uri = URI.create(put || form.isEmpty() ? base : base + "?" + form);
        } catch (IllegalArgumentException e) {
            throw new BackendException(BackendException.Kind.PROTOCOL,
                    httpMethod + " " + member + ": invalid URL: " + e.getMessage(), e);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder(uri).timeout(config.timeout());
        if (put) {
            builder.header("Content-Type", AlpacaForms.CONTENT_TYPE)
                    .PUT(HttpRequest.BodyPublishers.ofString(form));
        } else {
            builder.GET();
        }

        HttpResponse<String> response;
        try {
            response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new BackendException(BackendException.Kind.TIMEOUT,
                    httpMethod + " " + member + " timed out after " + config.timeout(), e);
        } catch (IOException e) {
            throw new BackendException(BackendException.Kind.UNAVAILABLE,
                    httpMethod + " " + member + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(BackendException.Kind.INTERRUPTED, httpMethod + " " + member + " interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new BackendException(BackendException.Kind.UNAVAILABLE,
                    "HTTP " + response.statusCode() + ": " + response.body());
        }

        JsonNode body;
        try {
            body = mapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new BackendException(BackendException.Kind.PROTOCOL,
                    "malformed response to " + member + ": " + e.getOriginalMessage(), e);
        }
        if (body == null || !body.isObject()) {
            throw new BackendException(BackendException.Kind.PROTOCOL, "response to " + member + " is not an object");
        }

        int errorNumber = body.path("ErrorNumber").asInt(0);
        if (errorNumber != 0) {
            throw BackendException.remoteError(errorNumber, body.path("ErrorMessage").asText(""));
        }
        JsonNode value = body.get("Value");
        return value == null || value.isNull() ? null : value;
    }
}
