package com.questrail.alpaca.server;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Transport-neutral HTTP response: status, headers and an optional body.
 * Immutable; headers are added with {@link #withHeader}.
 */
public final class AlpacaResponse {

    public static final String JSON = "application/json";

    private final int status;
    private final Map<String, String> headers;
    private final byte[] body;

    private AlpacaResponse(int status, Map<String, String> headers, byte[] body) {
        this.status = status;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body;
    }

    public static AlpacaResponse json(int status, byte[] body) {
        Objects.requireNonNull(body, "body");
        return new AlpacaResponse(status, Map.of("Content-Type", JSON), body);
    }

    public static AlpacaResponse text(int status, String body) {
        return new AlpacaResponse(status, Map.of("Content-Type", "text/plain; charset=utf-8"),
                body.getBytes(StandardCharsets.UTF_8));
    }

    public static AlpacaResponse empty(int status) {
        return new AlpacaResponse(status, Map.of(), new byte[0]);
    }

    public AlpacaResponse withHeader(String name, String value) {
        Map<String, String> h = new LinkedHashMap<>(headers);
        h.put(name, value);
        return new AlpacaResponse(status, h, body);
    }

    public int status() {
        return status;
    }

    public String header(String name) {
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) {
                return e.getValue();
            }
        }
        return null;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public byte[] body() {
        return body.clone();
    }

    public int bodyLength() {
        return body.length;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
