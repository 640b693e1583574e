package com.questrail.alpaca.backend.bus;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Request published to {@code {root}/request/{type}/{number}/{member}}.
 */
public record BusRequest(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("device_type") String deviceType,
        @JsonProperty("device_number") int deviceNumber,
        @JsonProperty("method") String method,
        @JsonProperty("http_method") String httpMethod,
        @JsonProperty("parameters") Map<String, String> parameters,
        @JsonProperty("timestamp") Instant timestamp
) {
    public BusRequest {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }
}
