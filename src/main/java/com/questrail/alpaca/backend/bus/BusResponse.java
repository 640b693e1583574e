package com.questrail.alpaca.backend.bus;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Response received on {@code {root}/response/+}, correlated by {@code request_id}.
 */
public record BusResponse(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("value") JsonNode value,
        @JsonProperty("error_number") int errorNumber,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("timestamp") Instant timestamp
) {
}
