package com.questrail.alpaca.backend;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * DeviceBackend
 * =============================================================================
 * Transport strategy realizing one virtual device against real hardware.
 *
 * <p>{@link #get} and {@link #put} forward one Alpaca member call and return
 * the backend's {@code Value} as a JSON tree, ready to be placed into the
 * response envelope unchanged. A missing value is returned as {@code null}.</p>
 *
 * <p>Implementations are thread-safe. Calls may block up to the configured
 * timeout (times the retry count for network backends).</p>
 */
public interface DeviceBackend {

    /**
     * Establish the transport and verify the backend answers.
     */
    void connect() throws BackendException;

    void disconnect();

    boolean isConnected();

    JsonNode get(String member, Map<String, String> params) throws BackendException;

    JsonNode put(String member, Map<String, String> params) throws BackendException;

    /**
     * One probe without retries.
     */
    void healthCheck() throws BackendException;

    BackendMetrics metrics();
}
