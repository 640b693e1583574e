package com.questrail.alpaca.backend;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Objects;

/**
 * Backend for the reserved direct (serial/USB) mode. Every call fails with
 * {@link BackendException.Kind#NOT_IMPLEMENTED}.
 */
final class UnimplementedDeviceBackend implements DeviceBackend {

    private final String mode;
    private final BackendMetrics metrics = new BackendMetrics(0, 0, 0, null, null, null, 0,
            BackendMetricsRecorder.DISCONNECTED, null);

    UnimplementedDeviceBackend(String mode) {
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    @Override
    public void connect() throws BackendException {
        throw notImplemented();
    }

    @Override
    public void disconnect() {
        // never connected
    }

    @Override
    public boolean isConnected() {
        return false;
    }

    @Override
    public JsonNode get(String member, Map<String, String> params) throws BackendException {
        throw notImplemented();
    }

    @Override
    public JsonNode put(String member, Map<String, String> params) throws BackendException {
        throw notImplemented();
    }

    @Override
    public void healthCheck() throws BackendException {
        throw notImplemented();
    }

    @Override
    public BackendMetrics metrics() {
        return metrics;
    }

    private BackendException notImplemented() {
        return new BackendException(BackendException.Kind.NOT_IMPLEMENTED, mode + " backend is not implemented");
    }
}
