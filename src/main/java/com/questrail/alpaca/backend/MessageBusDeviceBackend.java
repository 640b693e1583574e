package com.questrail.alpaca.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.alpaca.backend.bus.BusRequestBridge;
import com.questrail.alpaca.backend.bus.BusResponse;
import com.questrail.alpaca.time.MonotonicClock;
import com.questrail.alpaca.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Realizes a virtual device over the message bus. Requests are correlated
 * through the shared {@link BusRequestBridge} of the device's topic root.
 */
public final class MessageBusDeviceBackend implements DeviceBackend {

    private static final Logger log = LoggerFactory.getLogger(MessageBusDeviceBackend.class);

    private final BackendDeviceConfig.MqttBackend config;
    private final String deviceType;
    private final int deviceNumber;
    private final BusRequestBridge bridge;
    private final BackendMetricsRecorder metrics;

    private boolean attached;

    public MessageBusDeviceBackend(BackendDeviceConfig.MqttBackend config,
                                   String deviceType,
                                   int deviceNumber,
                                   BusRequestBridge bridge,
                                   MonotonicClock clock,
                                   WallClock wallClock) {
        this.config = Objects.requireNonNull(config, "config");
        this.deviceType = Objects.requireNonNull(deviceType, "deviceType");
        this.deviceNumber = deviceNumber;
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.metrics = new BackendMetricsRecorder(clock, wallClock);
    }

    @Override
    public synchronized void connect() throws BackendException {
        if (attached) {
            return;
        }
        try {
            bridge.attach();
        } catch (BackendException e) {
            metrics.connectionState(BackendMetricsRecorder.ERROR, e.getMessage());
            throw e;
        }
        attached = true;
        metrics.connectionState(BackendMetricsRecorder.CONNECTED, null);
        log.info("Message bus backend connected: {}/{} via {}", deviceType, deviceNumber, bridge.topicRoot());
    }

    @Override
    public synchronized void disconnect() {
        if (attached) {
            bridge.detach();
            attached = false;
        }
        metrics.connectionState(BackendMetricsRecorder.DISCONNECTED, null);
    }

    @Override
    public synchronized boolean isConnected() {
        return attached && bridge.isUp();
    }

    @Override
    public JsonNode get(String member, Map<String, String> params) throws BackendException {
        return call("GET", member, params);
    }

    @Override
    public JsonNode put(String member, Map<String, String> params) throws BackendException {
        return call("PUT", member, params);
    }

    @Override
    public void healthCheck() throws BackendException {
        if (!isConnected()) {
            throw new BackendException(BackendException.Kind.NOT_CONNECTED, "message bus not connected");
        }
        call("GET", "connected", Map.of());
    }

    @Override
    public BackendMetrics metrics() {
        return metrics.snapshot();
    }

    private JsonNode call(String httpMethod, String member, Map<String, String> params) throws BackendException {
        if (!isConnected()) {
            throw new BackendException(BackendException.Kind.NOT_CONNECTED,
                    deviceType + "/" + deviceNumber + " is not connected to the message bus");
        }
        long start = metrics.startNanos();
        try {
            BusResponse response = bridge.request(deviceType, deviceNumber, member, httpMethod, params,
                    config.timeout());
            if (response.errorNumber() != 0) {
                throw BackendException.remoteError(response.errorNumber(),
                        response.errorMessage() == null ? "" : response.errorMessage());
            }
            metrics.record(start, true);
            JsonNode value = response.value();
            return value == null || value.isNull() ? null : value;
        } catch (BackendException e) {
            metrics.record(start, false);
            metrics.connectionState(BackendMetricsRecorder.CONNECTED, e.getMessage());
            throw e;
        }
    }
}
