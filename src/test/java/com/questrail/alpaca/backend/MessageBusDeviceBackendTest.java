package com.questrail.alpaca.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.alpaca.api.AlpacaJson;
import com.questrail.alpaca.backend.bus.BusRequestBridge;
import com.questrail.alpaca.backend.bus.InMemoryMessageBus;
import com.questrail.alpaca.time.ManualMonotonicClock;
import com.questrail.alpaca.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageBusDeviceBackendTest {

    private final ObjectMapper mapper = AlpacaJson.newMapper();
    private final ManualWallClock wallClock = new ManualWallClock(Instant.parse("2026-01-01T00:00:00Z"));
    private InMemoryMessageBus bus;
    private MessageBusDeviceBackend backend;

    @BeforeEach
    void setUp() {
        bus = new InMemoryMessageBus();
        BackendDeviceConfig.MqttBackend config = new BackendDeviceConfig.MqttBackend(
                "tcp://broker:1883", "scope1", "reflector", null, null, Duration.ofMillis(200), 1, "ascom");
        BusRequestBridge bridge = new BusRequestBridge(bus, config.topicRoot(), config.qos(), mapper, wallClock);
        backend = new MessageBusDeviceBackend(config, "focuser", 0, bridge, new ManualMonotonicClock(), wallClock);
    }

    private void device(String valueJson, int errorNumber) throws IOException {
        bus.connect();
        bus.subscribe("ascom/scope1/request/focuser/0/+", 1, (topic, payload) -> {
            try {
                String id = mapper.readTree(payload).get("request_id").asText();
                bus.publish("ascom/scope1/response/" + id, 1, ("{\"request_id\":\"" + id + "\",\"value\":" + valueJson
                        + ",\"error_number\":" + errorNumber + ",\"error_message\":\"device says no\"}")
                        .getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    @Test
    void callsBeforeConnectAreNotConnected() {
        BackendException e = assertThrows(BackendException.class, () -> backend.get("position", Map.of()));
        assertEquals(BackendException.Kind.NOT_CONNECTED, e.kind());
    }

    @Test
    void valueIsReturnedAfterConnect() throws Exception {
        device("4200", 0);
        backend.connect();

        JsonNode value = backend.get("position", Map.of());

        assertEquals(4200, value.asInt());
        assertEquals(1, backend.metrics().successfulRequests());
        assertEquals("connected", backend.metrics().connectionState());
    }

    @Test
    void nonZeroErrorNumberBecomesRemoteError() throws Exception {
        device("null", 0x401);
        backend.connect();

        BackendException e = assertThrows(BackendException.class, () -> backend.put("move", Map.of("Position", "-1")));

        assertEquals(BackendException.Kind.REMOTE_ERROR, e.kind());
        assertEquals(0x401, e.remoteErrorNumber());
        assertTrue(e.getMessage().contains("device says no"));
    }

    @Test
    void silentDeviceTimesOut() throws Exception {
        backend.connect();

        BackendException e = assertThrows(BackendException.class, () -> backend.get("position", Map.of()));

        assertEquals(BackendException.Kind.TIMEOUT, e.kind());
        assertEquals(1, backend.metrics().failedRequests());
    }

    @Test
    void brokerDropMakesBackendDisconnected() throws Exception {
        backend.connect();
        assertTrue(backend.isConnected());

        bus.drop();

        assertFalse(backend.isConnected());
        BackendException e = assertThrows(BackendException.class, backend::healthCheck);
        assertEquals(BackendException.Kind.NOT_CONNECTED, e.kind());
    }

    @Test
    void disconnectReleasesSubscription() throws Exception {
        backend.connect();
        assertTrue(bus.isSubscribed("ascom/scope1/response/+"));

        backend.disconnect();

        assertFalse(bus.isSubscribed("ascom/scope1/response/+"));
        assertFalse(backend.isConnected());
    }
}
