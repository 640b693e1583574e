package com.questrail.alpaca.backend.bus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.alpaca.api.AlpacaJson;
import com.questrail.alpaca.backend.BackendException;
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

/**
 * BusRequestBridgeTest
 * -----------------------------------------------------------------------------
 * Request/response correlation over the in-memory bus. A scripted device
 * subscribes to the request topics and answers on the response topic.
 */
class BusRequestBridgeTest {

    private static final Instant T0 = Instant.parse("2026-03-01T20:00:00Z");

    private final ObjectMapper mapper = AlpacaJson.newMapper();
    private InMemoryMessageBus bus;
    private BusRequestBridge bridge;

    @BeforeEach
    void setUp() throws IOException {
        bus = new InMemoryMessageBus();
        bridge = new BusRequestBridge(bus, "ascom/scope1", 1, mapper, new ManualWallClock(T0));
    }

    private void answerWith(String valueJson, int errorNumber, String errorMessage) throws IOException {
        bus.connect();
        bus.subscribe("ascom/scope1/request/#", 1, (topic, payload) -> {
            try {
                JsonNode request = mapper.readTree(payload);
                String id = request.get("request_id").asText();
                String reply = "{\"request_id\":\"" + id + "\",\"value\":" + valueJson
                        + ",\"error_number\":" + errorNumber + ",\"error_message\":\"" + errorMessage
                        + "\",\"timestamp\":\"2026-03-01T20:00:01Z\"}";
                bus.publish("ascom/scope1/response/" + id, 1, reply.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    @Test
    void requestIsPublishedAndCorrelatedResponseReturned() throws Exception {
        answerWith("12.5", 0, "");
        bridge.attach();

        BusResponse response = bridge.request("telescope", 0, "rightascension", "GET", Map.of(), Duration.ofSeconds(1));

        assertEquals(12.5, response.value().asDouble());
        assertEquals(0, response.errorNumber());
        assertEquals(0, bridge.pendingCount());

        InMemoryMessageBus.Published request = bus.published().get(0);
        assertEquals("ascom/scope1/request/telescope/0/rightascension", request.topic());
        assertEquals(1, request.qos());
        JsonNode body = mapper.readTree(request.payload());
        assertEquals("telescope", body.get("device_type").asText());
        assertEquals(0, body.get("device_number").asInt());
        assertEquals("rightascension", body.get("method").asText());
        assertEquals("GET", body.get("http_method").asText());
        assertTrue(body.has("timestamp"));
    }

    @Test
    void parametersTravelWithTheRequest() throws Exception {
        answerWith("null", 0, "");
        bridge.attach();

        bridge.request("focuser", 1, "move", "PUT", Map.of("Position", "1500"), Duration.ofSeconds(1));

        JsonNode body = mapper.readTree(bus.published().get(0).payload());
        assertEquals("1500", body.get("parameters").get("Position").asText());
    }

    @Test
    void remoteErrorIsReturnedUninterpreted() throws Exception {
        answerWith("null", 0x408, "parked");
        bridge.attach();

        BusResponse response = bridge.request("telescope", 0, "slewtocoordinates", "PUT", Map.of(), Duration.ofSeconds(1));

        assertEquals(0x408, response.errorNumber());
        assertEquals("parked", response.errorMessage());
    }

    @Test
    void missingResponseTimesOutAndClearsPending() throws Exception {
        bridge.attach();

        BackendException e = assertThrows(BackendException.class, () ->
                bridge.request("dome", 0, "azimuth", "GET", Map.of(), Duration.ofMillis(50)));

        assertEquals(BackendException.Kind.TIMEOUT, e.kind());
        assertEquals(0, bridge.pendingCount());
    }

    @Test
    void uncorrelatedResponsesAreDropped() throws Exception {
        bridge.attach();
        bus.publish("ascom/scope1/response/other", 1,
                "{\"request_id\":\"nobody\",\"value\":1,\"error_number\":0}".getBytes(StandardCharsets.UTF_8));
        bus.publish("ascom/scope1/response/garbage", 1, "not json".getBytes(StandardCharsets.UTF_8));

        assertEquals(0, bridge.pendingCount());
    }

    @Test
    void requestWhileBusDownIsNotConnected() {
        BackendException e = assertThrows(BackendException.class, () ->
                bridge.request("dome", 0, "azimuth", "GET", Map.of(), Duration.ofMillis(50)));
        assertEquals(BackendException.Kind.NOT_CONNECTED, e.kind());
    }

    @Test
    void subscriptionIsReferenceCounted() throws Exception {
        bridge.attach();
        bridge.attach();
        assertTrue(bus.isSubscribed("ascom/scope1/response/+"));
        assertEquals(1, bus.connectCount());

        bridge.detach();
        assertTrue(bus.isSubscribed("ascom/scope1/response/+"));
        bridge.detach();
        assertFalse(bus.isSubscribed("ascom/scope1/response/+"));
    }

    @Test
    void attachFailsWhenBrokerIsUnreachable() {
        bus.failConnect(true);
        BackendException e = assertThrows(BackendException.class, () -> bridge.attach());
        assertEquals(BackendException.Kind.UNAVAILABLE, e.kind());
    }

    @Test
    void topicFilterMatching() {
        assertTrue(InMemoryMessageBus.matches("a/+/c", "a/b/c"));
        assertTrue(InMemoryMessageBus.matches("a/#", "a/b/c/d"));
        assertFalse(InMemoryMessageBus.matches("a/+", "a/b/c"));
        assertFalse(InMemoryMessageBus.matches("a/b", "a/c"));
    }
}
