package com.questrail.alpaca.backend.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.alpaca.backend.BackendException;
import com.questrail.alpaca.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * BusRequestBridge
 * =============================================================================
 * Request/response correlation over a {@link MessageBus} for one topic root.
 *
 * <p>Every backend sharing a topic root shares one bridge, so the response
 * subscription {@code {root}/response/+} exists once. The bridge subscribes
 * when the first backend attaches and unsubscribes when the last detaches.</p>
 *
 * <p>Each request gets a random id and a pending future. Responses with an
 * unknown id (late, duplicated or foreign) are logged and dropped. A request
 * whose response does not arrive within the timeout fails with
 * {@link BackendException.Kind#TIMEOUT} and its pending entry is removed.</p>
 */
public final class BusRequestBridge {

    private static final Logger log = LoggerFactory.getLogger(BusRequestBridge.class);

    private final MessageBus bus;
    private final String topicRoot;
    private final int qos;
    private final ObjectMapper mapper;
    private final WallClock wallClock;

    private final Map<String, CompletableFuture<BusResponse>> pending = new ConcurrentHashMap<>();
    private int attached;

    public BusRequestBridge(MessageBus bus, String topicRoot, int qos, ObjectMapper mapper, WallClock wallClock) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.topicRoot = Objects.requireNonNull(topicRoot, "topicRoot");
        this.qos = qos;
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public String topicRoot() {
        return topicRoot;
    }

    public String responseFilter() {
        return topicRoot + "/response/+";
    }

    public synchronized void attach() throws BackendException {
        if (attached == 0) {
            try {
                if (!bus.isConnected()) {
                    bus.connect();
                }
                bus.subscribe(responseFilter(), qos, this::onResponse);
            } catch (IOException e) {
                throw new BackendException(BackendException.Kind.UNAVAILABLE,
                        "message bus unavailable for " + topicRoot + ": " + e.getMessage(), e);
            }
            log.info("Subscribed to {}", responseFilter());
        }
        attached++;
    }

    public synchronized void detach() {
        if (attached == 0) {
            return;
        }
        attached--;
        if (attached == 0) {
            bus.unsubscribe(responseFilter());
            pending.forEach((id, future) -> future.completeExceptionally(
                    new BackendException(BackendException.Kind.NOT_CONNECTED, "bridge detached")));
            pending.clear();
            log.info("Unsubscribed from {}", responseFilter());
        }
    }

    public boolean isUp() {
        return bus.isConnected();
    }

    int pendingCount() {
        return pending.size();
    }

    /**
     * Publish one request and wait for its correlated response.
     *
     * @return the response; its error number is not interpreted here
     */
    public BusResponse request(String deviceType,
                               int deviceNumber,
                               String member,
                               String httpMethod,
                               Map<String, String> params,
                               Duration timeout) throws BackendException {
        if (!bus.isConnected()) {
            throw new BackendException(BackendException.Kind.NOT_CONNECTED, "message bus not connected");
        }

        String requestId = UUID.randomUUID().toString();
        BusRequest request = new BusRequest(requestId, deviceType, deviceNumber, member, httpMethod, params,
                wallClock.now());
        String topic = topicRoot + "/request/" + deviceType + "/" + deviceNumber + "/" + member;

        CompletableFuture<BusResponse> future = new CompletableFuture<>();
        pending.put(requestId, future);
        try {
            bus.publish(topic, qos, mapper.writeValueAsBytes(request));
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (JsonProcessingException e) {
            throw new BackendException(BackendException.Kind.PROTOCOL, "cannot encode request: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new BackendException(BackendException.Kind.UNAVAILABLE, "publish to " + topic + " failed", e);
        } catch (TimeoutException e) {
            throw new BackendException(BackendException.Kind.TIMEOUT,
                    member + " on " + deviceType + "/" + deviceNumber + " timed out after " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(BackendException.Kind.INTERRUPTED, member + " interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof BackendException be) {
                throw be;
            }
            throw new BackendException(BackendException.Kind.UNAVAILABLE, member + " failed", e.getCause());
        } finally {
            pending.remove(requestId);
        }
    }

    private void onResponse(String topic, byte[] payload) {
        BusResponse response;
        try {
            response = mapper.readValue(payload, BusResponse.class);
        } catch (IOException e) {
            log.warn("Malformed response on {}: {}", topic, e.getMessage());
            return;
        }
        CompletableFuture<BusResponse> future = response.requestId() == null ? null : pending.get(response.requestId());
        if (future == null) {
            log.debug("Dropping uncorrelated response {} on {}", response.requestId(), topic);
            return;
        }
        future.complete(response);
    }
}
