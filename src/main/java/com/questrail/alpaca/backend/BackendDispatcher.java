package com.questrail.alpaca.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.alpaca.backend.bus.BusRequestBridge;
import com.questrail.alpaca.backend.bus.MessageBus;
import com.questrail.alpaca.config.ConfigurationException;
import com.questrail.alpaca.registry.DeviceKey;
import com.questrail.alpaca.registry.VirtualDevice;
import com.questrail.alpaca.registry.VirtualDeviceRegistry;
import com.questrail.alpaca.time.MonotonicClock;
import com.questrail.alpaca.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * BackendDispatcher
 * =============================================================================
 * Routes each virtual device's calls to the backend its configuration selects.
 *
 * <p>One {@link DeviceBackend} is created per registered device when the
 * dispatcher is built. Message-bus devices sharing a topic root share one
 * {@link BusRequestBridge}.</p>
 *
 * <p>The dispatcher does not serialize calls; concurrent calls for the same
 * device reach the backend concurrently.</p>
 */
public final class BackendDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BackendDispatcher.class);

    private final Map<DeviceKey, DeviceBackend> backends;

    BackendDispatcher(Map<DeviceKey, DeviceBackend> backends) {
        this.backends = Collections.unmodifiableMap(new LinkedHashMap<>(backends));
    }

    /**
     * @param messageBus bus for message-bus devices; may be {@code null} when
     *                   no device uses that mode
     * @throws ConfigurationException if a message-bus device exists but no bus was given
     */
    public static BackendDispatcher create(VirtualDeviceRegistry registry,
                                           HttpClient http,
                                           MessageBus messageBus,
                                           ObjectMapper mapper,
                                           MonotonicClock clock,
                                           WallClock wallClock) {
        Objects.requireNonNull(registry, "registry");
        Map<DeviceKey, DeviceBackend> backends = new LinkedHashMap<>();
        Map<String, BusRequestBridge> bridges = new HashMap<>();

        for (VirtualDevice device : registry.list()) {
            BackendDeviceConfig cfg = device.backendConfig();
            DeviceBackend backend;
            if (cfg instanceof BackendDeviceConfig.NetworkBackend network) {
                backend = new NetworkDeviceBackend(network, http, mapper, clock, wallClock);
            } else if (cfg instanceof BackendDeviceConfig.MqttBackend mqtt) {
                if (messageBus == null) {
                    throw new ConfigurationException("device " + device.key() + " uses the mqtt backend but no message bus is configured");
                }
                BusRequestBridge bridge = bridges.computeIfAbsent(mqtt.topicRoot(),
                        root -> new BusRequestBridge(messageBus, root, mqtt.qos(), mapper, wallClock));
                backend = new MessageBusDeviceBackend(mqtt, device.deviceType(), device.deviceNumber(), bridge,
                        clock, wallClock);
            } else if (cfg instanceof BackendDeviceConfig.DirectBackend direct) {
                backend = new UnimplementedDeviceBackend(direct.mode());
            } else {
                throw new ConfigurationException("unsupported backend for " + device.key() + ": " + cfg);
            }
            backends.put(device.key(), backend);
            log.debug("Backend for {}: {}", device.key(), cfg);
        }
        return new BackendDispatcher(backends);
    }

    public Optional<DeviceBackend> backendFor(DeviceKey key) {
        return Optional.ofNullable(backends.get(key));
    }

    public JsonNode get(VirtualDevice device, String member, Map<String, String> params) throws BackendException {
        return require(device).get(member, params);
    }

    public JsonNode put(VirtualDevice device, String member, Map<String, String> params) throws BackendException {
        return require(device).put(member, params);
    }

    /**
     * Metrics per device in registry order.
     */
    public Map<DeviceKey, BackendMetrics> metrics() {
        Map<DeviceKey, BackendMetrics> out = new LinkedHashMap<>();
        backends.forEach((key, backend) -> out.put(key, backend.metrics()));
        return out;
    }

    public void disconnectAll() {
        backends.forEach((key, backend) -> {
            try {
                backend.disconnect();
            } catch (RuntimeException e) {
                log.warn("Disconnect of {} failed", key, e);
            }
        });
    }

    private DeviceBackend require(VirtualDevice device) throws BackendException {
        DeviceBackend backend = backends.get(device.key());
        if (backend == null) {
            throw new BackendException(BackendException.Kind.NOT_IMPLEMENTED, "no backend for " + device.key());
        }
        return backend;
    }
}
