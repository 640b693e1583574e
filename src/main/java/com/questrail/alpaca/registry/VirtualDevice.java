package com.questrail.alpaca.registry;

import com.questrail.alpaca.backend.BackendDeviceConfig;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * VirtualDevice
 * -----------------------------------------------------------------------------
 * One device exposed by the reflector.
 *
 * <p>The ASCOM metadata and backend descriptor are fixed at startup. The
 * {@code connected} flag, {@code lastUpdate} and the state cache are refreshed
 * by request handlers as backend answers come in; they are safe to read from
 * any thread.</p>
 */
public final class VirtualDevice {

    private final DeviceKey key;
    private final String name;
    private final String description;
    private final String driverInfo;
    private final String driverVersion;
    private final int interfaceVersion;
    private final String uniqueId;
    private final BackendDeviceConfig backendConfig;

    private volatile boolean connected;
    private volatile Instant lastUpdate;
    private final Map<String, Object> stateCache = new ConcurrentHashMap<>();

    public VirtualDevice(DeviceKey key,
                         String name,
                         String description,
                         String driverInfo,
                         String driverVersion,
                         int interfaceVersion,
                         String uniqueId,
                         BackendDeviceConfig backendConfig,
                         Instant createdAt) {
        this.key = Objects.requireNonNull(key, "key");
        this.name = Objects.requireNonNull(name, "name");
        this.description = Objects.requireNonNull(description, "description");
        this.driverInfo = Objects.requireNonNull(driverInfo, "driverInfo");
        this.driverVersion = Objects.requireNonNull(driverVersion, "driverVersion");
        this.interfaceVersion = interfaceVersion;
        this.uniqueId = Objects.requireNonNull(uniqueId, "uniqueId");
        this.backendConfig = Objects.requireNonNull(backendConfig, "backendConfig");
        this.lastUpdate = Objects.requireNonNull(createdAt, "createdAt");
    }

    public DeviceKey key() {
        return key;
    }

    public String deviceType() {
        return key.type();
    }

    public int deviceNumber() {
        return key.number();
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public String driverInfo() {
        return driverInfo;
    }

    public String driverVersion() {
        return driverVersion;
    }

    public int interfaceVersion() {
        return interfaceVersion;
    }

    public String uniqueId() {
        return uniqueId;
    }

    public BackendDeviceConfig backendConfig() {
        return backendConfig;
    }

    public boolean connected() {
        return connected;
    }

    public Instant lastUpdate() {
        return lastUpdate;
    }

    public void markConnected(boolean connected, Instant now) {
        this.connected = connected;
        this.lastUpdate = now;
    }

    /**
     * Remembers the last value a backend returned for a member. Null values are
     * not cached.
     */
    public void cacheValue(String member, Object value, Instant now) {
        if (value == null) {
            stateCache.remove(member);
        } else {
            stateCache.put(member, value);
        }
        this.lastUpdate = now;
    }

    public Map<String, Object> stateCache() {
        return Map.copyOf(stateCache);
    }

    @Override
    public String toString() {
        return "VirtualDevice[" + key + ", name=" + name + ", backend=" + backendConfig.mode() + "]";
    }
}
