package com.questrail.alpaca.engine;

import com.questrail.alpaca.api.DeviceRole;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The devices making up one telescope, keyed by role. Immutable; the engine
 * replaces a pool wholesale.
 */
public final class TelescopePool {

    private final String telescopeId;
    private final Map<DeviceRole, ManagedDevice> devices;

    TelescopePool(String telescopeId, Map<DeviceRole, ManagedDevice> devices) {
        this.telescopeId = Objects.requireNonNull(telescopeId, "telescopeId");
        Map<DeviceRole, ManagedDevice> copy = new EnumMap<>(DeviceRole.class);
        copy.putAll(devices);
        this.devices = Collections.unmodifiableMap(copy);
    }

    public String telescopeId() {
        return telescopeId;
    }

    public Map<DeviceRole, ManagedDevice> devices() {
        return devices;
    }

    public Optional<ManagedDevice> device(DeviceRole role) {
        return Optional.ofNullable(devices.get(role));
    }

    TelescopePool without(String deviceId) {
        Map<DeviceRole, ManagedDevice> remaining = new EnumMap<>(DeviceRole.class);
        devices.forEach((role, md) -> {
            if (!md.deviceId().equals(deviceId)) {
                remaining.put(role, md);
            }
        });
        return new TelescopePool(telescopeId, remaining);
    }

    @Override
    public String toString() {
        return "TelescopePool[" + telescopeId + ", roles=" + devices.keySet() + "]";
    }
}
