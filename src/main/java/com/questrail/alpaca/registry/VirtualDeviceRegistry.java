package com.questrail.alpaca.registry;

import com.questrail.alpaca.api.DeviceType;
import com.questrail.alpaca.backend.BackendDeviceConfig;
import com.questrail.alpaca.config.ConfigurationException;
import com.questrail.alpaca.config.DeviceSettings;
import com.questrail.alpaca.config.ReflectorConfig;
import com.questrail.alpaca.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * VirtualDeviceRegistry
 * =============================================================================
 * The set of devices the reflector exposes, keyed by {@code (type, number)}.
 *
 * <h2>Ordering</h2>
 * Iteration follows registration order, which is configuration order. The
 * configured-devices listing depends on this.
 *
 * <h2>Concurrency</h2>
 * Request handlers read concurrently; writes only happen while the registry is
 * built at startup. A read/write lock guards the map.
 */
public final class VirtualDeviceRegistry {

    private static final Logger log = LoggerFactory.getLogger(VirtualDeviceRegistry.class);

    public static final String DRIVER_VERSION = "1.0.0";

    private final Map<DeviceKey, VirtualDevice> devices = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Builds a registry from a validated configuration.
     *
     * @throws ConfigurationException on an empty device list or a repeated key
     */
    public static VirtualDeviceRegistry fromConfig(ReflectorConfig config, WallClock clock) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(clock, "clock");
        if (config.devices() == null || config.devices().isEmpty()) {
            throw new ConfigurationException("at least one device must be configured");
        }

        VirtualDeviceRegistry registry = new VirtualDeviceRegistry();
        Instant now = clock.now();
        for (DeviceSettings d : config.devices()) {
            registry.register(createDevice(d, BackendDeviceConfig.from(d, config.backend()), now));
        }
        return registry;
    }

    static VirtualDevice createDevice(DeviceSettings d, BackendDeviceConfig backend, Instant now) {
        String uniqueId = d.uniqueId() == null || d.uniqueId().isBlank()
                ? UniqueIds.forDevice(d.type(), d.number())
                : d.uniqueId();
        return new VirtualDevice(
                DeviceKey.of(d.type(), d.number()),
                d.name(),
                d.description(),
                "Alpaca Reflector - " + d.type() + " Driver",
                DRIVER_VERSION,
                DeviceType.interfaceVersionOf(d.type()),
                uniqueId,
                backend,
                now);
    }

    /**
     * @throws ConfigurationException if a device with the same key is already registered
     */
    public void register(VirtualDevice device) {
        Objects.requireNonNull(device, "device");
        lock.writeLock().lock();
        try {
            if (devices.containsKey(device.key())) {
                throw new ConfigurationException("duplicate device: " + device.key());
            }
            devices.put(device.key(), device);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Virtual device registered: {} name='{}' uniqueId={} backend={}",
                device.key(), device.name(), device.uniqueId(), device.backendConfig().mode());
    }

    public Optional<VirtualDevice> find(String type, int number) {
        if (type == null || number < 0) {
            return Optional.empty();
        }
        return find(DeviceKey.of(type, number));
    }

    public Optional<VirtualDevice> find(DeviceKey key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(devices.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of all devices in registration order.
     */
    public List<VirtualDevice> list() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(devices.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return devices.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
