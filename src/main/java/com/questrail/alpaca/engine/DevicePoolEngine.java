package com.questrail.alpaca.engine;

import com.questrail.alpaca.api.DeviceRole;
import com.questrail.alpaca.api.HealthCheckResult;
import com.questrail.alpaca.api.HealthChecker;
import com.questrail.alpaca.api.HealthStatus;
import com.questrail.alpaca.discovery.AlpacaDiscoveryScanner;
import com.questrail.alpaca.discovery.DiscoveredServer;
import com.questrail.alpaca.engine.client.AlpacaDeviceClient;
import com.questrail.alpaca.engine.observability.DeviceHealthCheckEvent;
import com.questrail.alpaca.engine.observability.DevicePoolErrorEvent;
import com.questrail.alpaca.engine.observability.DevicePoolObservabilitySink;
import com.questrail.alpaca.engine.observability.DeviceStateTransitionEvent;
import com.questrail.alpaca.engine.observability.NullDevicePoolObservabilitySink;
import com.questrail.alpaca.engine.state.DeviceEvent;
import com.questrail.alpaca.engine.state.DeviceStateReducer;
import com.questrail.alpaca.engine.state.ManagedDeviceState;
import com.questrail.alpaca.time.Cancellable;
import com.questrail.alpaca.time.MonotonicClock;
import com.questrail.alpaca.time.MonotonicScheduler;
import com.questrail.alpaca.time.SystemMonotonicClock;
import com.questrail.alpaca.time.SystemWallClock;
import com.questrail.alpaca.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * DevicePoolEngine
 * =============================================================================
 * Client-side manager for Alpaca devices on other servers.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>discover Alpaca servers and list their devices (never registers them)</li>
 *   <li>keep a registry of managed devices and their connection state</li>
 *   <li>group devices into telescope pools by role</li>
 *   <li>probe connected devices on a fixed interval and demote a device after
 *       {@value DeviceStateReducer#FAILURE_THRESHOLD} consecutive failures</li>
 *   <li>report aggregate health through {@link HealthChecker}</li>
 * </ul>
 *
 * <h2>State</h2>
 * Every connection-state change goes through {@link DeviceStateReducer}. The
 * device and telescope maps are guarded by a read/write lock; each device's
 * state by the device's own lock. The health ticker never holds the map lock
 * while probing.
 *
 * <h2>Failure policy</h2>
 * A failed probe is retried on the next tick; there is no backoff and no
 * automatic reconnection after demotion.
 */
public final class DevicePoolEngine implements HealthChecker {

    private static final Logger log = LoggerFactory.getLogger(DevicePoolEngine.class);

    public static final String COMPONENT_NAME = "device_pool_engine";
    public static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(30);

    private final AlpacaDeviceClient client;
    private final AlpacaDiscoveryScanner scanner;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final MonotonicScheduler scheduler;
    private final DevicePoolObservabilitySink sink;
    private final Duration healthCheckInterval;
    private final DeviceStateReducer reducer = new DeviceStateReducer();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ManagedDevice> devices = new LinkedHashMap<>();
    private final Map<String, TelescopePool> telescopes = new LinkedHashMap<>();

    private final Object tickerLock = new Object();
    private boolean running;
    private Cancellable nextTick;

    private DevicePoolEngine(Builder b) {
        this.client = b.client;
        this.scanner = b.scanner;
        this.clock = b.clock;
        this.wallClock = b.wallClock;
        this.scheduler = b.scheduler;
        this.sink = b.sink;
        this.healthCheckInterval = b.healthCheckInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Start the health ticker. The first round runs one interval from now.
     */
    public void start() {
        synchronized (tickerLock) {
            if (running) {
                return;
            }
            running = true;
            scheduleNextTick();
        }
        log.info("Device pool engine started, health check interval {}", healthCheckInterval);
    }

    /**
     * Stop the health ticker. A round already in progress finishes; no further
     * round is scheduled.
     */
    public void stop() {
        synchronized (tickerLock) {
            running = false;
            if (nextTick != null) {
                nextTick.cancel();
                nextTick = null;
            }
        }
        log.info("Device pool engine stopped");
    }

    private void scheduleNextTick() {
        nextTick = scheduler.scheduleAfter(healthCheckInterval, clock, this::onTick);
    }

    private void onTick() {
        try {
            performHealthChecks();
        } catch (RuntimeException e) {
            sink.onError(new DevicePoolErrorEvent(wallClock.now(), null, "health check round failed", e));
        } finally {
            synchronized (tickerLock) {
                if (running) {
                    scheduleNextTick();
                }
            }
        }
    }

    // ---------------------------------------------------------------------
    // Discovery
    // ---------------------------------------------------------------------

    /**
     * Broadcast a discovery probe on {@code port} and list the devices of every
     * server that answers within the scanner's default timeout.
     */
    public List<AlpacaDevice> discoverDevices(int port) throws DeviceEngineException {
        return discoverDevices(port, AlpacaDiscoveryScanner.DEFAULT_TIMEOUT);
    }

    /**
     * A server whose device list cannot be fetched is skipped. The registry is
     * not changed.
     */
    public List<AlpacaDevice> discoverDevices(int port, Duration timeout) throws DeviceEngineException {
        log.info("Starting device discovery on port {}", port);
        List<DiscoveredServer> servers;
        try {
            servers = scanner.scan(port, timeout);
        } catch (IllegalArgumentException e) {
            throw new DeviceEngineException(DeviceEngineException.Kind.DISCOVERY_FAILED,
                    "discovery failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new DeviceEngineException(DeviceEngineException.Kind.DISCOVERY_FAILED,
                    "discovery failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeviceEngineException(DeviceEngineException.Kind.INTERRUPTED, "discovery interrupted", e);
        }

        List<AlpacaDevice> found = new ArrayList<>();
        for (DiscoveredServer server : servers) {
            try {
                found.addAll(client.getConfiguredDevices(server.baseUrl()));
            } catch (DeviceEngineException e) {
                log.warn("Cannot list devices of {}: {}", server.baseUrl(), e.getMessage());
            }
        }
        log.info("Discovery complete: {} servers, {} devices", servers.size(), found.size());
        return found;
    }

    // ---------------------------------------------------------------------
    // Registry
    // ---------------------------------------------------------------------

    /**
     * Add a device in state UNKNOWN. It is not connected.
     */
    public ManagedDevice registerDevice(AlpacaDevice device) throws DeviceEngineException {
        Objects.requireNonNull(device, "device");
        lock.writeLock().lock();
        try {
            if (devices.containsKey(device.deviceId())) {
                throw new DeviceEngineException(DeviceEngineException.Kind.ALREADY_REGISTERED,
                        "device " + device.deviceId() + " already registered");
            }
            ManagedDevice md = new ManagedDevice(device, wallClock.now());
            devices.put(device.deviceId(), md);
            log.info("Registered device {}", device.deviceId());
            return md;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove a device, disconnecting it first when connected. The device is
     * also dropped from every telescope pool that referenced it.
     */
    public void unregisterDevice(String deviceId) throws DeviceEngineException {
        ManagedDevice md = require(deviceId);
        disconnect(md);

        lock.writeLock().lock();
        try {
            devices.remove(deviceId);
            telescopes.replaceAll((id, pool) -> pool.without(deviceId));
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Unregistered device {}", deviceId);
    }

    public ManagedDevice getDevice(String deviceId) throws DeviceEngineException {
        return require(deviceId);
    }

    /** Managed devices in registration order. */
    public List<ManagedDevice> listDevices() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(devices.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isDeviceConnected(String deviceId) throws DeviceEngineException {
        return require(deviceId).connected();
    }

    // ---------------------------------------------------------------------
    // Connection
    // ---------------------------------------------------------------------

    /**
     * Connect a registered device. Already connected is a no-op. On failure the
     * device ends DISCONNECTED and the cause is rethrown.
     */
    public void connectDevice(String deviceId) throws DeviceEngineException {
        ManagedDevice md = require(deviceId);
        md.lock().lock();
        try {
            if (md.connected()) {
                return;
            }
            apply(md, new DeviceEvent.ConnectRequested(wallClock.now()));
            try {
                client.connect(md.device());
            } catch (DeviceEngineException e) {
                apply(md, new DeviceEvent.ConnectFailed(wallClock.now(), e.getMessage()));
                throw new DeviceEngineException(DeviceEngineException.Kind.CONNECTION_FAILED,
                        "failed to connect " + deviceId + ": " + e.getMessage(), e.ascomErrorNumber(), e);
            }
            apply(md, new DeviceEvent.ConnectSucceeded(wallClock.now()));
        } finally {
            md.lock().unlock();
        }
    }

    /**
     * Disconnect a registered device. Not connected is a no-op. The local state
     * changes even when the remote side does not acknowledge.
     */
    public void disconnectDevice(String deviceId) throws DeviceEngineException {
        disconnect(require(deviceId));
    }

    private void disconnect(ManagedDevice md) {
        md.lock().lock();
        try {
            if (!md.connected()) {
                return;
            }
            try {
                client.disconnect(md.device());
            } catch (DeviceEngineException e) {
                sink.onError(new DevicePoolErrorEvent(wallClock.now(), md.deviceId(),
                        "remote disconnect failed: " + e.getMessage(), e));
            }
            apply(md, new DeviceEvent.DisconnectRequested(wallClock.now()));
        } finally {
            md.lock().unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Telescope pools
    // ---------------------------------------------------------------------

    /**
     * Define or replace a telescope pool. Every referenced device must be
     * registered; otherwise nothing changes.
     */
    public TelescopePool registerTelescope(String telescopeId, Map<DeviceRole, String> roles)
            throws DeviceEngineException {
        Objects.requireNonNull(telescopeId, "telescopeId");
        Objects.requireNonNull(roles, "roles");
        lock.writeLock().lock();
        try {
            Map<DeviceRole, ManagedDevice> members = new EnumMap<>(DeviceRole.class);
            for (Map.Entry<DeviceRole, String> e : roles.entrySet()) {
                ManagedDevice md = devices.get(e.getValue());
                if (md == null) {
                    throw new DeviceNotFoundException("device " + e.getValue() + " not registered");
                }
                members.put(e.getKey(), md);
            }
            TelescopePool pool = new TelescopePool(telescopeId, members);
            telescopes.put(telescopeId, pool);
            log.info("Registered telescope {} with roles {}", telescopeId, members.keySet());
            return pool;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Remove a telescope pool; unknown ids are ignored. */
    public void unregisterTelescope(String telescopeId) {
        lock.writeLock().lock();
        try {
            if (telescopes.remove(telescopeId) != null) {
                log.info("Unregistered telescope {}", telescopeId);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ManagedDevice getTelescopeDevice(String telescopeId, DeviceRole role) throws DeviceEngineException {
        TelescopePool pool;
        lock.readLock().lock();
        try {
            pool = telescopes.get(telescopeId);
        } finally {
            lock.readLock().unlock();
        }
        if (pool == null) {
            throw new DeviceNotFoundException("telescope " + telescopeId + " not registered");
        }
        return pool.device(role).orElseThrow(() ->
                new DeviceNotFoundException("telescope " + telescopeId + " has no " + role.wireName() + " device"));
    }

    public AlpacaDeviceClient client() {
        return client;
    }

    // ---------------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------------

    /**
     * One probe of every connected device. Public for deterministic tests and
     * for on-demand checks.
     */
    public void performHealthChecks() {
        List<ManagedDevice> toCheck = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (ManagedDevice md : devices.values()) {
                if (md.connected()) {
                    toCheck.add(md);
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        for (ManagedDevice md : toCheck) {
            checkDeviceHealth(md);
        }
    }

    private void checkDeviceHealth(ManagedDevice md) {
        md.lock().lock();
        try {
            if (!md.connected()) {
                return;
            }
            long start = clock.nowNanos();
            String failure = null;
            try {
                if (!client.isConnected(md.device())) {
                    failure = "device reports not connected";
                }
            } catch (DeviceEngineException e) {
                failure = e.getMessage();
            }
            Duration elapsed = Duration.ofNanos(clock.nowNanos() - start);
            Instant now = wallClock.now();

            DeviceEvent event = failure == null
                    ? new DeviceEvent.HealthCheckPassed(now)
                    : new DeviceEvent.HealthCheckFailed(now, failure);
            ManagedDeviceState before = md.state();
            ManagedDeviceState after = apply(md, event);

            int failCount = failure != null && before.connected() && !after.connected()
                    ? DeviceStateReducer.FAILURE_THRESHOLD
                    : after.failCount();
            sink.onHealthCheck(new DeviceHealthCheckEvent(now, md.deviceId(), failure == null, failCount,
                    elapsed, failure));
        } finally {
            md.lock().unlock();
        }
    }

    @Override
    public String name() {
        return COMPONENT_NAME;
    }

    /**
     * Aggregate health: unhealthy when devices are registered but none is
     * connected, degraded when a connected device has failed probes, healthy
     * otherwise.
     */
    @Override
    public HealthCheckResult check() {
        long start = clock.nowNanos();
        int total;
        int connected = 0;
        int healthy = 0;
        int telescopeCount;

        lock.readLock().lock();
        try {
            total = devices.size();
            telescopeCount = telescopes.size();
            for (ManagedDevice md : devices.values()) {
                ManagedDeviceState s = md.state();
                if (s.connected()) {
                    connected++;
                    if (s.failCount() == 0) {
                        healthy++;
                    }
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        HealthStatus status = HealthStatus.HEALTHY;
        String message = String.format("device pool healthy: %d/%d devices connected, %d healthy",
                connected, total, healthy);
        if (total > 0 && connected == 0) {
            status = HealthStatus.UNHEALTHY;
            message = "No devices connected";
        } else if (connected > 0 && healthy < connected) {
            status = HealthStatus.DEGRADED;
            message = String.format("Some devices unhealthy: %d/%d", healthy, connected);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("total_devices", total);
        details.put("connected_devices", connected);
        details.put("healthy_devices", healthy);
        details.put("telescope_count", telescopeCount);

        return new HealthCheckResult(COMPONENT_NAME, status, message, wallClock.now(),
                Duration.ofNanos(clock.nowNanos() - start), details);
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private ManagedDevice require(String deviceId) throws DeviceNotFoundException {
        lock.readLock().lock();
        try {
            ManagedDevice md = devices.get(deviceId);
            if (md == null) {
                throw new DeviceNotFoundException("device " + deviceId + " not registered");
            }
            return md;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Caller holds the device lock. */
    private ManagedDeviceState apply(ManagedDevice md, DeviceEvent event) {
        ManagedDeviceState before = md.state();
        DeviceStateReducer.Result result = reducer.apply(before, event);
        md.publish(result.newState());
        if (result.transition()) {
            sink.onStateTransition(new DeviceStateTransitionEvent(event.timestamp(), md.deviceId(),
                    before, result.newState(), event));
        }
        return result.newState();
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private AlpacaDeviceClient client;
        private AlpacaDiscoveryScanner scanner;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private DevicePoolObservabilitySink sink = NullDevicePoolObservabilitySink.INSTANCE;
        private Duration healthCheckInterval = DEFAULT_HEALTH_CHECK_INTERVAL;

        public Builder withClient(AlpacaDeviceClient client) {
            this.client = client;
            return this;
        }

        public Builder withScanner(AlpacaDiscoveryScanner scanner) {
            this.scanner = scanner;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withObservabilitySink(DevicePoolObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        /** Zero or negative selects the default interval. */
        public Builder withHealthCheckInterval(Duration interval) {
            this.healthCheckInterval = interval == null || interval.isZero() || interval.isNegative()
                    ? DEFAULT_HEALTH_CHECK_INTERVAL
                    : interval;
            return this;
        }

        public DevicePoolEngine build() {
            Objects.requireNonNull(client, "client");
            Objects.requireNonNull(scanner, "scanner");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(scheduler, "scheduler");
            Objects.requireNonNull(sink, "sink");
            return new DevicePoolEngine(this);
        }
    }
}
