package com.questrail.alpaca.engine;

import com.questrail.alpaca.engine.state.DeviceConnectionState;
import com.questrail.alpaca.engine.state.ManagedDeviceState;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A registered device plus its connection and health state.
 *
 * <p>State is replaced only while holding the device's own lock, which also
 * serializes connect, disconnect and health probes for this device. Readers
 * see the latest published {@link ManagedDeviceState} without locking.</p>
 */
public final class ManagedDevice {

    private final AlpacaDevice device;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile ManagedDeviceState state;

    ManagedDevice(AlpacaDevice device, Instant registeredAt) {
        this.device = Objects.requireNonNull(device, "device");
        this.state = ManagedDeviceState.initial(registeredAt);
    }

    public AlpacaDevice device() {
        return device;
    }

    public String deviceId() {
        return device.deviceId();
    }

    public ManagedDeviceState state() {
        return state;
    }

    public DeviceConnectionState connectionState() {
        return state.connectionState();
    }

    public boolean connected() {
        return state.connected();
    }

    public int failCount() {
        return state.failCount();
    }

    public Instant lastHealthy() {
        return state.lastHealthy();
    }

    ReentrantLock lock() {
        return lock;
    }

    void publish(ManagedDeviceState next) {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("state change without holding the device lock");
        }
        this.state = Objects.requireNonNull(next, "next");
    }

    @Override
    public String toString() {
        return "ManagedDevice[" + device.deviceId() + ", " + state + "]";
    }
}
