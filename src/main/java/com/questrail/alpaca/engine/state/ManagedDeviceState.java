package com.questrail.alpaca.engine.state;

import java.time.Instant;
import java.util.Objects;

/**
 * ManagedDeviceState
 * -----------------------------------------------------------------------------
 * Immutable connection and health state of one managed device.
 *
 * <p>Carries no behavior; transitions are computed by
 * {@link DeviceStateReducer}.</p>
 */
public final class ManagedDeviceState
{
    private final DeviceConnectionState connectionState;
    private final int failCount;
    private final Instant lastHealthy;
    private final Instant lastChange;

    private ManagedDeviceState(DeviceConnectionState connectionState,
                               int failCount,
                               Instant lastHealthy,
                               Instant lastChange) {
        this.connectionState = Objects.requireNonNull(connectionState, "connectionState");
        if (failCount < 0) {
            throw new IllegalArgumentException("failCount must be >= 0");
        }
        this.failCount = failCount;
        this.lastHealthy = lastHealthy;
        this.lastChange = Objects.requireNonNull(lastChange, "lastChange");
    }

    /**
     * State of a freshly registered device.
     */
    public static ManagedDeviceState initial(Instant registeredAt) {
        return new ManagedDeviceState(DeviceConnectionState.UNKNOWN, 0, null, registeredAt);
    }

    public DeviceConnectionState connectionState() {
        return connectionState;
    }

    public boolean connected() {
        return connectionState == DeviceConnectionState.CONNECTED;
    }

    public int failCount() {
        return failCount;
    }

    /** Last successful connect or health check; {@code null} if never. */
    public Instant lastHealthy() {
        return lastHealthy;
    }

    public Instant lastChange() {
        return lastChange;
    }

    // ---------------------------------------------------------------------
    // Transition helpers
    // ---------------------------------------------------------------------

    public ManagedDeviceState withConnectionState(DeviceConnectionState state, Instant now) {
        return new ManagedDeviceState(state, failCount, lastHealthy, now);
    }

    public ManagedDeviceState withFailCount(int count, Instant now) {
        return new ManagedDeviceState(connectionState, count, lastHealthy, now);
    }

    public ManagedDeviceState withHealthy(Instant now) {
        return new ManagedDeviceState(connectionState, 0, now, now);
    }

    @Override
    public String toString() {
        return "ManagedDeviceState[" + connectionState + ", failCount=" + failCount
                + ", lastHealthy=" + lastHealthy + "]";
    }
}
