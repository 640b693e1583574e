package com.questrail.alpaca.engine.observability;

import com.questrail.alpaca.engine.state.DeviceEvent;
import com.questrail.alpaca.engine.state.ManagedDeviceState;

import java.time.Instant;

/**
 * A managed device moved from one connection state to another.
 */
public record DeviceStateTransitionEvent(
    Instant timestamp,
    String deviceId,
    ManagedDeviceState oldState,
    ManagedDeviceState newState,
    DeviceEvent triggeringEvent
) {
    /**
     * True when a health-check failure caused the device to be marked disconnected.
     */
    public boolean isDemotion() {
        return oldState.connected() && !newState.connected()
                && triggeringEvent instanceof DeviceEvent.HealthCheckFailed;
    }
}
