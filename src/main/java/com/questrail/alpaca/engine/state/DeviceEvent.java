package com.questrail.alpaca.engine.state;

import java.time.Instant;

/**
 * Inputs to {@link DeviceStateReducer}. Every event carries the wall-clock time
 * it was observed.
 */
public sealed interface DeviceEvent
        permits DeviceEvent.ConnectRequested, DeviceEvent.ConnectSucceeded, DeviceEvent.ConnectFailed,
                DeviceEvent.DisconnectRequested, DeviceEvent.HealthCheckPassed, DeviceEvent.HealthCheckFailed {

    Instant timestamp();

    record ConnectRequested(Instant timestamp) implements DeviceEvent {}

    record ConnectSucceeded(Instant timestamp) implements DeviceEvent {}

    record ConnectFailed(Instant timestamp, String reason) implements DeviceEvent {}

    record DisconnectRequested(Instant timestamp) implements DeviceEvent {}

    record HealthCheckPassed(Instant timestamp) implements DeviceEvent {}

    /**
     * @param reason probe error, or a note that the device reported itself disconnected
     */
    record HealthCheckFailed(Instant timestamp, String reason) implements DeviceEvent {}
}
