package com.questrail.alpaca.engine.state;

import java.util.Objects;

/**
 * DeviceStateReducer
 * -----------------------------------------------------------------------------
 * Pure transition function for one managed device:
 * {@code (state, event) -> state}.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>{@code ConnectRequested}: any state other than CONNECTED moves to
 *       CONNECTING; CONNECTED is unchanged</li>
 *   <li>{@code ConnectSucceeded}: CONNECTED, fail count 0, healthy now</li>
 *   <li>{@code ConnectFailed}: DISCONNECTED</li>
 *   <li>{@code DisconnectRequested}: CONNECTED or CONNECTING moves to
 *       DISCONNECTED with fail count 0; otherwise unchanged</li>
 *   <li>{@code HealthCheckPassed} while CONNECTED: fail count 0, healthy now,
 *       state unchanged</li>
 *   <li>{@code HealthCheckFailed} while CONNECTED: fail count + 1; the
 *       {@value #FAILURE_THRESHOLD}rd consecutive failure demotes to
 *       DISCONNECTED and resets the fail count</li>
 * </ul>
 * Health events outside CONNECTED are ignored.
 */
public final class DeviceStateReducer
{
    /** Consecutive failed health checks that demote a connected device. */
    public static final int FAILURE_THRESHOLD = 3;

    /**
     * @param newState   state after the event
     * @param transition {@code true} when the connection state changed
     */
    public record Result(ManagedDeviceState newState, boolean transition) {}

    public Result apply(ManagedDeviceState state, DeviceEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (event instanceof DeviceEvent.ConnectRequested e) {
            if (state.connected()) {
                return unchanged(state);
            }
            return moveTo(state, DeviceConnectionState.CONNECTING, e);
        }
        if (event instanceof DeviceEvent.ConnectSucceeded e) {
            ManagedDeviceState next = state
                    .withConnectionState(DeviceConnectionState.CONNECTED, e.timestamp())
                    .withHealthy(e.timestamp());
            return new Result(next, state.connectionState() != DeviceConnectionState.CONNECTED);
        }
        if (event instanceof DeviceEvent.ConnectFailed e) {
            return moveTo(state, DeviceConnectionState.DISCONNECTED, e);
        }
        if (event instanceof DeviceEvent.DisconnectRequested e) {
            if (state.connectionState() != DeviceConnectionState.CONNECTED
                    && state.connectionState() != DeviceConnectionState.CONNECTING) {
                return unchanged(state);
            }
            ManagedDeviceState next = state
                    .withConnectionState(DeviceConnectionState.DISCONNECTED, e.timestamp())
                    .withFailCount(0, e.timestamp());
            return new Result(next, true);
        }
        if (event instanceof DeviceEvent.HealthCheckPassed e) {
            if (!state.connected()) {
                return unchanged(state);
            }
            return new Result(state.withHealthy(e.timestamp()), false);
        }
        if (event instanceof DeviceEvent.HealthCheckFailed e) {
            return onHealthCheckFailed(state, e);
        }

        return unchanged(state);
    }

    private Result onHealthCheckFailed(ManagedDeviceState state, DeviceEvent.HealthCheckFailed e) {
        if (!state.connected()) {
            return unchanged(state);
        }

        int failures = state.failCount() + 1;
        if (failures < FAILURE_THRESHOLD) {
            return new Result(state.withFailCount(failures, e.timestamp()), false);
        }

        ManagedDeviceState demoted = state
                .withConnectionState(DeviceConnectionState.DISCONNECTED, e.timestamp())
                .withFailCount(0, e.timestamp());
        return new Result(demoted, true);
    }

    private static Result moveTo(ManagedDeviceState state, DeviceConnectionState target, DeviceEvent e) {
        if (state.connectionState() == target) {
            return unchanged(state);
        }
        return new Result(state.withConnectionState(target, e.timestamp()), true);
    }

    private static Result unchanged(ManagedDeviceState state) {
        return new Result(state, false);
    }
}
