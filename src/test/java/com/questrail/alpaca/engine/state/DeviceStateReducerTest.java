package com.questrail.alpaca.engine.state;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DeviceStateReducerTest
 * -----------------------------------------------------------------------------
 * Unit tests for the pure managed-device reducer. No transports, no timers,
 * no threads: a prior state and an event in, the next state out.
 */
class DeviceStateReducerTest {

    private DeviceStateReducer reducer;
    private Instant t0;

    @BeforeEach
    void setUp() {
        reducer = new DeviceStateReducer();
        t0 = Instant.parse("2026-01-01T00:00:00Z");
    }

    private Instant at(int seconds) {
        return t0.plusSeconds(seconds);
    }

    private ManagedDeviceState connected() {
        ManagedDeviceState s = ManagedDeviceState.initial(t0);
        s = reducer.apply(s, new DeviceEvent.ConnectRequested(at(1))).newState();
        return reducer.apply(s, new DeviceEvent.ConnectSucceeded(at(2))).newState();
    }

    private ManagedDeviceState fail(ManagedDeviceState s, int at) {
        return reducer.apply(s, new DeviceEvent.HealthCheckFailed(at(at), "timeout")).newState();
    }

    @Test
    void freshDeviceIsUnknownWithNoHistory() {
        ManagedDeviceState s = ManagedDeviceState.initial(t0);
        assertEquals(DeviceConnectionState.UNKNOWN, s.connectionState());
        assertFalse(s.connected());
        assertEquals(0, s.failCount());
        assertNull(s.lastHealthy());
    }

    @Test
    void connectPathGoesThroughConnecting() {
        ManagedDeviceState s = ManagedDeviceState.initial(t0);

        DeviceStateReducer.Result r1 = reducer.apply(s, new DeviceEvent.ConnectRequested(at(1)));
        assertTrue(r1.transition());
        assertEquals(DeviceConnectionState.CONNECTING, r1.newState().connectionState());

        DeviceStateReducer.Result r2 = reducer.apply(r1.newState(), new DeviceEvent.ConnectSucceeded(at(2)));
        assertTrue(r2.transition());
        assertEquals(DeviceConnectionState.CONNECTED, r2.newState().connectionState());
        assertEquals(at(2), r2.newState().lastHealthy());
        assertEquals(0, r2.newState().failCount());
    }

    @Test
    void failedConnectEndsDisconnected() {
        ManagedDeviceState s = reducer.apply(ManagedDeviceState.initial(t0),
                new DeviceEvent.ConnectRequested(at(1))).newState();

        DeviceStateReducer.Result r = reducer.apply(s, new DeviceEvent.ConnectFailed(at(2), "refused"));
        assertTrue(r.transition());
        assertEquals(DeviceConnectionState.DISCONNECTED, r.newState().connectionState());
    }

    @Test
    void connectRequestWhileConnectedIsIgnored() {
        ManagedDeviceState s = connected();
        DeviceStateReducer.Result r = reducer.apply(s, new DeviceEvent.ConnectRequested(at(5)));
        assertFalse(r.transition());
        assertSame(s, r.newState());
    }

    @Test
    void twoFailuresOnlyCount() {
        ManagedDeviceState s = connected();
        s = fail(s, 10);
        s = fail(s, 20);
        assertTrue(s.connected());
        assertEquals(2, s.failCount());
    }

    @Test
    void thirdConsecutiveFailureDemotesAndResetsCount() {
        ManagedDeviceState s = fail(fail(connected(), 10), 20);

        DeviceStateReducer.Result r = reducer.apply(s, new DeviceEvent.HealthCheckFailed(at(30), "timeout"));
        assertTrue(r.transition());
        assertEquals(DeviceConnectionState.DISCONNECTED, r.newState().connectionState());
        assertEquals(0, r.newState().failCount());
    }

    @Test
    void successInBetweenResetsTheCount() {
        ManagedDeviceState s = fail(fail(connected(), 10), 20);

        DeviceStateReducer.Result passed = reducer.apply(s, new DeviceEvent.HealthCheckPassed(at(25)));
        assertFalse(passed.transition());
        assertTrue(passed.newState().connected());
        assertEquals(0, passed.newState().failCount());
        assertEquals(at(25), passed.newState().lastHealthy());

        s = fail(fail(passed.newState(), 30), 40);
        assertTrue(s.connected(), "two failures after a success must not demote");
        assertEquals(2, s.failCount());
    }

    @Test
    void healthEventsOutsideConnectedAreIgnored() {
        ManagedDeviceState unknown = ManagedDeviceState.initial(t0);
        assertSame(unknown, reducer.apply(unknown, new DeviceEvent.HealthCheckFailed(at(1), "x")).newState());
        assertSame(unknown, reducer.apply(unknown, new DeviceEvent.HealthCheckPassed(at(1))).newState());
    }

    @Test
    void disconnectIsHonoredRegardlessOfFailCount() {
        ManagedDeviceState s = fail(fail(connected(), 10), 20);

        DeviceStateReducer.Result r = reducer.apply(s, new DeviceEvent.DisconnectRequested(at(21)));
        assertTrue(r.transition());
        assertEquals(DeviceConnectionState.DISCONNECTED, r.newState().connectionState());
        assertEquals(0, r.newState().failCount());
    }

    @Test
    void disconnectWhenNotConnectedIsNoOp() {
        ManagedDeviceState unknown = ManagedDeviceState.initial(t0);
        DeviceStateReducer.Result r = reducer.apply(unknown, new DeviceEvent.DisconnectRequested(at(1)));
        assertFalse(r.transition());
        assertSame(unknown, r.newState());

        ManagedDeviceState disconnected = reducer.apply(connected(), new DeviceEvent.DisconnectRequested(at(3))).newState();
        DeviceStateReducer.Result again = reducer.apply(disconnected, new DeviceEvent.DisconnectRequested(at(4)));
        assertFalse(again.transition());
        assertSame(disconnected, again.newState());
    }

    @Test
    void reconnectAfterDemotionStartsFromZero() {
        ManagedDeviceState s = fail(fail(fail(connected(), 10), 20), 30);
        assertFalse(s.connected());

        s = reducer.apply(s, new DeviceEvent.ConnectRequested(at(40))).newState();
        s = reducer.apply(s, new DeviceEvent.ConnectSucceeded(at(41))).newState();
        assertTrue(s.connected());
        assertEquals(0, s.failCount());
        assertEquals(at(41), s.lastHealthy());
    }
}
