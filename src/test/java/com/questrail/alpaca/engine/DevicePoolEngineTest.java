package com.questrail.alpaca.engine;

import com.questrail.alpaca.api.AlpacaJson;
import com.questrail.alpaca.api.DeviceRole;
import com.questrail.alpaca.api.HealthCheckResult;
import com.questrail.alpaca.api.HealthStatus;
import com.questrail.alpaca.discovery.AlpacaDiscoveryScanner;
import com.questrail.alpaca.engine.client.AlpacaDeviceClient;
import com.questrail.alpaca.engine.client.AlpacaRestClient;
import com.questrail.alpaca.engine.client.TelescopeStatus;
import com.questrail.alpaca.engine.observability.DeviceHealthCheckEvent;
import com.questrail.alpaca.engine.observability.DeviceStateTransitionEvent;
import com.questrail.alpaca.engine.observability.RecordingDevicePoolObservabilitySink;
import com.questrail.alpaca.engine.state.DeviceConnectionState;
import com.questrail.alpaca.time.DeterministicScheduler;
import com.questrail.alpaca.time.ManualMonotonicClock;
import com.questrail.alpaca.time.ManualWallClock;
import com.questrail.alpaca.transport.FakeDatagramEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DevicePoolEngineTest
 * -----------------------------------------------------------------------------
 * Drives the engine with a fake device client, a manual clock and a
 * deterministic scheduler, so every health round runs exactly when the test
 * asks for it.
 */
class DevicePoolEngineTest {

    private static final Duration INTERVAL = Duration.ofSeconds(30);

    private ManualMonotonicClock clock;
    private ManualWallClock wallClock;
    private DeterministicScheduler scheduler;
    private FakeDeviceClient client;
    private FakeDatagramEndpoint discoveryEndpoint;
    private RecordingDevicePoolObservabilitySink sink;
    private DevicePoolEngine engine;

    private final AlpacaDevice scope = AlpacaDevice.of("http://10.0.0.5:11111", "telescope", 0, "Mount", "u-1");
    private final AlpacaDevice camera = AlpacaDevice.of("http://10.0.0.5:11111", "camera", 0, "Imager", "u-2");

    @BeforeEach
    void setUp() throws Exception {
        clock = new ManualMonotonicClock();
        wallClock = new ManualWallClock(Instant.parse("2026-03-01T20:00:00Z"));
        scheduler = new DeterministicScheduler(clock);
        client = new FakeDeviceClient();
        discoveryEndpoint = new FakeDatagramEndpoint();
        sink = new RecordingDevicePoolObservabilitySink();

        engine = DevicePoolEngine.builder()
                .withClient(client)
                .withScanner(new AlpacaDiscoveryScanner(() -> discoveryEndpoint,
                        InetAddress.getByName("255.255.255.255"), AlpacaJson.newMapper()))
                .withClock(clock)
                .withWallClock(wallClock)
                .withScheduler(scheduler)
                .withObservabilitySink(sink)
                .withHealthCheckInterval(INTERVAL)
                .build();
    }

    private void tick() {
        clock.advance(INTERVAL);
        wallClock.advance(INTERVAL);
        scheduler.runDueTasks();
    }

    private ManagedDevice registerAndConnect(AlpacaDevice device) throws DeviceEngineException {
        ManagedDevice md = engine.registerDevice(device);
        engine.connectDevice(device.deviceId());
        return md;
    }

    // ---------------------------------------------------------------------
    // Registry and connection
    // ---------------------------------------------------------------------

    @Test
    void registeredDeviceStartsUnknownAndDisconnected() throws Exception {
        ManagedDevice md = engine.registerDevice(scope);

        assertEquals(DeviceConnectionState.UNKNOWN, md.connectionState());
        assertFalse(engine.isDeviceConnected(scope.deviceId()));
        assertEquals(List.of(md), engine.listDevices());
        assertSame(md, engine.getDevice(scope.deviceId()));
    }

    @Test
    void clientIsTheConfiguredOne() {
        assertSame(client, engine.client());
    }

    @Test
    void coordinatorDrivesTelescopeVerbsThroughTheClient() throws Exception {
        registerAndConnect(scope);
        AlpacaDeviceClient verbs = engine.client();

        verbs.unpark(scope);
        verbs.setTracking(scope, true);
        verbs.slewToCoordinates(scope, 5.5, 20.0);
        verbs.abortSlew(scope);
        verbs.park(scope);
        TelescopeStatus status = verbs.getTelescopeStatus(scope);

        String id = scope.deviceId();
        assertTrue(client.calls().containsAll(List.of("PUT unpark " + id, "PUT tracking " + id,
                "PUT slewtocoordinates " + id, "PUT abortslew " + id, "PUT park " + id)));
        assertTrue(status.connected());
        assertTrue(client.calls().contains("GET tracking " + id));
    }

    @Test
    void duplicateRegistrationIsRejected() throws Exception {
        engine.registerDevice(scope);
        DeviceEngineException e = assertThrows(DeviceEngineException.class, () -> engine.registerDevice(scope));
        assertEquals(DeviceEngineException.Kind.ALREADY_REGISTERED, e.kind());
    }

    @Test
    void unknownDeviceIsNotFound() {
        DeviceEngineException e = assertThrows(DeviceNotFoundException.class,
                () -> engine.connectDevice("nope"));
        assertEquals(DeviceEngineException.Kind.NOT_FOUND, e.kind());
        assertThrows(DeviceNotFoundException.class, () -> engine.disconnectDevice("nope"));
        assertThrows(DeviceNotFoundException.class, () -> engine.isDeviceConnected("nope"));
    }

    @Test
    void connectMovesThroughConnectingToConnected() throws Exception {
        ManagedDevice md = registerAndConnect(scope);

        assertTrue(md.connected());
        assertEquals(0, md.failCount());
        assertEquals(wallClock.now(), md.lastHealthy());
        assertTrue(client.calls().contains("PUT connected " + scope.deviceId()));

        List<DeviceStateTransitionEvent> transitions = sink.getStateTransitions();
        assertEquals(2, transitions.size());
        assertEquals(DeviceConnectionState.CONNECTING, transitions.get(0).newState().connectionState());
        assertEquals(DeviceConnectionState.CONNECTED, transitions.get(1).newState().connectionState());
    }

    @Test
    void connectWhenAlreadyConnectedDoesNotCallTheDevice() throws Exception {
        registerAndConnect(scope);
        int before = client.calls().size();

        engine.connectDevice(scope.deviceId());

        assertEquals(before, client.calls().size());
    }

    @Test
    void failedConnectLeavesDeviceDisconnectedAndKeepsTheAscomCode() throws Exception {
        ManagedDevice md = engine.registerDevice(scope);
        client.refuseConnect(scope.deviceId());

        DeviceEngineException e = assertThrows(DeviceEngineException.class,
                () -> engine.connectDevice(scope.deviceId()));

        assertEquals(DeviceEngineException.Kind.CONNECTION_FAILED, e.kind());
        assertEquals(0x407, e.ascomErrorNumber());
        assertEquals(DeviceConnectionState.DISCONNECTED, md.connectionState());
    }

    @Test
    void unusableServerUrlFailsTheConnectAndLeavesDeviceDisconnected() throws Exception {
        DevicePoolEngine restEngine = DevicePoolEngine.builder()
                .withClient(new AlpacaRestClient(HttpClient.newHttpClient(), AlpacaJson.newMapper()))
                .withScanner(new AlpacaDiscoveryScanner(() -> discoveryEndpoint,
                        InetAddress.getByName("255.255.255.255"), AlpacaJson.newMapper()))
                .withClock(clock)
                .withWallClock(wallClock)
                .withScheduler(scheduler)
                .withObservabilitySink(sink)
                .withHealthCheckInterval(INTERVAL)
                .build();
        AlpacaDevice badUrl = AlpacaDevice.of("http://obs host:11111", "telescope", 0, "Mount", "");
        ManagedDevice md = restEngine.registerDevice(badUrl);

        DeviceEngineException e = assertThrows(DeviceEngineException.class,
                () -> restEngine.connectDevice(badUrl.deviceId()));

        assertEquals(DeviceEngineException.Kind.CONNECTION_FAILED, e.kind());
        assertEquals(DeviceConnectionState.DISCONNECTED, md.connectionState());
    }

    @Test
    void disconnectIsImmediateAndIdempotent() throws Exception {
        ManagedDevice md = registerAndConnect(scope);

        engine.disconnectDevice(scope.deviceId());
        assertEquals(DeviceConnectionState.DISCONNECTED, md.connectionState());
        int calls = client.calls().size();

        assertDoesNotThrow(() -> engine.disconnectDevice(scope.deviceId()));
        assertEquals(DeviceConnectionState.DISCONNECTED, md.connectionState());
        assertEquals(calls, client.calls().size(), "second disconnect must not reach the device");
    }

    @Test
    void disconnectOfNeverConnectedDeviceIsNoOp() throws Exception {
        ManagedDevice md = engine.registerDevice(scope);
        assertDoesNotThrow(() -> engine.disconnectDevice(scope.deviceId()));
        assertEquals(DeviceConnectionState.UNKNOWN, md.connectionState());
        assertTrue(client.calls().isEmpty());
    }

    @Test
    void unregisterDisconnectsAndRemovesFromPools() throws Exception {
        registerAndConnect(scope);
        engine.registerDevice(camera);
        Map<DeviceRole, String> roles = new EnumMap<>(DeviceRole.class);
        roles.put(DeviceRole.TELESCOPE, scope.deviceId());
        roles.put(DeviceRole.CAMERA, camera.deviceId());
        engine.registerTelescope("east", roles);

        engine.unregisterDevice(scope.deviceId());

        assertTrue(client.calls().contains("PUT connected " + scope.deviceId()));
        assertThrows(DeviceNotFoundException.class, () -> engine.getDevice(scope.deviceId()));
        assertThrows(DeviceNotFoundException.class,
                () -> engine.getTelescopeDevice("east", DeviceRole.TELESCOPE));
        assertEquals(camera.deviceId(), engine.getTelescopeDevice("east", DeviceRole.CAMERA).deviceId());
    }

    // ---------------------------------------------------------------------
    // Telescope pools
    // ---------------------------------------------------------------------

    @Test
    void telescopePoolResolvesDevicesByRole() throws Exception {
        engine.registerDevice(scope);
        engine.registerDevice(camera);
        TelescopePool pool = engine.registerTelescope("west", Map.of(
                DeviceRole.TELESCOPE, scope.deviceId(),
                DeviceRole.CAMERA, camera.deviceId()));

        assertEquals("west", pool.telescopeId());
        assertEquals(2, pool.devices().size());
        assertEquals(scope.deviceId(), engine.getTelescopeDevice("west", DeviceRole.TELESCOPE).deviceId());
        assertEquals(camera.deviceId(), engine.getTelescopeDevice("west", DeviceRole.CAMERA).deviceId());
    }

    @Test
    void missingRoleOrTelescopeIsNotFound() throws Exception {
        engine.registerDevice(scope);
        engine.registerTelescope("west", Map.of(DeviceRole.TELESCOPE, scope.deviceId()));

        assertThrows(DeviceNotFoundException.class, () -> engine.getTelescopeDevice("west", DeviceRole.DOME));
        assertThrows(DeviceNotFoundException.class,
                () -> engine.getTelescopeDevice("north", DeviceRole.TELESCOPE));
    }

    @Test
    void poolReferencingUnknownDeviceIsRejectedWithoutChange() throws Exception {
        engine.registerDevice(scope);

        assertThrows(DeviceNotFoundException.class, () -> engine.registerTelescope("west", Map.of(
                DeviceRole.TELESCOPE, scope.deviceId(),
                DeviceRole.FOCUSER, "missing")));
        assertThrows(DeviceNotFoundException.class,
                () -> engine.getTelescopeDevice("west", DeviceRole.TELESCOPE));
    }

    @Test
    void unregisterTelescopeDropsThePoolOnly() throws Exception {
        engine.registerDevice(scope);
        engine.registerTelescope("west", Map.of(DeviceRole.TELESCOPE, scope.deviceId()));

        engine.unregisterTelescope("west");
        engine.unregisterTelescope("west");

        assertThrows(DeviceNotFoundException.class,
                () -> engine.getTelescopeDevice("west", DeviceRole.TELESCOPE));
        assertNotNull(engine.getDevice(scope.deviceId()));
    }

    // ---------------------------------------------------------------------
    // Health monitor
    // ---------------------------------------------------------------------

    @Test
    void firstRoundRunsOneIntervalAfterStart() throws Exception {
        registerAndConnect(scope);
        engine.start();

        scheduler.runDueTasks();
        assertTrue(sink.getHealthChecks().isEmpty());

        tick();
        assertEquals(1, sink.getHealthChecks().size());
        assertTrue(sink.getHealthChecks().get(0).healthy());
        assertEquals(1, scheduler.pendingCount());
    }

    @Test
    void threeConsecutiveFailuresDemote() throws Exception {
        ManagedDevice md = registerAndConnect(scope);
        client.probes(scope.deviceId(), false, false, false);
        engine.start();

        tick();
        tick();
        assertTrue(md.connected());
        assertEquals(2, md.failCount());

        tick();
        assertEquals(DeviceConnectionState.DISCONNECTED, md.connectionState());
        assertEquals(0, md.failCount());

        DeviceStateTransitionEvent last = sink.getStateTransitions().get(sink.getStateTransitions().size() - 1);
        assertTrue(last.isDemotion());
        DeviceHealthCheckEvent lastCheck = sink.getHealthChecks().get(2);
        assertFalse(lastCheck.healthy());
        assertEquals(3, lastCheck.failCount());
    }

    @Test
    void successBetweenFailuresResetsTheCount() throws Exception {
        ManagedDevice md = registerAndConnect(scope);
        client.probes(scope.deviceId(), false, false, true, false, false);
        engine.start();

        for (int i = 0; i < 5; i++) {
            tick();
        }

        assertTrue(md.connected());
        assertEquals(2, md.failCount());
    }

    @Test
    void deviceReportingDisconnectedCountsAsFailure() throws Exception {
        ManagedDevice md = registerAndConnect(scope);
        client.dropRemotely(scope.deviceId());
        engine.start();

        tick();

        assertEquals(1, md.failCount());
        assertEquals("device reports not connected", sink.getHealthChecks().get(0).reason());
    }

    @Test
    void demotedDeviceIsNotProbedOrReconnected() throws Exception {
        ManagedDevice md = registerAndConnect(scope);
        client.probes(scope.deviceId(), false, false, false);
        engine.start();
        tick();
        tick();
        tick();
        int calls = client.calls().size();

        tick();
        tick();

        assertEquals(calls, client.calls().size());
        assertFalse(md.connected());
    }

    @Test
    void disconnectedDevicesAreSkipped() throws Exception {
        engine.registerDevice(scope);
        engine.start();

        tick();

        assertTrue(sink.getHealthChecks().isEmpty());
        assertTrue(client.calls().isEmpty());
    }

    @Test
    void stopCancelsTheTicker() throws Exception {
        registerAndConnect(scope);
        engine.start();
        engine.stop();

        assertEquals(0, scheduler.pendingCount());
        tick();
        assertTrue(sink.getHealthChecks().isEmpty());
    }

    @Test
    void checkReportsAggregateHealth() throws Exception {
        HealthCheckResult empty = engine.check();
        assertEquals(HealthStatus.HEALTHY, empty.status());
        assertEquals(DevicePoolEngine.COMPONENT_NAME, empty.component());

        engine.registerDevice(scope);
        assertEquals(HealthStatus.UNHEALTHY, engine.check().status());

        engine.connectDevice(scope.deviceId());
        registerAndConnect(camera);
        HealthCheckResult healthy = engine.check();
        assertEquals(HealthStatus.HEALTHY, healthy.status());
        assertEquals(2, healthy.details().get("connected_devices"));
        assertEquals(2, healthy.details().get("healthy_devices"));

        client.probes(camera.deviceId(), false);
        engine.performHealthChecks();
        HealthCheckResult degraded = engine.check();
        assertEquals(HealthStatus.DEGRADED, degraded.status());
        assertEquals(2, degraded.details().get("total_devices"));
        assertEquals(1, degraded.details().get("healthy_devices"));
        assertEquals(0, degraded.details().get("telescope_count"));
    }

    // ---------------------------------------------------------------------
    // Discovery
    // ---------------------------------------------------------------------

    @Test
    void discoveryListsDevicesWithoutRegisteringThem() throws Exception {
        discoveryEndpoint.onSend(sent -> {
            discoveryEndpoint.injectDatagram(new InetSocketAddress("10.0.0.5", 32227),
                    "{\"AlpacaPort\":11111}".getBytes(StandardCharsets.UTF_8));
            discoveryEndpoint.injectDatagram(new InetSocketAddress("10.0.0.6", 32227),
                    "{\"AlpacaPort\":8080}".getBytes(StandardCharsets.UTF_8));
        });
        client.serverLists("http://10.0.0.5:11111", scope, camera);
        client.serverUnreachable("http://10.0.0.6:8080");

        List<AlpacaDevice> found = engine.discoverDevices(32227, Duration.ofMillis(10));

        assertEquals(List.of(scope, camera), found);
        assertTrue(engine.listDevices().isEmpty());
        assertTrue(client.calls().contains("GET configureddevices http://10.0.0.6:8080"));
    }

    @Test
    void discoveryOnInvalidPortIsTypedFailure() {
        DeviceEngineException e = assertThrows(DeviceEngineException.class,
                () -> engine.discoverDevices(0, Duration.ofMillis(10)));
        assertEquals(DeviceEngineException.Kind.DISCOVERY_FAILED, e.kind());

        assertThrows(DeviceEngineException.class, () -> engine.discoverDevices(70000));
        assertTrue(discoveryEndpoint.sent().isEmpty());
    }
}
