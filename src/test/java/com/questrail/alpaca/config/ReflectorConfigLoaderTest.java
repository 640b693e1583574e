package com.questrail.alpaca.config;

import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReflectorConfigLoaderTest {

    private final ReflectorConfigLoader loader = new ReflectorConfigLoader();

    @Test
    void minimalConfigGetsDefaults() {
        ReflectorConfig config = loader.parse(
                "devices:\n" +
                "  - type: Telescope\n" +
                "    number: 0\n" +
                "    backend:\n" +
                "      network_url: http://10.0.0.2:11111\n");

        ServerSettings server = config.server();
        assertEquals(":11111", server.listenAddress());
        assertEquals(11111, server.apiPort());
        assertEquals(32227, server.discoveryPort());
        assertEquals("Alpaca Reflector", server.serverName());
        assertEquals(Duration.ofSeconds(30), server.readTimeout());
        assertEquals(Duration.ofSeconds(60), server.idleTimeout());

        assertEquals("network", config.backend().mode());
        assertEquals(3, config.backend().network().defaultRetryAttempts());
        assertFalse(config.authentication().enabled());
        assertFalse(config.cors().enabled());
        assertFalse(config.tls().enabled());

        DeviceSettings device = config.devices().get(0);
        assertEquals("telescope", device.type());
        assertEquals("telescope #0", device.name());
        assertEquals("network", device.backend().mode());
        assertEquals("telescope", device.backend().networkDeviceType());
        assertEquals(0, device.backend().networkDeviceNumber());
    }

    @Test
    void fullFixtureLoadsFromClasspath() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/reflector-test.yaml")) {
            assertNotNull(in, "fixture missing");
            ReflectorConfig config = loader.load(in);

            assertEquals("127.0.0.1:0", config.server().listenAddress());
            assertEquals("Test Bench", config.server().location());
            assertEquals(Duration.ofSeconds(2), config.backend().network().defaultTimeout());
            assertEquals(Duration.ofMillis(10), config.backend().network().defaultRetryDelay());
            assertEquals(3, config.devices().size());
            assertEquals("direct", config.devices().get(1).backend().mode());
            assertEquals(3, config.devices().get(2).backend().networkDeviceNumber());
        }
    }

    @Test
    void noDevicesIsFatal() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> loader.parse("server:\n  server_name: x\n"));
        assertTrue(e.getMessage().contains("at least one device"));
    }

    @Test
    void duplicateTypeAndNumberIsFatal() {
        String yaml =
                "devices:\n" +
                "  - type: camera\n" +
                "    number: 1\n" +
                "    backend: {network_url: 'http://a'}\n" +
                "  - type: Camera\n" +
                "    number: 1\n" +
                "    backend: {network_url: 'http://b'}\n";
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.parse(yaml));
        assertTrue(e.getMessage().contains("duplicate device"), e.getMessage());
    }

    @Test
    void unknownGlobalModeIsFatal() {
        String yaml =
                "backend: {mode: carrier-pigeon}\n" +
                "devices:\n" +
                "  - {type: dome, number: 0}\n";
        assertThrows(ConfigurationException.class, () -> loader.parse(yaml));
    }

    @Test
    void networkDeviceWithoutUrlIsFatal() {
        assertThrows(ConfigurationException.class, () -> loader.parse(
                "devices:\n" +
                "  - {type: dome, number: 0}\n"));
    }

    @Test
    void malformedNetworkUrlIsFatal() {
        for (String url : List.of("http://obs host:11111", "ftp://10.0.0.2", "10.0.0.2:11111", "http:///api")) {
            ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.parse(
                    "devices:\n" +
                    "  - {type: telescope, number: 0, backend: {network_url: '" + url + "'}}\n"), url);
            assertTrue(e.getMessage().contains("network_url"), e.getMessage());
        }
    }

    @Test
    void httpsNetworkUrlIsAccepted() {
        ReflectorConfig config = loader.parse(
                "devices:\n" +
                "  - {type: telescope, number: 0, backend: {network_url: 'https://mount.local:11111'}}\n");
        assertEquals("https://mount.local:11111", config.devices().get(0).backend().networkUrl());
    }

    @Test
    void mqttQosZeroIsKeptAndAbsentQosDefaults() {
        ReflectorConfig zero = loader.parse(
                "backend: {mode: mqtt, mqtt: {broker: 'tcp://broker:1883', qos: 0}}\n" +
                "devices:\n" +
                "  - {type: focuser, number: 0}\n");
        ReflectorConfig absent = loader.parse(
                "backend: {mode: mqtt, mqtt: {broker: 'tcp://broker:1883'}}\n" +
                "devices:\n" +
                "  - {type: focuser, number: 0}\n");

        assertEquals(0, zero.backend().mqtt().qos().intValue());
        assertEquals(1, absent.backend().mqtt().qos().intValue());
    }

    @Test
    void mqttDeviceWithoutBrokerIsFatal() {
        assertThrows(ConfigurationException.class, () -> loader.parse(
                "backend: {mode: mqtt}\n" +
                "devices:\n" +
                "  - {type: focuser, number: 0}\n"));
    }

    @Test
    void hybridModeResolvesPerDevice() {
        ReflectorConfig config = loader.parse(
                "backend:\n" +
                "  mode: hybrid\n" +
                "  mqtt: {broker: 'tcp://broker:1883', telescope_id: scope1}\n" +
                "devices:\n" +
                "  - type: telescope\n" +
                "    number: 0\n" +
                "    backend: {network_url: 'http://10.0.0.2:11111'}\n" +
                "  - {type: focuser, number: 0}\n");

        List<DeviceSettings> devices = config.devices();
        assertEquals("network", devices.get(0).backend().mode());
        assertEquals("mqtt", devices.get(1).backend().mode());
        assertEquals("scope1", devices.get(1).backend().mqttTelescopeId());
    }

    @Test
    void corsDefaultsApplyOnlyWhenEnabled() {
        ReflectorConfig config = loader.parse(
                "cors: {enabled: true}\n" +
                "devices:\n" +
                "  - {type: dome, number: 0, backend: {mode: direct}}\n");

        CorsSettings cors = config.cors();
        assertEquals(List.of("*"), cors.allowedOrigins());
        assertEquals(CorsSettings.DEFAULT_METHODS, cors.allowedMethods());
        assertEquals(CorsSettings.DEFAULT_MAX_AGE_SECONDS, cors.maxAge());
    }

    @Test
    void enabledAuthenticationRequiresUsername() {
        assertThrows(ConfigurationException.class, () -> loader.parse(
                "authentication: {enabled: true, password: secret}\n" +
                "devices:\n" +
                "  - {type: dome, number: 0, backend: {mode: direct}}\n"));
    }

    @Test
    void enabledTlsRequiresKeyMaterial() {
        assertThrows(ConfigurationException.class, () -> loader.parse(
                "tls: {enabled: true, cert_file: /tmp/cert.pem}\n" +
                "devices:\n" +
                "  - {type: dome, number: 0, backend: {mode: direct}}\n"));
    }

    @Test
    void tlsMinVersionSelectsProtocols() {
        TlsSettings tls = new TlsSettings(true, "c", "k", "1.3");
        assertEquals(List.of("TLSv1.3"), tls.enabledProtocols());
        assertEquals(List.of("TLSv1.3", "TLSv1.2"), new TlsSettings(true, "c", "k", "TLSv1.2").enabledProtocols());
        assertThrows(ConfigurationException.class, () -> new TlsSettings(true, "c", "k", "1.0").enabledProtocols());
    }

    @Test
    void listenAddressWithHostBindsThatHost() {
        ReflectorConfig config = loader.parse(
                "server: {listen_address: '127.0.0.1:8080'}\n" +
                "devices:\n" +
                "  - {type: dome, number: 0, backend: {mode: direct}}\n");
        assertEquals(8080, config.server().apiPort());
        assertEquals("127.0.0.1", config.server().listenSocketAddress().getHostString());
    }

    @Test
    void badListenPortIsFatal() {
        assertThrows(ConfigurationException.class, () -> loader.parse(
                "server: {listen_address: ':http'}\n" +
                "devices:\n" +
                "  - {type: dome, number: 0, backend: {mode: direct}}\n"));
    }
}
