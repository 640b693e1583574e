package com.questrail.alpaca.config;

import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * HTTP listener and server identity settings.
 *
 * <p>{@code listenAddress} is {@code host:port} or {@code :port}; an empty host
 * binds all interfaces. The port part is also what discovery advertises.</p>
 */
public record ServerSettings(
        String listenAddress,
        Integer discoveryPort,
        String serverName,
        String manufacturer,
        String manufacturerVersion,
        String location,
        Duration readTimeout,
        Duration writeTimeout,
        Duration idleTimeout,
        Duration shutdownTimeout
) {
    public static final int DEFAULT_API_PORT = 11111;
    public static final int DEFAULT_DISCOVERY_PORT = 32227;
    public static final String DEFAULT_SERVER_NAME = "Alpaca Reflector";
    public static final String DEFAULT_MANUFACTURER = "Questrail";
    public static final String DEFAULT_MANUFACTURER_VERSION = "1.0.0";
    public static final String DEFAULT_LOCATION = "Observatory";

    static ServerSettings empty() {
        return new ServerSettings(null, null, null, null, null, null, null, null, null, null);
    }

    ServerSettings withDefaults() {
        ServerSettings s = new ServerSettings(
                Settings.orDefault(listenAddress, ":" + DEFAULT_API_PORT),
                discoveryPort == null || discoveryPort == 0 ? DEFAULT_DISCOVERY_PORT : discoveryPort,
                Settings.orDefault(serverName, DEFAULT_SERVER_NAME),
                Settings.orDefault(manufacturer, DEFAULT_MANUFACTURER),
                Settings.orDefault(manufacturerVersion, DEFAULT_MANUFACTURER_VERSION),
                Settings.orDefault(location, DEFAULT_LOCATION),
                Settings.orDefault(readTimeout, Duration.ofSeconds(30)),
                Settings.orDefault(writeTimeout, Duration.ofSeconds(30)),
                Settings.orDefault(idleTimeout, Duration.ofSeconds(60)),
                Settings.orDefault(shutdownTimeout, Duration.ofSeconds(30)));

        if (s.discoveryPort < 0 || s.discoveryPort > 65535) {
            throw new ConfigurationException("server.discovery_port out of range: " + s.discoveryPort);
        }
        // Parses eagerly so a bad address fails at startup.
        s.listenSocketAddress();
        return s;
    }

    /**
     * Port part of {@link #listenAddress()}, falling back to {@link #DEFAULT_API_PORT}
     * when it has none.
     */
    public int apiPort() {
        int colon = listenAddress.lastIndexOf(':');
        if (colon < 0) {
            return DEFAULT_API_PORT;
        }
        String port = listenAddress.substring(colon + 1);
        try {
            int parsed = Integer.parseInt(port);
            if (parsed < 0 || parsed > 65535) {
                throw new ConfigurationException("server.listen_address port out of range: " + listenAddress);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new ConfigurationException("server.listen_address has an invalid port: " + listenAddress, e);
        }
    }

    public InetSocketAddress listenSocketAddress() {
        int colon = listenAddress.lastIndexOf(':');
        String host = colon < 0 ? listenAddress : listenAddress.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port = apiPort();
        return host.isEmpty() ? new InetSocketAddress(port) : new InetSocketAddress(host, port);
    }
}
