package com.questrail.alpaca.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * One virtual device exposed by the reflector.
 */
public record DeviceSettings(
        String type,
        Integer number,
        String name,
        String description,
        String uniqueId,
        DeviceBackendSettings backend
) {
    /**
     * Per-device backend override. Unset fields fall back to the server-wide
     * {@link BackendSettings}.
     */
    public record DeviceBackendSettings(
            String mode,
            String networkUrl,
            String networkDeviceType,
            Integer networkDeviceNumber,
            String mqttTelescopeId,
            String directPort,
            Integer directBaudRate,
            String directProtocol
    ) {
        static DeviceBackendSettings empty() {
            return new DeviceBackendSettings(null, null, null, null, null, null, null, null);
        }
    }

    DeviceSettings withDefaults(int index, BackendSettings global) {
        if (Settings.isBlank(type)) {
            throw new ConfigurationException("device " + index + ": type is required");
        }
        if (number == null || number < 0) {
            throw new ConfigurationException("device " + index + ": number must be non-negative");
        }
        String t = type.toLowerCase(Locale.ROOT);
        DeviceBackendSettings b = backend == null ? DeviceBackendSettings.empty() : backend;

        return new DeviceSettings(
                t,
                number,
                Settings.orDefault(name, t + " #" + number),
                Settings.orDefault(description, "Alpaca Reflector " + t),
                uniqueId,
                new DeviceBackendSettings(
                        resolveMode(index, b, global),
                        b.networkUrl(),
                        Settings.isBlank(b.networkDeviceType()) ? t : b.networkDeviceType().toLowerCase(Locale.ROOT),
                        b.networkDeviceNumber() == null ? number : b.networkDeviceNumber(),
                        Settings.isBlank(b.mqttTelescopeId()) ? global.mqtt().telescopeId() : b.mqttTelescopeId(),
                        b.directPort(),
                        b.directBaudRate() == null ? 9600 : b.directBaudRate(),
                        b.directProtocol()));
    }

    private static String resolveMode(int index, DeviceBackendSettings b, BackendSettings global) {
        String mode;
        if (!Settings.isBlank(b.mode())) {
            mode = b.mode().toLowerCase(Locale.ROOT);
        } else if (BackendSettings.MODE_HYBRID.equals(global.mode())) {
            mode = Settings.isBlank(b.networkUrl()) ? BackendSettings.MODE_MQTT : BackendSettings.MODE_NETWORK;
        } else {
            mode = global.mode();
        }

        switch (mode) {
            case BackendSettings.MODE_NETWORK:
                if (Settings.isBlank(b.networkUrl())) {
                    throw new ConfigurationException("device " + index + ": backend.network_url is required for network mode");
                }
                requireHttpUrl(index, b.networkUrl());
                return mode;
            case BackendSettings.MODE_MQTT:
                if (Settings.isBlank(global.mqtt().broker())) {
                    throw new ConfigurationException("device " + index + ": backend.mqtt.broker is required for mqtt mode");
                }
                return mode;
            case BackendSettings.MODE_DIRECT:
                return mode;
            default:
                throw new ConfigurationException(
                        "device " + index + ": invalid backend mode '" + mode + "' (must be 'network', 'mqtt' or 'direct')");
        }
    }

    private static void requireHttpUrl(int index, String url) {
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new ConfigurationException("device " + index + ": backend.network_url is not a valid URL: " + url, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new ConfigurationException("device " + index + ": backend.network_url must be http or https: " + url);
        }
        if (uri.getHost() == null) {
            throw new ConfigurationException("device " + index + ": backend.network_url has no host: " + url);
        }
    }
}
