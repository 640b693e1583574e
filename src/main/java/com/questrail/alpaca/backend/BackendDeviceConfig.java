package com.questrail.alpaca.backend;

import com.questrail.alpaca.config.BackendSettings;
import com.questrail.alpaca.config.ConfigurationException;
import com.questrail.alpaca.config.DeviceSettings;

import java.time.Duration;
import java.util.Objects;

/**
 * BackendDeviceConfig
 * =============================================================================
 * How a virtual device reaches real hardware. Exactly one variant per device.
 *
 * <ul>
 *   <li>{@link NetworkBackend}: forward Alpaca REST calls to another Alpaca server</li>
 *   <li>{@link MqttBackend}: bridge calls over the message bus</li>
 *   <li>{@link DirectBackend}: serial/USB; reserved, every call yields not-implemented</li>
 * </ul>
 */
public sealed interface BackendDeviceConfig
        permits BackendDeviceConfig.NetworkBackend, BackendDeviceConfig.MqttBackend, BackendDeviceConfig.DirectBackend {

    /** Short mode name as used in configuration. */
    String mode();

    /**
     * @param serverUrl     base URL of the remote Alpaca server
     * @param remoteType    device type on the remote server
     * @param remoteNumber  device number on the remote server
     * @param timeout       per-attempt request timeout
     * @param retryAttempts retries after the first attempt
     * @param retryDelay    base delay, doubled after each failed attempt
     */
    record NetworkBackend(String serverUrl,
                          String remoteType,
                          int remoteNumber,
                          Duration timeout,
                          int retryAttempts,
                          Duration retryDelay) implements BackendDeviceConfig {
        public NetworkBackend {
            Objects.requireNonNull(serverUrl, "serverUrl");
            Objects.requireNonNull(remoteType, "remoteType");
            Objects.requireNonNull(timeout, "timeout");
            Objects.requireNonNull(retryDelay, "retryDelay");
            // Trailing slashes would double up in the request path.
            while (serverUrl.endsWith("/")) {
                serverUrl = serverUrl.substring(0, serverUrl.length() - 1);
            }
        }

        @Override
        public String mode() {
            return BackendSettings.MODE_NETWORK;
        }
    }

    record MqttBackend(String broker,
                       String telescopeId,
                       String clientId,
                       String username,
                       String password,
                       Duration timeout,
                       int qos,
                       String topicPrefix) implements BackendDeviceConfig {
        public MqttBackend {
            Objects.requireNonNull(broker, "broker");
            Objects.requireNonNull(timeout, "timeout");
            Objects.requireNonNull(topicPrefix, "topicPrefix");
        }

        @Override
        public String mode() {
            return BackendSettings.MODE_MQTT;
        }

        /**
         * Topic root for this device: {@code prefix/telescopeId} when scoped to a
         * telescope, {@code prefix} otherwise.
         */
        public String topicRoot() {
            return telescopeId == null || telescopeId.isBlank() ? topicPrefix : topicPrefix + "/" + telescopeId;
        }

        @Override
        public String toString() {
            return "MqttBackend[broker=" + broker + ", telescopeId=" + telescopeId + ", clientId=" + clientId
                    + ", timeout=" + timeout + ", qos=" + qos + ", topicPrefix=" + topicPrefix + "]";
        }
    }

    record DirectBackend(String port,
                         int baudRate,
                         String protocol,
                         Duration timeout) implements BackendDeviceConfig {
        @Override
        public String mode() {
            return BackendSettings.MODE_DIRECT;
        }
    }

    /**
     * Builds the variant selected by a validated device entry.
     */
    static BackendDeviceConfig from(DeviceSettings device, BackendSettings global) {
        DeviceSettings.DeviceBackendSettings b = device.backend();
        switch (b.mode()) {
            case BackendSettings.MODE_NETWORK:
                return new NetworkBackend(
                        b.networkUrl(),
                        b.networkDeviceType(),
                        b.networkDeviceNumber(),
                        global.network().defaultTimeout(),
                        global.network().defaultRetryAttempts(),
                        global.network().defaultRetryDelay());
            case BackendSettings.MODE_MQTT:
                BackendSettings.MqttSettings m = global.mqtt();
                return new MqttBackend(
                        m.broker(),
                        b.mqttTelescopeId(),
                        m.clientId(),
                        m.username(),
                        m.password(),
                        m.timeout(),
                        m.qos(),
                        m.topicPrefix());
            case BackendSettings.MODE_DIRECT:
                return new DirectBackend(b.directPort(), b.directBaudRate(), b.directProtocol(),
                        global.network().defaultTimeout());
            default:
                throw new ConfigurationException("unsupported backend mode: " + b.mode());
        }
    }
}
