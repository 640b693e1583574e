package com.questrail.alpaca.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Server-wide backend defaults.
 *
 * <p>{@code mode} is one of {@code network}, {@code mqtt} or {@code hybrid}.
 * {@code hybrid} means there is no single global transport: every device picks
 * its own mode, and a device that names none is routed by its settings
 * (network when it has a {@code network_url}, mqtt otherwise).</p>
 */
public record BackendSettings(
        String mode,
        NetworkSettings network,
        MqttSettings mqtt
) {
    public static final String MODE_NETWORK = "network";
    public static final String MODE_MQTT = "mqtt";
    public static final String MODE_HYBRID = "hybrid";
    public static final String MODE_DIRECT = "direct";

    static BackendSettings empty() {
        return new BackendSettings(null, null, null);
    }

    BackendSettings withDefaults() {
        String m = Settings.orDefault(mode, MODE_NETWORK).toLowerCase(Locale.ROOT);
        switch (m) {
            case MODE_NETWORK:
            case MODE_MQTT:
            case MODE_HYBRID:
                break;
            default:
                throw new ConfigurationException(
                        "invalid backend mode: " + mode + " (must be 'network', 'mqtt', or 'hybrid')");
        }
        return new BackendSettings(
                m,
                (network == null ? NetworkSettings.empty() : network).withDefaults(),
                (mqtt == null ? MqttSettings.empty() : mqtt).withDefaults());
    }

    /**
     * Remote Alpaca proxy defaults applied to every network-backed device.
     */
    public record NetworkSettings(
            Duration defaultTimeout,
            Integer defaultRetryAttempts,
            Duration defaultRetryDelay
    ) {
        public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
        public static final int DEFAULT_RETRY_ATTEMPTS = 3;
        public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);

        static NetworkSettings empty() {
            return new NetworkSettings(null, null, null);
        }

        NetworkSettings withDefaults() {
            NetworkSettings s = new NetworkSettings(
                    Settings.orDefault(defaultTimeout, DEFAULT_TIMEOUT),
                    Settings.orDefault(defaultRetryAttempts, DEFAULT_RETRY_ATTEMPTS),
                    Settings.orDefault(defaultRetryDelay, DEFAULT_RETRY_DELAY));
            if (s.defaultTimeout.isNegative() || s.defaultTimeout.isZero()) {
                throw new ConfigurationException("backend.network.default_timeout must be positive");
            }
            if (s.defaultRetryAttempts < 0) {
                throw new ConfigurationException("backend.network.default_retry_attempts must be >= 0");
            }
            if (s.defaultRetryDelay.isNegative()) {
                throw new ConfigurationException("backend.network.default_retry_delay must be >= 0");
            }
            return s;
        }
    }

    /**
     * Message-bus bridge defaults.
     *
     * <p>{@code topicPrefix} defaults to {@code ascom}; a device scoped to a
     * telescope id publishes under {@code {prefix}/{telescope_id}}.</p>
     */
    public record MqttSettings(
            String broker,
            String telescopeId,
            String clientId,
            String username,
            String password,
            Integer qos,
            Duration timeout,
            Duration keepAlive,
            String topicPrefix
    ) {
        public static final int DEFAULT_QOS = 1;
        public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
        public static final Duration DEFAULT_KEEP_ALIVE = Duration.ofSeconds(60);
        public static final String DEFAULT_TOPIC_PREFIX = "ascom";

        static MqttSettings empty() {
            return new MqttSettings(null, null, null, null, null, null, null, null, null);
        }

        MqttSettings withDefaults() {
            MqttSettings s = new MqttSettings(
                    broker,
                    telescopeId,
                    Settings.orDefault(clientId, "alpaca-reflector"),
                    username,
                    password,
                    qos == null ? DEFAULT_QOS : qos,
                    Settings.orDefault(timeout, DEFAULT_TIMEOUT),
                    Settings.orDefault(keepAlive, DEFAULT_KEEP_ALIVE),
                    Settings.orDefault(topicPrefix, DEFAULT_TOPIC_PREFIX));
            if (s.qos < 0 || s.qos > 2) {
                throw new ConfigurationException("backend.mqtt.qos must be 0, 1 or 2");
            }
            return s;
        }

        @Override
        public String toString() {
            return "MqttSettings[broker=" + broker + ", telescopeId=" + telescopeId + ", clientId=" + clientId
                    + ", qos=" + qos + ", timeout=" + timeout + ", topicPrefix=" + topicPrefix + "]";
        }
    }
}
