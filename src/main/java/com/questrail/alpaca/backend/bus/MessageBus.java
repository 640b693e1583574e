package com.questrail.alpaca.backend.bus;

import java.io.IOException;

/**
 * MessageBus
 * =============================================================================
 * Publish/subscribe transport used by the message-bus backend mode.
 *
 * <p>The shape follows MQTT: slash-separated topics, {@code +} as a one-level
 * wildcard in subscription filters, QoS 0 to 2. A broker client library is
 * plugged in by implementing this interface.</p>
 *
 * <p>Listeners may be invoked on a transport thread and must not block.</p>
 */
public interface MessageBus {

    void connect() throws IOException;

    void disconnect();

    boolean isConnected();

    void publish(String topic, int qos, byte[] payload) throws IOException;

    void subscribe(String topicFilter, int qos, MessageListener listener) throws IOException;

    void unsubscribe(String topicFilter);

    @FunctionalInterface
    interface MessageListener {
        void onMessage(String topic, byte[] payload);
    }
}
