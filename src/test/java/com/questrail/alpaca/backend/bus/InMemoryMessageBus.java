package com.questrail.alpaca.backend.bus;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * InMemoryMessageBus
 * -----------------------------------------------------------------------------
 * Test-only {@link MessageBus}. Publishing delivers synchronously, on the
 * publishing thread, to every subscription whose filter matches. Filters
 * support the single-level {@code +} and trailing multi-level {@code #}
 * wildcards.
 */
public final class InMemoryMessageBus implements MessageBus {

    public record Published(String topic, int qos, byte[] payload) {}

    private final Map<String, MessageListener> subscriptions = new ConcurrentHashMap<>();
    private final List<Published> published = new CopyOnWriteArrayList<>();
    private volatile boolean connected;
    private volatile boolean failConnect;
    private int connectCount;

    @Override
    public synchronized void connect() throws IOException {
        if (failConnect) {
            throw new IOException("broker unreachable");
        }
        connected = true;
        connectCount++;
    }

    @Override
    public void disconnect() {
        connected = false;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void publish(String topic, int qos, byte[] payload) throws IOException {
        if (!connected) {
            throw new IOException("not connected");
        }
        published.add(new Published(topic, qos, payload));
        for (Map.Entry<String, MessageListener> e : subscriptions.entrySet()) {
            if (matches(e.getKey(), topic)) {
                e.getValue().onMessage(topic, payload);
            }
        }
    }

    @Override
    public void subscribe(String topicFilter, int qos, MessageListener listener) throws IOException {
        if (!connected) {
            throw new IOException("not connected");
        }
        subscriptions.put(topicFilter, listener);
    }

    @Override
    public void unsubscribe(String topicFilter) {
        subscriptions.remove(topicFilter);
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void failConnect(boolean fail) {
        this.failConnect = fail;
    }

    /** Simulates a broker drop without the subscriptions being removed. */
    public void drop() {
        connected = false;
    }

    public boolean isSubscribed(String topicFilter) {
        return subscriptions.containsKey(topicFilter);
    }

    public List<Published> published() {
        return new ArrayList<>(published);
    }

    public synchronized int connectCount() {
        return connectCount;
    }

    static boolean matches(String filter, String topic) {
        String[] f = filter.split("/");
        String[] t = topic.split("/");
        for (int i = 0; i < f.length; i++) {
            if ("#".equals(f[i])) {
                return true;
            }
            if (i >= t.length) {
                return false;
            }
            if (!"+".equals(f[i]) && !f[i].equals(t[i])) {
                return false;
            }
        }
        return f.length == t.length;
    }
}
