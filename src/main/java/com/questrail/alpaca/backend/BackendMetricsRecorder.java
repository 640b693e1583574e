package com.questrail.alpaca.backend;

import com.questrail.alpaca.time.MonotonicClock;
import com.questrail.alpaca.time.WallClock;

import java.time.Instant;
import java.util.Objects;

/**
 * Mutable accumulator behind {@link BackendMetrics}. Latency is measured on the
 * monotonic clock; timestamps come from the wall clock.
 */
final class BackendMetricsRecorder {

    static final String CONNECTED = "connected";
    static final String DISCONNECTED = "disconnected";
    static final String ERROR = "error";

    private final MonotonicClock clock;
    private final WallClock wallClock;

    private long total;
    private long successful;
    private long failed;
    private Instant lastRequest;
    private Instant lastSuccess;
    private Instant lastFailure;
    private double averageLatencyMillis;
    private String connectionState = DISCONNECTED;
    private String lastError;

    BackendMetricsRecorder(MonotonicClock clock, WallClock wallClock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    long startNanos() {
        return clock.nowNanos();
    }

    synchronized void record(long startNanos, boolean success) {
        Instant now = wallClock.now();
        total++;
        if (success) {
            successful++;
            lastSuccess = now;
        } else {
            failed++;
            lastFailure = now;
        }
        lastRequest = now;

        double latency = (clock.nowNanos() - startNanos) / 1_000_000.0;
        averageLatencyMillis = averageLatencyMillis == 0 ? latency : 0.8 * averageLatencyMillis + 0.2 * latency;
    }

    synchronized void connectionState(String state, String error) {
        this.connectionState = state;
        if (error != null && !error.isEmpty()) {
            this.lastError = error;
        }
    }

    synchronized BackendMetrics snapshot() {
        return new BackendMetrics(total, successful, failed, lastRequest, lastSuccess, lastFailure,
                averageLatencyMillis, connectionState, lastError);
    }
}
