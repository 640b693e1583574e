package com.questrail.alpaca.backend;

import java.time.Instant;

/**
 * Point-in-time snapshot of a backend's request counters.
 *
 * @param averageLatencyMillis exponential moving average, {@code 0.8 * old + 0.2 * new}
 * @param connectionState      {@code connected}, {@code disconnected} or {@code error}
 * @param lastError            most recent error message, or {@code null}
 */
public record BackendMetrics(
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        Instant lastRequest,
        Instant lastSuccess,
        Instant lastFailure,
        double averageLatencyMillis,
        String connectionState,
        String lastError
) {
}
