package com.questrail.alpaca.api;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one {@link HealthChecker#check()} call.
 *
 * @param component name of the reporting component
 * @param status    overall status
 * @param message   human-readable summary
 * @param timestamp wall-clock time of the check
 * @param duration  time spent computing the result
 * @param details   component-specific counters
 */
public record HealthCheckResult(
        String component,
        HealthStatus status,
        String message,
        Instant timestamp,
        Duration duration,
        Map<String, Object> details
) {
    public HealthCheckResult {
        Objects.requireNonNull(component, "component");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(duration, "duration");
        details = Map.copyOf(details);
    }
}
