package com.questrail.alpaca.engine.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one health probe.
 *
 * @param failCount consecutive failures after this probe
 * @param reason    failure reason, {@code null} on success
 */
public record DeviceHealthCheckEvent(
    Instant timestamp,
    String deviceId,
    boolean healthy,
    int failCount,
    Duration duration,
    String reason
) {}
