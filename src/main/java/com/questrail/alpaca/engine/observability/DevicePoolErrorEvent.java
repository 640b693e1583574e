package com.questrail.alpaca.engine.observability;

import java.time.Instant;

/**
 * A pool operation or probe failed.
 *
 * @param deviceId affected device, or {@code null} for pool-wide failures
 */
public record DevicePoolErrorEvent(
    Instant timestamp,
    String deviceId,
    String message,
    Throwable cause
) {}
