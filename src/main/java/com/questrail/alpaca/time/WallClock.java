package com.questrail.alpaca.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for report timestamps ({@code last_healthy}, health check
 * results, backend metrics, cached device values).
 *
 * <p>
 * This clock may jump due to NTP adjustments or explicit time setting. It MUST
 * NOT drive the health-check cadence, request timeouts or retry spacing.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
