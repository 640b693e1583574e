package com.questrail.alpaca.time;

import java.time.Instant;

/**
 * SystemWallClock
 * =============================================================================
 * Production {@link WallClock} backed by {@link Instant#now()}.
 *
 * <p>The value may jump with NTP or manual adjustments. It stamps health
 * reports, device state and backend metrics; it never drives timing.</p>
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
