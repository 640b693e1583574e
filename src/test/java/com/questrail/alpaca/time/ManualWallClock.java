package com.questrail.alpaca.time;

import java.time.Duration;
import java.time.Instant;

/**
 * Wall clock that only moves when told to.
 */
public final class ManualWallClock implements WallClock {

    private Instant now;

    public ManualWallClock(Instant start) {
        this.now = start;
    }

    @Override
    public synchronized Instant now() {
        return now;
    }

    public synchronized void advance(Duration delta) {
        now = now.plus(delta);
    }
}
