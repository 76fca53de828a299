package com.questrail.videowall.time;

import java.time.Duration;
import java.time.Instant;

/**
 * Settable {@link WallClock} for tests.
 */
public final class FixedWallClock implements WallClock {
    private volatile Instant now;

    public FixedWallClock(Instant now) {
        this.now = now;
    }

    @Override
    public Instant now() {
        return now;
    }

    public void set(Instant now) {
        this.now = now;
    }

    public void advance(Duration by) {
        this.now = now.plus(by);
    }
}
