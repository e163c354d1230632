package com.questrail.spy.internal.time;

import java.time.Instant;

/**
 * SystemWallClock
 * =============================================================================
 * Production {@link WallClock} implementation backed by {@link Instant#now()}.
 *
 * <p><strong>Do not use for call ordering.</strong> Call records are stamped
 * from {@link MonotonicClock}; this clock only feeds observability sinks.</p>
 */
public enum SystemWallClock implements WallClock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
