package com.questrail.spy.internal.time;

/**
 * SystemMonotonicClock
 * =============================================================================
 * Production {@link MonotonicClock} implementation backed by {@link System#nanoTime()}.
 *
 * <h2>Properties</h2>
 * <ul>
 *   <li>Monotonically non-decreasing (never goes backward)</li>
 *   <li>Not affected by wall-clock adjustments (NTP, DST, manual changes)</li>
 *   <li>Only meaningful for ordering and elapsed time, not absolute timestamps</li>
 * </ul>
 *
 * <p>For deterministic testing, use {@code ManualMonotonicClock} instead.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
