package com.questrail.spy.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for call record timestamps.
 *
 * <h2>Binding invariant</h2>
 * Call records MUST be stamped from a monotonic time source so that their
 * timestamps never decrease in call order. Wall-clock time (e.g.
 * {@code Instant.now()}) is permitted only for observability.
 *
 * <p>
 * Implementations should be backed by a monotonic clock such as
 * {@link System#nanoTime()}.
 * </p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>
     * Values are only meaningful relative to each other.
     * </p>
     */
    long nowNanos();
}
