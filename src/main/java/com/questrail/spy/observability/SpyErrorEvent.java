package com.questrail.spy.observability;

import java.time.Instant;

/**
 * Record representing a failure the engine absorbed instead of raising, such
 * as a restore that could not write its member back.
 */
public record SpyErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
