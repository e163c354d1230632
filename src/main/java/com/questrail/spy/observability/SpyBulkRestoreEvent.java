package com.questrail.spy.observability;

import java.time.Instant;

/**
 * Record representing a restore-all pass over a registry.
 *
 * @param restored number of substitutes the registry held when the pass started
 */
public record SpyBulkRestoreEvent(
    Instant timestamp,
    int restored
) {
}
