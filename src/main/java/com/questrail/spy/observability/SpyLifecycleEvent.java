package com.questrail.spy.observability;

import java.time.Instant;

/**
 * Record representing a substitute being installed on, or removed from, its owner.
 *
 * @param owner  owner description, or {@code null} for standalone substitutes
 * @param member member (or configured) name
 * @param kind   what was installed, e.g. {@code spy}, {@code asyncSpy}, {@code accessor}
 */
public record SpyLifecycleEvent(
    Instant timestamp,
    String owner,
    String member,
    String kind
) {
    /**
     * Human-readable target, {@code Owner.member} or just {@code member}.
     */
    public String target() {
        return owner != null ? owner + "." + member : member;
    }
}
