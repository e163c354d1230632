package com.questrail.spy.registry;

import com.questrail.spy.api.Substitute;
import com.questrail.spy.internal.time.WallClock;
import com.questrail.spy.observability.SpyBulkRestoreEvent;
import com.questrail.spy.observability.SpyErrorEvent;
import com.questrail.spy.observability.SpyObservabilitySink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * SpyRegistry
 * -----------------------------------------------------------------------------
 * The set of substitutes currently installed on some owner.
 *
 * <h2>Lifecycle</h2>
 * Starts empty. Every successful interception adds itself; a substitute's own
 * {@link Substitute#restore()} removes it; {@link #restoreAll()} restores every
 * member and leaves the registry empty. Membership is by identity and carries
 * no ordering guarantee.
 *
 * <h2>Threading model</h2>
 * Access is synchronized on the registry. {@link #restoreAll()} restores from a
 * snapshot so that substitutes can deregister themselves while it runs.
 */
public final class SpyRegistry
{
    private final Set<Substitute> active = Collections.newSetFromMap(new IdentityHashMap<>());
    private final SpyObservabilitySink sink;
    private final WallClock wallClock;

    public SpyRegistry(SpyObservabilitySink sink, WallClock wallClock) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public synchronized void add(Substitute substitute) {
        active.add(Objects.requireNonNull(substitute, "substitute"));
    }

    public synchronized boolean remove(Substitute substitute) {
        return active.remove(substitute);
    }

    public synchronized boolean contains(Substitute substitute) {
        return active.contains(substitute);
    }

    public synchronized int size() {
        return active.size();
    }

    public synchronized List<Substitute> snapshot() {
        return new ArrayList<>(active);
    }

    /**
     * Restores every active substitute and clears the registry. Idempotent; a
     * substitute that fails to restore is reported and skipped.
     *
     * @return number of substitutes that were active
     */
    public int restoreAll() {
        List<Substitute> toRestore = snapshot();
        for (Substitute substitute : toRestore) {
            try {
                substitute.restore();
            } catch (RuntimeException e) {
                sink.onError(new SpyErrorEvent(wallClock.now(),
                        "Failed to restore " + substitute.memberName(), e));
            }
        }
        synchronized (this) {
            active.clear();
        }
        sink.onBulkRestore(new SpyBulkRestoreEvent(wallClock.now(), toRestore.size()));
        return toRestore.size();
    }
}
