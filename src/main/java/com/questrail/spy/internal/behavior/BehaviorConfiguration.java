package com.questrail.spy.internal.behavior;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * BehaviorConfiguration
 * -----------------------------------------------------------------------------
 * Per-substitute behavior state: the once-queue, the default behavior, the
 * sequential-value cursor and the lock flag.
 *
 * <h2>State machine</h2>
 * The default behavior tag times {locked, unlocked}, with the once-queue as
 * orthogonal state consulted first. Initial state: call-through, unlocked,
 * empty queue.
 *
 * <h2>Exhaustion</h2>
 * The two sequential mechanisms differ once they run out:
 * <ul>
 *   <li>a {@link Behavior.SequentialValues} default keeps answering its last
 *       value (the cursor never moves past the final index)</li>
 *   <li>the once-queue simply becomes empty and the default takes over</li>
 * </ul>
 *
 * <h2>Threading model</h2>
 * Methods are synchronized so that the dequeue for a call happens atomically
 * at call time, which fixes which value each call receives.
 */
public final class BehaviorConfiguration
{
    private final Deque<Behavior> onceQueue = new ArrayDeque<>();
    private Behavior defaultBehavior = Behavior.CALL_THROUGH;
    private int cursor;
    private boolean locked;

    /**
     * Replaces the default behavior. A new sequential default starts from its
     * first value.
     */
    public synchronized void setDefault(Behavior behavior) {
        this.defaultBehavior = Objects.requireNonNull(behavior, "behavior");
        if (behavior instanceof Behavior.SequentialValues) {
            cursor = 0;
        }
    }

    /**
     * Appends a one-time behavior.
     *
     * @return {@code false} if the configuration is locked and the item was dropped
     */
    public synchronized boolean enqueue(Behavior behavior) {
        Objects.requireNonNull(behavior, "behavior");
        if (behavior instanceof Behavior.SequentialValues) {
            throw new IllegalArgumentException("Sequential values cannot be queued");
        }
        if (locked) {
            return false;
        }
        onceQueue.addLast(behavior);
        return true;
    }

    public synchronized void lock() {
        locked = true;
    }

    public synchronized void unlock() {
        locked = false;
    }

    public synchronized boolean isLocked() {
        return locked;
    }

    public synchronized void clearQueue() {
        onceQueue.clear();
    }

    public synchronized void resetCursor() {
        cursor = 0;
    }

    /**
     * Back to the initial state: call-through, unlocked, empty queue.
     */
    public synchronized void clear() {
        onceQueue.clear();
        defaultBehavior = Behavior.CALL_THROUGH;
        cursor = 0;
        locked = false;
    }

    public synchronized Behavior defaultBehavior() {
        return defaultBehavior;
    }

    public synchronized int queued() {
        return onceQueue.size();
    }

    /**
     * Selects the behavior for one call, consuming queue or cursor state.
     */
    public synchronized Behavior next() {
        Behavior once = onceQueue.pollFirst();
        if (once != null) {
            return once;
        }

        if (defaultBehavior instanceof Behavior.SequentialValues seq) {
            List<Object> values = seq.values();
            if (values.isEmpty()) {
                return new Behavior.FixedValue(null);
            }
            Object value = values.get(cursor);
            if (cursor < values.size() - 1) {
                cursor++;
            }
            return new Behavior.FixedValue(value);
        }

        return defaultBehavior;
    }
}
