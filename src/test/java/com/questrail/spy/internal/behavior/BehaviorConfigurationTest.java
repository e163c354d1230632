package com.questrail.spy.internal.behavior;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BehaviorConfigurationTest
{
    // ---------------------------------------------------------------------
    // Initial state
    // ---------------------------------------------------------------------

    @Test
    void startsAsUnlockedCallThroughWithEmptyQueue() {
        BehaviorConfiguration config = new BehaviorConfiguration();

        assertEquals(Behavior.CALL_THROUGH, config.defaultBehavior());
        assertFalse(config.isLocked());
        assertEquals(0, config.queued());
        assertEquals(Behavior.CALL_THROUGH, config.next());
    }

    // ---------------------------------------------------------------------
    // Once-queue
    // ---------------------------------------------------------------------

    /**
     * Queued behaviors are consumed in insertion order, one per call, after
     * which the default applies again.
     */
    @Test
    void queuedBehaviorsAreConsumedFifoThenDefaultTakesOver() {
        BehaviorConfiguration config = new BehaviorConfiguration();
        config.setDefault(new Behavior.FixedValue("default"));
        config.enqueue(new Behavior.FixedValue("a"));
        config.enqueue(new Behavior.FixedValue("b"));

        assertEquals(new Behavior.FixedValue("a"), config.next());
        assertEquals(new Behavior.FixedValue("b"), config.next());
        assertEquals(new Behavior.FixedValue("default"), config.next());
        assertEquals(new Behavior.FixedValue("default"), config.next());
    }

    @Test
    void enqueueIsDroppedWhileLocked() {
        BehaviorConfiguration config = new BehaviorConfiguration();
        config.enqueue(new Behavior.FixedValue("kept"));
        config.lock();

        assertFalse(config.enqueue(new Behavior.FixedValue("dropped")));
        assertEquals(1, config.queued());
        assertEquals(new Behavior.FixedValue("kept"), config.next());
        assertEquals(Behavior.CALL_THROUGH, config.next());
    }

    @Test
    void sequentialValuesCannotBeQueued() {
        BehaviorConfiguration config = new BehaviorConfiguration();
        assertThrows(IllegalArgumentException.class,
                () -> config.enqueue(Behavior.SequentialValues.of(1, 2)));
    }

    // ---------------------------------------------------------------------
    // Sequential default
    // ---------------------------------------------------------------------

    /**
     * A sequential default walks its values and then keeps answering the last
     * one.
     */
    @Test
    void sequentialDefaultRepeatsLastValueOnceExhausted() {
        BehaviorConfiguration config = new BehaviorConfiguration();
        config.setDefault(Behavior.SequentialValues.of(10, 20, 30));

        assertEquals(new Behavior.FixedValue(10), config.next());
        assertEquals(new Behavior.FixedValue(20), config.next());
        assertEquals(new Behavior.FixedValue(30), config.next());
        assertEquals(new Behavior.FixedValue(30), config.next());
    }

    @Test
    void settingSequentialDefaultAgainRestartsFromFirstValue() {
        BehaviorConfiguration config = new BehaviorConfiguration();
        config.setDefault(Behavior.SequentialValues.of("x", "y"));
        config.next();
        config.next();

        config.setDefault(Behavior.SequentialValues.of("p", "q"));
        assertEquals(new Behavior.FixedValue("p"), config.next());
    }

    @Test
    void resetCursorRewindsSequence() {
        BehaviorConfiguration config = new BehaviorConfiguration();
        config.setDefault(Behavior.SequentialValues.of(1, 2));
        config.next();
        config.next();

        config.resetCursor();
        assertEquals(new Behavior.FixedValue(1), config.next());
    }

    @Test
    void emptySequenceAnswersNull() {
        BehaviorConfiguration config = new BehaviorConfiguration();
        config.setDefault(Behavior.SequentialValues.of());

        assertEquals(new Behavior.FixedValue(null), config.next());
    }

    @Test
    void nullArrayMeansSingleNullValue() {
        Behavior.SequentialValues seq = Behavior.SequentialValues.of((Object[]) null);
        assertEquals(1, seq.values().size());
        assertNull(seq.values().get(0));
    }

    // ---------------------------------------------------------------------
    // Clearing
    // ---------------------------------------------------------------------

    @Test
    void clearReturnsToInitialState() {
        BehaviorConfiguration config = new BehaviorConfiguration();
        config.setDefault(new Behavior.FixedValue(5));
        config.enqueue(new Behavior.FixedValue(6));
        config.lock();

        config.clear();

        assertEquals(Behavior.CALL_THROUGH, config.defaultBehavior());
        assertFalse(config.isLocked());
        assertEquals(0, config.queued());
    }

    @Test
    void clearQueueKeepsDefaultAndLock() {
        BehaviorConfiguration config = new BehaviorConfiguration();
        config.setDefault(new Behavior.FixedValue(5));
        config.enqueue(new Behavior.FixedValue(6));
        config.lock();

        config.clearQueue();

        assertEquals(new Behavior.FixedValue(5), config.defaultBehavior());
        assertTrue(config.isLocked());
        assertEquals(0, config.queued());
    }
}
