package com.questrail.spy.api;

import java.util.List;
import java.util.Optional;

/**
 * Spy
 * -----------------------------------------------------------------------------
 * A tracked substitute for a single callable of functional interface type
 * {@code F}.
 *
 * <h2>Recording</h2>
 * Every invocation of {@link #fn()} appends exactly one {@link SpyCall}, in
 * call order, after the configured behavior has produced a value or raised.
 *
 * <h2>Behavior</h2>
 * Exactly one default behavior is active at a time. Each setter replaces the
 * previous one and returns this spy for chaining:
 * <ul>
 *   <li>{@link #callThrough()}: delegate to the original (initial state)</li>
 *   <li>{@link #returnValue(Object)}: return a fixed value on every call</li>
 *   <li>{@link #returnValues(Object...)}: return values in order, then keep
 *       returning the last one</li>
 *   <li>{@link #throwError(Throwable)}: raise the given error</li>
 *   <li>{@link #callFake(Object)}: run a replacement implementation</li>
 * </ul>
 *
 * @param <F> the functional interface the substitute implements
 */
public interface Spy<F> extends Substitute
{
    /**
     * The callable substitute. This is the value installed on the owner.
     */
    F fn();

    Class<F> type();

    /**
     * The displaced original implementation used by call-through.
     */
    F original();

    // ---------------------------------------------------------------------
    // Behavior
    // ---------------------------------------------------------------------

    Spy<F> callThrough();

    Spy<F> returnValue(Object value);

    Spy<F> returnValues(Object... values);

    Spy<F> throwError(Throwable error);

    Spy<F> callFake(F implementation);

    // ---------------------------------------------------------------------
    // Inspection
    // ---------------------------------------------------------------------

    /**
     * Snapshot of the recorded calls, oldest first.
     */
    List<SpyCall> calls();

    int callCount();

    default boolean called() {
        return callCount() > 0;
    }

    default boolean notCalled() {
        return callCount() == 0;
    }

    default boolean calledOnce() {
        return callCount() == 1;
    }

    default boolean calledTwice() {
        return callCount() == 2;
    }

    default boolean calledThrice() {
        return callCount() == 3;
    }

    /**
     * True iff some recorded call has exactly these arguments, compared
     * position by position with the engine's equality predicate.
     */
    boolean calledWith(Object... args);

    default boolean neverCalledWith(Object... args) {
        return !calledWith(args);
    }

    Optional<SpyCall> firstCall();

    Optional<SpyCall> lastCall();

    /**
     * Call at the given zero-based index; empty when out of range, including
     * negative indices.
     */
    Optional<SpyCall> getCall(int index);
}
