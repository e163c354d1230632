package com.questrail.spy.api;

/**
 * AsyncSpy
 * -----------------------------------------------------------------------------
 * A {@link Spy} extended with one-time behaviors and deferred results.
 *
 * <h2>Once-queue</h2>
 * One-time behaviors are consumed first-in-first-out, one per call, before the
 * default behavior is consulted. Once the queue is empty the default applies.
 *
 * <h2>Locking</h2>
 * {@link #returnValue(Object)}, {@link #returnValues(Object...)},
 * {@link #resolvedValue(Object)} and {@link #rejectedValue(Throwable)} set the
 * default <em>and lock</em> the spy: items already queued are still consumed
 * first, but any later once-enqueue is silently ignored. {@link #callThrough()},
 * {@link #throwError(Throwable)} and {@link #callFake(Object)} clear the queue
 * and unlock, as do {@link #clearReturnValues()} and {@link #clearAll()}.
 *
 * <h2>Deferred results</h2>
 * Resolved and rejected values are handed back as already-settled
 * {@link java.util.concurrent.CompletableFuture}s; the call itself never
 * raises for a rejection, but the rejection is recorded as the call's error.
 */
public interface AsyncSpy<F> extends Spy<F>
{
    // One-time behaviors (ignored while locked)

    AsyncSpy<F> returnValueOnce(Object value);

    AsyncSpy<F> returnValuesOnce(Object... values);

    AsyncSpy<F> resolvedValueOnce(Object value);

    AsyncSpy<F> resolvedValues(Object... values);

    AsyncSpy<F> rejectedValueOnce(Throwable error);

    AsyncSpy<F> rejectedValues(Throwable... errors);

    AsyncSpy<F> callFakeOnce(F implementation);

    // Defaults

    @Override
    AsyncSpy<F> callThrough();

    @Override
    AsyncSpy<F> returnValue(Object value);

    @Override
    AsyncSpy<F> returnValues(Object... values);

    @Override
    AsyncSpy<F> throwError(Throwable error);

    @Override
    AsyncSpy<F> callFake(F implementation);

    AsyncSpy<F> resolvedValue(Object value);

    AsyncSpy<F> rejectedValue(Throwable error);

    // Clearing

    /** Empties the recorded calls only. */
    AsyncSpy<F> clearCalls();

    /** Empties the once-queue, resets the default to call-through and unlocks. */
    AsyncSpy<F> clearReturnValues();

    AsyncSpy<F> clearAll();

    boolean isLocked();

    int queuedBehaviors();
}
