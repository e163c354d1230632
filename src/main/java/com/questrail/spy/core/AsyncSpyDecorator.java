package com.questrail.spy.core;

import com.questrail.spy.api.AsyncSpy;
import com.questrail.spy.api.SpyCall;
import com.questrail.spy.internal.behavior.Behavior;
import com.questrail.spy.internal.behavior.BehaviorConfiguration;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * AsyncSpyDecorator
 * -----------------------------------------------------------------------------
 * Adds the once-queue, deferred results and the locking rule on top of a
 * {@link BasicSpy}, without changing how calls are recorded.
 *
 * <h2>Sharing</h2>
 * The decorator works on the base spy's own {@link BehaviorConfiguration} and
 * call log, and never replaces its proxy. Decorating a spy that is already
 * installed on an owner therefore changes its behavior in place.
 *
 * <h2>Setter families</h2>
 * <ul>
 *   <li>once-enqueue: appended unless locked; while locked the call is a
 *       no-op and its arguments are not validated</li>
 *   <li>call-through / throw / fake: replace the default, clear the queue, unlock</li>
 *   <li>fixed / sequential / resolved / rejected: replace the default and lock;
 *       queued items are still consumed first</li>
 * </ul>
 */
public final class AsyncSpyDecorator<F> implements AsyncSpy<F>
{
    private final BasicSpy<F> spy;
    private final BehaviorConfiguration behavior;

    public AsyncSpyDecorator(BasicSpy<F> spy) {
        this.spy = Objects.requireNonNull(spy, "spy");
        this.behavior = spy.behavior();
        spy.markKind("asyncSpy");
    }

    /**
     * The decorated base spy; this is what the registry tracks.
     */
    public BasicSpy<F> base() {
        return spy;
    }

    // ---------------------------------------------------------------------
    // Once-queue
    // ---------------------------------------------------------------------

    @Override
    public AsyncSpy<F> returnValueOnce(Object value) {
        synchronized (behavior) {
            if (!behavior.isLocked()) {
                spy.requireReturnable(value);
                behavior.enqueue(new Behavior.FixedValue(value));
            }
        }
        return this;
    }

    @Override
    public AsyncSpy<F> returnValuesOnce(Object... values) {
        synchronized (behavior) {
            if (!behavior.isLocked()) {
                Object[] items = nonNull(values);
                for (Object value : items) {
                    spy.requireReturnable(value);
                }
                for (Object value : items) {
                    behavior.enqueue(new Behavior.FixedValue(value));
                }
            }
        }
        return this;
    }

    @Override
    public AsyncSpy<F> resolvedValueOnce(Object value) {
        synchronized (behavior) {
            if (!behavior.isLocked()) {
                spy.requireFutureReturn();
                behavior.enqueue(new Behavior.ResolvedValue(value));
            }
        }
        return this;
    }

    @Override
    public AsyncSpy<F> resolvedValues(Object... values) {
        synchronized (behavior) {
            if (!behavior.isLocked()) {
                spy.requireFutureReturn();
                for (Object value : nonNull(values)) {
                    behavior.enqueue(new Behavior.ResolvedValue(value));
                }
            }
        }
        return this;
    }

    @Override
    public AsyncSpy<F> rejectedValueOnce(Throwable error) {
        synchronized (behavior) {
            if (!behavior.isLocked()) {
                spy.requireFutureReturn();
                behavior.enqueue(new Behavior.RejectedValue(error));
            }
        }
        return this;
    }

    @Override
    public AsyncSpy<F> rejectedValues(Throwable... errors) {
        synchronized (behavior) {
            if (!behavior.isLocked() && errors != null) {
                spy.requireFutureReturn();
                for (Throwable error : errors) {
                    Objects.requireNonNull(error, "error");
                }
                for (Throwable error : errors) {
                    behavior.enqueue(new Behavior.RejectedValue(error));
                }
            }
        }
        return this;
    }

    @Override
    public AsyncSpy<F> callFakeOnce(F implementation) {
        synchronized (behavior) {
            if (!behavior.isLocked()) {
                behavior.enqueue(new Behavior.CallFake(Objects.requireNonNull(implementation, "implementation")));
            }
        }
        return this;
    }

    private static Object[] nonNull(Object[] values) {
        return values == null ? new Object[] { null } : values;
    }

    // ---------------------------------------------------------------------
    // Unlocking defaults
    // ---------------------------------------------------------------------

    @Override
    public AsyncSpy<F> callThrough() {
        replaceDefaultAndUnlock(Behavior.CALL_THROUGH);
        return this;
    }

    @Override
    public AsyncSpy<F> throwError(Throwable error) {
        spy.requireThrowable(error);
        replaceDefaultAndUnlock(new Behavior.ThrowError(error));
        return this;
    }

    @Override
    public AsyncSpy<F> callFake(F implementation) {
        replaceDefaultAndUnlock(new Behavior.CallFake(Objects.requireNonNull(implementation, "implementation")));
        return this;
    }

    private void replaceDefaultAndUnlock(Behavior next) {
        synchronized (behavior) {
            behavior.setDefault(next);
            behavior.clearQueue();
            behavior.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Locking defaults
    // ---------------------------------------------------------------------

    @Override
    public AsyncSpy<F> returnValue(Object value) {
        spy.requireReturnable(value);
        replaceDefaultAndLock(new Behavior.FixedValue(value));
        return this;
    }

    @Override
    public AsyncSpy<F> returnValues(Object... values) {
        Behavior.SequentialValues sequence = Behavior.SequentialValues.of(values);
        sequence.values().forEach(spy::requireReturnable);
        replaceDefaultAndLock(sequence);
        return this;
    }

    @Override
    public AsyncSpy<F> resolvedValue(Object value) {
        spy.requireFutureReturn();
        replaceDefaultAndLock(new Behavior.ResolvedValue(value));
        return this;
    }

    @Override
    public AsyncSpy<F> rejectedValue(Throwable error) {
        spy.requireFutureReturn();
        replaceDefaultAndLock(new Behavior.RejectedValue(error));
        return this;
    }

    private void replaceDefaultAndLock(Behavior next) {
        synchronized (behavior) {
            behavior.setDefault(next);
            behavior.lock();
        }
    }

    // ---------------------------------------------------------------------
    // Clearing
    // ---------------------------------------------------------------------

    @Override
    public AsyncSpy<F> clearCalls() {
        spy.callLog().clear();
        return this;
    }

    @Override
    public AsyncSpy<F> clearReturnValues() {
        behavior.clear();
        return this;
    }

    @Override
    public AsyncSpy<F> clearAll() {
        clearCalls();
        return clearReturnValues();
    }

    @Override
    public boolean isLocked() {
        return behavior.isLocked();
    }

    @Override
    public int queuedBehaviors() {
        return behavior.queued();
    }

    // ---------------------------------------------------------------------
    // Delegation
    // ---------------------------------------------------------------------

    @Override
    public F fn() {
        return spy.fn();
    }

    @Override
    public Class<F> type() {
        return spy.type();
    }

    @Override
    public F original() {
        return spy.original();
    }

    @Override
    public Optional<Object> owner() {
        return spy.owner();
    }

    @Override
    public String memberName() {
        return spy.memberName();
    }

    @Override
    public void restore() {
        spy.restore();
    }

    @Override
    public void reset() {
        spy.reset();
    }

    @Override
    public List<SpyCall> calls() {
        return spy.calls();
    }

    @Override
    public int callCount() {
        return spy.callCount();
    }

    @Override
    public boolean calledWith(Object... args) {
        return spy.calledWith(args);
    }

    @Override
    public Optional<SpyCall> firstCall() {
        return spy.firstCall();
    }

    @Override
    public Optional<SpyCall> lastCall() {
        return spy.lastCall();
    }

    @Override
    public Optional<SpyCall> getCall(int index) {
        return spy.getCall(index);
    }

    @Override
    public String toString() {
        return "AsyncSpy<" + memberName() + ">";
    }
}
