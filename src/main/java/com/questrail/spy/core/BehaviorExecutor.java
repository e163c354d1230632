package com.questrail.spy.core;

import com.questrail.spy.internal.behavior.Behavior;
import com.questrail.spy.internal.intercept.Invocation;

import java.util.concurrent.CompletableFuture;

/**
 * BehaviorExecutor
 * ============================================================================
 * Turns the {@link Behavior} selected for a call into that call's outcome.
 *
 * <h2>Outcomes</h2>
 * <ul>
 *   <li>call-through / fake: whatever the delegate returns or raises</li>
 *   <li>fixed value: the value, verbatim</li>
 *   <li>throw: the configured error is raised</li>
 *   <li>resolved value: an already-completed future</li>
 *   <li>rejected value: an already-failed future; the call does not raise,
 *       but the rejection is noted on the invocation</li>
 * </ul>
 *
 * Sequential defaults never reach this class; the configuration resolves them
 * to a fixed value per call.
 */
final class BehaviorExecutor
{
    private BehaviorExecutor() {}

    static Object execute(Behavior behavior, Invocation invocation, Object original) throws Throwable
    {
        if (behavior instanceof Behavior.CallThrough) {
            return invocation.invokeOn(original);
        }
        else if (behavior instanceof Behavior.FixedValue v) {
            return v.value();
        }
        else if (behavior instanceof Behavior.ThrowError t) {
            throw t.error();
        }
        else if (behavior instanceof Behavior.CallFake f) {
            return invocation.invokeOn(f.implementation());
        }
        else if (behavior instanceof Behavior.ResolvedValue r) {
            return CompletableFuture.completedFuture(r.value());
        }
        else if (behavior instanceof Behavior.RejectedValue r) {
            invocation.recordRejection(r.error());
            return CompletableFuture.failedFuture(r.error());
        }
        else {
            throw new IllegalStateException("Behavior cannot be executed directly: " + behavior);
        }
    }
}
