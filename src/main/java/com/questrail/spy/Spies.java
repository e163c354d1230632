package com.questrail.spy;

import com.questrail.spy.api.AccessorSpy;
import com.questrail.spy.api.AsyncSpy;
import com.questrail.spy.api.Spy;
import com.questrail.spy.api.SpyFunction;
import com.questrail.spy.api.Substitute;
import com.questrail.spy.core.SpyEngine;

import java.util.Optional;

/**
 * Spies
 * =============================================================================
 * Static entry points over one process-wide {@link SpyEngine}.
 *
 * <p>The default engine and its registry live for the whole test run. Tests
 * that want isolation construct their own engine instead; everything here
 * simply delegates.</p>
 *
 * <pre>
 * Spy&lt;IntSupplier&gt; spy = Spies.spyOn(service, "nextId");
 * spy.returnValues(10, 20, 30);
 * ...
 * Spies.restoreAllSpies();
 * </pre>
 */
public final class Spies
{
    private static final SpyEngine DEFAULT_ENGINE = new SpyEngine();

    private Spies() {}

    public static SpyEngine engine() {
        return DEFAULT_ENGINE;
    }

    public static Substitute wrap(Object owner, String memberName) {
        return DEFAULT_ENGINE.wrap(owner, memberName);
    }

    public static <F> Spy<F> spyOn(Object owner, String memberName) {
        return DEFAULT_ENGINE.spyOn(owner, memberName);
    }

    public static <T> AccessorSpy<T> spyOnAccessor(Object owner, String memberName) {
        return DEFAULT_ENGINE.spyOnAccessor(owner, memberName);
    }

    public static <F> AsyncSpy<F> spyOnAsync(Object owner, String memberName) {
        return DEFAULT_ENGINE.spyOnAsync(owner, memberName);
    }

    public static <F> Spy<F> createSpy(Class<F> type) {
        return DEFAULT_ENGINE.createSpy(type);
    }

    public static <F> Spy<F> createSpy(Class<F> type, String name, F original) {
        return DEFAULT_ENGINE.createSpy(type, name, original);
    }

    public static Spy<SpyFunction> createSpyFunction() {
        return DEFAULT_ENGINE.createSpyFunction();
    }

    public static Spy<SpyFunction> createSpyFunction(String name) {
        return DEFAULT_ENGINE.createSpyFunction(name);
    }

    public static <F> AsyncSpy<F> createAsyncSpy(Class<F> type) {
        return DEFAULT_ENGINE.createAsyncSpy(type);
    }

    public static <F> AsyncSpy<F> createAsyncSpy(Class<F> type, String name, F original) {
        return DEFAULT_ENGINE.createAsyncSpy(type, name, original);
    }

    public static AsyncSpy<SpyFunction> createAsyncSpyFunction(String name) {
        return DEFAULT_ENGINE.createAsyncSpyFunction(name);
    }

    public static <F> AsyncSpy<F> enhanceSpy(Spy<F> spy) {
        return DEFAULT_ENGINE.enhanceSpy(spy);
    }

    /**
     * Restores every substitute installed through the default engine. Meant
     * for an after-each hook.
     */
    public static void restoreAllSpies() {
        DEFAULT_ENGINE.restoreAllSpies();
    }

    public static boolean isSpy(Object value) {
        return DEFAULT_ENGINE.isSpy(value);
    }

    public static Optional<Spy<?>> spyOf(Object value) {
        return DEFAULT_ENGINE.spyOf(value);
    }
}
