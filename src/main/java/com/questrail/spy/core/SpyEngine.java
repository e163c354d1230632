package com.questrail.spy.core;

import com.questrail.spy.api.AccessorSpy;
import com.questrail.spy.api.AsyncSpy;
import com.questrail.spy.api.Spy;
import com.questrail.spy.api.SpyCall;
import com.questrail.spy.api.SpyFunction;
import com.questrail.spy.api.SpyUsageException;
import com.questrail.spy.api.Substitute;
import com.questrail.spy.config.SpyEngineConfig;
import com.questrail.spy.integration.SpyInspector;
import com.questrail.spy.internal.intercept.MemberSnapshot;
import com.questrail.spy.internal.intercept.SubstituteProxies;
import com.questrail.spy.registry.SpyRegistry;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SpyEngine
 * =============================================================================
 * Creates substitutes, swaps them into place on their owners, and keeps the
 * registry that lets a test lifecycle restore them all at once.
 *
 * <h2>Interception</h2>
 * <ul>
 *   <li>{@link #spyOn(Object, String)}: a functional interface member becomes a
 *       {@link Spy} whose callable replaces the member value</li>
 *   <li>{@link #spyOnAccessor(Object, String)}: an {@link com.questrail.spy.api.Accessor}
 *       member becomes an {@link AccessorSpy}</li>
 *   <li>{@link #wrap(Object, String)}: either of the above, by member kind</li>
 *   <li>{@link #spyOnAsync(Object, String)}: like {@code spyOn}, returning an
 *       {@link AsyncSpy}; an existing substitute on the member is restored first</li>
 * </ul>
 * A member that already holds a substitute cannot be wrapped again by the
 * synchronous entry points; the test must restore it first.
 *
 * <h2>Standalone substitutes</h2>
 * {@link #createSpy(Class)} and friends build spies bound to no owner. They
 * are never registered, since there is nothing to restore.
 *
 * <h2>Threading model</h2>
 * The engine assumes the cooperative single-threaded use typical of a test
 * body. Registry and per-spy state are synchronized, but wrapping the same
 * member from two threads at once is not guarded beyond the duplicate check.
 */
public final class SpyEngine implements SpyInspector
{
    private final EngineContext context;

    public SpyEngine() {
        this(SpyEngineConfig.defaults());
    }

    public SpyEngine(SpyEngineConfig config) {
        this(config, new SpyRegistry(config.observabilitySink(), config.wallClock()));
    }

    public SpyEngine(SpyEngineConfig config, SpyRegistry registry) {
        this.context = new EngineContext(config, registry);
    }

    public SpyEngineConfig config() {
        return context.config();
    }

    public SpyRegistry registry() {
        return context.registry();
    }

    // ---------------------------------------------------------------------
    // Interception
    // ---------------------------------------------------------------------

    /**
     * Intercepts a callable or accessor member, whichever it is.
     */
    public Substitute wrap(Object owner, String memberName) {
        MemberSnapshot snapshot = captureUnintercepted(owner, memberName);
        if (snapshot.kind() == MemberSnapshot.Kind.ACCESSOR) {
            return installAccessor(snapshot);
        }
        return installSpy(snapshot, "spy");
    }

    public <F> Spy<F> spyOn(Object owner, String memberName) {
        MemberSnapshot snapshot = captureUnintercepted(owner, memberName);
        requireCallable(snapshot, "spyOnAccessor");
        return installSpy(snapshot, "spy");
    }

    public <T> AccessorSpy<T> spyOnAccessor(Object owner, String memberName) {
        MemberSnapshot snapshot = captureUnintercepted(owner, memberName);
        if (snapshot.kind() != MemberSnapshot.Kind.ACCESSOR) {
            throw new SpyUsageException("Member '" + memberName + "' is not an accessor; use spyOn");
        }
        return installAccessor(snapshot);
    }

    public <F> AsyncSpy<F> spyOnAsync(Object owner, String memberName) {
        Object current = MemberSnapshot.capture(owner, memberName).originalValue();
        spyOf(current).ifPresent(Substitute::restore);

        MemberSnapshot snapshot = captureUnintercepted(owner, memberName);
        requireCallable(snapshot, "spyOnAccessor");
        BasicSpy<F> spy = installSpy(snapshot, "asyncSpy");
        return new AsyncSpyDecorator<>(spy);
    }

    private MemberSnapshot captureUnintercepted(Object owner, String memberName) {
        MemberSnapshot snapshot = MemberSnapshot.capture(owner, memberName);
        if (isSpy(snapshot.originalValue())) {
            throw new SpyUsageException("Method '" + memberName + "' is already a spy. Restore it first.");
        }
        return snapshot;
    }

    private static void requireCallable(MemberSnapshot snapshot, String alternative) {
        if (snapshot.kind() != MemberSnapshot.Kind.CALLABLE) {
            throw new SpyUsageException("Member '" + snapshot.memberName() + "' is an accessor; use " + alternative);
        }
    }

    @SuppressWarnings("unchecked")
    private <F> BasicSpy<F> installSpy(MemberSnapshot snapshot, String kind) {
        Class<F> type = (Class<F>) snapshot.declaredType();
        F original = type.cast(snapshot.originalValue());

        BasicSpy<F> spy = new BasicSpy<>(type, original, SpyBinding.member(snapshot), context);
        spy.markKind(kind);
        snapshot.install(spy.fn());
        context.registry().add(spy);
        context.installed(spy.binding(), kind);
        return spy;
    }

    private <T> AccessorSpy<T> installAccessor(MemberSnapshot snapshot) {
        DefaultAccessorSpy<T> spy = new DefaultAccessorSpy<>(snapshot, context);
        spy.install();
        context.registry().add(spy);
        context.installed(SpyBinding.member(snapshot), "accessor");
        return spy;
    }

    // ---------------------------------------------------------------------
    // Standalone substitutes
    // ---------------------------------------------------------------------

    public <F> Spy<F> createSpy(Class<F> type) {
        return createSpy(type, null, null);
    }

    public <F> Spy<F> createSpy(Class<F> type, String name) {
        return createSpy(type, name, null);
    }

    /**
     * @param original call-through target; when {@code null}, calls return the
     *                 zero value of the return type
     */
    public <F> Spy<F> createSpy(Class<F> type, String name, F original) {
        return standalone(type, name != null ? name : "spy", original);
    }

    public Spy<SpyFunction> createSpyFunction() {
        return createSpy(SpyFunction.class, null, null);
    }

    public Spy<SpyFunction> createSpyFunction(String name) {
        return createSpy(SpyFunction.class, name, null);
    }

    public Spy<SpyFunction> createSpyFunction(String name, SpyFunction original) {
        return createSpy(SpyFunction.class, name, original);
    }

    public <F> AsyncSpy<F> createAsyncSpy(Class<F> type) {
        return createAsyncSpy(type, null, null);
    }

    public <F> AsyncSpy<F> createAsyncSpy(Class<F> type, String name) {
        return createAsyncSpy(type, name, null);
    }

    public <F> AsyncSpy<F> createAsyncSpy(Class<F> type, String name, F original) {
        return new AsyncSpyDecorator<>(standalone(type, name != null ? name : "asyncSpy", original));
    }

    public AsyncSpy<SpyFunction> createAsyncSpyFunction(String name) {
        return createAsyncSpy(SpyFunction.class, name, null);
    }

    private <F> BasicSpy<F> standalone(Class<F> type, String name, F original) {
        return new BasicSpy<>(type, original, SpyBinding.standalone(name), context);
    }

    /**
     * Adds async capabilities to an existing spy. The spy keeps its callable,
     * its recorded calls and its registration; an async spy is returned as is.
     */
    public <F> AsyncSpy<F> enhanceSpy(Spy<F> spy) {
        Objects.requireNonNull(spy, "spy");
        if (spy instanceof AsyncSpy<F> async) {
            return async;
        }
        if (spy instanceof BasicSpy<F> basic) {
            return new AsyncSpyDecorator<>(basic);
        }
        throw new SpyUsageException("Cannot enhance " + spy.getClass().getName());
    }

    // ---------------------------------------------------------------------
    // Registry and lookup
    // ---------------------------------------------------------------------

    /**
     * Restores every substitute this engine installed and clears the registry.
     * Safe to call any number of times.
     */
    public void restoreAllSpies() {
        context.registry().restoreAll();
    }

    /**
     * The spy behind a substitute callable, or the value itself if it is a spy.
     */
    public Optional<Spy<?>> spyOf(Object value) {
        if (value instanceof Spy<?> spy) {
            return Optional.of(spy);
        }
        return SubstituteProxies.handlerOf(value)
                .map(handler -> (Spy<?>) handler.owner());
    }

    @Override
    public boolean isSpy(Object value) {
        return value instanceof Substitute
                || value instanceof RedirectingAccessor<?>
                || SubstituteProxies.isSubstitute(value);
    }

    @Override
    public int callCount(Object value) {
        return spyOf(value).map(Spy::callCount).orElse(0);
    }

    @Override
    public List<SpyCall> calls(Object value) {
        return spyOf(value).map(Spy::calls).orElse(List.of());
    }
}
