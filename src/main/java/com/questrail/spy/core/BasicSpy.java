package com.questrail.spy.core;

import com.questrail.spy.api.Spy;
import com.questrail.spy.api.SpyCall;
import com.questrail.spy.api.SpyUsageException;
import com.questrail.spy.internal.behavior.Behavior;
import com.questrail.spy.internal.behavior.BehaviorConfiguration;
import com.questrail.spy.internal.intercept.FunctionalMethod;
import com.questrail.spy.internal.intercept.Invocation;
import com.questrail.spy.internal.intercept.MemberSnapshot;
import com.questrail.spy.internal.intercept.SubstituteInvocationHandler;
import com.questrail.spy.internal.intercept.SubstituteProxies;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * BasicSpy
 * -----------------------------------------------------------------------------
 * The synchronous substitute pipeline behind every {@link Spy}.
 *
 * <h2>Per call</h2>
 * <ol>
 *   <li>stamp a new invocation with arguments, receiver and monotonic time</li>
 *   <li>ask the {@link BehaviorConfiguration} for the behavior to apply</li>
 *   <li>execute it, capturing the value or the raised error</li>
 *   <li>append the completed {@link SpyCall}, then return or rethrow</li>
 * </ol>
 *
 * The base API only ever sets defaults, so the once-queue stays empty unless
 * an {@link AsyncSpyDecorator} shares this spy's configuration.
 *
 * <h2>Restoration</h2>
 * Member-bound spies put the snapshot's original value back (only while the
 * member still holds this spy's proxy) and leave the registry. Accessor halves
 * restore their whole pair. Restoration never throws; a failed write is
 * reported to the observability sink.
 */
public final class BasicSpy<F> implements Spy<F>
{
    private final Class<F> type;
    private final FunctionalMethod functionalMethod;
    private final F original;
    private final F proxy;
    private final SpyBinding binding;
    private final EngineContext context;

    private final CallLog callLog = new CallLog();
    private final BehaviorConfiguration behavior = new BehaviorConfiguration();

    private volatile String kind = "spy";

    public BasicSpy(Class<F> type, F original, SpyBinding binding, EngineContext context) {
        this.type = Objects.requireNonNull(type, "type");
        this.functionalMethod = FunctionalMethod.of(type);
        this.binding = Objects.requireNonNull(binding, "binding");
        this.context = Objects.requireNonNull(context, "context");
        this.original = original != null ? original : NoopImplementations.of(type, functionalMethod);

        SubstituteInvocationHandler handler =
                new SubstituteInvocationHandler(binding.memberName(), functionalMethod, this);
        this.proxy = SubstituteProxies.create(type, handler);
        handler.bind(this::handle);
    }

    private Object handle(Object[] rawArgs) throws Throwable {
        Invocation invocation = new Invocation(
                functionalMethod, rawArgs, binding.receiver(), context.config().clock().nowNanos());

        Behavior selected = behavior.next();
        Object result;
        try {
            result = BehaviorExecutor.execute(selected, invocation, original);
        } catch (Throwable error) {
            callLog.append(invocation.raised(error));
            throw error;
        }
        callLog.append(invocation.returned(result));
        return result;
    }

    // ---------------------------------------------------------------------
    // Shared with the async decorator
    // ---------------------------------------------------------------------

    BehaviorConfiguration behavior() {
        return behavior;
    }

    CallLog callLog() {
        return callLog;
    }

    FunctionalMethod functionalMethod() {
        return functionalMethod;
    }

    SpyBinding binding() {
        return binding;
    }

    String kind() {
        return kind;
    }

    void markKind(String kind) {
        this.kind = kind;
    }

    // ---------------------------------------------------------------------
    // Identity
    // ---------------------------------------------------------------------

    @Override
    public F fn() {
        return proxy;
    }

    @Override
    public Class<F> type() {
        return type;
    }

    @Override
    public F original() {
        return original;
    }

    @Override
    public Optional<Object> owner() {
        return binding.owner();
    }

    @Override
    public String memberName() {
        return binding.memberName();
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void restore() {
        if (binding.parent().isPresent()) {
            binding.parent().get().restore();
            return;
        }

        Optional<MemberSnapshot> snapshot = binding.snapshot();
        if (snapshot.isPresent()) {
            try {
                if (snapshot.get().restoreIfStillInstalled(proxy)) {
                    context.restored(binding, kind);
                }
            } catch (RuntimeException e) {
                context.error("Failed to restore " + snapshot.get(), e);
            }
        }
        context.registry().remove(this);
    }

    @Override
    public void reset() {
        callLog.clear();
        behavior.resetCursor();
    }

    // ---------------------------------------------------------------------
    // Behavior
    // ---------------------------------------------------------------------

    @Override
    public Spy<F> callThrough() {
        behavior.setDefault(Behavior.CALL_THROUGH);
        return this;
    }

    @Override
    public Spy<F> returnValue(Object value) {
        requireReturnable(value);
        behavior.setDefault(new Behavior.FixedValue(value));
        return this;
    }

    @Override
    public Spy<F> returnValues(Object... values) {
        Behavior.SequentialValues sequence = Behavior.SequentialValues.of(values);
        sequence.values().forEach(this::requireReturnable);
        behavior.setDefault(sequence);
        return this;
    }

    @Override
    public Spy<F> throwError(Throwable error) {
        requireThrowable(error);
        behavior.setDefault(new Behavior.ThrowError(error));
        return this;
    }

    @Override
    public Spy<F> callFake(F implementation) {
        behavior.setDefault(new Behavior.CallFake(Objects.requireNonNull(implementation, "implementation")));
        return this;
    }

    void requireReturnable(Object value) {
        if (!functionalMethod.canReturn(value)) {
            throw new SpyUsageException("Spy '" + memberName() + "' cannot return a "
                    + value.getClass().getName() + " from " + functionalMethod
                    + " (returns " + functionalMethod.returnType().getName() + ")");
        }
    }

    void requireFutureReturn() {
        if (!functionalMethod.canReturnFuture()) {
            throw new SpyUsageException("Spy '" + memberName() + "' cannot return a deferred result from "
                    + functionalMethod + " (returns " + functionalMethod.returnType().getName() + ")");
        }
    }

    void requireThrowable(Throwable error) {
        Objects.requireNonNull(error, "error");
        if (!functionalMethod.canThrow(error)) {
            throw new SpyUsageException("Checked exception " + error.getClass().getName()
                    + " is not declared by " + functionalMethod);
        }
    }

    // ---------------------------------------------------------------------
    // Inspection
    // ---------------------------------------------------------------------

    @Override
    public List<SpyCall> calls() {
        return callLog.snapshot();
    }

    @Override
    public int callCount() {
        return callLog.size();
    }

    @Override
    public boolean calledWith(Object... args) {
        // calledWith(null) arrives as a null array and means one null argument
        Object[] expected = args == null ? new Object[] { null } : args;
        return callLog.anyMatch(Arrays.asList(expected), context.config().equality());
    }

    @Override
    public Optional<SpyCall> firstCall() {
        return callLog.first();
    }

    @Override
    public Optional<SpyCall> lastCall() {
        return callLog.last();
    }

    @Override
    public Optional<SpyCall> getCall(int index) {
        return callLog.get(index);
    }

    @Override
    public String toString() {
        return "Spy<" + memberName() + ">";
    }
}
