package com.questrail.spy.internal.intercept;

import com.questrail.spy.api.SpyCall;

import java.lang.reflect.InvocationTargetException;
import java.util.List;

/**
 * One in-flight call of a substitute. Collects what the eventual
 * {@link SpyCall} needs and performs reflective delegation.
 */
public final class Invocation
{
    private final FunctionalMethod method;
    private final Object[] rawArgs;
    private final List<Object> args;
    private final Object receiver;
    private final long timestampNanos;
    private Throwable rejection;

    public Invocation(FunctionalMethod method, Object[] rawArgs, Object receiver, long timestampNanos) {
        this.method = method;
        this.rawArgs = rawArgs == null ? new Object[0] : rawArgs;
        this.args = method.recordedArgs(this.rawArgs);
        this.receiver = receiver;
        this.timestampNanos = timestampNanos;
    }

    public FunctionalMethod method() {
        return method;
    }

    public List<Object> args() {
        return args;
    }

    public Object receiver() {
        return receiver;
    }

    /**
     * Invokes {@code target} with this call's arguments. Whatever the target
     * raises is rethrown unwrapped.
     */
    public Object invokeOn(Object target) throws Throwable {
        try {
            return method.method().invoke(target, rawArgs);
        } catch (InvocationTargetException e) {
            throw e.getCause();
        }
    }

    /**
     * Marks this call as answered with a rejected deferred result.
     */
    public void recordRejection(Throwable error) {
        this.rejection = error;
    }

    public SpyCall returned(Object result) {
        return new SpyCall(args, receiver, result, rejection, timestampNanos);
    }

    public SpyCall raised(Throwable error) {
        return new SpyCall(args, receiver, null, error, timestampNanos);
    }
}
