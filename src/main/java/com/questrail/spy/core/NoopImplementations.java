package com.questrail.spy.core;

import com.questrail.spy.internal.intercept.FunctionalMethod;
import com.questrail.spy.internal.intercept.SubstituteInvocationHandler;
import com.questrail.spy.internal.intercept.SubstituteProxies;

/**
 * Originals for standalone spies created without one: every call returns the
 * zero value of the return type and records nothing.
 */
final class NoopImplementations
{
    private NoopImplementations() {}

    static <F> F of(Class<F> type, FunctionalMethod functionalMethod) {
        SubstituteInvocationHandler handler =
                new SubstituteInvocationHandler("noop", functionalMethod, null);
        handler.bind(args -> functionalMethod.defaultReturnValue());
        return SubstituteProxies.create(type, handler);
    }
}
