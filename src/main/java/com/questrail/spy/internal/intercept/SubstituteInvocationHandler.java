package com.questrail.spy.internal.intercept;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.util.Objects;

/**
 * Routes calls on a substitute proxy.
 *
 * <ul>
 *   <li>{@code equals}/{@code hashCode}/{@code toString}: identity semantics and
 *       a {@code Spy<name>} label</li>
 *   <li>default interface methods: their own body, which calls back into the proxy</li>
 *   <li>the functional method: the owning spy's {@link CallHandler}</li>
 * </ul>
 */
public final class SubstituteInvocationHandler implements InvocationHandler
{
    private static final Method EQUALS;
    private static final Method HASH_CODE;
    private static final Method TO_STRING;

    static {
        try {
            EQUALS = Object.class.getMethod("equals", Object.class);
            HASH_CODE = Object.class.getMethod("hashCode");
            TO_STRING = Object.class.getMethod("toString");
        } catch (NoSuchMethodException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private final String name;
    private final FunctionalMethod functionalMethod;
    private final Object owner;
    private volatile CallHandler callHandler;

    public SubstituteInvocationHandler(String name, FunctionalMethod functionalMethod, Object owner) {
        this.name = Objects.requireNonNull(name, "name");
        this.functionalMethod = Objects.requireNonNull(functionalMethod, "functionalMethod");
        this.owner = owner;
    }

    /**
     * The spy that owns this proxy, as a plain object so the engine can find a
     * spy from its callable.
     */
    public Object owner() {
        return owner;
    }

    public void bind(CallHandler callHandler) {
        this.callHandler = Objects.requireNonNull(callHandler, "callHandler");
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        if (method.equals(EQUALS)) {
            return proxy == args[0];
        }
        if (method.equals(HASH_CODE)) {
            return System.identityHashCode(proxy);
        }
        if (method.equals(TO_STRING)) {
            return "Spy<" + name + ">";
        }
        if (method.isDefault()) {
            return InvocationHandler.invokeDefault(proxy, method, args);
        }

        CallHandler handler = callHandler;
        if (handler == null) {
            throw new IllegalStateException("Substitute " + name + " is not bound to a spy");
        }
        return functionalMethod.adaptResult(handler.handle(args));
    }
}
