package com.questrail.spy.internal.intercept;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Proxy;
import java.util.Optional;

/**
 * Creates substitute proxies and recognizes them again.
 */
public final class SubstituteProxies
{
    private SubstituteProxies() {}

    public static <F> F create(Class<F> type, SubstituteInvocationHandler handler) {
        Object proxy = Proxy.newProxyInstance(classLoaderFor(type), new Class<?>[] { type }, handler);
        return type.cast(proxy);
    }

    /**
     * The handler behind {@code value} if it is one of our substitute proxies.
     * Proxies without an owning spy (no-op originals) are not substitutes.
     */
    public static Optional<SubstituteInvocationHandler> handlerOf(Object value) {
        if (value == null || !Proxy.isProxyClass(value.getClass())) {
            return Optional.empty();
        }
        InvocationHandler handler = Proxy.getInvocationHandler(value);
        if (handler instanceof SubstituteInvocationHandler substituteHandler && substituteHandler.owner() != null) {
            return Optional.of(substituteHandler);
        }
        return Optional.empty();
    }

    public static boolean isSubstitute(Object value) {
        return handlerOf(value).isPresent();
    }

    private static ClassLoader classLoaderFor(Class<?> type) {
        ClassLoader loader = type.getClassLoader();
        return loader != null ? loader : SubstituteProxies.class.getClassLoader();
    }
}
