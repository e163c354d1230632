package com.questrail.spy.api;

/**
 * Untyped callback used for standalone substitutes that are passed where any
 * callable will do.
 */
@FunctionalInterface
public interface SpyFunction
{
    Object call(Object... args);
}
