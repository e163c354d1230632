package com.questrail.spy.internal.intercept;

/**
 * Receives every functional call made on a substitute proxy.
 */
@FunctionalInterface
public interface CallHandler
{
    /**
     * @return the produced value, before return-type adaptation
     */
    Object handle(Object[] args) throws Throwable;
}
