package com.questrail.spy.api;

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * AccessorSpy
 * -----------------------------------------------------------------------------
 * Handle over an intercepted {@link Accessor}. Reads and writes are tracked by
 * two independent spies; restoring the handle reinstates the original accessor
 * instance.
 *
 * @param <T> property value type
 */
public interface AccessorSpy<T> extends Substitute
{
    Spy<Supplier<T>> get();

    Spy<Consumer<T>> set();
}
