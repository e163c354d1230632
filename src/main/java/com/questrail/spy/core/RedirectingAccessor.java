package com.questrail.spy.core;

import com.questrail.spy.api.Accessor;

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * The accessor installed on an owner while its property is intercepted; reads
 * and writes go through the getter and setter spies.
 */
final class RedirectingAccessor<T> implements Accessor<T>
{
    private final String name;
    private final Supplier<T> getter;
    private final Consumer<T> setter;

    RedirectingAccessor(String name, Supplier<T> getter, Consumer<T> setter) {
        this.name = name;
        this.getter = getter;
        this.setter = setter;
    }

    @Override
    public T get() {
        return getter.get();
    }

    @Override
    public void set(T value) {
        setter.accept(value);
    }

    @Override
    public String toString() {
        return "Accessor<" + name + ">";
    }
}
