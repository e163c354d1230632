package com.questrail.spy.api;

/**
 * Accessor
 * -----------------------------------------------------------------------------
 * A getter/setter pair exposed as a single interceptable member.
 *
 * An owner that wants a property to be observable by tests declares a
 * (non-final) field of this type. Wrapping that field yields an
 * {@link AccessorSpy} that tracks reads and writes independently.
 *
 * @param <T> property value type
 */
public interface Accessor<T>
{
    T get();

    void set(T value);

    /**
     * Creates an accessor backed by a plain mutable slot.
     */
    static <T> Accessor<T> of(T initialValue) {
        return new Accessor<>() {
            private T value = initialValue;

            @Override
            public T get() {
                return value;
            }

            @Override
            public void set(T value) {
                this.value = value;
            }
        };
    }
}
