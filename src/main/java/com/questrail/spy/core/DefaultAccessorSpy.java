package com.questrail.spy.core;

import com.questrail.spy.api.Accessor;
import com.questrail.spy.api.AccessorSpy;
import com.questrail.spy.api.Spy;
import com.questrail.spy.internal.intercept.MemberSnapshot;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * DefaultAccessorSpy
 * -----------------------------------------------------------------------------
 * Intercepts an {@link Accessor} member with two independent spies bound
 * under one handle.
 *
 * The getter spy's original is the original accessor's {@code get}, the
 * setter spy's original is its {@code set}, so call-through reads and writes
 * the real property. Restoring either half restores the pair.
 */
public final class DefaultAccessorSpy<T> implements AccessorSpy<T>
{
    private final MemberSnapshot snapshot;
    private final EngineContext context;
    private final BasicSpy<Supplier<T>> getter;
    private final BasicSpy<Consumer<T>> setter;
    private final RedirectingAccessor<T> installed;

    @SuppressWarnings("unchecked")
    public DefaultAccessorSpy(MemberSnapshot snapshot, EngineContext context) {
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
        this.context = Objects.requireNonNull(context, "context");
        if (snapshot.kind() != MemberSnapshot.Kind.ACCESSOR) {
            throw new IllegalArgumentException(snapshot + " is not an accessor");
        }

        Accessor<T> original = (Accessor<T>) snapshot.originalValue();
        Object owner = snapshot.owner();
        String name = snapshot.memberName();
        Supplier<T> read = original::get;
        Consumer<T> write = original::set;

        this.getter = new BasicSpy<>((Class<Supplier<T>>) (Class<?>) Supplier.class,
                read, SpyBinding.accessorPart(owner, name, this), context);
        this.setter = new BasicSpy<>((Class<Consumer<T>>) (Class<?>) Consumer.class,
                write, SpyBinding.accessorPart(owner, name, this), context);
        this.installed = new RedirectingAccessor<>(name, getter.fn(), setter.fn());
    }

    /**
     * Replaces the member with the redirecting accessor.
     */
    void install() {
        snapshot.install(installed);
    }

    Accessor<T> installedAccessor() {
        return installed;
    }

    @Override
    public Spy<Supplier<T>> get() {
        return getter;
    }

    @Override
    public Spy<Consumer<T>> set() {
        return setter;
    }

    @Override
    public Optional<Object> owner() {
        return Optional.of(snapshot.owner());
    }

    @Override
    public String memberName() {
        return snapshot.memberName();
    }

    @Override
    public void restore() {
        try {
            if (snapshot.restoreIfStillInstalled(installed)) {
                context.restored(SpyBinding.member(snapshot), "accessor");
            }
        } catch (RuntimeException e) {
            context.error("Failed to restore " + snapshot, e);
        }
        context.registry().remove(this);
    }

    @Override
    public void reset() {
        getter.reset();
        setter.reset();
    }

    @Override
    public String toString() {
        return "AccessorSpy<" + memberName() + ">";
    }
}
