package com.questrail.spy.core;

import com.questrail.spy.api.Substitute;
import com.questrail.spy.internal.intercept.MemberSnapshot;

import java.util.Objects;
import java.util.Optional;

/**
 * Where a spy lives: standalone, directly on an owner's member, or as one half
 * of an intercepted accessor pair.
 */
public final class SpyBinding
{
    private final String memberName;
    private final Object owner;
    private final MemberSnapshot snapshot;
    private final Substitute parent;

    private SpyBinding(String memberName, Object owner, MemberSnapshot snapshot, Substitute parent) {
        this.memberName = Objects.requireNonNull(memberName, "memberName");
        this.owner = owner;
        this.snapshot = snapshot;
        this.parent = parent;
    }

    public static SpyBinding standalone(String name) {
        return new SpyBinding(name, null, null, null);
    }

    public static SpyBinding member(MemberSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        return new SpyBinding(snapshot.memberName(), snapshot.owner(), snapshot, null);
    }

    /**
     * Getter or setter half of an accessor pair. The snapshot stays with the
     * accessor handle, so restoring a half restores the whole pair.
     */
    public static SpyBinding accessorPart(Object owner, String memberName, Substitute parent) {
        return new SpyBinding(memberName, Objects.requireNonNull(owner, "owner"), null,
                Objects.requireNonNull(parent, "parent"));
    }

    public String memberName() {
        return memberName;
    }

    public Optional<Object> owner() {
        return Optional.ofNullable(owner);
    }

    /**
     * The {@code this} a call is recorded with; static members have none.
     */
    public Object receiver() {
        return owner instanceof Class<?> ? null : owner;
    }

    public Optional<MemberSnapshot> snapshot() {
        return Optional.ofNullable(snapshot);
    }

    public Optional<Substitute> parent() {
        return Optional.ofNullable(parent);
    }

    String ownerLabel() {
        if (owner == null) {
            return null;
        }
        return owner instanceof Class<?> c ? c.getSimpleName() : owner.getClass().getSimpleName();
    }
}
