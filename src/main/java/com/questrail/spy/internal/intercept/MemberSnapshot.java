package com.questrail.spy.internal.intercept;

import com.questrail.spy.api.Accessor;
import com.questrail.spy.api.SpyUsageException;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Objects;

/**
 * MemberSnapshot
 * -----------------------------------------------------------------------------
 * What an owner's member held before interception, captured once at wrap time
 * and written back verbatim on restore.
 *
 * <h2>Members</h2>
 * A member is a non-final field on the owner's class or any superclass. When
 * the owner is a {@link Class}, the member is a static field of that class.
 * Field modifiers are never changed, so the only state to snapshot is the
 * original value.
 *
 * <h2>Kinds</h2>
 * <ul>
 *   <li>{@link Kind#CALLABLE}: declared type is a functional interface and the
 *       value is non-null</li>
 *   <li>{@link Kind#ACCESSOR}: declared type is exactly {@link Accessor} and the
 *       value is non-null</li>
 * </ul>
 * Anything else is a usage error.
 */
public final class MemberSnapshot
{
    public enum Kind {
        CALLABLE,
        ACCESSOR
    }

    private final Object owner;
    private final Object target;
    private final Field field;
    private final Object originalValue;
    private final Kind kind;

    private MemberSnapshot(Object owner, Object target, Field field, Object originalValue, Kind kind) {
        this.owner = owner;
        this.target = target;
        this.field = field;
        this.originalValue = originalValue;
        this.kind = kind;
    }

    /**
     * Resolves {@code memberName} on {@code owner} and captures its current value.
     *
     * @throws SpyUsageException if the member is missing, final, inaccessible,
     *                           or neither callable nor an accessor
     */
    public static MemberSnapshot capture(Object owner, String memberName) {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(memberName, "memberName");

        boolean staticMember = owner instanceof Class<?>;
        Class<?> ownerType = staticMember ? (Class<?>) owner : owner.getClass();

        Field field = findField(ownerType, memberName, staticMember);
        if (field == null) {
            throw new SpyUsageException("Member '" + memberName + "' does not exist on " + ownerType.getName());
        }
        if (Modifier.isFinal(field.getModifiers())) {
            throw new SpyUsageException("Member '" + memberName + "' of " + ownerType.getName()
                    + " is final and cannot be replaced");
        }
        if (!field.trySetAccessible()) {
            throw new SpyUsageException("Member '" + memberName + "' of " + ownerType.getName()
                    + " is not accessible");
        }

        Object target = staticMember ? null : owner;
        Object value = read(field, target);

        Kind kind;
        if (value != null && field.getType() == Accessor.class) {
            kind = Kind.ACCESSOR;
        } else if (value != null && FunctionalMethod.isFunctional(field.getType())) {
            kind = Kind.CALLABLE;
        } else {
            throw new SpyUsageException("Method '" + memberName + "' is not a function or accessor");
        }
        return new MemberSnapshot(owner, target, field, value, kind);
    }

    private static Field findField(Class<?> type, String name, boolean staticMember) {
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field f : c.getDeclaredFields()) {
                if (f.getName().equals(name) && Modifier.isStatic(f.getModifiers()) == staticMember) {
                    return f;
                }
            }
        }
        return null;
    }

    private static Object read(Field field, Object target) {
        try {
            return field.get(target);
        } catch (IllegalAccessException e) {
            throw new SpyUsageException("Cannot read member '" + field.getName() + "'", e);
        }
    }

    public Object owner() {
        return owner;
    }

    public String memberName() {
        return field.getName();
    }

    public Kind kind() {
        return kind;
    }

    public Class<?> declaredType() {
        return field.getType();
    }

    public Object originalValue() {
        return originalValue;
    }

    public Object currentValue() {
        return read(field, target);
    }

    /**
     * Puts {@code replacement} in place of the original.
     */
    public void install(Object replacement) {
        write(replacement);
    }

    /**
     * Writes the original value back if the member still holds
     * {@code installed}.
     *
     * @return {@code false} if something else has been installed since, in
     *         which case nothing is written
     */
    public boolean restoreIfStillInstalled(Object installed) {
        if (currentValue() != installed) {
            return false;
        }
        write(originalValue);
        return true;
    }

    private void write(Object value) {
        try {
            field.set(target, value);
        } catch (IllegalAccessException e) {
            throw new SpyUsageException("Cannot write member '" + field.getName() + "'", e);
        }
    }

    @Override
    public String toString() {
        return field.getDeclaringClass().getSimpleName() + "." + field.getName();
    }
}
