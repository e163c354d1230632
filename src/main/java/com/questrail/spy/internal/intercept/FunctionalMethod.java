package com.questrail.spy.internal.intercept;

import com.questrail.spy.api.SpyUsageException;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * FunctionalMethod
 * -----------------------------------------------------------------------------
 * The single abstract method of a functional interface, plus the type rules a
 * substitute for it has to respect.
 *
 * <h2>Return values</h2>
 * <ul>
 *   <li>{@code null} for a primitive return type becomes that type's zero value</li>
 *   <li>{@code void} methods discard whatever was produced</li>
 *   <li>other values must be instances of the (boxed) return type</li>
 * </ul>
 */
public final class FunctionalMethod
{
    private static final Map<Class<?>, Object> DEFAULT_RETURN_VALUES = Map.of(
            int.class, 0,
            boolean.class, false,
            byte.class, (byte) 0,
            long.class, 0L,
            short.class, (short) 0,
            float.class, 0f,
            double.class, 0d,
            char.class, '\u0000'
    );

    private static final Map<Class<?>, Class<?>> PRIMITIVE_TO_BOXED = Map.of(
            int.class, Integer.class,
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            long.class, Long.class,
            short.class, Short.class,
            float.class, Float.class,
            double.class, Double.class,
            char.class, Character.class
    );

    private final Class<?> type;
    private final Method method;

    private FunctionalMethod(Class<?> type, Method method) {
        this.type = type;
        this.method = method;
        // Needed for Method.invoke on non-public interfaces.
        this.method.trySetAccessible();
    }

    /**
     * Resolves the single abstract method of {@code type}.
     *
     * @throws SpyUsageException if {@code type} is not a functional interface
     */
    public static FunctionalMethod of(Class<?> type) {
        Objects.requireNonNull(type, "type");
        if (!type.isInterface()) {
            throw new SpyUsageException(type.getName() + " is not an interface");
        }

        List<Method> abstractMethods = new ArrayList<>();
        for (Method m : type.getMethods()) {
            if (Modifier.isAbstract(m.getModifiers()) && !isObjectMethod(m)) {
                abstractMethods.add(m);
            }
        }
        if (abstractMethods.size() != 1) {
            throw new SpyUsageException(type.getName() + " is not a functional interface ("
                    + abstractMethods.size() + " abstract methods)");
        }
        return new FunctionalMethod(type, abstractMethods.get(0));
    }

    /**
     * True if {@code type} is an interface with exactly one abstract method.
     */
    public static boolean isFunctional(Class<?> type) {
        if (!type.isInterface()) {
            return false;
        }
        return Arrays.stream(type.getMethods())
                .filter(m -> Modifier.isAbstract(m.getModifiers()) && !isObjectMethod(m))
                .count() == 1;
    }

    private static boolean isObjectMethod(Method m) {
        try {
            Object.class.getMethod(m.getName(), m.getParameterTypes());
            return true;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    public Class<?> type() {
        return type;
    }

    public Method method() {
        return method;
    }

    public Class<?> returnType() {
        return method.getReturnType();
    }

    public boolean isVoid() {
        return method.getReturnType() == void.class;
    }

    /**
     * Zero value of the return type; {@code null} for reference and void types.
     */
    public Object defaultReturnValue() {
        return DEFAULT_RETURN_VALUES.get(method.getReturnType());
    }

    /**
     * Value handed back to the proxy caller for a produced result.
     */
    public Object adaptResult(Object result) {
        if (isVoid()) {
            return null;
        }
        if (result == null) {
            return defaultReturnValue();
        }
        return result;
    }

    public boolean canReturn(Object value) {
        if (isVoid() || value == null) {
            return true;
        }
        Class<?> rt = method.getReturnType();
        Class<?> boxed = rt.isPrimitive() ? PRIMITIVE_TO_BOXED.get(rt) : rt;
        return boxed.isInstance(value);
    }

    public boolean canReturnFuture() {
        return method.getReturnType().isAssignableFrom(CompletableFuture.class);
    }

    /**
     * Unchecked errors can always be raised; checked ones only when declared.
     */
    public boolean canThrow(Throwable error) {
        if (error instanceof RuntimeException || error instanceof Error) {
            return true;
        }
        for (Class<?> declared : method.getExceptionTypes()) {
            if (declared.isInstance(error)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Arguments as recorded: varargs arrays are flattened into positions.
     */
    public List<Object> recordedArgs(Object[] rawArgs) {
        List<Object> args = new ArrayList<>();
        if (rawArgs == null) {
            return args;
        }
        int last = rawArgs.length - 1;
        for (int i = 0; i < rawArgs.length; i++) {
            if (i == last && method.isVarArgs() && rawArgs[i] instanceof Object[] varargs) {
                args.addAll(Arrays.asList(varargs));
            } else {
                args.add(rawArgs[i]);
            }
        }
        return args;
    }

    @Override
    public String toString() {
        return type.getSimpleName() + "." + method.getName();
    }
}
