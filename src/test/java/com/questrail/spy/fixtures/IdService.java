package com.questrail.spy.fixtures;

import com.questrail.spy.api.Accessor;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.IntSupplier;
import java.util.function.Supplier;

/**
 * Owner with one member of every interceptable shape.
 */
public class IdService {

    public IntSupplier nextId = () -> 1;

    public Function<String, String> greet = name -> "Hello " + name;

    public Runnable ping = () -> {};

    public Supplier<CompletableFuture<String>> fetch = () -> CompletableFuture.completedFuture("real");

    public Accessor<String> status = Accessor.of("idle");

    public Loader loader = key -> "loaded:" + key;

    public IntSupplier missing = null;

    public String label = "not callable";

    public final IntSupplier fixed = () -> 7;

    public static IntSupplier sharedCounter = () -> 42;

    /**
     * Functional interface with a declared checked exception and a default method.
     */
    @FunctionalInterface
    public interface Loader {
        String load(String key) throws java.io.IOException;

        default String loadOrDefault(String key, String fallback) {
            try {
                return load(key);
            } catch (java.io.IOException e) {
                return fallback;
            }
        }
    }
}
