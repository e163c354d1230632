package com.questrail.spy.core;

import com.questrail.spy.api.SpyCall;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * Append-only, insertion-ordered log of the calls a substitute received.
 * {@link #clear()} empties it without replacing it.
 */
public final class CallLog
{
    private final List<SpyCall> calls = new ArrayList<>();

    public synchronized void append(SpyCall call) {
        calls.add(Objects.requireNonNull(call, "call"));
    }

    public synchronized void clear() {
        calls.clear();
    }

    public synchronized int size() {
        return calls.size();
    }

    public synchronized List<SpyCall> snapshot() {
        return List.copyOf(calls);
    }

    public synchronized Optional<SpyCall> get(int index) {
        if (index < 0 || index >= calls.size()) {
            return Optional.empty();
        }
        return Optional.of(calls.get(index));
    }

    public synchronized Optional<SpyCall> first() {
        return get(0);
    }

    public synchronized Optional<SpyCall> last() {
        return get(calls.size() - 1);
    }

    /**
     * True iff some call has the same number of arguments and every position
     * is equal under {@code equality}.
     */
    public synchronized boolean anyMatch(List<Object> expected, BiPredicate<Object, Object> equality) {
        for (SpyCall call : calls) {
            if (argumentsMatch(expected, call.args(), equality)) {
                return true;
            }
        }
        return false;
    }

    private static boolean argumentsMatch(List<Object> expected, List<Object> actual,
                                          BiPredicate<Object, Object> equality) {
        if (expected.size() != actual.size()) {
            return false;
        }
        for (int i = 0; i < expected.size(); i++) {
            if (!equality.test(expected.get(i), actual.get(i))) {
                return false;
            }
        }
        return true;
    }
}
