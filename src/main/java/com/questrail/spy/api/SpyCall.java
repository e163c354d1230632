package com.questrail.spy.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Record of a single invocation of a substitute.
 *
 * <p>{@code error} holds what the call raised. For a call answered with a
 * rejected deferred result it holds the rejection as well, even though the
 * call itself returned normally; {@code returnValue} then holds the failed
 * future.</p>
 *
 * @param args           arguments in positional order, varargs flattened; may contain nulls
 * @param receiver       the object the member belongs to, or null for standalone substitutes
 * @param returnValue    produced value, or null when the call raised
 * @param error          raised or rejected error, or null
 * @param timestampNanos monotonic creation time
 */
public record SpyCall(
    List<Object> args,
    Object receiver,
    Object returnValue,
    Throwable error,
    long timestampNanos
) {
    public SpyCall {
        args = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(args, "args")));
    }

    public Object arg(int index) {
        return args.get(index);
    }

    public Optional<Object> receiverRef() {
        return Optional.ofNullable(receiver);
    }

    public boolean hasError() {
        return error != null;
    }
}
