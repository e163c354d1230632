package com.questrail.spy.internal.behavior;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Behavior
 * -----------------------------------------------------------------------------
 * What a substitute does when it is called. One variant per strategy, each
 * carrying only the data that strategy needs.
 *
 * The same variants serve as the default behavior and as one-time queue items.
 * {@link SequentialValues} is only ever a default; {@link BehaviorConfiguration}
 * turns it into a {@link FixedValue} per call.
 */
public sealed interface Behavior
        permits Behavior.CallThrough, Behavior.FixedValue, Behavior.SequentialValues,
                Behavior.ThrowError, Behavior.CallFake, Behavior.ResolvedValue,
                Behavior.RejectedValue
{
    Behavior CALL_THROUGH = new CallThrough();

    /** Delegate to the displaced original. */
    record CallThrough() implements Behavior {}

    /** Return the value verbatim. */
    record FixedValue(Object value) implements Behavior {}

    /** Return values by cursor, repeating the last once exhausted. */
    record SequentialValues(List<Object> values) implements Behavior {
        public SequentialValues {
            values = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(values, "values")));
        }

        public static SequentialValues of(Object... values) {
            return new SequentialValues(values == null ? Collections.singletonList(null) : Arrays.asList(values));
        }
    }

    /** Raise the error. */
    record ThrowError(Throwable error) implements Behavior {
        public ThrowError {
            Objects.requireNonNull(error, "error");
        }
    }

    /** Run a replacement implementing the same functional interface. */
    record CallFake(Object implementation) implements Behavior {
        public CallFake {
            Objects.requireNonNull(implementation, "implementation");
        }
    }

    /** Answer with an already-completed future. */
    record ResolvedValue(Object value) implements Behavior {}

    /** Answer with an already-failed future. */
    record RejectedValue(Throwable error) implements Behavior {
        public RejectedValue {
            Objects.requireNonNull(error, "error");
        }
    }
}
