package com.questrail.spy.config;

import com.questrail.spy.internal.time.MonotonicClock;
import com.questrail.spy.internal.time.SystemMonotonicClock;
import com.questrail.spy.internal.time.SystemWallClock;
import com.questrail.spy.internal.time.WallClock;
import com.questrail.spy.observability.Slf4jSpyObservabilitySink;
import com.questrail.spy.observability.SpyObservabilitySink;

import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Aggregated configuration for a spy engine.
 *
 * @param equality         structural equality used by "called with" queries
 * @param clock            time source for call record timestamps
 * @param wallClock        time source for observability events
 * @param observabilitySink receiver of lifecycle and error events
 */
public record SpyEngineConfig(
    BiPredicate<Object, Object> equality,
    MonotonicClock clock,
    WallClock wallClock,
    SpyObservabilitySink observabilitySink
) {
    public SpyEngineConfig {
        Objects.requireNonNull(equality, "equality");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    public static SpyEngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BiPredicate<Object, Object> equality = Objects::deepEquals;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private SpyObservabilitySink observabilitySink = new Slf4jSpyObservabilitySink();

        public Builder withEquality(BiPredicate<Object, Object> equality) {
            this.equality = equality;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withObservabilitySink(SpyObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public SpyEngineConfig build() {
            return new SpyEngineConfig(equality, clock, wallClock, observabilitySink);
        }
    }
}
