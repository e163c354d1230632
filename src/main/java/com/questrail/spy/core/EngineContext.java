package com.questrail.spy.core;

import com.questrail.spy.config.SpyEngineConfig;
import com.questrail.spy.observability.SpyErrorEvent;
import com.questrail.spy.observability.SpyLifecycleEvent;
import com.questrail.spy.registry.SpyRegistry;

import java.util.Objects;

/**
 * What every substitute created by one engine shares: configuration and the
 * registry it registers in.
 */
public record EngineContext(
    SpyEngineConfig config,
    SpyRegistry registry
) {
    public EngineContext {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(registry, "registry");
    }

    void installed(SpyBinding binding, String kind) {
        config.observabilitySink().onInstalled(lifecycleEvent(binding, kind));
    }

    void restored(SpyBinding binding, String kind) {
        config.observabilitySink().onRestored(lifecycleEvent(binding, kind));
    }

    void error(String message, Throwable cause) {
        config.observabilitySink().onError(new SpyErrorEvent(config.wallClock().now(), message, cause));
    }

    private SpyLifecycleEvent lifecycleEvent(SpyBinding binding, String kind) {
        return new SpyLifecycleEvent(config.wallClock().now(), binding.ownerLabel(), binding.memberName(), kind);
    }
}
