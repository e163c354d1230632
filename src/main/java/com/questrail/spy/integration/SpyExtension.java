package com.questrail.spy.integration;

import com.questrail.spy.Spies;
import com.questrail.spy.core.SpyEngine;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.util.Objects;

/**
 * JUnit Jupiter extension that restores every active substitute after each
 * test, so no interception leaks into the next one.
 *
 * <pre>
 * &#64;ExtendWith(SpyExtension.class)            // default engine
 * &#64;RegisterExtension
 * static SpyExtension spies = new SpyExtension(engine);  // a specific engine
 * </pre>
 */
public final class SpyExtension implements AfterEachCallback
{
    private final SpyEngine engine;

    public SpyExtension() {
        this(Spies.engine());
    }

    public SpyExtension(SpyEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    @Override
    public void afterEach(ExtensionContext context) {
        engine.restoreAllSpies();
    }
}
