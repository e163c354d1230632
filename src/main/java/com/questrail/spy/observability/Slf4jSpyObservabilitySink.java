package com.questrail.spy.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SpyObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSpyObservabilitySink implements SpyObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSpyObservabilitySink.class);

    @Override
    public void onInstalled(SpyLifecycleEvent event) {
        log.debug("Installed {} on {}", event.kind(), event.target());
    }

    @Override
    public void onRestored(SpyLifecycleEvent event) {
        log.debug("Restored {} on {}", event.kind(), event.target());
    }

    @Override
    public void onBulkRestore(SpyBulkRestoreEvent event) {
        if (event.restored() > 0) {
            log.debug("Restored {} active substitute(s)", event.restored());
        }
    }

    @Override
    public void onError(SpyErrorEvent event) {
        log.error("Spy engine error: {}", event.message(), event.cause());
    }
}
