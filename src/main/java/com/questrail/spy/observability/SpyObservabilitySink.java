package com.questrail.spy.observability;

/**
 * Main interface for receiving spy engine observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface SpyObservabilitySink {
    /**
     * Called after a substitute has replaced its owner's member.
     * @param event the installation details
     */
    void onInstalled(SpyLifecycleEvent event);

    /**
     * Called after a substitute has put its owner's original member back.
     * @param event the restoration details
     */
    void onRestored(SpyLifecycleEvent event);

    /**
     * Called once per restore-all pass.
     * @param event the pass summary
     */
    void onBulkRestore(SpyBulkRestoreEvent event);

    /**
     * Called when an operation that must not throw hit an error.
     * @param event the error event
     */
    void onError(SpyErrorEvent event);
}
