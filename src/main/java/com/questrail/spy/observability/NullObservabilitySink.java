package com.questrail.spy.observability;

/**
 * No-op implementation of SpyObservabilitySink.
 */
public final class NullObservabilitySink implements SpyObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onInstalled(SpyLifecycleEvent event) {}

    @Override
    public void onRestored(SpyLifecycleEvent event) {}

    @Override
    public void onBulkRestore(SpyBulkRestoreEvent event) {}

    @Override
    public void onError(SpyErrorEvent event) {}
}
