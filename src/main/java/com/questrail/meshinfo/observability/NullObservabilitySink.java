package com.questrail.meshinfo.observability;

/**
 * No-op implementation of CollectorObservabilitySink.
 */
public final class NullObservabilitySink implements CollectorObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(CollectorStateTransitionEvent event) {}

    @Override
    public void onCycleCompleted(CycleCompletedEvent event) {}

    @Override
    public void onError(CollectorErrorEvent event) {}
}
