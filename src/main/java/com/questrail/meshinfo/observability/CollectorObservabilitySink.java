package com.questrail.meshinfo.observability;

/**
 * Receives structured events from the collection loop.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface CollectorObservabilitySink {
    /**
     * Called when the loop moves from one state to another.
     * @param event the transition details
     */
    void onStateTransition(CollectorStateTransitionEvent event);

    /**
     * Called after a cycle's reconciliation has been committed.
     * @param event the cycle details
     */
    void onCycleCompleted(CycleCompletedEvent event);

    /**
     * Called when a connection attempt or a cycle fails.
     * @param event the error details
     */
    void onError(CollectorErrorEvent event);
}
