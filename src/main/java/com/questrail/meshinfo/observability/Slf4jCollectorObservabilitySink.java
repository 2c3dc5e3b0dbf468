package com.questrail.meshinfo.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CollectorObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCollectorObservabilitySink implements CollectorObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCollectorObservabilitySink.class);

    @Override
    public void onStateTransition(CollectorStateTransitionEvent event) {
        log.debug("Collector state: {} -> {}", event.oldState(), event.newState());
    }

    @Override
    public void onCycleCompleted(CycleCompletedEvent event) {
        var stats = event.statistics();
        log.info("Cycle started {}: {} nodes, {} links, {} errors, polling {} ms, total {} ms",
            stats.startedAt(),
            stats.nodeCount(),
            stats.linkCount(),
            stats.errorCount(),
            stats.pollDuration().toMillis(),
            stats.totalDuration().toMillis());
    }

    @Override
    public void onError(CollectorErrorEvent event) {
        log.error("Collector error: {}", event.message(), event.cause());
    }
}
