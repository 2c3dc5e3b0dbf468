package com.questrail.meshinfo.observability;

import com.questrail.meshinfo.collector.CollectorState;

import java.time.Instant;

/**
 * Record representing a state transition of the collection loop.
 */
public record CollectorStateTransitionEvent(
    Instant timestamp,
    CollectorState oldState,
    CollectorState newState
) {
}
