package com.questrail.meshinfo.observability;

import com.questrail.meshinfo.persistence.CycleStatistics;

import java.time.Instant;

/**
 * Record representing a committed collection cycle.
 */
public record CycleCompletedEvent(
    Instant timestamp,
    CycleStatistics statistics
) {
}
