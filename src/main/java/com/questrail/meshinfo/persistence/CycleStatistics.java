package com.questrail.meshinfo.persistence;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Summary of one collection cycle, stored alongside the topology.
 *
 * @param startedAt     wall-clock start of the cycle
 * @param pollDuration  time spent connecting, polling and merging
 * @param totalDuration time from start until the reconciliation committed
 * @param counters      assembler and reconciler counters
 */
public record CycleStatistics(
        Instant startedAt,
        int nodeCount,
        int linkCount,
        int errorCount,
        Duration pollDuration,
        Duration totalDuration,
        Map<String, Integer> counters
) {
    public CycleStatistics {
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(pollDuration, "pollDuration");
        Objects.requireNonNull(totalDuration, "totalDuration");
        counters = Collections.unmodifiableMap(new LinkedHashMap<>(counters));
    }
}
