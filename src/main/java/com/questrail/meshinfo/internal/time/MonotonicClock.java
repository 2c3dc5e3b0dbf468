package com.questrail.meshinfo.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for the collector's operational timing.
 *
 * <h2>Binding invariant</h2>
 * Cycle durations and the sleep until the next polling boundary MUST be
 * computed from a monotonic source. Wall-clock time ({@code Instant.now()}) is
 * used only for persisted timestamps and observability.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
