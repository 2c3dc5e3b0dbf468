package com.questrail.meshinfo.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for {@code last_seen} timestamps, expiry cutoffs and
 * observability events.
 *
 * <p>It MUST NOT be used for cadence or elapsed-time decisions; use
 * {@link MonotonicClock} for those.</p>
 */
public interface WallClock
{
    Instant now();
}
