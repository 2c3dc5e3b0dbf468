package com.questrail.meshinfo.observability;

import java.time.Instant;

/**
 * Record representing a failure observed by the collection loop.
 */
public record CollectorErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
