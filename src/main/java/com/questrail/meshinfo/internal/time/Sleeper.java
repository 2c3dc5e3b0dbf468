package com.questrail.meshinfo.internal.time;

import java.time.Duration;

/**
 * Sleeper
 * =============================================================================
 * The only intentional blocking point of the service loop between cycles.
 *
 * <p>Kept as a seam so tests can advance a manual clock instead of waiting
 * out a real polling period.</p>
 */
@FunctionalInterface
public interface Sleeper
{
    /**
     * Block for the given duration.
     *
     * @throws InterruptedException if the sleeping thread is interrupted
     */
    void sleep(Duration duration) throws InterruptedException;
}
