package com.questrail.meshinfo.collector;

/**
 * Consecutive failed connection attempts.
 *
 * - Incremented on each failed connect
 * - Reset on a successful connect
 * - Does not encode retry policy
 */
final class ConnectAttemptTracker {

    private int failures;

    /**
     * Record that a connection attempt failed.
     *
     * @return the updated failure count
     */
    int recordFailure() {
        return ++failures;
    }

    /**
     * Reset the count after a successful connection.
     */
    void reset() {
        failures = 0;
    }
}
