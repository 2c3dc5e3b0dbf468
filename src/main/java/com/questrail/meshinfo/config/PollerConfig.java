package com.questrail.meshinfo.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Limits for polling node status endpoints.
 *
 * @param maxConnections most fetches in flight at once
 * @param connectTimeout limit on establishing each HTTP connection
 * @param readTimeout    longest silence tolerated while reading a response
 */
public record PollerConfig(
        int maxConnections,
        Duration connectTimeout,
        Duration readTimeout
) {
    public PollerConfig {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(readTimeout, "readTimeout");

        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be >= 1");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (readTimeout.isNegative() || readTimeout.isZero()) {
            throw new IllegalArgumentException("readTimeout must be positive");
        }
    }

    /**
     * Defaults: 50 connections, 10 s to connect, 15 s to read.
     */
    public static PollerConfig defaults() {
        return new PollerConfig(50, Duration.ofSeconds(10), Duration.ofSeconds(15));
    }
}
