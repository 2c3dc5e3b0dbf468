package com.questrail.meshinfo.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CollectorConfigTest
 * -----------------------------------------------------------------------------
 * Defaults and rejection of invalid settings for all configuration records.
 */
class CollectorConfigTest {

    @Test
    void defaults() {
        CollectorConfig config = CollectorConfig.defaults();

        assertEquals(Duration.ofMinutes(5), config.period());
        assertEquals(Duration.ofDays(7), config.nodeInactive());
        assertEquals(Duration.ofDays(1), config.linkInactive());
        assertEquals(5, config.maxRetries());
        assertFalse(config.runOnce());

        assertEquals("localnode.local.mesh", config.olsr().host());
        assertEquals(2004, config.olsr().port());
        assertEquals(50, config.poller().maxConnections());
        assertEquals(Duration.ofSeconds(10), config.poller().connectTimeout());
        assertEquals(Duration.ofSeconds(15), config.poller().readTimeout());
    }

    @Test
    void builderOverridesDefaults() {
        CollectorConfig config = CollectorConfig.builder()
                .withPeriod(Duration.ofSeconds(30))
                .withMaxRetries(1)
                .withRunOnce(true)
                .withOlsr(OlsrConfig.builder().withHost("10.0.0.1").withPort(9090).build())
                .withPoller(new PollerConfig(8, Duration.ofSeconds(1), Duration.ofSeconds(2)))
                .build();

        assertEquals(Duration.ofSeconds(30), config.period());
        assertTrue(config.runOnce());
        assertEquals("10.0.0.1", config.olsr().host());
        assertEquals(9090, config.olsr().port());
        assertEquals(8, config.poller().maxConnections());
    }

    @Test
    void rejectsNonPositivePeriod() {
        assertThrows(IllegalArgumentException.class,
                () -> CollectorConfig.builder().withPeriod(Duration.ZERO).build());
    }

    @Test
    void rejectsZeroRetries() {
        assertThrows(IllegalArgumentException.class,
                () -> CollectorConfig.builder().withMaxRetries(0).build());
    }

    @Test
    void rejectsNegativeExpiry() {
        assertThrows(IllegalArgumentException.class,
                () -> CollectorConfig.builder().withLinkInactive(Duration.ofDays(-1)).build());
    }

    @Test
    void rejectsBadOlsrEndpoint() {
        assertThrows(IllegalArgumentException.class, () -> OlsrConfig.builder().withHost(" ").build());
        assertThrows(IllegalArgumentException.class, () -> OlsrConfig.builder().withPort(0).build());
        assertThrows(NullPointerException.class, () -> OlsrConfig.builder().withHost(null).build());
    }

    @Test
    void rejectsBadPollerLimits() {
        assertThrows(IllegalArgumentException.class,
                () -> new PollerConfig(0, Duration.ofSeconds(1), Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new PollerConfig(1, Duration.ZERO, Duration.ofSeconds(1)));
    }
}
