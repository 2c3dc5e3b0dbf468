package com.questrail.meshinfo.config;

import java.time.Duration;
import java.util.Objects;

/**
 * CollectorConfig
 * -----------------------------------------------------------------------------
 * Configuration of the collection loop and everything it drives.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>period</b>: cycle cadence. After a cycle the loop waits until the
 *       next multiple of the period counted from that cycle's start; a failed
 *       connection waits one full period before the next attempt.</li>
 *   <li><b>nodeInactive</b>: an active node not seen for this long becomes inactive.</li>
 *   <li><b>linkInactive</b>: a recent link not seen for this long becomes inactive.</li>
 *   <li><b>maxRetries</b>: consecutive failed OLSR connections before the loop aborts.</li>
 *   <li><b>runOnce</b>: stop after the first cycle; a failed connection aborts at once.</li>
 * </ul>
 */
public record CollectorConfig(
        Duration period,
        Duration nodeInactive,
        Duration linkInactive,
        int maxRetries,
        boolean runOnce,
        OlsrConfig olsr,
        PollerConfig poller
) {
    public CollectorConfig {
        Objects.requireNonNull(period, "period");
        Objects.requireNonNull(nodeInactive, "nodeInactive");
        Objects.requireNonNull(linkInactive, "linkInactive");
        Objects.requireNonNull(olsr, "olsr");
        Objects.requireNonNull(poller, "poller");

        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("period must be positive");
        }
        if (nodeInactive.isNegative()) {
            throw new IllegalArgumentException("nodeInactive must be non-negative");
        }
        if (linkInactive.isNegative()) {
            throw new IllegalArgumentException("linkInactive must be non-negative");
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1");
        }
    }

    /**
     * Defaults: 5 minute period, nodes expire after 7 days, links after 1 day,
     * 5 connection attempts, run forever.
     */
    public static CollectorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration period = Duration.ofMinutes(5);
        private Duration nodeInactive = Duration.ofDays(7);
        private Duration linkInactive = Duration.ofDays(1);
        private int maxRetries = 5;
        private boolean runOnce;
        private OlsrConfig olsr = OlsrConfig.defaults();
        private PollerConfig poller = PollerConfig.defaults();

        public Builder withPeriod(Duration period) {
            this.period = period;
            return this;
        }

        public Builder withNodeInactive(Duration nodeInactive) {
            this.nodeInactive = nodeInactive;
            return this;
        }

        public Builder withLinkInactive(Duration linkInactive) {
            this.linkInactive = linkInactive;
            return this;
        }

        public Builder withMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder withRunOnce(boolean runOnce) {
            this.runOnce = runOnce;
            return this;
        }

        public Builder withOlsr(OlsrConfig olsr) {
            this.olsr = olsr;
            return this;
        }

        public Builder withPoller(PollerConfig poller) {
            this.poller = poller;
            return this;
        }

        public CollectorConfig build() {
            return new CollectorConfig(period, nodeInactive, linkInactive, maxRetries, runOnce, olsr, poller);
        }
    }
}
