package com.questrail.meshinfo.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Where and how to reach the OLSR daemon's text export.
 *
 * @param host           host name or address of the local node
 * @param port           TCP port of the text export
 * @param connectTimeout limit on establishing the connection
 * @param readTimeout    longest silence tolerated while the export is streaming
 */
public record OlsrConfig(
        String host,
        int port,
        Duration connectTimeout,
        Duration readTimeout
) {
    public static final String DEFAULT_HOST = "localnode.local.mesh";
    public static final int DEFAULT_PORT = 2004;

    public OlsrConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(readTimeout, "readTimeout");

        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be in 1..65535");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (readTimeout.isNegative() || readTimeout.isZero()) {
            throw new IllegalArgumentException("readTimeout must be positive");
        }
    }

    public static OlsrConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public OlsrConfig build() {
            return new OlsrConfig(host, port, connectTimeout, readTimeout);
        }
    }
}
