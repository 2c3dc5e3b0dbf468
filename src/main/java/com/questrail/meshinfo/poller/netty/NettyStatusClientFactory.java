package com.questrail.meshinfo.poller.netty;

import com.questrail.meshinfo.poller.StatusClient;
import com.questrail.meshinfo.poller.StatusClientFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Opens a {@link NettyStatusClient} per poll pass.
 */
public final class NettyStatusClientFactory implements StatusClientFactory
{
    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final int port;

    public NettyStatusClientFactory(Duration connectTimeout, Duration readTimeout) {
        this(connectTimeout, readTimeout, StatusClient.STATUS_PORT);
    }

    /**
     * @param port status port; only tests use anything but {@link StatusClient#STATUS_PORT}
     */
    public NettyStatusClientFactory(Duration connectTimeout, Duration readTimeout, int port) {
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
        this.port = port;
    }

    @Override
    public StatusClient open() {
        return new NettyStatusClient(connectTimeout, readTimeout, port);
    }
}
