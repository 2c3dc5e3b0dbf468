package com.questrail.meshinfo.olsr.netty;

import com.questrail.meshinfo.olsr.OlsrConnectException;
import com.questrail.meshinfo.olsr.OlsrConnector;
import com.questrail.meshinfo.olsr.OlsrLineSource;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyOlsrConnector
 * =============================================================================
 * Netty-backed implementation of the {@link OlsrConnector} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It opens a TCP
 * connection to the daemon's text export and frames the byte stream into
 * lines. It does not classify lines, deduplicate, or retry.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Lines leave as {@code String}.
 *
 * <h2>Lifecycle</h2>
 * Every connection owns a dedicated single-thread event loop group, so closing
 * the returned {@link OlsrLineSource} releases every resource of that session.
 * Reads are demand-driven ({@code AUTO_READ} off): the socket is only read when
 * a consumer asks for a line that is not yet buffered.
 */
public final class NettyOlsrConnector implements OlsrConnector
{
    static final int MAX_LINE_LENGTH = 64 * 1024;

    private final Duration readTimeout;

    /**
     * @param readTimeout maximum wait for the next line before the stream is
     *                    considered stalled
     */
    public NettyOlsrConnector(Duration readTimeout) {
        this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
    }

    @Override
    public OlsrLineSource connect(String host, int port, Duration timeout) throws OlsrConnectException {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(timeout, "timeout");

        EventLoopGroup group = new NioEventLoopGroup(1);
        NettyOlsrLineSource.InboundHandler handler = new NettyOlsrLineSource.InboundHandler();

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.max(1, timeout.toMillis()))
                .option(ChannelOption.AUTO_READ, false)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new LineBasedFrameDecoder(MAX_LINE_LENGTH));
                        p.addLast(new StringDecoder(StandardCharsets.UTF_8));
                        p.addLast(handler);
                    }
                });

        ChannelFuture future;
        try {
            future = bootstrap.connect(host, port);
            // Netty enforces CONNECT_TIMEOUT_MILLIS; the extra second covers name resolution.
            if (!future.await(timeout.toMillis() + 1000, TimeUnit.MILLISECONDS)) {
                future.cancel(false);
                throw new OlsrConnectException(host, port, "Timeout connecting to OLSR daemon", null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown(group);
            throw new OlsrConnectException(host, port, "Interrupted connecting to OLSR daemon", e);
        } catch (OlsrConnectException e) {
            shutdown(group);
            throw e;
        }

        if (!future.isSuccess()) {
            shutdown(group);
            Throwable cause = future.cause();
            if (cause instanceof ConnectTimeoutException) {
                throw new OlsrConnectException(host, port, "Timeout connecting to OLSR daemon", cause);
            }
            throw new OlsrConnectException(host, port, "Failed to connect to OLSR daemon: " + cause, cause);
        }

        return new NettyOlsrLineSource(future.channel(), group, handler, readTimeout);
    }

    static void shutdown(EventLoopGroup group) {
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly(2, TimeUnit.SECONDS);
    }
}
