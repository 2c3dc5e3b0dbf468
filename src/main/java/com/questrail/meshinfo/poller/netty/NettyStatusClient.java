package com.questrail.meshinfo.poller.netty;

import com.questrail.meshinfo.poller.StatusClient;
import com.questrail.meshinfo.poller.StatusResponse;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.ConnectTimeoutException;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.ReadTimeoutHandler;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyStatusClient
 * =============================================================================
 * Netty-backed implementation of the {@link StatusClient} port: one HTTP/1.1
 * GET per fetch over a fresh connection, closed after the response.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Responses are copied into a
 * {@code byte[]} and every reference-counted buffer is released here.
 *
 * <h2>Timeouts</h2>
 * <ul>
 *   <li>connect: enforced by {@code CONNECT_TIMEOUT_MILLIS}</li>
 *   <li>read: enforced by {@link ReadTimeoutHandler}, i.e. the maximum gap
 *       between two reads, not a deadline for the whole response</li>
 * </ul>
 * Both surface as {@link SocketTimeoutException} so callers can classify them
 * without knowing Netty.
 *
 * <h2>Lifecycle</h2>
 * The event loop group belongs to this client and is shut down by
 * {@link #close()}.
 */
public final class NettyStatusClient implements StatusClient
{
    static final int MAX_RESPONSE_BYTES = 4 * 1024 * 1024;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final int port;
    private final Duration readTimeout;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public NettyStatusClient(Duration connectTimeout, Duration readTimeout) {
        this(connectTimeout, readTimeout, STATUS_PORT);
    }

    NettyStatusClient(Duration connectTimeout, Duration readTimeout, int port) {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
        this.port = port;

        this.group = new NioEventLoopGroup();
        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.max(1, connectTimeout.toMillis()));
    }

    @Override
    public StatusResponse fetch(String address) throws IOException {
        Objects.requireNonNull(address, "address");
        if (closed.get()) {
            throw new IOException("Status client is closed");
        }

        CompletableFuture<StatusResponse> response = new CompletableFuture<>();
        Bootstrap b = bootstrap.clone().handler(new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch)
            {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new ReadTimeoutHandler(readTimeout.toMillis(), TimeUnit.MILLISECONDS));
                p.addLast(new HttpClientCodec());
                p.addLast(new HttpObjectAggregator(MAX_RESPONSE_BYTES));
                p.addLast(new ResponseHandler(address + ":" + port, response));
            }
        });

        b.connect(address, port).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                response.completeExceptionally(future.cause());
            }
        });

        try {
            return response.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted polling " + address);
        } catch (ExecutionException e) {
            throw translate(e.getCause());
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly(2, TimeUnit.SECONDS);
        }
    }

    static IOException translate(Throwable cause) {
        if (cause instanceof ConnectTimeoutException) {
            SocketTimeoutException e = new SocketTimeoutException("Connect timed out");
            e.initCause(cause);
            return e;
        }
        if (cause instanceof ReadTimeoutException) {
            SocketTimeoutException e = new SocketTimeoutException("Read timed out");
            e.initCause(cause);
            return e;
        }
        if (cause instanceof IOException io) {
            return io;
        }
        return new IOException(String.valueOf(cause), cause);
    }

    static String requestUri() {
        return STATUS_PATH + "?" + STATUS_QUERY;
    }

    /**
     * Sends the request once connected and completes the future with the
     * aggregated response or the first failure.
     */
    private static final class ResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse>
    {
        private final String host;
        private final CompletableFuture<StatusResponse> response;

        private ResponseHandler(String host, CompletableFuture<StatusResponse> response) {
            this.host = host;
            this.response = response;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            FullHttpRequest request = new DefaultFullHttpRequest(
                    HttpVersion.HTTP_1_1, HttpMethod.GET, requestUri());
            request.headers()
                    .set(HttpHeaderNames.HOST, host)
                    .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE)
                    .set(HttpHeaderNames.ACCEPT, "application/json");
            ctx.writeAndFlush(request).addListener((ChannelFutureListener) f -> {
                if (!f.isSuccess()) {
                    response.completeExceptionally(f.cause());
                    f.channel().close();
                }
            });
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse msg)
        {
            ByteBuf content = msg.content();
            byte[] body = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), body);
            response.complete(new StatusResponse(msg.status().code(), body));
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            response.completeExceptionally(new ClosedChannelException());
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            response.completeExceptionally(cause);
            ctx.close();
        }
    }
}
