package com.questrail.meshinfo.olsr.netty;

import com.questrail.meshinfo.olsr.OlsrLineSource;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Line source over one Netty channel connected to the OLSR daemon.
 *
 * <p>The inbound handler runs on the channel's event loop and only appends to
 * a queue; {@link #readLine()} runs on the consumer thread and requests more
 * socket reads when the queue is empty.</p>
 */
final class NettyOlsrLineSource implements OlsrLineSource
{
    private static final Object END = new Object();

    private final Channel channel;
    private final EventLoopGroup group;
    private final InboundHandler handler;
    private final Duration readTimeout;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    NettyOlsrLineSource(Channel channel, EventLoopGroup group, InboundHandler handler, Duration readTimeout) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.group = Objects.requireNonNull(group, "group");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
    }

    @Override
    public String readLine() throws IOException {
        BlockingQueue<Object> inbound = handler.inbound;

        Object next = inbound.poll();
        if (next == null) {
            channel.read();
            try {
                next = inbound.poll(readTimeout.toNanos(), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted reading OLSR data");
            }
            if (next == null) {
                throw new SocketTimeoutException("No OLSR data received within " + readTimeout);
            }
        }

        if (next == END) {
            // terminal markers stay queued so later reads see the same outcome
            inbound.offer(END);
            return null;
        }
        if (next instanceof Throwable cause) {
            inbound.offer(cause);
            throw new IOException("OLSR connection failed", cause);
        }
        return (String) next;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            channel.close().awaitUninterruptibly(1, TimeUnit.SECONDS);
            NettyOlsrConnector.shutdown(group);
        }
    }

    /**
     * Receives decoded lines and lifecycle signals from the pipeline.
     */
    static final class InboundHandler extends SimpleChannelInboundHandler<String>
    {
        private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line)
        {
            inbound.add(line);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            inbound.add(END);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            inbound.add(cause);
            ctx.close();
        }
    }
}
