package com.questrail.datagram.transport.udp.netty;

import com.questrail.datagram.api.RawDatagram;
import com.questrail.datagram.transport.DatagramSocketHandle;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.DatagramPacket;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyDatagramSocketHandle
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramSocketHandle} port.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) MUST NOT
 * escape this package. Inbound payloads are copied into {@code byte[]}; all
 * reference-counted buffers are released internally.
 *
 * <h2>Demand-driven reads</h2>
 * The channel runs with {@code AUTO_READ} disabled. Each {@link #receive()}
 * call that finds nothing pending issues one {@link Channel#read()}, which
 * reads a single datagram. The event loop therefore never reads ahead of the
 * server's reader: while the reader is blocked on a full request queue,
 * datagrams stay in the kernel receive buffer.
 *
 * <h2>Writes</h2>
 * {@link #send} is safe for concurrent callers. Each call waits on the write
 * future for at most the given timeout and fails with
 * {@link SocketTimeoutException} if the write has not completed by then.
 */
public final class NettyDatagramSocketHandle implements DatagramSocketHandle
{
    private static final long GROUP_SHUTDOWN_TIMEOUT_MILLIS = 1000;

    private final EventLoopGroup group;
    private final Channel channel;
    private final BlockingQueue<Inbound> inbound;
    private final Duration defaultWriteTimeout;

    private final AtomicBoolean inputShutdown = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    NettyDatagramSocketHandle(EventLoopGroup group,
                              Channel channel,
                              BlockingQueue<Inbound> inbound,
                              Duration defaultWriteTimeout)
    {
        this.group = Objects.requireNonNull(group, "group");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.inbound = Objects.requireNonNull(inbound, "inbound");
        this.defaultWriteTimeout = Objects.requireNonNull(defaultWriteTimeout, "defaultWriteTimeout");
    }

    @Override
    public InetSocketAddress localAddress()
    {
        return (InetSocketAddress) channel.localAddress();
    }

    @Override
    public RawDatagram receive() throws IOException
    {
        if (inputShutdown.get() || !channel.isOpen()) {
            throw new ClosedChannelException();
        }

        Inbound next = inbound.poll();
        if (next == null) {
            channel.read();
            try {
                next = inbound.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("receive interrupted");
            }
        }

        if (next.end() || inputShutdown.get()) {
            throw new ClosedChannelException();
        }
        if (next.error() != null) {
            Throwable error = next.error();
            if (error instanceof IOException) {
                throw (IOException) error;
            }
            throw new IOException("datagram read failed", error);
        }
        return next.datagram();
    }

    @Override
    public void send(SocketAddress remote, byte[] payload) throws IOException
    {
        send(remote, payload, defaultWriteTimeout);
    }

    @Override
    public void send(SocketAddress remote, byte[] payload, Duration timeout) throws IOException
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(timeout, "timeout");
        if (!(remote instanceof InetSocketAddress)) {
            throw new IllegalArgumentException("unsupported remote address type: " + remote.getClass().getName());
        }

        if (timeout.isZero() || timeout.isNegative()) {
            throw new SocketTimeoutException("write deadline to " + remote + " already passed");
        }
        if (!channel.isActive()) {
            throw new ClosedChannelException();
        }

        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        ChannelFuture future = channel.writeAndFlush(new DatagramPacket(buf, (InetSocketAddress) remote));

        final boolean completed;
        try {
            completed = future.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            future.cancel(false);
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("send to " + remote + " interrupted");
        }

        if (!completed) {
            future.cancel(false);
            throw new SocketTimeoutException("write to " + remote + " timed out after " + timeout.toMillis() + " ms");
        }
        if (!future.isSuccess()) {
            Throwable cause = future.cause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("write to " + remote + " failed", cause);
        }
    }

    @Override
    public void shutdownInput()
    {
        if (inputShutdown.compareAndSet(false, true)) {
            inbound.offer(Inbound.END);
        }
    }

    @Override
    public boolean isOpen()
    {
        return !closed.get() && channel.isOpen();
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        shutdownInput();
        try {
            channel.close().awaitUninterruptibly();
        } finally {
            group.shutdownGracefully(0, GROUP_SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)
                    .awaitUninterruptibly();
        }
    }

    @Override
    public String toString()
    {
        return "NettyDatagramSocketHandle[" + channel.localAddress() + "]";
    }

    /**
     * One item on the hand-off between the event loop and the reader thread.
     */
    record Inbound(RawDatagram datagram, Throwable error, boolean end)
    {
        static final Inbound END = new Inbound(null, null, true);

        static Inbound of(RawDatagram datagram)
        {
            return new Inbound(datagram, null, false);
        }

        static Inbound failure(Throwable error)
        {
            return new Inbound(null, error, false);
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives Netty {@link DatagramPacket}s, copies the payload and hands it to
     * the reader thread. Read errors and channel closure are handed over the
     * same way so the reader observes them in order.
     */
    static final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        private final BlockingQueue<Inbound> inbound;

        InboundHandler(BlockingQueue<Inbound> inbound)
        {
            this.inbound = Objects.requireNonNull(inbound, "inbound");
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            // Copy the payload into a plain byte[] (Netty containment rule).
            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            inbound.offer(Inbound.of(new RawDatagram(packet.sender(), bytes)));
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            inbound.offer(Inbound.END);
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            inbound.offer(Inbound.failure(cause));
        }
    }
}
