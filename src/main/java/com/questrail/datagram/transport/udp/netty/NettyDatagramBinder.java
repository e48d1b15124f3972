package com.questrail.datagram.transport.udp.netty;

import com.questrail.datagram.api.BindAddress;
import com.questrail.datagram.api.Binder;
import com.questrail.datagram.api.NetworkFamily;
import com.questrail.datagram.transport.DatagramSocketHandle;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFactory;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.InternetProtocolFamily;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.util.concurrent.DefaultThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * NettyDatagramBinder
 * =============================================================================
 * The standard {@link Binder}: binds a Netty {@link NioDatagramChannel} to the
 * configured address and wraps it in a {@link NettyDatagramSocketHandle}.
 *
 * <p>Each bound socket gets a dedicated single-threaded {@link NioEventLoopGroup}
 * so that the handle is self-contained; closing the handle shuts the group
 * down.</p>
 *
 * <p>Binding is synchronous: {@link #bind} returns only once the socket is
 * bound, or throws the bind failure.</p>
 */
public final class NettyDatagramBinder implements Binder
{
    private static final Logger log = LoggerFactory.getLogger(NettyDatagramBinder.class);

    /** Default timeout applied by {@link DatagramSocketHandle#send(java.net.SocketAddress, byte[])}. */
    public static final Duration DEFAULT_WRITE_TIMEOUT = Duration.ofSeconds(1);

    /** Largest UDP payload over IPv4. */
    public static final int DEFAULT_MAX_DATAGRAM_SIZE = 65_507;

    private static final long FAILED_BIND_SHUTDOWN_MILLIS = 500;

    private final Duration writeTimeout;
    private final int maxDatagramSize;
    private final String threadNamePrefix;

    public NettyDatagramBinder()
    {
        this(builder());
    }

    private NettyDatagramBinder(Builder builder)
    {
        this.writeTimeout = builder.writeTimeout;
        this.maxDatagramSize = builder.maxDatagramSize;
        this.threadNamePrefix = builder.threadNamePrefix;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    @Override
    public DatagramSocketHandle bind(NetworkFamily family, String bindAddress) throws IOException
    {
        Objects.requireNonNull(family, "family");

        final InetSocketAddress local;
        try {
            local = BindAddress.parse(bindAddress).resolve(family);
        } catch (IllegalArgumentException e) {
            throw new IOException("invalid bind address '" + bindAddress + "'", e);
        }

        BlockingQueue<NettyDatagramSocketHandle.Inbound> inbound = new LinkedBlockingQueue<>();
        EventLoopGroup group = new NioEventLoopGroup(1, new DefaultThreadFactory(threadNamePrefix, true));

        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channelFactory(channelFactory(family))
                .option(ChannelOption.AUTO_READ, false)
                .option(ChannelOption.SO_BROADCAST, false)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(maxDatagramSize).maxMessagesPerRead(1))
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch)
                    {
                        ch.pipeline().addLast(new NettyDatagramSocketHandle.InboundHandler(inbound));
                    }
                });

        ChannelFuture bound = bootstrap.bind(local).awaitUninterruptibly();
        if (!bound.isSuccess()) {
            group.shutdownGracefully(0, FAILED_BIND_SHUTDOWN_MILLIS, TimeUnit.MILLISECONDS).awaitUninterruptibly();
            Throwable cause = bound.cause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("failed to bind " + family + " " + local, cause);
        }

        NettyDatagramSocketHandle handle =
                new NettyDatagramSocketHandle(group, bound.channel(), inbound, writeTimeout);
        log.debug("Bound {} socket on {}", family, handle.localAddress());
        return handle;
    }

    private static ChannelFactory<NioDatagramChannel> channelFactory(NetworkFamily family)
    {
        switch (family) {
            case UDP4:
                return () -> new NioDatagramChannel(InternetProtocolFamily.IPv4);
            case UDP6:
                return () -> new NioDatagramChannel(InternetProtocolFamily.IPv6);
            default:
                return NioDatagramChannel::new;
        }
    }

    public static final class Builder
    {
        private Duration writeTimeout = DEFAULT_WRITE_TIMEOUT;
        private int maxDatagramSize = DEFAULT_MAX_DATAGRAM_SIZE;
        private String threadNamePrefix = "datagram-io";

        public Builder withWriteTimeout(Duration writeTimeout)
        {
            Objects.requireNonNull(writeTimeout, "writeTimeout");
            if (writeTimeout.isZero() || writeTimeout.isNegative()) {
                throw new IllegalArgumentException("writeTimeout must be positive");
            }
            this.writeTimeout = writeTimeout;
            return this;
        }

        public Builder withMaxDatagramSize(int maxDatagramSize)
        {
            if (maxDatagramSize <= 0 || maxDatagramSize > 65_535) {
                throw new IllegalArgumentException("maxDatagramSize must be in (0, 65535]");
            }
            this.maxDatagramSize = maxDatagramSize;
            return this;
        }

        public Builder withThreadNamePrefix(String threadNamePrefix)
        {
            this.threadNamePrefix = Objects.requireNonNull(threadNamePrefix, "threadNamePrefix");
            return this;
        }

        public NettyDatagramBinder build()
        {
            return new NettyDatagramBinder(this);
        }
    }
}
