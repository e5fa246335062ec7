package com.questrail.netsession.transport.netty;

import com.questrail.netsession.transport.DatagramSocketFactory;
import com.questrail.netsession.transport.DatagramSocketPort;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.InternetProtocolFamily;

import java.net.ProtocolFamily;
import java.net.StandardProtocolFamily;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyDatagramSocketFactory
 * =============================================================================
 * Creates {@link NettyDatagramSocket}s on one shared NIO event loop group.
 *
 * <h2>Ownership</h2>
 * A group created here is owned here and shut down by {@link #close()}. A group
 * passed in belongs to the caller.
 */
public final class NettyDatagramSocketFactory implements DatagramSocketFactory, AutoCloseable
{
    private final EventLoopGroup group;
    private final boolean ownsGroup;

    public NettyDatagramSocketFactory()
    {
        this(new NioEventLoopGroup(1), true);
    }

    public NettyDatagramSocketFactory(EventLoopGroup group)
    {
        this(group, false);
    }

    private NettyDatagramSocketFactory(EventLoopGroup group, boolean ownsGroup)
    {
        this.group = Objects.requireNonNull(group, "group");
        this.ownsGroup = ownsGroup;
    }

    @Override
    public DatagramSocketPort create(ProtocolFamily family)
    {
        InternetProtocolFamily f = family == StandardProtocolFamily.INET6
            ? InternetProtocolFamily.IPv6
            : InternetProtocolFamily.IPv4;
        return new NettyDatagramSocket(group, f);
    }

    @Override
    public void close()
    {
        if (ownsGroup) {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly(5, TimeUnit.SECONDS);
        }
    }
}
