package com.questrail.netsession.transport.netty;

import com.questrail.netsession.payload.Packet;
import com.questrail.netsession.transport.DatagramSocketError;
import com.questrail.netsession.transport.DatagramSocketListener;
import com.questrail.netsession.transport.DatagramSocketPort;
import com.questrail.netsession.transport.SocketBindException;
import com.questrail.netsession.transport.SocketErrorKind;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFactory;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.DatagramChannel;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.InternetProtocolFamily;
import io.netty.channel.socket.nio.NioDatagramChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.util.Objects;

/**
 * NettyDatagramSocket
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramSocketPort}.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT track
 * sessions, correlate requests, or decide what a receive error means.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound payloads are copied into a
 * {@link Packet}; all reference-counted buffers are released internally.
 *
 * <h2>Receive buffer</h2>
 * Each read allocates exactly the configured receive size. NIO silently drops
 * the tail of a larger datagram, so a read that fills the buffer completely is
 * treated as truncated and reported as {@link SocketErrorKind#MESSAGE_TOO_LARGE}
 * instead of being delivered.
 *
 * <h2>Errors</h2>
 * Read failures are classified and reported to the listener. The channel stays
 * open: Netty's NIO datagram channel does not close on a socket exception.
 */
final class NettyDatagramSocket implements DatagramSocketPort
{
    private static final Logger log = LoggerFactory.getLogger(NettyDatagramSocket.class);

    static final int DEFAULT_RECEIVE_BUFFER_SIZE = 8192;

    private final EventLoopGroup group;
    private final InternetProtocolFamily family;

    private volatile DatagramSocketListener listener;
    private volatile DatagramChannel channel;
    private volatile int receiveBufferSize = DEFAULT_RECEIVE_BUFFER_SIZE;

    NettyDatagramSocket(EventLoopGroup group, InternetProtocolFamily family)
    {
        this.group = Objects.requireNonNull(group, "group");
        this.family = Objects.requireNonNull(family, "family");
    }

    @Override
    public void setListener(DatagramSocketListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void bind(InetSocketAddress local, boolean reuseAddress)
    {
        Objects.requireNonNull(local, "local");
        if (listener == null) {
            throw new IllegalStateException("DatagramSocketListener must be set before bind()");
        }
        if (channel != null) {
            throw new IllegalStateException("Already bound to " + channel.localAddress());
        }

        Bootstrap bootstrap = new Bootstrap()
            .group(group)
            .channelFactory((ChannelFactory<NioDatagramChannel>) () -> new NioDatagramChannel(family))
            .option(ChannelOption.SO_BROADCAST, false)
            .option(ChannelOption.SO_REUSEADDR, reuseAddress)
            .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(receiveBufferSize))
            .handler(new InboundHandler());

        ChannelFuture f = bootstrap.bind(local).awaitUninterruptibly();
        if (!f.isSuccess()) {
            f.channel().close().awaitUninterruptibly();
            throw new SocketBindException(local, f.cause());
        }
        channel = (DatagramChannel) f.channel();
        log.debug("Bound {} ({})", channel.localAddress(), family);
    }

    @Override
    public InetSocketAddress localAddress()
    {
        DatagramChannel ch = channel;
        return ch != null ? ch.localAddress() : null;
    }

    @Override
    public boolean isOpen()
    {
        DatagramChannel ch = channel;
        return ch != null && ch.isOpen();
    }

    @Override
    public boolean isConnected()
    {
        DatagramChannel ch = channel;
        return ch != null && ch.isConnected();
    }

    @Override
    public boolean isBroadcastEnabled()
    {
        DatagramChannel ch = channel;
        return ch != null && ch.config().isBroadcast();
    }

    @Override
    public void enableBroadcast()
    {
        requireChannel().config().setBroadcast(true);
    }

    @Override
    public int send(Packet packet)
    {
        Objects.requireNonNull(packet, "packet");
        DatagramChannel ch = requireChannel();
        ByteBuf buf = wrap(packet);
        int bytes = buf.readableBytes();
        return complete(ch, ch.writeAndFlush(buf), bytes, (InetSocketAddress) ch.remoteAddress());
    }

    @Override
    public int sendTo(Packet packet, InetSocketAddress remote)
    {
        Objects.requireNonNull(packet, "packet");
        Objects.requireNonNull(remote, "remote");
        DatagramChannel ch = requireChannel();
        ByteBuf buf = wrap(packet);
        int bytes = buf.readableBytes();
        return complete(ch, ch.writeAndFlush(new DatagramPacket(buf, remote)), bytes, remote);
    }

    @Override
    public int receiveBufferSize()
    {
        return receiveBufferSize;
    }

    @Override
    public void setReceiveBufferSize(int bytes)
    {
        if (bytes <= 0) {
            throw new IllegalArgumentException("receive buffer size must be positive");
        }
        receiveBufferSize = bytes;
        DatagramChannel ch = channel;
        if (ch != null) {
            ch.config().setRecvByteBufAllocator(new FixedRecvByteBufAllocator(bytes));
        }
    }

    @Override
    public void close()
    {
        DatagramChannel ch = channel;
        if (ch != null && ch.isOpen()) {
            ch.close().awaitUninterruptibly();
            log.debug("Closed {}", ch.localAddress());
        }
    }

    private DatagramChannel requireChannel()
    {
        DatagramChannel ch = channel;
        if (ch == null || !ch.isOpen()) {
            throw new UncheckedIOException(new ClosedChannelException());
        }
        return ch;
    }

    private static ByteBuf wrap(Packet packet)
    {
        if (packet.next() == null) {
            return Unpooled.wrappedBuffer(packet.data(), packet.offset(), packet.count());
        }
        return Unpooled.wrappedBuffer(packet.segments().toArray(new ByteBuffer[0]));
    }

    /**
     * Await the write unless called on the event loop itself, where waiting
     * would deadlock; a failure there is reported to the listener instead.
     */
    private int complete(DatagramChannel ch, ChannelFuture f, int bytes, InetSocketAddress remote)
    {
        if (ch.eventLoop().inEventLoop()) {
            f.addListener((ChannelFutureListener) future -> {
                if (!future.isSuccess()) {
                    report(remote, future.cause());
                }
            });
            return bytes;
        }

        f.awaitUninterruptibly();
        if (!f.isSuccess()) {
            Throwable cause = f.cause();
            throw new UncheckedIOException(cause instanceof IOException
                ? (IOException) cause
                : new IOException("Send to " + remote + " failed", cause));
        }
        return bytes;
    }

    private void report(InetSocketAddress remote, Throwable cause)
    {
        DatagramSocketListener l = listener;
        if (l != null) {
            l.onError(new DatagramSocketError(NettySocketErrors.classify(cause), remote, cause));
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies each Netty {@link DatagramPacket} into a {@link Packet} and forwards
     * it to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            DatagramSocketListener l = listener;
            if (l == null) {
                return;
            }

            ByteBuf content = packet.content();
            int size = content.readableBytes();
            InetSocketAddress remote = packet.sender();
            if (size >= receiveBufferSize) {
                l.onError(new DatagramSocketError(SocketErrorKind.MESSAGE_TOO_LARGE, remote,
                    new IOException("Datagram of at least " + size + " bytes exceeds the receive buffer")));
                return;
            }

            byte[] bytes = new byte[size];
            content.getBytes(content.readerIndex(), bytes);
            l.onDatagram(remote, new Packet(bytes));
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            log.debug("Channel inactive {}", ctx.channel().localAddress());
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            SocketAddress remote = ctx.channel().remoteAddress();
            report(remote instanceof InetSocketAddress ? (InetSocketAddress) remote : null, cause);
        }
    }
}
