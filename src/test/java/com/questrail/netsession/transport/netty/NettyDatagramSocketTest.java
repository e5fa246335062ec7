package com.questrail.netsession.transport.netty;

import com.questrail.netsession.payload.Packet;
import com.questrail.netsession.transport.DatagramSocketError;
import com.questrail.netsession.transport.DatagramSocketListener;
import com.questrail.netsession.transport.DatagramSocketPort;
import com.questrail.netsession.transport.SocketBindException;
import com.questrail.netsession.transport.SocketErrorKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.StandardProtocolFamily;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the Netty adapter over real sockets on the loopback interface.
 */
class NettyDatagramSocketTest {

    private static final class QueueingListener implements DatagramSocketListener {
        final BlockingQueue<InetSocketAddress> senders = new LinkedBlockingQueue<>();
        final BlockingQueue<Packet> datagrams = new LinkedBlockingQueue<>();
        final BlockingQueue<DatagramSocketError> errors = new LinkedBlockingQueue<>();

        @Override
        public void onDatagram(InetSocketAddress remote, Packet packet) {
            senders.add(remote);
            datagrams.add(packet);
        }

        @Override
        public void onError(DatagramSocketError error) {
            errors.add(error);
        }
    }

    private NettyDatagramSocketFactory factory;
    private final List<DatagramSocketPort> sockets = new ArrayList<>();

    @BeforeEach
    void setUp() {
        factory = new NettyDatagramSocketFactory();
    }

    @AfterEach
    void tearDown() {
        sockets.forEach(DatagramSocketPort::close);
        factory.close();
    }

    private DatagramSocketPort bound(QueueingListener listener) {
        DatagramSocketPort s = factory.create(StandardProtocolFamily.INET);
        sockets.add(s);
        s.setListener(listener);
        s.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), false);
        return s;
    }

    @Test
    void datagramTravelsBetweenTwoSockets() throws InterruptedException {
        QueueingListener a = new QueueingListener();
        QueueingListener b = new QueueingListener();
        DatagramSocketPort sender = bound(a);
        DatagramSocketPort receiver = bound(b);

        int sent = sender.sendTo(Packet.of("hello"), receiver.localAddress());

        assertEquals(5, sent);
        Packet received = b.datagrams.poll(5, TimeUnit.SECONDS);
        assertNotNull(received, "no datagram received");
        assertEquals("hello", received.toUtf8());
        assertEquals(sender.localAddress(), b.senders.poll());
    }

    @Test
    void chainedPacketArrivesAsOneDatagram() throws InterruptedException {
        QueueingListener b = new QueueingListener();
        DatagramSocketPort sender = bound(new QueueingListener());
        DatagramSocketPort receiver = bound(b);

        sender.sendTo(Packet.of("head-").append(Packet.of("tail")), receiver.localAddress());

        Packet received = b.datagrams.poll(5, TimeUnit.SECONDS);
        assertNotNull(received, "no datagram received");
        assertEquals("head-tail", received.toUtf8());
    }

    @Test
    void datagramFillingTheBufferIsReportedAsTooLarge() throws InterruptedException {
        QueueingListener b = new QueueingListener();
        DatagramSocketPort sender = bound(new QueueingListener());
        DatagramSocketPort receiver = factory.create(StandardProtocolFamily.INET);
        sockets.add(receiver);
        receiver.setListener(b);
        receiver.setReceiveBufferSize(16);
        receiver.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), false);

        sender.sendTo(new Packet(new byte[64]), receiver.localAddress());

        DatagramSocketError error = b.errors.poll(5, TimeUnit.SECONDS);
        assertNotNull(error, "no error reported");
        assertEquals(SocketErrorKind.MESSAGE_TOO_LARGE, error.kind());
        assertEquals(sender.localAddress(), error.remote());
        assertTrue(b.datagrams.isEmpty());
        assertTrue(receiver.isOpen());
    }

    @Test
    void grownBufferAcceptsTheLargerDatagram() throws InterruptedException {
        QueueingListener b = new QueueingListener();
        DatagramSocketPort sender = bound(new QueueingListener());
        DatagramSocketPort receiver = factory.create(StandardProtocolFamily.INET);
        sockets.add(receiver);
        receiver.setListener(b);
        receiver.setReceiveBufferSize(16);
        receiver.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), false);

        receiver.setReceiveBufferSize(128);
        sender.sendTo(new Packet(new byte[64]), receiver.localAddress());

        Packet received = b.datagrams.poll(5, TimeUnit.SECONDS);
        assertNotNull(received, "no datagram received");
        assertEquals(64, received.total());
        assertEquals(128, receiver.receiveBufferSize());
    }

    @Test
    void bindingATakenPortFails() {
        DatagramSocketPort first = bound(new QueueingListener());
        DatagramSocketPort second = factory.create(StandardProtocolFamily.INET);
        sockets.add(second);
        second.setListener(new QueueingListener());

        SocketBindException e = assertThrows(SocketBindException.class,
            () -> second.bind(first.localAddress(), false));

        assertEquals(first.localAddress(), e.local());
        assertFalse(second.isOpen());
    }

    @Test
    void bindRequiresAListener() {
        DatagramSocketPort s = factory.create(StandardProtocolFamily.INET);

        assertThrows(IllegalStateException.class,
            () -> s.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), false));
    }

    @Test
    void broadcastIsOffUntilEnabled() {
        DatagramSocketPort s = bound(new QueueingListener());

        assertFalse(s.isBroadcastEnabled());
        s.enableBroadcast();
        assertTrue(s.isBroadcastEnabled());
        assertFalse(s.isConnected());
    }

    @Test
    void closedSocketRefusesToSend() {
        DatagramSocketPort s = bound(new QueueingListener());
        InetSocketAddress target = new InetSocketAddress(InetAddress.getLoopbackAddress(), 9);

        s.close();

        assertFalse(s.isOpen());
        assertThrows(UncheckedIOException.class, () -> s.sendTo(Packet.of("late"), target));
    }

    @Test
    void unboundSocketRefusesToSend() {
        DatagramSocketPort s = factory.create(StandardProtocolFamily.INET);

        assertFalse(s.isOpen());
        assertNull(s.localAddress());
        assertThrows(UncheckedIOException.class, () -> s.send(Packet.of("x")));
    }
}
