package com.questrail.netsession.server;

import com.questrail.netsession.codec.MessageCodec;
import com.questrail.netsession.config.SessionServerConfig;
import com.questrail.netsession.internal.time.Cancellable;
import com.questrail.netsession.internal.time.MonotonicClock;
import com.questrail.netsession.internal.time.MonotonicScheduler;
import com.questrail.netsession.internal.time.SystemWallClock;
import com.questrail.netsession.internal.time.WallClock;
import com.questrail.netsession.match.DefaultMatchQueue;
import com.questrail.netsession.match.MatchQueue;
import com.questrail.netsession.net.LocalAddressProvider;
import com.questrail.netsession.net.NetAddresses;
import com.questrail.netsession.net.NetType;
import com.questrail.netsession.net.NetUri;
import com.questrail.netsession.observability.DatagramEvent;
import com.questrail.netsession.observability.NetErrorEvent;
import com.questrail.netsession.observability.NetObservabilitySink;
import com.questrail.netsession.observability.NullObservabilitySink;
import com.questrail.netsession.observability.SessionLifecycleEvent;
import com.questrail.netsession.payload.Packet;
import com.questrail.netsession.transport.DatagramSocketError;
import com.questrail.netsession.transport.DatagramSocketFactory;
import com.questrail.netsession.transport.DatagramSocketListener;
import com.questrail.netsession.transport.DatagramSocketPort;
import com.questrail.netsession.transport.SocketBindException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * DatagramSessionServer
 * =============================================================================
 * Owns one bound datagram socket and the per-peer sessions living on it.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   socket I/O thread
 *     → receive worker          (one of receiveConcurrency)
 *       → loopback filter       (drops our own datagrams unless acceptLoopback)
 *         → resolveSession      (lookup by peer key, then broadcast port)
 *           → DatagramSession   (match queue, then MessageListeners)
 * </pre>
 *
 * <h2>Outbound path</h2>
 * All sends on the socket are serialized by one send lock. A connected socket
 * without broadcast sends unicast on the connection; otherwise the datagram is
 * sent to its explicit destination, enabling {@code SO_BROADCAST} first for the
 * limited broadcast address.
 *
 * <h2>Receive errors</h2>
 * <ul>
 *   <li>message too large: the receive buffer doubles, up to
 *       {@link SessionServerConfig#MAX_RECEIVE_BUFFER_SIZE}</li>
 *   <li>peer reset / aborted: only the session of that peer is closed</li>
 *   <li>anything else: reported</li>
 * </ul>
 * The server itself never closes because of a per-datagram error.
 *
 * <h2>Lifecycle</h2>
 * {@link #open()} and {@link #close(String)} may alternate; {@link #close()}
 * disposes the server for good. {@link #createSession} opens a closed (but not
 * disposed) server on demand.
 */
public final class DatagramSessionServer implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(DatagramSessionServer.class);

    /** Period of the idle-session check. */
    public static final Duration REAP_INTERVAL = Duration.ofSeconds(30);

    /** Payload bytes rendered in datagram events. */
    static final int LOG_DATA_LENGTH = 64;

    private final SessionServerConfig config;
    private final DatagramSocketFactory socketFactory;
    private final LocalAddressProvider localAddresses;
    private final MessageCodec codec;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Executor receiveExecutor;
    private final Executor notificationExecutor;
    private final NetObservabilitySink sink;
    private final WallClock wallClock = SystemWallClock.INSTANCE;

    private final SessionRegistry registry = new SessionRegistry();
    private final SessionEvents events;
    private final List<MessageListener> messageListeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger ids = new AtomicInteger();

    private final Object lifecycleLock = new Object();
    private final Object sendLock = new Object();

    private volatile DatagramSocketPort socket;
    private volatile boolean active;
    private volatile boolean disposed;
    private volatile InetAddress localAddress;
    private volatile int port;
    private volatile int receiveBufferSize;
    private volatile Cancellable reapTask;

    /**
     * @param config               operational configuration
     * @param socketFactory        creates the socket on open
     * @param localAddresses       own addresses, for the loopback filter when bound to "any"
     * @param codec                message codec shared by all sessions
     * @param clock                monotonic source for deadlines and idle tracking
     * @param scheduler            runs the match-queue sweeps and the idle check
     * @param receiveExecutor      receive workers; its width bounds receive parallelism
     * @param notificationExecutor resolves request futures and runs session subscribers
     * @param sink                 observability sink; {@code null} for none
     */
    public DatagramSessionServer(SessionServerConfig config,
                                 DatagramSocketFactory socketFactory,
                                 LocalAddressProvider localAddresses,
                                 MessageCodec codec,
                                 MonotonicClock clock,
                                 MonotonicScheduler scheduler,
                                 Executor receiveExecutor,
                                 Executor notificationExecutor,
                                 NetObservabilitySink sink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.socketFactory = Objects.requireNonNull(socketFactory, "socketFactory");
        this.localAddresses = Objects.requireNonNull(localAddresses, "localAddresses");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.receiveExecutor = Objects.requireNonNull(receiveExecutor, "receiveExecutor");
        this.notificationExecutor = Objects.requireNonNull(notificationExecutor, "notificationExecutor");
        this.sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);

        this.events = new SessionEvents(notificationExecutor, this.sink, wallClock);
        this.localAddress = config.localAddress();
        this.port = config.port();
        this.receiveBufferSize = config.receiveBufferSize();
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Bind the socket and start receiving. No-op when already open.
     *
     * @throws SocketBindException   if the local endpoint cannot be bound
     * @throws IllegalStateException if the server was disposed
     */
    public void open()
    {
        synchronized (lifecycleLock) {
            if (disposed) {
                throw new IllegalStateException("Server " + this + " is disposed");
            }
            if (active) {
                return;
            }

            InetAddress local = localAddress;
            NetUri remote = config.remote();
            if (remote != null && NetAddresses.isAny(local)) {
                InetAddress target = remote.address();
                if (!NetAddresses.isAny(target)) {
                    local = NetAddresses.rightAny(local, NetAddresses.familyOf(target));
                }
            }

            DatagramSocketPort s = socketFactory.create(NetAddresses.familyOf(local));
            s.setListener(new ReceiveListener());
            s.setReceiveBufferSize(receiveBufferSize);
            try {
                s.bind(new InetSocketAddress(local, config.port()), config.reuseAddress());
            } catch (SocketBindException e) {
                s.close();
                throw e;
            }

            InetSocketAddress bound = s.localAddress();
            localAddress = local;
            port = bound != null ? bound.getPort() : config.port();
            socket = s;
            active = true;
            scheduleReap();
        }

        sink.onSessionEvent(new SessionLifecycleEvent(
            wallClock.now(), SessionLifecycleEvent.Kind.SERVER_OPENED, 0, localUri().toString(), null));
    }

    /**
     * Close every session, then the socket. No-op when not open.
     */
    public void close(String reason)
    {
        DatagramSocketPort s;
        synchronized (lifecycleLock) {
            if (!active) {
                return;
            }
            active = false;
            s = socket;
            Cancellable reap = reapTask;
            reapTask = null;
            if (reap != null) {
                reap.cancel();
            }
        }

        closeAllSessions(reason);

        synchronized (sendLock) {
            socket = null;
        }
        boolean wasOpen = s.isOpen();
        try {
            s.close();
        } catch (RuntimeException e) {
            // a socket that was already gone has nothing left to report
            if (wasOpen) {
                reportError("Close", "Socket shutdown failed for " + localUri(), e);
            }
        }

        sink.onSessionEvent(new SessionLifecycleEvent(
            wallClock.now(), SessionLifecycleEvent.Kind.SERVER_CLOSED, 0, localUri().toString(), reason));
    }

    /**
     * Close and dispose; the server cannot be opened again.
     */
    @Override
    public void close()
    {
        disposed = true;
        close("Dispose");
    }

    public boolean isActive()
    {
        return active;
    }

    public boolean isDisposed()
    {
        return disposed;
    }

    private void closeAllSessions(String reason)
    {
        List<DatagramSession> all;
        // creations check active under this lock, so none can land after the snapshot
        synchronized (registry.createLock) {
            all = registry.all();
        }
        if (!all.isEmpty()) {
            log.debug("Closing {} sessions of {}", all.size(), localUri());
        }
        for (DatagramSession s : all) {
            s.close(reason);
        }
    }

    // -------------------------------------------------------------------------
    // Sessions
    // -------------------------------------------------------------------------

    /**
     * The session for a peer, created on first use.
     *
     * <p>Opens the server if it is not active, adapting an "any" local address
     * to the peer's address family first.</p>
     *
     * @return the session, or empty if the server could not be opened
     * @throws IllegalStateException if the server was disposed
     */
    public Optional<DatagramSession> createSession(InetSocketAddress remote)
    {
        Objects.requireNonNull(remote, "remote");
        if (disposed) {
            throw new IllegalStateException("Server " + this + " is disposed");
        }

        if (!active) {
            if (remote.getAddress() != null) {
                adaptLocalFamily(remote.getAddress());
            }
            try {
                open();
            } catch (SocketBindException e) {
                reportError("Open", e.getMessage(), e);
                return Optional.empty();
            }
        }
        return resolveSession(remote);
    }

    /**
     * Lookup-or-create on an open server. Never opens the server: the receive
     * path uses this, so a datagram still in flight when the server closes
     * cannot bring it back.
     *
     * @return the session, or empty if the server is not active
     */
    Optional<DatagramSession> resolveSession(InetSocketAddress remote)
    {
        if (!active) {
            return Optional.empty();
        }

        String key = NetAddresses.peerKey(remote);
        int remotePort = remote.getPort();
        DatagramSession session = registry.find(key, remotePort);
        if (session != null) {
            return Optional.of(session);
        }

        synchronized (registry.createLock) {
            if (!active) {
                return Optional.empty();
            }
            session = registry.find(key, remotePort);
            if (session != null) {
                return Optional.of(session);
            }
            session = newSession(remote, key);
            // registered before subscribers hear of it, so a subscriber can look it up
            registry.add(session);
        }

        sink.onSessionEvent(new SessionLifecycleEvent(
            wallClock.now(), SessionLifecycleEvent.Kind.SESSION_CREATED, session.id(), key, null));
        events.publish(session);
        return Optional.of(session);
    }

    private DatagramSession newSession(InetSocketAddress remote, String key)
    {
        MatchQueue<Object, Object> queue = new DefaultMatchQueue<>(
            config.matchQueueCapacity(), clock, scheduler, notificationExecutor, sink);
        // wraps to negative after 2^31 sessions
        DatagramSession session = new DatagramSession(ids.incrementAndGet(), this, remote, key, queue, codec, clock);

        session.onDisposed(() -> registry.remove(session));
        if (NetAddresses.isBroadcast(remote.getAddress())) {
            int remotePort = remote.getPort();
            registry.addBroadcast(remotePort, session);
            session.onDisposed(() -> registry.removeBroadcast(remotePort, session));
        }

        session.start();
        return session;
    }

    private void adaptLocalFamily(InetAddress target)
    {
        synchronized (lifecycleLock) {
            if (!active) {
                localAddress = NetAddresses.rightAny(localAddress, NetAddresses.familyOf(target));
            }
        }
    }

    /**
     * Live read-only view of the sessions, keyed by peer key.
     */
    public Map<String, DatagramSession> sessions()
    {
        return registry.view();
    }

    public Optional<DatagramSession> session(InetSocketAddress remote)
    {
        return Optional.ofNullable(registry.get(NetAddresses.peerKey(remote)));
    }

    public int sessionCount()
    {
        return registry.size();
    }

    public SessionEvents events()
    {
        return events;
    }

    /**
     * @return handle that removes the listener
     */
    public Cancellable addMessageListener(MessageListener listener)
    {
        Objects.requireNonNull(listener, "listener");
        messageListeners.add(listener);
        return () -> messageListeners.remove(listener);
    }

    void sessionClosed(DatagramSession session, String reason)
    {
        sink.onSessionEvent(new SessionLifecycleEvent(
            wallClock.now(), SessionLifecycleEvent.Kind.SESSION_CLOSED, session.id(), session.key(), reason));
    }

    void deliverUnmatched(DatagramSession session, Object message)
    {
        for (MessageListener l : messageListeners) {
            try {
                l.onMessage(session, message);
            } catch (RuntimeException e) {
                reportError("Message", "Listener failed for " + session, e);
            }
        }
    }

    // -------------------------------------------------------------------------
    // Idle reaping
    // -------------------------------------------------------------------------

    private void scheduleReap()
    {
        if (config.sessionTimeout().isZero()) {
            return;
        }
        reapTask = scheduler.scheduleAfter(REAP_INTERVAL, clock, this::reap);
    }

    private void reap()
    {
        if (!active) {
            return;
        }
        try {
            reapIdleSessions();
        } finally {
            synchronized (lifecycleLock) {
                if (active) {
                    scheduleReap();
                }
            }
        }
    }

    /**
     * Close every session idle for at least the session timeout.
     *
     * @return number of sessions closed
     */
    int reapIdleSessions()
    {
        long now = clock.nowNanos();
        long timeout = config.sessionTimeout().toNanos();
        int reaped = 0;
        for (DatagramSession s : registry.all()) {
            if (now - s.lastActivityNanos() >= timeout) {
                s.close("Timeout");
                reaped++;
            }
        }
        return reaped;
    }

    // -------------------------------------------------------------------------
    // Send
    // -------------------------------------------------------------------------

    /**
     * Send one datagram.
     *
     * @return bytes sent, or -1 on failure (reported to the sink)
     */
    public int send(Packet packet, InetSocketAddress remote)
    {
        try {
            return transmit(packet, remote);
        } catch (UncheckedIOException e) {
            reportError("Send", "Send to " + remote + " failed", e);
            return -1;
        }
    }

    /**
     * Send a message to the configured remote through its session and await
     * the response. Matching requires the session path, so this never sends
     * on the bare socket.
     *
     * @throws IllegalStateException if no remote is configured or the server cannot be opened
     */
    public CompletableFuture<Object> sendMessageAsync(Object message)
    {
        NetUri remote = config.remote();
        if (remote == null) {
            throw new IllegalStateException("No remote configured for " + this);
        }
        return createSession(remote.endpoint())
            .orElseThrow(() -> new IllegalStateException("Server " + this + " could not be opened"))
            .sendMessageAsync(message);
    }

    /**
     * @throws UncheckedIOException if the socket is closed or refuses the datagram
     */
    int transmit(Packet packet, InetSocketAddress remote)
    {
        Objects.requireNonNull(packet, "packet");
        Objects.requireNonNull(remote, "remote");

        int sent;
        synchronized (sendLock) {
            DatagramSocketPort s = socket;
            if (s == null) {
                throw new UncheckedIOException(new ClosedChannelException());
            }
            if (s.isConnected() && !s.isBroadcastEnabled()) {
                sent = s.send(packet);
            } else {
                if (NetAddresses.isBroadcast(remote.getAddress()) && !s.isBroadcastEnabled()) {
                    s.enableBroadcast();
                }
                sent = s.sendTo(packet, remote);
            }
        }

        emitDatagram(DatagramEvent.Kind.SENT, remote, packet, packet.total());
        return sent;
    }

    // -------------------------------------------------------------------------
    // Receive
    // -------------------------------------------------------------------------

    void process(InetSocketAddress remote, Packet packet)
    {
        if (!active) {
            return;
        }
        if (isLoopback(remote)) {
            emitDatagram(DatagramEvent.Kind.DROPPED_LOOPBACK, remote, packet, packet.total());
            return;
        }
        emitDatagram(DatagramEvent.Kind.RECEIVED, remote, packet, packet.total());

        Optional<DatagramSession> session = resolveSession(remote);
        if (session.isEmpty()) {
            log.debug("Recv [{}] from {} resolved to no session: {}", packet.total(), remote, packet.toHex(LOG_DATA_LENGTH));
            return;
        }
        session.get().onReceive(packet);
    }

    /**
     * Whether a datagram came from this server itself.
     */
    boolean isLoopback(InetSocketAddress remote)
    {
        if (config.acceptLoopback() || remote.getPort() != port) {
            return false;
        }
        InetAddress from = remote.getAddress();
        if (from == null) {
            return false;
        }
        InetAddress local = localAddress;
        if (!NetAddresses.isAny(local)) {
            return from.equals(local);
        }
        for (InetAddress a : localAddresses.localAddresses()) {
            if (from.equals(a)) {
                return true;
            }
        }
        return false;
    }

    void onReceiveError(DatagramSocketError error)
    {
        switch (error.kind()) {
            case MESSAGE_TOO_LARGE: {
                int before = receiveBufferSize;
                growReceiveBuffer();
                sink.onDatagramEvent(new DatagramEvent(
                    wallClock.now(), DatagramEvent.Kind.DROPPED_TRUNCATED, error.remote(), before, null));
                break;
            }
            case PEER_RESET:
            case PEER_ABORTED: {
                InetSocketAddress remote = error.remote();
                if (remote != null) {
                    DatagramSession s = registry.get(NetAddresses.peerKey(remote));
                    if (s != null) {
                        s.close(error.kind().toString());
                    }
                }
                break;
            }
            default:
                reportError("Receive", error.message(), error.cause());
                break;
        }
    }

    private void growReceiveBuffer()
    {
        synchronized (lifecycleLock) {
            int current = receiveBufferSize;
            if (current >= SessionServerConfig.MAX_RECEIVE_BUFFER_SIZE) {
                return;
            }
            int next = Math.min(current * 2, SessionServerConfig.MAX_RECEIVE_BUFFER_SIZE);
            receiveBufferSize = next;
            DatagramSocketPort s = socket;
            if (s != null) {
                s.setReceiveBufferSize(next);
            }
            log.debug("Receive buffer of {} grown to {}", localUri(), next);
        }
    }

    public int receiveBufferSize()
    {
        return receiveBufferSize;
    }

    private final class ReceiveListener implements DatagramSocketListener
    {
        @Override
        public void onDatagram(InetSocketAddress remote, Packet packet)
        {
            try {
                receiveExecutor.execute(() -> process(remote, packet));
            } catch (RejectedExecutionException e) {
                reportError("Receive", "Receive worker rejected datagram from " + remote, e);
            }
        }

        @Override
        public void onError(DatagramSocketError error)
        {
            onReceiveError(error);
        }
    }

    // -------------------------------------------------------------------------
    // Support
    // -------------------------------------------------------------------------

    public SessionServerConfig config()
    {
        return config;
    }

    /**
     * Local endpoint as a URI; the bound port once open.
     */
    public NetUri localUri()
    {
        return new NetUri(NetType.UDP, localAddress, port);
    }

    public int port()
    {
        return port;
    }

    void reportError(String action, String message, Throwable cause)
    {
        sink.onError(new NetErrorEvent(wallClock.now(), action, message, cause));
    }

    private void emitDatagram(DatagramEvent.Kind kind, InetSocketAddress remote, Packet packet, int bytes)
    {
        if (sink == NullObservabilitySink.INSTANCE) {
            return;
        }
        sink.onDatagramEvent(new DatagramEvent(wallClock.now(), kind, remote, bytes, packet.toHex(LOG_DATA_LENGTH)));
    }

    @Override
    public String toString()
    {
        int n = registry.size();
        return n > 0 ? localUri() + " [" + n + "]" : localUri().toString();
    }
}
