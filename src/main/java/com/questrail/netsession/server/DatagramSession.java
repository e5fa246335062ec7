package com.questrail.netsession.server;

import com.questrail.netsession.codec.MessageCodec;
import com.questrail.netsession.internal.time.MonotonicClock;
import com.questrail.netsession.match.MatchQueue;
import com.questrail.netsession.match.MatchQueueFullException;
import com.questrail.netsession.net.NetType;
import com.questrail.netsession.net.NetUri;
import com.questrail.netsession.payload.Packet;

import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DatagramSession
 * =============================================================================
 * One conversation between a {@link DatagramSessionServer} and a single peer.
 *
 * <h2>Lifecycle</h2>
 * Created by the server on the first datagram from, or first send to, a new
 * peer, and closed at most once: by the application, by the server when it
 * closes, on a peer-reset error, or when idle for longer than the session
 * timeout. Closing cancels every pending request and runs the disposal actions
 * that remove the session from the server.
 *
 * <h2>Requests</h2>
 * {@link #sendMessageAsync} registers the message in this session's match
 * queue before sending it. An inbound message first tries to complete a
 * pending request; only a message that completes nothing reaches the
 * server's {@link MessageListener}s.
 */
public final class DatagramSession implements AutoCloseable
{
    private final int id;
    private final DatagramSessionServer server;
    private final InetSocketAddress remote;
    private final String key;
    private final MatchQueue<Object, Object> matchQueue;
    private final MessageCodec codec;
    private final MonotonicClock clock;

    private final List<Runnable> disposalActions = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean active;
    private volatile long lastActivityNanos;

    DatagramSession(int id,
                    DatagramSessionServer server,
                    InetSocketAddress remote,
                    String key,
                    MatchQueue<Object, Object> matchQueue,
                    MessageCodec codec,
                    MonotonicClock clock)
    {
        this.id = id;
        this.server = Objects.requireNonNull(server, "server");
        this.remote = Objects.requireNonNull(remote, "remote");
        this.key = Objects.requireNonNull(key, "key");
        this.matchQueue = Objects.requireNonNull(matchQueue, "matchQueue");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lastActivityNanos = clock.nowNanos();
    }

    void start()
    {
        active = true;
        touch();
    }

    public int id()
    {
        return id;
    }

    public DatagramSessionServer server()
    {
        return server;
    }

    public InetSocketAddress remote()
    {
        return remote;
    }

    public NetUri remoteUri()
    {
        return new NetUri(NetType.UDP, remote);
    }

    /**
     * Peer key this session is registered under.
     */
    public String key()
    {
        return key;
    }

    public boolean isActive()
    {
        return active;
    }

    public boolean isClosed()
    {
        return closed.get();
    }

    public long lastActivityNanos()
    {
        return lastActivityNanos;
    }

    public int pendingRequests()
    {
        return matchQueue.pending();
    }

    // -------------------------------------------------------------------------
    // Send
    // -------------------------------------------------------------------------

    /**
     * Send one datagram to the peer.
     *
     * @return bytes sent, or -1 if the send failed (reported to the server's sink)
     * @throws IllegalStateException if the session is closed
     */
    public int send(Packet packet)
    {
        requireOpen();
        touch();
        return server.send(packet, remote);
    }

    public int send(byte[] data)
    {
        return send(new Packet(data));
    }

    /**
     * Send a message and await the matching response, with the server's match
     * timeout.
     */
    public CompletableFuture<Object> sendMessageAsync(Object message)
    {
        return sendMessageAsync(message, server.config().matchTimeout());
    }

    /**
     * Send a message and await the matching response.
     *
     * <p>The returned future completes with the decoded response, or
     * exceptionally with:</p>
     * <ul>
     *   <li>{@link SessionSendException} if the datagram could not be sent</li>
     *   <li>{@link com.questrail.netsession.match.MatchCancelledException} on
     *       timeout or when the session closes</li>
     * </ul>
     *
     * @throws MatchQueueFullException if too many requests are already pending
     * @throws IllegalStateException   if the session is closed
     */
    public CompletableFuture<Object> sendMessageAsync(Object message, Duration timeout)
    {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(timeout, "timeout");
        requireOpen();

        Packet packet = codec.encode(message);
        CompletableFuture<Object> response = new CompletableFuture<>();
        matchQueue.add(this, message, (int) Math.min(Integer.MAX_VALUE, timeout.toMillis()), response);

        // close() sets the flag before clearing, so a slot added after that clear is caught here
        if (closed.get()) {
            matchQueue.clear();
            return response;
        }

        touch();
        try {
            server.transmit(packet, remote);
        } catch (UncheckedIOException e) {
            server.reportError("Send", "Send to " + key + " failed", e);
            // the slot stays until expiry; the queue never resolves a done handle twice
            response.completeExceptionally(new SessionSendException(remote, e.getCause()));
        }
        return response;
    }

    // -------------------------------------------------------------------------
    // Receive
    // -------------------------------------------------------------------------

    void onReceive(Packet packet)
    {
        touch();

        Optional<Object> decoded;
        try {
            decoded = codec.decode(packet);
        } catch (RuntimeException e) {
            server.reportError("Decode", "Undecodable datagram from " + key + " [" + packet.total() + "]", e);
            return;
        }
        if (decoded.isEmpty()) {
            return;
        }

        Object message = decoded.get();
        if (!matchQueue.match(this, message, message, codec::isMatch)) {
            server.deliverUnmatched(this, message);
        }
    }

    // -------------------------------------------------------------------------
    // Close
    // -------------------------------------------------------------------------

    /**
     * Register an action run once when the session closes.
     */
    void onDisposed(Runnable action)
    {
        disposalActions.add(Objects.requireNonNull(action, "action"));
    }

    /**
     * Close the session. Pending requests are cancelled; further calls are no-ops.
     */
    public void close(String reason)
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        active = false;
        matchQueue.clear();

        for (Runnable action : disposalActions) {
            try {
                action.run();
            } catch (RuntimeException e) {
                server.reportError("Close", "Disposal action failed for " + key, e);
            }
        }
        server.sessionClosed(this, reason);
    }

    @Override
    public void close()
    {
        close("Dispose");
    }

    private void touch()
    {
        lastActivityNanos = clock.nowNanos();
    }

    private void requireOpen()
    {
        if (closed.get()) {
            throw new IllegalStateException("Session " + this + " is closed");
        }
    }

    @Override
    public String toString()
    {
        return "#" + id + " " + key;
    }
}
