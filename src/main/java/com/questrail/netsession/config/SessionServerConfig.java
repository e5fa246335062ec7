package com.questrail.netsession.config;

import com.questrail.netsession.net.NetAddresses;
import com.questrail.netsession.net.NetUri;

import java.net.InetAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * SessionServerConfig
 * -----------------------------------------------------------------------------
 * Operational configuration of a datagram session server.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>port</b>: local port to bind; 0 picks an ephemeral port.</li>
 *   <li><b>localAddress</b>: local address to bind. The IPv4 "any" address by
 *       default; an "any" address is adapted to the family of the remote target
 *       before binding.</li>
 *   <li><b>remote</b>: default target of {@code sendMessageAsync} on the server
 *       itself; {@code null} when the server only answers.</li>
 *   <li><b>reuseAddress</b>: sets {@code SO_REUSEADDR}.</li>
 *   <li><b>acceptLoopback</b>: when {@code false}, datagrams the server sent to
 *       itself (same port, one of its own addresses) are dropped.</li>
 *   <li><b>sessionTimeout</b>: idle time after which a session is closed;
 *       zero disables reaping.</li>
 *   <li><b>matchTimeout</b>: how long a session waits for a response to a request.</li>
 *   <li><b>matchQueueCapacity</b>: pending requests per session.</li>
 *   <li><b>receiveConcurrency</b>: receive worker threads.</li>
 *   <li><b>receiveBufferSize</b>: initial receive buffer per datagram, grown on
 *       oversize datagrams up to {@link #MAX_RECEIVE_BUFFER_SIZE}.</li>
 * </ul>
 */
public record SessionServerConfig(
    int port,
    InetAddress localAddress,
    NetUri remote,
    boolean reuseAddress,
    boolean acceptLoopback,
    Duration sessionTimeout,
    Duration matchTimeout,
    int matchQueueCapacity,
    int receiveConcurrency,
    int receiveBufferSize
) {
    public static final int MAX_RECEIVE_BUFFER_SIZE = 1024 * 1024;

    public static final Duration DEFAULT_SESSION_TIMEOUT = Duration.ofMinutes(20);
    public static final Duration DEFAULT_MATCH_TIMEOUT = Duration.ofSeconds(15);
    public static final int DEFAULT_MATCH_QUEUE_CAPACITY = 256;
    public static final int DEFAULT_RECEIVE_BUFFER_SIZE = 8192;

    public SessionServerConfig {
        Objects.requireNonNull(localAddress, "localAddress");
        Objects.requireNonNull(sessionTimeout, "sessionTimeout");
        Objects.requireNonNull(matchTimeout, "matchTimeout");

        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be within 0..65535");
        }
        if (sessionTimeout.isNegative()) {
            throw new IllegalArgumentException("sessionTimeout must be non-negative");
        }
        if (matchTimeout.isNegative()) {
            throw new IllegalArgumentException("matchTimeout must be non-negative");
        }
        if (matchTimeout.toMillis() > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("matchTimeout is too long");
        }
        if (matchQueueCapacity <= 0) {
            throw new IllegalArgumentException("matchQueueCapacity must be positive");
        }
        if (receiveConcurrency <= 0) {
            throw new IllegalArgumentException("receiveConcurrency must be positive");
        }
        if (receiveBufferSize <= 0 || receiveBufferSize > MAX_RECEIVE_BUFFER_SIZE) {
            throw new IllegalArgumentException("receiveBufferSize must be within 1.." + MAX_RECEIVE_BUFFER_SIZE);
        }
    }

    /**
     * {@code max(1, availableProcessors * 16 / 10)}.
     */
    public static int defaultReceiveConcurrency() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() * 16 / 10);
    }

    /**
     * Ephemeral port on the IPv4 "any" address, no remote, loopback filtered,
     * 20 min idle timeout, 15 s match timeout, 256 pending requests per session.
     */
    public static SessionServerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .withPort(port)
            .withLocalAddress(localAddress)
            .withRemote(remote)
            .withReuseAddress(reuseAddress)
            .withAcceptLoopback(acceptLoopback)
            .withSessionTimeout(sessionTimeout)
            .withMatchTimeout(matchTimeout)
            .withMatchQueueCapacity(matchQueueCapacity)
            .withReceiveConcurrency(receiveConcurrency)
            .withReceiveBufferSize(receiveBufferSize);
    }

    public static final class Builder {
        private int port;
        private InetAddress localAddress = NetAddresses.ANY_V4;
        private NetUri remote;
        private boolean reuseAddress;
        private boolean acceptLoopback;
        private Duration sessionTimeout = DEFAULT_SESSION_TIMEOUT;
        private Duration matchTimeout = DEFAULT_MATCH_TIMEOUT;
        private int matchQueueCapacity = DEFAULT_MATCH_QUEUE_CAPACITY;
        private int receiveConcurrency = defaultReceiveConcurrency();
        private int receiveBufferSize = DEFAULT_RECEIVE_BUFFER_SIZE;

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withLocalAddress(InetAddress localAddress) {
            this.localAddress = localAddress;
            return this;
        }

        public Builder withRemote(NetUri remote) {
            this.remote = remote;
            return this;
        }

        public Builder withRemote(String remote) {
            this.remote = remote == null ? null : NetUri.parse(remote);
            return this;
        }

        public Builder withReuseAddress(boolean reuseAddress) {
            this.reuseAddress = reuseAddress;
            return this;
        }

        public Builder withAcceptLoopback(boolean acceptLoopback) {
            this.acceptLoopback = acceptLoopback;
            return this;
        }

        public Builder withSessionTimeout(Duration sessionTimeout) {
            this.sessionTimeout = sessionTimeout;
            return this;
        }

        public Builder withMatchTimeout(Duration matchTimeout) {
            this.matchTimeout = matchTimeout;
            return this;
        }

        public Builder withMatchQueueCapacity(int matchQueueCapacity) {
            this.matchQueueCapacity = matchQueueCapacity;
            return this;
        }

        public Builder withReceiveConcurrency(int receiveConcurrency) {
            this.receiveConcurrency = receiveConcurrency;
            return this;
        }

        public Builder withReceiveBufferSize(int receiveBufferSize) {
            this.receiveBufferSize = receiveBufferSize;
            return this;
        }

        public SessionServerConfig build() {
            return new SessionServerConfig(
                port,
                localAddress,
                remote,
                reuseAddress,
                acceptLoopback,
                sessionTimeout,
                matchTimeout,
                matchQueueCapacity,
                receiveConcurrency,
                receiveBufferSize
            );
        }
    }
}
