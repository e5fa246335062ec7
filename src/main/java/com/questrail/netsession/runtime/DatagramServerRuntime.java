package com.questrail.netsession.runtime;

import com.questrail.netsession.codec.MessageCodec;
import com.questrail.netsession.codec.RawPacketCodec;
import com.questrail.netsession.config.SessionServerConfig;
import com.questrail.netsession.internal.time.MonotonicClock;
import com.questrail.netsession.internal.time.MonotonicScheduler;
import com.questrail.netsession.internal.time.ScheduledExecutorScheduler;
import com.questrail.netsession.internal.time.SystemMonotonicClock;
import com.questrail.netsession.net.CachingHostResolver;
import com.questrail.netsession.net.HostResolver;
import com.questrail.netsession.net.InetHostResolver;
import com.questrail.netsession.net.LocalAddressProvider;
import com.questrail.netsession.net.NetworkInterfaceAddressProvider;
import com.questrail.netsession.observability.NetObservabilitySink;
import com.questrail.netsession.observability.NullObservabilitySink;
import com.questrail.netsession.server.DatagramSessionServer;
import com.questrail.netsession.transport.DatagramSocketFactory;
import com.questrail.netsession.transport.netty.NettyDatagramSocketFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * DatagramServerRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one datagram session server.
 *
 * <p>Owns the threads the server runs on: the timer thread, the receive worker
 * pool ({@code receiveConcurrency} wide), the notification pool that resolves
 * request futures and runs session subscribers, and (unless a socket factory is
 * supplied) the Netty event loop.</p>
 */
public final class DatagramServerRuntime {
    private static final Logger log = LoggerFactory.getLogger(DatagramServerRuntime.class);

    private static final long TERMINATION_TIMEOUT_SECONDS = 5;

    private final DatagramSessionServer server;
    private final ScheduledExecutorService schedulerExecutor;
    private final ExecutorService receiveExecutor;
    private final ExecutorService notificationExecutor;
    private final NettyDatagramSocketFactory ownedSocketFactory;

    private DatagramServerRuntime(
            DatagramSessionServer server,
            ScheduledExecutorService schedulerExecutor,
            ExecutorService receiveExecutor,
            ExecutorService notificationExecutor,
            NettyDatagramSocketFactory ownedSocketFactory) {
        this.server = server;
        this.schedulerExecutor = schedulerExecutor;
        this.receiveExecutor = receiveExecutor;
        this.notificationExecutor = notificationExecutor;
        this.ownedSocketFactory = ownedSocketFactory;
    }

    /**
     * Open the server.
     *
     * @throws com.questrail.netsession.transport.SocketBindException if the port cannot be bound
     */
    public void start() {
        server.open();
    }

    /**
     * Dispose the server and release every thread this runtime owns.
     */
    public void stop() {
        server.close();

        List<ExecutorService> executors = new ArrayList<>();
        executors.add(receiveExecutor);
        executors.add(schedulerExecutor);
        executors.add(notificationExecutor);
        for (ExecutorService e : executors) {
            shutdown(e);
        }

        if (ownedSocketFactory != null) {
            ownedSocketFactory.close();
        }
        log.info("Runtime for {} stopped", server.localUri());
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public DatagramSessionServer server() {
        return server;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SessionServerConfig config = SessionServerConfig.defaults();
        private MessageCodec codec = RawPacketCodec.INSTANCE;
        private NetObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private DatagramSocketFactory socketFactory;
        private LocalAddressProvider localAddressProvider;
        private HostResolver hostResolver;

        public Builder withConfig(SessionServerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withCodec(MessageCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder withObservabilitySink(NetObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replace the Netty socket factory; the caller keeps ownership.
         */
        public Builder withSocketFactory(DatagramSocketFactory socketFactory) {
            this.socketFactory = socketFactory;
            return this;
        }

        public Builder withLocalAddressProvider(LocalAddressProvider provider) {
            this.localAddressProvider = provider;
            return this;
        }

        /**
         * Resolver for the configured remote; a 60 s caching resolver over DNS
         * by default.
         */
        public Builder withHostResolver(HostResolver resolver) {
            this.hostResolver = resolver;
            return this;
        }

        public DatagramServerRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(codec, "codec");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            // 1. Time
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newScheduledThreadPool(1, named("netsession-timer"));
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            // 2. Worker pools
            ExecutorService receiveExec = Executors.newFixedThreadPool(config.receiveConcurrency(), named("netsession-recv"));
            ExecutorService notificationExec = Executors.newCachedThreadPool(named("netsession-notify"));

            // 3. Addressing
            HostResolver resolver = hostResolver != null
                ? hostResolver
                : new CachingHostResolver(InetHostResolver.INSTANCE, clock);
            if (config.remote() != null) {
                config.remote().withResolver(resolver);
            }
            LocalAddressProvider localAddresses = localAddressProvider != null
                ? localAddressProvider
                : new NetworkInterfaceAddressProvider(clock);

            // 4. Transport
            NettyDatagramSocketFactory owned = null;
            DatagramSocketFactory factory = socketFactory;
            if (factory == null) {
                owned = new NettyDatagramSocketFactory();
                factory = owned;
            }

            // 5. Server
            DatagramSessionServer server = new DatagramSessionServer(
                config,
                factory,
                localAddresses,
                codec,
                clock,
                scheduler,
                receiveExec,
                notificationExec,
                observabilitySink
            );

            return new DatagramServerRuntime(server, schedulerExec, receiveExec, notificationExec, owned);
        }

        private static ThreadFactory named(String prefix) {
            AtomicInteger n = new AtomicInteger();
            return r -> {
                Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
                t.setDaemon(true);
                return t;
            };
        }
    }
}
