package com.questrail.netsession.net;

import com.questrail.netsession.internal.time.MonotonicClock;

import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Objects;

/**
 * {@link LocalAddressProvider} that enumerates up, non-loopback network interfaces.
 *
 * <p>The enumeration is cached for a fixed TTL on a monotonic clock, and can be
 * dropped early with {@link #invalidate()}.</p>
 */
public final class NetworkInterfaceAddressProvider implements LocalAddressProvider
{
    private record Snapshot(List<InetAddress> addresses, long expiresAtNanos) {}

    private final MonotonicClock clock;
    private final long ttlNanos;

    private volatile Snapshot snapshot;

    public NetworkInterfaceAddressProvider(MonotonicClock clock)
    {
        this(clock, Duration.ofSeconds(60));
    }

    public NetworkInterfaceAddressProvider(MonotonicClock clock, Duration ttl)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ttlNanos = Objects.requireNonNull(ttl, "ttl").toNanos();
    }

    @Override
    public List<InetAddress> localAddresses()
    {
        long now = clock.nowNanos();
        Snapshot s = snapshot;
        if (s != null && now - s.expiresAtNanos() < 0) {
            return s.addresses();
        }

        List<InetAddress> addresses = enumerate();
        snapshot = new Snapshot(addresses, now + ttlNanos);
        return addresses;
    }

    @Override
    public void invalidate()
    {
        snapshot = null;
    }

    private static List<InetAddress> enumerate()
    {
        List<InetAddress> result = new ArrayList<>();
        try {
            Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
            if (interfaces == null) {
                return List.of();
            }
            for (NetworkInterface ni : Collections.list(interfaces)) {
                if (!ni.isUp() || ni.isLoopback()) {
                    continue;
                }
                result.addAll(Collections.list(ni.getInetAddresses()));
            }
        } catch (SocketException e) {
            throw new UncheckedIOException("Failed to enumerate network interfaces", e);
        }
        return List.copyOf(result);
    }
}
