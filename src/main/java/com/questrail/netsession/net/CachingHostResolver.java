package com.questrail.netsession.net;

import com.questrail.netsession.internal.time.MonotonicClock;

import java.net.InetAddress;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * CachingHostResolver
 * =============================================================================
 * Decorates a {@link HostResolver} with a time-bounded answer cache.
 *
 * <p>Entries live for a fixed TTL measured on a {@link MonotonicClock}. The
 * cache belongs to this instance: whoever observes a network change calls
 * {@link #invalidate()} on the instance they injected.</p>
 *
 * <p>Failures are not cached.</p>
 */
public final class CachingHostResolver implements HostResolver
{
    public static final Duration DEFAULT_TTL = Duration.ofSeconds(60);

    private record Entry(List<InetAddress> addresses, long expiresAtNanos) {}

    private final HostResolver delegate;
    private final MonotonicClock clock;
    private final long ttlNanos;
    private final Map<String, Entry> cache = new ConcurrentHashMap<>();

    public CachingHostResolver(HostResolver delegate, MonotonicClock clock)
    {
        this(delegate, clock, DEFAULT_TTL);
    }

    public CachingHostResolver(HostResolver delegate, MonotonicClock clock, Duration ttl)
    {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.ttlNanos = ttl.toNanos();
    }

    @Override
    public List<InetAddress> resolve(String host)
    {
        Objects.requireNonNull(host, "host");

        long now = clock.nowNanos();
        Entry entry = cache.get(host);
        if (entry != null && now - entry.expiresAtNanos() < 0) {
            return entry.addresses();
        }

        List<InetAddress> addresses = List.copyOf(delegate.resolve(host));
        cache.put(host, new Entry(addresses, now + ttlNanos));
        return addresses;
    }

    /**
     * Drop every cached answer.
     */
    public void invalidate()
    {
        cache.clear();
    }

    /**
     * Drop the cached answer for one host.
     */
    public void invalidate(String host)
    {
        cache.remove(host);
    }

    int size()
    {
        return cache.size();
    }
}
