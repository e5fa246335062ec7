package com.questrail.netsession.net;

import com.questrail.netsession.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CachingHostResolverTest {

    private ManualMonotonicClock clock;
    private AtomicInteger lookups;
    private AtomicBoolean failing;
    private CachingHostResolver resolver;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        lookups = new AtomicInteger();
        failing = new AtomicBoolean(false);
        HostResolver delegate = host -> {
            lookups.incrementAndGet();
            if (failing.get()) {
                throw new HostResolutionException(host, null);
            }
            return List.of(NetAddresses.parseLiteral("10.0.0." + lookups.get()).orElseThrow());
        };
        resolver = new CachingHostResolver(delegate, clock, Duration.ofSeconds(60));
    }

    @Test
    void answersFromCacheWithinTtl() {
        List<InetAddress> first = resolver.resolve("device");
        clock.advanceSeconds(59);
        List<InetAddress> second = resolver.resolve("device");

        assertEquals(first, second);
        assertEquals(1, lookups.get());
    }

    @Test
    void looksUpAgainOnceTtlElapsed() {
        resolver.resolve("device");
        clock.advanceSeconds(60);
        List<InetAddress> refreshed = resolver.resolve("device");

        assertEquals(2, lookups.get());
        assertEquals(List.of(NetAddresses.parseLiteral("10.0.0.2").orElseThrow()), refreshed);
    }

    @Test
    void invalidateDropsCachedAnswers() {
        resolver.resolve("a");
        resolver.resolve("b");
        assertEquals(2, resolver.size());

        resolver.invalidate("a");
        assertEquals(1, resolver.size());

        resolver.invalidate();
        assertEquals(0, resolver.size());

        resolver.resolve("b");
        assertEquals(3, lookups.get());
    }

    @Test
    void failuresAreNotCached() {
        failing.set(true);
        assertThrows(HostResolutionException.class, () -> resolver.resolve("device"));

        failing.set(false);
        assertEquals(1, resolver.resolve("device").size());
        assertEquals(2, lookups.get());
    }

    @Test
    void rejectsNonPositiveTtl() {
        assertThrows(IllegalArgumentException.class,
            () -> new CachingHostResolver(InetHostResolver.INSTANCE, clock, Duration.ZERO));
    }
}
