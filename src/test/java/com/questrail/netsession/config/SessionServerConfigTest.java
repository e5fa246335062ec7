package com.questrail.netsession.config;

import com.questrail.netsession.net.NetAddresses;
import com.questrail.netsession.net.NetType;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SessionServerConfigTest {

    @Test
    void defaultsDescribeAnEphemeralAnswerOnlyServer() {
        SessionServerConfig c = SessionServerConfig.defaults();

        assertEquals(0, c.port());
        assertEquals(NetAddresses.ANY_V4, c.localAddress());
        assertNull(c.remote());
        assertFalse(c.reuseAddress());
        assertFalse(c.acceptLoopback());
        assertEquals(Duration.ofMinutes(20), c.sessionTimeout());
        assertEquals(Duration.ofSeconds(15), c.matchTimeout());
        assertEquals(256, c.matchQueueCapacity());
        assertEquals(8192, c.receiveBufferSize());
        assertEquals(SessionServerConfig.defaultReceiveConcurrency(), c.receiveConcurrency());
    }

    @Test
    void receiveConcurrencyScalesWithProcessors() {
        int cpus = Runtime.getRuntime().availableProcessors();

        assertEquals(Math.max(1, cpus * 16 / 10), SessionServerConfig.defaultReceiveConcurrency());
        assertTrue(SessionServerConfig.defaultReceiveConcurrency() >= 1);
    }

    @Test
    void remoteIsParsedFromText() {
        SessionServerConfig c = SessionServerConfig.builder().withRemote("udp://10.1.2.3:5500").build();

        assertEquals(NetType.UDP, c.remote().type());
        assertEquals("10.1.2.3", c.remote().host());
        assertEquals(5500, c.remote().port());
    }

    @Test
    void toBuilderPreservesEverySetting() {
        SessionServerConfig c = SessionServerConfig.builder()
            .withPort(7001)
            .withLocalAddress(NetAddresses.ANY_V6)
            .withRemote("udp://[::1]:7002")
            .withReuseAddress(true)
            .withAcceptLoopback(true)
            .withSessionTimeout(Duration.ofMinutes(1))
            .withMatchTimeout(Duration.ofMillis(250))
            .withMatchQueueCapacity(8)
            .withReceiveConcurrency(3)
            .withReceiveBufferSize(2048)
            .build();

        assertEquals(c, c.toBuilder().build());
        assertEquals(7003, c.toBuilder().withPort(7003).build().port());
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> SessionServerConfig.builder().withPort(-1).build());
        assertThrows(IllegalArgumentException.class, () -> SessionServerConfig.builder().withPort(65536).build());
        assertThrows(IllegalArgumentException.class,
            () -> SessionServerConfig.builder().withSessionTimeout(Duration.ofSeconds(-1)).build());
        assertThrows(IllegalArgumentException.class,
            () -> SessionServerConfig.builder().withMatchTimeout(Duration.ofMillis(-1)).build());
        assertThrows(IllegalArgumentException.class,
            () -> SessionServerConfig.builder().withMatchTimeout(Duration.ofDays(30)).build());
        assertThrows(IllegalArgumentException.class,
            () -> SessionServerConfig.builder().withMatchQueueCapacity(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> SessionServerConfig.builder().withReceiveConcurrency(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> SessionServerConfig.builder().withReceiveBufferSize(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> SessionServerConfig.builder()
                .withReceiveBufferSize(SessionServerConfig.MAX_RECEIVE_BUFFER_SIZE + 1).build());
        assertThrows(NullPointerException.class,
            () -> SessionServerConfig.builder().withLocalAddress(null).build());
    }

    @Test
    void zeroSessionTimeoutIsAllowed() {
        assertEquals(Duration.ZERO,
            SessionServerConfig.builder().withSessionTimeout(Duration.ZERO).build().sessionTimeout());
    }
}
