package com.questrail.netsession.net;

import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class NetUriTest {

    private static InetAddress ip(String literal) {
        return NetAddresses.parseLiteral(literal).orElseThrow();
    }

    @Test
    void parsesSchemeAddressAndPort() {
        NetUri uri = NetUri.parse("udp://127.0.0.1:5000");

        assertEquals(NetType.UDP, uri.type());
        assertTrue(uri.isUdp());
        assertFalse(uri.isTcp());
        assertEquals("127.0.0.1", uri.host());
        assertEquals(ip("127.0.0.1"), uri.address());
        assertEquals(5000, uri.port());
        assertEquals("udp://127.0.0.1:5000", uri.toString());
    }

    @Test
    void schemeIsCaseInsensitive() {
        assertEquals(NetType.TCP, NetUri.parse("TCP://10.0.0.1:80").type());
    }

    @Test
    void httpSchemesApplyDefaultPortsAndDropPathAndQuery() {
        NetUri http = NetUri.parse("http://www.example.com/index.html?a=1");
        assertEquals(NetType.HTTP, http.type());
        assertEquals("www.example.com", http.host());
        assertEquals(80, http.port());
        assertEquals("http://www.example.com:80", http.toString());

        NetUri https = NetUri.parse("https://secure.example.com");
        assertEquals(NetType.HTTPS, https.type());
        assertEquals(443, https.port());
    }

    @Test
    void explicitPortOverridesSchemeDefault() {
        NetUri uri = NetUri.parse("http://example.com:8080/x");
        assertEquals(8080, uri.port());
    }

    @Test
    void websocketRendersWsOrWssByPort() {
        NetUri secure = NetUri.parse("wss://push.example.com");
        assertEquals(NetType.WEBSOCKET, secure.type());
        assertEquals(443, secure.port());
        assertEquals("wss://push.example.com:443", secure.toString());

        NetUri plain = NetUri.parse("ws://push.example.com:8080");
        assertEquals("ws://push.example.com:8080", plain.toString());
    }

    @Test
    void unknownSchemeRendersWithEmptyScheme() {
        NetUri uri = NetUri.parse("gopher://host.example:70");

        assertEquals(NetType.UNKNOWN, uri.type());
        assertEquals("://host.example:70", uri.toString());
    }

    @Test
    void inputWithoutSchemeKeepsUnknownType() {
        NetUri uri = NetUri.parse("localhost:8080");

        assertEquals(NetType.UNKNOWN, uri.type());
        assertEquals("localhost", uri.host());
        assertEquals(8080, uri.port());
    }

    @Test
    void bracketedIpv6WithPortIsParsedAndRenderedBracketed() {
        NetUri uri = NetUri.parse("tcp://[::1]:8080");

        assertEquals(ip("::1"), uri.address());
        assertEquals("::1", uri.host());
        assertEquals(8080, uri.port());
        assertEquals("tcp://[::1]:8080", uri.toString());
    }

    @Test
    void doubleColonIsNotMistakenForAPort() {
        NetUri uri = NetUri.parse("udp://fe80::1");

        assertEquals(0, uri.port());
        assertEquals(ip("fe80::1"), uri.address());
    }

    @Test
    void blankInputYieldsUnsetIdentity() {
        NetUri uri = new NetUri("   ");

        assertEquals(NetType.UNKNOWN, uri.type());
        assertNull(uri.host());
        assertEquals(0, uri.port());
        assertEquals(NetAddresses.ANY_V4, uri.address());
    }

    @Test
    void literalAddressIsNeverLookedUp() {
        AtomicInteger lookups = new AtomicInteger();
        NetUri uri = new NetUri("udp://192.168.1.20:9").withResolver(host -> {
            lookups.incrementAndGet();
            return List.of();
        });

        assertEquals(ip("192.168.1.20"), uri.address());
        assertEquals(0, lookups.get());
    }

    @Test
    void hostIsResolvedLazilyOnceAndKept() {
        AtomicInteger lookups = new AtomicInteger();
        NetUri uri = new NetUri("udp://device.local:7").withResolver(host -> {
            lookups.incrementAndGet();
            return List.of(ip("10.1.2.3"), ip("10.1.2.4"));
        });
        assertEquals(0, lookups.get());

        assertEquals(ip("10.1.2.3"), uri.address());
        assertEquals(ip("10.1.2.3"), uri.address());

        assertEquals(1, lookups.get());
        assertEquals("device.local", uri.host());
        assertEquals(new InetSocketAddress(ip("10.1.2.3"), 7), uri.endpoint());
    }

    @Test
    void failedResolutionFallsBackToAnyAddress() {
        NetUri uri = new NetUri("udp://nowhere.invalid:7").withResolver(host -> {
            throw new HostResolutionException(host, null);
        });

        assertEquals(NetAddresses.ANY_V4, uri.address());
    }

    @Test
    void getAddressesReportsResolutionFailureNamingTheHost() {
        NetUri uri = new NetUri("udp://nowhere.invalid:7").withResolver(host -> {
            throw new HostResolutionException(host, null);
        });

        HostResolutionException e = assertThrows(HostResolutionException.class, uri::getAddresses);
        assertEquals("nowhere.invalid", e.host());
        assertTrue(e.getMessage().contains("nowhere.invalid"));
    }

    @Test
    void getEndpointsPairsEveryAddressWithThePort() {
        NetUri uri = new NetUri("tcp://multi.example:443").withResolver(host ->
            List.of(ip("10.0.0.1"), ip("2001:db8::1")));

        List<InetSocketAddress> endpoints = uri.getEndpoints();

        assertEquals(List.of(
            new InetSocketAddress(ip("10.0.0.1"), 443),
            new InetSocketAddress(ip("2001:db8::1"), 443)), endpoints);
    }

    @Test
    void wildcardHostFallsBackToStoredAddress() {
        NetUri uri = new NetUri(NetType.UDP, "*", 5000);

        assertEquals(List.of(NetAddresses.ANY_V4), uri.getAddresses());
    }

    @Test
    void settingAnAddressOverwritesTheHost() {
        NetUri uri = new NetUri(NetType.TCP, "example.com", 80);

        uri.setAddress(ip("10.9.8.7"));

        assertEquals("10.9.8.7", uri.host());
        assertEquals("tcp://10.9.8.7:80", uri.toString());
    }

    @Test
    void settingAHostClearsTheResolvedAddress() {
        NetUri uri = new NetUri(NetType.UDP, ip("10.0.0.1"), 9)
            .withResolver(host -> List.of(ip("10.0.0.2")));

        uri.setHost("other.example");

        assertEquals(ip("10.0.0.2"), uri.address());
    }

    @Test
    void endpointConstructorTakesAddressAndPort() {
        NetUri uri = new NetUri(NetType.UDP, new InetSocketAddress(ip("172.16.0.5"), 161));

        assertEquals("172.16.0.5", uri.host());
        assertEquals(161, uri.port());
        assertEquals("udp://172.16.0.5:161", uri.toString());
    }

    @Test
    void rejectsPortsOutOfRange() {
        NetUri uri = new NetUri();

        assertThrows(IllegalArgumentException.class, () -> uri.setPort(-1));
        assertThrows(IllegalArgumentException.class, () -> uri.setPort(65536));
    }

    @Test
    void equalityFollowsTypeHostAndPort() {
        NetUri parsed = NetUri.parse("udp://127.0.0.1:5000");
        NetUri built = new NetUri(NetType.UDP, ip("127.0.0.1"), 5000);

        assertEquals(parsed, built);
        assertEquals(parsed.hashCode(), built.hashCode());
        assertNotEquals(parsed, NetUri.parse("tcp://127.0.0.1:5000"));
        assertNotEquals(parsed, NetUri.parse("udp://127.0.0.1:5001"));
    }
}
