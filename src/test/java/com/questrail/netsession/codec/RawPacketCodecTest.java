package com.questrail.netsession.codec;

import com.questrail.netsession.payload.Packet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RawPacketCodecTest {

    private final RawPacketCodec codec = RawPacketCodec.INSTANCE;

    @Test
    void packetsPassThroughUntouched() {
        Packet p = Packet.of("abc");

        assertSame(p, codec.encode(p));
        assertSame(p, codec.decode(p).orElseThrow());
    }

    @Test
    void bytesAndTextAreWrapped() {
        assertArrayEquals(new byte[] { 1, 2 }, codec.encode(new byte[] { 1, 2 }).toArray());
        assertEquals("grüß", codec.encode("grüß").toUtf8());
        assertEquals("sb", codec.encode(new StringBuilder("sb")).toUtf8());
    }

    @Test
    void otherTypesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> codec.encode(42));
        assertThrows(NullPointerException.class, () -> codec.encode(null));
    }

    @Test
    void anyResponseAnswersAnyRequest() {
        assertTrue(codec.isMatch("request", Packet.of("whatever")));
    }
}
