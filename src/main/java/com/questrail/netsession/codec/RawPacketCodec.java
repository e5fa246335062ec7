package com.questrail.netsession.codec;

import com.questrail.netsession.payload.Packet;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Identity codec over raw payloads.
 *
 * <p>Accepts {@link Packet}, {@code byte[]} and text (sent as UTF-8) and decodes
 * every datagram to its {@link Packet}. Raw payloads carry no correlation id,
 * so any datagram from the peer answers its oldest pending request.</p>
 */
public final class RawPacketCodec implements MessageCodec
{
    public static final RawPacketCodec INSTANCE = new RawPacketCodec();

    private RawPacketCodec() {}

    @Override
    public Packet encode(Object message)
    {
        Objects.requireNonNull(message, "message");
        if (message instanceof Packet) {
            return (Packet) message;
        }
        if (message instanceof byte[]) {
            return new Packet((byte[]) message);
        }
        if (message instanceof CharSequence) {
            return new Packet(message.toString().getBytes(StandardCharsets.UTF_8));
        }
        throw new IllegalArgumentException("Unsupported message type: " + message.getClass().getName());
    }

    @Override
    public Optional<Object> decode(Packet packet)
    {
        return Optional.of(Objects.requireNonNull(packet, "packet"));
    }

    @Override
    public boolean isMatch(Object request, Object response)
    {
        return true;
    }
}
