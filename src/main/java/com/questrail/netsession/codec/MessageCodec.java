package com.questrail.netsession.codec;

import com.questrail.netsession.payload.Packet;

import java.util.Optional;

/**
 * MessageCodec
 * -----------------------------------------------------------------------------
 * Boundary between application messages and datagram payloads, used by a
 * session for "send and await a response".
 *
 * <p>The codec is responsible only for:</p>
 * <ul>
 *   <li>turning an outbound message into one datagram payload</li>
 *   <li>turning one inbound datagram payload into a message</li>
 *   <li>deciding whether an inbound message answers a pending request</li>
 * </ul>
 *
 * <p>Implementations are shared by every session of a server and must be
 * stateless or thread-safe.</p>
 */
public interface MessageCodec
{
    /**
     * @throws IllegalArgumentException if the message type is not supported
     */
    Packet encode(Object message);

    /**
     * Decode one complete datagram.
     *
     * @return the message, or {@link Optional#empty()} if the datagram is not
     *         a message this codec understands
     */
    Optional<Object> decode(Packet packet);

    /**
     * Whether {@code response} answers {@code request}. Only requests of the
     * same session are ever offered.
     */
    boolean isMatch(Object request, Object response);
}
