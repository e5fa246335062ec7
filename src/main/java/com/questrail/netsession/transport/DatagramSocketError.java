package com.questrail.netsession.transport;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * A receive failure reported by a {@link DatagramSocketPort}.
 *
 * @param kind   classification
 * @param remote peer the failure relates to; {@code null} when unknown
 * @param cause  underlying failure; may be {@code null}
 */
public record DatagramSocketError(
    SocketErrorKind kind,
    InetSocketAddress remote,
    Throwable cause
) {
    public DatagramSocketError {
        Objects.requireNonNull(kind, "kind");
    }

    public String message()
    {
        if (cause != null && cause.getMessage() != null) {
            return kind + ": " + cause.getMessage();
        }
        return kind.toString();
    }
}
