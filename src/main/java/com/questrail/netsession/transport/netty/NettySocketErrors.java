package com.questrail.netsession.transport.netty;

import com.questrail.netsession.transport.SocketErrorKind;

import java.net.PortUnreachableException;
import java.util.Locale;

/**
 * Maps the exceptions Netty surfaces from a datagram channel onto
 * {@link SocketErrorKind}.
 *
 * <p>The JDK reports these conditions only through exception types and
 * platform messages ({@code "Connection reset"}, {@code "Message too long"}),
 * so the message text is part of the classification.</p>
 */
final class NettySocketErrors
{
    private NettySocketErrors() {}

    static SocketErrorKind classify(Throwable error)
    {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof PortUnreachableException) {
                return SocketErrorKind.PEER_RESET;
            }
            String message = t.getMessage();
            if (message == null) {
                continue;
            }
            String m = message.toLowerCase(Locale.ROOT);
            if (m.contains("message too long") || m.contains("message too large")) {
                return SocketErrorKind.MESSAGE_TOO_LARGE;
            }
            if (m.contains("reset")) {
                return SocketErrorKind.PEER_RESET;
            }
            if (m.contains("abort")) {
                return SocketErrorKind.PEER_ABORTED;
            }
        }
        return SocketErrorKind.OTHER;
    }
}
