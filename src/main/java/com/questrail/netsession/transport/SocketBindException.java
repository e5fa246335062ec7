package com.questrail.netsession.transport;

import java.net.InetSocketAddress;

/**
 * Indicates that a datagram socket could not be bound to its local endpoint.
 *
 * <p>The caller decides whether to retry; the transport never does.</p>
 */
public final class SocketBindException extends RuntimeException
{
    private final InetSocketAddress local;

    public SocketBindException(InetSocketAddress local, Throwable cause) {
        super("Failed to bind " + local, cause);
        this.local = local;
    }

    public InetSocketAddress local() {
        return local;
    }
}
