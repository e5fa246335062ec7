package com.questrail.netsession.server;

import java.net.InetSocketAddress;

/**
 * Completes a request whose datagram could not be sent.
 */
public final class SessionSendException extends RuntimeException
{
    private final InetSocketAddress remote;

    public SessionSendException(InetSocketAddress remote, Throwable cause) {
        super("Failed to send to " + remote, cause);
        this.remote = remote;
    }

    public InetSocketAddress remote() {
        return remote;
    }
}
