package com.questrail.netsession.net;

/**
 * Indicates that a host name could not be resolved to any address.
 *
 * <p>The message always names the host that failed.</p>
 */
public final class HostResolutionException extends RuntimeException
{
    private final String host;

    public HostResolutionException(String host, Throwable cause) {
        super("Failed to resolve addresses for host " + host
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.host = host;
    }

    public String host() {
        return host;
    }
}
