package com.questrail.netsession.observability;

import java.net.InetSocketAddress;
import java.time.Instant;

/**
 * One datagram crossing (or being refused at) the server boundary.
 *
 * @param hex leading payload bytes in hex, possibly cut short
 */
public record DatagramEvent(
    Instant timestamp,
    Kind kind,
    InetSocketAddress remote,
    int bytes,
    String hex
) {
    public enum Kind {
        SENT,
        RECEIVED,
        DROPPED_LOOPBACK,
        DROPPED_TRUNCATED
    }
}
