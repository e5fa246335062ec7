package com.questrail.netsession.transport;

/**
 * Closed classification of receive failures.
 */
public enum SocketErrorKind
{
    /** The datagram did not fit the receive buffer and was cut short. */
    MESSAGE_TOO_LARGE,
    /** The peer reset the conversation (for example ICMP port unreachable). */
    PEER_RESET,
    /** The conversation with the peer was aborted locally. */
    PEER_ABORTED,
    OTHER
}
