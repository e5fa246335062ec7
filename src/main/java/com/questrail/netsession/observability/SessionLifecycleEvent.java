package com.questrail.netsession.observability;

import java.time.Instant;

/**
 * Lifecycle change of a server or of one of its sessions.
 *
 * @param sessionId session id, or 0 for server-level events
 * @param name      peer key for sessions, local URI for the server
 * @param reason    close reason; {@code null} for opening events
 */
public record SessionLifecycleEvent(
    Instant timestamp,
    Kind kind,
    int sessionId,
    String name,
    String reason
) {
    public enum Kind {
        SERVER_OPENED,
        SERVER_CLOSED,
        SESSION_CREATED,
        SESSION_CLOSED
    }
}
