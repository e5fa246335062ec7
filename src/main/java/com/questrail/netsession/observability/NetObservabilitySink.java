package com.questrail.netsession.observability;

/**
 * Receives observability events from the session server, its sessions and their
 * match queues. Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive on arbitrary receive-worker and timer threads and must not
 * block. An absent sink changes only what is observed, never behavior.</p>
 */
public interface NetObservabilitySink {
    /**
     * Server opened/closed, session created/closed.
     */
    void onSessionEvent(SessionLifecycleEvent event);

    /**
     * Datagram sent, received, or dropped before session dispatch.
     */
    void onDatagramEvent(DatagramEvent event);

    /**
     * Request added, matched, expired, cleared, or rejected by a full queue.
     */
    void onMatchEvent(MatchEvent event);

    /**
     * Transport or listener failure that was handled locally.
     */
    void onError(NetErrorEvent event);
}
