package com.questrail.netsession.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of NetObservabilitySink that emits logs via SLF4J.
 *
 * <p>Lifecycle at INFO, per-datagram and per-request traffic at DEBUG, errors at
 * WARN (the transport recovers from everything it reports here).</p>
 */
public final class Slf4jNetObservabilitySink implements NetObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jNetObservabilitySink.class);

    @Override
    public void onSessionEvent(SessionLifecycleEvent event) {
        switch (event.kind()) {
            case SERVER_OPENED:
                log.info("Open {}", event.name());
                break;
            case SERVER_CLOSED:
                log.info("Close {} {}", event.reason(), event.name());
                break;
            case SESSION_CREATED:
                log.debug("Session #{} created for {}", event.sessionId(), event.name());
                break;
            case SESSION_CLOSED:
                log.debug("Session #{} {} closed: {}", event.sessionId(), event.name(), event.reason());
                break;
            default:
                break;
        }
    }

    @Override
    public void onDatagramEvent(DatagramEvent event) {
        if (!log.isDebugEnabled()) {
            return;
        }
        switch (event.kind()) {
            case SENT:
                log.debug("Send {} [{}]: {}", event.remote(), event.bytes(), event.hex());
                break;
            case RECEIVED:
                log.debug("Recv {} [{}]: {}", event.remote(), event.bytes(), event.hex());
                break;
            default:
                log.debug("Dropped {} from {} [{}]", event.kind(), event.remote(), event.bytes());
                break;
        }
    }

    @Override
    public void onMatchEvent(MatchEvent event) {
        if (event.kind() == MatchEvent.Kind.QUEUE_FULL) {
            log.warn("Match queue full for {} (pending={})", event.owner(), event.pending());
            return;
        }
        log.debug("Match {} owner={} request={} tag={} pending={}",
            event.kind(), event.owner(), event.request(), event.traceTag(), event.pending());
    }

    @Override
    public void onError(NetErrorEvent event) {
        log.warn("{} failed: {}", event.action(), event.message(), event.cause());
    }
}
