package com.questrail.netsession.observability;

import java.time.Instant;

/**
 * Transition of a match-queue slot, or a rejected add.
 *
 * @param request  the pending request; for {@code UNMATCHED}, the response that found no request
 * @param traceTag caller-supplied tag carried by the slot; may be {@code null}
 * @param pending  occupied slot count after the transition
 */
public record MatchEvent(
    Instant timestamp,
    Kind kind,
    Object owner,
    Object request,
    Object traceTag,
    int pending
) {
    public enum Kind {
        ADDED,
        MATCHED,
        UNMATCHED,
        EXPIRED,
        CLEARED,
        QUEUE_FULL
    }
}
