package com.questrail.netsession.match;

import java.util.concurrent.CancellationException;

/**
 * Completes a pending request that ended without a response.
 *
 * <p>Being a {@link CancellationException}, it makes
 * {@link java.util.concurrent.CompletableFuture#isCancelled()} report
 * {@code true} and is thrown as-is from {@code get()} and {@code join()}.
 * {@link #reason()} tells expiry apart from an explicit clear.</p>
 */
public final class MatchCancelledException extends CancellationException
{
    public enum Reason {
        /** The request outlived its timeout. */
        EXPIRED,
        /** The queue was cleared, typically because its session or server closed. */
        CLEARED
    }

    private final Reason reason;

    public MatchCancelledException(Reason reason) {
        super(reason == Reason.EXPIRED ? "Request expired without a response" : "Request cancelled by queue clear");
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
