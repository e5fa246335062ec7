package com.questrail.netsession.observability;

import java.time.Instant;

/**
 * An error handled locally by the transport.
 *
 * @param action what was being done: {@code "Send"}, {@code "Receive"}, {@code "Close"}, ...
 */
public record NetErrorEvent(
    Instant timestamp,
    String action,
    String message,
    Throwable cause
) {
}
