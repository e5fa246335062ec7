package com.questrail.netsession.internal.time;

/**
 * Handle returned for anything that can be withdrawn after the fact: a
 * pending sweep, the idle-session check, a new-session subscription, a
 * message listener registration.
 */
@FunctionalInterface
public interface Cancellable
{
    /**
     * @return {@code false} if the handle had already fired or been withdrawn
     */
    boolean cancel();
}
