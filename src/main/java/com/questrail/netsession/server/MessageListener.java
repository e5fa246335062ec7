package com.questrail.netsession.server;

/**
 * Receives inbound messages that did not answer a pending request.
 *
 * <p>Invoked on a receive worker thread; must not block for long.</p>
 */
@FunctionalInterface
public interface MessageListener
{
    void onMessage(DatagramSession session, Object message);
}
