package com.questrail.netsession.transport;

import com.questrail.netsession.payload.Packet;

import java.net.InetSocketAddress;

/**
 * Callback sink for {@link DatagramSocketPort}.
 *
 * <p>Callbacks arrive on the socket's I/O thread and must return quickly; the
 * session server hands each datagram to its receive workers.</p>
 */
public interface DatagramSocketListener
{
    /**
     * Called once per received datagram. The packet owns a private copy of
     * the payload.
     *
     * @param remote sender endpoint
     * @param packet full datagram payload
     */
    void onDatagram(InetSocketAddress remote, Packet packet);

    /**
     * Called when a receive fails. The socket keeps receiving afterwards.
     */
    void onError(DatagramSocketError error);
}
