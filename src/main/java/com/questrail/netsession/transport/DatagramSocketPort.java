package com.questrail.netsession.transport;

import com.questrail.netsession.payload.Packet;

import java.io.UncheckedIOException;
import java.net.InetSocketAddress;

/**
 * DatagramSocketPort
 * -----------------------------------------------------------------------------
 * Minimal port for one bound datagram socket.
 *
 * <p>The owner serializes sends; implementations need not be safe for
 * concurrent {@code send}/{@code sendTo} calls. Inbound datagrams and receive
 * errors are pushed to the listener, which must be set before {@link #bind}.</p>
 */
public interface DatagramSocketPort
{
    /**
     * Register the listener that receives inbound datagrams and receive errors.
     */
    void setListener(DatagramSocketListener listener);

    /**
     * Bind to the local endpoint and begin receiving. Blocks until bound.
     *
     * @param local        local endpoint; port 0 picks an ephemeral port
     * @param reuseAddress whether to set {@code SO_REUSEADDR}
     * @throws SocketBindException if the endpoint cannot be bound
     */
    void bind(InetSocketAddress local, boolean reuseAddress);

    /**
     * The bound endpoint, or {@code null} before a successful bind.
     */
    InetSocketAddress localAddress();

    boolean isOpen();

    /**
     * Whether the socket is connected to a single peer.
     */
    boolean isConnected();

    boolean isBroadcastEnabled();

    /**
     * Set {@code SO_BROADCAST}. Idempotent.
     */
    void enableBroadcast();

    /**
     * Send on a connected socket.
     *
     * @return bytes accepted
     * @throws UncheckedIOException if the datagram could not be sent
     */
    int send(Packet packet);

    /**
     * Send to an explicit destination.
     *
     * @return bytes accepted
     * @throws UncheckedIOException if the datagram could not be sent
     */
    int sendTo(Packet packet, InetSocketAddress remote);

    int receiveBufferSize();

    /**
     * Largest datagram accepted per receive. Applies to the next receive when
     * already bound.
     */
    void setReceiveBufferSize(int bytes);

    /**
     * Stop receiving and release the socket. Idempotent.
     */
    void close();
}
