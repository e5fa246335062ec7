package com.questrail.netsession.net;

import java.net.InetAddress;
import java.util.List;

/**
 * Narrow port onto the host's own unicast addresses.
 *
 * <p>The server consults this only when it is bound to the "any" address and
 * needs to recognize datagrams it sent to itself.</p>
 */
public interface LocalAddressProvider
{
    List<InetAddress> localAddresses();

    /**
     * Drop any cached view of the local addresses. No-op by default.
     */
    default void invalidate() {}
}
