package com.questrail.netsession.transport;

import java.net.ProtocolFamily;

/**
 * Creates unbound sockets for a given address family.
 */
@FunctionalInterface
public interface DatagramSocketFactory
{
    DatagramSocketPort create(ProtocolFamily family);
}
