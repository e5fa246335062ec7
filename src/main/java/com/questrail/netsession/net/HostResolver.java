package com.questrail.netsession.net;

import java.net.InetAddress;
import java.util.List;

/**
 * HostResolver
 * -----------------------------------------------------------------------------
 * Narrow port for host name resolution.
 *
 * <p>Caching and invalidation (for example after a network change) are the
 * resolver's concern, see {@link CachingHostResolver}. Callers never assume an
 * ambient process-wide cache.</p>
 */
@FunctionalInterface
public interface HostResolver
{
    /**
     * Resolve a host name (or an address literal) to zero or more addresses.
     *
     * @throws HostResolutionException if the lookup itself fails
     */
    List<InetAddress> resolve(String host);
}
