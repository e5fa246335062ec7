package com.questrail.netsession.net;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Optional;

/**
 * {@link HostResolver} backed by the JVM's {@link InetAddress#getAllByName(String)}.
 *
 * <p>Address literals are answered without a lookup. This resolver keeps no
 * state; wrap it in a {@link CachingHostResolver} to cache answers.</p>
 */
public enum InetHostResolver implements HostResolver
{
    INSTANCE;

    @Override
    public List<InetAddress> resolve(String host)
    {
        Optional<InetAddress> literal = NetAddresses.parseLiteral(host);
        if (literal.isPresent()) {
            return List.of(literal.get());
        }

        try {
            return List.of(InetAddress.getAllByName(host));
        } catch (UnknownHostException e) {
            throw new HostResolutionException(host, e);
        }
    }
}
