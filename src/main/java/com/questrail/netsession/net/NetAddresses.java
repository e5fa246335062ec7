package com.questrail.netsession.net;

import io.netty.util.NetUtil;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ProtocolFamily;
import java.net.StandardProtocolFamily;
import java.net.UnknownHostException;
import java.util.Objects;
import java.util.Optional;

/**
 * NetAddresses
 * =============================================================================
 * Pure helper functions over {@link InetAddress} and {@link InetSocketAddress}.
 *
 * <p>Nothing here touches the network: literals are parsed without lookups and
 * address-family adaptation is a function of its two arguments only.</p>
 */
public final class NetAddresses
{
    public static final InetAddress ANY_V4 = fromBytes(new byte[4]);
    public static final InetAddress ANY_V6 = fromBytes(new byte[16]);
    public static final InetAddress BROADCAST = fromBytes(new byte[] { (byte) 255, (byte) 255, (byte) 255, (byte) 255 });

    private NetAddresses() {}

    public static boolean isAny(InetAddress address)
    {
        return address != null && address.isAnyLocalAddress();
    }

    public static boolean isIPv4(InetAddress address)
    {
        return address instanceof Inet4Address;
    }

    /**
     * True for the limited broadcast address {@code 255.255.255.255}.
     */
    public static boolean isBroadcast(InetAddress address)
    {
        return BROADCAST.equals(address);
    }

    public static ProtocolFamily familyOf(InetAddress address)
    {
        Objects.requireNonNull(address, "address");
        return address instanceof Inet6Address ? StandardProtocolFamily.INET6 : StandardProtocolFamily.INET;
    }

    public static InetAddress anyFor(ProtocolFamily family)
    {
        return family == StandardProtocolFamily.INET6 ? ANY_V6 : ANY_V4;
    }

    /**
     * Adapt a configured local address to the family of a target.
     *
     * <p>Only the "any" addresses have an equivalent in the other family: an
     * IPv4-any becomes IPv6-any for an IPv6 target and vice versa. A concrete
     * address is returned unchanged, since it has no equivalent to switch to.
     * A {@code null} configured address is treated as IPv4-any.</p>
     */
    public static InetAddress rightAny(InetAddress configured, ProtocolFamily targetFamily)
    {
        Objects.requireNonNull(targetFamily, "targetFamily");

        InetAddress address = configured != null ? configured : ANY_V4;
        if (familyOf(address) == targetFamily) {
            return address;
        }
        if (isAny(address)) {
            return anyFor(targetFamily);
        }
        return address;
    }

    /**
     * Canonical peer identity key: textual address, a colon, and the port.
     *
     * <p>IPv6 addresses are bracketed ({@code [::1]:5000}). A host name never
     * takes part in the key, so the same peer always maps to the same key.</p>
     */
    public static String peerKey(InetSocketAddress endpoint)
    {
        Objects.requireNonNull(endpoint, "endpoint");

        InetAddress address = endpoint.getAddress();
        if (address == null) {
            return endpoint.getHostString() + ":" + endpoint.getPort();
        }
        if (address instanceof Inet6Address) {
            return "[" + toText(address) + "]:" + endpoint.getPort();
        }
        return toText(address) + ":" + endpoint.getPort();
    }

    /**
     * Textual form of an address; IPv6 is rendered in RFC 5952 compressed form,
     * keeping any scope suffix.
     */
    public static String toText(InetAddress address)
    {
        Objects.requireNonNull(address, "address");
        if (!(address instanceof Inet6Address)) {
            return address.getHostAddress();
        }
        String raw = address.getHostAddress();
        int pct = raw.indexOf('%');
        String text = NetUtil.toAddressString(address);
        return pct >= 0 ? text + raw.substring(pct) : text;
    }

    /**
     * Parse an IPv4 or IPv6 literal without any name lookup.
     *
     * <p>Brackets around an IPv6 literal are accepted. Anything that is not a
     * literal, including host names, yields an empty result.</p>
     */
    public static Optional<InetAddress> parseLiteral(String text)
    {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        byte[] bytes = NetUtil.createByteArrayFromIpAddressString(text.trim());
        return bytes == null ? Optional.empty() : Optional.of(fromBytes(bytes));
    }

    private static InetAddress fromBytes(byte[] bytes)
    {
        try {
            return InetAddress.getByAddress(bytes);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Illegal address length " + bytes.length, e);
        }
    }
}
