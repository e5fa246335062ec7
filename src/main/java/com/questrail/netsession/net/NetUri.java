package com.questrail.netsession.net;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * NetUri
 * =============================================================================
 * Network resource identifier: protocol, host or address, and port.
 *
 * <h2>Host and address</h2>
 * The host name and the address are two views of the same identity.
 * <ul>
 *   <li>Setting a concrete address (or endpoint) overwrites the stored host
 *       with the address's textual form.</li>
 *   <li>Reading the effective address lazily resolves a stored host when no
 *       address is set yet (or only "any" is set). The first resolved address
 *       is kept; resolution yielding nothing, or failing, gives the IPv4 "any"
 *       address.</li>
 * </ul>
 *
 * <h2>Canonical form</h2>
 * {@code scheme://host[:port]}. The scheme is empty for {@link NetType#UNKNOWN},
 * {@code ws} or {@code wss} (by port 443) for {@link NetType#WEBSOCKET}, and the
 * lower-cased constant name otherwise. IPv6 literals are bracketed when a port
 * follows.
 *
 * <h2>Thread Safety</h2>
 * Instances are mutable and not synchronized. Owners that share an instance
 * across threads must publish changes safely.
 */
public final class NetUri
{
    private static final String SEPARATOR = "://";

    private NetType type = NetType.UNKNOWN;
    private String host;
    private InetAddress address;
    private int port;

    private HostResolver resolver = InetHostResolver.INSTANCE;

    public NetUri() {}

    public NetUri(String uri)
    {
        parseInto(uri);
    }

    public NetUri(NetType type, InetSocketAddress endpoint)
    {
        this.type = Objects.requireNonNull(type, "type");
        setEndpoint(endpoint);
    }

    public NetUri(NetType type, InetAddress address, int port)
    {
        this.type = Objects.requireNonNull(type, "type");
        setAddress(address);
        setPort(port);
    }

    public NetUri(NetType type, String host, int port)
    {
        this.type = Objects.requireNonNull(type, "type");
        this.host = host;
        setPort(port);
    }

    public static NetUri parse(String uri)
    {
        return new NetUri(uri);
    }

    // -------------------------------------------------------------------------
    // Parsing
    // -------------------------------------------------------------------------

    private void parseInto(String uri)
    {
        if (uri == null || uri.isBlank()) {
            return;
        }

        String scheme = "";
        String rest = uri.trim();
        int sep = rest.indexOf(SEPARATOR);
        if (sep >= 0) {
            scheme = rest.substring(0, sep).trim();
            type = NetType.fromScheme(scheme);
            rest = rest.substring(sep + SEPARATOR.length()).trim();
        }

        host = null;
        address = null;

        int defaultPort = NetType.defaultPort(scheme);
        if (defaultPort > 0) {
            port = defaultPort;
        }

        // drop any path or query
        int p = rest.indexOf('/');
        if (p < 0) p = rest.indexOf('\\');
        if (p < 0) p = rest.indexOf('?');
        if (p >= 0) {
            rest = rest.substring(0, p).trim();
        }

        // a trailing :port, unless the colon belongs to an IPv6 "::"
        p = rest.lastIndexOf(':');
        if (p >= 0 && (p < 1 || rest.charAt(p - 1) != ':')) {
            Optional<Integer> parsed = parsePort(rest.substring(p + 1));
            if (parsed.isPresent()) {
                port = parsed.get();
                rest = rest.substring(0, p).trim();
            }
        }

        Optional<InetAddress> literal = NetAddresses.parseLiteral(rest);
        if (literal.isPresent()) {
            setAddress(literal.get());
        } else {
            host = rest;
        }
    }

    private static Optional<Integer> parsePort(String text)
    {
        String s = text.trim();
        if (s.isEmpty() || s.length() > 5) {
            return Optional.empty();
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return Optional.empty();
            }
        }
        int value = Integer.parseInt(s);
        return value <= 65535 ? Optional.of(value) : Optional.empty();
    }

    // -------------------------------------------------------------------------
    // Properties
    // -------------------------------------------------------------------------

    public NetType type()
    {
        return type;
    }

    public NetUri setType(NetType type)
    {
        this.type = Objects.requireNonNull(type, "type");
        return this;
    }

    public boolean isTcp()
    {
        return type == NetType.TCP;
    }

    public boolean isUdp()
    {
        return type == NetType.UDP;
    }

    /**
     * Host name, or the textual form of the address once an address was set.
     * May be {@code null}.
     */
    public String host()
    {
        return host;
    }

    public NetUri setHost(String host)
    {
        this.host = host;
        this.address = null;
        return this;
    }

    /**
     * The effective address, resolving a stored host on first use.
     */
    public InetAddress address()
    {
        InetAddress a = address;
        if ((a == null || NetAddresses.isAny(a)) && host != null && !host.isEmpty()) {
            a = resolveFirst(host).orElse(a != null ? a : NetAddresses.ANY_V4);
            address = a;
        }
        return a != null ? a : NetAddresses.ANY_V4;
    }

    /**
     * Sets a concrete address; the host becomes its textual form.
     */
    public NetUri setAddress(InetAddress address)
    {
        this.address = address;
        this.host = address != null ? NetAddresses.toText(address) : null;
        return this;
    }

    public int port()
    {
        return port;
    }

    public NetUri setPort(int port)
    {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        this.port = port;
        return this;
    }

    public InetSocketAddress endpoint()
    {
        return new InetSocketAddress(address(), port);
    }

    /**
     * Sets address and port from an endpoint; the host becomes the address text.
     */
    public NetUri setEndpoint(InetSocketAddress endpoint)
    {
        Objects.requireNonNull(endpoint, "endpoint");
        InetAddress a = endpoint.getAddress();
        if (a != null) {
            setAddress(a);
        } else {
            setHost(endpoint.getHostString());
        }
        this.port = endpoint.getPort();
        return this;
    }

    /**
     * Resolver used for lazy address resolution and {@link #getAddresses()}.
     */
    public NetUri withResolver(HostResolver resolver)
    {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        return this;
    }

    // -------------------------------------------------------------------------
    // Resolution
    // -------------------------------------------------------------------------

    /**
     * All addresses of the host, or the single stored address when there is no
     * host to resolve.
     *
     * @throws HostResolutionException if the host cannot be resolved
     */
    public List<InetAddress> getAddresses()
    {
        if (host != null && !host.isEmpty() && !"*".equals(host)) {
            List<InetAddress> resolved = resolver.resolve(host);
            if (resolved != null && !resolved.isEmpty()) {
                return List.copyOf(resolved);
            }
        }
        return List.of(address());
    }

    /**
     * {@link #getAddresses()} paired with this port.
     */
    public List<InetSocketAddress> getEndpoints()
    {
        List<InetSocketAddress> endpoints = new ArrayList<>();
        for (InetAddress a : getAddresses()) {
            endpoints.add(new InetSocketAddress(a, port));
        }
        return endpoints;
    }

    private Optional<InetAddress> resolveFirst(String name)
    {
        if ("*".equals(name)) {
            return Optional.empty();
        }
        try {
            List<InetAddress> resolved = resolver.resolve(name);
            return resolved == null || resolved.isEmpty() ? Optional.empty() : Optional.of(resolved.get(0));
        } catch (HostResolutionException e) {
            // the effective address falls back to "any"; getAddresses() reports the failure
            return Optional.empty();
        }
    }

    // -------------------------------------------------------------------------
    // Rendering
    // -------------------------------------------------------------------------

    @Override
    public String toString()
    {
        String scheme;
        switch (type) {
            case UNKNOWN:
                scheme = "";
                break;
            case WEBSOCKET:
                scheme = port == 443 ? "wss" : "ws";
                break;
            default:
                scheme = type.name().toLowerCase(Locale.ROOT);
                break;
        }

        String h = host;
        if (h == null || h.isEmpty()) {
            InetAddress a = address();
            h = a instanceof Inet6Address && port > 0 ? "[" + NetAddresses.toText(a) + "]" : NetAddresses.toText(a);
        } else if (port > 0 && h.indexOf(':') >= 0 && h.charAt(0) != '[') {
            h = "[" + h + "]";
        }

        return port > 0 ? scheme + SEPARATOR + h + ":" + port : scheme + SEPARATOR + h;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof NetUri)) return false;
        NetUri other = (NetUri) o;
        return type == other.type
                && port == other.port
                && Objects.equals(host, other.host);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(type, host, port);
    }
}
