package com.questrail.netsession.net;

import java.util.Locale;

/**
 * Protocol tag carried by a {@link NetUri}.
 *
 * <p>The numeric codes follow the IANA protocol numbers where one exists
 * (TCP = 6, UDP = 17); the application protocols use their well-known port.</p>
 */
public enum NetType
{
    UNKNOWN(0),
    TCP(6),
    UDP(17),
    HTTP(80),
    HTTPS(43),
    WEBSOCKET(81);

    private final int code;

    NetType(int code)
    {
        this.code = code;
    }

    public int code()
    {
        return code;
    }

    /**
     * Maps a URI scheme to a protocol tag.
     *
     * <p>{@code http}, {@code https}, {@code ws} and {@code wss} are recognized
     * specially; any other scheme is matched case-insensitively against the
     * constant names. Unrecognized or blank schemes map to {@link #UNKNOWN}.</p>
     */
    public static NetType fromScheme(String scheme)
    {
        if (scheme == null || scheme.isBlank()) {
            return UNKNOWN;
        }

        String s = scheme.trim().toLowerCase(Locale.ROOT);
        switch (s) {
            case "http":
                return HTTP;
            case "https":
                return HTTPS;
            case "ws":
            case "wss":
                return WEBSOCKET;
            default:
                break;
        }

        for (NetType type : values()) {
            if (type.name().toLowerCase(Locale.ROOT).equals(s)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    /**
     * Default port implied by a scheme, or {@code -1} when the scheme implies none.
     */
    static int defaultPort(String scheme)
    {
        if (scheme == null) {
            return -1;
        }
        switch (scheme.trim().toLowerCase(Locale.ROOT)) {
            case "http":
            case "ws":
                return 80;
            case "https":
            case "wss":
                return 443;
            default:
                return -1;
        }
    }
}
