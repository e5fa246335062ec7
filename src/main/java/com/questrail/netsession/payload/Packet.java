package com.questrail.netsession.payload;

import io.netty.buffer.ByteBufUtil;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Packet
 * =============================================================================
 * Opaque datagram payload: a window onto a byte array, optionally chained to
 * further segments.
 *
 * <p>The transport never interprets the bytes. It needs only the total length,
 * a segment view for gather writes, and a hex rendering for diagnostics.</p>
 *
 * <p>The backing arrays are shared, not copied. A packet handed to a send call
 * must not be modified until the call returns.</p>
 */
public final class Packet
{
    private final byte[] data;
    private final int offset;
    private final int count;

    private Packet next;

    public Packet(byte[] data)
    {
        this(data, 0, Objects.requireNonNull(data, "data").length);
    }

    public Packet(byte[] data, int offset, int count)
    {
        Objects.requireNonNull(data, "data");
        Objects.checkFromIndexSize(offset, count, data.length);
        this.data = data;
        this.offset = offset;
        this.count = count;
    }

    public static Packet of(String text)
    {
        return new Packet(text.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] data()
    {
        return data;
    }

    public int offset()
    {
        return offset;
    }

    /**
     * Length of this segment only.
     */
    public int count()
    {
        return count;
    }

    public Packet next()
    {
        return next;
    }

    /**
     * Chain another packet after the last segment of this one.
     *
     * @return this packet
     */
    public Packet append(Packet tail)
    {
        Objects.requireNonNull(tail, "tail");
        if (tail == this) {
            throw new IllegalArgumentException("Cannot append a packet to itself");
        }
        Packet p = this;
        while (p.next != null) {
            p = p.next;
        }
        p.next = tail;
        return this;
    }

    /**
     * Total length over the whole chain.
     */
    public int total()
    {
        int total = 0;
        for (Packet p = this; p != null; p = p.next) {
            total += p.count;
        }
        return total;
    }

    /**
     * Read-only buffer views, one per segment, for gather writes.
     */
    public List<ByteBuffer> segments()
    {
        if (next == null) {
            return Collections.singletonList(ByteBuffer.wrap(data, offset, count).asReadOnlyBuffer());
        }
        List<ByteBuffer> list = new ArrayList<>();
        for (Packet p = this; p != null; p = p.next) {
            list.add(ByteBuffer.wrap(p.data, p.offset, p.count).asReadOnlyBuffer());
        }
        return list;
    }

    /**
     * Copy of the whole chain as one array.
     */
    public byte[] toArray()
    {
        byte[] out = new byte[total()];
        int pos = 0;
        for (Packet p = this; p != null; p = p.next) {
            System.arraycopy(p.data, p.offset, out, pos, p.count);
            pos += p.count;
        }
        return out;
    }

    public String toUtf8()
    {
        return new String(toArray(), StandardCharsets.UTF_8);
    }

    /**
     * Hex rendering of at most {@code maxBytes} bytes; {@code "..."} marks a cut.
     * A negative limit renders everything.
     */
    public String toHex(int maxBytes)
    {
        int total = total();
        int limit = maxBytes < 0 ? total : Math.min(maxBytes, total);

        StringBuilder sb = new StringBuilder(limit * 2 + 3);
        int remaining = limit;
        for (Packet p = this; p != null && remaining > 0; p = p.next) {
            int n = Math.min(p.count, remaining);
            sb.append(ByteBufUtil.hexDump(p.data, p.offset, n).toUpperCase(Locale.ROOT));
            remaining -= n;
        }
        if (limit < total) {
            sb.append("...");
        }
        return sb.toString();
    }

    public String toHex()
    {
        return toHex(-1);
    }

    @Override
    public String toString()
    {
        return "Packet[" + total() + "]";
    }
}
