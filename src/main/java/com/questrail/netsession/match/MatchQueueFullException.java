package com.questrail.netsession.match;

/**
 * Thrown by {@link MatchQueue#add} when every slot is occupied by an unexpired
 * request. The queue capacity is a backpressure boundary, so the caller decides
 * whether to wait and retry.
 */
public final class MatchQueueFullException extends RuntimeException
{
    private final int capacity;

    public MatchQueueFullException(int capacity) {
        super("Match queue is full [" + capacity + "]");
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }
}
