package com.questrail.netsession.match;

import com.questrail.netsession.internal.time.MonotonicClock;
import com.questrail.netsession.internal.time.MonotonicScheduler;
import com.questrail.netsession.internal.time.SystemWallClock;
import com.questrail.netsession.internal.time.WallClock;
import com.questrail.netsession.observability.MatchEvent;
import com.questrail.netsession.observability.NetObservabilitySink;
import com.questrail.netsession.observability.NullObservabilitySink;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.BiPredicate;

/**
 * DefaultMatchQueue
 * =============================================================================
 * Fixed-capacity {@link MatchQueue} over an array of atomically claimed slots.
 *
 * <h2>Slots</h2>
 * A slot is free ({@code null}) or holds exactly one pending request.
 * <ul>
 *   <li>{@link #add} claims the first free slot with a compare-and-set from
 *       {@code null}, so two concurrent adds never claim the same slot.</li>
 *   <li>Match, expiry and clear free a slot with a compare-and-set from the
 *       occupant they observed, so each occupancy ends exactly once.</li>
 * </ul>
 * There is no structure-wide lock; the occupied count is an atomic counter.
 *
 * <h2>Expiry</h2>
 * Deadlines are absolute monotonic ticks. A sweep runs every second while any
 * slot is occupied: it is armed by the first add, re-arms itself while the count
 * is positive, and disarms at zero. A request is therefore cancelled at most one
 * sweep interval after its deadline.
 *
 * <h2>Completion</h2>
 * Handles are resolved on the completion executor, not on the thread that
 * matched or swept, so a continuation attached by the caller cannot stall the
 * receive path. A handle that is already done (for example completed by the
 * caller after a failed send) is left untouched.
 *
 * <h2>Capacity</h2>
 * Fixed at construction (default 256). It is a backpressure boundary: a full
 * queue fails {@link #add} immediately rather than growing.
 */
public final class DefaultMatchQueue<Q, R> implements MatchQueue<Q, R>
{
    public static final int DEFAULT_CAPACITY = 256;
    public static final int DEFAULT_TIMEOUT_MILLIS = 15_000;
    public static final Duration SWEEP_INTERVAL = Duration.ofSeconds(1);

    /** Timeouts at or below this are treated as unset. */
    static final int MIN_TIMEOUT_MILLIS = 10;

    private record Slot<Q, R>(
        Object owner,
        Q request,
        long expiresAtNanos,
        CompletableFuture<R> completion,
        Object traceTag
    ) {}

    private final AtomicReferenceArray<Slot<Q, R>> slots;
    private final AtomicInteger count = new AtomicInteger();
    private final AtomicBoolean sweepArmed = new AtomicBoolean(false);

    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Executor completionExecutor;
    private final NetObservabilitySink sink;
    private final WallClock wallClock;

    public DefaultMatchQueue(MonotonicClock clock, MonotonicScheduler scheduler)
    {
        this(DEFAULT_CAPACITY, clock, scheduler, ForkJoinPool.commonPool(), null);
    }

    /**
     * @param capacity           number of slots
     * @param clock              monotonic source for deadlines
     * @param scheduler          runs the expiry sweep
     * @param completionExecutor resolves completion handles off the calling thread
     * @param sink               observability sink; {@code null} for none
     */
    public DefaultMatchQueue(int capacity,
                             MonotonicClock clock,
                             MonotonicScheduler scheduler,
                             Executor completionExecutor,
                             NetObservabilitySink sink)
    {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.slots = new AtomicReferenceArray<>(capacity);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.completionExecutor = Objects.requireNonNull(completionExecutor, "completionExecutor");
        this.sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
        this.wallClock = SystemWallClock.INSTANCE;
    }

    @Override
    public CompletableFuture<R> add(Object owner, Q request, int timeoutMillis, CompletableFuture<R> completion, Object traceTag)
    {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(completion, "completion");

        int timeout = timeoutMillis <= MIN_TIMEOUT_MILLIS ? DEFAULT_TIMEOUT_MILLIS : timeoutMillis;
        long deadline = clock.nowNanos() + timeout * 1_000_000L;
        Slot<Q, R> slot = new Slot<>(owner, request, deadline, completion, traceTag);

        boolean claimed = false;
        for (int i = 0; i < slots.length(); i++) {
            if (slots.compareAndSet(i, null, slot)) {
                claimed = true;
                break;
            }
        }
        if (!claimed) {
            emit(MatchEvent.Kind.QUEUE_FULL, slot, count.get());
            throw new MatchQueueFullException(slots.length());
        }

        int pending = count.incrementAndGet();
        emit(MatchEvent.Kind.ADDED, slot, pending);

        if (sweepArmed.compareAndSet(false, true)) {
            scheduleSweep();
        }
        return completion;
    }

    @Override
    public <S> boolean match(Object owner, S response, R result, BiPredicate<? super Q, ? super S> matcher)
    {
        Objects.requireNonNull(matcher, "matcher");
        if (count.get() <= 0) {
            return false;
        }

        // linear scan; the lowest matching index wins
        for (int i = 0; i < slots.length(); i++) {
            Slot<Q, R> slot = slots.get(i);
            if (slot == null || slot.owner() != owner || !matcher.test(slot.request(), response)) {
                continue;
            }
            if (!slots.compareAndSet(i, slot, null)) {
                // lost to a concurrent match, expiry or clear
                continue;
            }

            int pending = count.decrementAndGet();
            emit(MatchEvent.Kind.MATCHED, slot, pending);
            completeAsync(slot, () -> slot.completion().complete(result));
            return true;
        }

        sink.onMatchEvent(new MatchEvent(wallClock.now(), MatchEvent.Kind.UNMATCHED, owner, response, null, count.get()));
        return false;
    }

    @Override
    public void clear()
    {
        for (int i = 0; i < slots.length(); i++) {
            Slot<Q, R> slot = slots.get(i);
            if (slot != null && slots.compareAndSet(i, slot, null)) {
                int pending = count.decrementAndGet();
                emit(MatchEvent.Kind.CLEARED, slot, pending);
                cancel(slot, MatchCancelledException.Reason.CLEARED);
            }
        }
    }

    @Override
    public int pending()
    {
        return count.get();
    }

    @Override
    public int capacity()
    {
        return slots.length();
    }

    /**
     * Cancel every request whose deadline is at or before {@code nowNanos}.
     */
    void expire(long nowNanos)
    {
        if (count.get() <= 0) {
            return;
        }

        for (int i = 0; i < slots.length(); i++) {
            Slot<Q, R> slot = slots.get(i);
            if (slot == null || nowNanos - slot.expiresAtNanos() < 0) {
                continue;
            }
            if (slots.compareAndSet(i, slot, null)) {
                int pending = count.decrementAndGet();
                emit(MatchEvent.Kind.EXPIRED, slot, pending);
                cancel(slot, MatchCancelledException.Reason.EXPIRED);
            }
        }
    }

    boolean isSweepArmed()
    {
        return sweepArmed.get();
    }

    // -------------------------------------------------------------------------
    // Sweep timer
    // -------------------------------------------------------------------------

    private void scheduleSweep()
    {
        scheduler.scheduleAfter(SWEEP_INTERVAL, clock, this::sweep);
    }

    private void sweep()
    {
        try {
            expire(clock.nowNanos());
        } finally {
            if (count.get() > 0) {
                scheduleSweep();
            } else {
                sweepArmed.set(false);
                // an add may have slipped in between the check and the disarm
                if (count.get() > 0 && sweepArmed.compareAndSet(false, true)) {
                    scheduleSweep();
                }
            }
        }
    }

    // -------------------------------------------------------------------------
    // Completion
    // -------------------------------------------------------------------------

    private void cancel(Slot<Q, R> slot, MatchCancelledException.Reason reason)
    {
        completeAsync(slot, () -> slot.completion().completeExceptionally(new MatchCancelledException(reason)));
    }

    private void completeAsync(Slot<Q, R> slot, Runnable completion)
    {
        if (slot.completion().isDone()) {
            return;
        }
        try {
            completionExecutor.execute(completion);
        } catch (RejectedExecutionException e) {
            // executor already shut down: resolve here rather than leave the caller waiting
            completion.run();
        }
    }

    private void emit(MatchEvent.Kind kind, Slot<Q, R> slot, int pending)
    {
        sink.onMatchEvent(new MatchEvent(wallClock.now(), kind, slot.owner(), slot.request(), slot.traceTag(), pending));
    }
}
