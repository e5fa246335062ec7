package com.questrail.netsession.server;

import com.questrail.netsession.internal.time.Cancellable;
import com.questrail.netsession.internal.time.WallClock;
import com.questrail.netsession.observability.NetErrorEvent;
import com.questrail.netsession.observability.NetObservabilitySink;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * SessionEvents
 * =============================================================================
 * Subscription channel for newly created sessions.
 *
 * <p>Each subscriber is called on its own executor (the server's notification
 * executor unless one is given), never on the thread that created the session.
 * A slow subscriber therefore delays nobody else, and a failing one is reported
 * to the observability sink and does not affect the others.</p>
 */
public final class SessionEvents
{
    private record Subscriber(Consumer<DatagramSession> consumer, Executor executor) {}

    private final CopyOnWriteArrayList<Subscriber> subscribers = new CopyOnWriteArrayList<>();
    private final Executor defaultExecutor;
    private final NetObservabilitySink sink;
    private final WallClock wallClock;

    SessionEvents(Executor defaultExecutor, NetObservabilitySink sink, WallClock wallClock)
    {
        this.defaultExecutor = Objects.requireNonNull(defaultExecutor, "defaultExecutor");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public Cancellable subscribe(Consumer<DatagramSession> consumer)
    {
        return subscribe(consumer, defaultExecutor);
    }

    /**
     * @return handle that stops further notifications; already queued ones still run
     */
    public Cancellable subscribe(Consumer<DatagramSession> consumer, Executor executor)
    {
        Subscriber s = new Subscriber(
            Objects.requireNonNull(consumer, "consumer"),
            Objects.requireNonNull(executor, "executor"));
        subscribers.add(s);
        return () -> subscribers.remove(s);
    }

    public int subscriberCount()
    {
        return subscribers.size();
    }

    void publish(DatagramSession session)
    {
        for (Subscriber s : subscribers) {
            try {
                s.executor().execute(() -> deliver(s, session));
            } catch (RejectedExecutionException e) {
                sink.onError(new NetErrorEvent(wallClock.now(), "NewSession", "Notification rejected for " + session, e));
            }
        }
    }

    private void deliver(Subscriber s, DatagramSession session)
    {
        try {
            s.consumer().accept(session);
        } catch (RuntimeException e) {
            sink.onError(new NetErrorEvent(wallClock.now(), "NewSession", "Subscriber failed for " + session, e));
        }
    }
}
