package com.questrail.netsession.server;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SessionRegistry
 * -----------------------------------------------------------------------------
 * Sessions of one server, keyed by peer key, plus the broadcast sessions keyed
 * by port.
 *
 * <p>Lookups are lock-free. Only create-or-fetch takes {@link #createLock}, so
 * two datagrams from a new peer arriving on different workers create one
 * session. Removal is conditional on the mapped value, so a session only ever
 * removes its own entries.</p>
 */
final class SessionRegistry
{
    private final ConcurrentHashMap<String, DatagramSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Integer, DatagramSession> broadcasts = new ConcurrentHashMap<>();

    final Object createLock = new Object();

    /**
     * The session of {@code key}, else the broadcast session listening on
     * {@code port}, else {@code null}.
     */
    DatagramSession find(String key, int port)
    {
        DatagramSession s = sessions.get(key);
        return s != null ? s : broadcasts.get(port);
    }

    DatagramSession get(String key)
    {
        return sessions.get(key);
    }

    void add(DatagramSession session)
    {
        sessions.put(session.key(), session);
    }

    void addBroadcast(int port, DatagramSession session)
    {
        broadcasts.put(port, session);
    }

    boolean remove(DatagramSession session)
    {
        return sessions.remove(session.key(), session);
    }

    boolean removeBroadcast(int port, DatagramSession session)
    {
        return broadcasts.remove(port, session);
    }

    DatagramSession broadcast(int port)
    {
        return broadcasts.get(port);
    }

    /**
     * Snapshot of the current sessions.
     */
    List<DatagramSession> all()
    {
        return new ArrayList<>(sessions.values());
    }

    Map<String, DatagramSession> view()
    {
        return Collections.unmodifiableMap(sessions);
    }

    int size()
    {
        return sessions.size();
    }
}
