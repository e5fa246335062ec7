package com.questrail.netsession.observability;

/**
 * No-op implementation of NetObservabilitySink.
 */
public final class NullObservabilitySink implements NetObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onSessionEvent(SessionLifecycleEvent event) {}

    @Override
    public void onDatagramEvent(DatagramEvent event) {}

    @Override
    public void onMatchEvent(MatchEvent event) {}

    @Override
    public void onError(NetErrorEvent event) {}
}
