package com.questrail.netsession.transport;

import java.net.ProtocolFamily;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Hands out {@link FakeDatagramSocket}s and remembers them.
 */
public final class FakeDatagramSocketFactory implements DatagramSocketFactory {

    private final List<FakeDatagramSocket> created = new ArrayList<>();
    private Consumer<FakeDatagramSocket> customizer = s -> {};

    @Override
    public synchronized DatagramSocketPort create(ProtocolFamily family) {
        FakeDatagramSocket s = new FakeDatagramSocket(family);
        customizer.accept(s);
        created.add(s);
        return s;
    }

    /**
     * Applied to every socket before it is handed out.
     */
    public synchronized void customize(Consumer<FakeDatagramSocket> customizer) {
        this.customizer = customizer;
    }

    public synchronized List<FakeDatagramSocket> created() {
        return new ArrayList<>(created);
    }

    public synchronized FakeDatagramSocket last() {
        if (created.isEmpty()) {
            throw new IllegalStateException("No socket created yet");
        }
        return created.get(created.size() - 1);
    }
}
