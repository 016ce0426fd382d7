package org.optimax.rogue.server.net;

import org.optimax.rogue.server.codec.WireCodec;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Hands out in-process connections. {@link #connect()} returns the client end and queues the
 * server end for the next {@link #poll()}.
 */
public final class LocalConnectionAcceptor implements IConnectionAcceptor {

    private final WireCodec codec;
    private final Queue<IConnection> pending = new ConcurrentLinkedQueue<>();

    public LocalConnectionAcceptor(WireCodec codec) {
        this.codec = codec;
    }

    /**
     * @return the client end of a new connection
     */
    public LocalConnection connect() {
        LocalConnection.Pair pair = LocalConnection.pair(codec);
        pending.add(pair.server());
        return pair.client();
    }

    @Override
    public IConnection poll() {
        return pending.poll();
    }

    @Override
    public void close() {
        IConnection connection;
        while ((connection = pending.poll()) != null) {
            connection.close();
        }
    }
}
