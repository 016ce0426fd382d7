package org.optimax.rogue.server.net;

/**
 * Source of newly connected clients.
 */
public interface IConnectionAcceptor extends AutoCloseable {

    /**
     * @return the next new connection, or {@code null} if none arrived; never blocks
     */
    IConnection poll();

    @Override
    void close();
}
