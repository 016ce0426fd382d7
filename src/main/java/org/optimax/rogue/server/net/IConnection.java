package org.optimax.rogue.server.net;

/**
 * A packet-level, non-blocking connection to one client.
 * <p>
 * Implementations must be safe to {@link #send} from the server thread while packets arrive
 * concurrently. A connection that failed is {@linkplain #isDisconnected() disconnected} for good.
 */
public interface IConnection extends AutoCloseable {

    /**
     * Queues a packet for the peer. Does nothing once disconnected.
     */
    void send(Packet packet);

    /**
     * @return the next received packet, or {@code null} if none is waiting
     */
    Packet poll();

    boolean isDisconnected();

    /**
     * @return a human-readable peer address for log messages
     */
    String describe();

    @Override
    void close();
}
