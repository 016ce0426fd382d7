package org.optimax.rogue.server.net;

import org.optimax.rogue.server.codec.WireCodec;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * An in-process connection. Every packet goes through the codec, so the two ends never share
 * an object and the wire format is exercised exactly as over a socket.
 */
public final class LocalConnection implements IConnection {

    /**
     * Both ends of one in-process link.
     */
    public record Pair(LocalConnection server, LocalConnection client) {
    }

    private final WireCodec codec;
    private final String name;
    private final Queue<Packet> inbox = new ConcurrentLinkedQueue<>();
    private LocalConnection peer;
    private volatile boolean disconnected;

    private LocalConnection(WireCodec codec, String name) {
        this.codec = codec;
        this.name = name;
    }

    /**
     * Creates two connected ends.
     */
    public static Pair pair(WireCodec codec) {
        LocalConnection server = new LocalConnection(codec, "local-server");
        LocalConnection client = new LocalConnection(codec, "local-client");
        server.peer = client;
        client.peer = server;
        return new Pair(server, client);
    }

    @Override
    public void send(Packet packet) {
        if (disconnected) {
            return;
        }
        byte[] frame = codec.encode(packet);
        peer.inbox.add(codec.decode(frame, Packet.class));
    }

    @Override
    public Packet poll() {
        return inbox.poll();
    }

    @Override
    public boolean isDisconnected() {
        return disconnected;
    }

    @Override
    public String describe() {
        return name;
    }

    /**
     * Closes both ends.
     */
    @Override
    public void close() {
        disconnected = true;
        peer.disconnected = true;
    }
}
