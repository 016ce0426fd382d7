package org.optimax.rogue.server.net;

import org.optimax.rogue.server.codec.WireCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Accepts TCP clients on a background thread and hands them out as {@link SocketConnection}s.
 */
public final class SocketConnectionAcceptor implements IConnectionAcceptor {

    private static final Logger LOG = LoggerFactory.getLogger(SocketConnectionAcceptor.class);

    private final ServerSocket serverSocket;
    private final WireCodec codec;
    private final Queue<IConnection> pending = new ConcurrentLinkedQueue<>();
    private final Thread acceptThread;
    private volatile boolean closed;

    /**
     * Binds the listening socket and starts accepting.
     *
     * @param host the interface to bind
     * @param port the port to bind; 0 picks a free one
     * @throws IOException if the socket cannot be bound
     */
    public SocketConnectionAcceptor(String host, int port, WireCodec codec) throws IOException {
        this.codec = codec;
        this.serverSocket = new ServerSocket();
        this.serverSocket.setReuseAddress(true);
        this.serverSocket.bind(new InetSocketAddress(host, port));
        this.acceptThread = new Thread(this::acceptLoop, "acceptor-" + getPort());
        this.acceptThread.setDaemon(true);
        this.acceptThread.start();
        LOG.info("Listening on {}:{}", host, getPort());
    }

    /**
     * @return the port actually bound
     */
    public int getPort() {
        return serverSocket.getLocalPort();
    }

    @Override
    public IConnection poll() {
        return pending.poll();
    }

    @Override
    public void close() {
        closed = true;
        try {
            serverSocket.close();
        } catch (IOException e) {
            LOG.debug("Error closing listening socket: {}", e.getMessage());
        }
        IConnection connection;
        while ((connection = pending.poll()) != null) {
            connection.close();
        }
    }

    private void acceptLoop() {
        while (!closed) {
            try {
                Socket socket = serverSocket.accept();
                LOG.info("Accepted connection from {}", socket.getRemoteSocketAddress());
                pending.add(new SocketConnection(socket, codec));
            } catch (IOException e) {
                if (!closed) {
                    LOG.warn("Failed to accept a connection: {}", e.getMessage());
                }
            }
        }
    }
}
