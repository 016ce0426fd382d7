package org.optimax.rogue.server.net;

import org.optimax.rogue.server.codec.CodecException;
import org.optimax.rogue.server.codec.WireCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.Socket;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * A connection over a blocking TCP socket.
 * <p>
 * Frames are a 4-byte big-endian length followed by that many bytes of encoded packet. One
 * daemon reader thread decodes incoming frames into a queue; sends happen on the caller's
 * thread. Any I/O or decoding failure disconnects the connection.
 */
public final class SocketConnection implements IConnection {

    private static final Logger LOG = LoggerFactory.getLogger(SocketConnection.class);

    /** Frames above this size are treated as a protocol violation. */
    public static final int MAX_FRAME_BYTES = 16 * 1024 * 1024;

    private final Socket socket;
    private final WireCodec codec;
    private final String address;
    private final DataOutputStream out;
    private final DataInputStream in;
    private final Queue<Packet> inbox = new ConcurrentLinkedQueue<>();
    private final Thread reader;
    private volatile boolean disconnected;

    /**
     * Wraps a connected socket and starts the reader thread.
     *
     * @throws IOException if the socket streams cannot be opened
     */
    public SocketConnection(Socket socket, WireCodec codec) throws IOException {
        this.socket = socket;
        this.codec = codec;
        this.address = String.valueOf(socket.getRemoteSocketAddress());
        this.socket.setTcpNoDelay(true);
        this.out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()));
        this.in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
        this.reader = new Thread(this::readLoop, "conn-reader-" + address);
        this.reader.setDaemon(true);
        this.reader.start();
    }

    @Override
    public void send(Packet packet) {
        if (disconnected) {
            return;
        }
        byte[] frame = codec.encode(packet);
        try {
            synchronized (out) {
                out.writeInt(frame.length);
                out.write(frame);
                out.flush();
            }
        } catch (IOException e) {
            LOG.info("Lost connection to {} while sending: {}", address, e.getMessage());
            close();
        }
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
        return address;
    }

    @Override
    public void close() {
        if (disconnected) {
            return;
        }
        disconnected = true;
        try {
            socket.close();
        } catch (IOException e) {
            LOG.debug("Error closing socket to {}: {}", address, e.getMessage());
        }
    }

    private void readLoop() {
        try {
            while (!disconnected) {
                int length = in.readInt();
                if (length < 0 || length > MAX_FRAME_BYTES) {
                    LOG.warn("Connection {} sent a frame of {} bytes, disconnecting", address, length);
                    break;
                }
                byte[] frame = new byte[length];
                in.readFully(frame);
                inbox.add(codec.decode(frame, Packet.class));
            }
        } catch (EOFException e) {
            LOG.debug("Connection {} closed by peer", address);
        } catch (CodecException e) {
            LOG.warn("Connection {} sent an undecodable frame, disconnecting: {}", address, e.getMessage());
        } catch (IOException e) {
            if (!disconnected) {
                LOG.info("Lost connection to {}: {}", address, e.getMessage());
            }
        } finally {
            close();
        }
    }
}
