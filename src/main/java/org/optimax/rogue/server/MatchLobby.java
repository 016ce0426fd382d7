package org.optimax.rogue.server;

import org.optimax.rogue.runtime.Updater;
import org.optimax.rogue.runtime.model.GameState;
import org.optimax.rogue.runtime.spi.IStartGenerator;
import org.optimax.rogue.server.net.IConnection;
import org.optimax.rogue.server.net.IConnectionAcceptor;
import org.optimax.rogue.server.net.IdentifyPacket;
import org.optimax.rogue.server.net.IdentifyResultPacket;
import org.optimax.rogue.server.net.LobbyChangePacket;
import org.optimax.rogue.server.net.LobbyResult;
import org.optimax.rogue.server.net.Packet;
import org.optimax.rogue.server.net.SyncPacket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * The pre-match stage. Every new connection starts as a spectator and may claim a player slot by
 * sending that player's shared secret. Once both slots are taken the initial state is built,
 * every connection is synced and a {@link MatchServer} takes over.
 */
public class MatchLobby {

    private static final Logger LOG = LoggerFactory.getLogger(MatchLobby.class);

    private final IConnectionAcceptor acceptor;
    private final byte[] secret1;
    private final byte[] secret2;
    private final IStartGenerator startGenerator;
    private final Updater updater;
    private final TickPacer pacer;

    private final List<IConnection> spectators = new ArrayList<>();
    private IConnection player1;
    private IConnection player2;
    private MatchServer matchServer;

    /**
     * @throws IllegalArgumentException if the two secrets are equal
     */
    public MatchLobby(IConnectionAcceptor acceptor, String secret1, String secret2, IStartGenerator startGenerator,
                      Updater updater, TickPacer pacer) {
        Objects.requireNonNull(secret1, "secret1");
        Objects.requireNonNull(secret2, "secret2");
        if (secret1.equals(secret2)) {
            throw new IllegalArgumentException("The two player secrets must differ");
        }
        this.acceptor = acceptor;
        this.secret1 = secret1.getBytes(StandardCharsets.UTF_8);
        this.secret2 = secret2.getBytes(StandardCharsets.UTF_8);
        this.startGenerator = startGenerator;
        this.updater = updater;
        this.pacer = pacer;
    }

    /**
     * @return the match server once {@link #step()} returned {@link LobbyResult#READY}, else {@code null}
     */
    public MatchServer getMatchServer() {
        return matchServer;
    }

    /**
     * Does one round of lobby work.
     *
     * @return {@link LobbyResult#READY} when the match started, {@link LobbyResult#SETUP_FAILED}
     * when a player left before it did, otherwise {@link LobbyResult#IN_PROGRESS}
     */
    public LobbyResult step() {
        if (matchServer != null) {
            return LobbyResult.READY;
        }
        if ((player1 != null && player1.isDisconnected()) || (player2 != null && player2.isDisconnected())) {
            LOG.info("A player disconnected before the match started, closing the lobby");
            broadcast(new LobbyChangePacket(LobbyResult.SETUP_FAILED));
            closeAll();
            return LobbyResult.SETUP_FAILED;
        }

        for (Iterator<IConnection> it = spectators.iterator(); it.hasNext(); ) {
            IConnection connection = it.next();
            if (connection.isDisconnected()) {
                it.remove();
                continue;
            }
            Packet packet = connection.poll();
            if (packet == null) {
                continue;
            }
            if (!(packet instanceof IdentifyPacket identify)) {
                LOG.warn("Lobby connection {} sent {}, dropping it", connection.describe(),
                        packet.getClass().getSimpleName());
                connection.close();
                it.remove();
                continue;
            }
            byte[] secret = identify.getSecret().getBytes(StandardCharsets.UTF_8);
            if (player1 == null && MessageDigest.isEqual(secret1, secret)) {
                LOG.info("Connection {} identified as player 1", connection.describe());
                player1 = connection;
                it.remove();
                connection.send(new IdentifyResultPacket(1));
            } else if (player2 == null && MessageDigest.isEqual(secret2, secret)) {
                LOG.info("Connection {} identified as player 2", connection.describe());
                player2 = connection;
                it.remove();
                connection.send(new IdentifyResultPacket(2));
            } else {
                LOG.warn("Connection {} failed to identify", connection.describe());
                connection.send(new IdentifyResultPacket(null));
            }
        }

        if (player1 != null && player2 != null) {
            startMatch();
            return LobbyResult.READY;
        }

        IConnection connection;
        while ((connection = acceptor.poll()) != null) {
            LOG.info("Connection {} joined the lobby", connection.describe());
            spectators.add(connection);
        }
        return LobbyResult.IN_PROGRESS;
    }

    private void startMatch() {
        GameState state = startGenerator.createInitialState();
        player1.send(new SyncPacket(state.viewFor(state.getPlayer1Id()), state.getPlayer1Id()));
        player2.send(new SyncPacket(state.viewFor(state.getPlayer2Id()), state.getPlayer2Id()));
        for (IConnection spectator : spectators) {
            spectator.send(new SyncPacket(state.spectatorView(), null));
        }
        LOG.info("Starting match with {} spectators", spectators.size());
        matchServer = new MatchServer(state, updater, pacer, acceptor, player1, player2, spectators);
    }

    private void broadcast(Packet packet) {
        if (player1 != null) {
            player1.send(packet);
        }
        if (player2 != null) {
            player2.send(packet);
        }
        for (IConnection spectator : spectators) {
            spectator.send(packet);
        }
    }

    private void closeAll() {
        if (player1 != null) {
            player1.close();
        }
        if (player2 != null) {
            player2.close();
        }
        for (IConnection spectator : spectators) {
            spectator.close();
        }
        spectators.clear();
    }
}
