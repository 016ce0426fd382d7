package org.optimax.rogue.server;

import org.optimax.rogue.runtime.TickOutcome;
import org.optimax.rogue.runtime.TickResult;
import org.optimax.rogue.runtime.Updater;
import org.optimax.rogue.runtime.model.GameState;
import org.optimax.rogue.runtime.model.Move;
import org.optimax.rogue.runtime.update.EntityPositionUpdate;
import org.optimax.rogue.runtime.update.EntitySpawnUpdate;
import org.optimax.rogue.runtime.update.GameStateUpdate;
import org.optimax.rogue.server.net.IConnection;
import org.optimax.rogue.server.net.IConnectionAcceptor;
import org.optimax.rogue.server.net.MovePacket;
import org.optimax.rogue.server.net.Packet;
import org.optimax.rogue.server.net.SyncPacket;
import org.optimax.rogue.server.net.TickEndPacket;
import org.optimax.rogue.server.net.TickStartPacket;
import org.optimax.rogue.server.net.UpdatePacket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Runs a match once both players are connected: collects moves, advances the authoritative
 * state and fans the update log out to players and spectators.
 * <p>
 * Driven by repeated calls to {@link #step()} from a single thread.
 */
public class MatchServer {

    private static final Logger LOG = LoggerFactory.getLogger(MatchServer.class);

    /**
     * One player's connection and the move it submitted for the coming tick.
     */
    static final class PlayerSlot {
        final int entityId;
        final IConnection connection;
        Move move;

        PlayerSlot(int entityId, IConnection connection) {
            this.entityId = entityId;
            this.connection = connection;
        }
    }

    private final GameState state;
    private final Updater updater;
    private final TickPacer pacer;
    private final IConnectionAcceptor acceptor;
    private final PlayerSlot player1;
    private final PlayerSlot player2;
    private final List<IConnection> spectators;

    /**
     * @param state     the authoritative state; every client has been synced to it
     * @param updater   the tick engine
     * @param pacer     minimum time between ticks
     * @param acceptor  source of late spectators; may be {@code null}
     * @param player1   player 1's connection
     * @param player2   player 2's connection
     * @param spectators connections watching the match
     */
    public MatchServer(GameState state, Updater updater, TickPacer pacer, IConnectionAcceptor acceptor,
                       IConnection player1, IConnection player2, List<IConnection> spectators) {
        if (!state.isAuthoritative()) {
            throw new IllegalArgumentException("A match server needs an authoritative state");
        }
        this.state = state;
        this.updater = updater;
        this.pacer = pacer;
        this.acceptor = acceptor;
        this.player1 = new PlayerSlot(state.getPlayer1Id(), player1);
        this.player2 = new PlayerSlot(state.getPlayer2Id(), player2);
        this.spectators = new ArrayList<>(spectators);
    }

    public GameState getState() {
        return state;
    }

    public int getSpectatorCount() {
        return spectators.size();
    }

    /**
     * Does one round of work: checks connections, reads moves and resolves a tick if both moves
     * are in and the pacer allows it.
     *
     * @return the match outcome; anything but {@link TickOutcome#IN_PROGRESS} ends the match
     */
    public TickOutcome step() {
        boolean p1Gone = player1.connection.isDisconnected();
        boolean p2Gone = player2.connection.isDisconnected();
        if (p1Gone && p2Gone) {
            LOG.info("Both players disconnected, match ends in a tie");
            return TickOutcome.TIE;
        }
        if (p1Gone) {
            LOG.info("Player 1 disconnected, player 2 wins");
            return TickOutcome.PLAYER2_WIN;
        }
        if (p2Gone) {
            LOG.info("Player 2 disconnected, player 1 wins");
            return TickOutcome.PLAYER1_WIN;
        }

        for (Iterator<IConnection> it = spectators.iterator(); it.hasNext(); ) {
            IConnection spectator = it.next();
            if (spectator.isDisconnected()) {
                LOG.info("Spectator {} disconnected", spectator.describe());
                it.remove();
            }
        }

        readMoves(player1);
        readMoves(player2);

        if (player1.move != null && player2.move != null && pacer.isDue()) {
            pacer.markTick();
            return runTick();
        }

        acceptSpectators();
        return TickOutcome.IN_PROGRESS;
    }

    private TickOutcome runTick() {
        broadcast(new TickStartPacket());
        GameState shadow = state.spectatorView();
        shadow.refreshAttributes();
        TickResult result = updater.resolveTick(state, player1.move, player2.move);
        player1.move = null;
        player2.move = null;

        for (GameStateUpdate update : result.updates()) {
            fanOut(shadow, update);
        }
        broadcast(new TickEndPacket(result.outcome()));
        if (result.outcome().isFinished()) {
            LOG.info("Match ended at tick {} with {}", state.getTick(), result.outcome());
        }
        return result.outcome();
    }

    /**
     * Sends one record to everyone who needs it. {@code shadow} follows the authoritative state
     * record by record, so per-player syncs and synthesised spawns show the moment the record
     * was emitted.
     */
    private void fanOut(GameState shadow, GameStateUpdate update) {
        int depth1 = shadow.requireEntity(player1.entityId).getDepth();
        int depth2 = shadow.requireEntity(player2.entityId).getDepth();
        update.apply(shadow);

        UpdatePacket packet = new UpdatePacket(update);
        for (IConnection spectator : spectators) {
            spectator.send(packet);
        }
        sendToPlayer(player1, depth1, shadow, update, packet);
        sendToPlayer(player2, depth2, shadow, update, packet);
    }

    private void sendToPlayer(PlayerSlot player, int viewerDepth, GameState shadow, GameStateUpdate update,
                              UpdatePacket packet) {
        if (update instanceof EntityPositionUpdate position && position.isDepthChanged()) {
            if (position.getEntityId() == player.entityId) {
                player.connection.send(new SyncPacket(shadow.viewFor(player.entityId), player.entityId));
                return;
            }
            if (position.getDepth() == viewerDepth) {
                player.connection.send(new UpdatePacket(new EntitySpawnUpdate(position.getOrder(),
                        shadow.requireEntity(position.getEntityId()))));
                return;
            }
        }
        if (update.relevantFor(shadow, viewerDepth)) {
            player.connection.send(packet);
        }
    }

    private void readMoves(PlayerSlot player) {
        Packet packet;
        while ((packet = player.connection.poll()) != null) {
            if (packet instanceof MovePacket move) {
                if (move.getEntityId() != player.entityId) {
                    LOG.warn("Player {} sent a move for entity {}, ignoring", player.entityId, move.getEntityId());
                    continue;
                }
                player.move = move.getMove();
            } else {
                LOG.warn("Player {} sent unexpected {}, disconnecting", player.entityId,
                        packet.getClass().getSimpleName());
                player.connection.close();
                return;
            }
        }
    }

    private void acceptSpectators() {
        if (acceptor == null) {
            return;
        }
        IConnection connection;
        while ((connection = acceptor.poll()) != null) {
            LOG.info("Spectator {} joined at tick {}", connection.describe(), state.getTick());
            connection.send(new SyncPacket(state.spectatorView(), null));
            spectators.add(connection);
        }
    }

    private void broadcast(Packet packet) {
        player1.connection.send(packet);
        player2.connection.send(packet);
        for (IConnection spectator : spectators) {
            spectator.send(packet);
        }
    }

    /**
     * Closes every connection of the match.
     */
    public void close() {
        player1.connection.close();
        player2.connection.close();
        for (IConnection spectator : spectators) {
            spectator.close();
        }
        spectators.clear();
    }
}
