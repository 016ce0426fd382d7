package org.optimax.rogue.server;

import org.optimax.rogue.runtime.EngineSettings;
import org.optimax.rogue.runtime.TickOutcome;
import org.optimax.rogue.runtime.Updater;
import org.optimax.rogue.runtime.internal.services.SeededRandomProvider;
import org.optimax.rogue.runtime.npc.NpcControllerFactory;
import org.optimax.rogue.runtime.spi.IDungeonGenerator;
import org.optimax.rogue.runtime.spi.INpcController;
import org.optimax.rogue.runtime.spi.IRandomProvider;
import org.optimax.rogue.runtime.worldgen.DuelStartGenerator;
import org.optimax.rogue.runtime.worldgen.EmptyDungeonGenerator;
import org.optimax.rogue.server.codec.TypeRegistry;
import org.optimax.rogue.server.codec.WireCodec;
import org.optimax.rogue.server.config.ServerSettings;
import org.optimax.rogue.server.net.IConnectionAcceptor;
import org.optimax.rogue.server.net.LobbyResult;
import org.optimax.rogue.server.net.SocketConnectionAcceptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Wires a complete duel together and drives it: lobby first, then the match, each polled on
 * the calling thread until it finishes.
 */
public class DuelServer {

    private static final Logger LOG = LoggerFactory.getLogger(DuelServer.class);

    private final ServerSettings serverSettings;
    private final EngineSettings engineSettings;
    private final String secret1;
    private final String secret2;
    private final WireCodec codec;
    private volatile boolean stopRequested;

    public DuelServer(ServerSettings serverSettings, EngineSettings engineSettings, String secret1, String secret2) {
        if (secret1.equals(secret2)) {
            throw new IllegalArgumentException("The two player secrets must differ");
        }
        this.serverSettings = serverSettings;
        this.engineSettings = engineSettings;
        this.secret1 = secret1;
        this.secret2 = secret2;
        this.codec = new WireCodec(TypeRegistry.standard());
    }

    public WireCodec getCodec() {
        return codec;
    }

    /**
     * Listens on the configured host and port and runs one duel.
     *
     * @return the outcome, or empty if the lobby failed or the server was stopped first
     * @throws IOException if the port cannot be bound
     */
    public Optional<TickOutcome> run() throws IOException, InterruptedException {
        try (SocketConnectionAcceptor acceptor =
                     new SocketConnectionAcceptor(serverSettings.host(), serverSettings.port(), codec)) {
            return run(acceptor);
        }
    }

    /**
     * Runs one duel with connections from {@code acceptor}.
     *
     * @return the outcome, or empty if the lobby failed or the server was stopped first
     */
    public Optional<TickOutcome> run(IConnectionAcceptor acceptor) throws InterruptedException {
        IRandomProvider random = new SeededRandomProvider(serverSettings.seed());
        IDungeonGenerator dungeonGenerator = new EmptyDungeonGenerator(engineSettings.dungeonWidth(),
                engineSettings.dungeonHeight(), random.deriveFor("dungeon", 0));
        INpcController npcController = NpcControllerFactory.create(engineSettings.npcController(),
                random.deriveFor("npc", 0));
        Updater updater = new Updater(dungeonGenerator, npcController, random, engineSettings);
        DuelStartGenerator startGenerator = new DuelStartGenerator(dungeonGenerator, engineSettings, random);
        TickPacer pacer = new TickPacer(serverSettings.tickInterval());

        LOG.info("Duel server starting with seed {}", serverSettings.seed());
        MatchLobby lobby = new MatchLobby(acceptor, secret1, secret2, startGenerator, updater, pacer);
        LobbyResult lobbyResult = LobbyResult.IN_PROGRESS;
        while (!stopRequested) {
            lobbyResult = lobby.step();
            if (lobbyResult != LobbyResult.IN_PROGRESS) {
                break;
            }
            Thread.sleep(serverSettings.pollInterval().toMillis());
        }
        if (lobbyResult != LobbyResult.READY) {
            LOG.info("Lobby closed without a match ({})", stopRequested ? "stopped" : lobbyResult);
            return Optional.empty();
        }

        MatchServer match = lobby.getMatchServer();
        try {
            while (!stopRequested) {
                TickOutcome outcome = match.step();
                if (outcome.isFinished()) {
                    return Optional.of(outcome);
                }
                Thread.sleep(serverSettings.pollInterval().toMillis());
            }
            LOG.info("Match stopped at tick {}", match.getState().getTick());
            return Optional.empty();
        } finally {
            match.close();
        }
    }

    /**
     * Asks a running {@link #run} loop to return at its next poll.
     */
    public void stop() {
        stopRequested = true;
    }
}
