package org.optimax.rogue.server;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.optimax.rogue.junit.extensions.logging.LogWatchExtension;
import org.optimax.rogue.runtime.EngineSettings;
import org.optimax.rogue.runtime.TickOutcome;
import org.optimax.rogue.runtime.model.Move;
import org.optimax.rogue.server.config.ServerSettings;
import org.optimax.rogue.server.net.IdentifyPacket;
import org.optimax.rogue.server.net.IdentifyResultPacket;
import org.optimax.rogue.server.net.LocalConnectionAcceptor;
import org.optimax.rogue.server.net.MovePacket;
import org.optimax.rogue.server.net.SyncPacket;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Runs whole duels on a background thread over in-process connections.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class DuelServerTest {

    private static final ServerSettings SETTINGS =
            new ServerSettings("127.0.0.1", 0, Duration.ZERO, Duration.ofMillis(1), 42L);

    private final DuelServer server = new DuelServer(SETTINGS, EngineSettings.defaults(), "alpha", "beta");
    private final LocalConnectionAcceptor acceptor = new LocalConnectionAcceptor(server.getCodec());

    @AfterEach
    void tearDown() {
        server.stop();
        acceptor.close();
    }

    private CompletableFuture<Optional<TickOutcome>> runAsync() {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return server.run(acceptor);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(e);
            }
        });
    }

    @Test
    void disconnectingPlayerLosesTheDuel() throws Exception {
        TestClient first = new TestClient(acceptor.connect());
        TestClient second = new TestClient(acceptor.connect());
        CompletableFuture<Optional<TickOutcome>> result = runAsync();

        first.send(new IdentifyPacket("alpha"));
        second.send(new IdentifyPacket("beta"));
        await().atMost(5, TimeUnit.SECONDS)
                .until(() -> !first.drain().receivedOf(SyncPacket.class).isEmpty()
                        && !second.drain().receivedOf(SyncPacket.class).isEmpty());
        assertThat(first.playerId).isEqualTo(1);
        assertThat(second.playerId).isEqualTo(2);

        first.send(new MovePacket(1, Move.STAY));
        second.send(new MovePacket(2, Move.STAY));
        await().atMost(5, TimeUnit.SECONDS).until(() -> first.drain().lastOutcome != null);
        assertThat(first.lastOutcome).isEqualTo(TickOutcome.IN_PROGRESS);
        assertThat(first.view().getTick()).isEqualTo(1);

        second.connection.close();

        assertThat(result.get(5, TimeUnit.SECONDS)).contains(TickOutcome.PLAYER1_WIN);
    }

    @Test
    void playerLeavingTheLobbyEndsWithoutAMatch() throws Exception {
        TestClient first = new TestClient(acceptor.connect());
        CompletableFuture<Optional<TickOutcome>> result = runAsync();

        first.send(new IdentifyPacket("alpha"));
        await().atMost(5, TimeUnit.SECONDS)
                .until(() -> !first.drain().receivedOf(IdentifyResultPacket.class).isEmpty());
        first.connection.close();

        assertThat(result.get(5, TimeUnit.SECONDS)).isEmpty();
    }

    @Test
    void stopEndsAWaitingLobby() throws Exception {
        CompletableFuture<Optional<TickOutcome>> result = runAsync();

        server.stop();

        assertThat(result.get(5, TimeUnit.SECONDS)).isEmpty();
    }

    @Test
    void equalSecretsAreRejected() {
        assertThatThrownBy(() -> new DuelServer(SETTINGS, EngineSettings.defaults(), "same", "same"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
