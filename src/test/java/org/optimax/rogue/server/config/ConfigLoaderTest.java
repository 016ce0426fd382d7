package org.optimax.rogue.server.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.optimax.rogue.junit.extensions.logging.LogWatchExtension;
import org.optimax.rogue.runtime.DespawnStrategy;
import org.optimax.rogue.runtime.EngineSettings;
import org.optimax.rogue.runtime.OccupiedLevelPolicy;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Precedence of the configuration layers: system properties, then the file, then
 * {@code reference.conf}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("optimax-rogue.server.port");
        System.clearProperty("optimax-rogue.engine.npcs-per-level");
        ConfigFactory.invalidateCaches();
    }

    private File writeConfig(String content) throws IOException {
        Path file = tempDir.resolve("rogue.conf");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file.toFile();
    }

    @Test
    @DisplayName("reference.conf alone yields the built-in defaults")
    void referenceDefaultsMatchTheCodeDefaults() {
        Config config = ConfigLoader.load();

        assertThat(EngineSettings.fromConfig(config.getConfig("optimax-rogue"))).isEqualTo(EngineSettings.defaults());
        ServerSettings server = ServerSettings.fromConfig(config.getConfig("optimax-rogue"));
        assertThat(server.port()).isEqualTo(1769);
        assertThat(server.tickInterval()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.getString("logging.format")).isEqualTo("PLAIN");
    }

    @Test
    void fileOverridesReferenceValues() throws IOException {
        File file = writeConfig("""
                optimax-rogue {
                  server { port = 4000, seed = 12 }
                  engine {
                    despawn-strategy = "unused", occupied-level-policy = "cull", npc.health = 7
                    npc.crit.chance = 20
                    player.regen.amount = 0
                  }
                }
                """);

        Config rogue = ConfigLoader.load(file).getConfig("optimax-rogue");
        EngineSettings engine = EngineSettings.fromConfig(rogue);
        ServerSettings server = ServerSettings.fromConfig(rogue);

        assertThat(server.port()).isEqualTo(4000);
        assertThat(server.seed()).isEqualTo(12L);
        assertThat(server.host()).isEqualTo("0.0.0.0");
        assertThat(engine.despawnStrategy()).isEqualTo(DespawnStrategy.UNUSED);
        assertThat(engine.occupiedLevelPolicy()).isEqualTo(OccupiedLevelPolicy.CULL);
        assertThat(engine.npcHealth()).isEqualTo(7);
        assertThat(engine.npcLoadout().critChance()).isEqualTo(20);
        assertThat(engine.npcLoadout().critMultiplier()).isEqualTo(1);
        assertThat(engine.playerLoadout().regenAmount()).isZero();
        assertThat(engine.playerLoadout().critChance()).isEqualTo(10);
        assertThat(engine.npcsPerLevel()).isEqualTo(2);
    }

    @Test
    void systemPropertiesOverrideTheFile() throws IOException {
        File file = writeConfig("optimax-rogue.server.port = 4000\noptimax-rogue.engine.npcs-per-level = 5\n");
        System.setProperty("optimax-rogue.server.port", "5000");
        ConfigFactory.invalidateCaches();

        Config rogue = ConfigLoader.load(file).getConfig("optimax-rogue");

        assertThat(rogue.getInt("server.port")).isEqualTo(5000);
        assertThat(rogue.getInt("engine.npcs-per-level")).isEqualTo(5);
    }

    @Test
    void missingExplicitFileIsAnError() {
        File missing = tempDir.resolve("nope.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.load(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope.conf");
    }

    @Test
    void unknownStrategyNameIsRejected() throws IOException {
        File file = writeConfig("optimax-rogue.engine.despawn-strategy = \"sometimes\"\n");
        Config rogue = ConfigLoader.load(file).getConfig("optimax-rogue");

        assertThatThrownBy(() -> EngineSettings.fromConfig(rogue))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sometimes");
    }

    @Test
    void settingsRejectImpossibleValues() {
        EngineSettings d = EngineSettings.defaults();
        assertThatThrownBy(() -> new EngineSettings(d.despawnStrategy(), d.occupiedLevelPolicy(), -1, "stationary",
                1, 1, 0, 22, 12, 10, 2, 1, 3, 1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EngineSettings(d.despawnStrategy(), d.occupiedLevelPolicy(), 1, "stationary",
                1, 1, 0, 3, 12, 10, 2, 1, 3, 1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ServerSettings("localhost", 70000, Duration.ZERO, Duration.ZERO, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(d.killRewardEnabled()).isTrue();
    }
}
