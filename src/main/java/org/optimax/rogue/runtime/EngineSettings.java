package org.optimax.rogue.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.Objects;

/**
 * Tunables of the tick engine and the world it generates.
 *
 * @param despawnStrategy     when a level left behind is dropped
 * @param occupiedLevelPolicy what happens to NPCs on a level about to be dropped
 * @param npcsPerLevel        NPCs spawned on every generated level
 * @param npcController       name of the NPC controller, see {@code NpcControllerFactory}
 * @param killBonusDamage     damage bonus a player gets for killing an NPC; 0 disables the reward
 * @param killBonusTicks      how long the kill bonus lasts; 0 disables the reward
 * @param maxTicks            tick at which a running match ends in a tie; 0 for no limit
 * @param dungeonWidth        width of generated dungeons
 * @param dungeonHeight       height of generated dungeons
 * @param playerHealth        base max health of both players
 * @param playerDamage        base damage of both players
 * @param playerArmor         base armor of both players
 * @param npcHealth           base max health of NPCs
 * @param npcDamage           base damage of NPCs
 * @param npcArmor            base armor of NPCs
 * @param playerLoadout       modifiers both players start with
 * @param npcLoadout          modifiers every NPC spawns with
 */
public record EngineSettings(DespawnStrategy despawnStrategy,
                             OccupiedLevelPolicy occupiedLevelPolicy,
                             int npcsPerLevel,
                             String npcController,
                             int killBonusDamage,
                             int killBonusTicks,
                             long maxTicks,
                             int dungeonWidth,
                             int dungeonHeight,
                             int playerHealth,
                             int playerDamage,
                             int playerArmor,
                             int npcHealth,
                             int npcDamage,
                             int npcArmor,
                             Loadout playerLoadout,
                             Loadout npcLoadout) {

    public EngineSettings {
        if (npcsPerLevel < 0) {
            throw new IllegalArgumentException("npcs-per-level must not be negative, got " + npcsPerLevel);
        }
        if (maxTicks < 0) {
            throw new IllegalArgumentException("max-ticks must not be negative, got " + maxTicks);
        }
        if (dungeonWidth < 4 || dungeonHeight < 3) {
            throw new IllegalArgumentException("Dungeons must be at least 4x3, got " + dungeonWidth + "x" + dungeonHeight);
        }
        if (playerHealth <= 0) {
            throw new IllegalArgumentException("player health must be positive, got " + playerHealth);
        }
        Objects.requireNonNull(playerLoadout, "playerLoadout");
        Objects.requireNonNull(npcLoadout, "npcLoadout");
    }

    /**
     * Settings without any starting modifiers.
     */
    public EngineSettings(DespawnStrategy despawnStrategy, OccupiedLevelPolicy occupiedLevelPolicy, int npcsPerLevel,
                          String npcController, int killBonusDamage, int killBonusTicks, long maxTicks,
                          int dungeonWidth, int dungeonHeight, int playerHealth, int playerDamage, int playerArmor,
                          int npcHealth, int npcDamage, int npcArmor) {
        this(despawnStrategy, occupiedLevelPolicy, npcsPerLevel, npcController, killBonusDamage, killBonusTicks,
                maxTicks, dungeonWidth, dungeonHeight, playerHealth, playerDamage, playerArmor,
                npcHealth, npcDamage, npcArmor, Loadout.NONE, Loadout.NONE);
    }

    /**
     * @return the settings {@code reference.conf} ships with
     */
    public static EngineSettings defaults() {
        return new EngineSettings(DespawnStrategy.UNREACHABLE, OccupiedLevelPolicy.KEEP, 2, "stationary",
                1, 10, 0L, 22, 12, 10, 2, 1, 3, 1, 0,
                new Loadout(10, 2, 10, 1, 1, 5), Loadout.NONE);
    }

    /**
     * Reads the settings from an {@code optimax-rogue} config block. Missing keys fall back to
     * {@link #defaults()}.
     *
     * @param config the {@code optimax-rogue} block
     * @throws IllegalArgumentException if a strategy or policy name is unknown
     */
    public static EngineSettings fromConfig(Config config) {
        EngineSettings d = defaults();
        Config engine = config.hasPath("engine") ? config.getConfig("engine") : ConfigFactory.empty();
        Config world = config.hasPath("world") ? config.getConfig("world") : ConfigFactory.empty();
        return new EngineSettings(
                engine.hasPath("despawn-strategy")
                        ? DespawnStrategy.fromName(engine.getString("despawn-strategy")) : d.despawnStrategy(),
                engine.hasPath("occupied-level-policy")
                        ? OccupiedLevelPolicy.fromName(engine.getString("occupied-level-policy")) : d.occupiedLevelPolicy(),
                engine.hasPath("npcs-per-level") ? engine.getInt("npcs-per-level") : d.npcsPerLevel(),
                engine.hasPath("npc-controller") ? engine.getString("npc-controller") : d.npcController(),
                engine.hasPath("kill-bonus.damage") ? engine.getInt("kill-bonus.damage") : d.killBonusDamage(),
                engine.hasPath("kill-bonus.ticks") ? engine.getInt("kill-bonus.ticks") : d.killBonusTicks(),
                engine.hasPath("max-ticks") ? engine.getLong("max-ticks") : d.maxTicks(),
                world.hasPath("width") ? world.getInt("width") : d.dungeonWidth(),
                world.hasPath("height") ? world.getInt("height") : d.dungeonHeight(),
                engine.hasPath("player.health") ? engine.getInt("player.health") : d.playerHealth(),
                engine.hasPath("player.damage") ? engine.getInt("player.damage") : d.playerDamage(),
                engine.hasPath("player.armor") ? engine.getInt("player.armor") : d.playerArmor(),
                engine.hasPath("npc.health") ? engine.getInt("npc.health") : d.npcHealth(),
                engine.hasPath("npc.damage") ? engine.getInt("npc.damage") : d.npcDamage(),
                engine.hasPath("npc.armor") ? engine.getInt("npc.armor") : d.npcArmor(),
                engine.hasPath("player") ? Loadout.fromConfig(engine.getConfig("player"), d.playerLoadout())
                        : d.playerLoadout(),
                engine.hasPath("npc") ? Loadout.fromConfig(engine.getConfig("npc"), d.npcLoadout()) : d.npcLoadout());
    }

    public boolean killRewardEnabled() {
        return killBonusDamage != 0 && killBonusTicks != 0;
    }
}
