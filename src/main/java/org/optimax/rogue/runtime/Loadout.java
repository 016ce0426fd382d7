package org.optimax.rogue.runtime;

import com.typesafe.config.Config;
import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.modifier.CriticalStrikeModifier;
import org.optimax.rogue.runtime.modifier.RegenerationModifier;
import org.optimax.rogue.runtime.modifier.ShieldModifier;

/**
 * Modifiers an entity is equipped with when it enters the world. A zero chance or amount leaves
 * the matching modifier out.
 *
 * @param critChance      percent chance of a critical strike
 * @param critMultiplier  damage multiplier of a critical strike
 * @param shieldChance    percent chance of blocking part of an incoming hit
 * @param shieldReduction damage a successful block takes off
 * @param regenAmount     health regenerated per interval
 * @param regenInterval   ticks between two regenerations
 */
public record Loadout(int critChance,
                      int critMultiplier,
                      int shieldChance,
                      int shieldReduction,
                      int regenAmount,
                      int regenInterval) {

    public static final Loadout NONE = new Loadout(0, 1, 0, 0, 0, 1);

    public Loadout {
        if (critChance < 0 || critChance > 100 || shieldChance < 0 || shieldChance > 100) {
            throw new IllegalArgumentException("Chances must be within 0..100, got crit " + critChance
                    + " and shield " + shieldChance);
        }
        if (regenInterval <= 0) {
            throw new IllegalArgumentException("regen interval must be positive, got " + regenInterval);
        }
    }

    /**
     * Reads a loadout from a {@code player} or {@code npc} block. Missing keys fall back to
     * {@code fallback}.
     */
    public static Loadout fromConfig(Config config, Loadout fallback) {
        return new Loadout(
                config.hasPath("crit.chance") ? config.getInt("crit.chance") : fallback.critChance(),
                config.hasPath("crit.multiplier") ? config.getInt("crit.multiplier") : fallback.critMultiplier(),
                config.hasPath("shield.chance") ? config.getInt("shield.chance") : fallback.shieldChance(),
                config.hasPath("shield.reduction") ? config.getInt("shield.reduction") : fallback.shieldReduction(),
                config.hasPath("regen.amount") ? config.getInt("regen.amount") : fallback.regenAmount(),
                config.hasPath("regen.interval") ? config.getInt("regen.interval") : fallback.regenInterval());
    }

    /**
     * Attaches the enabled modifiers to {@code entity}: critical strike, shield, regeneration.
     */
    public Entity equip(Entity entity) {
        if (critChance > 0) {
            entity.attachModifier(new CriticalStrikeModifier(critChance, critMultiplier));
        }
        if (shieldChance > 0) {
            entity.attachModifier(new ShieldModifier(shieldChance, shieldReduction));
        }
        if (regenAmount > 0) {
            entity.attachModifier(new RegenerationModifier(regenAmount, regenInterval));
        }
        return entity;
    }
}
