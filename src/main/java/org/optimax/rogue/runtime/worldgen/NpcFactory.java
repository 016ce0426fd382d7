package org.optimax.rogue.runtime.worldgen;

import org.optimax.rogue.runtime.Loadout;
import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.Position;

/**
 * Builds NPC entities with the configured base stats and loadout.
 */
public final class NpcFactory {

    private final int health;
    private final int damage;
    private final int armor;
    private final Loadout loadout;

    public NpcFactory(int health, int damage, int armor, Loadout loadout) {
        if (health <= 0) {
            throw new IllegalArgumentException("NPC health must be positive, got " + health);
        }
        this.health = health;
        this.damage = damage;
        this.armor = armor;
        this.loadout = loadout;
    }

    public Entity create(int id, Position position) {
        return loadout.equip(new Entity(id, position, health, damage, armor));
    }
}
