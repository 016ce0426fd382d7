package org.optimax.rogue.runtime.spi;

import org.optimax.rogue.runtime.model.Dungeon;

/**
 * Creates the dungeon for a depth the first time a player reaches it.
 */
public interface IDungeonGenerator {

    /**
     * @param depth the depth the dungeon will be stored at
     * @return a new dungeon with at least one free ground tile
     */
    Dungeon spawnDungeon(int depth);
}
