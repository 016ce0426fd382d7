package org.optimax.rogue.runtime.worldgen;

import org.optimax.rogue.runtime.model.Dungeon;
import org.optimax.rogue.runtime.model.Tile;
import org.optimax.rogue.runtime.spi.IDungeonGenerator;
import org.optimax.rogue.runtime.spi.IRandomProvider;

/**
 * Generates open rooms: ground surrounded by walls with one staircase down at a random
 * interior cell.
 */
public class EmptyDungeonGenerator implements IDungeonGenerator {

    private final int width;
    private final int height;
    private final IRandomProvider random;

    /**
     * @param width  dungeon width, at least 4 so a staircase and a free ground tile fit
     * @param height dungeon height, at least 3
     * @param random the stream staircase positions are drawn from
     */
    public EmptyDungeonGenerator(int width, int height, IRandomProvider random) {
        if (width < 4 || height < 3) {
            throw new IllegalArgumentException("Dungeons must be at least 4x3, got " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.random = random;
    }

    @Override
    public Dungeon spawnDungeon(int depth) {
        int sx = 1 + random.nextInt(width - 2);
        int sy = 1 + random.nextInt(height - 2);
        return Dungeon.walledRoom(width, height).withTile(sx, sy, Tile.STAIRCASE_DOWN);
    }
}
