package org.optimax.rogue.runtime.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The map of one level of the world. A dungeon never changes after it was generated.
 * <p>
 * Tiles are kept as their byte codes in column-major order ({@code x * height + y}) so the
 * whole grid travels as one binary payload.
 */
public final class Dungeon {

    @JsonProperty("width")
    private final int width;
    @JsonProperty("height")
    private final int height;
    @JsonProperty("tiles")
    private final byte[] tiles;

    /**
     * Creates a dungeon from raw tile codes.
     *
     * @param width  number of columns
     * @param height number of rows
     * @param tiles  {@code width * height} tile codes, column-major; copied
     */
    @JsonCreator
    public Dungeon(@JsonProperty("width") int width,
                   @JsonProperty("height") int height,
                   @JsonProperty("tiles") byte[] tiles) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Dungeon dimensions must be positive, got " + width + "x" + height);
        }
        if (tiles == null || tiles.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " tiles for a "
                    + width + "x" + height + " dungeon");
        }
        for (byte code : tiles) {
            Tile.fromCode(code);
        }
        this.width = width;
        this.height = height;
        this.tiles = Arrays.copyOf(tiles, tiles.length);
    }

    /**
     * Creates an open room: ground everywhere, walls on the border.
     *
     * @param width  number of columns, at least 3
     * @param height number of rows, at least 3
     * @return the room
     */
    public static Dungeon walledRoom(int width, int height) {
        if (width < 3 || height < 3) {
            throw new IllegalArgumentException("A walled room needs at least 3x3 tiles");
        }
        byte[] tiles = new byte[width * height];
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                boolean border = x == 0 || y == 0 || x == width - 1 || y == height - 1;
                tiles[x * height + y] = (border ? Tile.WALL : Tile.GROUND).code();
            }
        }
        return new Dungeon(width, height, tiles);
    }

    /**
     * @return a copy of this dungeon with one tile replaced
     */
    public Dungeon withTile(int x, int y, Tile tile) {
        if (!inBounds(x, y)) {
            throw new IllegalArgumentException("(" + x + "," + y + ") is outside the dungeon");
        }
        byte[] copy = Arrays.copyOf(tiles, tiles.length);
        copy[x * height + y] = tile.code();
        return new Dungeon(width, height, copy);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /**
     * @return the tile at the given cell
     * @throws IllegalArgumentException if the cell is out of bounds
     */
    public Tile getTile(int x, int y) {
        if (!inBounds(x, y)) {
            throw new IllegalArgumentException("(" + x + "," + y + ") is outside the dungeon");
        }
        return Tile.fromCode(tiles[x * height + y]);
    }

    /**
     * Returns true if nothing can stand on the given cell: walls and everything outside the map.
     */
    public boolean isBlocked(int x, int y) {
        return !inBounds(x, y) || tiles[x * height + y] == Tile.WALL.code();
    }

    public boolean isStaircase(int x, int y) {
        return inBounds(x, y) && tiles[x * height + y] == Tile.STAIRCASE_DOWN.code();
    }

    /**
     * Picks a uniformly random ground tile on this dungeon that no entity of {@code state}
     * currently occupies at {@code depth}.
     *
     * @param state  the state whose position index decides occupancy
     * @param depth  the depth this dungeon is stored at
     * @param random the source of the draw
     * @return the chosen cell
     * @throws IllegalStateException if every ground tile is taken
     */
    public Position randomUnoccupiedGround(GameState state, int depth, IRandomProvider random) {
        List<Position> free = new ArrayList<>();
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                if (tiles[x * height + y] == Tile.GROUND.code() && state.entityAt(depth, x, y) == null) {
                    free.add(new Position(depth, x, y));
                }
            }
        }
        if (free.isEmpty()) {
            throw new IllegalStateException("No unoccupied ground left at depth " + depth);
        }
        return free.get(random.nextInt(free.size()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dungeon other)) return false;
        return width == other.width && height == other.height && Arrays.equals(tiles, other.tiles);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(tiles);
    }

    @Override
    public String toString() {
        return "Dungeon[" + width + "x" + height + "]";
    }
}
