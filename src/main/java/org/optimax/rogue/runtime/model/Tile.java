package org.optimax.rogue.runtime.model;

/**
 * The kinds of tile a {@link Dungeon} is made of. Tiles are stored as their byte code.
 */
public enum Tile {
    GROUND((byte) 1),
    WALL((byte) 2),
    STAIRCASE_DOWN((byte) 3);

    private final byte code;

    Tile(byte code) {
        this.code = code;
    }

    public byte code() {
        return code;
    }

    /**
     * Resolves a stored tile code.
     * @param code the byte code
     * @return the matching tile
     * @throws IllegalArgumentException if no tile has this code
     */
    public static Tile fromCode(byte code) {
        for (Tile tile : values()) {
            if (tile.code == code) {
                return tile;
            }
        }
        throw new IllegalArgumentException("Unknown tile code: " + code);
    }
}
