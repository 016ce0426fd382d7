package org.optimax.rogue.runtime.model;

/**
 * A cell in the world: the key of the position index.
 *
 * @param depth the dungeon level
 * @param x     the column
 * @param y     the row
 */
public record Position(int depth, int x, int y) {

    /**
     * @param move the move to apply
     * @return the cell reached by applying {@code move} on the same depth
     */
    public Position translate(Move move) {
        return new Position(depth, x + move.dx(), y + move.dy());
    }
}
