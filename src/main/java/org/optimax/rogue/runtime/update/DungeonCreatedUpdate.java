package org.optimax.rogue.runtime.update;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.model.Dungeon;
import org.optimax.rogue.runtime.model.GameState;

import java.util.Objects;

/**
 * A newly generated dungeon is stored at {@code depth}.
 */
public final class DungeonCreatedUpdate extends GameStateUpdate {

    @JsonProperty("depth")
    private final int depth;
    @JsonProperty("dungeon")
    private final Dungeon dungeon;

    @JsonCreator
    public DungeonCreatedUpdate(@JsonProperty("order") long order,
                                @JsonProperty("depth") int depth,
                                @JsonProperty("dungeon") Dungeon dungeon) {
        super(order);
        this.depth = depth;
        this.dungeon = Objects.requireNonNull(dungeon, "dungeon");
    }

    public int getDepth() {
        return depth;
    }

    public Dungeon getDungeon() {
        return dungeon;
    }

    @Override
    public void apply(GameState state) {
        state.getWorld().set(depth, dungeon);
    }

    @Override
    public boolean relevantFor(GameState state, int viewerDepth) {
        return depth == viewerDepth;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof DungeonCreatedUpdate other && getOrder() == other.getOrder()
                && depth == other.depth && dungeon.equals(other.dungeon));
    }

    @Override
    public int hashCode() {
        return Objects.hash(getOrder(), depth, dungeon);
    }

    @Override
    public String toString() {
        return "DungeonCreatedUpdate#" + getOrder() + "[depth=" + depth + ", " + dungeon + "]";
    }
}
