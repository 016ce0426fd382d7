package org.optimax.rogue.runtime.update;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.model.GameState;

import java.util.Objects;

/**
 * The dungeon at {@code depth} is dropped from the world.
 */
public final class DungeonDespawnedUpdate extends GameStateUpdate {

    @JsonProperty("depth")
    private final int depth;

    @JsonCreator
    public DungeonDespawnedUpdate(@JsonProperty("order") long order,
                                  @JsonProperty("depth") int depth) {
        super(order);
        this.depth = depth;
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public void apply(GameState state) {
        if (!state.entitiesOn(depth).isEmpty()) {
            throw new DesyncException(getOrder(), "depth " + depth + " is despawned while entities remain on it");
        }
        state.getWorld().remove(depth);
    }

    @Override
    public boolean relevantFor(GameState state, int viewerDepth) {
        return depth == viewerDepth;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof DungeonDespawnedUpdate other
                && getOrder() == other.getOrder() && depth == other.depth);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getOrder(), depth);
    }

    @Override
    public String toString() {
        return "DungeonDespawnedUpdate#" + getOrder() + "[depth=" + depth + "]";
    }
}
