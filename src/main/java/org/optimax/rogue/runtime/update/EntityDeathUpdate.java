package org.optimax.rogue.runtime.update;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.model.GameState;

import java.util.Objects;

/**
 * An entity dies and leaves the state.
 */
public final class EntityDeathUpdate extends GameStateUpdate {

    @JsonProperty("entityId")
    private final int entityId;
    @JsonProperty("depth")
    private final int depth;

    @JsonCreator
    public EntityDeathUpdate(@JsonProperty("order") long order,
                             @JsonProperty("entityId") int entityId,
                             @JsonProperty("depth") int depth) {
        super(order);
        this.entityId = entityId;
        this.depth = depth;
    }

    public int getEntityId() {
        return entityId;
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public void apply(GameState state) {
        requireEntity(state, entityId);
        state.removeEntity(entityId);
    }

    @Override
    public boolean relevantFor(GameState state, int viewerDepth) {
        return depth == viewerDepth;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof EntityDeathUpdate other
                && getOrder() == other.getOrder() && entityId == other.entityId && depth == other.depth);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getOrder(), entityId, depth);
    }

    @Override
    public String toString() {
        return "EntityDeathUpdate#" + getOrder() + "[entity=" + entityId + ", depth=" + depth + "]";
    }
}
