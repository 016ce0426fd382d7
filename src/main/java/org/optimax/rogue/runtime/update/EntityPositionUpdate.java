package org.optimax.rogue.runtime.update;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;

import java.util.Objects;

/**
 * An entity moves to a new cell, possibly on another depth.
 * <p>
 * A view that does not hold the destination dungeon drops the entity instead: it left the
 * part of the world the viewer can see.
 */
public final class EntityPositionUpdate extends GameStateUpdate {

    @JsonProperty("entityId")
    private final int entityId;
    @JsonProperty("fromDepth")
    private final int fromDepth;
    @JsonProperty("depth")
    private final int depth;
    @JsonProperty("x")
    private final int x;
    @JsonProperty("y")
    private final int y;
    @JsonProperty("depthChanged")
    private final boolean depthChanged;

    @JsonCreator
    public EntityPositionUpdate(@JsonProperty("order") long order,
                                @JsonProperty("entityId") int entityId,
                                @JsonProperty("fromDepth") int fromDepth,
                                @JsonProperty("depth") int depth,
                                @JsonProperty("x") int x,
                                @JsonProperty("y") int y,
                                @JsonProperty("depthChanged") boolean depthChanged) {
        super(order);
        this.entityId = entityId;
        this.fromDepth = fromDepth;
        this.depth = depth;
        this.x = x;
        this.y = y;
        this.depthChanged = depthChanged;
    }

    public int getEntityId() {
        return entityId;
    }

    public int getFromDepth() {
        return fromDepth;
    }

    public int getDepth() {
        return depth;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public boolean isDepthChanged() {
        return depthChanged;
    }

    @Override
    public void apply(GameState state) {
        Entity entity = requireEntity(state, entityId);
        if (!state.isAuthoritative() && !state.getWorld().has(depth)) {
            state.removeEntity(entity.getId());
            return;
        }
        Entity occupant = state.entityAt(depth, x, y);
        if (occupant != null && occupant != entity) {
            throw new DesyncException(getOrder(), "destination " + depth + "/" + x + "," + y
                    + " is occupied by entity " + occupant.getId());
        }
        state.moveEntity(entityId, depth, x, y);
    }

    @Override
    public boolean relevantFor(GameState state, int viewerDepth) {
        return depth == viewerDepth || (depthChanged && fromDepth == viewerDepth);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityPositionUpdate other)) return false;
        return getOrder() == other.getOrder() && entityId == other.entityId && fromDepth == other.fromDepth
                && depth == other.depth && x == other.x && y == other.y && depthChanged == other.depthChanged;
    }

    @Override
    public int hashCode() {
        return Objects.hash(getOrder(), entityId, fromDepth, depth, x, y, depthChanged);
    }

    @Override
    public String toString() {
        return "EntityPositionUpdate#" + getOrder() + "[entity=" + entityId + " -> " + depth + "/" + x + "," + y
                + (depthChanged ? ", from depth " + fromDepth : "") + "]";
    }
}
