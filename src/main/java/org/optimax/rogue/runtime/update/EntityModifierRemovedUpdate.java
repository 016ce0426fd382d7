package org.optimax.rogue.runtime.update;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;

import java.util.Objects;

/**
 * Detaches the modifier at {@code index} from an entity.
 */
public final class EntityModifierRemovedUpdate extends GameStateUpdate {

    @JsonProperty("entityId")
    private final int entityId;
    @JsonProperty("depth")
    private final int depth;
    @JsonProperty("index")
    private final int index;

    @JsonCreator
    public EntityModifierRemovedUpdate(@JsonProperty("order") long order,
                                       @JsonProperty("entityId") int entityId,
                                       @JsonProperty("depth") int depth,
                                       @JsonProperty("index") int index) {
        super(order);
        this.entityId = entityId;
        this.depth = depth;
        this.index = index;
    }

    public int getEntityId() {
        return entityId;
    }

    public int getDepth() {
        return depth;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public void apply(GameState state) {
        Entity entity = requireEntity(state, entityId);
        requireModifier(entity, index);
        entity.detachModifier(index);
    }

    @Override
    public boolean relevantFor(GameState state, int viewerDepth) {
        return depth == viewerDepth;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof EntityModifierRemovedUpdate other && getOrder() == other.getOrder()
                && entityId == other.entityId && depth == other.depth && index == other.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getOrder(), entityId, depth, index);
    }

    @Override
    public String toString() {
        return "EntityModifierRemovedUpdate#" + getOrder() + "[entity=" + entityId + ", index=" + index + "]";
    }
}
