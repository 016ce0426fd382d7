package org.optimax.rogue.runtime.update;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.model.GameState;
import org.optimax.rogue.runtime.modifier.Modifier;

import java.util.Objects;

/**
 * Attaches a copy of {@code modifier} at the end of an entity's modifier list.
 */
public final class EntityModifierAddedUpdate extends GameStateUpdate {

    @JsonProperty("entityId")
    private final int entityId;
    @JsonProperty("depth")
    private final int depth;
    @JsonProperty("modifier")
    private final Modifier modifier;

    @JsonCreator
    public EntityModifierAddedUpdate(@JsonProperty("order") long order,
                                     @JsonProperty("entityId") int entityId,
                                     @JsonProperty("depth") int depth,
                                     @JsonProperty("modifier") Modifier modifier) {
        super(order);
        this.entityId = entityId;
        this.depth = depth;
        this.modifier = modifier.copy();
    }

    public int getEntityId() {
        return entityId;
    }

    public int getDepth() {
        return depth;
    }

    public Modifier getModifier() {
        return modifier;
    }

    @Override
    public void apply(GameState state) {
        requireEntity(state, entityId).attachModifier(modifier.copy());
    }

    @Override
    public boolean relevantFor(GameState state, int viewerDepth) {
        return depth == viewerDepth;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof EntityModifierAddedUpdate other && getOrder() == other.getOrder()
                && entityId == other.entityId && depth == other.depth && modifier.equals(other.modifier));
    }

    @Override
    public int hashCode() {
        return Objects.hash(getOrder(), entityId, depth, modifier);
    }

    @Override
    public String toString() {
        return "EntityModifierAddedUpdate#" + getOrder() + "[entity=" + entityId + ", " + modifier + "]";
    }
}
