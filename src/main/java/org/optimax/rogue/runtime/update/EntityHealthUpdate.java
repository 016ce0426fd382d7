package org.optimax.rogue.runtime.update;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;

import java.util.Objects;

/**
 * Adds {@code amount} to an entity's health; negative amounts are damage.
 * {@code sourceId} is the entity that caused the change, or 0 if none did.
 */
public final class EntityHealthUpdate extends GameStateUpdate {

    @JsonProperty("entityId")
    private final int entityId;
    @JsonProperty("depth")
    private final int depth;
    @JsonProperty("sourceId")
    private final int sourceId;
    @JsonProperty("amount")
    private final int amount;

    @JsonCreator
    public EntityHealthUpdate(@JsonProperty("order") long order,
                              @JsonProperty("entityId") int entityId,
                              @JsonProperty("depth") int depth,
                              @JsonProperty("sourceId") int sourceId,
                              @JsonProperty("amount") int amount) {
        super(order);
        this.entityId = entityId;
        this.depth = depth;
        this.sourceId = sourceId;
        this.amount = amount;
    }

    public int getEntityId() {
        return entityId;
    }

    public int getDepth() {
        return depth;
    }

    public int getSourceId() {
        return sourceId;
    }

    public int getAmount() {
        return amount;
    }

    @Override
    public void apply(GameState state) {
        Entity entity = requireEntity(state, entityId);
        entity.setHealth(entity.getHealth() + amount);
    }

    @Override
    public boolean relevantFor(GameState state, int viewerDepth) {
        return depth == viewerDepth;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof EntityHealthUpdate other && getOrder() == other.getOrder()
                && entityId == other.entityId && depth == other.depth
                && sourceId == other.sourceId && amount == other.amount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getOrder(), entityId, depth, sourceId, amount);
    }

    @Override
    public String toString() {
        return "EntityHealthUpdate#" + getOrder() + "[entity=" + entityId + ", amount=" + amount
                + ", source=" + sourceId + "]";
    }
}
