package org.optimax.rogue.runtime.update;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;

import java.util.Objects;

/**
 * An entity appears. The record owns a snapshot of the entity; every apply inserts a fresh copy.
 */
public final class EntitySpawnUpdate extends GameStateUpdate {

    @JsonProperty("entity")
    private final Entity entity;

    @JsonCreator
    public EntitySpawnUpdate(@JsonProperty("order") long order,
                             @JsonProperty("entity") Entity entity) {
        super(order);
        this.entity = entity.copy();
    }

    public Entity getEntity() {
        return entity;
    }

    @Override
    public void apply(GameState state) {
        if (state.findEntity(entity.getId()) != null) {
            throw new DesyncException(getOrder(), "entity " + entity.getId() + " already exists");
        }
        if (state.entityAt(entity.getPosition()) != null) {
            throw new DesyncException(getOrder(), "spawn cell " + entity.getPosition() + " is occupied");
        }
        Entity copy = entity.copy();
        copy.refreshAttributes();
        state.addEntity(copy);
    }

    @Override
    public boolean relevantFor(GameState state, int depth) {
        return entity.getDepth() == depth;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof EntitySpawnUpdate other
                && getOrder() == other.getOrder() && entity.equals(other.entity));
    }

    @Override
    public int hashCode() {
        return Objects.hash(getOrder(), entity);
    }

    @Override
    public String toString() {
        return "EntitySpawnUpdate#" + getOrder() + "[" + entity + "]";
    }
}
