package org.optimax.rogue.runtime.update;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;
import org.optimax.rogue.runtime.modifier.Modifier;

/**
 * One immutable entry of the update log.
 * <p>
 * The server applies every record to its authoritative state as it emits it, and clients
 * apply the same records to their views in ascending {@link #getOrder() order}. Applying a
 * record never draws randomness, so both sides reach the same state.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
public abstract class GameStateUpdate {

    @JsonProperty("order")
    private final long order;

    protected GameStateUpdate(long order) {
        this.order = order;
    }

    /**
     * @return the position of this record in the log; strictly increasing per match
     */
    public long getOrder() {
        return order;
    }

    /**
     * Applies this record.
     *
     * @throws DesyncException if {@code state} lacks something the record refers to
     */
    public abstract void apply(GameState state);

    /**
     * Decides whether a viewer located at {@code depth} needs this record. Must not modify
     * {@code state}.
     */
    public abstract boolean relevantFor(GameState state, int depth);

    protected Entity requireEntity(GameState state, int entityId) {
        Entity entity = state.findEntity(entityId);
        if (entity == null) {
            throw new DesyncException(order, "unknown entity " + entityId);
        }
        return entity;
    }

    protected Modifier requireModifier(Entity entity, int index) {
        if (index < 0 || index >= entity.getModifiers().size()) {
            throw new DesyncException(order, "entity " + entity.getId() + " has no modifier at index " + index);
        }
        return entity.getModifiers().get(index);
    }

    protected void requirePrevals(Entity entity, int[] prevals) {
        if (prevals.length != entity.getModifiers().size()) {
            throw new DesyncException(order, "entity " + entity.getId() + " has " + entity.getModifiers().size()
                    + " modifiers but the record carries " + prevals.length + " prevals");
        }
    }
}
