package org.optimax.rogue.runtime.update;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;
import org.optimax.rogue.runtime.modifier.EventArgs;
import org.optimax.rogue.runtime.modifier.ModifierEvent;
import org.optimax.rogue.runtime.modifier.ModifierPipeline;

import java.util.Arrays;
import java.util.Objects;

/**
 * A single-entity modifier event. Applying it runs the on- and post-phases of the entity's
 * modifiers with the recorded prevals.
 */
public final class EntityEventUpdate extends GameStateUpdate {

    @JsonProperty("entityId")
    private final int entityId;
    @JsonProperty("depth")
    private final int depth;
    @JsonProperty("event")
    private final ModifierEvent event;
    @JsonProperty("args")
    private final EventArgs args;
    @JsonProperty("prevals")
    private final int[] prevals;

    @JsonCreator
    public EntityEventUpdate(@JsonProperty("order") long order,
                             @JsonProperty("entityId") int entityId,
                             @JsonProperty("depth") int depth,
                             @JsonProperty("event") ModifierEvent event,
                             @JsonProperty("args") EventArgs args,
                             @JsonProperty("prevals") int[] prevals) {
        super(order);
        this.entityId = entityId;
        this.depth = depth;
        this.event = Objects.requireNonNull(event, "event");
        this.args = Objects.requireNonNull(args, "args");
        this.prevals = prevals == null ? new int[0] : prevals.clone();
    }

    public int getEntityId() {
        return entityId;
    }

    public int getDepth() {
        return depth;
    }

    public ModifierEvent getEvent() {
        return event;
    }

    public EventArgs getArgs() {
        return args;
    }

    public int[] getPrevals() {
        return prevals.clone();
    }

    @Override
    public void apply(GameState state) {
        Entity entity = requireEntity(state, entityId);
        requirePrevals(entity, prevals);
        ModifierPipeline.resolveEvent(event, state, entity, args, prevals);
    }

    @Override
    public boolean relevantFor(GameState state, int viewerDepth) {
        return depth == viewerDepth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityEventUpdate other)) return false;
        return getOrder() == other.getOrder() && entityId == other.entityId && depth == other.depth
                && event == other.event && args.equals(other.args) && Arrays.equals(prevals, other.prevals);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(getOrder(), entityId, depth, event, args) + Arrays.hashCode(prevals);
    }

    @Override
    public String toString() {
        return "EntityEventUpdate#" + getOrder() + "[entity=" + entityId + ", " + event + ", " + args
                + ", prevals=" + Arrays.toString(prevals) + "]";
    }
}
