package org.optimax.rogue.runtime.update;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.model.GameState;

import java.util.Objects;

/**
 * The last record of every tick: sets the tick counter. Relevant for every viewer.
 */
public final class TickAdvancedUpdate extends GameStateUpdate {

    @JsonProperty("tick")
    private final long tick;

    @JsonCreator
    public TickAdvancedUpdate(@JsonProperty("order") long order,
                              @JsonProperty("tick") long tick) {
        super(order);
        this.tick = tick;
    }

    public long getTick() {
        return tick;
    }

    @Override
    public void apply(GameState state) {
        state.setTick(tick);
    }

    @Override
    public boolean relevantFor(GameState state, int viewerDepth) {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof TickAdvancedUpdate other
                && getOrder() == other.getOrder() && tick == other.tick);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getOrder(), tick);
    }

    @Override
    public String toString() {
        return "TickAdvancedUpdate#" + getOrder() + "[tick=" + tick + "]";
    }
}
