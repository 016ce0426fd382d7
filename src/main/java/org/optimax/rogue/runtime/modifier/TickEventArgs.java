package org.optimax.rogue.runtime.modifier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Arguments of {@link ModifierEvent#TICK}. Carries the tick being resolved.
 */
public final class TickEventArgs extends EventArgs {

    @JsonProperty("tick")
    private final long tick;

    @JsonCreator
    public TickEventArgs(@JsonProperty("tick") long tick) {
        this.tick = tick;
    }

    public long getTick() {
        return tick;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof TickEventArgs other && tick == other.tick);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(tick);
    }

    @Override
    public String toString() {
        return "TickEventArgs[tick=" + tick + "]";
    }
}
