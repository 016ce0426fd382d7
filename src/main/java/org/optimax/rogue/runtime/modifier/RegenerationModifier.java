package org.optimax.rogue.runtime.modifier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;

import java.util.Objects;

/**
 * Heals the parent every {@code interval} ticks, up to its effective max health.
 */
public final class RegenerationModifier extends Modifier {

    @JsonProperty("amount")
    private final int amount;
    @JsonProperty("interval")
    private final int interval;

    @JsonCreator
    public RegenerationModifier(@JsonProperty("amount") int amount,
                                @JsonProperty("interval") int interval) {
        if (interval <= 0) {
            throw new IllegalArgumentException("interval must be positive, got " + interval);
        }
        this.amount = amount;
        this.interval = interval;
    }

    @Override
    public boolean handles(ModifierEvent event) {
        return event == ModifierEvent.TICK;
    }

    @Override
    public EventArgs onEvent(ModifierEvent event, GameState state, Entity parent, EventArgs args, int preval) {
        long tick = ((TickEventArgs) args).getTick();
        if (tick % interval == 0 && parent.getHealth() > 0 && parent.getHealth() < parent.getMaxHealth()) {
            parent.setHealth(Math.min(parent.getMaxHealth(), parent.getHealth() + amount));
        }
        return args;
    }

    @Override
    public RegenerationModifier copy() {
        return new RegenerationModifier(amount, interval);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof RegenerationModifier other
                && amount == other.amount && interval == other.interval);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount, interval);
    }

    @Override
    public String toString() {
        return "RegenerationModifier[+" + amount + " every " + interval + "]";
    }
}
