package org.optimax.rogue.runtime.modifier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;
import org.optimax.rogue.runtime.spi.IRandomProvider;

import java.util.Objects;

/**
 * Reduces incoming damage by a fixed amount with a given chance. Damage never drops below 0.
 */
public final class ShieldModifier extends Modifier {

    @JsonProperty("chancePercent")
    private final int chancePercent;
    @JsonProperty("reduction")
    private final int reduction;

    @JsonCreator
    public ShieldModifier(@JsonProperty("chancePercent") int chancePercent,
                          @JsonProperty("reduction") int reduction) {
        if (chancePercent < 0 || chancePercent > 100) {
            throw new IllegalArgumentException("chancePercent must be within 0..100, got " + chancePercent);
        }
        this.chancePercent = chancePercent;
        this.reduction = reduction;
    }

    @Override
    public boolean handles(ModifierEvent event) {
        return event == ModifierEvent.PARENT_DEFEND;
    }

    @Override
    public int preEvent(ModifierEvent event, GameState state, Entity parent, EventArgs args, IRandomProvider random) {
        return random.nextInt(100);
    }

    @Override
    public EventArgs onEvent(ModifierEvent event, GameState state, Entity parent, EventArgs args, int preval) {
        DefendEventArgs defend = (DefendEventArgs) args;
        if (preval >= chancePercent) {
            return defend;
        }
        AttackResult result = defend.getResult();
        return defend.withResult(result.withDamage(Math.max(0, result.getDamage() - reduction)));
    }

    @Override
    public ShieldModifier copy() {
        return new ShieldModifier(chancePercent, reduction);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ShieldModifier other
                && chancePercent == other.chancePercent && reduction == other.reduction);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chancePercent, reduction);
    }

    @Override
    public String toString() {
        return "ShieldModifier[" + chancePercent + "% -" + reduction + "]";
    }
}
