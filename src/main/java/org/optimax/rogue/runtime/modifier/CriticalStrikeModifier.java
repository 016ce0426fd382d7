package org.optimax.rogue.runtime.modifier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;
import org.optimax.rogue.runtime.spi.IRandomProvider;

import java.util.Objects;

/**
 * Multiplies the parent's positive attack damage with a given chance.
 * The preval is the percentile roll.
 */
public final class CriticalStrikeModifier extends Modifier {

    @JsonProperty("chancePercent")
    private final int chancePercent;
    @JsonProperty("multiplier")
    private final int multiplier;

    @JsonCreator
    public CriticalStrikeModifier(@JsonProperty("chancePercent") int chancePercent,
                                  @JsonProperty("multiplier") int multiplier) {
        if (chancePercent < 0 || chancePercent > 100) {
            throw new IllegalArgumentException("chancePercent must be within 0..100, got " + chancePercent);
        }
        this.chancePercent = chancePercent;
        this.multiplier = multiplier;
    }

    @Override
    public boolean handles(ModifierEvent event) {
        return event == ModifierEvent.PARENT_ATTACK;
    }

    @Override
    public int preEvent(ModifierEvent event, GameState state, Entity parent, EventArgs args, IRandomProvider random) {
        return random.nextInt(100);
    }

    @Override
    public EventArgs onEvent(ModifierEvent event, GameState state, Entity parent, EventArgs args, int preval) {
        AttackEventArgs attack = (AttackEventArgs) args;
        AttackResult result = attack.getResult();
        if (preval < chancePercent && result.getDamage() > 0) {
            return attack.withResult(result.withDamage(result.getDamage() * multiplier));
        }
        return attack;
    }

    @Override
    public CriticalStrikeModifier copy() {
        return new CriticalStrikeModifier(chancePercent, multiplier);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof CriticalStrikeModifier other
                && chancePercent == other.chancePercent && multiplier == other.multiplier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chancePercent, multiplier);
    }

    @Override
    public String toString() {
        return "CriticalStrikeModifier[" + chancePercent + "% x" + multiplier + "]";
    }
}
