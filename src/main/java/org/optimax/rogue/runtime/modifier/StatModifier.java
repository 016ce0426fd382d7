package org.optimax.rogue.runtime.modifier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;

import java.util.Objects;

/**
 * Flat stat deltas, either permanent or for a limited number of ticks.
 * <p>
 * A timed modifier counts its elapsed ticks in the on-phase of {@link ModifierEvent#TICK}, so
 * clients replaying the tick record reach the same count.
 */
public final class StatModifier extends Modifier {

    @JsonProperty("maxHealth")
    private final int maxHealth;
    @JsonProperty("damage")
    private final int damage;
    @JsonProperty("armor")
    private final int armor;
    @JsonProperty("durationTicks")
    private final int durationTicks;
    @JsonProperty("elapsedTicks")
    private int elapsedTicks;

    @JsonCreator
    public StatModifier(@JsonProperty("maxHealth") int maxHealth,
                        @JsonProperty("damage") int damage,
                        @JsonProperty("armor") int armor,
                        @JsonProperty("durationTicks") int durationTicks,
                        @JsonProperty("elapsedTicks") int elapsedTicks) {
        this.maxHealth = maxHealth;
        this.damage = damage;
        this.armor = armor;
        this.durationTicks = durationTicks;
        this.elapsedTicks = elapsedTicks;
    }

    /**
     * @param durationTicks number of ticks the deltas last; 0 or less is permanent
     */
    public StatModifier(int maxHealth, int damage, int armor, int durationTicks) {
        this(maxHealth, damage, armor, durationTicks, 0);
    }

    public static StatModifier permanent(int maxHealth, int damage, int armor) {
        return new StatModifier(maxHealth, damage, armor, 0);
    }

    @Override
    public int getFlatMaxHealth() {
        return maxHealth;
    }

    @Override
    public int getFlatDamage() {
        return damage;
    }

    @Override
    public int getFlatArmor() {
        return armor;
    }

    public int getDurationTicks() {
        return durationTicks;
    }

    public int getElapsedTicks() {
        return elapsedTicks;
    }

    public boolean isPermanent() {
        return durationTicks <= 0;
    }

    @Override
    public boolean handles(ModifierEvent event) {
        return event == ModifierEvent.TICK && !isPermanent();
    }

    @Override
    public EventArgs onEvent(ModifierEvent event, GameState state, Entity parent, EventArgs args, int preval) {
        if (event == ModifierEvent.TICK && !isPermanent()) {
            elapsedTicks++;
        }
        return args;
    }

    @Override
    public boolean isExpired() {
        return !isPermanent() && elapsedTicks >= durationTicks;
    }

    @Override
    public StatModifier copy() {
        return new StatModifier(maxHealth, damage, armor, durationTicks, elapsedTicks);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatModifier other)) return false;
        return maxHealth == other.maxHealth && damage == other.damage && armor == other.armor
                && durationTicks == other.durationTicks && elapsedTicks == other.elapsedTicks;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxHealth, damage, armor, durationTicks, elapsedTicks);
    }

    @Override
    public String toString() {
        return "StatModifier[+" + maxHealth + "hp +" + damage + "dmg +" + armor + "arm"
                + (isPermanent() ? "" : ", " + elapsedTicks + "/" + durationTicks + " ticks") + "]";
    }
}
