package org.optimax.rogue.runtime.modifier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * The outcome of one attack as it passes through the modifier pipeline: the damage about to
 * be dealt and the flags describing the exchange.
 * <p>
 * Immutable. Modifiers return a changed copy from their on-phase instead of mutating a shared
 * instance.
 */
public final class AttackResult {

    @JsonProperty("damage")
    private final int damage;
    @JsonProperty("flags")
    private final Set<CombatFlag> flags;

    @JsonCreator
    public AttackResult(@JsonProperty("damage") int damage,
                        @JsonProperty("flags") Collection<CombatFlag> flags) {
        this.damage = damage;
        this.flags = flags == null || flags.isEmpty() ? EnumSet.noneOf(CombatFlag.class) : EnumSet.copyOf(flags);
    }

    public AttackResult(int damage, CombatFlag... flags) {
        this(damage, flags.length == 0 ? null : EnumSet.of(flags[0], flags));
    }

    public int getDamage() {
        return damage;
    }

    public Set<CombatFlag> getFlags() {
        return Collections.unmodifiableSet(flags);
    }

    public boolean hasFlag(CombatFlag flag) {
        return flags.contains(flag);
    }

    public AttackResult withDamage(int newDamage) {
        return new AttackResult(newDamage, flags);
    }

    public AttackResult withFlag(CombatFlag flag) {
        EnumSet<CombatFlag> copy = EnumSet.noneOf(CombatFlag.class);
        copy.addAll(flags);
        copy.add(flag);
        return new AttackResult(damage, copy);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof AttackResult other && damage == other.damage && flags.equals(other.flags));
    }

    @Override
    public int hashCode() {
        return Objects.hash(damage, flags);
    }

    @Override
    public String toString() {
        return "AttackResult[damage=" + damage + ", flags=" + flags + "]";
    }
}
