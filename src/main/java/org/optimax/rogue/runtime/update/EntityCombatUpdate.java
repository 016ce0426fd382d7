package org.optimax.rogue.runtime.update;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;
import org.optimax.rogue.runtime.modifier.AttackResult;
import org.optimax.rogue.runtime.modifier.CombatFlag;
import org.optimax.rogue.runtime.modifier.ModifierPipeline;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One attack. The record carries the base damage before any modifier ran; applying it re-runs
 * the on- and post-phases of both sides with the recorded prevals and subtracts the final
 * damage from the defender if it is positive.
 */
public final class EntityCombatUpdate extends GameStateUpdate {

    @JsonProperty("attackerId")
    private final int attackerId;
    @JsonProperty("defenderId")
    private final int defenderId;
    @JsonProperty("depth")
    private final int depth;
    @JsonProperty("baseDamage")
    private final int baseDamage;
    @JsonProperty("flags")
    private final Set<CombatFlag> flags;
    @JsonProperty("attackPrevals")
    private final int[] attackPrevals;
    @JsonProperty("defendPrevals")
    private final int[] defendPrevals;

    @JsonCreator
    public EntityCombatUpdate(@JsonProperty("order") long order,
                              @JsonProperty("attackerId") int attackerId,
                              @JsonProperty("defenderId") int defenderId,
                              @JsonProperty("depth") int depth,
                              @JsonProperty("baseDamage") int baseDamage,
                              @JsonProperty("flags") Collection<CombatFlag> flags,
                              @JsonProperty("attackPrevals") int[] attackPrevals,
                              @JsonProperty("defendPrevals") int[] defendPrevals) {
        super(order);
        this.attackerId = attackerId;
        this.defenderId = defenderId;
        this.depth = depth;
        this.baseDamage = baseDamage;
        this.flags = flags == null || flags.isEmpty() ? EnumSet.noneOf(CombatFlag.class) : EnumSet.copyOf(flags);
        this.attackPrevals = attackPrevals == null ? new int[0] : attackPrevals.clone();
        this.defendPrevals = defendPrevals == null ? new int[0] : defendPrevals.clone();
    }

    public int getAttackerId() {
        return attackerId;
    }

    public int getDefenderId() {
        return defenderId;
    }

    public int getDepth() {
        return depth;
    }

    public int getBaseDamage() {
        return baseDamage;
    }

    public Set<CombatFlag> getFlags() {
        return Collections.unmodifiableSet(flags);
    }

    public int[] getAttackPrevals() {
        return attackPrevals.clone();
    }

    public int[] getDefendPrevals() {
        return defendPrevals.clone();
    }

    @Override
    public void apply(GameState state) {
        resolve(state);
    }

    /**
     * Applies the record and reports the result the pipeline produced.
     *
     * @return the final attack result
     */
    public AttackResult resolve(GameState state) {
        Entity attacker = requireEntity(state, attackerId);
        Entity defender = requireEntity(state, defenderId);
        requirePrevals(attacker, attackPrevals);
        requirePrevals(defender, defendPrevals);

        AttackResult result = ModifierPipeline.resolveCombat(state, attacker, defender,
                new AttackResult(baseDamage, flags), attackPrevals, defendPrevals);
        if (result.getDamage() > 0) {
            defender.setHealth(defender.getHealth() - result.getDamage());
        }
        return result;
    }

    @Override
    public boolean relevantFor(GameState state, int viewerDepth) {
        return depth == viewerDepth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityCombatUpdate other)) return false;
        return getOrder() == other.getOrder() && attackerId == other.attackerId && defenderId == other.defenderId
                && depth == other.depth && baseDamage == other.baseDamage && flags.equals(other.flags)
                && Arrays.equals(attackPrevals, other.attackPrevals)
                && Arrays.equals(defendPrevals, other.defendPrevals);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(getOrder(), attackerId, defenderId, depth, baseDamage, flags);
        h = 31 * h + Arrays.hashCode(attackPrevals);
        return 31 * h + Arrays.hashCode(defendPrevals);
    }

    @Override
    public String toString() {
        return "EntityCombatUpdate#" + getOrder() + "[" + attackerId + " -> " + defenderId + ", base=" + baseDamage
                + ", flags=" + flags + "]";
    }
}
