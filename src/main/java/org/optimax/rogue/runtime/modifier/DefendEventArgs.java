package org.optimax.rogue.runtime.modifier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Arguments of {@link ModifierEvent#PARENT_DEFEND}.
 */
public final class DefendEventArgs extends EventArgs {

    @JsonProperty("attackerId")
    private final int attackerId;
    @JsonProperty("result")
    private final AttackResult result;

    @JsonCreator
    public DefendEventArgs(@JsonProperty("attackerId") int attackerId,
                           @JsonProperty("result") AttackResult result) {
        this.attackerId = attackerId;
        this.result = Objects.requireNonNull(result, "result");
    }

    public int getAttackerId() {
        return attackerId;
    }

    public AttackResult getResult() {
        return result;
    }

    public DefendEventArgs withResult(AttackResult newResult) {
        return new DefendEventArgs(attackerId, newResult);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof DefendEventArgs other
                && attackerId == other.attackerId && result.equals(other.result));
    }

    @Override
    public int hashCode() {
        return Objects.hash(attackerId, result);
    }

    @Override
    public String toString() {
        return "DefendEventArgs[attacker=" + attackerId + ", " + result + "]";
    }
}
