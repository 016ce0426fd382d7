package org.optimax.rogue.runtime.modifier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Arguments of {@link ModifierEvent#PARENT_ATTACK}.
 */
public final class AttackEventArgs extends EventArgs {

    @JsonProperty("defenderId")
    private final int defenderId;
    @JsonProperty("result")
    private final AttackResult result;

    @JsonCreator
    public AttackEventArgs(@JsonProperty("defenderId") int defenderId,
                           @JsonProperty("result") AttackResult result) {
        this.defenderId = defenderId;
        this.result = Objects.requireNonNull(result, "result");
    }

    public int getDefenderId() {
        return defenderId;
    }

    public AttackResult getResult() {
        return result;
    }

    public AttackEventArgs withResult(AttackResult newResult) {
        return new AttackEventArgs(defenderId, newResult);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof AttackEventArgs other
                && defenderId == other.defenderId && result.equals(other.result));
    }

    @Override
    public int hashCode() {
        return Objects.hash(defenderId, result);
    }

    @Override
    public String toString() {
        return "AttackEventArgs[defender=" + defenderId + ", " + result + "]";
    }
}
