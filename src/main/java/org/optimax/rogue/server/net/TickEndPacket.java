package org.optimax.rogue.server.net;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.TickOutcome;

import java.util.Objects;

/**
 * Sent after the records of a tick. The server accepts moves for the next tick from now on.
 */
public final class TickEndPacket extends Packet {

    @JsonProperty("outcome")
    private final TickOutcome outcome;

    @JsonCreator
    public TickEndPacket(@JsonProperty("outcome") TickOutcome outcome) {
        this.outcome = Objects.requireNonNull(outcome, "outcome");
    }

    public TickOutcome getOutcome() {
        return outcome;
    }

    @Override
    public String toString() {
        return "TickEndPacket[" + outcome + "]";
    }
}
