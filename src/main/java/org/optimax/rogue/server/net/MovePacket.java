package org.optimax.rogue.server.net;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.model.Move;

import java.util.Objects;

/**
 * A player's move for the coming tick.
 */
public final class MovePacket extends Packet {

    @JsonProperty("entityId")
    private final int entityId;
    @JsonProperty("move")
    private final Move move;

    @JsonCreator
    public MovePacket(@JsonProperty("entityId") int entityId,
                      @JsonProperty("move") Move move) {
        this.entityId = entityId;
        this.move = Objects.requireNonNull(move, "move");
    }

    public int getEntityId() {
        return entityId;
    }

    public Move getMove() {
        return move;
    }

    @Override
    public String toString() {
        return "MovePacket[entity=" + entityId + ", " + move + "]";
    }
}
