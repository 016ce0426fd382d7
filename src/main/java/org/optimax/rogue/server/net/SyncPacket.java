package org.optimax.rogue.server.net;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.model.GameState;

import java.util.Objects;

/**
 * A complete view for a client, replacing whatever it held. {@code playerId} is the entity the
 * client controls, or {@code null} for a spectator.
 */
public final class SyncPacket extends Packet {

    @JsonProperty("state")
    private final GameState state;
    @JsonProperty("playerId")
    private final Integer playerId;

    @JsonCreator
    public SyncPacket(@JsonProperty("state") GameState state,
                      @JsonProperty("playerId") Integer playerId) {
        this.state = Objects.requireNonNull(state, "state");
        this.playerId = playerId;
    }

    public GameState getState() {
        return state;
    }

    public Integer getPlayerId() {
        return playerId;
    }

    @Override
    public String toString() {
        return "SyncPacket[" + state + ", player=" + playerId + "]";
    }
}
