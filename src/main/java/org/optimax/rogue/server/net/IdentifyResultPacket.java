package org.optimax.rogue.server.net;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Answer to an {@link IdentifyPacket}: the player id the connection now controls, or
 * {@code null} if the secret matched no free slot.
 */
public final class IdentifyResultPacket extends Packet {

    @JsonProperty("playerId")
    private final Integer playerId;

    @JsonCreator
    public IdentifyResultPacket(@JsonProperty("playerId") Integer playerId) {
        this.playerId = playerId;
    }

    public Integer getPlayerId() {
        return playerId;
    }

    @Override
    public String toString() {
        return "IdentifyResultPacket[player=" + playerId + "]";
    }
}
