package org.optimax.rogue.server.net;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Tells every lobby connection that the lobby closed.
 */
public final class LobbyChangePacket extends Packet {

    @JsonProperty("result")
    private final LobbyResult result;

    @JsonCreator
    public LobbyChangePacket(@JsonProperty("result") LobbyResult result) {
        this.result = Objects.requireNonNull(result, "result");
    }

    public LobbyResult getResult() {
        return result;
    }

    @Override
    public String toString() {
        return "LobbyChangePacket[" + result + "]";
    }
}
