package org.optimax.rogue.server.net;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.update.GameStateUpdate;

import java.util.Objects;

/**
 * Carries one record of the update log.
 */
public final class UpdatePacket extends Packet {

    @JsonProperty("update")
    private final GameStateUpdate update;

    @JsonCreator
    public UpdatePacket(@JsonProperty("update") GameStateUpdate update) {
        this.update = Objects.requireNonNull(update, "update");
    }

    public GameStateUpdate getUpdate() {
        return update;
    }

    @Override
    public String toString() {
        return "UpdatePacket[" + update + "]";
    }
}
