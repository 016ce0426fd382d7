package org.optimax.rogue.server.net;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Sent by a lobby connection to claim a player slot with that player's shared secret.
 */
public final class IdentifyPacket extends Packet {

    @JsonProperty("secret")
    private final String secret;

    @JsonCreator
    public IdentifyPacket(@JsonProperty("secret") String secret) {
        this.secret = Objects.requireNonNull(secret, "secret");
    }

    public String getSecret() {
        return secret;
    }

    @Override
    public String toString() {
        return "IdentifyPacket[***]";
    }
}
