package org.optimax.rogue.server.net;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A message between the server and a client. Every packet travels as one frame.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
public abstract class Packet {
}
