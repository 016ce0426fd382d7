package org.optimax.rogue.server.net;

/**
 * Sent before the records of a tick. Clients refresh derived attributes on receipt.
 */
public final class TickStartPacket extends Packet {

    @Override
    public String toString() {
        return "TickStartPacket";
    }
}
