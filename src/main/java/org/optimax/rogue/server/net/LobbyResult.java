package org.optimax.rogue.server.net;

/**
 * The state of the pre-match lobby.
 */
public enum LobbyResult {
    /** Still waiting for players. */
    IN_PROGRESS,
    /** A player disconnected before the match started. */
    SETUP_FAILED,
    /** Both players are identified; the match starts. */
    READY
}
