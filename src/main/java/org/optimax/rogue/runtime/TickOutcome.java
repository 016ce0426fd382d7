package org.optimax.rogue.runtime;

/**
 * The state of the match after a tick.
 */
public enum TickOutcome {
    IN_PROGRESS,
    PLAYER1_WIN,
    PLAYER2_WIN,
    TIE;

    public boolean isFinished() {
        return this != IN_PROGRESS;
    }
}
