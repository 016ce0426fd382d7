package org.optimax.rogue.runtime.spi;

import org.optimax.rogue.runtime.model.GameState;

/**
 * Builds the authoritative state a match starts from.
 */
public interface IStartGenerator {

    /**
     * @return a fresh authoritative state at tick 0 holding both players
     */
    GameState createInitialState();
}
