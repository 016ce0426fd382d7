package org.optimax.rogue.runtime.spi;

import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;
import org.optimax.rogue.runtime.model.Move;

/**
 * Chooses the move of an NPC for the current tick. Called on the server only; the returned move
 * is validated like a player's.
 */
@FunctionalInterface
public interface INpcController {

    Move decide(GameState state, Entity npc);
}
