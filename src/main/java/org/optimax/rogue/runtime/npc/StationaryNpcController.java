package org.optimax.rogue.runtime.npc;

import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;
import org.optimax.rogue.runtime.model.Move;
import org.optimax.rogue.runtime.spi.INpcController;

/**
 * NPCs never move.
 */
public final class StationaryNpcController implements INpcController {

    @Override
    public Move decide(GameState state, Entity npc) {
        return Move.STAY;
    }
}
