package org.optimax.rogue.runtime.npc;

import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;
import org.optimax.rogue.runtime.model.Move;
import org.optimax.rogue.runtime.spi.INpcController;
import org.optimax.rogue.runtime.spi.IRandomProvider;

/**
 * NPCs pick a uniformly random move every tick, staying included.
 */
public final class WanderingNpcController implements INpcController {

    private static final Move[] MOVES = Move.values();

    private final IRandomProvider random;

    public WanderingNpcController(IRandomProvider random) {
        this.random = random;
    }

    @Override
    public Move decide(GameState state, Entity npc) {
        return MOVES[random.nextInt(MOVES.length)];
    }
}
