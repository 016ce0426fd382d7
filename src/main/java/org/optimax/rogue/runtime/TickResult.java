package org.optimax.rogue.runtime;

import org.optimax.rogue.runtime.update.GameStateUpdate;

import java.util.List;
import java.util.Map;

/**
 * Everything one call to {@link Updater#resolveTick} produced.
 *
 * @param outcome     the match state after the tick
 * @param updates     the records emitted, in ascending order
 * @param resolutions how each entity's move was resolved, by entity id
 * @param initiative  the entity ids in the order they resolved
 */
public record TickResult(TickOutcome outcome,
                         List<GameStateUpdate> updates,
                         Map<Integer, MoveResolution> resolutions,
                         List<Integer> initiative) {

    public TickResult {
        updates = List.copyOf(updates);
        resolutions = Map.copyOf(resolutions);
        initiative = List.copyOf(initiative);
    }
}
