package org.optimax.rogue.runtime.modifier;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;
import org.optimax.rogue.runtime.spi.IRandomProvider;

/**
 * Something attached to an entity that changes its stats and may react to events.
 * <p>
 * Every event runs in three phases:
 * <ol>
 *   <li>{@link #preEvent} runs on the server only. It is the only phase that may draw
 *       randomness. Its return value, the <em>preval</em>, is shipped to clients.</li>
 *   <li>{@link #onEvent} must be deterministic given the arguments and the preval. It is the
 *       only phase that may change the outcome, by returning changed arguments.</li>
 *   <li>{@link #postEvent} is deterministic and sees the final outcome.</li>
 * </ol>
 * {@link #handles(ModifierEvent)} lets the pipeline skip modifiers that ignore an event. A
 * skipped modifier gets a preval of 0, so skipping must behave exactly like running the default
 * no-op phases.
 * <p>
 * A modifier belongs to exactly one entity. {@link #copy()} must return an independent
 * instance including any mutable counters.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
public abstract class Modifier {

    public int getFlatMaxHealth() {
        return 0;
    }

    public int getFlatDamage() {
        return 0;
    }

    public int getFlatArmor() {
        return 0;
    }

    /**
     * @return true if this modifier wants to take part in {@code event}
     */
    public boolean handles(ModifierEvent event) {
        return false;
    }

    /**
     * Server-side pre-phase.
     *
     * @return the preval handed to the later phases of this modifier
     */
    public int preEvent(ModifierEvent event, GameState state, Entity parent, EventArgs args, IRandomProvider random) {
        return 0;
    }

    /**
     * Deterministic on-phase.
     *
     * @return the arguments for the next modifier; {@code args} itself if nothing changed
     */
    public EventArgs onEvent(ModifierEvent event, GameState state, Entity parent, EventArgs args, int preval) {
        return args;
    }

    /**
     * Deterministic post-phase. The outcome is already fixed.
     */
    public void postEvent(ModifierEvent event, GameState state, Entity parent, EventArgs args, int preval) {
    }

    /**
     * @return true once the engine should detach this modifier
     */
    public boolean isExpired() {
        return false;
    }

    public abstract Modifier copy();
}
