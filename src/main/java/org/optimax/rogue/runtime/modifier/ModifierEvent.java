package org.optimax.rogue.runtime.modifier;

/**
 * The closed set of events a {@link Modifier} can react to.
 */
public enum ModifierEvent {
    /** The modifier's parent attacks another entity. */
    PARENT_ATTACK,
    /** The modifier's parent is attacked. */
    PARENT_DEFEND,
    /** Once per entity at the end of every tick's move pass. */
    TICK
}
