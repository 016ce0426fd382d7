package org.optimax.rogue.runtime.modifier;

/**
 * Describes the situation a combat exchange arose from.
 */
public enum CombatFlag {
    /** The defender stood still. */
    BLOCK,
    /** The defender had already finished its move this tick. */
    AMBUSH,
    /** The defender was about to move elsewhere. */
    FLEE,
    /** Both sides moved into each other. */
    PARRY
}
