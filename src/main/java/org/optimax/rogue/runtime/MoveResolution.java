package org.optimax.rogue.runtime;

/**
 * How the move of one entity was resolved in a tick.
 */
public enum MoveResolution {
    /** Stayed in place and nobody attacked it. */
    REST,
    /** Moved to a free cell. */
    MOVE,
    /** Went down a staircase. */
    DESCEND,
    /** An NPC stepped on a staircase and died. */
    PERISH,
    /** Was attacked while standing still, or was prevented from moving away. */
    BLOCK,
    /** Attacked an entity that stood still or was about to move away. */
    ATTACK_BLOCKED,
    /** Attacked an entity that was moving into it at the same time. */
    ATTACK_PARRY,
    /** Attacked an entity that had already finished its move. */
    ATTACK_AMBUSH
}
