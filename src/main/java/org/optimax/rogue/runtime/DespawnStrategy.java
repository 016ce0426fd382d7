package org.optimax.rogue.runtime;

import java.util.Locale;

/**
 * Decides whether the level a player just left can be dropped from the world.
 */
public enum DespawnStrategy {
    /** Drop the level once both players are strictly deeper; nobody can come back to it. */
    UNREACHABLE,
    /** Drop the level as soon as no player stands on it. */
    UNUSED;

    /**
     * Parses a configured name, case-insensitively.
     *
     * @throws IllegalArgumentException if the name is not a known strategy
     */
    public static DespawnStrategy fromName(String name) {
        if (name != null) {
            for (DespawnStrategy strategy : values()) {
                if (strategy.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
                    return strategy;
                }
            }
        }
        throw new IllegalArgumentException("Unknown despawn strategy: " + name
                + " (expected one of unreachable, unused)");
    }
}
