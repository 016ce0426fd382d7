package org.optimax.rogue.runtime;

import java.util.Locale;

/**
 * What happens to NPCs on a level the {@link DespawnStrategy} wants to drop.
 */
public enum OccupiedLevelPolicy {
    /** Remove the NPCs with death records, then drop the level. */
    CULL,
    /** Keep the level as long as any entity is on it. */
    KEEP;

    /**
     * @throws IllegalArgumentException if the name is not a known policy
     */
    public static OccupiedLevelPolicy fromName(String name) {
        if (name != null) {
            for (OccupiedLevelPolicy policy : values()) {
                if (policy.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
                    return policy;
                }
            }
        }
        throw new IllegalArgumentException("Unknown occupied-level policy: " + name
                + " (expected one of cull, keep)");
    }
}
