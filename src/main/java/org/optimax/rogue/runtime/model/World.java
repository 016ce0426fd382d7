package org.optimax.rogue.runtime.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * The static part of the world: a partially loaded stack of dungeons keyed by depth.
 * A missing depth has either not been generated yet or has been despawned.
 */
public final class World {

    @JsonProperty("dungeons")
    private final Map<Integer, Dungeon> dungeons;

    @JsonCreator
    public World(@JsonProperty("dungeons") Map<Integer, Dungeon> dungeons) {
        this.dungeons = new TreeMap<>(dungeons != null ? dungeons : Map.of());
    }

    public World() {
        this(Map.of());
    }

    /**
     * @return the dungeon at the given depth, or {@code null} if it is not loaded
     */
    public Dungeon get(int depth) {
        return dungeons.get(depth);
    }

    public boolean has(int depth) {
        return dungeons.containsKey(depth);
    }

    public void set(int depth, Dungeon dungeon) {
        dungeons.put(depth, dungeon);
    }

    public void remove(int depth) {
        dungeons.remove(depth);
    }

    public Set<Integer> depths() {
        return Collections.unmodifiableSet(dungeons.keySet());
    }

    /**
     * Dungeons are immutable, so the copy shares them.
     * @return an independent world holding the same dungeons
     */
    public World copy() {
        return new World(dungeons);
    }

    /**
     * @return a world holding only the given depth, if it is loaded
     */
    public World copyWithOnly(int depth) {
        Dungeon dungeon = dungeons.get(depth);
        return dungeon != null ? new World(Map.of(depth, dungeon)) : new World();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof World other && dungeons.equals(other.dungeons));
    }

    @Override
    public int hashCode() {
        return dungeons.hashCode();
    }

    @Override
    public String toString() {
        return "World" + dungeons.keySet();
    }
}
