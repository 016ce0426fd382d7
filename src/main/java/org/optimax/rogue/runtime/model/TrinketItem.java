package org.optimax.rogue.runtime.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A named keepsake with no effect of its own.
 */
public final class TrinketItem extends Item {

    @JsonProperty("name")
    private final String name;

    @JsonCreator
    public TrinketItem(@JsonProperty("name") String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TrinketItem other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "TrinketItem[" + name + "]";
    }
}
