package org.optimax.rogue.runtime.model;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Something an entity can carry in an inventory slot. Items are immutable, so entity
 * copies may share them.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
public abstract class Item {

    /**
     * @return a display name for this item
     */
    public abstract String getName();

    /**
     * @return how many of this item fit in one slot
     */
    public int getStackSize() {
        return 1;
    }
}
