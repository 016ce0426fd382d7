package org.optimax.rogue.runtime.model;

/**
 * Thrown when a {@link GameState} is asked for an entity id it does not hold.
 */
public class UnknownEntityException extends RuntimeException {

    private final int entityId;

    public UnknownEntityException(int entityId) {
        super("No entity with id " + entityId);
        this.entityId = entityId;
    }

    public int getEntityId() {
        return entityId;
    }
}
