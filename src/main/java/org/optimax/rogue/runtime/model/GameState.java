package org.optimax.rogue.runtime.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The complete mutable state of one match, or a client's partial view of it.
 * <p>
 * Every live entity is registered in exactly two indices: by position and by id. Adding,
 * moving and removing an entity update both in one step. A mismatch between the indices is
 * state corruption and raises an {@link AssertionError}.
 * <p>
 * Not thread-safe. The engine mutates a state from a single thread.
 */
public final class GameState {

    @JsonProperty("authoritative")
    private final boolean authoritative;
    @JsonProperty("tick")
    private long tick;
    @JsonProperty("player1Id")
    private final int player1Id;
    @JsonProperty("player2Id")
    private final int player2Id;
    @JsonProperty("world")
    private final World world;

    @JsonIgnore
    private final Map<Position, Entity> positionIndex = new HashMap<>();
    @JsonIgnore
    private final Map<Integer, Entity> identityIndex = new LinkedHashMap<>();

    /**
     * Creates an empty state.
     *
     * @param authoritative true for the server's state, false for a client view
     * @param tick          the current tick
     * @param player1Id     id of the first player entity
     * @param player2Id     id of the second player entity
     * @param world         the loaded dungeons
     */
    public GameState(boolean authoritative, long tick, int player1Id, int player2Id, World world) {
        this.authoritative = authoritative;
        this.tick = tick;
        this.player1Id = player1Id;
        this.player2Id = player2Id;
        this.world = world != null ? world : new World();
    }

    @JsonCreator
    GameState(@JsonProperty("authoritative") boolean authoritative,
              @JsonProperty("tick") long tick,
              @JsonProperty("player1Id") int player1Id,
              @JsonProperty("player2Id") int player2Id,
              @JsonProperty("world") World world,
              @JsonProperty("entities") List<Entity> entities) {
        this(authoritative, tick, player1Id, player2Id, world);
        if (entities != null) {
            for (Entity entity : entities) {
                addEntity(entity);
            }
        }
    }

    public boolean isAuthoritative() {
        return authoritative;
    }

    public long getTick() {
        return tick;
    }

    public void setTick(long tick) {
        this.tick = tick;
    }

    public int getPlayer1Id() {
        return player1Id;
    }

    public int getPlayer2Id() {
        return player2Id;
    }

    public boolean isPlayer(int entityId) {
        return entityId == player1Id || entityId == player2Id;
    }

    public World getWorld() {
        return world;
    }

    /**
     * @return player 1's entity, or {@code null} if it is not part of this state
     */
    public Entity getPlayer1() {
        return identityIndex.get(player1Id);
    }

    /**
     * @return player 2's entity, or {@code null} if it is not part of this state
     */
    public Entity getPlayer2() {
        return identityIndex.get(player2Id);
    }

    /**
     * @return all entities in insertion order; read-only
     */
    @JsonProperty("entities")
    public Collection<Entity> getEntities() {
        return Collections.unmodifiableCollection(identityIndex.values());
    }

    public List<Entity> entitiesOn(int depth) {
        List<Entity> result = new ArrayList<>();
        for (Entity entity : identityIndex.values()) {
            if (entity.getDepth() == depth) {
                result.add(entity);
            }
        }
        return result;
    }

    public Entity findEntity(int id) {
        return identityIndex.get(id);
    }

    /**
     * @throws UnknownEntityException if no entity has this id
     */
    public Entity requireEntity(int id) {
        Entity entity = identityIndex.get(id);
        if (entity == null) {
            throw new UnknownEntityException(id);
        }
        return entity;
    }

    public Entity entityAt(Position position) {
        return positionIndex.get(position);
    }

    public Entity entityAt(int depth, int x, int y) {
        return positionIndex.get(new Position(depth, x, y));
    }

    /**
     * @return one more than the largest live entity id, never below 3
     */
    public int nextEntityId() {
        int max = Math.max(player1Id, player2Id);
        for (Integer id : identityIndex.keySet()) {
            max = Math.max(max, id);
        }
        return max + 1;
    }

    /**
     * Registers an entity in both indices.
     *
     * @throws IllegalStateException if the id is taken or the cell is occupied
     */
    public void addEntity(Entity entity) {
        Objects.requireNonNull(entity, "entity");
        if (identityIndex.containsKey(entity.getId())) {
            throw new IllegalStateException("Entity id " + entity.getId() + " already exists");
        }
        Position position = entity.getPosition();
        if (positionIndex.containsKey(position)) {
            throw new IllegalStateException("Cell " + position + " is already occupied by entity "
                    + positionIndex.get(position).getId());
        }
        identityIndex.put(entity.getId(), entity);
        positionIndex.put(position, entity);
    }

    /**
     * Moves an entity to a new cell, possibly on another depth.
     *
     * @throws UnknownEntityException if the entity is not registered
     * @throws IllegalStateException  if the destination is occupied by another entity
     */
    public void moveEntity(int id, int depth, int x, int y) {
        Entity entity = requireEntity(id);
        Position from = entity.getPosition();
        Position to = new Position(depth, x, y);
        if (from.equals(to)) {
            return;
        }
        Entity occupant = positionIndex.get(to);
        if (occupant != null) {
            throw new IllegalStateException("Cannot move entity " + id + " onto " + to
                    + ", occupied by entity " + occupant.getId());
        }
        removeFromPositionIndex(entity, from);
        entity.setPosition(depth, x, y);
        positionIndex.put(to, entity);
    }

    /**
     * Removes an entity from both indices.
     *
     * @return the removed entity
     * @throws UnknownEntityException if the entity is not registered
     */
    public Entity removeEntity(int id) {
        Entity entity = requireEntity(id);
        removeFromPositionIndex(entity, entity.getPosition());
        identityIndex.remove(id);
        return entity;
    }

    private void removeFromPositionIndex(Entity entity, Position position) {
        Entity indexed = positionIndex.get(position);
        if (indexed != entity) {
            throw new AssertionError("Position index corrupt: entity " + entity.getId() + " claims " + position
                    + " but the index holds " + (indexed == null ? "nothing" : "entity " + indexed.getId()));
        }
        positionIndex.remove(position);
    }

    /**
     * Checks that both indices hold exactly the same entities and agree with their positions.
     *
     * @throws AssertionError on any mismatch
     */
    public void verifyIndices() {
        if (positionIndex.size() != identityIndex.size()) {
            throw new AssertionError("Index size mismatch: " + positionIndex.size() + " positions, "
                    + identityIndex.size() + " ids");
        }
        for (Map.Entry<Integer, Entity> entry : identityIndex.entrySet()) {
            Entity entity = entry.getValue();
            if (entity.getId() != entry.getKey()) {
                throw new AssertionError("Identity index maps " + entry.getKey() + " to entity " + entity.getId());
            }
            if (positionIndex.get(entity.getPosition()) != entity) {
                throw new AssertionError("Entity " + entity.getId() + " missing from position index at "
                        + entity.getPosition());
            }
        }
    }

    /**
     * Recomputes the derived attributes of every entity.
     */
    public void refreshAttributes() {
        for (Entity entity : identityIndex.values()) {
            entity.refreshAttributes();
        }
    }

    /**
     * @return a deep copy with the same authority; no entity or modifier is shared
     */
    public GameState copy() {
        return copy(authoritative, world.copy(), identityIndex.values());
    }

    /**
     * Builds the view a client controlling {@code entityId} receives: only the entity's
     * dungeon and the entities on that depth.
     *
     * @throws UnknownEntityException if the entity is not part of this state
     */
    public GameState viewFor(int entityId) {
        int depth = requireEntity(entityId).getDepth();
        return copy(false, world.copyWithOnly(depth), entitiesOn(depth));
    }

    /**
     * @return a non-authoritative copy of everything
     */
    public GameState spectatorView() {
        return copy(false, world.copy(), identityIndex.values());
    }

    private GameState copy(boolean authority, World worldCopy, Collection<Entity> entities) {
        GameState copy = new GameState(authority, tick, player1Id, player2Id, worldCopy);
        for (Entity entity : entities) {
            copy.addEntity(entity.copy());
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GameState other)) return false;
        return authoritative == other.authoritative
                && tick == other.tick
                && player1Id == other.player1Id
                && player2Id == other.player2Id
                && world.equals(other.world)
                && identityIndex.equals(other.identityIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(authoritative, tick, player1Id, player2Id, world, identityIndex);
    }

    @Override
    public String toString() {
        return "GameState[tick=" + tick + ", authoritative=" + authoritative + ", depths=" + world.depths()
                + ", entities=" + identityIndex.size() + "]";
    }
}
