package org.optimax.rogue.runtime.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.optimax.rogue.runtime.modifier.Modifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A creature on the map: one of the two players or an NPC.
 * <p>
 * Only the base stats are stored. The effective max health, damage and armor are derived from
 * the base stats plus the flat deltas of every attached {@link Modifier} and must be refreshed
 * through {@link #refreshAttributes()} before they are read. Position changes go through
 * {@link GameState} so the position index stays consistent.
 */
public final class Entity {

    @JsonProperty("id")
    private final int id;
    @JsonProperty("depth")
    private int depth;
    @JsonProperty("x")
    private int x;
    @JsonProperty("y")
    private int y;
    @JsonProperty("health")
    private int health;
    @JsonProperty("baseMaxHealth")
    private final int baseMaxHealth;
    @JsonProperty("baseDamage")
    private final int baseDamage;
    @JsonProperty("baseArmor")
    private final int baseArmor;
    @JsonProperty("modifiers")
    private final List<Modifier> modifiers;
    @JsonProperty("items")
    private final Map<Integer, Item> items;

    private boolean attributesFresh;
    private int maxHealth;
    private int damage;
    private int armor;

    @JsonCreator
    public Entity(@JsonProperty("id") int id,
                  @JsonProperty("depth") int depth,
                  @JsonProperty("x") int x,
                  @JsonProperty("y") int y,
                  @JsonProperty("health") int health,
                  @JsonProperty("baseMaxHealth") int baseMaxHealth,
                  @JsonProperty("baseDamage") int baseDamage,
                  @JsonProperty("baseArmor") int baseArmor,
                  @JsonProperty("modifiers") List<Modifier> modifiers,
                  @JsonProperty("items") Map<Integer, Item> items) {
        this.id = id;
        this.depth = depth;
        this.x = x;
        this.y = y;
        this.health = health;
        this.baseMaxHealth = baseMaxHealth;
        this.baseDamage = baseDamage;
        this.baseArmor = baseArmor;
        this.modifiers = new ArrayList<>(modifiers != null ? modifiers : List.of());
        this.items = new TreeMap<>(items != null ? items : Map.of());
    }

    /**
     * Creates an entity with full health, no modifiers and an empty inventory.
     */
    public Entity(int id, Position position, int maxHealth, int damage, int armor) {
        this(id, position.depth(), position.x(), position.y(), maxHealth, maxHealth, damage, armor, null, null);
    }

    public int getId() {
        return id;
    }

    public int getDepth() {
        return depth;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public Position getPosition() {
        return new Position(depth, x, y);
    }

    /**
     * Package-private: only {@link GameState} may move an entity.
     */
    void setPosition(int depth, int x, int y) {
        this.depth = depth;
        this.x = x;
        this.y = y;
    }

    public int getHealth() {
        return health;
    }

    public void setHealth(int health) {
        this.health = health;
    }

    public int getBaseMaxHealth() {
        return baseMaxHealth;
    }

    public int getBaseDamage() {
        return baseDamage;
    }

    public int getBaseArmor() {
        return baseArmor;
    }

    /**
     * @return the attached modifiers in attachment order; read-only
     */
    public List<Modifier> getModifiers() {
        return Collections.unmodifiableList(modifiers);
    }

    /**
     * Attaches a modifier at the end of the list and refreshes the derived attributes.
     * The entity takes exclusive ownership of {@code modifier}.
     */
    public void attachModifier(Modifier modifier) {
        modifiers.add(Objects.requireNonNull(modifier, "modifier"));
        refreshAttributes();
    }

    /**
     * Detaches the modifier at {@code index} and refreshes the derived attributes.
     *
     * @return the detached modifier
     * @throws IndexOutOfBoundsException if there is no modifier at that index
     */
    public Modifier detachModifier(int index) {
        Modifier removed = modifiers.remove(index);
        refreshAttributes();
        return removed;
    }

    /**
     * @return the inventory, slot to item; read-only
     */
    public Map<Integer, Item> getItems() {
        return Collections.unmodifiableMap(items);
    }

    public void putItem(int slot, Item item) {
        items.put(slot, Objects.requireNonNull(item, "item"));
    }

    public Item removeItem(int slot) {
        return items.remove(slot);
    }

    /**
     * Recomputes effective max health, damage and armor from the base stats and the flat
     * deltas of every attached modifier.
     */
    public void refreshAttributes() {
        int mh = baseMaxHealth;
        int dmg = baseDamage;
        int arm = baseArmor;
        for (Modifier modifier : modifiers) {
            mh += modifier.getFlatMaxHealth();
            dmg += modifier.getFlatDamage();
            arm += modifier.getFlatArmor();
        }
        this.maxHealth = mh;
        this.damage = dmg;
        this.armor = arm;
        this.attributesFresh = true;
    }

    public int getMaxHealth() {
        requireFresh();
        return maxHealth;
    }

    public int getDamage() {
        requireFresh();
        return damage;
    }

    public int getArmor() {
        requireFresh();
        return armor;
    }

    private void requireFresh() {
        if (!attributesFresh) {
            throw new IllegalStateException("Derived attributes of entity " + id + " read before refreshAttributes()");
        }
    }

    /**
     * Deep copy: every modifier is copied so the two entities never share one.
     * Items are immutable and shared.
     */
    public Entity copy() {
        List<Modifier> copiedModifiers = new ArrayList<>(modifiers.size());
        for (Modifier modifier : modifiers) {
            copiedModifiers.add(modifier.copy());
        }
        Entity copy = new Entity(id, depth, x, y, health, baseMaxHealth, baseDamage, baseArmor, copiedModifiers, items);
        if (attributesFresh) {
            copy.refreshAttributes();
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Entity other)) return false;
        return id == other.id
                && depth == other.depth
                && x == other.x
                && y == other.y
                && health == other.health
                && baseMaxHealth == other.baseMaxHealth
                && baseDamage == other.baseDamage
                && baseArmor == other.baseArmor
                && modifiers.equals(other.modifiers)
                && items.equals(other.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, depth, x, y, health, baseMaxHealth, baseDamage, baseArmor, modifiers, items);
    }

    @Override
    public String toString() {
        return "Entity[id=" + id + ", at=" + depth + "/" + x + "," + y + ", health=" + health
                + ", modifiers=" + modifiers + "]";
    }
}
