package org.optimax.rogue.server.codec;

import com.fasterxml.jackson.databind.jsontype.NamedType;
import org.optimax.rogue.runtime.model.Item;
import org.optimax.rogue.runtime.model.TrinketItem;
import org.optimax.rogue.runtime.modifier.AttackEventArgs;
import org.optimax.rogue.runtime.modifier.CriticalStrikeModifier;
import org.optimax.rogue.runtime.modifier.DefendEventArgs;
import org.optimax.rogue.runtime.modifier.EventArgs;
import org.optimax.rogue.runtime.modifier.Modifier;
import org.optimax.rogue.runtime.modifier.RegenerationModifier;
import org.optimax.rogue.runtime.modifier.ShieldModifier;
import org.optimax.rogue.runtime.modifier.StatModifier;
import org.optimax.rogue.runtime.modifier.TickEventArgs;
import org.optimax.rogue.runtime.update.DungeonCreatedUpdate;
import org.optimax.rogue.runtime.update.DungeonDespawnedUpdate;
import org.optimax.rogue.runtime.update.EntityCombatUpdate;
import org.optimax.rogue.runtime.update.EntityDeathUpdate;
import org.optimax.rogue.runtime.update.EntityEventUpdate;
import org.optimax.rogue.runtime.update.EntityHealthUpdate;
import org.optimax.rogue.runtime.update.EntityModifierAddedUpdate;
import org.optimax.rogue.runtime.update.EntityModifierRemovedUpdate;
import org.optimax.rogue.runtime.update.EntityPositionUpdate;
import org.optimax.rogue.runtime.update.EntitySpawnUpdate;
import org.optimax.rogue.runtime.update.GameStateUpdate;
import org.optimax.rogue.runtime.update.TickAdvancedUpdate;
import org.optimax.rogue.server.net.IdentifyPacket;
import org.optimax.rogue.server.net.IdentifyResultPacket;
import org.optimax.rogue.server.net.LobbyChangePacket;
import org.optimax.rogue.server.net.MovePacket;
import org.optimax.rogue.server.net.Packet;
import org.optimax.rogue.server.net.SyncPacket;
import org.optimax.rogue.server.net.TickEndPacket;
import org.optimax.rogue.server.net.TickStartPacket;
import org.optimax.rogue.server.net.UpdatePacket;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps stable string tags to the concrete classes of the closed polymorphic families that
 * travel on the wire: modifiers, items, event arguments, update records and packets.
 * <p>
 * A registry is built once at startup and handed to every {@link WireCodec}. Tags are part of
 * the protocol and must never be reused for a different class.
 */
public final class TypeRegistry {

    private final Map<Class<?>, Map<String, Class<?>>> families = new LinkedHashMap<>();
    private final Map<Class<?>, String> tags = new LinkedHashMap<>();

    /**
     * Registers a concrete class under a tag within its family.
     *
     * @return this registry, for chaining
     * @throws IllegalArgumentException if the tag is taken in the family or the class is
     *                                  already registered
     */
    public <T> TypeRegistry register(Class<T> family, String tag, Class<? extends T> type) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Tag for " + type.getName() + " must not be blank");
        }
        Map<String, Class<?>> members = families.computeIfAbsent(family, f -> new LinkedHashMap<>());
        if (members.containsKey(tag)) {
            throw new IllegalArgumentException("Tag '" + tag + "' is already registered in family "
                    + family.getSimpleName() + " for " + members.get(tag).getName());
        }
        if (tags.containsKey(type)) {
            throw new IllegalArgumentException(type.getName() + " is already registered as '" + tags.get(type) + "'");
        }
        members.put(tag, type);
        tags.put(type, tag);
        return this;
    }

    /**
     * @return the class registered under {@code tag} in {@code family}, or {@code null}
     */
    public Class<?> lookup(Class<?> family, String tag) {
        Map<String, Class<?>> members = families.get(family);
        return members == null ? null : members.get(tag);
    }

    /**
     * @return the tag of a registered class, or {@code null}
     */
    public String tagOf(Class<?> type) {
        return tags.get(type);
    }

    /**
     * @return every registration as a Jackson {@link NamedType}
     */
    public List<NamedType> namedTypes() {
        List<NamedType> result = new ArrayList<>(tags.size());
        for (Map.Entry<Class<?>, String> entry : tags.entrySet()) {
            result.add(new NamedType(entry.getKey(), entry.getValue()));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * @return a registry holding every built-in type
     */
    public static TypeRegistry standard() {
        return new TypeRegistry()
                .register(Modifier.class, "stat", StatModifier.class)
                .register(Modifier.class, "critical-strike", CriticalStrikeModifier.class)
                .register(Modifier.class, "shield", ShieldModifier.class)
                .register(Modifier.class, "regeneration", RegenerationModifier.class)
                .register(Item.class, "trinket", TrinketItem.class)
                .register(EventArgs.class, "attack-args", AttackEventArgs.class)
                .register(EventArgs.class, "defend-args", DefendEventArgs.class)
                .register(EventArgs.class, "tick-args", TickEventArgs.class)
                .register(GameStateUpdate.class, "entity-spawn", EntitySpawnUpdate.class)
                .register(GameStateUpdate.class, "entity-death", EntityDeathUpdate.class)
                .register(GameStateUpdate.class, "entity-position", EntityPositionUpdate.class)
                .register(GameStateUpdate.class, "entity-health", EntityHealthUpdate.class)
                .register(GameStateUpdate.class, "entity-modifier-added", EntityModifierAddedUpdate.class)
                .register(GameStateUpdate.class, "entity-modifier-removed", EntityModifierRemovedUpdate.class)
                .register(GameStateUpdate.class, "dungeon-created", DungeonCreatedUpdate.class)
                .register(GameStateUpdate.class, "dungeon-despawned", DungeonDespawnedUpdate.class)
                .register(GameStateUpdate.class, "entity-event", EntityEventUpdate.class)
                .register(GameStateUpdate.class, "entity-combat", EntityCombatUpdate.class)
                .register(GameStateUpdate.class, "tick-advanced", TickAdvancedUpdate.class)
                .register(Packet.class, "sync", SyncPacket.class)
                .register(Packet.class, "move", MovePacket.class)
                .register(Packet.class, "update", UpdatePacket.class)
                .register(Packet.class, "tick-start", TickStartPacket.class)
                .register(Packet.class, "tick-end", TickEndPacket.class)
                .register(Packet.class, "identify", IdentifyPacket.class)
                .register(Packet.class, "identify-result", IdentifyResultPacket.class)
                .register(Packet.class, "lobby-change", LobbyChangePacket.class);
    }
}
