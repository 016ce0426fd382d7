package org.optimax.rogue.server.codec;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.optimax.rogue.runtime.modifier.Modifier;
import org.optimax.rogue.runtime.modifier.ShieldModifier;
import org.optimax.rogue.runtime.modifier.StatModifier;
import org.optimax.rogue.runtime.update.GameStateUpdate;
import org.optimax.rogue.runtime.update.TickAdvancedUpdate;
import org.optimax.rogue.server.net.Packet;
import org.optimax.rogue.server.net.SyncPacket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TypeRegistryTest {

    @Test
    void standardRegistryResolvesTagsBothWays() {
        TypeRegistry registry = TypeRegistry.standard();

        assertThat(registry.lookup(Modifier.class, "shield")).isEqualTo(ShieldModifier.class);
        assertThat(registry.lookup(GameStateUpdate.class, "tick-advanced")).isEqualTo(TickAdvancedUpdate.class);
        assertThat(registry.tagOf(SyncPacket.class)).isEqualTo("sync");
        assertThat(registry.lookup(Packet.class, "shield")).isNull();
        assertThat(registry.namedTypes()).hasSize(27);
    }

    @Test
    void tagsAndClassesCannotBeRegisteredTwice() {
        TypeRegistry registry = new TypeRegistry().register(Modifier.class, "stat", StatModifier.class);

        assertThatThrownBy(() -> registry.register(Modifier.class, "stat", ShieldModifier.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already registered in family Modifier");
        assertThatThrownBy(() -> registry.register(Modifier.class, "stat-2", StatModifier.class))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register(Modifier.class, " ", ShieldModifier.class))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void theSameTagMayBeUsedInDifferentFamilies() {
        TypeRegistry registry = new TypeRegistry()
                .register(Modifier.class, "sync", StatModifier.class)
                .register(Packet.class, "sync", SyncPacket.class);

        assertThat(registry.lookup(Modifier.class, "sync")).isEqualTo(StatModifier.class);
        assertThat(registry.lookup(Packet.class, "sync")).isEqualTo(SyncPacket.class);
    }
}
