package org.optimax.rogue.runtime.npc;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;
import org.optimax.rogue.runtime.model.Move;
import org.optimax.rogue.runtime.testing.ScriptedRandomProvider;
import org.optimax.rogue.runtime.testing.TestStates;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.optimax.rogue.runtime.testing.TestStates.entity;

@Tag("unit")
class NpcControllerFactoryTest {

    private final Entity npc = entity(3, 1, 1, 3, 1, 0);
    private final GameState state = TestStates.authoritative(TestStates.openGround(3, 3),
            entity(TestStates.P1, 0, 0, 10, 2, 0), entity(TestStates.P2, 2, 2, 10, 2, 0), npc);

    @Test
    void namesAreCaseInsensitive() {
        assertThat(NpcControllerFactory.create("Stationary", new ScriptedRandomProvider()))
                .isInstanceOf(StationaryNpcController.class);
        assertThat(NpcControllerFactory.create("WANDERING", new ScriptedRandomProvider()))
                .isInstanceOf(WanderingNpcController.class);
    }

    @Test
    void unknownNameIsRejected() {
        assertThatThrownBy(() -> NpcControllerFactory.create("berserk", new ScriptedRandomProvider()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("berserk");
    }

    @Test
    void stationaryNpcsStay() {
        assertThat(new StationaryNpcController().decide(state, npc)).isEqualTo(Move.STAY);
    }

    @Test
    void wanderingNpcsDrawTheirMove() {
        ScriptedRandomProvider random = new ScriptedRandomProvider();
        WanderingNpcController controller = new WanderingNpcController(random);
        for (Move move : Move.values()) {
            random.enqueue(move.ordinal());
            assertThat(controller.decide(state, npc)).isEqualTo(move);
        }
    }
}
