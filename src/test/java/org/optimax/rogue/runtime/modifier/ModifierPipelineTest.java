package org.optimax.rogue.runtime.modifier;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;
import org.optimax.rogue.runtime.spi.IRandomProvider;
import org.optimax.rogue.runtime.testing.ScriptedRandomProvider;
import org.optimax.rogue.runtime.testing.TestStates;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.optimax.rogue.runtime.testing.TestStates.entity;

@Tag("unit")
class ModifierPipelineTest {

    private final List<String> calls = new ArrayList<>();
    private GameState state;
    private Entity attacker;
    private Entity defender;

    @BeforeEach
    void setUp() {
        calls.clear();
        attacker = entity(1, 0, 0, 10, 3, 0);
        defender = entity(2, 1, 0, 10, 2, 0);
        state = TestStates.authoritative(TestStates.openGround(3, 3), attacker, defender);
    }

    @Test
    void phasesRunAttackerFirstAndOnBeforePost() {
        attacker.attachModifier(new RecordingModifier("a", ModifierEvent.PARENT_ATTACK, calls));
        defender.attachModifier(new RecordingModifier("d", ModifierEvent.PARENT_DEFEND, calls));
        AttackResult initial = new AttackResult(3, CombatFlag.BLOCK);

        ModifierPipeline.CombatPrevals prevals =
                ModifierPipeline.rollCombat(state, attacker, defender, initial, new ScriptedRandomProvider());
        ModifierPipeline.resolveCombat(state, attacker, defender, initial, prevals.attack(), prevals.defend());

        assertThat(calls).containsExactly("a.pre", "d.pre", "a.on", "d.on", "a.post", "d.post");
    }

    @Test
    void defenderSeesTheResultChangedByTheAttacker() {
        attacker.attachModifier(new CriticalStrikeModifier(100, 2));
        defender.attachModifier(new ShieldModifier(100, 4));
        AttackResult initial = new AttackResult(3, CombatFlag.BLOCK);

        ModifierPipeline.CombatPrevals prevals =
                ModifierPipeline.rollCombat(state, attacker, defender, initial, new ScriptedRandomProvider().enqueue(0, 0));
        AttackResult result = ModifierPipeline.resolveCombat(state, attacker, defender, initial,
                prevals.attack(), prevals.defend());

        // (3 * 2) - 4; the other order would give max(0, 3 - 4) * 2
        assertThat(result.getDamage()).isEqualTo(2);
        assertThat(result.hasFlag(CombatFlag.BLOCK)).isTrue();
    }

    @Test
    void resolutionUsesOnlyThePrevalsAndNoRandomness() {
        attacker.attachModifier(new CriticalStrikeModifier(50, 3));
        AttackResult initial = new AttackResult(2, CombatFlag.FLEE);

        AttackResult hit = ModifierPipeline.resolveCombat(state, attacker, defender, initial, new int[]{49}, new int[0]);
        AttackResult miss = ModifierPipeline.resolveCombat(state, attacker, defender, initial, new int[]{50}, new int[0]);

        assertThat(hit.getDamage()).isEqualTo(6);
        assertThat(miss).isEqualTo(initial);
    }

    @Test
    void modifiersThatDoNotHandleTheEventAreSkipped() {
        attacker.attachModifier(StatModifier.permanent(0, 1, 0));
        attacker.attachModifier(new RegenerationModifier(1, 1));
        attacker.refreshAttributes();
        IRandomProvider random = new ScriptedRandomProvider().enqueue(7, 7, 7);
        AttackResult initial = new AttackResult(4, CombatFlag.AMBUSH);

        ModifierPipeline.CombatPrevals prevals = ModifierPipeline.rollCombat(state, attacker, defender, initial, random);
        AttackResult result = ModifierPipeline.resolveCombat(state, attacker, defender, initial,
                prevals.attack(), prevals.defend());

        assertThat(prevals.attack()).containsExactly(0, 0);
        assertThat(prevals.defend()).isEmpty();
        assertThat(result).isEqualTo(initial);
        assertThat(ModifierPipeline.anyHandles(attacker, ModifierEvent.PARENT_ATTACK)).isFalse();
        assertThat(ModifierPipeline.anyHandles(attacker, ModifierEvent.TICK)).isTrue();
    }

    @Test
    void rejectsPrevalsThatDoNotMatchTheModifierList() {
        attacker.attachModifier(new CriticalStrikeModifier(10, 2));

        assertThatThrownBy(() -> ModifierPipeline.resolveCombat(state, attacker, defender,
                new AttackResult(1, CombatFlag.BLOCK), new int[0], new int[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("1 modifiers but 0 prevals");
    }

    @Test
    void tickEventsRunOnAndPostPerModifier() {
        attacker.attachModifier(new RecordingModifier("first", ModifierEvent.TICK, calls));
        attacker.attachModifier(new RecordingModifier("second", ModifierEvent.TICK, calls));
        TickEventArgs args = new TickEventArgs(4);

        int[] prevals = ModifierPipeline.rollEvent(ModifierEvent.TICK, state, attacker, args, new ScriptedRandomProvider());
        EventArgs out = ModifierPipeline.resolveEvent(ModifierEvent.TICK, state, attacker, args, prevals);

        assertThat(out).isEqualTo(args);
        assertThat(calls).containsExactly("first.pre", "second.pre", "first.on", "second.on", "first.post", "second.post");
    }

    private static final class RecordingModifier extends Modifier {
        private final String name;
        private final ModifierEvent handled;
        private final List<String> calls;

        RecordingModifier(String name, ModifierEvent handled, List<String> calls) {
            this.name = name;
            this.handled = handled;
            this.calls = calls;
        }

        @Override
        public boolean handles(ModifierEvent event) {
            return event == handled;
        }

        @Override
        public int preEvent(ModifierEvent event, GameState state, Entity parent, EventArgs args, IRandomProvider random) {
            calls.add(name + ".pre");
            return 0;
        }

        @Override
        public EventArgs onEvent(ModifierEvent event, GameState state, Entity parent, EventArgs args, int preval) {
            calls.add(name + ".on");
            return args;
        }

        @Override
        public void postEvent(ModifierEvent event, GameState state, Entity parent, EventArgs args, int preval) {
            calls.add(name + ".post");
        }

        @Override
        public Modifier copy() {
            return new RecordingModifier(name, handled, calls);
        }
    }
}
