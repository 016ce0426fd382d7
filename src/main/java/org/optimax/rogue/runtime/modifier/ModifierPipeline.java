package org.optimax.rogue.runtime.modifier;

import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;
import org.optimax.rogue.runtime.spi.IRandomProvider;

import java.util.List;

/**
 * Runs the three-phase modifier protocol over the modifiers of one or two entities.
 * <p>
 * The pre-phase ({@code roll*}) is split from the on/post phases ({@code resolve*}) so the
 * server can ship the prevals and every client can repeat the resolution without randomness.
 */
public final class ModifierPipeline {

    private ModifierPipeline() {
    }

    /**
     * Prevals of one combat exchange, indexed like the attacker's and defender's modifier lists.
     */
    public record CombatPrevals(int[] attack, int[] defend) {
    }

    /**
     * Runs the pre-phase of every attacker modifier, then of every defender modifier.
     */
    public static CombatPrevals rollCombat(GameState state, Entity attacker, Entity defender,
                                           AttackResult initial, IRandomProvider random) {
        int[] attack = roll(ModifierEvent.PARENT_ATTACK, state, attacker,
                new AttackEventArgs(defender.getId(), initial), random);
        int[] defend = roll(ModifierEvent.PARENT_DEFEND, state, defender,
                new DefendEventArgs(attacker.getId(), initial), random);
        return new CombatPrevals(attack, defend);
    }

    /**
     * Runs the on-phases (attacker, then defender) and post-phases (attacker, then defender)
     * of one combat exchange. The defender's on-phase sees the result as changed by the
     * attacker's.
     *
     * @return the final result
     * @throws IllegalArgumentException if a preval array does not match its modifier list
     */
    public static AttackResult resolveCombat(GameState state, Entity attacker, Entity defender, AttackResult initial,
                                             int[] attackPrevals, int[] defendPrevals) {
        requireLength(attacker, attackPrevals);
        requireLength(defender, defendPrevals);

        AttackResult result = initial;
        List<Modifier> attackMods = attacker.getModifiers();
        for (int i = 0; i < attackMods.size(); i++) {
            Modifier m = attackMods.get(i);
            if (m.handles(ModifierEvent.PARENT_ATTACK)) {
                EventArgs out = m.onEvent(ModifierEvent.PARENT_ATTACK, state, attacker,
                        new AttackEventArgs(defender.getId(), result), attackPrevals[i]);
                result = ((AttackEventArgs) out).getResult();
            }
        }
        List<Modifier> defendMods = defender.getModifiers();
        for (int i = 0; i < defendMods.size(); i++) {
            Modifier m = defendMods.get(i);
            if (m.handles(ModifierEvent.PARENT_DEFEND)) {
                EventArgs out = m.onEvent(ModifierEvent.PARENT_DEFEND, state, defender,
                        new DefendEventArgs(attacker.getId(), result), defendPrevals[i]);
                result = ((DefendEventArgs) out).getResult();
            }
        }

        post(ModifierEvent.PARENT_ATTACK, state, attacker, new AttackEventArgs(defender.getId(), result), attackPrevals);
        post(ModifierEvent.PARENT_DEFEND, state, defender, new DefendEventArgs(attacker.getId(), result), defendPrevals);
        return result;
    }

    /**
     * Runs the pre-phase of a single-entity event.
     */
    public static int[] rollEvent(ModifierEvent event, GameState state, Entity entity, EventArgs args,
                                  IRandomProvider random) {
        return roll(event, state, entity, args, random);
    }

    /**
     * Runs the on-phase and then the post-phase of a single-entity event.
     *
     * @return the arguments after every on-phase
     * @throws IllegalArgumentException if the preval array does not match the modifier list
     */
    public static EventArgs resolveEvent(ModifierEvent event, GameState state, Entity entity, EventArgs args,
                                         int[] prevals) {
        requireLength(entity, prevals);
        EventArgs current = args;
        List<Modifier> mods = entity.getModifiers();
        for (int i = 0; i < mods.size(); i++) {
            Modifier m = mods.get(i);
            if (m.handles(event)) {
                current = m.onEvent(event, state, entity, current, prevals[i]);
            }
        }
        post(event, state, entity, current, prevals);
        return current;
    }

    /**
     * @return true if any modifier of {@code entity} handles {@code event}
     */
    public static boolean anyHandles(Entity entity, ModifierEvent event) {
        for (Modifier m : entity.getModifiers()) {
            if (m.handles(event)) {
                return true;
            }
        }
        return false;
    }

    private static int[] roll(ModifierEvent event, GameState state, Entity entity, EventArgs args,
                              IRandomProvider random) {
        List<Modifier> mods = entity.getModifiers();
        int[] prevals = new int[mods.size()];
        for (int i = 0; i < mods.size(); i++) {
            Modifier m = mods.get(i);
            if (m.handles(event)) {
                prevals[i] = m.preEvent(event, state, entity, args, random);
            }
        }
        return prevals;
    }

    private static void post(ModifierEvent event, GameState state, Entity entity, EventArgs args, int[] prevals) {
        List<Modifier> mods = entity.getModifiers();
        for (int i = 0; i < mods.size(); i++) {
            Modifier m = mods.get(i);
            if (m.handles(event)) {
                m.postEvent(event, state, entity, args, prevals[i]);
            }
        }
    }

    private static void requireLength(Entity entity, int[] prevals) {
        if (prevals.length != entity.getModifiers().size()) {
            throw new IllegalArgumentException("Entity " + entity.getId() + " has " + entity.getModifiers().size()
                    + " modifiers but " + prevals.length + " prevals were supplied");
        }
    }
}
