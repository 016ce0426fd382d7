package org.optimax.rogue.runtime;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.optimax.rogue.junit.extensions.logging.ExpectLog;
import org.optimax.rogue.junit.extensions.logging.LogLevel;
import org.optimax.rogue.junit.extensions.logging.LogWatchExtension;
import org.optimax.rogue.runtime.model.Dungeon;
import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;
import org.optimax.rogue.runtime.model.Move;
import org.optimax.rogue.runtime.model.Position;
import org.optimax.rogue.runtime.model.Tile;
import org.optimax.rogue.runtime.model.World;
import org.optimax.rogue.runtime.modifier.CombatFlag;
import org.optimax.rogue.runtime.modifier.StatModifier;
import org.optimax.rogue.runtime.spi.IDungeonGenerator;
import org.optimax.rogue.runtime.spi.INpcController;
import org.optimax.rogue.runtime.testing.ScriptedRandomProvider;
import org.optimax.rogue.runtime.testing.TestStates;
import org.optimax.rogue.runtime.update.DungeonCreatedUpdate;
import org.optimax.rogue.runtime.update.DungeonDespawnedUpdate;
import org.optimax.rogue.runtime.update.EntityCombatUpdate;
import org.optimax.rogue.runtime.update.EntityDeathUpdate;
import org.optimax.rogue.runtime.update.EntityEventUpdate;
import org.optimax.rogue.runtime.update.EntityModifierAddedUpdate;
import org.optimax.rogue.runtime.update.EntityModifierRemovedUpdate;
import org.optimax.rogue.runtime.update.EntityPositionUpdate;
import org.optimax.rogue.runtime.update.EntitySpawnUpdate;
import org.optimax.rogue.runtime.update.GameStateUpdate;
import org.optimax.rogue.runtime.update.TickAdvancedUpdate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.optimax.rogue.runtime.testing.TestStates.P1;
import static org.optimax.rogue.runtime.testing.TestStates.P2;
import static org.optimax.rogue.runtime.testing.TestStates.entity;

/**
 * Tick resolution on small hand-made states. Draws come from a {@link ScriptedRandomProvider},
 * so the initiative order is by id unless a test queues a shuffle.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class UpdaterTest {

    private static final IDungeonGenerator ROOMS = depth -> Dungeon.walledRoom(6, 4);

    private final ScriptedRandomProvider random = new ScriptedRandomProvider();
    private final Map<Integer, Move> npcMoves = new HashMap<>();
    private final INpcController npcController = (state, npc) -> npcMoves.getOrDefault(npc.getId(), Move.STAY);

    private Updater updater(EngineSettings settings) {
        return new Updater(ROOMS, npcController, random, settings);
    }

    private static EngineSettings settings(DespawnStrategy strategy, OccupiedLevelPolicy policy, int npcsPerLevel,
                                           int killBonusDamage, int killBonusTicks, long maxTicks) {
        return new EngineSettings(strategy, policy, npcsPerLevel, "stationary", killBonusDamage, killBonusTicks,
                maxTicks, 22, 12, 10, 2, 1, 3, 1, 0);
    }

    private static EngineSettings plain() {
        return settings(DespawnStrategy.UNREACHABLE, OccupiedLevelPolicy.CULL, 0, 0, 0, 0);
    }

    private static <T extends GameStateUpdate> List<T> recordsOf(TickResult result, Class<T> type) {
        return result.updates().stream().filter(type::isInstance).map(type::cast).toList();
    }

    /** A 6x4 walled room with a staircase at (2,1); interior cells are x 1..4, y 1..2. */
    private static Dungeon roomWithStairs() {
        return Dungeon.walledRoom(6, 4).withTile(2, 1, Tile.STAIRCASE_DOWN);
    }

    @Test
    void attackingAStationaryDefenderIsABlock() {
        GameState state = TestStates.authoritative(TestStates.openGround(3, 3),
                entity(P1, 1, 1, 10, 3, 0), entity(P2, 2, 1, 10, 2, 1));

        TickResult result = updater(plain()).resolveTick(state, Move.RIGHT, Move.STAY);

        assertThat(state.requireEntity(P2).getHealth()).isEqualTo(8);
        assertThat(state.requireEntity(P1).getPosition()).isEqualTo(new Position(0, 1, 1));
        assertThat(recordsOf(result, EntityCombatUpdate.class)).singleElement()
                .satisfies(combat -> {
                    assertThat(combat.getFlags()).containsExactly(CombatFlag.BLOCK);
                    assertThat(combat.getBaseDamage()).isEqualTo(2);
                });
        assertThat(recordsOf(result, EntityPositionUpdate.class)).isEmpty();
        assertThat(state.getTick()).isEqualTo(1);
        assertThat(result.outcome()).isEqualTo(TickOutcome.IN_PROGRESS);
        assertThat(result.resolutions())
                .containsEntry(P1, MoveResolution.ATTACK_BLOCKED)
                .containsEntry(P2, MoveResolution.BLOCK);
    }

    @Test
    void bothPlayersDyingInOneTickIsATie() {
        GameState state = TestStates.authoritative(TestStates.openGround(4, 2),
                entity(P1, 0, 0, 1, 2, 0), entity(P2, 3, 0, 1, 2, 0),
                entity(3, 1, 0, 3, 5, 0), entity(4, 2, 0, 3, 5, 0));
        npcMoves.put(3, Move.LEFT);
        npcMoves.put(4, Move.RIGHT);

        TickResult result = updater(plain()).resolveTick(state, Move.STAY, Move.STAY);

        assertThat(state.requireEntity(P1).getHealth()).isNegative();
        assertThat(state.requireEntity(P2).getHealth()).isNegative();
        assertThat(result.outcome()).isEqualTo(TickOutcome.TIE);
        assertThat(result.outcome().isFinished()).isTrue();
    }

    @Test
    void walkingIntoEachOtherIsAParry() {
        GameState state = TestStates.authoritative(TestStates.openGround(3, 1),
                entity(P1, 0, 0, 10, 3, 0), entity(P2, 1, 0, 10, 2, 1));

        TickResult result = updater(plain()).resolveTick(state, Move.RIGHT, Move.LEFT);

        assertThat(result.resolutions())
                .containsEntry(P1, MoveResolution.ATTACK_PARRY)
                .containsEntry(P2, MoveResolution.BLOCK);
        assertThat(recordsOf(result, EntityCombatUpdate.class)).singleElement()
                .satisfies(combat -> assertThat(combat.getFlags()).containsExactly(CombatFlag.PARRY));
        assertThat(state.requireEntity(P1).getHealth()).isEqualTo(10);
        assertThat(state.requireEntity(P2).getHealth()).isEqualTo(8);
        assertThat(recordsOf(result, EntityPositionUpdate.class)).isEmpty();
    }

    @Test
    void attackingAnEntityThatMovesAwayIsAFlee() {
        GameState state = TestStates.authoritative(TestStates.openGround(3, 1),
                entity(P1, 0, 0, 10, 3, 0), entity(P2, 1, 0, 10, 2, 1));

        TickResult result = updater(plain()).resolveTick(state, Move.RIGHT, Move.RIGHT);

        assertThat(recordsOf(result, EntityCombatUpdate.class)).singleElement()
                .satisfies(combat -> assertThat(combat.getFlags()).containsExactly(CombatFlag.FLEE));
        assertThat(result.resolutions())
                .containsEntry(P1, MoveResolution.ATTACK_BLOCKED)
                .containsEntry(P2, MoveResolution.BLOCK);
        assertThat(state.requireEntity(P2).getPosition()).isEqualTo(new Position(0, 1, 0));
    }

    @Test
    void initiativeOrderLetsAChainMoveTogether() {
        GameState state = TestStates.authoritative(TestStates.openGround(3, 1),
                entity(P1, 0, 0, 10, 3, 0), entity(P2, 1, 0, 10, 2, 1));
        // swaps the two players
        random.scope("initiative").enqueue(0);

        TickResult result = updater(plain()).resolveTick(state, Move.RIGHT, Move.RIGHT);

        assertThat(result.initiative()).containsExactly(P2, P1);
        assertThat(recordsOf(result, EntityPositionUpdate.class))
                .extracting(EntityPositionUpdate::getEntityId)
                .containsExactly(P2, P1);
        assertThat(recordsOf(result, EntityCombatUpdate.class)).isEmpty();
        assertThat(state.requireEntity(P1).getPosition()).isEqualTo(new Position(0, 1, 0));
        assertThat(state.requireEntity(P2).getPosition()).isEqualTo(new Position(0, 2, 0));
    }

    @Test
    void attackingAnOccupantWithEarlierInitiativeIsAnAmbush() {
        GameState state = TestStates.authoritative(TestStates.openGround(2, 2),
                entity(P1, 0, 0, 10, 3, 0), entity(P2, 1, 0, 10, 2, 1), entity(3, 0, 1, 10, 1, 0));

        TickResult result = updater(plain()).resolveTick(state, Move.DOWN, Move.LEFT);

        assertThat(result.resolutions())
                .containsEntry(P1, MoveResolution.ATTACK_BLOCKED)
                .containsEntry(3, MoveResolution.BLOCK)
                .containsEntry(P2, MoveResolution.ATTACK_AMBUSH);
        assertThat(recordsOf(result, EntityCombatUpdate.class))
                .extracting(EntityCombatUpdate::getFlags)
                .containsExactly(Set.of(CombatFlag.BLOCK), Set.of(CombatFlag.AMBUSH));
        assertThat(state.requireEntity(P1).getHealth()).isEqualTo(8);
    }

    @Test
    void occupantWithLaterInitiativeFleesFromEveryAttacker() {
        GameState state = TestStates.authoritative(TestStates.openGround(3, 2),
                entity(P1, 0, 0, 10, 3, 0), entity(P2, 1, 1, 10, 2, 0), entity(3, 1, 0, 10, 1, 0));
        npcMoves.put(3, Move.RIGHT);

        TickResult result = updater(plain()).resolveTick(state, Move.RIGHT, Move.UP);

        assertThat(result.initiative()).containsExactly(P1, P2, 3);
        assertThat(recordsOf(result, EntityCombatUpdate.class))
                .extracting(EntityCombatUpdate::getAttackerId, EntityCombatUpdate::getFlags)
                .containsExactly(tuple(P1, Set.of(CombatFlag.FLEE)), tuple(P2, Set.of(CombatFlag.FLEE)));
        assertThat(result.resolutions())
                .containsEntry(P1, MoveResolution.ATTACK_BLOCKED)
                .containsEntry(P2, MoveResolution.ATTACK_BLOCKED)
                .containsEntry(3, MoveResolution.BLOCK);
        assertThat(recordsOf(result, EntityPositionUpdate.class)).isEmpty();
        assertThat(state.requireEntity(3).getHealth()).isEqualTo(5);
        assertThat(state.requireEntity(3).getPosition()).isEqualTo(new Position(0, 1, 0));
    }

    @Test
    void swapWithAnEarlierEntityIsStillAParry() {
        GameState state = TestStates.authoritative(TestStates.openGround(3, 1),
                entity(P1, 0, 0, 10, 3, 0), entity(P2, 1, 0, 10, 2, 1));
        state.requireEntity(P1).setHealth(0);

        TickResult result = updater(plain()).resolveTick(state, Move.RIGHT, Move.LEFT);

        assertThat(result.initiative()).containsExactly(P1, P2);
        assertThat(recordsOf(result, EntityCombatUpdate.class)).singleElement()
                .satisfies(combat -> {
                    assertThat(combat.getAttackerId()).isEqualTo(P2);
                    assertThat(combat.getFlags()).containsExactly(CombatFlag.PARRY);
                });
        assertThat(result.resolutions()).containsEntry(P2, MoveResolution.ATTACK_PARRY);
        assertThat(result.outcome()).isEqualTo(TickOutcome.PLAYER2_WIN);
    }

    @Test
    void rotatingCycleEndsInCombatInsteadOfMovement() {
        GameState state = TestStates.authoritative(TestStates.openGround(2, 2),
                entity(P1, 0, 0, 10, 3, 0), entity(P2, 1, 0, 10, 2, 1),
                entity(3, 1, 1, 10, 1, 0), entity(4, 0, 1, 10, 1, 0));
        npcMoves.put(3, Move.LEFT);
        npcMoves.put(4, Move.UP);

        TickResult result = updater(plain()).resolveTick(state, Move.RIGHT, Move.DOWN);

        assertThat(result.initiative()).containsExactly(P1, P2, 3, 4);
        assertThat(recordsOf(result, EntityPositionUpdate.class)).isEmpty();
        assertThat(recordsOf(result, EntityCombatUpdate.class))
                .extracting(EntityCombatUpdate::getAttackerId, EntityCombatUpdate::getDefenderId)
                .containsExactly(tuple(P1, P2), tuple(3, 4));
    }

    @Test
    void blockedAndMissingMovesBecomeRest() {
        GameState state = TestStates.authoritative(Dungeon.walledRoom(6, 4),
                entity(P1, 1, 1, 10, 2, 0), entity(P2, 4, 2, 10, 2, 0));

        TickResult result = updater(plain()).resolveTick(state, Move.UP, null);

        assertThat(result.resolutions())
                .containsEntry(P1, MoveResolution.REST)
                .containsEntry(P2, MoveResolution.REST);
        assertThat(result.updates()).singleElement().isInstanceOf(TickAdvancedUpdate.class);
    }

    @Test
    void deadPlayerForfeitsItsMove() {
        GameState state = TestStates.authoritative(TestStates.openGround(3, 1),
                entity(P1, 0, 0, 10, 2, 0), entity(P2, 2, 0, 10, 2, 0));
        state.requireEntity(P2).setHealth(0);

        TickResult result = updater(plain()).resolveTick(state, Move.STAY, Move.LEFT);

        assertThat(result.resolutions()).containsEntry(P2, MoveResolution.REST);
        assertThat(state.requireEntity(P2).getPosition()).isEqualTo(new Position(0, 2, 0));
        assertThat(result.outcome()).isEqualTo(TickOutcome.PLAYER1_WIN);
    }

    @Test
    void npcOnAStaircasePerishes() {
        GameState state = TestStates.authoritative(roomWithStairs(),
                entity(P1, 4, 2, 10, 2, 0), entity(P2, 3, 2, 10, 2, 0), entity(3, 1, 1, 3, 1, 0));
        npcMoves.put(3, Move.RIGHT);

        TickResult result = updater(plain()).resolveTick(state, Move.STAY, Move.STAY);

        assertThat(result.resolutions()).containsEntry(3, MoveResolution.PERISH);
        assertThat(recordsOf(result, EntityDeathUpdate.class)).extracting(EntityDeathUpdate::getEntityId).containsExactly(3);
        assertThat(recordsOf(result, DungeonCreatedUpdate.class)).isEmpty();
        assertThat(state.findEntity(3)).isNull();
    }

    @Test
    void playerOnAStaircaseDescendsToAFreshLevel() {
        GameState state = TestStates.authoritative(roomWithStairs(),
                entity(P1, 1, 1, 10, 2, 0), entity(P2, 4, 2, 10, 2, 0));
        EngineSettings settings = settings(DespawnStrategy.UNREACHABLE, OccupiedLevelPolicy.CULL, 2, 0, 0, 0);

        TickResult result = updater(settings).resolveTick(state, Move.RIGHT, Move.STAY);

        assertThat(result.resolutions()).containsEntry(P1, MoveResolution.DESCEND);
        assertThat(result.updates()).hasExactlyElementsOfTypes(DungeonCreatedUpdate.class, EntityPositionUpdate.class,
                EntitySpawnUpdate.class, EntitySpawnUpdate.class, TickAdvancedUpdate.class);
        EntityPositionUpdate landing = recordsOf(result, EntityPositionUpdate.class).get(0);
        assertThat(landing.isDepthChanged()).isTrue();
        assertThat(landing.getFromDepth()).isZero();
        // an empty script draws the last free ground cell
        assertThat(state.requireEntity(P1).getPosition()).isEqualTo(new Position(1, 4, 2));
        assertThat(state.entitiesOn(1)).extracting(Entity::getId).containsExactlyInAnyOrder(P1, 3, 4);
        assertThat(state.requireEntity(3).getPosition()).isEqualTo(new Position(1, 4, 1));
        assertThat(state.getWorld().depths()).containsExactly(0, 1);
    }

    private GameState stateForDespawn(Entity player2, Entity... others) {
        World world = new World();
        world.set(0, Dungeon.walledRoom(6, 4));
        world.set(1, roomWithStairs());
        GameState state = new GameState(true, 0, P1, P2, world);
        state.addEntity(new Entity(P1, new Position(1, 1, 1), 10, 2, 0));
        state.addEntity(player2);
        for (Entity other : others) {
            state.addEntity(other);
        }
        state.refreshAttributes();
        return state;
    }

    @Test
    void unusedStrategyCullsTheLevelLeftBehind() {
        GameState state = stateForDespawn(new Entity(P2, new Position(0, 4, 2), 10, 2, 0),
                new Entity(5, new Position(1, 4, 2), 3, 1, 0));

        TickResult result = updater(settings(DespawnStrategy.UNUSED, OccupiedLevelPolicy.CULL, 0, 0, 0, 0))
                .resolveTick(state, Move.RIGHT, Move.STAY);

        assertThat(recordsOf(result, EntityDeathUpdate.class)).extracting(EntityDeathUpdate::getEntityId).containsExactly(5);
        assertThat(recordsOf(result, DungeonDespawnedUpdate.class)).extracting(DungeonDespawnedUpdate::getDepth).containsExactly(1);
        assertThat(state.getWorld().depths()).containsExactly(0, 2);
        state.verifyIndices();
    }

    @Test
    void keepPolicySparesAnOccupiedLevel() {
        GameState state = stateForDespawn(new Entity(P2, new Position(0, 4, 2), 10, 2, 0),
                new Entity(5, new Position(1, 4, 2), 3, 1, 0));

        TickResult result = updater(settings(DespawnStrategy.UNUSED, OccupiedLevelPolicy.KEEP, 0, 0, 0, 0))
                .resolveTick(state, Move.RIGHT, Move.STAY);

        assertThat(recordsOf(result, DungeonDespawnedUpdate.class)).isEmpty();
        assertThat(state.findEntity(5)).isNotNull();
        assertThat(state.getWorld().depths()).containsExactly(0, 1, 2);
    }

    @Test
    void unreachableStrategyWaitsForBothPlayers() {
        GameState behind = stateForDespawn(new Entity(P2, new Position(0, 4, 2), 10, 2, 0));
        updater(settings(DespawnStrategy.UNREACHABLE, OccupiedLevelPolicy.CULL, 0, 0, 0, 0))
                .resolveTick(behind, Move.RIGHT, Move.STAY);
        assertThat(behind.getWorld().depths()).containsExactly(0, 1, 2);

        World world = new World();
        world.set(1, roomWithStairs());
        world.set(2, Dungeon.walledRoom(6, 4));
        GameState ahead = new GameState(true, 0, P1, P2, world);
        ahead.addEntity(new Entity(P1, new Position(1, 1, 1), 10, 2, 0));
        ahead.addEntity(new Entity(P2, new Position(2, 4, 2), 10, 2, 0));
        ahead.refreshAttributes();

        TickResult result = updater(settings(DespawnStrategy.UNREACHABLE, OccupiedLevelPolicy.CULL, 0, 0, 0, 0))
                .resolveTick(ahead, Move.RIGHT, Move.STAY);

        assertThat(recordsOf(result, DungeonCreatedUpdate.class)).isEmpty();
        assertThat(ahead.requireEntity(P1).getPosition()).isEqualTo(new Position(2, 4, 1));
        assertThat(ahead.getWorld().depths()).containsExactly(2);
    }

    @Test
    void tickLimitEndsTheMatchInATie() {
        GameState state = TestStates.authoritative(TestStates.openGround(3, 1),
                entity(P1, 0, 0, 10, 2, 0), entity(P2, 2, 0, 10, 2, 0));
        Updater updater = updater(settings(DespawnStrategy.UNREACHABLE, OccupiedLevelPolicy.CULL, 0, 0, 0, 2));

        assertThat(updater.resolveTick(state, Move.STAY, Move.STAY).outcome()).isEqualTo(TickOutcome.IN_PROGRESS);
        assertThat(updater.resolveTick(state, Move.STAY, Move.STAY).outcome()).isEqualTo(TickOutcome.TIE);
    }

    @Test
    void killingAnNpcGrantsATimedDamageBonus() {
        GameState state = TestStates.authoritative(TestStates.openGround(3, 1),
                entity(P1, 0, 0, 10, 5, 0), entity(3, 1, 0, 3, 1, 0), entity(P2, 2, 0, 10, 2, 0));
        Updater updater = updater(settings(DespawnStrategy.UNREACHABLE, OccupiedLevelPolicy.CULL, 0, 1, 2, 0));

        TickResult kill = updater.resolveTick(state, Move.RIGHT, Move.STAY);

        assertThat(kill.updates()).hasExactlyElementsOfTypes(EntityCombatUpdate.class,
                EntityModifierAddedUpdate.class, EntityDeathUpdate.class, TickAdvancedUpdate.class);
        assertThat(state.requireEntity(P1).getModifiers()).containsExactly(new StatModifier(0, 1, 0, 2));
        assertThat(state.requireEntity(P1).getDamage()).isEqualTo(6);

        TickResult second = updater.resolveTick(state, Move.STAY, Move.STAY);
        assertThat(second.updates()).hasExactlyElementsOfTypes(EntityEventUpdate.class, TickAdvancedUpdate.class);

        TickResult third = updater.resolveTick(state, Move.STAY, Move.STAY);
        assertThat(third.updates()).hasExactlyElementsOfTypes(EntityEventUpdate.class,
                EntityModifierRemovedUpdate.class, TickAdvancedUpdate.class);
        assertThat(state.requireEntity(P1).getModifiers()).isEmpty();
        assertThat(state.requireEntity(P1).getDamage()).isEqualTo(5);
    }

    @Test
    void ordersStartAtOneAndKeepRising() {
        GameState state = TestStates.authoritative(TestStates.openGround(3, 3),
                entity(P1, 1, 1, 10, 3, 0), entity(P2, 2, 1, 10, 2, 1));
        Updater updater = updater(plain());

        List<GameStateUpdate> first = updater.resolveTick(state, Move.RIGHT, Move.STAY).updates();
        List<GameStateUpdate> second = updater.resolveTick(state, Move.DOWN, Move.UP).updates();

        assertThat(first.get(0).getOrder()).isEqualTo(1);
        long last = 0;
        for (GameStateUpdate update : first) {
            assertThat(update.getOrder()).isGreaterThan(last);
            last = update.getOrder();
        }
        assertThat(second.get(0).getOrder()).isGreaterThan(last);
    }

    @Test
    void refusesToAdvanceAClientView() {
        GameState view = TestStates.authoritative(TestStates.openGround(3, 1),
                entity(P1, 0, 0, 10, 2, 0), entity(P2, 2, 0, 10, 2, 0)).spectatorView();

        assertThatThrownBy(() -> updater(plain()).resolveTick(view, Move.STAY, Move.STAY))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Entity 1 stands on depth 4 which has no dungeon loaded")
    void entityOnAnUnloadedDepthStays() {
        GameState state = TestStates.authoritative(TestStates.openGround(3, 1), entity(P2, 2, 0, 10, 2, 0));
        state.addEntity(new Entity(P1, new Position(4, 1, 1), 10, 2, 0));
        state.refreshAttributes();

        TickResult result = updater(plain()).resolveTick(state, Move.LEFT, Move.STAY);

        assertThat(result.resolutions()).containsEntry(P1, MoveResolution.REST);
    }
}
