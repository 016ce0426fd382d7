package org.optimax.rogue.runtime;

import org.optimax.rogue.runtime.model.Dungeon;
import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;
import org.optimax.rogue.runtime.model.Move;
import org.optimax.rogue.runtime.model.Position;
import org.optimax.rogue.runtime.modifier.AttackResult;
import org.optimax.rogue.runtime.modifier.CombatFlag;
import org.optimax.rogue.runtime.modifier.ModifierEvent;
import org.optimax.rogue.runtime.modifier.ModifierPipeline;
import org.optimax.rogue.runtime.modifier.StatModifier;
import org.optimax.rogue.runtime.modifier.TickEventArgs;
import org.optimax.rogue.runtime.spi.IDungeonGenerator;
import org.optimax.rogue.runtime.spi.INpcController;
import org.optimax.rogue.runtime.spi.IRandomProvider;
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
import org.optimax.rogue.runtime.worldgen.NpcFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Advances an authoritative {@link GameState} by one tick.
 * <p>
 * Every change to the state is made by emitting an update record: the record is applied to the
 * state immediately and appended to the tick's log. Clients replaying the log therefore run the
 * exact code the server ran, minus the randomness, which only ever happens here.
 * <p>
 * Not thread-safe and not re-entrant on one state.
 */
public class Updater {

    private static final Logger LOG = LoggerFactory.getLogger(Updater.class);

    private final IDungeonGenerator dungeonGenerator;
    private final INpcController npcController;
    private final EngineSettings settings;
    private final NpcFactory npcFactory;
    private final IRandomProvider initiativeRandom;
    private final IRandomProvider spawnRandom;
    private final IRandomProvider modifierRandom;

    private long order;
    private List<GameStateUpdate> pending = new ArrayList<>();

    /**
     * @param dungeonGenerator creates dungeons for depths reached for the first time
     * @param npcController    decides the moves of NPCs
     * @param random           the match's random stream; independent sub-streams are derived from it
     * @param settings         engine tunables
     */
    public Updater(IDungeonGenerator dungeonGenerator, INpcController npcController, IRandomProvider random,
                   EngineSettings settings) {
        this.dungeonGenerator = dungeonGenerator;
        this.npcController = npcController;
        this.settings = settings;
        this.npcFactory = new NpcFactory(settings.npcHealth(), settings.npcDamage(), settings.npcArmor(),
                settings.npcLoadout());
        this.initiativeRandom = random.deriveFor("initiative", 0);
        this.spawnRandom = random.deriveFor("spawn", 0);
        this.modifierRandom = random.deriveFor("modifier", 0);
    }

    /**
     * Hands out the next record order. Orders start at 1 and never repeat within a match.
     */
    public long nextOrder() {
        return ++order;
    }

    /**
     * Resolves one tick.
     *
     * @param state       the authoritative state; mutated
     * @param player1Move player 1's submitted move
     * @param player2Move player 2's submitted move
     * @return the outcome and the records emitted
     * @throws IllegalArgumentException if {@code state} is a client view
     */
    public TickResult resolveTick(GameState state, Move player1Move, Move player2Move) {
        if (!state.isAuthoritative()) {
            throw new IllegalArgumentException("Only an authoritative state can be advanced");
        }
        pending = new ArrayList<>();
        state.refreshAttributes();

        Map<Integer, Move> moves = new HashMap<>();
        List<Entity> players = new ArrayList<>();
        List<Entity> npcs = new ArrayList<>();
        for (Entity entity : sortedById(state)) {
            Move requested;
            if (entity.getId() == state.getPlayer1Id()) {
                requested = player1Move;
                players.add(entity);
            } else if (entity.getId() == state.getPlayer2Id()) {
                requested = player2Move;
                players.add(entity);
            } else {
                requested = npcController.decide(state, entity);
                npcs.add(entity);
            }
            moves.put(entity.getId(), validate(state, entity, requested));
        }

        Collections.shuffle(players, initiativeRandom.asJavaRandom());
        Collections.shuffle(npcs, initiativeRandom.asJavaRandom());
        List<Entity> initiative = new ArrayList<>(players);
        initiative.addAll(npcs);

        Map<Integer, Position> destinations = new HashMap<>();
        for (Entity entity : initiative) {
            destinations.put(entity.getId(), entity.getPosition().translate(moves.get(entity.getId())));
        }

        List<Integer> initiativeIds = new ArrayList<>(initiative.size());
        Map<Integer, Integer> initiativeIndex = new HashMap<>();
        for (Entity entity : initiative) {
            initiativeIndex.put(entity.getId(), initiativeIds.size());
            initiativeIds.add(entity.getId());
        }

        Map<Integer, MoveResolution> resolutions = new LinkedHashMap<>();
        Map<Integer, Integer> lastAttacker = new HashMap<>();
        for (Entity entity : initiative) {
            resolveEntity(state, entity, moves, destinations, initiativeIndex, resolutions, lastAttacker);
        }

        runTickEvents(state);
        removeExpiredModifiers(state);
        sweepDeadNpcs(state, lastAttacker);

        long newTick = state.getTick() + 1;
        emit(state, new TickAdvancedUpdate(nextOrder(), newTick));

        TickOutcome outcome = outcome(state);
        LOG.debug("Tick {} resolved: {} records, outcome {}", newTick, pending.size(), outcome);
        return new TickResult(outcome, pending, resolutions, initiativeIds);
    }

    private Move validate(GameState state, Entity entity, Move requested) {
        if (requested == null || requested == Move.STAY) {
            return Move.STAY;
        }
        Dungeon dungeon = state.getWorld().get(entity.getDepth());
        if (dungeon == null) {
            LOG.warn("Entity {} stands on depth {} which has no dungeon loaded", entity.getId(), entity.getDepth());
            return Move.STAY;
        }
        Position target = entity.getPosition().translate(requested);
        if (dungeon.isBlocked(target.x(), target.y())) {
            LOG.debug("Entity {} tried to move {} into a blocked cell, staying", entity.getId(), requested);
            return Move.STAY;
        }
        return requested;
    }

    private void resolveEntity(GameState state, Entity entity, Map<Integer, Move> moves,
                               Map<Integer, Position> destinations, Map<Integer, Integer> initiativeIndex,
                               Map<Integer, MoveResolution> resolutions, Map<Integer, Integer> lastAttacker) {
        int id = entity.getId();
        if (state.findEntity(id) == null || resolutions.containsKey(id)) {
            return;
        }
        if (entity.getHealth() <= 0) {
            resolutions.put(id, MoveResolution.REST);
            return;
        }
        if (moves.get(id) == Move.STAY) {
            resolutions.put(id, MoveResolution.REST);
            return;
        }

        Position target = destinations.get(id);
        Entity occupant = state.entityAt(target);
        if (occupant == null) {
            Dungeon dungeon = state.getWorld().get(entity.getDepth());
            if (dungeon.isStaircase(target.x(), target.y())) {
                descend(state, entity, resolutions);
            } else {
                emit(state, new EntityPositionUpdate(nextOrder(), id, entity.getDepth(), target.depth(),
                        target.x(), target.y(), false));
                resolutions.put(id, MoveResolution.MOVE);
            }
            return;
        }

        int occupantId = occupant.getId();
        Move occupantMove = moves.getOrDefault(occupantId, Move.STAY);
        CombatFlag flag;
        if (occupantMove == Move.STAY) {
            flag = CombatFlag.BLOCK;
            resolutions.put(occupantId, MoveResolution.BLOCK);
            resolutions.put(id, MoveResolution.ATTACK_BLOCKED);
        } else if (entity.getPosition().equals(destinations.get(occupantId))) {
            flag = CombatFlag.PARRY;
            resolutions.put(occupantId, MoveResolution.BLOCK);
            resolutions.put(id, MoveResolution.ATTACK_PARRY);
        } else if (initiativeIndex.get(occupantId) < initiativeIndex.get(id)) {
            // the occupant had its turn first and is still standing there
            flag = CombatFlag.AMBUSH;
            resolutions.put(id, MoveResolution.ATTACK_AMBUSH);
        } else {
            flag = CombatFlag.FLEE;
            resolutions.put(occupantId, MoveResolution.BLOCK);
            resolutions.put(id, MoveResolution.ATTACK_BLOCKED);
        }
        attack(state, entity, occupant, flag);
        lastAttacker.put(occupantId, id);
    }

    private void attack(GameState state, Entity attacker, Entity defender, CombatFlag flag) {
        int base = attacker.getDamage() - defender.getArmor();
        AttackResult initial = new AttackResult(base, flag);
        ModifierPipeline.CombatPrevals prevals =
                ModifierPipeline.rollCombat(state, attacker, defender, initial, modifierRandom);
        emit(state, new EntityCombatUpdate(nextOrder(), attacker.getId(), defender.getId(), attacker.getDepth(),
                base, initial.getFlags(), prevals.attack(), prevals.defend()));
        LOG.debug("Entity {} attacked entity {} ({}), base damage {}, health now {}",
                attacker.getId(), defender.getId(), flag, base, defender.getHealth());
    }

    private void descend(GameState state, Entity entity, Map<Integer, MoveResolution> resolutions) {
        int id = entity.getId();
        int oldDepth = entity.getDepth();
        if (!state.isPlayer(id)) {
            emit(state, new EntityDeathUpdate(nextOrder(), id, oldDepth));
            resolutions.put(id, MoveResolution.PERISH);
            return;
        }

        int newDepth = oldDepth + 1;
        boolean created = false;
        Dungeon dungeon = state.getWorld().get(newDepth);
        if (dungeon == null) {
            dungeon = dungeonGenerator.spawnDungeon(newDepth);
            emit(state, new DungeonCreatedUpdate(nextOrder(), newDepth, dungeon));
            created = true;
        }
        Position landing = dungeon.randomUnoccupiedGround(state, newDepth, spawnRandom);
        emit(state, new EntityPositionUpdate(nextOrder(), id, oldDepth, newDepth, landing.x(), landing.y(), true));
        resolutions.put(id, MoveResolution.DESCEND);
        LOG.info("Player {} descended to depth {}", id, newDepth);

        if (created) {
            spawnNpcs(state, newDepth, dungeon);
        }
        evaluateDespawn(state, oldDepth);
    }

    private void spawnNpcs(GameState state, int depth, Dungeon dungeon) {
        for (int i = 0; i < settings.npcsPerLevel(); i++) {
            Position position = dungeon.randomUnoccupiedGround(state, depth, spawnRandom);
            Entity npc = npcFactory.create(state.nextEntityId(), position);
            emit(state, new EntitySpawnUpdate(nextOrder(), npc));
        }
    }

    private void evaluateDespawn(GameState state, int depth) {
        if (!state.getWorld().has(depth)) {
            return;
        }
        Entity p1 = state.requireEntity(state.getPlayer1Id());
        Entity p2 = state.requireEntity(state.getPlayer2Id());
        boolean drop = switch (settings.despawnStrategy()) {
            case UNREACHABLE -> p1.getDepth() > depth && p2.getDepth() > depth;
            case UNUSED -> p1.getDepth() != depth && p2.getDepth() != depth;
        };
        if (!drop) {
            return;
        }
        List<Entity> remaining = state.entitiesOn(depth);
        if (!remaining.isEmpty()) {
            if (settings.occupiedLevelPolicy() == OccupiedLevelPolicy.KEEP) {
                LOG.debug("Keeping depth {}: {} entities remain on it", depth, remaining.size());
                return;
            }
            remaining.sort(Comparator.comparingInt(Entity::getId));
            for (Entity npc : remaining) {
                emit(state, new EntityDeathUpdate(nextOrder(), npc.getId(), depth));
            }
        }
        emit(state, new DungeonDespawnedUpdate(nextOrder(), depth));
        LOG.info("Despawned depth {} ({}), culled {} entities", depth, settings.despawnStrategy(), remaining.size());
    }

    private void runTickEvents(GameState state) {
        for (Entity entity : sortedById(state)) {
            if (entity.getHealth() <= 0 || !ModifierPipeline.anyHandles(entity, ModifierEvent.TICK)) {
                continue;
            }
            TickEventArgs args = new TickEventArgs(state.getTick());
            int[] prevals = ModifierPipeline.rollEvent(ModifierEvent.TICK, state, entity, args, modifierRandom);
            emit(state, new EntityEventUpdate(nextOrder(), entity.getId(), entity.getDepth(),
                    ModifierEvent.TICK, args, prevals));
        }
    }

    private void removeExpiredModifiers(GameState state) {
        for (Entity entity : sortedById(state)) {
            boolean removed = false;
            for (int i = entity.getModifiers().size() - 1; i >= 0; i--) {
                if (entity.getModifiers().get(i).isExpired()) {
                    emit(state, new EntityModifierRemovedUpdate(nextOrder(), entity.getId(), entity.getDepth(), i));
                    removed = true;
                }
            }
            if (removed && entity.getHealth() > entity.getMaxHealth()) {
                emit(state, new EntityHealthUpdate(nextOrder(), entity.getId(), entity.getDepth(), 0,
                        entity.getMaxHealth() - entity.getHealth()));
            }
        }
    }

    private void sweepDeadNpcs(GameState state, Map<Integer, Integer> lastAttacker) {
        List<Entity> entities = sortedById(state);
        for (int i = entities.size() - 1; i >= 0; i--) {
            Entity entity = entities.get(i);
            if (state.isPlayer(entity.getId()) || entity.getHealth() > 0) {
                continue;
            }
            Integer killerId = lastAttacker.get(entity.getId());
            if (killerId != null && state.isPlayer(killerId) && settings.killRewardEnabled()) {
                Entity killer = state.requireEntity(killerId);
                emit(state, new EntityModifierAddedUpdate(nextOrder(), killerId, killer.getDepth(),
                        new StatModifier(0, settings.killBonusDamage(), 0, settings.killBonusTicks())));
            }
            emit(state, new EntityDeathUpdate(nextOrder(), entity.getId(), entity.getDepth()));
        }
    }

    private TickOutcome outcome(GameState state) {
        boolean p1Dead = state.requireEntity(state.getPlayer1Id()).getHealth() <= 0;
        boolean p2Dead = state.requireEntity(state.getPlayer2Id()).getHealth() <= 0;
        if (p1Dead && p2Dead) {
            return TickOutcome.TIE;
        }
        if (p1Dead) {
            return TickOutcome.PLAYER2_WIN;
        }
        if (p2Dead) {
            return TickOutcome.PLAYER1_WIN;
        }
        if (settings.maxTicks() > 0 && state.getTick() >= settings.maxTicks()) {
            LOG.info("Tick limit {} reached, match ends in a tie", settings.maxTicks());
            return TickOutcome.TIE;
        }
        return TickOutcome.IN_PROGRESS;
    }

    private void emit(GameState state, GameStateUpdate update) {
        update.apply(state);
        pending.add(update);
    }

    private static List<Entity> sortedById(GameState state) {
        List<Entity> entities = new ArrayList<>(state.getEntities());
        entities.sort(Comparator.comparingInt(Entity::getId));
        return entities;
    }
}
