package org.optimax.rogue.runtime.worldgen;

import org.optimax.rogue.runtime.EngineSettings;
import org.optimax.rogue.runtime.model.Dungeon;
import org.optimax.rogue.runtime.model.Entity;
import org.optimax.rogue.runtime.model.GameState;
import org.optimax.rogue.runtime.model.Position;
import org.optimax.rogue.runtime.model.World;
import org.optimax.rogue.runtime.spi.IDungeonGenerator;
import org.optimax.rogue.runtime.spi.IRandomProvider;
import org.optimax.rogue.runtime.spi.IStartGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts a duel: one dungeon at depth 0 with both players and the configured number of NPCs
 * placed on random free ground.
 */
public class DuelStartGenerator implements IStartGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(DuelStartGenerator.class);

    public static final int PLAYER1_ID = 1;
    public static final int PLAYER2_ID = 2;

    private final IDungeonGenerator dungeonGenerator;
    private final EngineSettings settings;
    private final NpcFactory npcFactory;
    private final IRandomProvider random;

    public DuelStartGenerator(IDungeonGenerator dungeonGenerator, EngineSettings settings, IRandomProvider random) {
        this.dungeonGenerator = dungeonGenerator;
        this.settings = settings;
        this.npcFactory = new NpcFactory(settings.npcHealth(), settings.npcDamage(), settings.npcArmor(),
                settings.npcLoadout());
        this.random = random.deriveFor("start", 0);
    }

    @Override
    public GameState createInitialState() {
        Dungeon dungeon = dungeonGenerator.spawnDungeon(0);
        World world = new World();
        world.set(0, dungeon);
        GameState state = new GameState(true, 0, PLAYER1_ID, PLAYER2_ID, world);

        for (int id : new int[]{PLAYER1_ID, PLAYER2_ID}) {
            Position position = dungeon.randomUnoccupiedGround(state, 0, random);
            state.addEntity(settings.playerLoadout().equip(new Entity(id, position, settings.playerHealth(),
                    settings.playerDamage(), settings.playerArmor())));
        }
        for (int i = 0; i < settings.npcsPerLevel(); i++) {
            Position position = dungeon.randomUnoccupiedGround(state, 0, random);
            state.addEntity(npcFactory.create(state.nextEntityId(), position));
        }
        state.refreshAttributes();
        LOG.debug("Created initial state with {} entities on a {}x{} dungeon",
                state.getEntities().size(), dungeon.getWidth(), dungeon.getHeight());
        return state;
    }
}
