package org.optimax.rogue.runtime.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.optimax.rogue.runtime.testing.ScriptedRandomProvider;
import org.optimax.rogue.runtime.testing.TestStates;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DungeonTest {

    @Test
    void walledRoomHasWallsOnTheBorderAndGroundInside() {
        Dungeon room = Dungeon.walledRoom(4, 3);

        assertThat(room.getTile(0, 0)).isEqualTo(Tile.WALL);
        assertThat(room.getTile(3, 2)).isEqualTo(Tile.WALL);
        assertThat(room.getTile(1, 1)).isEqualTo(Tile.GROUND);
        assertThat(room.getTile(2, 1)).isEqualTo(Tile.GROUND);
        assertThat(room.isBlocked(0, 1)).isTrue();
        assertThat(room.isBlocked(1, 1)).isFalse();
    }

    @Test
    void cellsOutsideTheMapAreBlocked() {
        Dungeon room = Dungeon.walledRoom(3, 3);

        assertThat(room.isBlocked(-1, 1)).isTrue();
        assertThat(room.isBlocked(1, 3)).isTrue();
        assertThat(room.isStaircase(5, 5)).isFalse();
        assertThatThrownBy(() -> room.getTile(3, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withTileLeavesTheOriginalUntouched() {
        Dungeon room = Dungeon.walledRoom(4, 3);
        Dungeon withStairs = room.withTile(2, 1, Tile.STAIRCASE_DOWN);

        assertThat(withStairs.isStaircase(2, 1)).isTrue();
        assertThat(withStairs.isBlocked(2, 1)).isFalse();
        assertThat(room.isStaircase(2, 1)).isFalse();
        assertThat(withStairs).isNotEqualTo(room);
    }

    @Test
    void rejectsUnknownTileCodesAndWrongSizes() {
        assertThatThrownBy(() -> new Dungeon(2, 1, new byte[]{Tile.GROUND.code(), 9}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown tile code");
        assertThatThrownBy(() -> new Dungeon(2, 2, new byte[3]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void randomUnoccupiedGroundSkipsOccupiedCellsAndStairs() {
        // 4x3 room: interior is (1,1) and (2,1)
        Dungeon room = Dungeon.walledRoom(4, 3);
        GameState state = TestStates.authoritative(room, TestStates.entity(1, 1, 1, 5, 1, 0));

        for (int draw = 0; draw < 3; draw++) {
            Position position = room.randomUnoccupiedGround(state, 0, new ScriptedRandomProvider());
            assertThat(position).isEqualTo(new Position(0, 2, 1));
        }

        Dungeon stairsOnly = room.withTile(2, 1, Tile.STAIRCASE_DOWN);
        assertThatThrownBy(() -> stairsOnly.randomUnoccupiedGround(state, 0, new ScriptedRandomProvider()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("depth 0");
    }

    @Test
    void randomUnoccupiedGroundUsesTheDrawAsIndex() {
        Dungeon open = TestStates.openGround(2, 2);
        GameState state = TestStates.authoritative(open);

        // column-major: (0,0), (0,1), (1,0), (1,1)
        assertThat(open.randomUnoccupiedGround(state, 0, new ScriptedRandomProvider().enqueue(1)))
                .isEqualTo(new Position(0, 0, 1));
        assertThat(open.randomUnoccupiedGround(state, 0, new ScriptedRandomProvider().enqueue(2)))
                .isEqualTo(new Position(0, 1, 0));
    }
}
