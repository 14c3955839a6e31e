package com.tessera.core.engine;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tessera.core.Board;
import com.tessera.core.GameConfig;
import com.tessera.core.Move;
import com.tessera.core.Player;
import com.tessera.core.Side;
import com.tessera.core.Tile;
import com.tessera.core.group.Group;
import com.tessera.core.group.GroupHandle;
import org.junit.jupiter.api.Test;

class PartitionBuilderTest {

    private static final int EAST = Side.EAST.mask();
    private static final int WEST = Side.WEST.mask();
    private static final int NORTH_WEST = Side.NORTH_WEST.mask();
    private static final int SOUTH_EAST = Side.SOUTH_EAST.mask();

    private final GroupResolver resolver = new GroupResolver();

    @Test
    void emptyBoardHasNoGroups() {
        Position rebuilt = PartitionBuilder.rebuild(new Board(2), 63, 63);

        assertEquals(0, rebuilt.arena(Player.FIRST).liveCount());
        assertEquals(0, rebuilt.arena(Player.SECOND).liveCount());
        assertNull(rebuilt.handleAt(0));
    }

    @Test
    void rebuildMatchesIncrementalGroups() {
        Position position = Position.empty(new GameConfig(2, 1));
        play(position, 0, 0, EAST | WEST | NORTH_WEST, Player.SECOND);
        play(position, 1, 0, WEST | EAST, Player.FIRST);
        play(position, -1, 0, EAST | WEST, Player.FIRST);
        play(position, 0, -1, SOUTH_EAST | NORTH_WEST, Player.FIRST);
        play(position, -2, 0, EAST | Side.NORTH_EAST.mask(), Player.SECOND);

        Position rebuilt = PartitionBuilder.rebuild(position.board(), 63, 63);

        assertEquals(position.board(), rebuilt.board());
        for (Player player : Player.values()) {
            assertEquals(position.arena(player).liveCount(), rebuilt.arena(player).liveCount());
        }
        Board board = position.board();
        for (int cell = 0; cell < board.getCellCount(); cell++) {
            if (board.isEmpty(cell)) {
                assertNull(rebuilt.handleAt(cell));
                continue;
            }
            Group expected = position.groupAt(cell);
            Group actual = rebuilt.groupAt(cell);
            assertSame(Tile.controller(board.get(cell)), rebuilt.handleAt(cell).owner());
            assertArrayEquals(expected.members(), actual.members());
            assertArrayEquals(expected.liberties(), actual.liberties());
            assertArrayEquals(expected.enemyAdjacent(), actual.enemyAdjacent());
            assertEquals(expected.isExtendable(), actual.isExtendable());
        }
    }

    @Test
    void groupsAreInsertedInCellOrder() {
        Board board = new Board(2);
        board.set(board.cellAt(1, 0), Tile.of(EAST, Player.FIRST));
        board.set(board.cellAt(0, -2), Tile.of(SOUTH_EAST, Player.FIRST));

        Position rebuilt = PartitionBuilder.rebuild(board, 63, 63);

        assertEquals(new GroupHandle(0, Player.FIRST), rebuilt.handleAt(board.cellAt(0, -2)));
        assertEquals(new GroupHandle(1, Player.FIRST), rebuilt.handleAt(board.cellAt(1, 0)));
    }

    @Test
    void rebuildWorksOnACopy() {
        Board board = new Board(1);
        board.set(3, Tile.of(EAST, Player.FIRST));

        Position rebuilt = PartitionBuilder.rebuild(board, 63, 63);
        board.set(3, Tile.EMPTY);

        assertTrue(board.isEmpty(3));
        assertEquals(Tile.of(EAST, Player.FIRST), rebuilt.board().get(3));
        assertEquals(1, rebuilt.groupAt(3).libertyCount());
    }

    @Test
    void findsTilesThatDisagreeWithTheirNeighbours() {
        Board board = new Board(2);
        assertEquals(Board.NO_CELL, PartitionBuilder.findMismatch(board));

        board.set(board.cellAt(0, 0), Tile.of(EAST, Player.FIRST));
        board.set(board.cellAt(1, 0), Tile.of(WEST, Player.SECOND));
        assertEquals(Board.NO_CELL, PartitionBuilder.findMismatch(board));

        board.set(board.cellAt(1, 0), Tile.of(Side.NORTH_EAST.mask(), Player.SECOND));
        assertEquals(board.cellAt(0, 0), PartitionBuilder.findMismatch(board));

        Board edge = new Board(2);
        edge.set(edge.cellAt(2, 0), Tile.of(EAST, Player.FIRST));
        assertEquals(edge.cellAt(2, 0), PartitionBuilder.findMismatch(edge));
    }

    private void play(Position position, int q, int r, int connections, Player player) {
        resolver.apply(position, Move.of(position.board().cellAt(q, r), connections, player), 0);
    }
}
