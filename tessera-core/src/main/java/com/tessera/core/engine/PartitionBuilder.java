package com.tessera.core.engine;

import com.tessera.core.Board;
import com.tessera.core.Player;
import com.tessera.core.Side;
import com.tessera.core.Tile;
import com.tessera.core.group.Group;
import com.tessera.core.group.GroupArena;
import com.tessera.core.group.GroupHandle;
import com.tessera.core.group.GroupIndex;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Rebuilds groups, arenas and the cell index from a board alone by flood filling over connected
 * sides between tiles of the same controller. Groups are inserted in ascending order of their
 * lowest cell.
 */
public final class PartitionBuilder {

    private PartitionBuilder() {
    }

    /**
     * Builds a fresh position around a copy of {@code board}.
     */
    public static Position rebuild(Board board, int firstCapacity, int secondCapacity) {
        Objects.requireNonNull(board, "board");
        Board copy = board.copy();
        int cellCount = copy.getCellCount();
        GroupArena firstArena = new GroupArena(Player.FIRST, firstCapacity);
        GroupArena secondArena = new GroupArena(Player.SECOND, secondCapacity);
        GroupIndex index = new GroupIndex(cellCount);

        boolean[] visited = new boolean[cellCount];
        Deque<Integer> pending = new ArrayDeque<>();
        for (int start = 0; start < cellCount; start++) {
            if (visited[start] || copy.isEmpty(start)) {
                continue;
            }
            Player controller = Tile.controller(copy.get(start));
            Group group = new Group(cellCount);
            visited[start] = true;
            pending.push(start);
            while (!pending.isEmpty()) {
                int cell = pending.pop();
                int tile = copy.get(cell);
                group.markMember(cell);
                for (Side side : Side.values()) {
                    if (!Tile.isConnected(tile, side)) {
                        continue;
                    }
                    int neighbor = copy.neighbor(cell, side);
                    if (neighbor == Board.NO_CELL) {
                        continue;
                    }
                    int neighborTile = copy.get(neighbor);
                    if (Tile.isEmpty(neighborTile)) {
                        group.markLiberty(neighbor);
                    } else if (Tile.controller(neighborTile) != controller) {
                        group.markEnemyAdjacent(neighbor);
                    } else if (!visited[neighbor]) {
                        visited[neighbor] = true;
                        pending.push(neighbor);
                    }
                }
            }
            group.refreshExtendable();
            GroupArena arena = controller == Player.FIRST ? firstArena : secondArena;
            GroupHandle handle = arena.insert(group);
            index.assignMembers(group, handle);
        }
        return new Position(copy, firstArena, secondArena, index);
    }

    /**
     * Returns the first cell whose tile disagrees with a neighbour or points a connected side off the
     * board, or {@link Board#NO_CELL} if every tile fits.
     */
    public static int findMismatch(Board board) {
        Objects.requireNonNull(board, "board");
        for (int cell = 0; cell < board.getCellCount(); cell++) {
            int tile = board.get(cell);
            if (!Tile.isEmpty(tile) && !LegalMoveGenerator.matches(board, cell, tile)) {
                return cell;
            }
        }
        return Board.NO_CELL;
    }
}
