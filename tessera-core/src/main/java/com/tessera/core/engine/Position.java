package com.tessera.core.engine;

import com.tessera.core.Board;
import com.tessera.core.GameConfig;
import com.tessera.core.InvariantViolationException;
import com.tessera.core.Player;
import com.tessera.core.group.Group;
import com.tessera.core.group.GroupArena;
import com.tessera.core.group.GroupHandle;
import com.tessera.core.group.GroupIndex;
import java.util.Objects;

/**
 * Mutable engine state: the board, one group arena per player and the shared cell to group index.
 * Arenas and index are derived from the board and can always be rebuilt with
 * {@link PartitionBuilder}.
 */
public final class Position {

    private final Board board;
    private final GroupArena firstArena;
    private final GroupArena secondArena;
    private final GroupIndex index;

    public Position(Board board, GroupArena firstArena, GroupArena secondArena, GroupIndex index) {
        this.board = Objects.requireNonNull(board, "board");
        this.firstArena = Objects.requireNonNull(firstArena, "firstArena");
        this.secondArena = Objects.requireNonNull(secondArena, "secondArena");
        this.index = Objects.requireNonNull(index, "index");
        if (firstArena.owner() != Player.FIRST || secondArena.owner() != Player.SECOND) {
            throw new IllegalArgumentException("Arenas must be supplied in player order");
        }
        if (index.cellCount() != board.getCellCount()) {
            throw new IllegalArgumentException("Index does not match the board size");
        }
    }

    /**
     * Creates the empty starting position for the configuration.
     */
    public static Position empty(GameConfig config) {
        Objects.requireNonNull(config, "config");
        Board board = new Board(config.boardRadius());
        return new Position(board,
                new GroupArena(Player.FIRST, config.handSize()),
                new GroupArena(Player.SECOND, config.handSize()),
                new GroupIndex(board.getCellCount()));
    }

    public Board board() {
        return board;
    }

    public GroupIndex index() {
        return index;
    }

    public GroupArena arena(Player player) {
        Objects.requireNonNull(player, "player");
        return player == Player.FIRST ? firstArena : secondArena;
    }

    public GroupHandle handleAt(int cell) {
        return index.handleAt(cell);
    }

    /**
     * Resolves a handle against the arena of its owner.
     *
     * @throws InvariantViolationException if the handle is missing or names a dead slot
     */
    public Group group(GroupHandle handle) {
        if (handle == null) {
            throw new InvariantViolationException(InvariantViolationException.Kind.STALE_HANDLE,
                    "Missing group handle");
        }
        return arena(handle.owner()).get(handle)
                .orElseThrow(() -> new InvariantViolationException(InvariantViolationException.Kind.STALE_HANDLE,
                        "Stale group handle " + handle));
    }

    /**
     * Returns the group owning the occupied cell.
     *
     * @throws InvariantViolationException if the index has no live group for the cell
     */
    public Group groupAt(int cell) {
        GroupHandle handle = index.handleAt(cell);
        if (handle == null) {
            throw new InvariantViolationException(InvariantViolationException.Kind.STALE_HANDLE,
                    "No group recorded for cell " + cell);
        }
        return group(handle);
    }

    /**
     * Returns a deep copy that can be mutated without affecting this position.
     */
    public Position copy() {
        return new Position(board.copy(), firstArena.copy(), secondArena.copy(), index.copy());
    }
}
