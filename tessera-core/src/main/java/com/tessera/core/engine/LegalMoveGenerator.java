package com.tessera.core.engine;

import com.tessera.core.Board;
import com.tessera.core.Hand;
import com.tessera.core.InvariantViolationException;
import com.tessera.core.Move;
import com.tessera.core.Player;
import com.tessera.core.Side;
import com.tessera.core.Tile;
import com.tessera.core.group.Group;
import com.tessera.core.group.GroupArena;
import com.tessera.core.group.GroupHandle;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Enumerates the placements available to a player.
 *
 * <p>A cell is a candidate when it is empty and either touches an opponent-controlled tile, or is a
 * liberty of one of the mover's extendable groups, or the board is still blank. A tile fits a
 * candidate when every side agrees with the neighbour across it (connected faces connected,
 * disconnected faces disconnected, the board edge counts as disconnected, empty cells accept both)
 * and the placement does not oscillate.
 */
public final class LegalMoveGenerator {

    private static final Logger LOGGER = Logger.getLogger(LegalMoveGenerator.class.getName());

    /**
     * Decision for a single cell and tile pair.
     */
    public enum Verdict {
        LEGAL,
        OCCUPIED,
        NOT_CANDIDATE,
        MISMATCH,
        OSCILLATION
    }

    /**
     * Returns every legal placement of the tiles in {@code hand} for {@code mover}.
     */
    public Set<Move> regenerate(Position position, Hand hand, Player mover) {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(hand, "hand");
        Objects.requireNonNull(mover, "mover");

        int[] masks = hand.masks();
        if (masks.length == 0) {
            return Collections.emptySet();
        }

        Board board = position.board();
        boolean opening = board.isBlank();
        Set<Move> legal = new LinkedHashSet<>();
        for (int cell = 0; cell < board.getCellCount(); cell++) {
            if (!board.isEmpty(cell)) {
                continue;
            }
            if (!opening && !isCandidate(position, mover, cell)) {
                continue;
            }
            for (int mask : masks) {
                int tile = Tile.of(mask, mover);
                if (matches(board, cell, tile) && !wouldOscillate(position, cell, tile)) {
                    legal.add(new Move(cell, tile));
                }
            }
        }

        LOGGER.fine(() -> String.format("%s has %d legal placement(s) with %d distinct tile(s)", mover,
                legal.size(), masks.length));
        return Collections.unmodifiableSet(legal);
    }

    /**
     * Classifies a single placement without mutating the position. The tile must be controlled by
     * {@code mover}; hand membership is not checked.
     */
    public Verdict evaluate(Position position, Player mover, int cell, int tile) {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(mover, "mover");
        Board board = position.board();
        if (!board.isEmpty(cell)) {
            return Verdict.OCCUPIED;
        }
        if (!board.isBlank() && !isCandidate(position, mover, cell)) {
            return Verdict.NOT_CANDIDATE;
        }
        if (!matches(board, cell, tile)) {
            return Verdict.MISMATCH;
        }
        if (wouldOscillate(position, cell, tile)) {
            return Verdict.OSCILLATION;
        }
        return Verdict.LEGAL;
    }

    /**
     * Returns {@code true} if the empty cell touches an opponent-controlled tile or is a liberty of one
     * of the mover's extendable groups.
     */
    public boolean isCandidate(Position position, Player mover, int cell) {
        Board board = position.board();
        for (Side side : Side.values()) {
            int neighbor = board.neighbor(cell, side);
            if (neighbor == Board.NO_CELL) {
                continue;
            }
            int neighborTile = board.get(neighbor);
            if (!Tile.isEmpty(neighborTile) && Tile.controller(neighborTile) != mover) {
                return true;
            }
        }
        return extendsIsolatedGroup(position.arena(mover), cell);
    }

    /**
     * Returns {@code true} if every side of {@code tile} agrees with the neighbour across it.
     */
    public static boolean matches(Board board, int cell, int tile) {
        for (Side side : Side.values()) {
            boolean connected = Tile.isConnected(tile, side);
            int neighbor = board.neighbor(cell, side);
            if (neighbor == Board.NO_CELL) {
                if (connected) {
                    return false;
                }
                continue;
            }
            int neighborTile = board.get(neighbor);
            if (Tile.isEmpty(neighborTile)) {
                continue;
            }
            if (connected != Tile.isConnected(neighborTile, side.opposite())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Predicts whether placing {@code tile} on {@code cell} would leave a structure without liberties
     * under either controller. That happens exactly when the tile opens no liberty of its own, every
     * group it connects to loses its last liberty on {@code cell}, and none of those groups touches
     * an opponent group outside that set, so no neighbouring structure can absorb the flip.
     */
    public boolean wouldOscillate(Position position, int cell, int tile) {
        Board board = position.board();
        Set<GroupHandle> stripped = new HashSet<>();
        for (Side side : Side.values()) {
            if (!Tile.isConnected(tile, side)) {
                continue;
            }
            int neighbor = board.neighbor(cell, side);
            if (neighbor == Board.NO_CELL) {
                continue;
            }
            if (board.isEmpty(neighbor)) {
                return false;
            }
            stripped.add(requireHandle(position, neighbor));
        }

        for (GroupHandle handle : stripped) {
            Group group = position.group(handle);
            if (group.libertyCount() != 1 || !group.isLiberty(cell)) {
                return false;
            }
        }
        for (GroupHandle handle : stripped) {
            for (int edge : position.group(handle).enemyAdjacent()) {
                if (!stripped.contains(requireHandle(position, edge))) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean extendsIsolatedGroup(GroupArena arena, int cell) {
        for (GroupHandle handle : arena.liveHandles()) {
            Group group = arena.get(handle).orElseThrow();
            if (group.isExtendable() && group.isLiberty(cell)) {
                return true;
            }
        }
        return false;
    }

    private static GroupHandle requireHandle(Position position, int cell) {
        GroupHandle handle = position.handleAt(cell);
        if (handle == null) {
            throw new InvariantViolationException(InvariantViolationException.Kind.STALE_HANDLE,
                    "Occupied cell " + cell + " has no group");
        }
        return handle;
    }
}
