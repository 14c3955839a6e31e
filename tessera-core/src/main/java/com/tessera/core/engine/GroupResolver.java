package com.tessera.core.engine;

import com.tessera.core.Board;
import com.tessera.core.InvariantViolationException;
import com.tessera.core.Move;
import com.tessera.core.Player;
import com.tessera.core.Side;
import com.tessera.core.Tile;
import com.tessera.core.group.Group;
import com.tessera.core.group.GroupArena;
import com.tessera.core.group.GroupHandle;
import com.tessera.core.group.GroupIndex;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Applies a validated placement to a {@link Position}: merges the friendly groups the new tile
 * joins, captures opponent groups left without liberties, resolves self-capture and keeps the cell
 * index and {@code extendable} flags in step with the board.
 *
 * <p>The resolver never declines a move. Moves must come from {@link LegalMoveGenerator}; anything
 * else may end in an {@link InvariantViolationException}, after which the position is unusable and
 * must be discarded. Callers that need atomicity run the resolver on {@link Position#copy()}.
 */
public final class GroupResolver {

    private static final Logger LOGGER = Logger.getLogger(GroupResolver.class.getName());

    /**
     * Resolves {@code move} on {@code position}.
     *
     * @param position the position to mutate
     * @param move the placement, already accepted by the legal move generator
     * @param moveNumber the number of the turn being played, used for diagnostics
     * @return the summary of the changes
     */
    public MoveOutcome apply(Position position, Move move, int moveNumber) {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(move, "move");

        Board board = position.board();
        int cell = move.cell();
        if (cell >= board.getCellCount() || !board.isEmpty(cell)) {
            throw new InvariantViolationException(InvariantViolationException.Kind.PRECONDITION,
                    "Move " + moveNumber + " targets an unavailable cell " + cell);
        }

        int tile = move.tile();
        Player mover = move.player();
        GroupArena ownArena = position.arena(mover);
        GroupIndex index = position.index();
        SortedSet<Integer> changed = new TreeSet<>();
        Set<GroupHandle> touched = new LinkedHashSet<>();

        board.set(cell, tile);
        changed.add(cell);

        List<Integer> newLiberties = new ArrayList<>(Side.COUNT);
        List<Integer> newEnemyEdges = new ArrayList<>(Side.COUNT);
        Set<GroupHandle> friendly = new LinkedHashSet<>();
        Set<GroupHandle> enemy = new LinkedHashSet<>();
        for (Side side : Side.values()) {
            if (!Tile.isConnected(tile, side)) {
                continue;
            }
            int neighbor = board.neighbor(cell, side);
            if (neighbor == Board.NO_CELL) {
                continue;
            }
            int neighborTile = board.get(neighbor);
            if (Tile.isEmpty(neighborTile)) {
                newLiberties.add(neighbor);
            } else if (Tile.controller(neighborTile) == mover) {
                friendly.add(requireHandle(index, neighbor));
            } else {
                newEnemyEdges.add(neighbor);
                enemy.add(requireHandle(index, neighbor));
            }
        }

        GroupHandle activeHandle;
        Group active;
        if (friendly.isEmpty()) {
            active = new Group(board.getCellCount());
            activeHandle = ownArena.insert(active);
        } else {
            Iterator<GroupHandle> iterator = friendly.iterator();
            activeHandle = iterator.next();
            active = position.group(activeHandle);
            while (iterator.hasNext()) {
                mergeInto(position, activeHandle, active, iterator.next());
            }
        }
        active.markMember(cell);
        index.assign(cell, activeHandle);
        for (int liberty : newLiberties) {
            active.markLiberty(liberty);
        }
        for (int edge : newEnemyEdges) {
            active.markEnemyAdjacent(edge);
        }
        touched.add(activeHandle);

        int captured = 0;
        for (GroupHandle enemyHandle : enemy) {
            Group target = position.group(enemyHandle);
            target.markEnemyAdjacent(cell);
            if (target.libertyCount() > 0) {
                touched.add(enemyHandle);
                continue;
            }
            capture(position, enemyHandle, activeHandle, active, changed);
            captured++;
        }

        GroupHandle placedGroup = activeHandle;
        boolean selfCapture = false;
        if (active.libertyCount() == 0) {
            placedGroup = selfCapture(position, activeHandle, active, cell, moveNumber, changed);
            touched.add(placedGroup);
            selfCapture = true;
        }

        for (GroupHandle handle : touched) {
            GroupArena arena = position.arena(handle.owner());
            arena.get(handle).ifPresent(group -> {
                index.assignMembers(group, handle);
                group.refreshExtendable();
            });
        }

        final int capturedGroups = captured;
        final boolean suicide = selfCapture;
        LOGGER.fine(() -> String.format("Move %d: %s at cell %d captured %d group(s)%s, %d cell(s) changed",
                moveNumber, mover, cell, capturedGroups, suicide ? " and was self-captured" : "", changed.size()));

        return new MoveOutcome(move, moveNumber, new ArrayList<>(changed), captured, selfCapture, placedGroup);
    }

    /**
     * Flips every member of the liberty-less opponent group, donates its state to the active group
     * and pulls in the mover's groups that only touched the active group through it.
     */
    private void capture(Position position, GroupHandle targetHandle, GroupHandle activeHandle, Group active,
            Set<Integer> changed) {
        Board board = position.board();
        GroupIndex index = position.index();
        Group target = position.arena(targetHandle.owner()).remove(targetHandle)
                .orElseThrow(() -> staleHandle(targetHandle));

        Set<GroupHandle> joined = new LinkedHashSet<>();
        for (int edge : target.enemyAdjacent()) {
            GroupHandle handle = requireHandle(index, edge);
            if (!handle.equals(activeHandle)) {
                joined.add(handle);
            }
        }

        for (int member : target.members()) {
            board.set(member, Tile.flipController(board.get(member)));
            changed.add(member);
        }
        active.absorb(target);
        index.assignMembers(target, activeHandle);

        for (GroupHandle handle : joined) {
            mergeInto(position, activeHandle, active, handle);
        }
    }

    /**
     * Hands the liberty-less active group over to the opponent groups it touches.
     *
     * @return the handle of the opponent group that absorbed it
     */
    private GroupHandle selfCapture(Position position, GroupHandle activeHandle, Group active, int cell,
            int moveNumber, Set<Integer> changed) {
        Board board = position.board();
        GroupIndex index = position.index();

        Set<GroupHandle> absorbers = new LinkedHashSet<>();
        for (int edge : active.enemyAdjacent()) {
            absorbers.add(requireHandle(index, edge));
        }
        if (absorbers.isEmpty()) {
            throw new InvariantViolationException(InvariantViolationException.Kind.OSCILLATION,
                    "Move " + moveNumber + " at cell " + cell + " leaves an isolated structure without liberties");
        }

        for (int member : active.members()) {
            board.set(member, Tile.flipController(board.get(member)));
            changed.add(member);
        }
        position.arena(activeHandle.owner()).remove(activeHandle)
                .orElseThrow(() -> staleHandle(activeHandle));

        Iterator<GroupHandle> iterator = absorbers.iterator();
        GroupHandle survivorHandle = iterator.next();
        Group survivor = position.group(survivorHandle);
        survivor.absorb(active);
        index.assignMembers(active, survivorHandle);
        while (iterator.hasNext()) {
            mergeInto(position, survivorHandle, survivor, iterator.next());
        }

        if (survivor.libertyCount() == 0) {
            throw new InvariantViolationException(InvariantViolationException.Kind.OSCILLATION,
                    "Move " + moveNumber + " at cell " + cell + " leaves a structure without liberties for both players");
        }
        return survivorHandle;
    }

    /**
     * Removes {@code victimHandle} from the survivor's arena and unions its state into the survivor.
     */
    private void mergeInto(Position position, GroupHandle survivorHandle, Group survivor, GroupHandle victimHandle) {
        if (victimHandle.equals(survivorHandle)) {
            return;
        }
        Group victim = position.arena(survivorHandle.owner()).remove(victimHandle)
                .orElseThrow(() -> staleHandle(victimHandle));
        survivor.absorb(victim);
        position.index().assignMembers(victim, survivorHandle);
    }

    private static GroupHandle requireHandle(GroupIndex index, int cell) {
        GroupHandle handle = index.handleAt(cell);
        if (handle == null) {
            throw new InvariantViolationException(InvariantViolationException.Kind.STALE_HANDLE,
                    "Occupied cell " + cell + " has no group");
        }
        return handle;
    }

    private static InvariantViolationException staleHandle(GroupHandle handle) {
        return new InvariantViolationException(InvariantViolationException.Kind.STALE_HANDLE,
                "Stale group handle " + handle);
    }
}
