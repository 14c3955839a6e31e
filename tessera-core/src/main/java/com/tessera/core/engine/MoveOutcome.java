package com.tessera.core.engine;

import com.tessera.core.Move;
import com.tessera.core.group.GroupHandle;
import java.util.List;
import java.util.Objects;

/**
 * Summary of a resolved move: every cell whose tile changed, how many opponent groups were
 * captured, whether the mover's own group was captured, and the group now holding the placed cell.
 */
public record MoveOutcome(Move move, int moveNumber, List<Integer> changedCells, int capturedGroups,
        boolean selfCapture, GroupHandle placedGroup) {

    public MoveOutcome {
        Objects.requireNonNull(move, "move");
        Objects.requireNonNull(placedGroup, "placedGroup");
        changedCells = List.copyOf(changedCells);
    }

    public boolean hasCaptures() {
        return capturedGroups > 0;
    }
}
