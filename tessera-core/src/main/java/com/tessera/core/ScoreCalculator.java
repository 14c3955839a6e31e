package com.tessera.core;

import java.util.Objects;

/**
 * Utility that scores a board by counting the tiles each player currently controls. Captured tiles
 * count for their controller, not for the player who placed them.
 */
public final class ScoreCalculator {

    private ScoreCalculator() {
    }

    /**
     * Returns the number of tiles controlled by {@code player}.
     */
    public static int controlledCells(Board board, Player player) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(player, "player");
        int count = 0;
        for (int cell = 0; cell < board.getCellCount(); cell++) {
            int tile = board.get(cell);
            if (!Tile.isEmpty(tile) && Tile.controller(tile) == player) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns the number of tiles placed by {@code player} that the opponent now controls.
     */
    public static int lostCells(Board board, Player player) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(player, "player");
        int count = 0;
        for (int cell = 0; cell < board.getCellCount(); cell++) {
            int tile = board.get(cell);
            if (Tile.isCaptured(tile) && Tile.owner(tile) == player) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns the player controlling more tiles, or {@code null} on a tie.
     */
    public static Player leader(Board board) {
        int first = controlledCells(board, Player.FIRST);
        int second = controlledCells(board, Player.SECOND);
        if (first == second) {
            return null;
        }
        return first > second ? Player.FIRST : Player.SECOND;
    }
}
