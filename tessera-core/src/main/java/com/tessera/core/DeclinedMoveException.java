package com.tessera.core;

import java.util.Objects;

/**
 * Raised when a move is refused before any state is touched. The game can continue normally.
 */
public final class DeclinedMoveException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final Reason reason;
    private final transient Move move;

    public DeclinedMoveException(Reason reason, Move move, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.move = move;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Returns the refused move, or {@code null} when the refusal concerned a pass.
     */
    public Move getMove() {
        return move;
    }

    public enum Reason {
        GAME_OVER,
        WRONG_TURN,
        TILE_NOT_IN_HAND,
        NOT_LEGAL
    }
}
