package com.tessera.core;

import java.util.Objects;

/**
 * Fatal engine failure: an internal invariant was broken, which means a caller skipped move
 * validation or the engine itself is wrong. Never raised for an ordinary refused move.
 */
public final class InvariantViolationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final Kind kind;

    public InvariantViolationException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind getKind() {
        return kind;
    }

    public enum Kind {
        /** A group handle pointed at a dead slot, the wrong arena or nothing at all. */
        STALE_HANDLE,
        /** A structure was left without liberties under either controller. */
        OSCILLATION,
        /** A group arena ran out of slots. */
        ARENA_EXHAUSTED,
        /** The resolver was handed a move that could not have been validated. */
        PRECONDITION
    }
}
