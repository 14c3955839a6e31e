package com.tessera.core;

/**
 * The two sides of a Tessera match. {@link #FIRST} always opens the game.
 */
public enum Player {
    FIRST,
    SECOND;

    /**
     * Returns the other player.
     */
    public Player opponent() {
        return this == FIRST ? SECOND : FIRST;
    }

    /**
     * Returns the single bit used to encode this player inside tile values and group handles.
     */
    public int bit() {
        return ordinal();
    }

    public static Player fromBit(int bit) {
        return (bit & 1) == 0 ? FIRST : SECOND;
    }
}
