package com.tessera.core;

/**
 * Utility for the packed 8-bit tile encoding. Bits 0-5 hold the connection flag of each
 * {@link Side}, bit 6 the player who placed the tile and bit 7 the player currently controlling it.
 * The value {@link #EMPTY} marks a cell without a tile; every playable tile has at least one
 * connected side and is therefore non-zero.
 */
public final class Tile {

    public static final int EMPTY = 0;
    public static final int CONNECTION_MASK = 0x3F;
    public static final int MIN_CONNECTIONS = 1;
    public static final int MAX_CONNECTIONS = CONNECTION_MASK;

    private static final int OWNER_SHIFT = 6;
    private static final int CONTROLLER_SHIFT = 7;
    private static final int CONTROLLER_BIT = 1 << CONTROLLER_SHIFT;

    private Tile() {
    }

    /**
     * Creates a tile with the provided connections, placed and controlled by {@code owner}.
     */
    public static int of(int connections, Player owner) {
        checkConnections(connections);
        if (owner == null) {
            throw new IllegalArgumentException("Owner must not be null");
        }
        return connections | (owner.bit() << OWNER_SHIFT) | (owner.bit() << CONTROLLER_SHIFT);
    }

    public static boolean isEmpty(int tile) {
        return tile == EMPTY;
    }

    public static boolean isConnected(int tile, Side side) {
        return (tile & side.mask()) != 0;
    }

    public static int connections(int tile) {
        return tile & CONNECTION_MASK;
    }

    public static Player owner(int tile) {
        return Player.fromBit(tile >>> OWNER_SHIFT);
    }

    public static Player controller(int tile) {
        return Player.fromBit(tile >>> CONTROLLER_SHIFT);
    }

    /**
     * Toggles the controller bit, leaving owner and connections untouched.
     */
    public static int flipController(int tile) {
        return tile ^ CONTROLLER_BIT;
    }

    /**
     * Returns {@code true} if the tile is controlled by the opponent of the player who placed it.
     */
    public static boolean isCaptured(int tile) {
        return !isEmpty(tile) && owner(tile) != controller(tile);
    }

    public static int connectedSideCount(int tile) {
        return Integer.bitCount(connections(tile));
    }

    /**
     * Returns {@code true} if the value is either {@link #EMPTY} or a well-formed playable tile.
     */
    public static boolean isValid(int tile) {
        if (tile < 0 || tile > 0xFF) {
            return false;
        }
        return tile == EMPTY || connections(tile) != 0;
    }

    static void checkConnections(int connections) {
        if (connections < MIN_CONNECTIONS || connections > MAX_CONNECTIONS) {
            throw new IllegalArgumentException("Connection mask out of range: " + connections);
        }
    }

    /**
     * Formats a tile as controller letter followed by the hexadecimal connection mask. Captured tiles
     * use a lowercase letter.
     */
    public static String toString(int tile) {
        if (isEmpty(tile)) {
            return ".";
        }
        char letter = controller(tile) == Player.FIRST ? 'X' : 'O';
        if (isCaptured(tile)) {
            letter = Character.toLowerCase(letter);
        }
        return String.format("%c%02x", letter, connections(tile));
    }
}
