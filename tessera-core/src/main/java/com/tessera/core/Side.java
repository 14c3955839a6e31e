package com.tessera.core;

/**
 * The six directions around a hexagonal cell, expressed as axial coordinate deltas.
 * Each side owns the connection bit with the same index as its ordinal.
 */
public enum Side {
    EAST(1, 0),
    NORTH_EAST(1, -1),
    NORTH_WEST(0, -1),
    WEST(-1, 0),
    SOUTH_WEST(-1, 1),
    SOUTH_EAST(0, 1);

    public static final int COUNT = 6;

    private static final Side[] VALUES = values();

    private final int dq;
    private final int dr;

    Side(int dq, int dr) {
        this.dq = dq;
        this.dr = dr;
    }

    public int dq() {
        return dq;
    }

    public int dr() {
        return dr;
    }

    /**
     * Returns the connection bit mask of this side.
     */
    public int mask() {
        return 1 << ordinal();
    }

    /**
     * Returns the side facing back from the neighbouring cell.
     */
    public Side opposite() {
        return VALUES[(ordinal() + COUNT / 2) % COUNT];
    }

    public static Side of(int index) {
        if (index < 0 || index >= COUNT) {
            throw new IllegalArgumentException("Side index out of range: " + index);
        }
        return VALUES[index];
    }
}
