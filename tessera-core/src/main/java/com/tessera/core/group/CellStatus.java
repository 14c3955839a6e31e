package com.tessera.core.group;

/**
 * Role of a board cell from the point of view of a single group. The flags are disjoint bits so
 * that group states can be merged with a bitwise OR, after which {@link #MEMBER} wins.
 */
public enum CellStatus {
    EMPTY(0),
    LIBERTY(1),
    ENEMY_ADJACENT(2),
    MEMBER(4);

    private final int bit;

    CellStatus(int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }

    static CellStatus fromBits(int bits) {
        if ((bits & MEMBER.bit) != 0) {
            return MEMBER;
        }
        if ((bits & ENEMY_ADJACENT.bit) != 0) {
            return ENEMY_ADJACENT;
        }
        if ((bits & LIBERTY.bit) != 0) {
            return LIBERTY;
        }
        return EMPTY;
    }
}
