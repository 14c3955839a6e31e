package com.tessera.core.group;

import java.util.Objects;

/**
 * Mutable state of one group: the status of every board cell relative to the group plus the
 * {@code extendable} flag. Counts are kept in step with the status array.
 */
public final class Group {

    private final byte[] status;
    private int memberCount;
    private int libertyCount;
    private int enemyAdjacentCount;
    private boolean extendable;

    public Group(int cellCount) {
        if (cellCount < 1) {
            throw new IllegalArgumentException("cellCount must be positive: " + cellCount);
        }
        this.status = new byte[cellCount];
        this.extendable = true;
    }

    private Group(Group source) {
        this.status = source.status.clone();
        this.memberCount = source.memberCount;
        this.libertyCount = source.libertyCount;
        this.enemyAdjacentCount = source.enemyAdjacentCount;
        this.extendable = source.extendable;
    }

    public int cellCount() {
        return status.length;
    }

    public CellStatus status(int cell) {
        return CellStatus.fromBits(status[cell]);
    }

    public boolean isMember(int cell) {
        return status(cell) == CellStatus.MEMBER;
    }

    public boolean isLiberty(int cell) {
        return status(cell) == CellStatus.LIBERTY;
    }

    public boolean isEnemyAdjacent(int cell) {
        return status(cell) == CellStatus.ENEMY_ADJACENT;
    }

    public void markMember(int cell) {
        update(cell, CellStatus.MEMBER);
    }

    /**
     * Records an empty cell reachable from the group. Ignored for member cells.
     */
    public void markLiberty(int cell) {
        if (!isMember(cell)) {
            update(cell, CellStatus.LIBERTY);
        }
    }

    /**
     * Records an opponent cell reachable from the group, replacing a liberty tag on the same cell.
     * Ignored for member cells.
     */
    public void markEnemyAdjacent(int cell) {
        if (!isMember(cell)) {
            update(cell, CellStatus.ENEMY_ADJACENT);
        }
    }

    /**
     * Unions the state of {@code other} into this group. Member tags dominate any other tag on the
     * same cell.
     */
    public void absorb(Group other) {
        Objects.requireNonNull(other, "other");
        if (other.status.length != status.length) {
            throw new IllegalArgumentException("Groups belong to boards of different size");
        }
        memberCount = 0;
        libertyCount = 0;
        enemyAdjacentCount = 0;
        for (int cell = 0; cell < status.length; cell++) {
            int merged = status[cell] | other.status[cell];
            CellStatus resolved = CellStatus.fromBits(merged);
            status[cell] = (byte) resolved.bit();
            count(resolved, 1);
        }
    }

    public int memberCount() {
        return memberCount;
    }

    public int libertyCount() {
        return libertyCount;
    }

    public int enemyAdjacentCount() {
        return enemyAdjacentCount;
    }

    /**
     * Returns {@code true} if the group is an entire isolated structure, as of the last call to
     * {@link #refreshExtendable()}.
     */
    public boolean isExtendable() {
        return extendable;
    }

    public void refreshExtendable() {
        extendable = enemyAdjacentCount == 0;
    }

    /**
     * Returns the cells carrying the given status, in ascending order.
     */
    public int[] cells(CellStatus wanted) {
        int size;
        switch (wanted) {
            case MEMBER:
                size = memberCount;
                break;
            case LIBERTY:
                size = libertyCount;
                break;
            case ENEMY_ADJACENT:
                size = enemyAdjacentCount;
                break;
            default:
                size = status.length - memberCount - libertyCount - enemyAdjacentCount;
                break;
        }
        int[] cells = new int[size];
        int index = 0;
        for (int cell = 0; cell < status.length; cell++) {
            if (status(cell) == wanted) {
                cells[index++] = cell;
            }
        }
        return cells;
    }

    public int[] members() {
        return cells(CellStatus.MEMBER);
    }

    public int[] liberties() {
        return cells(CellStatus.LIBERTY);
    }

    public int[] enemyAdjacent() {
        return cells(CellStatus.ENEMY_ADJACENT);
    }

    public Group copy() {
        return new Group(this);
    }

    private void update(int cell, CellStatus next) {
        CellStatus previous = status(cell);
        if (previous == next) {
            return;
        }
        count(previous, -1);
        count(next, 1);
        status[cell] = (byte) next.bit();
    }

    private void count(CellStatus value, int delta) {
        switch (value) {
            case MEMBER:
                memberCount += delta;
                break;
            case LIBERTY:
                libertyCount += delta;
                break;
            case ENEMY_ADJACENT:
                enemyAdjacentCount += delta;
                break;
            default:
                break;
        }
    }

    @Override
    public String toString() {
        return "Group[members=" + memberCount + ", liberties=" + libertyCount + ", enemyAdjacent="
                + enemyAdjacentCount + ", extendable=" + extendable + "]";
    }
}
