package com.tessera.core;

import java.util.Arrays;

/**
 * Hexagonal Tessera board of a given radius addressed by axial coordinates.
 * Each cell stores a packed tile value from {@link Tile}; {@link Tile#EMPTY} marks an empty cell.
 * Cells are numbered row by row, from the top row ({@code r = -radius}) to the bottom one and from
 * west to east inside a row.
 */
public final class Board {

    public static final int NO_CELL = -1;

    private final int radius;
    private final int[] qs;
    private final int[] rs;
    private final int[][] neighbors;
    private final int[] rowStart;
    private final byte[] tiles;

    /**
     * Creates an empty board of the provided radius.
     */
    public Board(int radius) {
        if (radius < 1) {
            throw new IllegalArgumentException("Radius must be at least 1: " + radius);
        }
        this.radius = radius;
        int count = cellCount(radius);
        this.qs = new int[count];
        this.rs = new int[count];
        this.rowStart = new int[2 * radius + 1];

        int index = 0;
        for (int r = -radius; r <= radius; r++) {
            rowStart[r + radius] = index;
            for (int q = minQ(r); q <= maxQ(r); q++) {
                qs[index] = q;
                rs[index] = r;
                index++;
            }
        }

        this.neighbors = new int[count][Side.COUNT];
        for (int cell = 0; cell < count; cell++) {
            for (Side side : Side.values()) {
                neighbors[cell][side.ordinal()] = cellAt(qs[cell] + side.dq(), rs[cell] + side.dr());
            }
        }
        this.tiles = new byte[count];
    }

    private Board(Board source) {
        this.radius = source.radius;
        this.qs = source.qs;
        this.rs = source.rs;
        this.neighbors = source.neighbors;
        this.rowStart = source.rowStart;
        this.tiles = source.tiles.clone();
    }

    /**
     * Returns the number of cells on a board of the given radius.
     */
    public static int cellCount(int radius) {
        return 3 * radius * (radius + 1) + 1;
    }

    public int getRadius() {
        return radius;
    }

    public int getCellCount() {
        return tiles.length;
    }

    /**
     * Returns the tile stored in the cell, or {@link Tile#EMPTY}.
     */
    public int get(int cell) {
        checkIndex(cell);
        return tiles[cell] & 0xFF;
    }

    /**
     * Stores a tile value in the cell. Passing {@link Tile#EMPTY} clears it.
     */
    public void set(int cell, int tile) {
        checkIndex(cell);
        if (!Tile.isValid(tile)) {
            throw new IllegalArgumentException("Invalid tile value: " + tile);
        }
        tiles[cell] = (byte) tile;
    }

    public boolean isEmpty(int cell) {
        return get(cell) == Tile.EMPTY;
    }

    /**
     * Returns {@code true} if no cell holds a tile.
     */
    public boolean isBlank() {
        for (byte tile : tiles) {
            if (tile != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the number of occupied cells.
     */
    public int countTiles() {
        int count = 0;
        for (byte tile : tiles) {
            if (tile != 0) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns the cell next to {@code cell} across {@code side}, or {@link #NO_CELL} if it lies off
     * the board.
     */
    public int neighbor(int cell, Side side) {
        checkIndex(cell);
        return neighbors[cell][side.ordinal()];
    }

    /**
     * Returns the index of the cell at the axial coordinates, or {@link #NO_CELL} if it lies off the
     * board.
     */
    public int cellAt(int q, int r) {
        if (r < -radius || r > radius || q < minQ(r) || q > maxQ(r)) {
            return NO_CELL;
        }
        return rowStart[r + radius] + (q - minQ(r));
    }

    public int q(int cell) {
        checkIndex(cell);
        return qs[cell];
    }

    public int r(int cell) {
        checkIndex(cell);
        return rs[cell];
    }

    public int minQ(int r) {
        return Math.max(-radius, -r - radius);
    }

    public int maxQ(int r) {
        return Math.min(radius, -r + radius);
    }

    /**
     * Returns a copy of the raw tile bytes.
     */
    public byte[] toBytes() {
        return tiles.clone();
    }

    /**
     * Returns an independent copy sharing only the immutable geometry tables.
     */
    public Board copy() {
        return new Board(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Board)) {
            return false;
        }
        Board other = (Board) o;
        return radius == other.radius && Arrays.equals(tiles, other.tiles);
    }

    @Override
    public int hashCode() {
        return 31 * radius + Arrays.hashCode(tiles);
    }

    private void checkIndex(int cell) {
        if (cell < 0 || cell >= tiles.length) {
            throw new IllegalArgumentException("Cell index out of range: " + cell);
        }
    }
}
