package com.tessera.core;

import java.util.Arrays;

/**
 * Immutable multiset of the connection masks a player can still place.
 */
public final class Hand {

    private final int[] counts;
    private final int size;

    private Hand(int[] counts) {
        this.counts = counts;
        int total = 0;
        for (int count : counts) {
            total += count;
        }
        this.size = total;
    }

    /**
     * Creates a hand holding {@code copies} tiles of every playable connection mask.
     */
    public static Hand full(int copies) {
        if (copies < 1) {
            throw new IllegalArgumentException("Copies must be at least 1: " + copies);
        }
        int[] counts = new int[Tile.MAX_CONNECTIONS + 1];
        for (int mask = Tile.MIN_CONNECTIONS; mask <= Tile.MAX_CONNECTIONS; mask++) {
            counts[mask] = copies;
        }
        return new Hand(counts);
    }

    /**
     * Creates a hand from per-mask counts, indexed by connection mask. Index zero must be empty.
     */
    public static Hand ofCounts(int[] counts) {
        if (counts == null || counts.length != Tile.MAX_CONNECTIONS + 1) {
            throw new IllegalArgumentException("Expected " + (Tile.MAX_CONNECTIONS + 1) + " counts");
        }
        if (counts[0] != 0) {
            throw new IllegalArgumentException("A hand cannot hold the disconnected tile");
        }
        for (int count : counts) {
            if (count < 0) {
                throw new IllegalArgumentException("Counts must not be negative");
            }
        }
        return new Hand(counts.clone());
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int count(int connections) {
        Tile.checkConnections(connections);
        return counts[connections];
    }

    public boolean contains(int connections) {
        return count(connections) > 0;
    }

    /**
     * Returns the distinct connection masks available, in ascending order.
     */
    public int[] masks() {
        int distinct = 0;
        for (int mask = Tile.MIN_CONNECTIONS; mask <= Tile.MAX_CONNECTIONS; mask++) {
            if (counts[mask] > 0) {
                distinct++;
            }
        }
        int[] masks = new int[distinct];
        int index = 0;
        for (int mask = Tile.MIN_CONNECTIONS; mask <= Tile.MAX_CONNECTIONS; mask++) {
            if (counts[mask] > 0) {
                masks[index++] = mask;
            }
        }
        return masks;
    }

    /**
     * Returns a new hand with one copy of {@code connections} withdrawn.
     */
    public Hand without(int connections) {
        if (!contains(connections)) {
            throw new IllegalArgumentException("Hand does not hold connection mask " + connections);
        }
        int[] updated = counts.clone();
        updated[connections]--;
        return new Hand(updated);
    }

    public int[] toCounts() {
        return counts.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Hand)) {
            return false;
        }
        return Arrays.equals(counts, ((Hand) o).counts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(counts);
    }

    @Override
    public String toString() {
        return "Hand[size=" + size + "]";
    }
}
