package com.tessera.core;

/**
 * Placement of a tile on a board cell. The tile carries the mover in its owner and controller bits.
 */
public record Move(int cell, int tile) {

    public Move {
        if (cell < 0) {
            throw new IllegalArgumentException("Cell index must not be negative: " + cell);
        }
        Tile.checkConnections(Tile.connections(tile));
        if (Tile.isCaptured(tile)) {
            throw new IllegalArgumentException("A placed tile must be controlled by its owner");
        }
    }

    public static Move of(int cell, int connections, Player player) {
        return new Move(cell, Tile.of(connections, player));
    }

    public Player player() {
        return Tile.owner(tile);
    }

    public int connections() {
        return Tile.connections(tile);
    }

    @Override
    public String toString() {
        return "Move[cell=" + cell + ", tile=" + Tile.toString(tile) + "]";
    }
}
