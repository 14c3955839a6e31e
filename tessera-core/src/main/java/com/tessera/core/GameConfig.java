package com.tessera.core;

/**
 * Immutable match configuration: the board radius and how many copies of every connection mask
 * each player starts with.
 */
public record GameConfig(int boardRadius, int copiesPerTile) {

    public static final int DEFAULT_RADIUS = 6;
    public static final int DEFAULT_COPIES = 1;
    public static final int MAX_RADIUS = 12;
    public static final int MAX_COPIES = 4;

    public static final String RADIUS_PROPERTY = "tessera.radius";
    public static final String COPIES_PROPERTY = "tessera.copies";

    public GameConfig {
        if (boardRadius < 1 || boardRadius > MAX_RADIUS) {
            throw new IllegalArgumentException("boardRadius must be between 1 and " + MAX_RADIUS + ": " + boardRadius);
        }
        if (copiesPerTile < 1 || copiesPerTile > MAX_COPIES) {
            throw new IllegalArgumentException("copiesPerTile must be between 1 and " + MAX_COPIES + ": "
                    + copiesPerTile);
        }
    }

    public static GameConfig defaults() {
        return new GameConfig(DEFAULT_RADIUS, DEFAULT_COPIES);
    }

    /**
     * Reads {@value #RADIUS_PROPERTY} and {@value #COPIES_PROPERTY}, falling back to the defaults.
     */
    public static GameConfig fromSystemProperties() {
        return new GameConfig(Integer.getInteger(RADIUS_PROPERTY, DEFAULT_RADIUS),
                Integer.getInteger(COPIES_PROPERTY, DEFAULT_COPIES));
    }

    public GameConfig withBoardRadius(int radius) {
        return new GameConfig(radius, copiesPerTile);
    }

    public GameConfig withCopiesPerTile(int copies) {
        return new GameConfig(boardRadius, copies);
    }

    /**
     * Number of tiles each player starts with; also the capacity of each player's group arena.
     */
    public int handSize() {
        return copiesPerTile * Tile.MAX_CONNECTIONS;
    }

    public Hand initialHand() {
        return Hand.full(copiesPerTile);
    }
}
