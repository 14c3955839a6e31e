package com.tessera.core;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistable view of a match: the board tiles, both hands, the player to move, the pass counter
 * and the move number. Groups are not stored; they are rebuilt from the tiles when a snapshot is
 * turned back into a {@link GameState}.
 */
public record GameSnapshot(GameConfig config, byte[] tiles, Hand firstHand, Hand secondHand, Player toMove,
        int consecutivePasses, int moveNumber) {

    private static final Logger LOGGER = Logger.getLogger(GameSnapshot.class.getName());
    private static final int MAGIC = 0x54455353;
    private static final int VERSION = 1;

    public GameSnapshot {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(tiles, "tiles");
        Objects.requireNonNull(firstHand, "firstHand");
        Objects.requireNonNull(secondHand, "secondHand");
        Objects.requireNonNull(toMove, "toMove");
        if (tiles.length != Board.cellCount(config.boardRadius())) {
            throw new IllegalArgumentException("Expected " + Board.cellCount(config.boardRadius())
                    + " tiles but got " + tiles.length);
        }
        if (consecutivePasses < 0 || consecutivePasses > 2) {
            throw new IllegalArgumentException("consecutivePasses out of range: " + consecutivePasses);
        }
        if (moveNumber < 0) {
            throw new IllegalArgumentException("moveNumber must not be negative: " + moveNumber);
        }
        tiles = tiles.clone();
    }

    @Override
    public byte[] tiles() {
        return tiles.clone();
    }

    public Hand hand(Player player) {
        return player == Player.FIRST ? firstHand : secondHand;
    }

    /**
     * Writes the snapshot to {@code path}, creating parent directories as needed.
     */
    public void writeTo(Path path) {
        Objects.requireNonNull(path, "path");
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to prepare directory for snapshot", ex);
            throw new UncheckedIOException(ex);
        }

        try (DataOutputStream output = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(path)))) {
            output.writeInt(MAGIC);
            output.writeByte(VERSION);
            output.writeByte(config.boardRadius());
            output.writeByte(config.copiesPerTile());
            output.writeInt(tiles.length);
            output.write(tiles);
            writeHand(output, firstHand);
            writeHand(output, secondHand);
            output.writeByte(toMove.ordinal());
            output.writeByte(consecutivePasses);
            output.writeInt(moveNumber);
            output.flush();
            LOGGER.info(() -> String.format("Saved snapshot of move %d to %s", moveNumber, path));
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to save snapshot to " + path, ex);
            throw new UncheckedIOException(ex);
        }
    }

    /**
     * Reads a snapshot previously written by {@link #writeTo(Path)}.
     *
     * @throws IllegalArgumentException if the file is not a snapshot of a supported version
     */
    public static GameSnapshot readFrom(Path path) {
        Objects.requireNonNull(path, "path");
        try (DataInputStream input = new DataInputStream(new BufferedInputStream(Files.newInputStream(path)))) {
            int magic = input.readInt();
            if (magic != MAGIC) {
                throw new IllegalArgumentException("Not a Tessera snapshot: " + path);
            }
            int version = input.readUnsignedByte();
            if (version != VERSION) {
                throw new IllegalArgumentException("Unsupported snapshot version " + version + " in " + path);
            }
            GameConfig config = new GameConfig(input.readUnsignedByte(), input.readUnsignedByte());
            int length = input.readInt();
            if (length != Board.cellCount(config.boardRadius())) {
                throw new IllegalArgumentException("Snapshot tile count " + length + " does not match radius "
                        + config.boardRadius());
            }
            byte[] tiles = new byte[length];
            input.readFully(tiles);
            Hand firstHand = readHand(input);
            Hand secondHand = readHand(input);
            int toMove = input.readUnsignedByte();
            if (toMove >= Player.values().length) {
                throw new IllegalArgumentException("Invalid player to move: " + toMove);
            }
            int passes = input.readUnsignedByte();
            int moveNumber = input.readInt();
            GameSnapshot snapshot = new GameSnapshot(config, tiles, firstHand, secondHand,
                    Player.values()[toMove], passes, moveNumber);
            LOGGER.info(() -> String.format("Loaded snapshot of move %d from %s", moveNumber, path));
            return snapshot;
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to load snapshot from " + path, ex);
            throw new UncheckedIOException(ex);
        }
    }

    private static void writeHand(DataOutputStream output, Hand hand) throws IOException {
        int[] counts = hand.toCounts();
        for (int mask = Tile.MIN_CONNECTIONS; mask <= Tile.MAX_CONNECTIONS; mask++) {
            output.writeByte(counts[mask]);
        }
    }

    private static Hand readHand(DataInputStream input) throws IOException {
        int[] counts = new int[Tile.MAX_CONNECTIONS + 1];
        for (int mask = Tile.MIN_CONNECTIONS; mask <= Tile.MAX_CONNECTIONS; mask++) {
            counts[mask] = input.readUnsignedByte();
        }
        return Hand.ofCounts(counts);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GameSnapshot)) {
            return false;
        }
        GameSnapshot other = (GameSnapshot) o;
        return config.equals(other.config)
                && Arrays.equals(tiles, other.tiles)
                && firstHand.equals(other.firstHand)
                && secondHand.equals(other.secondHand)
                && toMove == other.toMove
                && consecutivePasses == other.consecutivePasses
                && moveNumber == other.moveNumber;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(config, firstHand, secondHand, toMove, consecutivePasses, moveNumber);
        return 31 * result + Arrays.hashCode(tiles);
    }

    @Override
    public String toString() {
        return "GameSnapshot[config=" + config + ", moveNumber=" + moveNumber + ", toMove=" + toMove
                + ", consecutivePasses=" + consecutivePasses + "]";
    }
}
