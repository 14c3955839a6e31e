package com.tessera.core;

import com.tessera.core.engine.MoveOutcome;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Scanner;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Simple console front-end for playing a full Tessera match between two humans.
 */
public final class TesseraCLI {

    private static final Logger LOGGER = Logger.getLogger(TesseraCLI.class.getName());

    private TesseraCLI() {
    }

    public static void main(String[] args) {
        GameState state;
        try {
            state = initialState(args);
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
            return;
        } catch (IllegalArgumentException | UncheckedIOException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            printUsage();
            return;
        }

        Scanner scanner = new Scanner(System.in);
        System.out.println("Tessera, console edition");
        while (!state.isGameOver()) {
            printBoard(state);
            System.out.printf("Scores: FIRST %d, SECOND %d%n", state.getScore(Player.FIRST),
                    state.getScore(Player.SECOND));
            System.out.printf("%s to move (%d tiles in hand): ", state.getToMove(),
                    state.getHand(state.getToMove()).size());
            if (!scanner.hasNextLine()) {
                return;
            }
            String input = scanner.nextLine().trim();
            if (input.isEmpty()) {
                continue;
            }
            if ("quit".equals(input)) {
                return;
            }
            state = handle(state, input);
        }

        printBoard(state);
        int first = state.getScore(Player.FIRST);
        int second = state.getScore(Player.SECOND);
        System.out.printf("Final scores: FIRST %d, SECOND %d%n", first, second);
        Player leader = state.getLeader();
        System.out.println(leader == null ? "The game is a draw" : "Winner: " + leader);
    }

    static GameState initialState(String[] args) {
        GameConfig config = GameConfig.fromSystemProperties();
        Path loadPath = null;
        for (String option : args) {
            if (option.startsWith("--radius=")) {
                config = config.withBoardRadius(Integer.parseInt(option.substring("--radius=".length())));
            } else if (option.startsWith("--copies=")) {
                config = config.withCopiesPerTile(Integer.parseInt(option.substring("--copies=".length())));
            } else if (option.startsWith("--load=")) {
                if (loadPath != null) {
                    throw new IllegalArgumentException("Snapshot path specified more than once");
                }
                loadPath = Paths.get(option.substring("--load=".length()));
            } else {
                throw new IllegalArgumentException("Unrecognised argument: " + option);
            }
        }
        if (loadPath != null) {
            return GameState.fromSnapshot(GameSnapshot.readFrom(loadPath));
        }
        return new GameState(config);
    }

    /**
     * Executes one console command and returns the resulting state. Invalid input leaves the state
     * unchanged.
     */
    static GameState handle(GameState state, String input) {
        String[] parts = input.split("\\s+");
        switch (parts[0]) {
            case "pass":
                return state.pass();
            case "moves":
                printMoves(state);
                return state;
            case "save":
                if (parts.length != 2) {
                    System.out.println("Usage: save <path>");
                    return state;
                }
                try {
                    state.toSnapshot().writeTo(Paths.get(parts[1]));
                    System.out.println("Saved to " + parts[1]);
                } catch (UncheckedIOException ex) {
                    System.out.println("Could not save: " + ex.getCause().getMessage());
                }
                return state;
            default:
                break;
        }

        if (parts.length != 3) {
            System.out.println("Enter <q> <r> <mask-hex>, pass, moves, save <path> or quit.");
            return state;
        }
        int cell;
        int connections;
        try {
            int q = Integer.parseInt(parts[0]);
            int r = Integer.parseInt(parts[1]);
            connections = Integer.parseInt(parts[2], 16);
            cell = state.getBoard().cellAt(q, r);
        } catch (NumberFormatException ex) {
            System.out.println("Please enter valid coordinates and a hexadecimal mask.");
            return state;
        }
        if (cell == Board.NO_CELL) {
            System.out.println("Coordinates lie off the board.");
            return state;
        }
        if (connections < Tile.MIN_CONNECTIONS || connections > Tile.MAX_CONNECTIONS) {
            System.out.println("Mask must be between 01 and 3f.");
            return state;
        }

        try {
            GameState next = state.applyMove(cell, connections);
            MoveOutcome outcome = next.getLastOutcome();
            if (outcome.hasCaptures()) {
                System.out.printf("Captured %d group(s)%n", outcome.capturedGroups());
            }
            if (outcome.selfCapture()) {
                System.out.println("The placed structure was captured");
            }
            return next;
        } catch (DeclinedMoveException ex) {
            System.out.println("Move declined (" + ex.getReason() + "): " + ex.getMessage());
            return state;
        }
    }

    private static void printMoves(GameState state) {
        Board board = state.getBoard();
        int printed = 0;
        for (Move move : state.legalMoves()) {
            System.out.printf("%d %d %02x%n", board.q(move.cell()), board.r(move.cell()), move.connections());
            printed++;
        }
        System.out.printf("%d legal placement(s)%n", printed);
    }

    private static void printBoard(GameState state) {
        Board board = state.getBoard();
        int radius = board.getRadius();
        for (int r = -radius; r <= radius; r++) {
            StringBuilder row = new StringBuilder();
            for (int i = 0; i < Math.abs(r); i++) {
                row.append("  ");
            }
            for (int q = board.minQ(r); q <= board.maxQ(r); q++) {
                String label = Tile.toString(board.get(board.cellAt(q, r)));
                row.append(String.format("%-3s ", label.length() == 1 ? " " + label : label));
            }
            System.out.println(row.toString().stripTrailing());
        }
    }

    private static void printUsage() {
        System.err.println("Usage: TesseraCLI [--radius=<1-12>] [--copies=<1-4>] [--load=<path>]");
    }
}
