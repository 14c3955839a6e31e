package com.tessera.core;

import com.tessera.core.engine.GroupResolver;
import com.tessera.core.engine.LegalMoveGenerator;
import com.tessera.core.engine.MoveOutcome;
import com.tessera.core.engine.PartitionBuilder;
import com.tessera.core.engine.Position;
import com.tessera.core.group.Group;
import com.tessera.core.group.GroupArena;
import com.tessera.core.group.GroupHandle;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Immutable representation of the current state of a Tessera match.
 * The state keeps track of the board and its groups, both players' hands, the player to move,
 * the pass counter and the move number. Every transition returns a new instance and leaves this
 * one untouched.
 */
public final class GameState {

    private static final Logger LOGGER = Logger.getLogger(GameState.class.getName());
    private static final LegalMoveGenerator GENERATOR = new LegalMoveGenerator();
    private static final GroupResolver RESOLVER = new GroupResolver();

    private final GameConfig config;
    private final Position position;
    private final Hand firstHand;
    private final Hand secondHand;
    private final Player toMove;
    private final int consecutivePasses;
    private final int moveNumber;
    private final MoveOutcome lastOutcome;
    private Set<Move> legalMoves;

    /**
     * Creates the initial state with the default configuration.
     */
    public GameState() {
        this(GameConfig.defaults());
    }

    /**
     * Creates the initial state: an empty board, full hands and the first player to move.
     */
    public GameState(GameConfig config) {
        this(Objects.requireNonNull(config, "config"), Position.empty(config), config.initialHand(),
                config.initialHand(), Player.FIRST, 0, 0, null);
    }

    private GameState(GameConfig config, Position position, Hand firstHand, Hand secondHand, Player toMove,
            int consecutivePasses, int moveNumber, MoveOutcome lastOutcome) {
        this.config = config;
        this.position = position;
        this.firstHand = firstHand;
        this.secondHand = secondHand;
        this.toMove = toMove;
        this.consecutivePasses = consecutivePasses;
        this.moveNumber = moveNumber;
        this.lastOutcome = lastOutcome;
    }

    /**
     * Restores a state from a snapshot, rebuilding groups from the board.
     *
     * @throws IllegalArgumentException if the snapshot does not describe a reachable position
     */
    public static GameState fromSnapshot(GameSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        GameConfig config = snapshot.config();
        Board board = new Board(config.boardRadius());
        byte[] tiles = snapshot.tiles();
        for (int cell = 0; cell < tiles.length; cell++) {
            board.set(cell, tiles[cell] & 0xFF);
        }

        int mismatch = PartitionBuilder.findMismatch(board);
        if (mismatch != Board.NO_CELL) {
            throw new IllegalArgumentException("Snapshot tile at cell " + mismatch + " does not fit its neighbours");
        }

        Position position;
        try {
            position = PartitionBuilder.rebuild(board, config.handSize(), config.handSize());
        } catch (InvariantViolationException ex) {
            throw new IllegalArgumentException("Snapshot holds more groups than a match can produce", ex);
        }
        for (Player player : Player.values()) {
            GroupArena arena = position.arena(player);
            for (GroupHandle handle : arena.liveHandles()) {
                Group group = position.group(handle);
                if (group.libertyCount() == 0) {
                    throw new IllegalArgumentException("Snapshot holds a group of " + player + " without liberties");
                }
            }
            if (arena.liveCount() + snapshot.hand(player).size() > config.handSize()) {
                throw new IllegalArgumentException("Snapshot groups and hand of " + player + " exceed the hand size");
            }
        }
        return new GameState(config, position, snapshot.firstHand(), snapshot.secondHand(), snapshot.toMove(),
                snapshot.consecutivePasses(), snapshot.moveNumber(), null);
    }

    public GameConfig getConfig() {
        return config;
    }

    /**
     * Returns a copy of the board.
     */
    public Board getBoard() {
        return position.board().copy();
    }

    /**
     * Returns a copy of the engine position, groups included.
     */
    public Position getPosition() {
        return position.copy();
    }

    public int tileAt(int cell) {
        return position.board().get(cell);
    }

    public Player getToMove() {
        return toMove;
    }

    public Hand getHand(Player player) {
        Objects.requireNonNull(player, "player");
        return player == Player.FIRST ? firstHand : secondHand;
    }

    /**
     * Returns the number of turns taken so far, passes included.
     */
    public int getMoveNumber() {
        return moveNumber;
    }

    public int getConsecutivePasses() {
        return consecutivePasses;
    }

    /**
     * Returns the outcome of the placement that produced this state, or {@code null} after a pass
     * and for the initial state.
     */
    public MoveOutcome getLastOutcome() {
        return lastOutcome;
    }

    /**
     * Returns the number of tiles the player currently controls.
     */
    public int getScore(Player player) {
        return ScoreCalculator.controlledCells(position.board(), player);
    }

    /**
     * Returns the player controlling more tiles, or {@code null} on a tie.
     */
    public Player getLeader() {
        return ScoreCalculator.leader(position.board());
    }

    /**
     * Returns {@code true} once both players have passed in succession.
     */
    public boolean isGameOver() {
        return consecutivePasses >= 2;
    }

    /**
     * Returns the placements available to the player to move. Computed on first use and cached.
     */
    public Set<Move> legalMoves() {
        if (isGameOver()) {
            return Set.of();
        }
        if (legalMoves == null) {
            legalMoves = GENERATOR.regenerate(position, getHand(toMove), toMove);
        }
        return legalMoves;
    }

    /**
     * Places a tile with the given connections for the player to move.
     */
    public GameState applyMove(int cell, int connections) {
        return applyMove(Move.of(cell, connections, toMove));
    }

    /**
     * Applies the provided move and returns the resulting state.
     *
     * @throws DeclinedMoveException if the move is refused; this state is left untouched
     * @throws InvariantViolationException if the engine detects a broken invariant
     */
    public GameState applyMove(Move move) {
        Objects.requireNonNull(move, "move");
        if (isGameOver()) {
            throw new DeclinedMoveException(DeclinedMoveException.Reason.GAME_OVER, move, "The game is over");
        }
        if (move.player() != toMove) {
            throw new DeclinedMoveException(DeclinedMoveException.Reason.WRONG_TURN, move,
                    "It is " + toMove + "'s turn");
        }
        Hand hand = getHand(toMove);
        if (!hand.contains(move.connections())) {
            throw new DeclinedMoveException(DeclinedMoveException.Reason.TILE_NOT_IN_HAND, move,
                    "Tile " + Tile.toString(move.tile()) + " is not in " + toMove + "'s hand");
        }
        if (!legalMoves().contains(move)) {
            throw new DeclinedMoveException(DeclinedMoveException.Reason.NOT_LEGAL, move,
                    "Tile " + Tile.toString(move.tile()) + " cannot be placed on cell " + move.cell());
        }

        Position next = position.copy();
        int nextMoveNumber = moveNumber + 1;
        MoveOutcome outcome = RESOLVER.apply(next, move, nextMoveNumber);
        Hand remaining = hand.without(move.connections());
        Hand nextFirst = toMove == Player.FIRST ? remaining : firstHand;
        Hand nextSecond = toMove == Player.SECOND ? remaining : secondHand;
        return new GameState(config, next, nextFirst, nextSecond, toMove.opponent(), 0, nextMoveNumber, outcome);
    }

    /**
     * Passes the turn. Two passes in a row end the game.
     *
     * @throws DeclinedMoveException if the game is already over
     */
    public GameState pass() {
        if (isGameOver()) {
            throw new DeclinedMoveException(DeclinedMoveException.Reason.GAME_OVER, null, "The game is over");
        }
        GameState next = new GameState(config, position, firstHand, secondHand, toMove.opponent(),
                consecutivePasses + 1, moveNumber + 1, null);
        if (next.isGameOver()) {
            LOGGER.info(() -> String.format("Game over after %d moves: FIRST=%d, SECOND=%d", next.moveNumber,
                    next.getScore(Player.FIRST), next.getScore(Player.SECOND)));
        }
        return next;
    }

    public GameSnapshot toSnapshot() {
        return new GameSnapshot(config, position.board().toBytes(), firstHand, secondHand, toMove,
                consecutivePasses, moveNumber);
    }
}
