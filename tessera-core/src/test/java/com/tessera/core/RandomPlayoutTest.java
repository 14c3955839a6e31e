package com.tessera.core;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import com.tessera.core.engine.GroupResolver;
import com.tessera.core.engine.LegalMoveGenerator;
import com.tessera.core.engine.PartitionBuilder;
import com.tessera.core.engine.Position;
import com.tessera.core.group.Group;
import com.tessera.core.group.GroupHandle;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Plays seeded random matches and cross-checks the incremental group bookkeeping against a full
 * rebuild after every turn.
 */
class RandomPlayoutTest {

    private static final int MAX_TURNS = 400;
    private static final int SAMPLED_LEGAL_MOVES = 8;

    private final LegalMoveGenerator generator = new LegalMoveGenerator();
    private final GroupResolver resolver = new GroupResolver();

    @ParameterizedTest
    @ValueSource(longs = {1L, 7L, 42L, 1234L, 99991L})
    void incrementalGroupsMatchRebuildThroughoutTheGame(long seed) {
        Random random = new Random(seed);
        GameConfig config = new GameConfig(3, 1);
        GameState state = new GameState(config);

        int turns = 0;
        while (!state.isGameOver() && turns < MAX_TURNS) {
            Position position = state.getPosition();
            checkPartition(position);
            checkReconstruction(position, config);
            checkLegalityAgreement(state, random);
            if (turns % 10 == 0) {
                checkSnapshotRoundTrip(state);
            }

            List<Move> moves = new ArrayList<>(state.legalMoves());
            if (moves.isEmpty()) {
                state = state.pass();
            } else {
                state = state.applyMove(moves.get(random.nextInt(moves.size())));
            }
            turns++;
        }

        assertTrue(state.isGameOver(), "Game should end within " + MAX_TURNS + " turns");
        Board board = state.getBoard();
        assertTrue(board.countTiles() > 0);
        assertEquals(board.countTiles(), state.getScore(Player.FIRST) + state.getScore(Player.SECOND));
        int placed = 2 * config.handSize() - state.getHand(Player.FIRST).size()
                - state.getHand(Player.SECOND).size();
        assertEquals(board.countTiles(), placed);
    }

    private void checkPartition(Position position) {
        Board board = position.board();
        int members = 0;
        for (int cell = 0; cell < board.getCellCount(); cell++) {
            GroupHandle handle = position.handleAt(cell);
            if (board.isEmpty(cell)) {
                assertNull(handle, "Empty cell " + cell + " has a group");
                continue;
            }
            assertNotNull(handle, "Occupied cell " + cell + " has no group");
            assertSame(Tile.controller(board.get(cell)), handle.owner());
            assertTrue(position.group(handle).isMember(cell));
        }

        for (Player player : Player.values()) {
            for (GroupHandle handle : position.arena(player).liveHandles()) {
                Group group = position.group(handle);
                assertTrue(group.libertyCount() >= 1, "Group " + handle + " has no liberty");
                for (int member : group.members()) {
                    assertEquals(handle, position.handleAt(member));
                }
                for (int liberty : group.liberties()) {
                    assertTrue(board.isEmpty(liberty));
                }
                for (int edge : group.enemyAdjacent()) {
                    assertNotEquals(player, Tile.controller(board.get(edge)));
                }
                members += group.memberCount();
            }
        }
        assertEquals(board.countTiles(), members);
    }

    private void checkReconstruction(Position position, GameConfig config) {
        Board board = position.board();
        Position rebuilt = PartitionBuilder.rebuild(board, config.handSize(), config.handSize());
        for (Player player : Player.values()) {
            assertEquals(position.arena(player).liveCount(), rebuilt.arena(player).liveCount());
        }
        for (int cell = 0; cell < board.getCellCount(); cell++) {
            if (board.isEmpty(cell)) {
                continue;
            }
            Group expected = position.groupAt(cell);
            Group actual = rebuilt.groupAt(cell);
            assertArrayEquals(actual.members(), expected.members());
            assertArrayEquals(actual.liberties(), expected.liberties());
            assertArrayEquals(actual.enemyAdjacent(), expected.enemyAdjacent());
            assertEquals(actual.isExtendable(), expected.isExtendable(), "extendable flag of cell " + cell);
        }
    }

    private void checkLegalityAgreement(GameState state, Random random) {
        Position position = state.getPosition();
        Player mover = state.getToMove();
        List<Move> legal = new ArrayList<>();
        for (int cell = 0; cell < position.board().getCellCount(); cell++) {
            for (int mask : state.getHand(mover).masks()) {
                int tile = Tile.of(mask, mover);
                LegalMoveGenerator.Verdict verdict = generator.evaluate(position, mover, cell, tile);
                if (verdict == LegalMoveGenerator.Verdict.LEGAL) {
                    legal.add(new Move(cell, tile));
                } else if (verdict == LegalMoveGenerator.Verdict.OSCILLATION) {
                    checkOscillation(position, new Move(cell, tile));
                }
            }
        }
        assertEquals(state.legalMoves().size(), legal.size());
        assertTrue(state.legalMoves().containsAll(legal));

        for (int i = 0; i < SAMPLED_LEGAL_MOVES && !legal.isEmpty(); i++) {
            Move move = legal.get(random.nextInt(legal.size()));
            Position scratch = position.copy();
            resolver.apply(scratch, move, state.getMoveNumber() + 1);
            checkPartition(scratch);
        }
    }

    private void checkOscillation(Position position, Move move) {
        Position scratch = position.copy();
        try {
            resolver.apply(scratch, move, 0);
            fail("Oscillating move " + move + " was resolved");
        } catch (InvariantViolationException ex) {
            assertSame(InvariantViolationException.Kind.OSCILLATION, ex.getKind());
            Group stuck = scratch.groupAt(move.cell());
            assertEquals(0, stuck.libertyCount());
            assertEquals(0, stuck.enemyAdjacentCount());
        }
    }

    private void checkSnapshotRoundTrip(GameState state) {
        GameState restored = GameState.fromSnapshot(state.toSnapshot());
        assertEquals(state.getBoard(), restored.getBoard());
        assertEquals(state.getToMove(), restored.getToMove());
        assertEquals(state.legalMoves(), restored.legalMoves());
    }
}
