package com.minichess.core.ai.state;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.minichess.core.Board;
import com.minichess.core.GameState;
import com.minichess.core.Move;
import com.minichess.core.Piece;
import com.minichess.core.PieceKind;
import com.minichess.core.Side;
import com.minichess.core.ai.Evaluator;
import com.minichess.core.ai.Heuristic;
import org.junit.jupiter.api.Test;

class SearchStateTest {

    @Test
    void pushAndPopRestoreEveryGeneratedMove() {
        SearchState state = new SearchState();
        state.reset(new GameState());
        Piece[] before = state.snapshot();

        int count = state.generateMoves();
        assertEquals(13, count);
        for (int i = 0; i < count; i++) {
            state.pushGenerated(0, i);
            assertEquals(1, state.ply());
            assertSame(Side.BLACK, state.sideToMove());

            int replies = state.generateMoves();
            for (int j = 0; j < replies; j++) {
                state.pushGenerated(1, j);
                state.pop();
            }

            state.pop();
            assertArrayEquals(before, state.snapshot());
            assertSame(Side.WHITE, state.sideToMove());
            assertEquals(0, state.ply());
        }
    }

    @Test
    void appliedMovesMatchImmutableBoard() {
        GameState game = new GameState();
        SearchState state = new SearchState();
        state.reset(game);

        String[][] shuffle = {{"b1", "a3"}, {"d5", "e3"}, {"a3", "b1"}, {"e3", "d5"}, {"b2", "b3"}, {"c4", "c3"}};
        for (String[] step : shuffle) {
            Move move = game.findMove(cell(step[0]), cell(step[1]));
            assertNotNull(move, "Expected a legal move " + step[0] + " -> " + step[1]);
            state.push(move);
            game = game.applyMove(move);
            assertArrayEquals(game.getBoard().toArray(), state.snapshot());
            assertEquals(game.getHalfMovesSinceCapture(), state.halfMoveClock());
            assertSame(game.getSideToMove(), state.sideToMove());
        }
        assertFalse(game.isGameOver());
    }

    @Test
    void promotionIsUndone() {
        SearchState state = stateOf(new GameState(Board.fromRows(
                "bK .  .  .  .",
                ".  .  wp .  .",
                ".  .  .  .  .",
                ".  .  .  .  .",
                ".  .  .  .  wK"), Side.WHITE));
        Move promotion = new Move(Board.index(1, 2), Board.index(0, 2), null, true);

        state.push(promotion);
        assertEquals(Piece.of(PieceKind.QUEEN, Side.WHITE), state.pieceAt(Board.index(0, 2)));

        state.pop();
        assertEquals(Piece.of(PieceKind.PAWN, Side.WHITE), state.pieceAt(Board.index(1, 2)));
        assertEquals(null, state.pieceAt(Board.index(0, 2)));
    }

    @Test
    void tracksKingCaptureAndClock() {
        SearchState state = new SearchState();
        state.initialize(Board.fromRows(
                "bK .  .  .  .",
                ".  .  .  .  .",
                ".  .  .  .  .",
                ".  .  .  .  .",
                "wQ .  .  .  wK").toArray(), Side.WHITE, 12);

        state.push(new Move(Board.index(4, 4), Board.index(3, 4), null, false));
        assertEquals(13, state.halfMoveClock());
        assertFalse(state.isKingCaptured());
        state.pop();

        state.push(new Move(Board.index(4, 0), Board.index(0, 0), Piece.of(PieceKind.KING, Side.BLACK), false));
        assertTrue(state.isKingCaptured());
        assertEquals(0, state.halfMoveClock());

        state.pop();
        assertFalse(state.isKingCaptured());
        assertEquals(12, state.halfMoveClock());
    }

    @Test
    void reportsDrawAtLimit() {
        SearchState state = stateOf(new GameState(Board.initial(), Side.WHITE, GameState.DRAW_HALF_MOVE_LIMIT - 1));
        assertFalse(state.isDrawn());

        state.push(new Move(Board.index(4, 1), Board.index(2, 0), null, false));
        assertTrue(state.isDrawn());
    }

    @Test
    void evaluatesFromSideToMove() {
        GameState game = new GameState(Board.fromRows(
                "bK .  .  .  .",
                ".  .  .  .  .",
                ".  .  wQ .  .",
                ".  .  .  .  .",
                ".  .  .  .  wK"), Side.BLACK);
        SearchState state = stateOf(game);

        assertEquals(Evaluator.evaluate(Heuristic.E1, game.getBoard(), Side.BLACK),
                state.evaluateCurrent(Heuristic.E1));
        assertTrue(state.evaluateCurrent(Heuristic.E0) < 0);
    }

    @Test
    void rejectsInconsistentMoves() {
        SearchState state = stateOf(new GameState());

        Move fromEmpty = new Move(Board.index(2, 2), Board.index(1, 2), null, false);
        assertThrows(IllegalStateException.class, () -> state.push(fromEmpty));

        Move blackPawn = new Move(Board.index(1, 2), Board.index(2, 2), null, false);
        assertThrows(IllegalStateException.class, () -> state.push(blackPawn));

        Move phantomCapture = new Move(Board.index(3, 1), Board.index(2, 1),
                Piece.of(PieceKind.PAWN, Side.BLACK), false);
        assertThrows(IllegalStateException.class, () -> state.push(phantomCapture));

        assertThrows(IllegalStateException.class, state::pop);
        assertEquals(0, state.ply());
    }

    @Test
    void rejectsMalformedBoard() {
        SearchState state = new SearchState();
        assertThrows(IllegalArgumentException.class, () -> state.initialize(new Piece[3], Side.WHITE, 0));
    }

    private static SearchState stateOf(GameState game) {
        SearchState state = new SearchState();
        state.reset(game);
        return state;
    }

    private static int cell(String name) {
        int col = name.charAt(0) - 'a';
        int row = Board.SIZE - (name.charAt(1) - '0');
        return Board.index(row, col);
    }
}
