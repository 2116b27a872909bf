package com.minichess.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class GameStateTest {

    @Test
    void initialStateHasWhiteToMove() {
        GameState state = new GameState();
        assertSame(Side.WHITE, state.getSideToMove());
        assertEquals(0, state.getHalfMovesSinceCapture());
        assertEquals(GameOutcome.IN_PROGRESS, state.outcome());
        assertFalse(state.isGameOver());
        assertEquals(13, state.legalMoves().size());
    }

    @Test
    void quietMoveIncrementsCounterAndPassesTurn() {
        GameState state = new GameState(Board.initial(), Side.WHITE, 7);
        GameState next = state.applyMove(move(state, "b1", "a3"));

        assertEquals(8, next.getHalfMovesSinceCapture());
        assertSame(Side.BLACK, next.getSideToMove());
        assertEquals(7, state.getHalfMovesSinceCapture());
    }

    @Test
    void captureResetsCounter() {
        GameState state = new GameState(Board.initial(), Side.WHITE, 7);
        GameState next = state.applyMove(move(state, "d1", "d4"));

        assertEquals(0, next.getHalfMovesSinceCapture());
        assertEquals(11, next.getBoard().countPieces());
    }

    @Test
    void drawFiresAfterTwentyQuietHalfMoves() {
        GameState state = new GameState();
        String[][] cycle = {{"b1", "a3"}, {"d5", "e3"}, {"a3", "b1"}, {"e3", "d5"}};

        for (int halfMove = 0; halfMove < GameState.DRAW_HALF_MOVE_LIMIT; halfMove++) {
            assertFalse(state.isGameOver(), "Draw fired early after " + halfMove + " half-moves");
            String[] step = cycle[halfMove % cycle.length];
            state = state.applyMove(move(state, step[0], step[1]));
        }

        assertTrue(state.isDraw());
        assertTrue(state.isGameOver());
        assertEquals(GameOutcome.DRAW, state.outcome());
        GameState drawn = state;
        Move quiet = drawn.legalMoves().get(0);
        assertThrows(IllegalStateException.class, () -> drawn.applyMove(quiet));
    }

    @Test
    void pawnReachingFarRankBecomesQueen() {
        Board board = Board.fromRows(
                "bK .  .  .  .",
                ".  .  wp .  .",
                ".  .  .  .  .",
                ".  .  bp .  .",
                ".  .  .  .  wK");
        GameState state = new GameState(board, Side.WHITE);

        GameState afterWhite = state.applyMove(move(state, "c4", "c5"));
        assertEquals(Piece.of(PieceKind.QUEEN, Side.WHITE), afterWhite.getBoard().pieceAt(0, 2));
        assertNull(afterWhite.getBoard().pieceAt(1, 2));

        GameState afterBlack = afterWhite.applyMove(move(afterWhite, "c2", "c1"));
        assertEquals(Piece.of(PieceKind.QUEEN, Side.BLACK), afterBlack.getBoard().pieceAt(4, 2));
    }

    @Test
    void capturingKingEndsGame() {
        Board board = Board.fromRows(
                "bK .  .  .  .",
                ".  .  .  .  .",
                ".  .  .  .  .",
                ".  .  .  .  .",
                "wQ .  .  .  wK");
        GameState state = new GameState(board, Side.WHITE, 5);
        GameState next = state.applyMove(move(state, "a1", "a5"));

        assertTrue(next.isGameOver());
        assertEquals(GameOutcome.WHITE_WINS, next.outcome());
        Move kingStep = new Move(Board.index(4, 4), Board.index(3, 4), null, false);
        assertThrows(IllegalStateException.class, () -> next.applyMove(kingStep));
    }

    @Test
    void missingWhiteKingMeansBlackWins() {
        Board board = Board.fromRows(
                "bK .  .  .  .",
                ".  .  .  .  .",
                ".  .  .  .  .",
                ".  .  .  .  .",
                ".  .  .  .  wQ");
        assertEquals(GameOutcome.BLACK_WINS, new GameState(board, Side.WHITE).outcome());
    }

    @Test
    void rejectsIllegalMoves() {
        GameState state = new GameState();
        Move backwards = new Move(Board.index(3, 1), Board.index(4, 0), null, false);
        assertThrows(IllegalArgumentException.class, () -> state.applyMove(backwards));

        Move wrongSide = MoveGenerator.generateMoves(state.getBoard(), Side.BLACK).get(0);
        assertThrows(IllegalArgumentException.class, () -> state.applyMove(wrongSide));
    }

    @Test
    void blockedSideHasNoLegalMoves() {
        Board board = Board.fromRows(
                "wK wp .  .  .",
                "wp wp .  .  .",
                ".  .  .  .  .",
                ".  .  .  .  .",
                ".  .  .  .  bK");
        GameState state = new GameState(board, Side.WHITE);

        assertTrue(state.legalMoves().isEmpty());
        assertEquals(GameOutcome.NO_LEGAL_MOVES, state.outcome());
        assertFalse(state.isGameOver());
    }

    @Test
    void withSideToMoveKeepsBoardAndCounter() {
        GameState state = new GameState(Board.initial(), Side.WHITE, 3);
        GameState black = state.withSideToMove(Side.BLACK);

        assertSame(state, state.withSideToMove(Side.WHITE));
        assertSame(Side.BLACK, black.getSideToMove());
        assertEquals(3, black.getHalfMovesSinceCapture());
        assertEquals(state.getBoard(), black.getBoard());
    }

    private static Move move(GameState state, String from, String to) {
        Move move = state.findMove(cell(from), cell(to));
        assertNotNull(move, "Expected a legal move " + from + " -> " + to);
        return move;
    }

    private static int cell(String name) {
        int col = name.charAt(0) - 'a';
        int row = Board.SIZE - (name.charAt(1) - '0');
        return Board.index(row, col);
    }
}
