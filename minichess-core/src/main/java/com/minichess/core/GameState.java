package com.minichess.core;

import java.util.List;
import java.util.Objects;

/**
 * Immutable representation of the current state of a match.
 * The state keeps track of the board, the side to move and the number of half-moves played since
 * the last capture.
 */
public final class GameState {

    /**
     * Number of consecutive half-moves without a capture after which the game is drawn.
     */
    public static final int DRAW_HALF_MOVE_LIMIT = 20;

    private final Board board;
    private final Side sideToMove;
    private final int halfMovesSinceCapture;
    private List<Move> legalMoves;

    /**
     * Creates the initial game state with White to move.
     */
    public GameState() {
        this(Board.initial(), Side.WHITE, 0);
    }

    public GameState(Board board, Side sideToMove) {
        this(board, sideToMove, 0);
    }

    public GameState(Board board, Side sideToMove, int halfMovesSinceCapture) {
        this.board = Objects.requireNonNull(board, "board");
        this.sideToMove = Objects.requireNonNull(sideToMove, "sideToMove");
        if (halfMovesSinceCapture < 0) {
            throw new IllegalArgumentException("halfMovesSinceCapture must not be negative");
        }
        this.halfMovesSinceCapture = halfMovesSinceCapture;
    }

    /**
     * Returns the board associated with this state.
     */
    public Board getBoard() {
        return board;
    }

    public Side getSideToMove() {
        return sideToMove;
    }

    /**
     * Returns the number of half-moves since the last capture.
     */
    public int getHalfMovesSinceCapture() {
        return halfMovesSinceCapture;
    }

    /**
     * Returns the legal moves of the side to move in generation order.
     */
    public List<Move> legalMoves() {
        List<Move> moves = legalMoves;
        if (moves == null) {
            moves = List.copyOf(MoveGenerator.generateMoves(board, sideToMove));
            legalMoves = moves;
        }
        return moves;
    }

    /**
     * Returns a copy of this state with the provided side to move and the same board and counter.
     */
    public GameState withSideToMove(Side side) {
        if (side == sideToMove) {
            return this;
        }
        return new GameState(board, side, halfMovesSinceCapture);
    }

    public GameOutcome outcome() {
        if (!board.hasKing(Side.WHITE)) {
            return GameOutcome.BLACK_WINS;
        }
        if (!board.hasKing(Side.BLACK)) {
            return GameOutcome.WHITE_WINS;
        }
        if (isDraw()) {
            return GameOutcome.DRAW;
        }
        if (legalMoves().isEmpty()) {
            return GameOutcome.NO_LEGAL_MOVES;
        }
        return GameOutcome.IN_PROGRESS;
    }

    /**
     * Returns {@code true} if a king has been captured or the no-capture draw limit was reached.
     */
    public boolean isGameOver() {
        return !board.hasKing(Side.WHITE) || !board.hasKing(Side.BLACK) || isDraw();
    }

    public boolean isDraw() {
        return halfMovesSinceCapture >= DRAW_HALF_MOVE_LIMIT;
    }

    /**
     * Applies the provided move and returns the resulting state.
     */
    public GameState applyMove(Move move) {
        Objects.requireNonNull(move, "move");
        if (isGameOver()) {
            throw new IllegalStateException("Cannot apply " + move + ": the game is over (" + outcome() + ")");
        }
        if (!legalMoves().contains(move)) {
            throw new IllegalArgumentException("Illegal move for " + sideToMove + ": " + move);
        }
        Board updatedBoard = board.withMove(move);
        int updatedCounter = move.isCapture() ? 0 : halfMovesSinceCapture + 1;
        return new GameState(updatedBoard, sideToMove.opponent(), updatedCounter);
    }

    /**
     * Looks up the legal move between two cells, or returns {@code null} if there is none.
     */
    public Move findMove(int from, int to) {
        for (Move move : legalMoves()) {
            if (move.from() == from && move.to() == to) {
                return move;
            }
        }
        return null;
    }
}
