package com.minichess.core.ai.state;

import com.minichess.core.Board;
import com.minichess.core.BoardView;
import com.minichess.core.GameState;
import com.minichess.core.Move;
import com.minichess.core.MoveGenerator;
import com.minichess.core.Piece;
import com.minichess.core.PieceKind;
import com.minichess.core.Side;
import com.minichess.core.ai.Evaluator;
import com.minichess.core.ai.Heuristic;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Mutable search buffers that allow tree explorations without copying the board per node. Moves are
 * applied with {@link #push} and reverted with {@link #pop} in strict stack order.
 */
public final class SearchState implements BoardView {

    public static final int MAX_PLY = 64;

    private final Piece[] cells = new Piece[Board.CELL_COUNT];
    private final Move[] appliedMoves = new Move[MAX_PLY + 1];
    private final Piece[] movedPieces = new Piece[MAX_PLY + 1];
    private final int[] halfMoveClocks = new int[MAX_PLY + 1];
    private final boolean[] kingCaptured = new boolean[MAX_PLY + 1];
    private final List<List<Move>> moveLists = new ArrayList<>(MAX_PLY + 1);

    private Side sideToMove = Side.WHITE;
    private int ply;

    public SearchState() {
        for (int i = 0; i <= MAX_PLY; i++) {
            moveLists.add(new ArrayList<>());
        }
    }

    /**
     * Resets this state to mirror the provided {@link GameState}.
     */
    public void reset(GameState state) {
        initialize(state.getBoard().toArray(), state.getSideToMove(), state.getHalfMovesSinceCapture());
    }

    /**
     * Initialises the buffers from raw board data.
     */
    public void initialize(Piece[] board, Side side, int halfMovesSinceCapture) {
        if (board.length != Board.CELL_COUNT) {
            throw new IllegalArgumentException("Board must have " + Board.CELL_COUNT + " cells");
        }
        System.arraycopy(board, 0, cells, 0, Board.CELL_COUNT);
        ply = 0;
        sideToMove = side;
        halfMoveClocks[0] = halfMovesSinceCapture;
        kingCaptured[0] = false;
        appliedMoves[0] = null;
        movedPieces[0] = null;
        moveLists.get(0).clear();
    }

    public int ply() {
        return ply;
    }

    public Side sideToMove() {
        return sideToMove;
    }

    @Override
    public Piece pieceAt(int index) {
        return cells[index];
    }

    public int halfMoveClock() {
        return halfMoveClocks[ply];
    }

    /**
     * Returns {@code true} if the move that led to the current node captured a king.
     */
    public boolean isKingCaptured() {
        return kingCaptured[ply];
    }

    /**
     * Returns {@code true} if the no-capture draw limit is reached at the current node.
     */
    public boolean isDrawn() {
        return halfMoveClocks[ply] >= GameState.DRAW_HALF_MOVE_LIMIT;
    }

    /**
     * Generates the moves of the side to move into the buffer of the current ply.
     *
     * @return the number of generated moves
     */
    public int generateMoves() {
        List<Move> moves = moveLists.get(ply);
        moves.clear();
        return MoveGenerator.generateMoves(this, sideToMove, moves);
    }

    public int moveCount(int depth) {
        return moveLists.get(depth).size();
    }

    public Move moveAt(int depth, int index) {
        return moveLists.get(depth).get(index);
    }

    public void pushGenerated(int depth, int index) {
        push(moveAt(depth, index));
    }

    public void push(Move move) {
        if (ply >= MAX_PLY) {
            throw new IllegalStateException("Search exceeded the maximum ply of " + MAX_PLY);
        }
        Piece moving = cells[move.from()];
        if (moving == null) {
            throw new IllegalStateException("Move " + move + " starts on an empty cell");
        }
        if (moving.side() != sideToMove) {
            throw new IllegalStateException("Move " + move + " moves a " + moving.side() + " piece on "
                    + sideToMove + "'s turn");
        }
        Piece target = cells[move.to()];
        if (!Objects.equals(target, move.captured())) {
            throw new IllegalStateException("Move " + move + " expects " + move.captured() + " on the target but found "
                    + target);
        }

        cells[move.from()] = null;
        cells[move.to()] = move.promotion() ? Piece.of(PieceKind.QUEEN, moving.side()) : moving;
        int nextClock = move.isCapture() ? 0 : halfMoveClocks[ply] + 1;

        ply++;
        appliedMoves[ply] = move;
        movedPieces[ply] = moving;
        halfMoveClocks[ply] = nextClock;
        kingCaptured[ply] = target != null && target.isKing();
        moveLists.get(ply).clear();
        sideToMove = sideToMove.opponent();
    }

    public void pop() {
        if (ply == 0) {
            throw new IllegalStateException("Cannot pop root state");
        }
        Move move = appliedMoves[ply];
        cells[move.from()] = movedPieces[ply];
        cells[move.to()] = move.captured();
        appliedMoves[ply] = null;
        movedPieces[ply] = null;
        ply--;
        sideToMove = sideToMove.opponent();
    }

    public int evaluateCurrent(Heuristic heuristic) {
        return Evaluator.evaluate(heuristic, this, sideToMove);
    }

    /**
     * Returns a copy of the current cells.
     */
    public Piece[] snapshot() {
        return cells.clone();
    }
}
