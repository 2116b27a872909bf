package com.minichess.core.ai;

import com.minichess.core.Board;
import com.minichess.core.BoardView;
import com.minichess.core.MoveGenerator;
import com.minichess.core.Piece;
import com.minichess.core.Side;
import java.util.Objects;

/**
 * Static evaluation of a board from the perspective of one side. Every heuristic is computed as a
 * per-side term for {@code side} minus the same term for its opponent, which keeps scores
 * side-symmetric.
 */
public final class Evaluator {

    private static final int ATTACK_BONUS_DIVISOR = 10;
    private static final int HANGING_PENALTY_DIVISOR = 4;

    private Evaluator() {
    }

    /**
     * Scores {@code board} for {@code side} with the selected heuristic. A side without a king scores
     * {@link PieceValues#WIN_SCORE} below zero.
     */
    public static int evaluate(Heuristic heuristic, BoardView board, Side side) {
        Objects.requireNonNull(heuristic, "heuristic");
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(side, "side");

        boolean ownKing = false;
        boolean enemyKing = false;
        for (int index = 0; index < Board.CELL_COUNT; index++) {
            Piece piece = board.pieceAt(index);
            if (piece != null && piece.isKing()) {
                if (piece.side() == side) {
                    ownKing = true;
                } else {
                    enemyKing = true;
                }
            }
        }
        if (ownKing != enemyKing) {
            return ownKing ? PieceValues.WIN_SCORE : -PieceValues.WIN_SCORE;
        }

        switch (heuristic) {
            case E0:
                return material(board, side);
            case E1:
                return material(board, side) + placement(board, side);
            case E2:
                return material(board, side) + placement(board, side) + safety(board, side);
            default:
                throw new IllegalArgumentException("Unsupported heuristic: " + heuristic);
        }
    }

    /**
     * Material balance of {@code side}.
     */
    static int material(BoardView board, Side side) {
        int score = 0;
        for (int index = 0; index < Board.CELL_COUNT; index++) {
            Piece piece = board.pieceAt(index);
            if (piece == null) {
                continue;
            }
            int value = PieceValues.valueOf(piece.kind());
            score += piece.side() == side ? value : -value;
        }
        return score;
    }

    /**
     * Piece-square balance of {@code side}.
     */
    static int placement(BoardView board, Side side) {
        int score = 0;
        for (int index = 0; index < Board.CELL_COUNT; index++) {
            Piece piece = board.pieceAt(index);
            if (piece == null) {
                continue;
            }
            int bonus = PieceValues.squaresOf(piece.kind())[rankFromHome(index, piece.side())][Board.col(index)];
            score += piece.side() == side ? bonus : -bonus;
        }
        return score;
    }

    /**
     * Threat balance of {@code side}: enemy pieces it attacks earn a bonus, own pieces the opponent
     * attacks cost a penalty, and the mirrored term is subtracted for the opponent.
     */
    static int safety(BoardView board, Side side) {
        int attackedByUs = threatenedValue(board, side);
        int attackedByThem = threatenedValue(board, side.opponent());
        int ours = attackedByUs / ATTACK_BONUS_DIVISOR - attackedByThem / HANGING_PENALTY_DIVISOR;
        int theirs = attackedByThem / ATTACK_BONUS_DIVISOR - attackedByUs / HANGING_PENALTY_DIVISOR;
        return ours - theirs;
    }

    private static int threatenedValue(BoardView board, Side attacker) {
        int total = 0;
        for (Piece target : MoveGenerator.attackedPieces(board, attacker)) {
            total += PieceValues.threatValueOf(target.kind());
        }
        return total;
    }

    private static int rankFromHome(int index, Side side) {
        int row = Board.row(index);
        return side == Side.WHITE ? Board.SIZE - 1 - row : row;
    }
}
