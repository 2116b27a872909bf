package com.minichess.core.ai;

import com.minichess.core.PieceKind;

/**
 * Scoring constants shared by the evaluator and the search.
 */
public final class PieceValues {

    public static final int KING_VALUE = 20000;
    public static final int QUEEN_VALUE = 900;
    public static final int BISHOP_VALUE = 330;
    public static final int KNIGHT_VALUE = 320;
    public static final int PAWN_VALUE = 100;

    /**
     * Value of an attacked king in the safety term; the search handles the real capture.
     */
    public static final int KING_THREAT_VALUE = 200;

    /**
     * Score of a position whose opponent king has been captured.
     */
    public static final int WIN_SCORE = 1_000_000;

    /**
     * Scores at or beyond this magnitude are forced results found within the search horizon.
     */
    public static final int WIN_THRESHOLD = WIN_SCORE - 1_000;

    // Bonus tables, indexed [rank from the owner's home row][column].
    static final int[][] KING_SQUARES = {
            {10, 15, 5, 15, 10},
            {0, 0, -5, 0, 0},
            {-10, -15, -20, -15, -10},
            {-20, -25, -30, -25, -20},
            {-30, -30, -30, -30, -30}
    };

    static final int[][] QUEEN_SQUARES = {
            {-10, -5, 0, -5, -10},
            {-5, 5, 5, 5, -5},
            {0, 5, 10, 5, 0},
            {-5, 5, 5, 5, -5},
            {-10, -5, 0, -5, -10}
    };

    static final int[][] BISHOP_SQUARES = {
            {-10, -5, -5, -5, -10},
            {-5, 10, 5, 10, -5},
            {-5, 5, 15, 5, -5},
            {-5, 10, 5, 10, -5},
            {-10, -5, -5, -5, -10}
    };

    static final int[][] KNIGHT_SQUARES = {
            {-30, -15, -10, -15, -30},
            {-15, 5, 10, 5, -15},
            {-10, 10, 20, 10, -10},
            {-15, 5, 10, 5, -15},
            {-30, -15, -10, -15, -30}
    };

    static final int[][] PAWN_SQUARES = {
            {0, 0, 0, 0, 0},
            {0, 5, 5, 5, 0},
            {5, 10, 20, 10, 5},
            {30, 35, 40, 35, 30},
            {0, 0, 0, 0, 0}
    };

    private PieceValues() {
    }

    public static int valueOf(PieceKind kind) {
        switch (kind) {
            case KING:
                return KING_VALUE;
            case QUEEN:
                return QUEEN_VALUE;
            case BISHOP:
                return BISHOP_VALUE;
            case KNIGHT:
                return KNIGHT_VALUE;
            case PAWN:
                return PAWN_VALUE;
            default:
                throw new IllegalArgumentException("Unknown piece kind: " + kind);
        }
    }

    static int threatValueOf(PieceKind kind) {
        return kind == PieceKind.KING ? KING_THREAT_VALUE : valueOf(kind);
    }

    static int[][] squaresOf(PieceKind kind) {
        switch (kind) {
            case KING:
                return KING_SQUARES;
            case QUEEN:
                return QUEEN_SQUARES;
            case BISHOP:
                return BISHOP_SQUARES;
            case KNIGHT:
                return KNIGHT_SQUARES;
            case PAWN:
                return PAWN_SQUARES;
            default:
                throw new IllegalArgumentException("Unknown piece kind: " + kind);
        }
    }
}
