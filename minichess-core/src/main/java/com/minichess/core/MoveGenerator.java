package com.minichess.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Utility responsible for enumerating the legal moves of one side. Generation is pure and
 * order-stable: cells are scanned row by row from the top-left corner and each piece emits its
 * targets in a fixed direction order, so equal inputs always produce equal move lists.
 * Check is not enforced, a king may step onto an attacked cell.
 */
public final class MoveGenerator {

    private static final int[][] KING_STEPS = {
            {-1, -1}, {-1, 0}, {-1, 1},
            {0, -1}, {0, 1},
            {1, -1}, {1, 0}, {1, 1}
    };
    private static final int[][] ROOK_RAYS = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};
    private static final int[][] BISHOP_RAYS = {{-1, -1}, {-1, 1}, {1, -1}, {1, 1}};
    private static final int[][] KNIGHT_JUMPS = {
            {-2, -1}, {-2, 1}, {2, -1}, {2, 1},
            {-1, -2}, {-1, 2}, {1, -2}, {1, 2}
    };

    private static final int[][] KING_TARGETS = precomputeTargets(KING_STEPS);
    private static final int[][] KNIGHT_TARGETS = precomputeTargets(KNIGHT_JUMPS);

    private MoveGenerator() {
    }

    /**
     * Returns all legal moves of {@code side} on the provided board.
     */
    public static List<Move> generateMoves(BoardView board, Side side) {
        List<Move> moves = new ArrayList<>();
        generateMoves(board, side, moves);
        return moves;
    }

    /**
     * Appends all legal moves of {@code side} to {@code out}.
     *
     * @return the number of moves appended
     */
    public static int generateMoves(BoardView board, Side side, List<Move> out) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(out, "out");
        int before = out.size();
        for (int index = 0; index < Board.CELL_COUNT; index++) {
            Piece piece = board.pieceAt(index);
            if (piece == null || piece.side() != side) {
                continue;
            }
            switch (piece.kind()) {
                case KING:
                    addTargets(board, side, index, KING_TARGETS[index], out);
                    break;
                case QUEEN:
                    addRays(board, side, index, ROOK_RAYS, out);
                    addRays(board, side, index, BISHOP_RAYS, out);
                    break;
                case BISHOP:
                    addRays(board, side, index, BISHOP_RAYS, out);
                    break;
                case KNIGHT:
                    addTargets(board, side, index, KNIGHT_TARGETS[index], out);
                    break;
                case PAWN:
                    addPawnMoves(board, side, index, out);
                    break;
                default:
                    throw new IllegalStateException("Unhandled piece kind: " + piece.kind());
            }
        }
        return out.size() - before;
    }

    /**
     * Returns the enemy pieces {@code side} could capture with its next move, one entry per attacked
     * cell, in cell order.
     */
    public static List<Piece> attackedPieces(BoardView board, Side side) {
        List<Move> moves = generateMoves(board, side);
        boolean[] seen = new boolean[Board.CELL_COUNT];
        for (Move move : moves) {
            if (move.isCapture()) {
                seen[move.to()] = true;
            }
        }
        List<Piece> attacked = new ArrayList<>();
        for (int index = 0; index < Board.CELL_COUNT; index++) {
            if (seen[index]) {
                attacked.add(board.pieceAt(index));
            }
        }
        return attacked;
    }

    private static void addTargets(BoardView board, Side side, int from, int[] targets, List<Move> out) {
        for (int to : targets) {
            Piece occupant = board.pieceAt(to);
            if (occupant == null || occupant.side() != side) {
                out.add(new Move(from, to, occupant, false));
            }
        }
    }

    private static void addRays(BoardView board, Side side, int from, int[][] rays, List<Move> out) {
        int row = Board.row(from);
        int col = Board.col(from);
        for (int[] ray : rays) {
            int r = row + ray[0];
            int c = col + ray[1];
            while (Board.isOnBoard(r, c)) {
                int to = Board.index(r, c);
                Piece occupant = board.pieceAt(to);
                if (occupant == null) {
                    out.add(new Move(from, to, null, false));
                } else {
                    if (occupant.side() != side) {
                        out.add(new Move(from, to, occupant, false));
                    }
                    break;
                }
                r += ray[0];
                c += ray[1];
            }
        }
    }

    private static void addPawnMoves(BoardView board, Side side, int from, List<Move> out) {
        int row = Board.row(from) + side.forward();
        int col = Board.col(from);
        if (row < 0 || row >= Board.SIZE) {
            return;
        }
        boolean promotes = row == side.promotionRow();

        int ahead = Board.index(row, col);
        if (board.pieceAt(ahead) == null) {
            out.add(new Move(from, ahead, null, promotes));
        }
        for (int dc = -1; dc <= 1; dc += 2) {
            if (!Board.isOnBoard(row, col + dc)) {
                continue;
            }
            int to = Board.index(row, col + dc);
            Piece occupant = board.pieceAt(to);
            if (occupant != null && occupant.side() != side) {
                out.add(new Move(from, to, occupant, promotes));
            }
        }
    }

    private static int[][] precomputeTargets(int[][] offsets) {
        int[][] targets = new int[Board.CELL_COUNT][];
        for (int index = 0; index < Board.CELL_COUNT; index++) {
            int row = Board.row(index);
            int col = Board.col(index);
            List<Integer> cells = new ArrayList<>();
            for (int[] offset : offsets) {
                int r = row + offset[0];
                int c = col + offset[1];
                if (Board.isOnBoard(r, c)) {
                    cells.add(Board.index(r, c));
                }
            }
            targets[index] = cells.stream().mapToInt(Integer::intValue).toArray();
        }
        return targets;
    }
}
