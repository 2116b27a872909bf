package com.minichess.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable representation of the 5x5 game field.
 * Cell {@code row * 5 + col} holds a {@link Piece} or {@code null}. Row 0 is rank 5 (Black's home
 * rank), row 4 is rank 1 (White's home rank).
 */
public final class Board implements BoardView {

    public static final int SIZE = 5;
    public static final int CELL_COUNT = SIZE * SIZE;

    private static final String[] INITIAL_ROWS = {
            "bK bQ bB bN .",
            ".  .  bp bp .",
            ".  .  .  .  .",
            ".  wp wp .  .",
            ".  wN wB wQ wK"
    };

    private final Piece[] cells;

    private Board(Piece[] cells) {
        this.cells = cells;
    }

    /**
     * Creates the fixed starting layout.
     */
    public static Board initial() {
        return fromRows(INITIAL_ROWS);
    }

    /**
     * Creates a board with no pieces.
     */
    public static Board empty() {
        return new Board(new Piece[CELL_COUNT]);
    }

    /**
     * Builds a board from five rows of whitespace separated tokens, top row first. Tokens are
     * {@code .} for an empty cell or a side prefix followed by a piece symbol, e.g. {@code wK}.
     */
    public static Board fromRows(String... rows) {
        Objects.requireNonNull(rows, "rows");
        if (rows.length != SIZE) {
            throw new IllegalArgumentException("Expected " + SIZE + " rows but got " + rows.length);
        }
        Piece[] cells = new Piece[CELL_COUNT];
        for (int row = 0; row < SIZE; row++) {
            String[] tokens = rows[row].trim().split("\\s+");
            if (tokens.length != SIZE) {
                throw new IllegalArgumentException("Row " + row + " must contain " + SIZE + " cells: " + rows[row]);
            }
            for (int col = 0; col < SIZE; col++) {
                String token = tokens[col];
                cells[index(row, col)] = ".".equals(token) ? null : Piece.parse(token);
            }
        }
        return new Board(cells);
    }

    @Override
    public Piece pieceAt(int index) {
        checkIndex(index);
        return cells[index];
    }

    public Piece pieceAt(int row, int col) {
        return pieceAt(index(row, col));
    }

    /**
     * Returns {@code true} if the cell with the provided index is empty.
     */
    public boolean isEmpty(int index) {
        return pieceAt(index) == null;
    }

    /**
     * Returns a new Board with the provided piece placed on (or, for {@code null}, removed from) the cell.
     */
    public Board withPiece(int index, Piece piece) {
        checkIndex(index);
        Piece[] updated = cells.clone();
        updated[index] = piece;
        return new Board(updated);
    }

    /**
     * Returns a new Board with the move applied: the source cell is emptied and the destination holds
     * the moved piece, or a Queen of the same side when the move promotes.
     */
    public Board withMove(Move move) {
        Objects.requireNonNull(move, "move");
        Piece moving = pieceAt(move.from());
        if (moving == null) {
            throw new IllegalArgumentException("No piece on " + squareName(move.from()));
        }
        Piece[] updated = cells.clone();
        updated[move.from()] = null;
        updated[move.to()] = move.promotion() ? Piece.of(PieceKind.QUEEN, moving.side()) : moving;
        return new Board(updated);
    }

    /**
     * Returns {@code true} if the king of the provided side is still on the board.
     */
    public boolean hasKing(Side side) {
        Piece king = Piece.of(PieceKind.KING, side);
        for (Piece piece : cells) {
            if (king.equals(piece)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the number of pieces on the board.
     */
    public int countPieces() {
        int count = 0;
        for (Piece piece : cells) {
            if (piece != null) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns a copy of the cell array.
     */
    public Piece[] toArray() {
        return cells.clone();
    }

    public static int index(int row, int col) {
        return row * SIZE + col;
    }

    public static int row(int index) {
        return index / SIZE;
    }

    public static int col(int index) {
        return index % SIZE;
    }

    public static boolean isOnBoard(int row, int col) {
        return row >= 0 && row < SIZE && col >= 0 && col < SIZE;
    }

    /**
     * Returns the coordinate name of a cell, e.g. {@code a5} for index 0.
     */
    public static String squareName(int index) {
        checkIndex(index);
        return "" + (char) ('a' + col(index)) + (SIZE - row(index));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Board)) {
            return false;
        }
        return Arrays.equals(cells, ((Board) other).cells);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(cells);
    }

    private static void checkIndex(int index) {
        if (index < 0 || index >= CELL_COUNT) {
            throw new IllegalArgumentException("Cell index out of range: " + index);
        }
    }
}
