package com.minichess.core;

/**
 * A single half-move.
 *
 * @param from      source cell index
 * @param to        destination cell index
 * @param captured  the piece standing on {@code to} before the move, or {@code null}
 * @param promotion {@code true} if a pawn reaches the far rank and becomes a Queen
 */
public record Move(int from, int to, Piece captured, boolean promotion) {

    public Move {
        if (from < 0 || from >= Board.CELL_COUNT || to < 0 || to >= Board.CELL_COUNT) {
            throw new IllegalArgumentException("Cell index out of range: " + from + " -> " + to);
        }
        if (from == to) {
            throw new IllegalArgumentException("Source and destination must differ: " + from);
        }
    }

    public boolean isCapture() {
        return captured != null;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(8);
        builder.append(Board.squareName(from));
        builder.append(isCapture() ? 'x' : '-');
        builder.append(Board.squareName(to));
        if (promotion) {
            builder.append("=Q");
        }
        return builder.toString();
    }
}
