package com.minichess.core;

/**
 * Read-only access to the cells of a 5x5 board. Implemented both by the immutable {@link Board} and
 * by the mutable buffers the search uses, so move generation and evaluation work on either.
 */
public interface BoardView {

    /**
     * Returns the piece on the cell with the provided index, or {@code null} if it is empty.
     */
    Piece pieceAt(int index);
}
