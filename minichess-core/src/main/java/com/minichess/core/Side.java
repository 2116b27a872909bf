package com.minichess.core;

/**
 * The two players of a match. White moves first and advances towards row 0.
 */
public enum Side {
    WHITE('w', -1, 0),
    BLACK('b', 1, Board.SIZE - 1);

    private final char prefix;
    private final int forward;
    private final int promotionRow;

    Side(char prefix, int forward, int promotionRow) {
        this.prefix = prefix;
        this.forward = forward;
        this.promotionRow = promotionRow;
    }

    public Side opponent() {
        return this == WHITE ? BLACK : WHITE;
    }

    /**
     * Row delta of a pawn step for this side.
     */
    public int forward() {
        return forward;
    }

    /**
     * Row on which pawns of this side promote.
     */
    public int promotionRow() {
        return promotionRow;
    }

    public char prefix() {
        return prefix;
    }

    public static Side fromPrefix(char prefix) {
        for (Side side : values()) {
            if (side.prefix == prefix) {
                return side;
            }
        }
        throw new IllegalArgumentException("Unknown side prefix: " + prefix);
    }
}
