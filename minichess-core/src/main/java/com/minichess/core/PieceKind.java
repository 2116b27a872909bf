package com.minichess.core;

/**
 * The reduced piece set of the 5x5 variant.
 */
public enum PieceKind {
    KING('K'),
    QUEEN('Q'),
    BISHOP('B'),
    KNIGHT('N'),
    PAWN('p');

    private final char symbol;

    PieceKind(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public static PieceKind fromSymbol(char symbol) {
        for (PieceKind kind : values()) {
            if (kind.symbol == symbol) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown piece symbol: " + symbol);
    }
}
