package com.minichess.core;

import java.util.Objects;

/**
 * A piece descriptor. Instances are interned, so {@code of} always returns the same object for the
 * same kind and side.
 */
public record Piece(PieceKind kind, Side side) {

    private static final Piece[][] CACHE = new Piece[Side.values().length][PieceKind.values().length];

    static {
        for (Side side : Side.values()) {
            for (PieceKind kind : PieceKind.values()) {
                CACHE[side.ordinal()][kind.ordinal()] = new Piece(kind, side);
            }
        }
    }

    public Piece {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(side, "side");
    }

    public static Piece of(PieceKind kind, Side side) {
        return CACHE[side.ordinal()][kind.ordinal()];
    }

    /**
     * Parses a two character token such as {@code wK} or {@code bp}.
     */
    public static Piece parse(String token) {
        if (token == null || token.length() != 2) {
            throw new IllegalArgumentException("Invalid piece token: " + token);
        }
        return of(PieceKind.fromSymbol(token.charAt(1)), Side.fromPrefix(token.charAt(0)));
    }

    public boolean isKing() {
        return kind == PieceKind.KING;
    }

    @Override
    public String toString() {
        return "" + side.prefix() + kind.symbol();
    }
}
