package com.minichess.core;

/**
 * Result classification of a {@link GameState}.
 */
public enum GameOutcome {
    IN_PROGRESS,
    WHITE_WINS,
    BLACK_WINS,
    DRAW,
    /**
     * The side to move has no legal move. The ruleset does not score this as a draw; the match loop
     * ends the game and reports it as-is.
     */
    NO_LEGAL_MOVES;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
