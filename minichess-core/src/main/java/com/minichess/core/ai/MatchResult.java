package com.minichess.core.ai;

import com.minichess.core.GameOutcome;
import com.minichess.core.GameState;
import com.minichess.core.Move;
import java.util.List;
import java.util.Objects;

/**
 * Summary of one finished self-play game.
 *
 * @param outcome    how the game ended
 * @param finalState the last position reached
 * @param moves      the half-moves played, in order
 * @param totalNodes search nodes spent by both sides
 */
public record MatchResult(GameOutcome outcome, GameState finalState, List<Move> moves, long totalNodes) {

    public MatchResult {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(finalState, "finalState");
        moves = List.copyOf(moves);
    }

    public int halfMoves() {
        return moves.size();
    }
}
