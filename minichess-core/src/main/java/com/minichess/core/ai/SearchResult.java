package com.minichess.core.ai;

import com.minichess.core.Move;
import java.time.Duration;
import java.util.Objects;

/**
 * Result payload returned by {@link Searcher} implementations.
 *
 * @param move         best move of the last completed depth, or {@code null} if the root had no legal move
 * @param score        score of {@code move} from the mover's perspective
 * @param visitedNodes nodes explored across all iterations
 * @param elapsed      wall-clock time spent in the search call
 * @param depthReached deepest fully completed iteration, 0 for the fallback move
 * @param timedOut     {@code true} if the time budget cut the search short
 * @param telemetry    per-iteration statistics
 */
public record SearchResult(Move move, int score, long visitedNodes, Duration elapsed, int depthReached,
        boolean timedOut, SearchTelemetry telemetry) {

    public SearchResult {
        Objects.requireNonNull(elapsed, "elapsed");
        telemetry = telemetry == null ? SearchTelemetry.empty() : telemetry;
    }

    /**
     * Result reported when the side to move has no legal move at the root.
     */
    public static SearchResult noLegalMoves(int score, Duration elapsed) {
        return new SearchResult(null, score, 0L, elapsed, 0, false, SearchTelemetry.empty());
    }

    public boolean hasMove() {
        return move != null;
    }

    public boolean isNoLegalMoves() {
        return move == null;
    }

    public double elapsedSeconds() {
        return elapsed.toNanos() / 1_000_000_000.0;
    }
}
