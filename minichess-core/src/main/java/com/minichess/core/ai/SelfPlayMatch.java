package com.minichess.core.ai;

import com.minichess.core.GameOutcome;
import com.minichess.core.GameState;
import com.minichess.core.Move;
import com.minichess.core.Side;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Plays games in which both sides are driven by a {@link Searcher}. The match owns the authoritative
 * {@link GameState}: it asks the searcher for the active side's move, applies it and stops as soon as
 * the state reports a terminal outcome.
 */
public final class SelfPlayMatch {

    private static final Logger LOGGER = Logger.getLogger(SelfPlayMatch.class.getName());

    private final Searcher searcher;
    private final Map<Side, SearchConstraints> constraints = new EnumMap<>(Side.class);

    private int gamesPlayed;
    private final Map<GameOutcome, Integer> tally = new EnumMap<>(GameOutcome.class);

    public SelfPlayMatch(Searcher searcher, SearchConstraints whiteConstraints, SearchConstraints blackConstraints) {
        this.searcher = Objects.requireNonNull(searcher, "searcher");
        constraints.put(Side.WHITE, Objects.requireNonNull(whiteConstraints, "whiteConstraints"));
        constraints.put(Side.BLACK, Objects.requireNonNull(blackConstraints, "blackConstraints"));
    }

    public SelfPlayMatch(SearchConstraints whiteConstraints, SearchConstraints blackConstraints) {
        this(new NegamaxAI(), whiteConstraints, blackConstraints);
    }

    /**
     * Plays {@code gameCount} games from the initial position.
     */
    public List<MatchResult> playGames(int gameCount) {
        if (gameCount < 1) {
            throw new IllegalArgumentException("Game count must be at least 1");
        }
        List<MatchResult> results = new ArrayList<>(gameCount);
        for (int i = 0; i < gameCount; i++) {
            results.add(play(new GameState()));
        }
        return results;
    }

    /**
     * Plays one game from {@code start} until it is over.
     */
    public MatchResult play(GameState start) {
        Objects.requireNonNull(start, "start");
        GameState state = start;
        List<Move> moves = new ArrayList<>();
        long totalNodes = 0L;

        while (!state.isGameOver()) {
            Side mover = state.getSideToMove();
            SearchResult result = searcher.search(state, constraints.get(mover));
            totalNodes += result.visitedNodes();
            if (result.isNoLegalMoves()) {
                break;
            }

            Move move = result.move();
            final int ply = moves.size() + 1;
            LOGGER.fine(() -> String.format("%d. %s plays %s (score=%d, depth=%d, nodes=%d, %.3fs%s)", ply, mover,
                    move, result.score(), result.depthReached(), result.visitedNodes(), result.elapsedSeconds(),
                    result.timedOut() ? ", timed out" : ""));
            state = state.applyMove(move);
            moves.add(move);
        }

        GameOutcome outcome = state.outcome();
        gamesPlayed++;
        tally.merge(outcome, 1, Integer::sum);

        final int gameNumber = gamesPlayed;
        final int halfMoves = moves.size();
        final long nodes = totalNodes;
        LOGGER.info(() -> String.format("Completed game %d: %s after %d half-moves (nodes=%d, tally=%s)", gameNumber,
                outcome, halfMoves, nodes, tally));
        return new MatchResult(outcome, state, moves, totalNodes);
    }

    public int getGamesPlayed() {
        return gamesPlayed;
    }

    /**
     * Returns how many played games ended with {@code outcome}.
     */
    public int count(GameOutcome outcome) {
        return tally.getOrDefault(outcome, 0);
    }
}
