package com.minichess.core.ai;

import com.minichess.core.GameState;
import com.minichess.core.Move;
import com.minichess.core.Side;
import com.minichess.core.ai.state.SearchState;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Negamax searcher with iterative deepening under a wall-clock budget and optional alpha-beta
 * pruning. Moves are tried in generation order and ties keep the first move found, so equal inputs
 * always produce equal results. Instances are not thread-safe.
 */
public final class NegamaxAI implements Searcher {

    private static final Logger LOGGER = Logger.getLogger(NegamaxAI.class.getName());
    private static final int INFINITY = Integer.MAX_VALUE / 2;
    private static final int DRAW_SCORE = 0;

    private final SearchState searchState = new SearchState();
    private final LongSupplier clock;

    private long lastVisitedNodes;
    private boolean lastTimedOut;

    private Heuristic heuristic;
    private boolean alphaBeta;
    private long deadline;
    private long visitedNodes;
    private long cutoffs;
    private boolean timedOut;
    private boolean horizonReached;

    public NegamaxAI() {
        this(System::nanoTime);
    }

    NegamaxAI(LongSupplier clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the best move for the side to move, or {@code null} if it has no legal move.
     */
    public Move findBestMove(GameState state, SearchConstraints constraints) {
        return search(state, constraints).move();
    }

    /**
     * Searches the position of {@code state} on behalf of {@code sideToMove}.
     */
    public SearchResult search(GameState state, Side sideToMove, SearchConstraints constraints) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(sideToMove, "sideToMove");
        return search(state.withSideToMove(sideToMove), constraints);
    }

    public long getLastVisitedNodeCount() {
        return lastVisitedNodes;
    }

    public boolean wasLastSearchTimedOut() {
        return lastTimedOut;
    }

    @Override
    public SearchResult search(GameState state, SearchConstraints constraints) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(constraints, "constraints");

        if (state.isGameOver()) {
            throw new IllegalStateException("Cannot search moves in a terminal position (" + state.outcome() + ")");
        }

        long searchStart = clock.getAsLong();
        long deadlineNanos = saturatingAdd(searchStart, constraints.timeBudgetNanos());
        heuristic = constraints.heuristic();
        alphaBeta = constraints.alphaBeta();

        searchState.reset(state);
        int rootMoves = searchState.generateMoves();
        if (rootMoves == 0) {
            int score = searchState.evaluateCurrent(heuristic);
            Duration elapsed = Duration.ofNanos(Math.max(0L, clock.getAsLong() - searchStart));
            LOGGER.info(() -> String.format("No legal moves for %s", state.getSideToMove()));
            lastVisitedNodes = 0L;
            lastTimedOut = false;
            return SearchResult.noLegalMoves(score, elapsed);
        }

        SearchResult result = iterativeDeepening(constraints.depthLimit(), deadlineNanos, searchStart);

        lastVisitedNodes = result.visitedNodes();
        lastTimedOut = result.timedOut();
        return result;
    }

    private SearchResult iterativeDeepening(int depthLimit, long deadlineNanos, long searchStart) {
        deadline = deadlineNanos;
        long totalVisited = 0L;
        IterationResult lastComplete = null;
        boolean timedOutSearch = false;
        List<SearchTelemetry.Iteration> iterations = new ArrayList<>();

        for (int depth = 1; depth <= depthLimit; depth++) {
            long iterationStart = clock.getAsLong();
            if (iterationStart >= deadlineNanos) {
                timedOutSearch = true;
                break;
            }

            IterationResult iteration = runIteration(depth);
            totalVisited += iteration.visitedNodes;

            if (iteration.timedOut) {
                timedOutSearch = true;
                break;
            }

            lastComplete = iteration;
            long iterationNanos = clock.getAsLong() - iterationStart;
            iterations.add(new SearchTelemetry.Iteration(depth, iteration.visitedNodes, iteration.cutoffs,
                    iterationNanos, iteration.move, iteration.score));
            if (LOGGER.isLoggable(Level.FINE)) {
                SearchTelemetry.Iteration recorded = iterations.get(iterations.size() - 1);
                LOGGER.fine(String.format("depth=%d move=%s score=%d nodes=%d cutoffs=%d (%.1fms)", depth,
                        recorded.bestMove(), recorded.score(), recorded.nodes(), recorded.cutoffs(),
                        recorded.elapsedMillis()));
            }

            if (Math.abs(iteration.score) >= PieceValues.WIN_THRESHOLD) {
                break;
            }
            if (!iteration.horizonReached) {
                break;
            }
        }

        Duration elapsed = Duration.ofNanos(Math.max(0L, clock.getAsLong() - searchStart));
        SearchTelemetry telemetry = new SearchTelemetry(iterations);

        if (lastComplete == null) {
            Move fallback = searchState.moveAt(0, 0);
            int score = searchState.evaluateCurrent(heuristic);
            LOGGER.warning(() -> String.format("Depth 1 did not complete in time, playing first legal move %s",
                    fallback));
            return new SearchResult(fallback, score, totalVisited, elapsed, 0, true, telemetry);
        }

        final IterationResult finalResult = lastComplete;
        final long nodes = totalVisited;
        LOGGER.info(() -> String.format("Negamax explored %d nodes (depth=%d, alphaBeta=%s, heuristic=%s, %.3fs)",
                nodes, finalResult.depth, alphaBeta, heuristic, elapsed.toNanos() / 1_000_000_000.0));

        return new SearchResult(finalResult.move, finalResult.score, totalVisited, elapsed, finalResult.depth,
                timedOutSearch, telemetry);
    }

    private IterationResult runIteration(int depth) {
        visitedNodes = 1L;
        cutoffs = 0L;
        timedOut = false;
        horizonReached = false;

        Move bestMove = null;
        int bestScore = Integer.MIN_VALUE;
        int alpha = -INFINITY;
        int beta = INFINITY;

        int moveCount = searchState.moveCount(0);
        for (int i = 0; i < moveCount; i++) {
            if (isDeadlineExceeded()) {
                timedOut = true;
                break;
            }

            Move move = searchState.moveAt(0, i);
            searchState.pushGenerated(0, i);
            int score = -negamax(depth - 1, -beta, -alpha);
            searchState.pop();

            if (timedOut) {
                break;
            }

            if (score > bestScore) {
                bestScore = score;
                bestMove = move;
            }
            if (alphaBeta && score > alpha) {
                alpha = score;
            }
        }

        if (searchState.ply() != 0) {
            throw new IllegalStateException("Search stack not unwound, ply=" + searchState.ply());
        }
        return new IterationResult(bestMove, bestScore, depth, visitedNodes, cutoffs, timedOut, horizonReached);
    }

    private int negamax(int depth, int alpha, int beta) {
        if (isDeadlineExceeded()) {
            timedOut = true;
            return 0;
        }

        visitedNodes++;

        if (searchState.isKingCaptured()) {
            return -(PieceValues.WIN_SCORE - searchState.ply());
        }
        if (searchState.isDrawn()) {
            return DRAW_SCORE;
        }
        if (depth <= 0) {
            horizonReached = true;
            return searchState.evaluateCurrent(heuristic);
        }

        int currentPly = searchState.ply();
        int moveCount = searchState.generateMoves();
        if (moveCount == 0) {
            return searchState.evaluateCurrent(heuristic);
        }

        int bestValue = Integer.MIN_VALUE;
        for (int i = 0; i < moveCount; i++) {
            searchState.pushGenerated(currentPly, i);
            int score = -negamax(depth - 1, -beta, -alpha);
            searchState.pop();

            if (timedOut) {
                return 0;
            }

            if (score > bestValue) {
                bestValue = score;
            }
            if (alphaBeta) {
                if (score > alpha) {
                    alpha = score;
                }
                if (alpha >= beta) {
                    cutoffs++;
                    break;
                }
            }
        }
        return bestValue;
    }

    private boolean isDeadlineExceeded() {
        return timedOut || clock.getAsLong() >= deadline;
    }

    private long saturatingAdd(long a, long b) {
        long result = a + b;
        if (((a ^ result) & (b ^ result)) < 0) {
            return Long.MAX_VALUE;
        }
        return result;
    }

    private record IterationResult(Move move, int score, int depth, long visitedNodes, long cutoffs,
            boolean timedOut, boolean horizonReached) {
    }
}
