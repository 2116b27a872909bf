package com.minichess.core.ai;

import java.time.Duration;

/**
 * Immutable search configuration passed to {@link Searcher} implementations. Invalid values are
 * rejected here, before any search runs.
 *
 * @param depthLimit deepest iteration the search may start, between 1 and {@link #MAX_DEPTH}
 * @param timeBudget positive wall-clock budget for one search call
 * @param alphaBeta  {@code true} to prune with alpha-beta, {@code false} for plain minimax
 * @param heuristic  the evaluation function used at the leaves
 */
public record SearchConstraints(int depthLimit, Duration timeBudget, boolean alphaBeta, Heuristic heuristic) {

    public static final int MAX_DEPTH = 32;

    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    public SearchConstraints {
        if (timeBudget == null) {
            throw new SearchConfigurationException("timeBudget must not be null");
        }
        if (heuristic == null) {
            throw new SearchConfigurationException("heuristic must not be null");
        }
        if (depthLimit < 1 || depthLimit > MAX_DEPTH) {
            throw new SearchConfigurationException("depthLimit must be between 1 and " + MAX_DEPTH + ": " + depthLimit);
        }
        if (timeBudget.isNegative() || timeBudget.isZero()) {
            throw new SearchConfigurationException("timeBudget must be positive: " + timeBudget);
        }
    }

    /**
     * Creates constraints bounded only by time.
     */
    public static SearchConstraints ofSeconds(double seconds, boolean alphaBeta, Heuristic heuristic) {
        return new SearchConstraints(MAX_DEPTH, toDuration(seconds), alphaBeta, heuristic);
    }

    /**
     * Creates constraints bounded only by time, resolving the heuristic by id.
     */
    public static SearchConstraints ofSeconds(double seconds, boolean alphaBeta, String heuristicId) {
        return ofSeconds(seconds, alphaBeta, Heuristic.fromId(heuristicId));
    }

    public SearchConstraints withDepthLimit(int depth) {
        return new SearchConstraints(depth, timeBudget, alphaBeta, heuristic);
    }

    public double timeBudgetSeconds() {
        return timeBudget.getSeconds() + timeBudget.getNano() / 1_000_000_000.0;
    }

    /**
     * Returns the budget in nanoseconds, saturated at {@link Long#MAX_VALUE}.
     */
    public long timeBudgetNanos() {
        return timeBudget.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : timeBudget.toNanos();
    }

    private static Duration toDuration(double seconds) {
        if (Double.isNaN(seconds) || Double.isInfinite(seconds) || seconds <= 0.0) {
            throw new SearchConfigurationException("timeBudgetSeconds must be a positive number: " + seconds);
        }
        long nanos = (long) Math.ceil(seconds * 1_000_000_000.0);
        return Duration.ofNanos(Math.max(1L, nanos));
    }
}
