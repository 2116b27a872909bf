package com.minichess.core.ai;

import com.minichess.core.Move;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated instrumentation data captured during a single {@link Searcher#search} call. Only fully
 * completed iterations are recorded.
 */
public final class SearchTelemetry {

    private static final SearchTelemetry EMPTY = new SearchTelemetry(List.of());

    private final List<Iteration> iterations;

    public SearchTelemetry(List<Iteration> iterations) {
        if (iterations == null || iterations.isEmpty()) {
            this.iterations = List.of();
        } else {
            this.iterations = Collections.unmodifiableList(new ArrayList<>(iterations));
        }
    }

    public static SearchTelemetry empty() {
        return EMPTY;
    }

    public List<Iteration> iterations() {
        return iterations;
    }

    public Iteration latest() {
        return iterations.isEmpty() ? null : iterations.get(iterations.size() - 1);
    }

    public long totalNodes() {
        return iterations.stream().mapToLong(Iteration::nodes).sum();
    }

    public long totalCutoffs() {
        return iterations.stream().mapToLong(Iteration::cutoffs).sum();
    }

    public record Iteration(
            int depth,
            long nodes,
            long cutoffs,
            long elapsedNanos,
            Move bestMove,
            int score) {

        public Iteration {
            Objects.requireNonNull(bestMove, "bestMove");
        }

        public double elapsedMillis() {
            return elapsedNanos / 1_000_000.0;
        }
    }
}
