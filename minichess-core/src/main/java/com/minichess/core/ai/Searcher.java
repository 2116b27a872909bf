package com.minichess.core.ai;

import com.minichess.core.GameState;

/**
 * Generic interface for game tree search implementations.
 */
public interface Searcher {

    /**
     * Executes a search for the best move of the side to move in the provided {@link GameState}
     * under the supplied {@link SearchConstraints}.
     *
     * @param state the starting state to analyse
     * @param constraints the limits guiding the search execution
     * @return the result of the search; {@link SearchResult#isNoLegalMoves()} when the side to move
     *         cannot move
     */
    SearchResult search(GameState state, SearchConstraints constraints);
}
