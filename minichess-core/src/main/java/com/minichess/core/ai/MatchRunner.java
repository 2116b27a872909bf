package com.minichess.core.ai;

import com.minichess.core.GameOutcome;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point for running {@link SelfPlayMatch} sessions with configurable parameters.
 */
public final class MatchRunner {

    private static final Logger LOGGER = Logger.getLogger(MatchRunner.class.getName());

    private MatchRunner() {
    }

    public static void main(String[] args) {
        if (args.length < 4 || args.length > 6) {
            printUsage();
            return;
        }
        try {
            int gameCount = Integer.parseInt(args[0]);
            double timeBudgetSeconds = Double.parseDouble(args[1]);
            Heuristic whiteHeuristic = Heuristic.fromId(args[2]);
            Heuristic blackHeuristic = Heuristic.fromId(args[3]);
            int maxDepth = SearchConstraints.MAX_DEPTH;
            boolean alphaBeta = true;

            for (int index = 4; index < args.length; index++) {
                String option = args[index];
                if (option.startsWith("--maxDepth=")) {
                    maxDepth = Integer.parseInt(option.substring("--maxDepth=".length()));
                } else if ("--noAlphaBeta".equals(option)) {
                    alphaBeta = false;
                } else {
                    throw new IllegalArgumentException("Unrecognised argument: " + option);
                }
            }

            SearchConstraints white = SearchConstraints.ofSeconds(timeBudgetSeconds, alphaBeta, whiteHeuristic)
                    .withDepthLimit(maxDepth);
            SearchConstraints black = SearchConstraints.ofSeconds(timeBudgetSeconds, alphaBeta, blackHeuristic)
                    .withDepthLimit(maxDepth);

            SelfPlayMatch match = new SelfPlayMatch(white, black);
            match.playGames(gameCount);
            LOGGER.info(() -> String.format("White wins: %d, Black wins: %d, draws: %d, blocked: %d",
                    match.count(GameOutcome.WHITE_WINS), match.count(GameOutcome.BLACK_WINS),
                    match.count(GameOutcome.DRAW), match.count(GameOutcome.NO_LEGAL_MOVES)));
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            printUsage();
        }
    }

    private static void printUsage() {
        System.err.println(
                "Usage: MatchRunner <gameCount> <timeBudgetSeconds> <whiteHeuristic> <blackHeuristic> "
                        + "[--maxDepth=<value>] [--noAlphaBeta]");
    }
}
