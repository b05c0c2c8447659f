package org.maxsat.solver;

import org.maxsat.support.AssignmentEvaluator;

import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Solutore di confronto: valuta un assegnamento casuale iniziale più
 * {@code trials} assegnamenti casuali indipendenti e tiene il primo con il
 * punteggio strettamente migliore.
 */
public class RandomSamplingSolver {

    private static final Logger LOGGER = Logger.getLogger(RandomSamplingSolver.class.getName());

    /** Campioni aggiuntivi di default */
    public static final int DEFAULT_TRIALS = 100;

    private final int trials;

    private final Random random;

    public RandomSamplingSolver(long seed) {
        this(DEFAULT_TRIALS, new Random(seed));
    }

    /**
     * @param trials assegnamenti valutati oltre al primo (≥ 0)
     * @param random sorgente pseudo-casuale
     * @throws IllegalArgumentException se trials è negativo o random è null
     */
    public RandomSamplingSolver(int trials, Random random) {
        if (trials < 0) {
            throw new IllegalArgumentException("Numero di campioni non può essere negativo: " + trials);
        }
        if (random == null) {
            throw new IllegalArgumentException("Sorgente casuale non può essere null");
        }
        this.trials = trials;
        this.random = random;
    }

    public int getTrials() {
        return trials;
    }

    public MaxSATResult solve(List<List<Integer>> clauses, int numVars) {
        if (clauses == null) {
            throw new IllegalArgumentException("Lista clausole non può essere null");
        }
        if (numVars < 0) {
            throw new IllegalArgumentException("Numero variabili non può essere negativo: " + numVars);
        }

        MaxSATStatistics statistics = new MaxSATStatistics();

        boolean[] best = AssignmentEvaluator.randomAssignment(numVars, random);
        int bestScore = AssignmentEvaluator.evaluate(clauses, best);
        statistics.incrementSampledAssignments();
        statistics.recordInitialScore(bestScore);

        for (int trial = 0; trial < trials; trial++) {
            if (Thread.currentThread().isInterrupted()) {
                LOGGER.warning("Campionamento interrotto dopo " + trial + " campioni");
                break;
            }
            boolean[] candidate = AssignmentEvaluator.randomAssignment(numVars, random);
            int score = AssignmentEvaluator.evaluate(clauses, candidate);
            statistics.incrementSampledAssignments();
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }

        statistics.recordFinalScore(bestScore);
        statistics.setAllClausesSatisfied(bestScore == clauses.size());
        statistics.stopTimer();

        LOGGER.fine("Campionamento casuale: " + bestScore + "/" + clauses.size() + " su "
                + statistics.getSampledAssignments() + " assegnamenti");
        return new MaxSATResult(best, bestScore, clauses.size(), statistics);
    }
}
