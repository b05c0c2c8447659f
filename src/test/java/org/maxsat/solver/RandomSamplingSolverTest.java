package org.maxsat.solver;

import org.maxsat.support.AssignmentEvaluator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Solutore di confronto a campionamento casuale")
class RandomSamplingSolverTest {

    private static final List<List<Integer>> CLAUSES = List.of(
            List.of(1, 2, 3), List.of(-1, -2, 3), List.of(1, -2, -3), List.of(-1, 2, -3),
            List.of(-1, -2, -3), List.of(2, -4, 5), List.of(-3, 4, -5), List.of(1, 4, 5),
            List.of(-2, -4, -5), List.of(3, -1, 4));

    @Test
    @DisplayName("Zero campioni aggiuntivi: resta l'assegnamento iniziale")
    void zeroTrialsKeepsInitialAssignment() {
        MaxSATResult result = new RandomSamplingSolver(0, new Random(4)).solve(CLAUSES, 5);

        assertArrayEquals(AssignmentEvaluator.randomAssignment(5, new Random(4)), result.getAssignment());
        assertEquals(1, result.getStatistics().getSampledAssignments());
        assertEquals(result.getStatistics().getInitialScore(), result.getSatisfiedCount());
    }

    @Test
    @DisplayName("Il migliore campione non è peggiore del primo")
    void bestSampleIsNotWorseThanFirst() {
        for (long seed = 0; seed < 10; seed++) {
            MaxSATResult result = new RandomSamplingSolver(50, new Random(seed)).solve(CLAUSES, 5);
            MaxSATStatistics statistics = result.getStatistics();

            int firstScore = AssignmentEvaluator.evaluate(CLAUSES, AssignmentEvaluator.randomAssignment(5, new Random(seed)));
            assertEquals(firstScore, statistics.getInitialScore());
            assertTrue(result.getSatisfiedCount() >= firstScore);
            assertTrue(result.getSatisfiedCount() <= CLAUSES.size());
            assertEquals(AssignmentEvaluator.evaluate(CLAUSES, result.getAssignment()), result.getSatisfiedCount());
            assertEquals(51, statistics.getSampledAssignments());
        }
    }

    @Test
    @DisplayName("Stesso seme: stesso risultato")
    void sameSeedGivesSameResult() {
        assertEquals(new RandomSamplingSolver(8).solve(CLAUSES, 5), new RandomSamplingSolver(8).solve(CLAUSES, 5));
        assertEquals(RandomSamplingSolver.DEFAULT_TRIALS, new RandomSamplingSolver(8).getTrials());
    }

    @Test
    @DisplayName("Argomenti non validi")
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new RandomSamplingSolver(-1, new Random()));
        assertThrows(IllegalArgumentException.class, () -> new RandomSamplingSolver(3, null));
        assertThrows(IllegalArgumentException.class, () -> new RandomSamplingSolver(1).solve(null, 3));
    }
}
