package org.maxsat.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Valutazione degli assegnamenti")
class AssignmentEvaluatorTest {

    private static final List<List<Integer>> CLAUSES = List.of(
            List.of(1, -2),
            List.of(2, 3),
            List.of(-1, -3),
            List.of());

    @Test
    @DisplayName("Letterali positivi e negati")
    void evaluatesLiterals() {
        boolean[] assignment = {true, false};
        assertTrue(AssignmentEvaluator.isLiteralTrue(1, assignment));
        assertFalse(AssignmentEvaluator.isLiteralTrue(-1, assignment));
        assertTrue(AssignmentEvaluator.isLiteralTrue(-2, assignment));
    }

    @Test
    @DisplayName("Conteggio clausole soddisfatte; la clausola vuota non è mai soddisfatta")
    void countsSatisfiedClauses() {
        assertEquals(2, AssignmentEvaluator.evaluate(CLAUSES, new boolean[]{true, false, true}));
        assertEquals(3, AssignmentEvaluator.evaluate(CLAUSES, new boolean[]{true, true, false}));
        assertFalse(AssignmentEvaluator.isClauseSatisfied(List.of(), new boolean[]{true, true, true}));
        assertEquals(List.of(2, 3), AssignmentEvaluator.unsatisfiedClauses(CLAUSES, new boolean[]{true, false, true}));
        assertEquals(1, AssignmentEvaluator.evaluateSubset(CLAUSES, List.of(1, 2, 3), new boolean[]{true, false, true}));
    }

    @Test
    @DisplayName("Il punteggio resta sempre in [0, numero di clausole]")
    void scoreIsBounded() {
        Random random = new Random(5);
        for (int trial = 0; trial < 50; trial++) {
            boolean[] assignment = AssignmentEvaluator.randomAssignment(3, random);
            int score = AssignmentEvaluator.evaluate(CLAUSES, assignment);
            assertTrue(score >= 0 && score <= CLAUSES.size());
        }
    }

    @Test
    @DisplayName("Assegnamento casuale riproducibile con lo stesso seme")
    void randomAssignmentIsReproducible() {
        assertArrayEquals(AssignmentEvaluator.randomAssignment(32, new Random(9)),
                AssignmentEvaluator.randomAssignment(32, new Random(9)));
        assertEquals(0, AssignmentEvaluator.randomAssignment(0, new Random(9)).length);
    }

    @Test
    @DisplayName("Indice inverso variabile -> clausole senza duplicati")
    void buildsOccurrenceIndex() {
        List<List<Integer>> occurrences = AssignmentEvaluator.occurrencesByVariable(
                List.of(List.of(1, -1, 2), List.of(-2, 3), List.of(1)), 4);

        assertEquals(List.of(0, 2), occurrences.get(0));
        assertEquals(List.of(0, 1), occurrences.get(1));
        assertEquals(List.of(1), occurrences.get(2));
        assertEquals(List.of(), occurrences.get(3));
    }
}
