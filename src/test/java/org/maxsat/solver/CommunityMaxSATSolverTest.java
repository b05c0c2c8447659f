package org.maxsat.solver;

import org.maxsat.community.CommunityAssignment;
import org.maxsat.community.LabelPropagation;
import org.maxsat.community.VoteMode;
import org.maxsat.graph.ConflictGraphBuilder;
import org.maxsat.support.AssignmentEvaluator;
import org.maxsat.support.CNFFormula;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Solutore MAX-SAT guidato dalle comunità")
class CommunityMaxSATSolverTest {

    private static final List<List<Integer>> FIVE_CLAUSES = List.of(
            List.of(1, 2, 3),
            List.of(-1, -2, 3),
            List.of(1, -2, -3),
            List.of(-1, 2, -3),
            List.of(-1, -2, -3));

    /** 3-SAT casuale: tre variabili distinte per clausola, segni casuali. */
    private static List<List<Integer>> random3Sat(int numVars, int numClauses, long seed) {
        Random random = new Random(seed);
        List<List<Integer>> clauses = new ArrayList<>();
        while (clauses.size() < numClauses) {
            List<Integer> clause = new ArrayList<>();
            while (clause.size() < 3) {
                int variable = 1 + random.nextInt(numVars);
                if (!clause.contains(variable) && !clause.contains(-variable)) {
                    clause.add(random.nextBoolean() ? variable : -variable);
                }
            }
            clauses.add(clause);
        }
        return clauses;
    }

    private static int[] communitiesOf(List<List<Integer>> clauses, int numVars, long seed) {
        return LabelPropagation.detectCommunities(ConflictGraphBuilder.buildUnweighted(clauses, numVars), 100, seed);
    }

    /** Massimo esatto per enumerazione, solo per istanze piccole. */
    private static int exhaustiveMaximum(List<List<Integer>> clauses, int numVars) {
        int best = 0;
        for (int mask = 0; mask < (1 << numVars); mask++) {
            boolean[] assignment = new boolean[numVars];
            for (int v = 0; v < numVars; v++) {
                assignment[v] = (mask & (1 << v)) != 0;
            }
            best = Math.max(best, AssignmentEvaluator.evaluate(clauses, assignment));
        }
        return best;
    }

    @Test
    @DisplayName("Istanza a 5 clausole: punteggio tra 4 e l'ottimo esatto")
    void solvesFiveClauseInstance() {
        assertEquals(5, exhaustiveMaximum(FIVE_CLAUSES, 3));

        for (long seed = 0; seed < 10; seed++) {
            int[] labels = communitiesOf(FIVE_CLAUSES, 3, seed);
            MaxSATResult result = new CommunityMaxSATSolver(seed).solve(FIVE_CLAUSES, 3, labels);

            assertTrue(result.getSatisfiedCount() >= 4, "seme " + seed);
            assertTrue(result.getSatisfiedCount() <= 5, "seme " + seed);
            assertEquals(3, result.getVariableCount());
            assertEquals(AssignmentEvaluator.evaluate(FIVE_CLAUSES, result.getAssignment()),
                    result.getSatisfiedCount());
        }
    }

    @Test
    @DisplayName("Il punteggio non diminuisce dopo le fasi 2 e 3")
    void phasesNeverLoseClauses() {
        for (long seed = 0; seed < 8; seed++) {
            List<List<Integer>> clauses = random3Sat(20, 85, seed);
            MaxSATResult result = new CommunityMaxSATSolver(seed).solve(clauses, 20, communitiesOf(clauses, 20, seed));
            MaxSATStatistics statistics = result.getStatistics();

            assertTrue(statistics.getPhase2Score() >= statistics.getPhase1Score(), "seme " + seed);
            assertTrue(statistics.getFinalScore() >= statistics.getPhase2Score(), "seme " + seed);
            assertEquals(statistics.getFinalScore(), result.getSatisfiedCount());
            assertEquals(AssignmentEvaluator.evaluate(clauses, result.getAssignment()), result.getSatisfiedCount());
            assertTrue(statistics.getInitialScore() >= 0);
            assertTrue(statistics.isTimerStopped());
        }
    }

    @Test
    @DisplayName("Nessun singolo flip migliora la soluzione finale")
    void finalAssignmentIsLocalOptimum() {
        List<List<Integer>> clauses = random3Sat(25, 110, 7);
        MaxSATResult result = new CommunityMaxSATSolver(7).solve(clauses, 25, communitiesOf(clauses, 25, 7));

        boolean[] assignment = result.getAssignment();
        for (int v = 0; v < assignment.length; v++) {
            assignment[v] = !assignment[v];
            assertTrue(AssignmentEvaluator.evaluate(clauses, assignment) <= result.getSatisfiedCount(),
                    "variabile " + (v + 1));
            assignment[v] = !assignment[v];
        }
    }

    @Test
    @DisplayName("Clausole unitarie compatibili: tutte soddisfatte senza raffinamento")
    void unitClausesAreSatisfiedByPhaseOne() {
        MaxSATResult result = new CommunityMaxSATSolver(3).solve(
                List.of(List.of(1), List.of(2), List.of(-3)), 3, new int[]{1, 1, 1});

        assertTrue(result.isFullySatisfied());
        assertEquals("v 1 2 -3 0", result.toDimacsModel());
        assertEquals(3, result.getStatistics().getPhase1Score());
        assertEquals(0, result.getStatistics().getPhase3Iterations());
        assertTrue(result.getStatistics().isAllClausesSatisfied());
        assertEquals(1, result.getStatistics().getCommunityCount());
    }

    @Test
    @DisplayName("Fase 1: a parità di clausole soddisfatte la variabile vale true")
    void phaseOneTieGoesToTrue() {
        for (long seed = 0; seed < 20; seed++) {
            MaxSATResult result = new CommunityMaxSATSolver(seed).solve(List.of(List.of(1, -1)), 1, new int[]{1});

            assertTrue(result.getAssignment()[0], "seme " + seed);
            assertEquals(1, result.getSatisfiedCount());
        }
    }

    @Test
    @DisplayName("Fase 1: comunità per dimensione decrescente, la più piccola decide per ultima")
    void phaseOneVisitsLargerCommunitiesFirst() {
        // Comunità 1 = {[-1]} incontrata per prima, comunità 2 = {[1], [1]} più grande.
        // Visitando la 2 e poi la 1, la variabile condivisa resta false: una sola clausola.
        List<List<Integer>> clauses = List.of(List.of(-1), List.of(1), List.of(1));

        for (long seed = 0; seed < 10; seed++) {
            MaxSATResult result = new CommunityMaxSATSolver(seed).solve(clauses, 1, new int[]{1, 2, 2});

            assertEquals(1, result.getStatistics().getPhase1Score(), "seme " + seed);
            assertEquals(2, result.getSatisfiedCount(), "seme " + seed);
        }
    }

    @Test
    @DisplayName("Fase 1: a parità di dimensione vale l'ordine di primo incontro, non l'id")
    void phaseOneBreaksSizeTiesByEncounterOrder() {
        // Tre comunità singole incontrate nell'ordine 2, 7, 5: l'ultima visitata è la 5,
        // che vuole la variabile true. In ordine di id l'ultima sarebbe la 7 (false).
        List<List<Integer>> clauses = List.of(List.of(1), List.of(-1), List.of(1));

        for (long seed = 0; seed < 10; seed++) {
            MaxSATResult result = new CommunityMaxSATSolver(seed).solve(clauses, 1, new int[]{2, 7, 5});
            assertEquals(2, result.getStatistics().getPhase1Score(), "seme " + seed);
        }
    }

    @Test
    @DisplayName("Fase 3: si applica il primo flip migliorativo, non il migliore")
    void phaseThreeCommitsFirstImprovingFlip() {
        // Da tutto true: x1 compare in 3 clausole insoddisfatte e guadagna 1,
        // x2 compare in 2 e guadagnerebbe 2. Il primo miglioramento porta a un
        // ottimo locale con 4 clausole su 6; il miglior miglioramento le soddisferebbe tutte.
        List<List<Integer>> clauses = List.of(
                List.of(-1, -2), List.of(-1, -3), List.of(-1, -4), List.of(-2, -5),
                List.of(1), List.of(1));
        boolean[] assignment = {true, true, true, true, true};
        MaxSATStatistics statistics = new MaxSATStatistics();

        CommunityMaxSATSolver.refineGlobally(clauses, AssignmentEvaluator.occurrencesByVariable(clauses, 5),
                assignment, statistics);

        assertArrayEquals(new boolean[]{false, false, true, true, true}, assignment);
        assertEquals(4, AssignmentEvaluator.evaluate(clauses, assignment));
        assertEquals(2, statistics.getPhase3Flips());
        assertEquals(3, statistics.getPhase3Iterations());
    }

    @Test
    @DisplayName("Casi limite: nessuna clausola, nessuna variabile, clausola vuota")
    void handlesDegenerateInputs() {
        MaxSATResult noClauses = new CommunityMaxSATSolver().solve(List.of(), 4, new int[0]);
        assertEquals(0, noClauses.getSatisfiedCount());
        assertEquals(4, noClauses.getVariableCount());
        assertTrue(noClauses.isFullySatisfied());
        assertEquals(1.0, noClauses.getSatisfiedRatio());

        MaxSATResult nothing = new CommunityMaxSATSolver().solve(List.of(), 0, new int[0]);
        assertEquals(0, nothing.getVariableCount());
        assertEquals("v 0", nothing.toDimacsModel());

        MaxSATResult emptyClause = new CommunityMaxSATSolver().solve(List.of(List.of()), 0, new int[]{1});
        assertEquals(0, emptyClause.getSatisfiedCount());
        assertEquals(1, emptyClause.getUnsatisfiedCount());
        assertFalse(emptyClause.isFullySatisfied());
    }

    @Test
    @DisplayName("Stesso seme: stesso risultato")
    void sameSeedGivesSameResult() {
        List<List<Integer>> clauses = random3Sat(30, 128, 21);
        int[] labels = communitiesOf(clauses, 30, 21);

        assertEquals(new CommunityMaxSATSolver(99).solve(clauses, 30, labels),
                new CommunityMaxSATSolver(99).solve(clauses, 30, labels));
    }

    @Test
    @DisplayName("Percorso completo da formula e comunità rilevate")
    void solvesFromFormulaAndCommunities() {
        CNFFormula formula = new CNFFormula(3, FIVE_CLAUSES);
        CommunityAssignment communities = LabelPropagation.run(
                ConflictGraphBuilder.buildWeighted(FIVE_CLAUSES, 3, 1, null), VoteMode.EDGE_WEIGHT, 100, new Random(42));

        MaxSATResult result = new CommunityMaxSATSolver().solve(formula, communities);

        assertEquals(5, result.getTotalClauses());
        assertTrue(result.getSatisfiedCount() >= 4);
        assertEquals(communities.getCommunityCount(), result.getStatistics().getCommunityCount());
    }

    @Test
    @DisplayName("Argomenti non validi")
    void rejectsInvalidInput() {
        CommunityMaxSATSolver solver = new CommunityMaxSATSolver();

        assertThrows(IllegalArgumentException.class, () -> solver.solve(FIVE_CLAUSES, 3, new int[]{1, 1}));
        assertThrows(IllegalArgumentException.class, () -> solver.solve(null, 3, new int[0]));
        assertThrows(IllegalArgumentException.class, () -> solver.solve(FIVE_CLAUSES, 3, null));
        assertThrows(IllegalArgumentException.class, () -> solver.solve(FIVE_CLAUSES, -1, new int[5]));
        assertThrows(IllegalArgumentException.class,
                () -> solver.solve(List.of(List.of(1, 4)), 3, new int[]{1}));
        assertThrows(IllegalArgumentException.class,
                () -> solver.solve(List.of(List.of(0)), 3, new int[]{1}));
        assertThrows(IllegalArgumentException.class, () -> new CommunityMaxSATSolver((Random) null));
    }
}
