package org.maxsat.solver;

import org.maxsat.community.CommunityAssignment;
import org.maxsat.support.AssignmentEvaluator;
import org.maxsat.support.CNFFormula;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * SOLUTORE MAX-SAT GUIDATO DALLE COMUNITÀ - Euristica a tre fasi
 *
 * FASI:
 * 1. Assegnamento per priorità di comunità: partendo da un assegnamento casuale,
 *    le comunità vengono visitate per dimensione decrescente e ogni loro variabile
 *    viene fissata al valore che soddisfa più clausole della comunità (parità: true)
 * 2. Ricerca locale per comunità: hill-climbing sulle variabili di ogni comunità,
 *    un flip viene tenuto solo se aumenta le clausole soddisfatte della comunità
 *    senza ridurre il punteggio globale (massimo {@value #LOCAL_SEARCH_MAX_SWEEPS} passate)
 * 3. Raffinamento globale: le variabili più frequenti nelle clausole insoddisfatte
 *    vengono provate in ordine; si applica il primo flip che migliora il punteggio
 *    globale (massimo {@value #GLOBAL_REFINEMENT_MAX_ITERATIONS} iterazioni)
 *
 * Il punteggio globale non diminuisce mai da una fase alla successiva.
 * I delta dei flip sono calcolati solo sulle clausole che contengono la variabile,
 * tramite l'indice inverso variabile -> clausole.
 *
 * Un'istanza usa la propria sorgente casuale: chiamate successive a solve()
 * proseguono la stessa sequenza pseudo-casuale.
 */
public class CommunityMaxSATSolver {

    private static final Logger LOGGER = Logger.getLogger(CommunityMaxSATSolver.class.getName());

    //region CONFIGURAZIONE

    /** Passate massime della ricerca locale su una singola comunità */
    public static final int LOCAL_SEARCH_MAX_SWEEPS = 50;

    /** Iterazioni esterne massime del raffinamento globale */
    public static final int GLOBAL_REFINEMENT_MAX_ITERATIONS = 100;

    /** Seme di default per l'assegnamento iniziale */
    public static final long DEFAULT_SEED = 42L;

    private final Random random;

    //endregion

    //region INIZIALIZZAZIONE

    public CommunityMaxSATSolver() {
        this(DEFAULT_SEED);
    }

    public CommunityMaxSATSolver(long seed) {
        this(new Random(seed));
    }

    /**
     * @param random sorgente per l'assegnamento casuale iniziale
     * @throws IllegalArgumentException se random è null
     */
    public CommunityMaxSATSolver(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("Sorgente casuale non può essere null");
        }
        this.random = random;
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * Risolve la formula usando le comunità rilevate sul grafo dei conflitti.
     */
    public MaxSATResult solve(CNFFormula formula, CommunityAssignment communities) {
        if (formula == null || communities == null) {
            throw new IllegalArgumentException("Formula e comunità sono obbligatorie");
        }
        return solve(formula.getClauses(), formula.getVariableCount(), communities.getLabels());
    }

    /**
     * Esegue le tre fasi e restituisce l'assegnamento finale con il suo punteggio.
     *
     * @param clauses clausole della formula
     * @param numVars numero di variabili
     * @param clauseCommunities comunità di ogni clausola, posizione i per la clausola i + 1
     * @return assegnamento, clausole soddisfatte e statistiche per fase
     * @throws IllegalArgumentException se gli argomenti sono null, se il numero di etichette
     *         differisce dal numero di clausole o se un letterale è fuori da [1, numVars]
     */
    public MaxSATResult solve(List<List<Integer>> clauses, int numVars, int[] clauseCommunities) {
        validateInput(clauses, numVars, clauseCommunities);

        MaxSATStatistics statistics = new MaxSATStatistics();
        List<List<Integer>> occurrences = AssignmentEvaluator.occurrencesByVariable(clauses, numVars);
        Map<Integer, List<Integer>> communities = groupByCommunity(clauseCommunities);
        statistics.setCommunityCount(communities.size());

        LOGGER.fine("Avvio solutore: " + clauses.size() + " clausole, " + numVars + " variabili, "
                + communities.size() + " comunità");

        boolean[] assignment = AssignmentEvaluator.randomAssignment(numVars, random);
        statistics.recordInitialScore(AssignmentEvaluator.evaluate(clauses, assignment));

        assignByCommunityPriority(clauses, occurrences, clauseCommunities, communities, assignment);
        statistics.recordPhase1Score(AssignmentEvaluator.evaluate(clauses, assignment));

        searchWithinCommunities(clauses, occurrences, clauseCommunities, communities, assignment, statistics);
        statistics.recordPhase2Score(AssignmentEvaluator.evaluate(clauses, assignment));

        refineGlobally(clauses, occurrences, assignment, statistics);
        int score = AssignmentEvaluator.evaluate(clauses, assignment);
        statistics.recordFinalScore(score);
        statistics.setAllClausesSatisfied(score == clauses.size());
        statistics.stopTimer();

        LOGGER.info("Soluzione: " + score + "/" + clauses.size() + " clausole soddisfatte ("
                + statistics.toCompactString() + ")");
        return new MaxSATResult(assignment, score, clauses.size(), statistics);
    }

    //endregion

    //region VALIDAZIONE E PREPARAZIONE

    private static void validateInput(List<List<Integer>> clauses, int numVars, int[] clauseCommunities) {
        if (clauses == null) {
            throw new IllegalArgumentException("Lista clausole non può essere null");
        }
        if (numVars < 0) {
            throw new IllegalArgumentException("Numero variabili non può essere negativo: " + numVars);
        }
        if (clauseCommunities == null) {
            throw new IllegalArgumentException("Etichette di comunità non possono essere null");
        }
        if (clauseCommunities.length != clauses.size()) {
            throw new IllegalArgumentException("Etichette di comunità (" + clauseCommunities.length
                    + ") diverse dal numero di clausole (" + clauses.size() + ")");
        }
        for (int i = 0; i < clauses.size(); i++) {
            for (int literal : clauses.get(i)) {
                if (literal == 0 || Math.abs(literal) > numVars) {
                    throw new IllegalArgumentException("Letterale " + literal + " della clausola " + (i + 1)
                            + " fuori intervallo [1, " + numVars + "]");
                }
            }
        }
    }

    /**
     * Raggruppa gli indici di clausola (0-based) per comunità, nell'ordine di primo incontro.
     */
    private static Map<Integer, List<Integer>> groupByCommunity(int[] clauseCommunities) {
        Map<Integer, List<Integer>> communities = new LinkedHashMap<>();
        for (int i = 0; i < clauseCommunities.length; i++) {
            communities.computeIfAbsent(clauseCommunities[i], id -> new ArrayList<>()).add(i);
        }
        return communities;
    }

    /**
     * Variabili delle clausole di una comunità in ordine di prima occorrenza.
     */
    private static List<Integer> communityVariables(List<List<Integer>> clauses, List<Integer> clauseIndices) {
        Set<Integer> variables = new LinkedHashSet<>();
        for (int index : clauseIndices) {
            for (int literal : clauses.get(index)) {
                variables.add(Math.abs(literal));
            }
        }
        return new ArrayList<>(variables);
    }

    //endregion

    //region FASE 1 - ASSEGNAMENTO PER PRIORITÀ DI COMUNITÀ

    private void assignByCommunityPriority(List<List<Integer>> clauses, List<List<Integer>> occurrences,
                                           int[] clauseCommunities, Map<Integer, List<Integer>> communities,
                                           boolean[] assignment) {
        // Ordinamento stabile: a parità di dimensione resta l'ordine di primo incontro
        List<Map.Entry<Integer, List<Integer>>> ordered = new ArrayList<>(communities.entrySet());
        ordered.sort(Comparator.comparingInt((Map.Entry<Integer, List<Integer>> e) -> e.getValue().size()).reversed());

        for (Map.Entry<Integer, List<Integer>> community : ordered) {
            if (Thread.currentThread().isInterrupted()) {
                LOGGER.warning("Fase 1 interrotta");
                return;
            }
            int id = community.getKey();
            for (int variable : communityVariables(clauses, community.getValue())) {
                assignment[variable - 1] = true;
                int scoreTrue = countSatisfiedInCommunity(clauses, occurrences, clauseCommunities, id, variable, assignment);
                assignment[variable - 1] = false;
                int scoreFalse = countSatisfiedInCommunity(clauses, occurrences, clauseCommunities, id, variable, assignment);
                assignment[variable - 1] = scoreTrue >= scoreFalse;
            }
        }
        LOGGER.fine("Fase 1 completata su " + ordered.size() + " comunità");
    }

    //endregion

    //region FASE 2 - RICERCA LOCALE PER COMUNITÀ

    private void searchWithinCommunities(List<List<Integer>> clauses, List<List<Integer>> occurrences,
                                         int[] clauseCommunities, Map<Integer, List<Integer>> communities,
                                         boolean[] assignment, MaxSATStatistics statistics) {
        Map<Integer, List<Integer>> byId = new TreeMap<>(communities);

        for (Map.Entry<Integer, List<Integer>> community : byId.entrySet()) {
            int id = community.getKey();
            List<Integer> variables = communityVariables(clauses, community.getValue());
            if (variables.isEmpty()) {
                continue;
            }

            int sweeps = 0;
            boolean improved = true;
            while (improved && sweeps < LOCAL_SEARCH_MAX_SWEEPS) {
                if (Thread.currentThread().isInterrupted()) {
                    LOGGER.warning("Fase 2 interrotta sulla comunità " + id);
                    statistics.addPhase2Sweeps(sweeps);
                    return;
                }
                sweeps++;
                improved = false;

                for (int variable : variables) {
                    int communityBefore = countSatisfiedInCommunity(clauses, occurrences, clauseCommunities, id, variable, assignment);
                    int globalBefore = countSatisfiedContaining(clauses, occurrences, variable, assignment);
                    flip(assignment, variable);
                    int communityAfter = countSatisfiedInCommunity(clauses, occurrences, clauseCommunities, id, variable, assignment);
                    int globalAfter = countSatisfiedContaining(clauses, occurrences, variable, assignment);

                    if (communityAfter > communityBefore && globalAfter >= globalBefore) {
                        improved = true;
                        statistics.incrementPhase2Flips();
                    } else {
                        flip(assignment, variable);
                    }
                }
            }

            statistics.addPhase2Sweeps(sweeps);
            if (improved) {
                LOGGER.fine("Ricerca locale sulla comunità " + id + " fermata al limite di "
                        + LOCAL_SEARCH_MAX_SWEEPS + " passate");
            }
        }
    }

    //endregion

    //region FASE 3 - RAFFINAMENTO GLOBALE

    /**
     * Raffinamento a primo miglioramento: a ogni iterazione si applica il primo flip
     * candidato che aumenta il punteggio globale, anche se un candidato successivo
     * guadagnerebbe di più. Modifica l'assegnamento sul posto.
     */
    static void refineGlobally(List<List<Integer>> clauses, List<List<Integer>> occurrences,
                               boolean[] assignment, MaxSATStatistics statistics) {
        for (int iteration = 0; iteration < GLOBAL_REFINEMENT_MAX_ITERATIONS; iteration++) {
            if (Thread.currentThread().isInterrupted()) {
                LOGGER.warning("Fase 3 interrotta all'iterazione " + iteration);
                return;
            }

            List<Integer> unsatisfied = AssignmentEvaluator.unsatisfiedClauses(clauses, assignment);
            if (unsatisfied.isEmpty()) {
                LOGGER.fine("Fase 3: tutte le clausole soddisfatte");
                return;
            }
            statistics.incrementPhase3Iterations();

            List<Integer> candidates = candidatesByFrequency(clauses, unsatisfied, assignment.length);
            boolean committed = false;
            for (int variable : candidates) {
                int before = countSatisfiedContaining(clauses, occurrences, variable, assignment);
                flip(assignment, variable);
                int after = countSatisfiedContaining(clauses, occurrences, variable, assignment);
                if (after > before) {
                    statistics.incrementPhase3Flips();
                    committed = true;
                    break;
                }
                flip(assignment, variable);
            }

            if (!committed) {
                LOGGER.fine("Fase 3: ottimo locale dopo " + (iteration + 1) + " iterazioni");
                return;
            }
        }
        LOGGER.fine("Fase 3 fermata al limite di " + GLOBAL_REFINEMENT_MAX_ITERATIONS + " iterazioni");
    }

    /**
     * Variabili presenti nelle clausole insoddisfatte, per frequenza decrescente
     * e indice crescente a parità. Ogni clausola conta una volta per variabile.
     */
    private static List<Integer> candidatesByFrequency(List<List<Integer>> clauses, List<Integer> unsatisfied,
                                                       int numVars) {
        int[] frequency = new int[numVars];
        for (int index : unsatisfied) {
            Set<Integer> seen = new LinkedHashSet<>();
            for (int literal : clauses.get(index)) {
                if (seen.add(Math.abs(literal))) {
                    frequency[Math.abs(literal) - 1]++;
                }
            }
        }

        List<Integer> candidates = new ArrayList<>();
        for (int v = 1; v <= numVars; v++) {
            if (frequency[v - 1] > 0) {
                candidates.add(v);
            }
        }
        candidates.sort((a, b) -> frequency[a - 1] != frequency[b - 1]
                ? Integer.compare(frequency[b - 1], frequency[a - 1])
                : Integer.compare(a, b));
        return candidates;
    }

    //endregion

    //region CALCOLO DEI DELTA

    /**
     * Clausole soddisfatte tra quelle che contengono la variabile.
     */
    private static int countSatisfiedContaining(List<List<Integer>> clauses, List<List<Integer>> occurrences,
                                                int variable, boolean[] assignment) {
        return AssignmentEvaluator.evaluateSubset(clauses, occurrences.get(variable - 1), assignment);
    }

    /**
     * Clausole soddisfatte tra quelle della comunità che contengono la variabile.
     * Il confronto tra due valori della variabile su questo sottoinsieme equivale
     * al confronto sull'intera comunità.
     */
    private static int countSatisfiedInCommunity(List<List<Integer>> clauses, List<List<Integer>> occurrences,
                                                 int[] clauseCommunities, int community, int variable,
                                                 boolean[] assignment) {
        int satisfied = 0;
        for (int index : occurrences.get(variable - 1)) {
            if (clauseCommunities[index] == community
                    && AssignmentEvaluator.isClauseSatisfied(clauses.get(index), assignment)) {
                satisfied++;
            }
        }
        return satisfied;
    }

    private static void flip(boolean[] assignment, int variable) {
        assignment[variable - 1] = !assignment[variable - 1];
    }

    //endregion
}
