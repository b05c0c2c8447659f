package org.maxsat.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * COSTRUTTORE GRAFO DEI CONFLITTI - Dalle clausole al grafo sugli indici di clausola
 *
 * Per ogni coppia non ordinata di clausole distinte (i, j) con i &lt; j calcola
 * conflicts(i, j) = numero di letterali l della clausola i tali che -l compare
 * nella clausola j. L'arco (i, j) viene creato se e solo se il conteggio
 * raggiunge la soglia minConflicts.
 *
 * MODALITÀ:
 * - Non pesata: l'arco esiste o no
 * - Pesata: peso = weightFunction(conflicts), con ripiego sul conteggio grezzo
 *   quando la funzione restituisce un valore non finito, non positivo o solleva
 *   un'eccezione. Un arco che ha superato la soglia non viene mai scartato.
 *
 * COMPLESSITÀ: O(N² · L) con N clausole di lunghezza media L, adeguata alle
 * dimensioni di istanza previste (centinaia di clausole).
 */
public final class ConflictGraphBuilder {

    private static final Logger LOGGER = Logger.getLogger(ConflictGraphBuilder.class.getName());

    /** Soglia di default per il grafo non pesato */
    public static final int DEFAULT_MIN_CONFLICTS = 2;

    /** Soglia di default per il grafo pesato: ogni conflitto crea un arco */
    public static final int DEFAULT_WEIGHTED_MIN_CONFLICTS = 1;

    private ConflictGraphBuilder() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Costruisce il grafo dei conflitti.
     *
     * @param clauses clausole in ordine; la clausola in posizione k è il vertice k + 1
     * @param numVars numero di variabili, non usato dal calcolo ma mantenuto per coerenza d'interfaccia
     * @param weighted true per il grafo pesato
     * @param minConflicts soglia minima di conflitti per creare un arco (≥ 1)
     * @param weightFunction trasformazione dei pesi, ignorata se non pesato (null = identità)
     * @return grafo immutabile con un vertice per clausola
     * @throws IllegalArgumentException se clauses è null o minConflicts &lt; 1
     */
    public static ClauseGraph build(List<List<Integer>> clauses, int numVars, boolean weighted,
                                    int minConflicts, WeightFunction weightFunction) {
        if (clauses == null) {
            throw new IllegalArgumentException("Lista clausole non può essere null");
        }
        if (minConflicts < 1) {
            throw new IllegalArgumentException("Soglia minima di conflitti deve essere ≥ 1: " + minConflicts);
        }

        WeightFunction function = weightFunction != null ? weightFunction : WeightFunction.identity();
        int clauseCount = clauses.size();
        List<ClauseEdge> edges = new ArrayList<>();
        int fallbacks = 0;

        LOGGER.fine("Costruzione grafo " + (weighted ? "pesato" : "non pesato") + ": "
                + clauseCount + " clausole, " + numVars + " variabili, soglia " + minConflicts);

        for (int i = 0; i < clauseCount; i++) {
            for (int j = i + 1; j < clauseCount; j++) {
                int conflicts = countConflicts(clauses.get(i), clauses.get(j));
                if (conflicts < minConflicts) {
                    continue;
                }

                if (!weighted) {
                    edges.add(ClauseEdge.of(i + 1, j + 1));
                    continue;
                }

                double weight = transformWeight(function, conflicts);
                if (Double.isNaN(weight)) {
                    weight = conflicts;
                    fallbacks++;
                }
                if (LOGGER.isLoggable(Level.FINEST)) {
                    LOGGER.finest("Arco (" + (i + 1) + "," + (j + 1) + "): " + conflicts + " conflitti -> peso " + weight);
                }
                edges.add(new ClauseEdge(i + 1, j + 1, weight));
            }
        }

        ClauseGraph graph = weighted
                ? new WeightedClauseGraph(clauseCount, edges)
                : new UnweightedClauseGraph(clauseCount, edges);

        if (fallbacks > 0) {
            LOGGER.warning("Funzione di peso non valida su " + fallbacks
                    + " archi: usato il numero di conflitti come peso");
        }
        LOGGER.info("Grafo dei conflitti: " + graph.vertexCount() + " vertici, " + graph.edgeCount() + " archi");
        return graph;
    }

    /**
     * Grafo non pesato con la soglia di default ({@value #DEFAULT_MIN_CONFLICTS}).
     */
    public static ClauseGraph buildUnweighted(List<List<Integer>> clauses, int numVars) {
        return build(clauses, numVars, false, DEFAULT_MIN_CONFLICTS, null);
    }

    /**
     * Grafo pesato con soglia {@value #DEFAULT_WEIGHTED_MIN_CONFLICTS}: il peso è il numero di conflitti.
     */
    public static WeightedClauseGraph buildWeighted(List<List<Integer>> clauses, int numVars) {
        return buildWeighted(clauses, numVars, DEFAULT_WEIGHTED_MIN_CONFLICTS, null);
    }

    /**
     * Grafo pesato con soglia e funzione di peso esplicite.
     */
    public static WeightedClauseGraph buildWeighted(List<List<Integer>> clauses, int numVars,
                                                    int minConflicts, WeightFunction weightFunction) {
        return (WeightedClauseGraph) build(clauses, numVars, true, minConflicts, weightFunction);
    }

    /**
     * Numero di letterali di {@code first} la cui negazione compare in {@code second}.
     * Ogni occorrenza in {@code first} conta una volta.
     */
    public static int countConflicts(List<Integer> first, List<Integer> second) {
        int conflicts = 0;
        for (int literal : first) {
            if (second.contains(-literal)) {
                conflicts++;
            }
        }
        return conflicts;
    }

    //endregion

    //region GESTIONE PESI

    /**
     * Applica la funzione di peso e ne verifica il risultato.
     *
     * @return peso positivo e finito, oppure NaN se il chiamante deve ripiegare
     *         sul numero di conflitti
     */
    private static double transformWeight(WeightFunction function, int conflicts) {
        try {
            double weight = function.apply(conflicts);
            if (Double.isFinite(weight) && weight > 0) {
                return weight;
            }
            LOGGER.fine("Peso non valido " + weight + " per " + conflicts + " conflitti");
        } catch (RuntimeException e) {
            LOGGER.log(Level.FINE, "Funzione di peso fallita per " + conflicts + " conflitti", e);
        }
        return Double.NaN;
    }

    //endregion
}
