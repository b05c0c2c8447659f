package org.maxsat.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * FORMULA CNF NUMERICA - Rappresentazione immutabile di un'istanza MAX-SAT
 *
 * Contiene il numero di variabili dichiarato, il numero di clausole dichiarato
 * nell'intestazione DIMACS e la lista delle clausole effettivamente lette.
 * Ogni clausola è una List<Integer> di letterali con segno:
 * - Valori positivi: letterale positivo (variabile vera)
 * - Valori negativi: letterale negato (variabile falsa)
 *
 * INVARIANTI MANTENUTE:
 * - Lista clausole immutabile dopo costruzione (copia difensiva)
 * - L'ordine delle clausole fissa gli indici 1..N usati come vertici del grafo
 * - Il numero di clausole dichiarato è solo metadato: può differire da quello reale
 */
public class CNFFormula {

    private static final Logger LOGGER = Logger.getLogger(CNFFormula.class.getName());

    //region STRUTTURE DATI CORE

    /** Clausole nell'ordine di lettura; indice i (0-based) = clausola i+1 */
    private final List<List<Integer>> clauses;

    /** Numero di variabili dichiarato (letterali attesi in [1, variableCount]) */
    private final int variableCount;

    /** Numero di clausole dichiarato nell'intestazione, solo informativo */
    private final int declaredClauseCount;

    //endregion

    //region COSTRUZIONE

    /**
     * Costruisce una formula da clausole già decodificate.
     *
     * @param variableCount numero di variabili dichiarato (≥ 0)
     * @param declaredClauseCount numero di clausole riportato dall'intestazione
     * @param clauses clausole in ordine, ciascuna lista di letterali con segno
     * @throws IllegalArgumentException se clauses è null o variableCount negativo
     */
    public CNFFormula(int variableCount, int declaredClauseCount, List<List<Integer>> clauses) {
        if (clauses == null) {
            throw new IllegalArgumentException("Lista clausole non può essere null");
        }
        if (variableCount < 0) {
            throw new IllegalArgumentException("Numero variabili non può essere negativo: " + variableCount);
        }

        List<List<Integer>> copy = new ArrayList<>(clauses.size());
        for (List<Integer> clause : clauses) {
            if (clause == null) {
                throw new IllegalArgumentException("Clausola null alla posizione " + (copy.size() + 1));
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(clause)));
        }

        this.clauses = Collections.unmodifiableList(copy);
        this.variableCount = variableCount;
        this.declaredClauseCount = declaredClauseCount;

        if (declaredClauseCount != this.clauses.size()) {
            LOGGER.warning("Clausole dichiarate (" + declaredClauseCount + ") diverse da clausole lette ("
                    + this.clauses.size() + ")");
        }
    }

    /**
     * Costruisce una formula in cui il numero dichiarato coincide con quello reale.
     */
    public CNFFormula(int variableCount, List<List<Integer>> clauses) {
        this(variableCount, clauses == null ? 0 : clauses.size(), clauses);
    }

    //endregion

    //region ACCESSORS

    public List<List<Integer>> getClauses() {
        return clauses;
    }

    public int getVariableCount() {
        return variableCount;
    }

    public int getClausesCount() {
        return clauses.size();
    }

    public int getDeclaredClauseCount() {
        return declaredClauseCount;
    }

    /**
     * Rapporto clausole/variabili, indicatore classico di difficoltà per 3-SAT
     * casuale (transizione di fase intorno a 4.26).
     *
     * @return C/V ratio (0 se non ci sono variabili)
     */
    public double getClauseVariableRatio() {
        return variableCount > 0 ? (double) clauses.size() / variableCount : 0;
    }

    //endregion

    @Override
    public String toString() {
        return String.format("CNFFormula{variabili=%d, clausole=%d, dichiarate=%d}",
                variableCount, clauses.size(), declaredClauseCount);
    }
}
