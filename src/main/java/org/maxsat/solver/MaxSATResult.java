package org.maxsat.solver;

import java.util.Arrays;

/**
 * RISULTATO MAX-SAT - Contenitore immutabile per l'esito di una risoluzione
 *
 * COMPONENTI:
 * - Assegnamento: valore di ogni variabile, posizione v - 1 per la variabile v
 * - Punteggio: clausole soddisfatte su clausole totali
 * - Statistiche: punteggi per fase e tempo di esecuzione
 *
 * L'assegnamento viene copiato in ingresso e in uscita.
 */
public class MaxSATResult {

    //region ATTRIBUTI CORE

    private final boolean[] assignment;

    private final int satisfiedCount;

    private final int totalClauses;

    private final MaxSATStatistics statistics;

    //endregion

    //region COSTRUZIONE E VALIDAZIONE

    /**
     * @param assignment assegnamento finale (copiato)
     * @param satisfiedCount clausole soddisfatte, in [0, totalClauses]
     * @param totalClauses numero di clausole della formula
     * @param statistics metriche di esecuzione (null = statistiche vuote)
     * @throws IllegalArgumentException se assignment è null o il punteggio è fuori intervallo
     */
    public MaxSATResult(boolean[] assignment, int satisfiedCount, int totalClauses, MaxSATStatistics statistics) {
        if (assignment == null) {
            throw new IllegalArgumentException("Assegnamento non può essere null");
        }
        if (totalClauses < 0 || satisfiedCount < 0 || satisfiedCount > totalClauses) {
            throw new IllegalArgumentException("Punteggio non valido: " + satisfiedCount + "/" + totalClauses);
        }

        this.assignment = assignment.clone();
        this.satisfiedCount = satisfiedCount;
        this.totalClauses = totalClauses;
        this.statistics = statistics != null ? statistics : new MaxSATStatistics();
    }

    public MaxSATResult(boolean[] assignment, int satisfiedCount, int totalClauses) {
        this(assignment, satisfiedCount, totalClauses, null);
    }

    //endregion

    //region ACCESSORS E QUERY

    /** @return copia dell'assegnamento */
    public boolean[] getAssignment() {
        return assignment.clone();
    }

    /**
     * @param variable indice di variabile 1-based
     */
    public boolean valueOf(int variable) {
        if (variable < 1 || variable > assignment.length) {
            throw new IllegalArgumentException("Variabile " + variable + " fuori intervallo [1, " + assignment.length + "]");
        }
        return assignment[variable - 1];
    }

    public int getVariableCount() {
        return assignment.length;
    }

    public int getSatisfiedCount() {
        return satisfiedCount;
    }

    public int getTotalClauses() {
        return totalClauses;
    }

    public int getUnsatisfiedCount() {
        return totalClauses - satisfiedCount;
    }

    /**
     * @return frazione di clausole soddisfatte (1.0 per una formula senza clausole)
     */
    public double getSatisfiedRatio() {
        return totalClauses > 0 ? (double) satisfiedCount / totalClauses : 1.0;
    }

    public boolean isFullySatisfied() {
        return satisfiedCount == totalClauses;
    }

    public MaxSATStatistics getStatistics() {
        return statistics;
    }

    //endregion

    //region OUTPUT E RAPPRESENTAZIONE

    /**
     * Modello in forma DIMACS: letterali con segno terminati da 0.
     */
    public String toDimacsModel() {
        StringBuilder model = new StringBuilder("v");
        for (int i = 0; i < assignment.length; i++) {
            model.append(' ').append(assignment[i] ? i + 1 : -(i + 1));
        }
        return model.append(" 0").toString();
    }

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append(isFullySatisfied() ? "SAT" : "MAX-SAT").append("\n");
        output.append(String.format("Clausole soddisfatte: %d/%d (%.2f%%)%n",
                satisfiedCount, totalClauses, getSatisfiedRatio() * 100));
        output.append("Modello:\n");
        for (int i = 0; i < assignment.length; i++) {
            output.append("x").append(i + 1).append(" → ").append(assignment[i]).append("\n");
        }
        return output.toString();
    }

    public String toCompactString() {
        return String.format("MaxSATResult{%d/%d, vars=%d, time=%dms}",
                satisfiedCount, totalClauses, assignment.length, statistics.getExecutionTimeMs());
    }

    //endregion

    //region UGUAGLIANZA

    /**
     * Uguaglianza su assegnamento e punteggio, statistiche escluse.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        MaxSATResult other = (MaxSATResult) obj;
        return satisfiedCount == other.satisfiedCount &&
                totalClauses == other.totalClauses &&
                Arrays.equals(assignment, other.assignment);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(assignment) + satisfiedCount) + totalClauses;
    }

    //endregion
}
