package org.maxsat.support;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Random;

/**
 * VALUTAZIONE ASSEGNAMENTI - Funzioni condivise da solutore e baseline
 *
 * Un assegnamento è un boolean[] di lunghezza numVars: la variabile v (1-based)
 * corrisponde a assignment[v - 1]. Una clausola è soddisfatta se almeno un suo
 * letterale è vero; una clausola vuota non è mai soddisfatta.
 *
 * Nessuna validazione dei letterali: un letterale fuori da [1, numVars] è un
 * errore dell'input, rifiutato a monte dal lettore DIMACS.
 */
public final class AssignmentEvaluator {

    private AssignmentEvaluator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Valuta un singolo letterale.
     */
    public static boolean isLiteralTrue(int literal, boolean[] assignment) {
        boolean value = assignment[Math.abs(literal) - 1];
        return literal > 0 ? value : !value;
    }

    /**
     * @return true se almeno un letterale della clausola è vero
     */
    public static boolean isClauseSatisfied(List<Integer> clause, boolean[] assignment) {
        for (int literal : clause) {
            if (isLiteralTrue(literal, assignment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Conta le clausole soddisfatte dall'assegnamento.
     *
     * @return punteggio nell'intervallo [0, clauses.size()]
     */
    public static int evaluate(List<List<Integer>> clauses, boolean[] assignment) {
        int satisfied = 0;
        for (List<Integer> clause : clauses) {
            if (isClauseSatisfied(clause, assignment)) {
                satisfied++;
            }
        }
        return satisfied;
    }

    /**
     * Conta le clausole soddisfatte limitandosi a un sottoinsieme di indici (0-based).
     */
    public static int evaluateSubset(List<List<Integer>> clauses, Collection<Integer> clauseIndices,
                                     boolean[] assignment) {
        int satisfied = 0;
        for (int index : clauseIndices) {
            if (isClauseSatisfied(clauses.get(index), assignment)) {
                satisfied++;
            }
        }
        return satisfied;
    }

    /**
     * @return indici (0-based, crescenti) delle clausole non soddisfatte
     */
    public static List<Integer> unsatisfiedClauses(List<List<Integer>> clauses, boolean[] assignment) {
        List<Integer> unsatisfied = new ArrayList<>();
        for (int i = 0; i < clauses.size(); i++) {
            if (!isClauseSatisfied(clauses.get(i), assignment)) {
                unsatisfied.add(i);
            }
        }
        return unsatisfied;
    }

    /**
     * Genera un assegnamento uniforme usando la sorgente pseudo-casuale fornita.
     */
    public static boolean[] randomAssignment(int numVars, Random random) {
        boolean[] assignment = new boolean[numVars];
        for (int i = 0; i < numVars; i++) {
            assignment[i] = random.nextBoolean();
        }
        return assignment;
    }

    /**
     * Indice inverso variabile -> clausole (0-based) in cui compare, senza duplicati
     * per clausola. La posizione v - 1 contiene le clausole della variabile v.
     */
    public static List<List<Integer>> occurrencesByVariable(List<List<Integer>> clauses, int numVars) {
        List<List<Integer>> occurrences = new ArrayList<>(numVars);
        for (int v = 0; v < numVars; v++) {
            occurrences.add(new ArrayList<>());
        }
        for (int i = 0; i < clauses.size(); i++) {
            for (int literal : clauses.get(i)) {
                List<Integer> list = occurrences.get(Math.abs(literal) - 1);
                if (list.isEmpty() || list.get(list.size() - 1) != i) {
                    list.add(i);
                }
            }
        }
        return occurrences;
    }
}
