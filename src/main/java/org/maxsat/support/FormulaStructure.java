package org.maxsat.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Riepilogo strutturale di un insieme di clausole: numero di clausole,
 * lunghezze, lunghezze distinte e variabili effettivamente usate.
 */
public final class FormulaStructure {

    private final int clauseCount;

    /** Lunghezza di ogni clausola, nell'ordine originale */
    private final List<Integer> clauseLengths;

    /** Lunghezze distinte in ordine crescente */
    private final SortedSet<Integer> distinctClauseLengths;

    /** Variabili che compaiono almeno una volta, in ordine crescente */
    private final List<Integer> variablesUsed;

    private FormulaStructure(int clauseCount, List<Integer> clauseLengths,
                             SortedSet<Integer> distinctClauseLengths, List<Integer> variablesUsed) {
        this.clauseCount = clauseCount;
        this.clauseLengths = clauseLengths;
        this.distinctClauseLengths = distinctClauseLengths;
        this.variablesUsed = variablesUsed;
    }

    public static FormulaStructure analyze(List<List<Integer>> clauses) {
        List<Integer> lengths = new ArrayList<>(clauses.size());
        TreeSet<Integer> distinctLengths = new TreeSet<>();
        TreeSet<Integer> variables = new TreeSet<>();

        for (List<Integer> clause : clauses) {
            lengths.add(clause.size());
            distinctLengths.add(clause.size());
            for (int literal : clause) {
                variables.add(Math.abs(literal));
            }
        }

        return new FormulaStructure(clauses.size(),
                Collections.unmodifiableList(lengths),
                Collections.unmodifiableSortedSet(distinctLengths),
                List.copyOf(variables));
    }

    public int getClauseCount() {
        return clauseCount;
    }

    public List<Integer> getClauseLengths() {
        return clauseLengths;
    }

    public SortedSet<Integer> getDistinctClauseLengths() {
        return distinctClauseLengths;
    }

    public List<Integer> getVariablesUsed() {
        return variablesUsed;
    }

    /** @return numero di variabili distinte usate */
    public int getVariableCount() {
        return variablesUsed.size();
    }

    /** @return true se tutte le clausole hanno esattamente tre letterali */
    public boolean isUniform3SAT() {
        return clauseCount > 0 && distinctClauseLengths.size() == 1 && distinctClauseLengths.first() == 3;
    }

    @Override
    public String toString() {
        return String.format("FormulaStructure{clausole=%d, lunghezze=%s, variabili usate=%d}",
                clauseCount, distinctClauseLengths, variablesUsed.size());
    }
}
