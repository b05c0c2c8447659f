package org.maxsat.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Struttura della formula")
class FormulaStructureTest {

    @Test
    @DisplayName("Lunghezze, lunghezze distinte e variabili usate")
    void summarizesClauses() {
        FormulaStructure structure = FormulaStructure.analyze(List.of(
                List.of(3, -1, 2), List.of(-7, 1), List.of(2, 3, -3)));

        assertEquals(3, structure.getClauseCount());
        assertEquals(List.of(3, 2, 3), structure.getClauseLengths());
        assertEquals(List.of(2, 3), new ArrayList<>(structure.getDistinctClauseLengths()));
        assertEquals(List.of(1, 2, 3, 7), structure.getVariablesUsed());
        assertEquals(4, structure.getVariableCount());
        assertFalse(structure.isUniform3SAT());
    }

    @Test
    @DisplayName("Riconoscimento di 3-SAT uniforme")
    void detectsUniform3Sat() {
        assertTrue(FormulaStructure.analyze(List.of(List.of(1, 2, 3), List.of(-1, -2, -3))).isUniform3SAT());
        assertFalse(FormulaStructure.analyze(List.of()).isUniform3SAT());
    }

    @Test
    @DisplayName("Formula numerica: copia difensiva e conteggio dichiarato")
    void formulaKeepsDeclaredCountAsMetadata() {
        List<List<Integer>> clauses = new ArrayList<>();
        clauses.add(new ArrayList<>(List.of(1, -2)));
        CNFFormula formula = new CNFFormula(2, 5, clauses);
        clauses.get(0).add(3);

        assertEquals(List.of(List.of(1, -2)), formula.getClauses());
        assertEquals(1, formula.getClausesCount());
        assertEquals(5, formula.getDeclaredClauseCount());
        assertEquals(0.5, formula.getClauseVariableRatio());
        assertThrows(UnsupportedOperationException.class, () -> formula.getClauses().add(List.of(1)));
        assertThrows(IllegalArgumentException.class, () -> new CNFFormula(-1, List.of()));
        assertThrows(IllegalArgumentException.class, () -> new CNFFormula(2, null));
    }
}
