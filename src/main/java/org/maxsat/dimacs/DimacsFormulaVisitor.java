package org.maxsat.dimacs;

import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.maxsat.dimacs.parser.DimacsBaseVisitor;
import org.maxsat.dimacs.parser.DimacsParser.ClauseContext;
import org.maxsat.dimacs.parser.DimacsParser.FormulaContext;
import org.maxsat.dimacs.parser.DimacsParser.LineContext;
import org.maxsat.dimacs.parser.DimacsParser.ProblemContext;
import org.maxsat.support.CNFFormula;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * VISITOR DIMACS - Dall'albero sintattico ANTLR a {@link CNFFormula}
 *
 * REGOLE DI CONVERSIONE:
 * - Intestazione 'p cnf V C': fissa il numero di variabili e il numero di
 *   clausole dichiarato; al massimo una per file
 * - Ogni riga di clausola diventa una clausola, scartando tutti i token 0
 * - Una riga che resta senza letterali (es. la riga "0" dopo il marcatore '%')
 *   non produce clausole
 * - Senza intestazione il numero di variabili è il massimo indice usato
 *
 * Con l'intestazione presente, un letterale oltre il numero di variabili
 * dichiarato rende l'input non valido.
 */
public class DimacsFormulaVisitor extends DimacsBaseVisitor<CNFFormula> {

    private static final Logger LOGGER = Logger.getLogger(DimacsFormulaVisitor.class.getName());

    /** Terminatore di clausola, scartato ovunque compaia nella riga */
    private static final int CLAUSE_TERMINATOR = 0;

    @Override
    public CNFFormula visitFormula(FormulaContext ctx) {
        ProblemContext header = null;
        List<List<Integer>> clauses = new ArrayList<>();
        int maxVariable = 0;

        for (LineContext line : ctx.line()) {
            if (line.problem() != null) {
                if (header != null) {
                    throw new IllegalArgumentException("Intestazione 'p cnf' duplicata alla riga "
                            + line.problem().getStart().getLine());
                }
                header = line.problem();
                continue;
            }

            List<Integer> clause = readClause(line.clause());
            if (clause.isEmpty()) {
                LOGGER.finest("Riga " + line.getStart().getLine() + " senza letterali ignorata");
                continue;
            }
            for (int literal : clause) {
                maxVariable = Math.max(maxVariable, Math.abs(literal));
            }
            clauses.add(clause);
        }

        if (header == null) {
            LOGGER.warning("Intestazione 'p cnf' assente: " + maxVariable + " variabili dedotte dai letterali");
            return new CNFFormula(maxVariable, clauses);
        }

        int declaredVariables = parseCount(header.declaredVariables, "variabili");
        int declaredClauses = parseCount(header.declaredClauses, "clausole");
        if (maxVariable > declaredVariables) {
            throw new IllegalArgumentException("Letterale con variabile " + maxVariable
                    + " oltre le " + declaredVariables + " variabili dichiarate");
        }

        LOGGER.fine("Formula DIMACS: " + declaredVariables + " variabili, " + clauses.size() + " clausole");
        return new CNFFormula(declaredVariables, declaredClauses, clauses);
    }

    /**
     * Letterali della riga senza i terminatori.
     */
    private static List<Integer> readClause(ClauseContext ctx) {
        List<Integer> literals = new ArrayList<>();
        for (TerminalNode token : ctx.INT()) {
            int literal = parseInt(token.getSymbol());
            if (literal != CLAUSE_TERMINATOR) {
                literals.add(literal);
            }
        }
        return literals;
    }

    private static int parseCount(Token token, String what) {
        int value = parseInt(token);
        if (value < 0) {
            throw new IllegalArgumentException("Numero di " + what + " negativo nell'intestazione: " + value);
        }
        return value;
    }

    private static int parseInt(Token token) {
        try {
            return Integer.parseInt(token.getText());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Intero fuori intervallo alla riga " + token.getLine()
                    + ": " + token.getText(), e);
        }
    }
}
