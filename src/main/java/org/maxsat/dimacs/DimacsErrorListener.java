package org.maxsat.dimacs;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Trasforma il primo errore lessicale o sintattico in un'eccezione con
 * riga e colonna, al posto del recupero silenzioso di ANTLR.
 */
class DimacsErrorListener extends BaseErrorListener {

    private final String sourceName;

    DimacsErrorListener(String sourceName) {
        this.sourceName = sourceName;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        throw new IllegalArgumentException("Errore DIMACS in " + sourceName + " alla riga " + line
                + ", colonna " + (charPositionInLine + 1) + ": " + msg, e);
    }
}
