package org.maxsat.dimacs;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.maxsat.dimacs.parser.DimacsLexer;
import org.maxsat.dimacs.parser.DimacsParser;
import org.maxsat.support.CNFFormula;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * LETTORE DIMACS - Punto di ingresso per il caricamento delle istanze CNF
 *
 * Pipeline: CharStream -> DimacsLexer -> DimacsParser -> DimacsFormulaVisitor.
 * Gli errori di sintassi non vengono recuperati: il primo errore interrompe
 * la lettura con una {@link IllegalArgumentException}.
 */
public final class DimacsReader {

    private static final Logger LOGGER = Logger.getLogger(DimacsReader.class.getName());

    private DimacsReader() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Legge una formula da testo DIMACS.
     *
     * @throws IllegalArgumentException se il testo non è DIMACS valido
     */
    public static CNFFormula parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Testo DIMACS non può essere null");
        }
        return parse(CharStreams.fromString(text, "<testo>"), "<testo>");
    }

    /**
     * Legge una formula da file .cnf (UTF-8).
     *
     * @throws IOException se il file non esiste o non è leggibile
     * @throws IllegalArgumentException se il contenuto non è DIMACS valido
     */
    public static CNFFormula read(Path path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("Percorso non può essere null");
        }
        if (!Files.isRegularFile(path)) {
            throw new IOException("File non esistente: " + path);
        }
        if (!Files.isReadable(path)) {
            throw new IOException("File non leggibile: " + path);
        }

        LOGGER.fine("Lettura file DIMACS: " + path);
        String name = path.getFileName().toString();
        return parse(CharStreams.fromPath(path, StandardCharsets.UTF_8), name);
    }

    private static CNFFormula parse(CharStream input, String sourceName) {
        DimacsErrorListener errorListener = new DimacsErrorListener(sourceName);

        DimacsLexer lexer = new DimacsLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        DimacsParser parser = new DimacsParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        CNFFormula formula = new DimacsFormulaVisitor().visit(parser.formula());
        LOGGER.info("Letta formula " + sourceName + ": " + formula);
        return formula;
    }
}
