package org.maxsat;

import org.maxsat.community.CommunityAssignment;
import org.maxsat.community.LabelPropagation;
import org.maxsat.community.VoteMode;
import org.maxsat.dimacs.DimacsReader;
import org.maxsat.graph.ClauseGraph;
import org.maxsat.graph.ConflictGraphBuilder;
import org.maxsat.graph.StandardWeightFunction;
import org.maxsat.graph.WeightedClauseGraph;
import org.maxsat.solver.CommunityMaxSATSolver;
import org.maxsat.solver.MaxSATResult;
import org.maxsat.solver.MaxSATStatistics;
import org.maxsat.solver.RandomSamplingSolver;
import org.maxsat.support.CNFFormula;
import org.maxsat.support.FormulaStructure;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * SOLUTORE MAX-SAT GUIDATO DALLE COMUNITÀ
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: File CNF in formato DIMACS (singolo o intera directory)
 * 2. PARSING: Grammatica ANTLR DIMACS -> CNFFormula
 * 3. GRAFO: Grafo dei conflitti tra clausole, non pesato o pesato (-w)
 * 4. COMUNITÀ: Propagazione delle etichette sul grafo
 * 5. RISOLUZIONE: Euristica a tre fasi guidata dalle comunità
 * 6. CONFRONTO: Campionamento casuale come riferimento (-b)
 * 7. OUTPUT: File RESULT/ con modello e STATS/ con statistiche per fase
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - File singolo (-f): Elaborazione di un singolo file .cnf
 * - Directory batch (-d): Elaborazione di tutti i file .cnf in una cartella
 * - Timeout configurabile per singola formula (-t secondi)
 */
public final class Main {

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String MIN_CONFLICTS_PARAM = "-m";
    private static final String WEIGHT_PARAM = "-w=";
    private static final String SEED_PARAM = "-s";
    private static final String ITERATIONS_PARAM = "-i";
    private static final String BASELINE_PARAM = "-b";

    /**
     * Limiti temporali
     */
    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    /** Estensione dei file elaborati in modalità directory */
    private static final String CNF_EXTENSION = ".cnf";

    /**
     * Previene istanziazione - classe utility
     */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * FLUSSO ESECUZIONE:
     * 1. Parsing e validazione parametri linea di comando
     * 2. Riepilogo della configurazione
     * 3. Elaborazione del file singolo o della directory
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO SOLUTORE MAX-SAT <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            SolverConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            displayConfigurationSummary(config);
            executeMainPipeline(config);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE SOLUTORE MAX-SAT <---");
        }
    }

    private static void executeMainPipeline(SolverConfiguration config) {
        if (config.isFileMode) {
            System.out.println("[I] Modalità: Elaborazione file singolo");
            processSingleFile(config);
        } else {
            System.out.println("[I] Modalità: Elaborazione della directory");
            processDirectoryBatch(config);
        }
    }

    /**
     * Errore non previsto: messaggio all'utente e uscita con codice 1.
     */
    private static void handleGlobalError(Exception e) {
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    /**
     * @return configurazione validata o null se help/errore
     */
    private static SolverConfiguration parseAndValidateArguments(String[] args) {
        try {
            ArgumentParser parser = new ArgumentParser();
            return parser.parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(SolverConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE SOLUTORE MAX-SAT <<--");
        System.out.println("Modalità: " + (config.isFileMode ? "File singolo" : "Directory"));
        System.out.println("Input: " + config.inputPath);
        System.out.println("Timeout: " + config.timeoutSeconds + " secondi");
        System.out.println("Grafo: " + describeGraphMode(config));
        System.out.println("Propagazione: massimo " + config.maxIterations + " passate, seme " + config.seed);
        System.out.println("Confronto casuale: " + (config.baselineTrials > 0
                ? config.baselineTrials + " campioni" : "Disabilitato"));
        System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "Directory input"));
        System.out.println("====================================\n");
    }

    private static String describeGraphMode(SolverConfiguration config) {
        if (config.weightFunction == null) {
            return "non pesato, soglia " + config.minConflicts;
        }
        return "pesato (" + config.weightFunction.getFlag() + "), soglia " + config.minConflicts;
    }

    //endregion

    //region ELABORAZIONE DEL SINGOLO FILE

    /**
     * Elabora un singolo file: lettura -> grafo -> comunità -> risoluzione -> output.
     *
     * @return true se l'elaborazione ha prodotto un risultato o un report di timeout
     */
    private static boolean processSingleFile(SolverConfiguration config) {
        System.out.println("-->> ELABORAZIONE FILE <<--");
        System.out.println("File: " + Paths.get(config.inputPath).getFileName());
        System.out.println("=========================\n");

        try {
            CNFFormula formula = DimacsReader.read(Paths.get(config.inputPath));
            System.out.println("[I] Formula letta: " + formula.getVariableCount() + " variabili, "
                    + formula.getClausesCount() + " clausole");

            ProcessingResult result = executePipelineWithTimeout(formula, config);

            if (result == null) {
                handleTimeoutResult(config);
            } else {
                handleSuccessfulResult(result, config);
            }
            return true;

        } catch (Exception e) {
            handleFileProcessingError(config.inputPath, e);
            return false;
        }
    }

    /**
     * Esegue l'intera pipeline in un thread separato con limite temporale.
     * Allo scadere il thread viene interrotto e le fasi in corso si fermano.
     *
     * @return risultato completo o null se timeout
     */
    private static ProcessingResult executePipelineWithTimeout(CNFFormula formula, SolverConfiguration config) {
        System.out.println("Risoluzione MAX-SAT guidata dalle comunità (timeout: " + config.timeoutSeconds + "s)...");

        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            Callable<ProcessingResult> pipelineTask = () -> executePipeline(formula, config);
            Future<ProcessingResult> future = executor.submit(pipelineTask);
            return future.get(config.timeoutSeconds, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            System.out.println("[E] Errore durante la risoluzione: " + cause);
            throw new RuntimeException("Errore nella risoluzione MAX-SAT: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Risoluzione interrotta", e);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Pipeline completa sulla formula già letta.
     */
    private static ProcessingResult executePipeline(CNFFormula formula, SolverConfiguration config) {
        List<List<Integer>> clauses = formula.getClauses();
        int numVars = formula.getVariableCount();
        FormulaStructure structure = FormulaStructure.analyze(clauses);

        // Step 1: Grafo dei conflitti
        long graphStart = System.currentTimeMillis();
        boolean weighted = config.weightFunction != null;
        ClauseGraph graph = ConflictGraphBuilder.build(clauses, numVars, weighted, config.minConflicts,
                config.weightFunction);
        long graphTimeMs = System.currentTimeMillis() - graphStart;
        System.out.println("[I] Grafo dei conflitti: " + graph.vertexCount() + " vertici, "
                + graph.edgeCount() + " archi");

        // Step 2: Comunità
        long communityStart = System.currentTimeMillis();
        VoteMode mode = weighted ? VoteMode.EDGE_WEIGHT : VoteMode.UNIT;
        CommunityAssignment communities = LabelPropagation.run(graph, mode, config.maxIterations,
                new Random(config.seed));
        long communityTimeMs = System.currentTimeMillis() - communityStart;
        System.out.println("[I] Comunità rilevate: " + communities.getCommunityCount()
                + " (dimensioni " + Arrays.toString(communities.communitySizes()) + ")");

        // Step 3: Risoluzione guidata dalle comunità
        CommunityMaxSATSolver solver = new CommunityMaxSATSolver(config.seed);
        MaxSATResult result = solver.solve(formula, communities);

        // Step 4: Confronto con il campionamento casuale (opzionale)
        MaxSATResult baseline = null;
        if (config.baselineTrials > 0) {
            RandomSamplingSolver sampler = new RandomSamplingSolver(config.baselineTrials, new Random(config.seed));
            baseline = sampler.solve(clauses, numVars);
        }

        return new ProcessingResult(formula, structure, graph, communities, result, baseline,
                graphTimeMs, communityTimeMs);
    }

    //endregion

    //region ELABORAZIONE DELLA DIRECTORY

    /**
     * Elabora tutti i file .cnf di una directory con la stessa configurazione.
     */
    private static void processDirectoryBatch(SolverConfiguration config) {
        System.out.println("[I] Inizio elaborazione directory: " + config.inputPath);

        if (!validateInputDirectory(config.inputPath)) return;

        try {
            List<File> cnfFiles = findAllCnfFiles(config.inputPath);
            if (cnfFiles.isEmpty()) {
                System.out.println("[W] Nessun file .cnf trovato nella directory specificata.");
                return;
            }

            BatchResult batchResult = executeBatchProcessing(cnfFiles, config);
            displayBatchSummary(batchResult);

        } catch (IOException e) {
            System.out.println("[E] Errore durante l'accesso alla directory: " + e.getMessage());
        }
    }

    /**
     * @return file .cnf della directory in ordine di nome
     */
    private static List<File> findAllCnfFiles(String dirPath) throws IOException {
        System.out.println("Ricerca file .cnf nella directory...");

        List<File> cnfFiles;
        try (Stream<Path> paths = Files.list(Paths.get(dirPath))) {
            cnfFiles = paths
                    .filter(Files::isRegularFile)
                    .filter(path -> path.toString().toLowerCase(Locale.ROOT).endsWith(CNF_EXTENSION))
                    .map(Path::toFile)
                    .sorted(Comparator.comparing(File::getName))
                    .collect(Collectors.toList());
        }

        System.out.println("Trovati " + cnfFiles.size() + " file .cnf da elaborare.");
        return cnfFiles;
    }

    /**
     * Ogni file viene elaborato indipendentemente: un errore non ferma il batch.
     */
    private static BatchResult executeBatchProcessing(List<File> files, SolverConfiguration config) {
        BatchResult result = new BatchResult(files.size());

        System.out.println("Configurazione batch:");
        System.out.println("- Timeout per file: " + config.timeoutSeconds + " secondi");
        System.out.println("- Grafo: " + describeGraphMode(config));
        System.out.println();

        for (File file : files) {
            System.out.println("Elaborazione: " + file.getName());

            SolverConfiguration fileConfig = createFileConfiguration(file, config);
            if (processSingleFile(fileConfig)) {
                result.incrementSuccess();
            } else {
                result.incrementError();
            }
            System.out.println(); // Separatore visivo
        }

        return result;
    }

    private static boolean validateInputDirectory(String dirPath) {
        File dir = new File(dirPath);

        if (!dir.exists() || !dir.isDirectory()) {
            System.out.println("[E] Errore: directory non esistente: " + dirPath);
            return false;
        }

        if (!dir.canRead()) {
            System.out.println("[E] Errore: directory non leggibile: " + dirPath);
            return false;
        }

        return true;
    }

    private static void displayBatchSummary(BatchResult result) {
        System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
        System.out.println("File elaborati trovati: " + result.totalFiles);
        System.out.println("File elaborati con successo: " + result.successCount);
        System.out.println("File con errori: " + result.errorCount);

        if (result.totalFiles > 0) {
            double successRate = (double) result.successCount / result.totalFiles * 100;
            System.out.printf("Tasso di successo: %.1f%%\n", successRate);
        }
        System.out.println("=========================================\n");
    }

    //endregion

    //region GESTIONE DELL'OUTPUT E SALVATAGGIO DEI FILE

    private static void handleSuccessfulResult(ProcessingResult result, SolverConfiguration config) throws IOException {
        saveCompleteResults(result, config);
        saveStatistics(result, config);
        displayFinalStatistics(result);
    }

    private static void handleTimeoutResult(SolverConfiguration config) throws IOException {
        System.out.println("[W] Superato il timeout con limite di " + config.timeoutSeconds + " secondi");
        saveTimeoutReport(config);
    }

    private static void handleFileProcessingError(String filePath, Exception e) {
        System.out.println("[E] Errore elaborazione del file '" + filePath + "': " + e.getMessage());
    }

    /**
     * Scrive RESULT/&lt;nome&gt;.result con punteggio e modello.
     */
    private static void saveCompleteResults(ProcessingResult result, SolverConfiguration config) throws IOException {
        System.out.println("Salvataggio dei risultati...");

        Path resultDir = getOutputDirectory(config, "RESULT");
        Files.createDirectories(resultDir);

        String baseFileName = getBaseFileName(config.inputPath);
        Path resultFilePath = resultDir.resolve(baseFileName + ".result");

        MaxSATResult solution = result.solution;
        try (FileWriter writer = new FileWriter(resultFilePath.toFile())) {
            writer.write("=== RISOLUZIONE MAX-SAT ===\n");
            writer.write("File originale: " + Paths.get(config.inputPath).getFileName() + "\n");
            writer.write("Variabili: " + result.formula.getVariableCount() + "\n");
            writer.write("Clausole: " + result.formula.getClausesCount() + "\n");
            writer.write("Grafo: " + describeGraphMode(config) + "\n");
            writer.write("Comunità: " + result.communities.getCommunityCount() + "\n");
            writer.write("\n" + "=".repeat(50) + "\n\n");
            writer.write("RISULTATO: " + (solution.isFullySatisfied() ? "SAT" : "MAX-SAT") + "\n");
            writer.write(String.format("Clausole soddisfatte: %d/%d (%.2f%%)\n",
                    solution.getSatisfiedCount(), solution.getTotalClauses(), solution.getSatisfiedRatio() * 100));
            writer.write("\nModello:\n");
            writer.write(solution.toDimacsModel() + "\n");
        }

        System.out.println("[I] Risultati salvati: " + resultFilePath);
    }

    /**
     * Scrive STATS/&lt;nome&gt;.stats con struttura, grafo, comunità, fasi e confronto.
     */
    private static void saveStatistics(ProcessingResult result, SolverConfiguration config) throws IOException {
        System.out.println("Salvataggio delle statistiche...");

        Path statsDir = getOutputDirectory(config, "STATS");
        Files.createDirectories(statsDir);

        String baseFileName = getBaseFileName(config.inputPath);
        Path statsFilePath = statsDir.resolve(baseFileName + ".stats");

        try (FileWriter writer = new FileWriter(statsFilePath.toFile())) {
            writer.write(buildStatisticsReport(result, config));
        }

        System.out.println("[I] Statistiche salvate: " + statsFilePath);
    }

    private static String buildStatisticsReport(ProcessingResult result, SolverConfiguration config) {
        StringBuilder report = new StringBuilder();
        int clauseCount = result.formula.getClausesCount();

        report.append("=== STRUTTURA FORMULA ===\n");
        report.append("Variabili dichiarate: ").append(result.formula.getVariableCount()).append("\n");
        report.append("Variabili usate: ").append(result.structure.getVariableCount()).append("\n");
        report.append("Clausole: ").append(clauseCount).append("\n");
        report.append("Lunghezze distinte: ").append(result.structure.getDistinctClauseLengths()).append("\n");
        report.append("3-SAT uniforme: ").append(result.structure.isUniform3SAT() ? "sì" : "no").append("\n");
        report.append(String.format("Rapporto clausole/variabili: %.2f\n\n", result.formula.getClauseVariableRatio()));

        report.append("=== GRAFO DEI CONFLITTI ===\n");
        report.append("Modalità: ").append(describeGraphMode(config)).append("\n");
        report.append("Vertici: ").append(result.graph.vertexCount()).append("\n");
        report.append("Archi: ").append(result.graph.edgeCount()).append("\n");
        if (result.graph instanceof WeightedClauseGraph) {
            WeightedClauseGraph weightedGraph = (WeightedClauseGraph) result.graph;
            report.append(String.format("Pesi: min %.3f, max %.3f\n", weightedGraph.minWeight(), weightedGraph.maxWeight()));
        }
        report.append("Tempo costruzione: ").append(result.graphTimeMs).append("ms\n\n");

        report.append("=== COMUNITÀ ===\n");
        report.append("Comunità: ").append(result.communities.getCommunityCount()).append("\n");
        report.append("Dimensioni: ").append(Arrays.toString(result.communities.communitySizes())).append("\n");
        report.append("Passate: ").append(result.communities.getIterations())
                .append(result.communities.isConverged() ? " (convergenza)" : " (limite raggiunto)").append("\n");
        report.append("Tempo rilevamento: ").append(result.communityTimeMs).append("ms\n\n");

        report.append("=== FASI DEL SOLUTORE ===\n");
        report.append(result.solution.getStatistics());
        report.append("\n");

        report.append("=== CONFRONTO ===\n");
        report.append("Solutore a comunità: ").append(result.solution.getSatisfiedCount())
                .append("/").append(clauseCount).append("\n");
        if (result.baseline != null) {
            MaxSATStatistics baselineStats = result.baseline.getStatistics();
            report.append("Campionamento casuale: ").append(result.baseline.getSatisfiedCount())
                    .append("/").append(clauseCount)
                    .append(" (").append(baselineStats.getSampledAssignments()).append(" campioni, ")
                    .append(baselineStats.getExecutionTimeMs()).append("ms)\n");
            report.append("Differenza: ")
                    .append(result.solution.getSatisfiedCount() - result.baseline.getSatisfiedCount()).append("\n");
        }
        report.append(String.format("Riferimento 7/8: %.2f\n", clauseCount * 7.0 / 8.0));
        report.append(String.format("Riferimento 8/9: %.2f\n", clauseCount * 8.0 / 9.0));

        return report.toString();
    }

    private static void saveTimeoutReport(SolverConfiguration config) throws IOException {
        Path resultDir = getOutputDirectory(config, "RESULT");
        Files.createDirectories(resultDir);

        String baseFileName = getBaseFileName(config.inputPath);
        Path resultFilePath = resultDir.resolve(baseFileName + ".result");

        try (FileWriter writer = new FileWriter(resultFilePath.toFile())) {
            writer.write("=== RISOLUZIONE MAX-SAT ===\n");
            writer.write("File originale: " + Paths.get(config.inputPath).getFileName() + "\n");
            writer.write("Timeout: " + config.timeoutSeconds + " secondi\n");
            writer.write("Grafo: " + describeGraphMode(config) + "\n");
            writer.write("\n" + "=".repeat(50) + "\n\n");
            writer.write("RISULTATO: TIMEOUT\n");
            writer.write("La risoluzione ha superato il limite di tempo.\n\n");
            writer.write("Aumentare il timeout (-t) per istanze grandi.\n");
        }
    }

    /**
     * Riepilogo a console del file appena elaborato.
     */
    private static void displayFinalStatistics(ProcessingResult result) {
        System.out.println("Elaborazione completata!\n");

        MaxSATResult solution = result.solution;
        MaxSATStatistics stats = solution.getStatistics();
        int clauseCount = solution.getTotalClauses();

        System.out.println(">>> RISULTATO FINALE <<<");
        System.out.println("Esito: " + (solution.isFullySatisfied() ? "SAT" : "MAX-SAT"));
        System.out.printf("Clausole soddisfatte: %d/%d (%.2f%%)\n",
                solution.getSatisfiedCount(), clauseCount, solution.getSatisfiedRatio() * 100);
        System.out.println("Fasi: iniziale " + stats.getInitialScore() + " -> fase 1 " + stats.getPhase1Score()
                + " -> fase 2 " + stats.getPhase2Score() + " -> finale " + stats.getFinalScore());
        if (result.baseline != null) {
            System.out.println("Campionamento casuale: " + result.baseline.getSatisfiedCount() + "/" + clauseCount);
        }
        System.out.printf("Riferimenti: 7/8 = %.2f, 8/9 = %.2f\n", clauseCount * 7.0 / 8.0, clauseCount * 8.0 / 9.0);
        System.out.println("Tempo: " + stats.getExecutionTimeMs() + " ms");
        System.out.println("========================\n");
    }

    //endregion

    //region GESTIONE DEI PERCORSI

    /**
     * @param subdirName nome sottodirectory (RESULT, STATS)
     * @return directory di output: -o se indicato, altrimenti accanto al file di input
     */
    private static Path getOutputDirectory(SolverConfiguration config, String subdirName) {
        if (config.outputPath != null) {
            return Paths.get(config.outputPath).resolve(subdirName);
        } else {
            Path parentDir = Paths.get(config.inputPath).getParent();
            return parentDir != null ? parentDir.resolve(subdirName) : Paths.get(subdirName);
        }
    }

    private static String getBaseFileName(String filePath) {
        String fileName = Paths.get(filePath).getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    private static SolverConfiguration createFileConfiguration(File file, SolverConfiguration baseConfig) {
        return new SolverConfiguration(
                file.getAbsolutePath(),
                baseConfig.outputPath,
                true, // modalità file
                baseConfig.timeoutSeconds,
                baseConfig.minConflicts,
                baseConfig.weightFunction,
                baseConfig.seed,
                baseConfig.maxIterations,
                baseConfig.baselineTrials
        );
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> SOLUTORE MAX-SAT GUIDATO DALLE COMUNITÀ <<::");
        System.out.println("Euristica MAX-3SAT basata sulle comunità del grafo dei conflitti tra clausole\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar solutore-maxsat-comunita.jar [opzioni]\n");

        System.out.println("PARAMETRI:");
        System.out.println("  -f <file.cnf>     Elabora un singolo file DIMACS");
        System.out.println("  -d <directory>    Elabora tutti i file .cnf in una directory");
        System.out.println("  -o <directory>    Directory di output (default: stessa di input)");
        System.out.println("  -t <secondi>      Timeout per formula (min: " + MIN_TIMEOUT_SECONDS
                + ", default: " + DEFAULT_TIMEOUT_SECONDS + ")");
        System.out.println("  -m <conflitti>    Conflitti minimi per creare un arco (default: "
                + ConflictGraphBuilder.DEFAULT_MIN_CONFLICTS + ")");
        System.out.println("  -w=<funzione>     Grafo pesato: linear, quadratic, cubic, exponential, log");
        System.out.println("  -s <seme>         Seme pseudo-casuale (default: " + LabelPropagation.DEFAULT_SEED + ")");
        System.out.println("  -i <passate>      Passate massime della propagazione (default: "
                + LabelPropagation.DEFAULT_MAX_ITERATIONS + ")");
        System.out.println("  -b <campioni>     Campioni del confronto casuale, 0 = disabilitato (default: "
                + RandomSamplingSolver.DEFAULT_TRIALS + ")");
        System.out.println("  -h                Mostra questa guida\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  # File singolo, grafo non pesato");
        System.out.println("  java -jar solutore-maxsat-comunita.jar -f uf20-01.cnf\n");

        System.out.println("  # Directory con grafo pesato quadratico e soglia 1");
        System.out.println("  java -jar solutore-maxsat-comunita.jar -d ./istanze/ -w=quadratic -m 1 -t 30\n");

        System.out.println("OUTPUT GENERATO:");
        System.out.println("  RESULT/       Punteggio e modello in forma DIMACS (v ... 0)");
        System.out.println("  STATS/        Grafo, comunità, punteggi per fase e confronto\n");

        System.out.println("NOTE OPERATIVE:");
        System.out.println("  - Righe 'c' e '%' ignorate, una clausola per riga, token 0 scartati");
        System.out.println("  - Stesso seme e stessi parametri producono lo stesso risultato");
        System.out.println("  - Le funzioni di peso non valide ripiegano sul numero di conflitti\n");

        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    private static class SolverConfiguration {
        final String inputPath;
        final String outputPath;
        final boolean isFileMode;
        final int timeoutSeconds;
        final int minConflicts;
        final StandardWeightFunction weightFunction; // null = grafo non pesato
        final long seed;
        final int maxIterations;
        final int baselineTrials;

        SolverConfiguration(String inputPath, String outputPath, boolean isFileMode, int timeoutSeconds,
                            int minConflicts, StandardWeightFunction weightFunction, long seed,
                            int maxIterations, int baselineTrials) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
            this.timeoutSeconds = timeoutSeconds;
            this.minConflicts = minConflicts;
            this.weightFunction = weightFunction;
            this.seed = seed;
            this.maxIterations = maxIterations;
            this.baselineTrials = baselineTrials;
        }
    }

    /**
     * Parser per i parametri della linea di comando.
     */
    private static class ArgumentParser {

        /**
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se parametri sintatticamente o semanticamente invalidi
         */
        public SolverConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            int minConflicts = ConflictGraphBuilder.DEFAULT_MIN_CONFLICTS;
            StandardWeightFunction weightFunction = null;
            long seed = LabelPropagation.DEFAULT_SEED;
            int maxIterations = LabelPropagation.DEFAULT_MAX_ITERATIONS;
            int baselineTrials = RandomSamplingSolver.DEFAULT_TRIALS;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }

                    case FILE_PARAM -> {
                        validateExclusiveMode(isDirectoryMode, "file");
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        isFileMode = true;
                    }

                    case DIR_PARAM -> {
                        validateExclusiveMode(isFileMode, "directory");
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                        isDirectoryMode = true;
                    }

                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }

                    case TIMEOUT_PARAM -> timeoutSeconds = parseBoundedInt(args, ++i, "timeout", MIN_TIMEOUT_SECONDS);

                    case MIN_CONFLICTS_PARAM -> minConflicts = parseBoundedInt(args, ++i, "conflitti minimi", 1);

                    case SEED_PARAM -> seed = parseSeed(args, ++i);

                    case ITERATIONS_PARAM -> maxIterations = parseBoundedInt(args, ++i, "passate massime", 1);

                    case BASELINE_PARAM -> baselineTrials = parseBoundedInt(args, ++i, "campioni casuali", 0);

                    default -> {
                        if (args[i].startsWith(WEIGHT_PARAM)) {
                            weightFunction = StandardWeightFunction.fromFlag(args[i].substring(WEIGHT_PARAM.length()));
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare input con -f (file) o -d (directory)");
            }

            return new SolverConfiguration(inputPath, outputPath, isFileMode, timeoutSeconds, minConflicts,
                    weightFunction, seed, maxIterations, baselineTrials);
        }

        private void validateExclusiveMode(boolean otherMode, String currentMode) {
            if (otherMode) {
                throw new IllegalArgumentException("Modalità " + currentMode +
                        " non può essere combinata con altre modalità (file/directory sono mutualmente esclusive)");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        /**
         * Intero con limite inferiore, usato per timeout, soglie e contatori.
         */
        private int parseBoundedInt(String[] args, int currentIndex, String what, int minimum) {
            String value = getNextArgument(args, currentIndex, what);

            int parsed;
            try {
                parsed = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore " + what + " non valido: " + value);
            }
            if (parsed < minimum) {
                throw new IllegalArgumentException("Valore minimo per " + what + ": " + minimum + ", ricevuto: " + parsed);
            }
            return parsed;
        }

        private long parseSeed(String[] args, int currentIndex) {
            String value = getNextArgument(args, currentIndex, "seme");
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Seme non valido: " + value);
            }
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                throw new IllegalArgumentException("Directory non esistente: " + dirPath);
            }
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Non è una directory: " + dirPath);
            }
            if (!dir.canRead()) {
                throw new IllegalArgumentException("Directory non leggibile: " + dirPath);
            }
        }

        private void validateOrCreateOutputDirectory(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                System.out.println("Creazione directory output: " + dirPath);
                if (!dir.mkdirs()) {
                    throw new IllegalArgumentException("Impossibile creare directory: " + dirPath);
                }
            } else if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Percorso non è una directory: " + dirPath);
            }
            if (!dir.canWrite()) {
                throw new IllegalArgumentException("Directory non scrivibile: " + dirPath);
            }
        }
    }

    /**
     * Risultato elaborazione batch con statistiche.
     */
    private static class BatchResult {
        final int totalFiles;
        int successCount = 0;
        int errorCount = 0;

        BatchResult(int totalFiles) {
            this.totalFiles = totalFiles;
        }

        void incrementSuccess() { successCount++; }
        void incrementError() { errorCount++; }
    }

    /**
     * Tutto ciò che la pipeline produce per un file.
     */
    private static class ProcessingResult {
        final CNFFormula formula;
        final FormulaStructure structure;
        final ClauseGraph graph;
        final CommunityAssignment communities;
        final MaxSATResult solution;
        final MaxSATResult baseline; // null = confronto disabilitato
        final long graphTimeMs;
        final long communityTimeMs;

        ProcessingResult(CNFFormula formula, FormulaStructure structure, ClauseGraph graph,
                         CommunityAssignment communities, MaxSATResult solution, MaxSATResult baseline,
                         long graphTimeMs, long communityTimeMs) {
            this.formula = formula;
            this.structure = structure;
            this.graph = graph;
            this.communities = communities;
            this.solution = solution;
            this.baseline = baseline;
            this.graphTimeMs = graphTimeMs;
            this.communityTimeMs = communityTimeMs;
        }
    }

    //endregion
}
