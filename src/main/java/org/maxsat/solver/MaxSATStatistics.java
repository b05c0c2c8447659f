package org.maxsat.solver;

/**
 * STATISTICHE MAX-SAT - Raccolta metriche di esecuzione per fase
 *
 * Registra il punteggio (clausole soddisfatte) dopo ogni fase del solutore,
 * le mosse accettate dalla ricerca locale e il tempo di esecuzione.
 * I punteggi non ancora registrati valgono -1.
 *
 * Non thread-safe: ogni istanza appartiene a una sola esecuzione di un solutore.
 */
public class MaxSATStatistics {

    //region PUNTEGGI PER FASE

    /** Punteggio dell'assegnamento casuale iniziale */
    private int initialScore = -1;

    /** Punteggio dopo l'assegnamento guidato dalle comunità */
    private int phase1Score = -1;

    /** Punteggio dopo la ricerca locale per comunità */
    private int phase2Score = -1;

    /** Punteggio finale dopo il raffinamento globale */
    private int finalScore = -1;

    //endregion

    //region CONTATORI RICERCA LOCALE

    /** Flip accettati dalla ricerca locale per comunità */
    private int phase2Flips = 0;

    /** Passate complete della ricerca locale, sommate su tutte le comunità */
    private int phase2Sweeps = 0;

    /** Flip accettati dal raffinamento globale */
    private int phase3Flips = 0;

    /** Iterazioni esterne del raffinamento globale */
    private int phase3Iterations = 0;

    /** Il raffinamento globale si è fermato perché tutte le clausole erano soddisfatte */
    private boolean allClausesSatisfied = false;

    //endregion

    //region CONTESTO

    /** Numero di comunità distinte ricevute dal solutore */
    private int communityCount = 0;

    /** Assegnamenti casuali valutati dal solutore di confronto */
    private int sampledAssignments = 0;

    //endregion

    //region TIMING

    private long executionTimeMs = 0;

    private final long startTime;

    private boolean timerStopped = false;

    //endregion

    /**
     * Avvia immediatamente la misurazione del tempo di esecuzione.
     */
    public MaxSATStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region OPERAZIONI DI INCREMENTO CONTATORI

    public void incrementPhase2Flips() {
        phase2Flips++;
    }

    public void addPhase2Sweeps(int sweeps) {
        phase2Sweeps += sweeps;
    }

    public void incrementPhase3Flips() {
        phase3Flips++;
    }

    public void incrementPhase3Iterations() {
        phase3Iterations++;
    }

    public void incrementSampledAssignments() {
        sampledAssignments++;
    }

    //endregion

    //region REGISTRAZIONE PUNTEGGI

    public void recordInitialScore(int score) {
        this.initialScore = checkScore(score);
    }

    public void recordPhase1Score(int score) {
        this.phase1Score = checkScore(score);
    }

    public void recordPhase2Score(int score) {
        this.phase2Score = checkScore(score);
    }

    public void recordFinalScore(int score) {
        this.finalScore = checkScore(score);
    }

    public void setAllClausesSatisfied(boolean allClausesSatisfied) {
        this.allClausesSatisfied = allClausesSatisfied;
    }

    public void setCommunityCount(int communityCount) {
        if (communityCount < 0) {
            throw new IllegalArgumentException("Numero comunità non può essere negativo: " + communityCount);
        }
        this.communityCount = communityCount;
    }

    private static int checkScore(int score) {
        if (score < 0) {
            throw new IllegalArgumentException("Punteggio non può essere negativo: " + score);
        }
        return score;
    }

    //endregion

    //region GESTIONE TIMING

    /**
     * Ferma la misurazione. Le chiamate successive alla prima non hanno effetto.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    /**
     * @return tempo finale, o parziale se il timer è ancora attivo
     */
    public long getExecutionTimeMs() {
        if (!timerStopped) {
            return System.currentTimeMillis() - startTime;
        }
        return executionTimeMs;
    }

    public boolean isTimerStopped() {
        return timerStopped;
    }

    //endregion

    //region ACCESSORS

    public int getInitialScore() {
        return initialScore;
    }

    public int getPhase1Score() {
        return phase1Score;
    }

    public int getPhase2Score() {
        return phase2Score;
    }

    public int getFinalScore() {
        return finalScore;
    }

    public int getPhase2Flips() {
        return phase2Flips;
    }

    public int getPhase2Sweeps() {
        return phase2Sweeps;
    }

    public int getPhase3Flips() {
        return phase3Flips;
    }

    public int getPhase3Iterations() {
        return phase3Iterations;
    }

    public boolean isAllClausesSatisfied() {
        return allClausesSatisfied;
    }

    public int getCommunityCount() {
        return communityCount;
    }

    public int getSampledAssignments() {
        return sampledAssignments;
    }

    /**
     * @return clausole guadagnate rispetto all'assegnamento iniziale (0 se non registrato)
     */
    public int getTotalImprovement() {
        if (initialScore < 0 || finalScore < 0) {
            return 0;
        }
        return finalScore - initialScore;
    }

    //endregion

    //region OUTPUT E RAPPRESENTAZIONE

    /**
     * Report in stile benchmark, usato anche per i file STATS.
     */
    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();

        output.append("===========================[ EVALUATION COMPLETED: PROBLEM STATS ]===========================\n");
        output.append("======================================[ SEARCH STATS ]=======================================\n");
        if (communityCount > 0) {
            output.append("    Comunità:           ").append(communityCount).append("\n");
        }
        if (sampledAssignments > 0) {
            output.append("    Campioni casuali:   ").append(sampledAssignments).append("\n");
        }
        appendScore(output, "Punteggio iniziale: ", initialScore);
        appendScore(output, "Dopo fase 1:        ", phase1Score);
        if (phase2Score >= 0) {
            output.append("    Dopo fase 2:        ").append(phase2Score)
                    .append(" (flip ").append(phase2Flips).append(", passate ").append(phase2Sweeps).append(")\n");
        }
        appendScore(output, "Punteggio finale:   ", finalScore);
        if (phase3Iterations > 0 || phase3Flips > 0) {
            output.append("    Fase 3:             ").append(phase3Iterations).append(" iterazioni, ")
                    .append(phase3Flips).append(" flip\n");
        }
        output.append("    Tempo:              ").append(getExecutionTimeMs()).append("ms\n");
        output.append("=============================================================================================\n");

        return output.toString();
    }

    private static void appendScore(StringBuilder output, String label, int score) {
        if (score >= 0) {
            output.append("    ").append(label).append(score).append("\n");
        }
    }

    /**
     * Output su singola linea per il logging.
     */
    public String toCompactString() {
        return String.format("Stats[Init:%d, F1:%d, F2:%d, Final:%d, Flip2:%d, Flip3:%d, Time:%dms]",
                initialScore, phase1Score, phase2Score, finalScore, phase2Flips, phase3Flips, getExecutionTimeMs());
    }

    //endregion
}
