package org.maxsat.community;

import org.maxsat.graph.ClauseGraph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * PROPAGAZIONE DELLE ETICHETTE - Rilevamento comunità sul grafo dei conflitti
 *
 * ALGORITMO:
 * 1. Ogni vertice parte con un'etichetta propria (labels[v] = v)
 * 2. A ogni passata i vertici vengono visitati in una permutazione casuale
 * 3. Ogni vertice con almeno un vicino adotta l'etichetta più votata dai vicini;
 *    a parità vince l'etichetta numericamente minore
 * 4. Stop dopo una passata senza cambiamenti o dopo maxIterations passate
 * 5. Le etichette sopravvissute vengono rinumerate in 1..k (ordine crescente)
 *
 * Il seme governa solo l'ordine di visita: la scelta dell'etichetta è
 * deterministica, quindi stesso grafo e stesso seme danno le stesse comunità.
 * Gli aggiornamenti sono asincroni: un vertice vede le etichette già
 * modificate nella stessa passata.
 */
public final class LabelPropagation {

    private static final Logger LOGGER = Logger.getLogger(LabelPropagation.class.getName());

    /** Limite di default sul numero di passate */
    public static final int DEFAULT_MAX_ITERATIONS = 100;

    /** Seme di default per l'ordine di visita */
    public static final long DEFAULT_SEED = 42L;

    private LabelPropagation() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Etichette di comunità con voto a conteggio.
     *
     * @return array di etichette compatte, posizione v - 1 per il vertice v
     */
    public static int[] detectCommunities(ClauseGraph graph, int maxIterations, long seed) {
        return run(graph, VoteMode.UNIT, maxIterations, new Random(seed)).getLabels();
    }

    public static int[] detectCommunities(ClauseGraph graph) {
        return detectCommunities(graph, DEFAULT_MAX_ITERATIONS, DEFAULT_SEED);
    }

    /**
     * Etichette di comunità con voto pesato: ogni etichetta riceve la somma dei
     * pesi degli archi verso i vicini che la portano. Su un grafo non pesato
     * ogni arco vale 1.0 e il risultato coincide con {@link #detectCommunities}.
     */
    public static int[] weightedDetectCommunities(ClauseGraph graph, int maxIterations, long seed) {
        return run(graph, VoteMode.EDGE_WEIGHT, maxIterations, new Random(seed)).getLabels();
    }

    public static int[] weightedDetectCommunities(ClauseGraph graph) {
        return weightedDetectCommunities(graph, DEFAULT_MAX_ITERATIONS, DEFAULT_SEED);
    }

    /**
     * Esegue la propagazione completa restituendo anche passate e convergenza.
     *
     * @param graph grafo delle clausole
     * @param mode criterio di voto
     * @param maxIterations limite sulle passate (≥ 0)
     * @param random sorgente per le permutazioni di visita
     * @throws IllegalArgumentException se graph, mode o random sono null, o maxIterations &lt; 0
     */
    public static CommunityAssignment run(ClauseGraph graph, VoteMode mode, int maxIterations, Random random) {
        if (graph == null) {
            throw new IllegalArgumentException("Grafo non può essere null");
        }
        if (mode == null || random == null) {
            throw new IllegalArgumentException("Modalità di voto e sorgente casuale sono obbligatorie");
        }
        if (maxIterations < 0) {
            throw new IllegalArgumentException("Numero massimo di iterazioni non può essere negativo: " + maxIterations);
        }

        int n = graph.vertexCount();
        if (n == 0) {
            return new CommunityAssignment(new int[0], 0, true);
        }
        if (n == 1) {
            return new CommunityAssignment(new int[]{1}, 0, true);
        }

        int[] labels = new int[n];
        for (int v = 1; v <= n; v++) {
            labels[v - 1] = v;
        }

        List<Integer> order = new ArrayList<>(n);
        for (int v = 1; v <= n; v++) {
            order.add(v);
        }

        int iterations = 0;
        boolean converged = false;

        while (iterations < maxIterations) {
            if (Thread.currentThread().isInterrupted()) {
                LOGGER.warning("Propagazione etichette interrotta alla passata " + iterations);
                break;
            }
            iterations++;
            Collections.shuffle(order, random);

            int changes = 0;
            for (int vertex : order) {
                int chosen = chooseLabel(graph, mode, labels, vertex);
                if (chosen != labels[vertex - 1]) {
                    labels[vertex - 1] = chosen;
                    changes++;
                }
            }

            LOGGER.finest("Passata " + iterations + ": " + changes + " etichette cambiate");
            if (changes == 0) {
                converged = true;
                break;
            }
        }

        if (!converged) {
            LOGGER.warning("Propagazione etichette fermata dopo " + iterations
                    + " passate senza convergenza");
        }

        CommunityAssignment result = new CommunityAssignment(relabel(labels), iterations, converged);
        LOGGER.info("Comunità rilevate (" + mode + "): " + result.getCommunityCount()
                + " in " + iterations + " passate");
        return result;
    }

    //endregion

    //region VOTO E RINUMERAZIONE

    /**
     * Etichetta vincente tra i vicini; l'etichetta corrente se il vertice è isolato.
     */
    private static int chooseLabel(ClauseGraph graph, VoteMode mode, int[] labels, int vertex) {
        List<Integer> neighbors = graph.neighbors(vertex);
        if (neighbors.isEmpty()) {
            return labels[vertex - 1];
        }

        // TreeMap: iterazione per etichetta crescente, il confronto stretto premia la minore
        Map<Integer, Double> votes = new TreeMap<>();
        for (int neighbor : neighbors) {
            double vote = mode == VoteMode.EDGE_WEIGHT ? graph.weight(vertex, neighbor) : 1.0;
            votes.merge(labels[neighbor - 1], vote, Double::sum);
        }

        int best = labels[vertex - 1];
        double bestVote = Double.NEGATIVE_INFINITY;
        for (Map.Entry<Integer, Double> entry : votes.entrySet()) {
            if (entry.getValue() > bestVote) {
                best = entry.getKey();
                bestVote = entry.getValue();
            }
        }
        return best;
    }

    /**
     * Rinumera le etichette in 1..k preservando l'ordine delle etichette originali.
     */
    static int[] relabel(int[] labels) {
        int[] unique = Arrays.stream(labels).distinct().sorted().toArray();
        int[] dense = new int[labels.length];
        for (int i = 0; i < labels.length; i++) {
            dense[i] = Arrays.binarySearch(unique, labels[i]) + 1;
        }
        return dense;
    }

    //endregion
}
