package org.maxsat.graph;

import java.util.List;

/**
 * Grafo non orientato sulle clausole di una formula: i vertici sono gli indici
 * di clausola 1..N, gli archi collegano clausole in conflitto.
 *
 * Le due implementazioni ({@link UnweightedClauseGraph}, {@link WeightedClauseGraph})
 * condividono questo contratto di attraversamento, così la propagazione delle
 * etichette non deve conoscere il tipo concreto.
 */
public interface ClauseGraph {

    /** @return numero di vertici N */
    int vertexCount();

    /** @return numero di archi non orientati */
    int edgeCount();

    /**
     * Vicini di un vertice in ordine crescente.
     *
     * @param vertex indice di clausola in [1, N]
     * @throws IllegalArgumentException se il vertice è fuori intervallo
     */
    List<Integer> neighbors(int vertex);

    boolean hasEdge(int u, int v);

    /**
     * Peso dell'arco (u, v). I grafi non pesati restituiscono 1.0 per ogni arco esistente.
     *
     * @return peso positivo e finito se l'arco esiste, 0.0 altrimenti
     */
    default double weight(int u, int v) {
        return hasEdge(u, v) ? 1.0 : 0.0;
    }

    boolean isWeighted();

    /** @return archi con source &lt; target, in ordine lessicografico */
    List<ClauseEdge> edges();
}
