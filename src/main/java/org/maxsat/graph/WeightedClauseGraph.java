package org.maxsat.graph;

import java.util.Collection;

/**
 * Grafo dei conflitti pesato. Ogni peso memorizzato è positivo e finito,
 * garantito già da {@link ClauseEdge}.
 */
public final class WeightedClauseGraph extends AbstractClauseGraph {

    public WeightedClauseGraph(int vertexCount, Collection<ClauseEdge> edges) {
        super(vertexCount, edges);
    }

    @Override
    double storedWeight(ClauseEdge edge) {
        return edge.getWeight();
    }

    @Override
    public boolean isWeighted() {
        return true;
    }

    /** @return peso minimo tra gli archi, 0.0 se il grafo non ha archi */
    public double minWeight() {
        return edges().stream().mapToDouble(ClauseEdge::getWeight).min().orElse(0.0);
    }

    /** @return peso massimo tra gli archi, 0.0 se il grafo non ha archi */
    public double maxWeight() {
        return edges().stream().mapToDouble(ClauseEdge::getWeight).max().orElse(0.0);
    }
}
