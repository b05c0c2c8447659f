package org.maxsat.graph;

import java.util.Collection;

/**
 * Grafo dei conflitti senza pesi: l'arco esiste o no. Il peso degli archi
 * in input viene ignorato e ogni arco vale 1.0.
 */
public final class UnweightedClauseGraph extends AbstractClauseGraph {

    public UnweightedClauseGraph(int vertexCount, Collection<ClauseEdge> edges) {
        super(vertexCount, edges);
    }

    @Override
    double storedWeight(ClauseEdge edge) {
        return 1.0;
    }

    @Override
    public boolean isWeighted() {
        return false;
    }
}
