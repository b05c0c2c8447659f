package org.maxsat.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Liste di adiacenza condivise dalle due varianti di grafo. Immutabile dopo la
 * costruzione: gli archi vengono validati e inseriti solo nel costruttore.
 */
abstract class AbstractClauseGraph implements ClauseGraph {

    /** Posizione v - 1: vicino -> peso, ordinato per indice di vicino */
    private final List<Map<Integer, Double>> adjacency;

    private final List<ClauseEdge> edges;

    AbstractClauseGraph(int vertexCount, Collection<ClauseEdge> edges) {
        if (vertexCount < 0) {
            throw new IllegalArgumentException("Numero vertici non può essere negativo: " + vertexCount);
        }
        if (edges == null) {
            throw new IllegalArgumentException("Lista archi non può essere null");
        }

        List<Map<Integer, Double>> lists = new ArrayList<>(vertexCount);
        for (int v = 0; v < vertexCount; v++) {
            lists.add(new TreeMap<>());
        }

        List<ClauseEdge> sorted = new ArrayList<>(edges);
        sorted.sort((a, b) -> a.getSource() != b.getSource()
                ? Integer.compare(a.getSource(), b.getSource())
                : Integer.compare(a.getTarget(), b.getTarget()));

        for (ClauseEdge edge : sorted) {
            checkVertex(edge.getSource(), vertexCount);
            checkVertex(edge.getTarget(), vertexCount);
            double stored = storedWeight(edge);
            if (lists.get(edge.getSource() - 1).put(edge.getTarget(), stored) != null) {
                throw new IllegalArgumentException("Arco duplicato: (" + edge.getSource() + "," + edge.getTarget() + ")");
            }
            lists.get(edge.getTarget() - 1).put(edge.getSource(), stored);
        }

        List<Map<Integer, Double>> frozen = new ArrayList<>(vertexCount);
        for (Map<Integer, Double> map : lists) {
            frozen.add(Collections.unmodifiableMap(map));
        }
        this.adjacency = Collections.unmodifiableList(frozen);

        List<ClauseEdge> stored = new ArrayList<>(sorted.size());
        for (ClauseEdge edge : sorted) {
            stored.add(new ClauseEdge(edge.getSource(), edge.getTarget(), storedWeight(edge)));
        }
        this.edges = Collections.unmodifiableList(stored);
    }

    /** Peso effettivamente memorizzato per un arco in input. */
    abstract double storedWeight(ClauseEdge edge);

    private static void checkVertex(int vertex, int vertexCount) {
        if (vertex < 1 || vertex > vertexCount) {
            throw new IllegalArgumentException("Vertice " + vertex + " fuori intervallo [1, " + vertexCount + "]");
        }
    }

    @Override
    public int vertexCount() {
        return adjacency.size();
    }

    @Override
    public int edgeCount() {
        return edges.size();
    }

    @Override
    public List<Integer> neighbors(int vertex) {
        checkVertex(vertex, adjacency.size());
        return List.copyOf(adjacency.get(vertex - 1).keySet());
    }

    @Override
    public boolean hasEdge(int u, int v) {
        if (u < 1 || u > adjacency.size() || v < 1 || v > adjacency.size()) {
            return false;
        }
        return adjacency.get(u - 1).containsKey(v);
    }

    @Override
    public double weight(int u, int v) {
        if (!hasEdge(u, v)) {
            return 0.0;
        }
        return adjacency.get(u - 1).get(v);
    }

    @Override
    public List<ClauseEdge> edges() {
        return edges;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{vertici=" + vertexCount() + ", archi=" + edgeCount() + "}";
    }
}
