package org.maxsat.community;

import org.maxsat.graph.ClauseEdge;
import org.maxsat.graph.ClauseGraph;
import org.maxsat.graph.ConflictGraphBuilder;
import org.maxsat.graph.UnweightedClauseGraph;
import org.maxsat.graph.WeightedClauseGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Propagazione delle etichette")
class LabelPropagationTest {

    private static ClauseGraph twoTriangles() {
        return new UnweightedClauseGraph(6, List.of(
                ClauseEdge.of(1, 2), ClauseEdge.of(1, 3), ClauseEdge.of(2, 3),
                ClauseEdge.of(4, 5), ClauseEdge.of(4, 6), ClauseEdge.of(5, 6)));
    }

    /** Grafo casuale con seme fisso, abbastanza denso da avere più comunità. */
    private static ClauseGraph randomGraph(int vertices, double density, long seed) {
        Random random = new Random(seed);
        List<ClauseEdge> edges = new ArrayList<>();
        for (int u = 1; u <= vertices; u++) {
            for (int v = u + 1; v <= vertices; v++) {
                if (random.nextDouble() < density) {
                    edges.add(new ClauseEdge(u, v, 1.0 + random.nextInt(5)));
                }
            }
        }
        return new WeightedClauseGraph(vertices, edges);
    }

    private static void assertDense(int[] labels) {
        int max = Arrays.stream(labels).max().orElse(0);
        int[] distinct = Arrays.stream(labels).distinct().sorted().toArray();
        assertArrayEquals(IntStream.rangeClosed(1, max).toArray(), distinct);
    }

    @Test
    @DisplayName("Due triangoli disgiunti: due comunità")
    void separatesDisconnectedTriangles() {
        for (long seed = 0; seed < 20; seed++) {
            int[] labels = LabelPropagation.detectCommunities(twoTriangles(), 100, seed);
            assertArrayEquals(new int[]{1, 1, 1, 2, 2, 2}, labels, "seme " + seed);
        }
    }

    @Test
    @DisplayName("Stesso grafo e stesso seme: stesse etichette")
    void sameSeedGivesSameLabels() {
        ClauseGraph graph = randomGraph(40, 0.08, 3);
        assertArrayEquals(LabelPropagation.detectCommunities(graph, 100, 11),
                LabelPropagation.detectCommunities(graph, 100, 11));
        assertArrayEquals(LabelPropagation.weightedDetectCommunities(graph, 100, 11),
                LabelPropagation.weightedDetectCommunities(graph, 100, 11));
    }

    @Test
    @DisplayName("Etichette compatte da 1 a k")
    void labelsAreDense() {
        for (long seed = 0; seed < 5; seed++) {
            ClauseGraph graph = randomGraph(30, 0.06, seed);
            assertDense(LabelPropagation.detectCommunities(graph, 100, seed));
            assertDense(LabelPropagation.weightedDetectCommunities(graph, 100, seed));
        }
        assertDense(LabelPropagation.detectCommunities(
                ConflictGraphBuilder.buildUnweighted(List.of(List.of(1, 2), List.of(-1, -2), List.of(3)), 3)));
    }

    @Test
    @DisplayName("Casi limite: nessun vertice, un vertice, vertici isolati")
    void handlesDegenerateGraphs() {
        assertArrayEquals(new int[0], LabelPropagation.detectCommunities(new UnweightedClauseGraph(0, List.of())));
        assertArrayEquals(new int[]{1}, LabelPropagation.detectCommunities(new UnweightedClauseGraph(1, List.of())));
        assertArrayEquals(new int[]{1}, LabelPropagation.weightedDetectCommunities(new WeightedClauseGraph(1, List.of())));
        assertArrayEquals(new int[]{1, 2, 3},
                LabelPropagation.detectCommunities(new UnweightedClauseGraph(3, List.of())));
    }

    @Test
    @DisplayName("Voto pesato su grafo non pesato equivale al voto a conteggio")
    void weightedVoteOnUnweightedGraphMatchesUnitVote() {
        ClauseGraph unweighted = ConflictGraphBuilder.buildUnweighted(List.of(
                List.of(1, 2, 3), List.of(-1, -2, 3), List.of(1, -2, -3), List.of(-1, 2, -3),
                List.of(-1, -2, -3), List.of(4, 5, -6), List.of(-4, -5, 6), List.of(4, -5, 6)), 6);
        for (long seed = 0; seed < 10; seed++) {
            assertArrayEquals(LabelPropagation.detectCommunities(unweighted, 100, seed),
                    LabelPropagation.weightedDetectCommunities(unweighted, 100, seed));
        }
    }

    @Test
    @DisplayName("Un ponte leggero non unisce due triangoli pesanti")
    void weakBridgeKeepsCommunitiesApart() {
        ClauseGraph graph = new WeightedClauseGraph(6, List.of(
                new ClauseEdge(1, 2, 5.0), new ClauseEdge(1, 3, 5.0), new ClauseEdge(2, 3, 5.0),
                new ClauseEdge(4, 5, 5.0), new ClauseEdge(4, 6, 5.0), new ClauseEdge(5, 6, 5.0),
                new ClauseEdge(3, 4, 0.1)));

        for (long seed = 0; seed < 20; seed++) {
            CommunityAssignment result = LabelPropagation.run(graph, VoteMode.EDGE_WEIGHT, 100, new Random(seed));
            assertArrayEquals(new int[]{1, 1, 1, 2, 2, 2}, result.getLabels(), "seme " + seed);
            assertTrue(result.isConverged());
        }
    }

    @Test
    @DisplayName("Risultato completo: dimensioni, membri e convergenza")
    void exposesCommunityDetails() {
        CommunityAssignment result = LabelPropagation.run(twoTriangles(), VoteMode.UNIT, 100, new Random(42));

        assertEquals(2, result.getCommunityCount());
        assertArrayEquals(new int[]{3, 3}, result.communitySizes());
        assertEquals(List.of(4, 5, 6), result.members(2));
        assertEquals(1, result.labelOf(3));
        assertTrue(result.isConverged());
        assertTrue(result.getIterations() >= 1 && result.getIterations() <= 100);
        assertEquals(3, result.largestCommunitySize());
        assertThrows(IllegalArgumentException.class, () -> result.members(3));
    }

    @Test
    @DisplayName("Zero passate: etichette iniziali rinumerate")
    void zeroIterationsKeepsInitialLabels() {
        CommunityAssignment result = LabelPropagation.run(twoTriangles(), VoteMode.UNIT, 0, new Random(1));
        assertArrayEquals(new int[]{1, 2, 3, 4, 5, 6}, result.getLabels());
        assertEquals(0, result.getIterations());
        assertFalse(result.isConverged());
    }

    @Test
    @DisplayName("Rinumerazione per ordine crescente delle etichette")
    void relabelPreservesOrder() {
        assertArrayEquals(new int[]{2, 1, 2, 3}, LabelPropagation.relabel(new int[]{7, 3, 7, 12}));
    }

    @Test
    @DisplayName("Argomenti non validi")
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> LabelPropagation.run(null, VoteMode.UNIT, 10, new Random()));
        assertThrows(IllegalArgumentException.class,
                () -> LabelPropagation.run(twoTriangles(), VoteMode.UNIT, -1, new Random()));
        assertThrows(IllegalArgumentException.class,
                () -> LabelPropagation.run(twoTriangles(), null, 10, new Random()));
    }
}
