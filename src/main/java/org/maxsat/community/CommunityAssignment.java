package org.maxsat.community;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * RISULTATO PROPAGAZIONE ETICHETTE - Comunità di clausole
 *
 * Le etichette sono compatte: valori consecutivi 1..k, ognuno usato da almeno
 * un vertice. La posizione v - 1 dell'array contiene l'etichetta del vertice v.
 */
public final class CommunityAssignment {

    private final int[] labels;
    private final int iterations;
    private final boolean converged;
    private final int communityCount;

    CommunityAssignment(int[] labels, int iterations, boolean converged) {
        this.labels = labels.clone();
        this.iterations = iterations;
        this.converged = converged;
        this.communityCount = Arrays.stream(labels).max().orElse(0);
    }

    //region ACCESSORS

    /** @return copia delle etichette, una per vertice */
    public int[] getLabels() {
        return labels.clone();
    }

    /**
     * @param vertex indice di clausola 1-based
     * @return etichetta della comunità del vertice
     */
    public int labelOf(int vertex) {
        if (vertex < 1 || vertex > labels.length) {
            throw new IllegalArgumentException("Vertice " + vertex + " fuori intervallo [1, " + labels.length + "]");
        }
        return labels[vertex - 1];
    }

    public int getVertexCount() {
        return labels.length;
    }

    /** @return passate complete eseguite */
    public int getIterations() {
        return iterations;
    }

    /** @return true se l'ultima passata non ha cambiato nessuna etichetta */
    public boolean isConverged() {
        return converged;
    }

    public int getCommunityCount() {
        return communityCount;
    }

    //endregion

    //region INTERROGAZIONI

    /**
     * @return dimensioni delle comunità; la posizione c - 1 è la comunità c
     */
    public int[] communitySizes() {
        int[] sizes = new int[communityCount];
        for (int label : labels) {
            sizes[label - 1]++;
        }
        return sizes;
    }

    /**
     * Vertici (1-based, crescenti) con l'etichetta indicata.
     */
    public List<Integer> members(int label) {
        if (label < 1 || label > communityCount) {
            throw new IllegalArgumentException("Comunità " + label + " inesistente (1.." + communityCount + ")");
        }
        List<Integer> members = new ArrayList<>();
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == label) {
                members.add(i + 1);
            }
        }
        return Collections.unmodifiableList(members);
    }

    /** @return dimensione della comunità più grande, 0 se non ci sono vertici */
    public int largestCommunitySize() {
        return Arrays.stream(communitySizes()).max().orElse(0);
    }

    //endregion

    @Override
    public String toString() {
        return String.format("CommunityAssignment{vertici=%d, comunità=%d, iterazioni=%d, convergenza=%s}",
                labels.length, communityCount, iterations, converged ? "sì" : "no");
    }
}
