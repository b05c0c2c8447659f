package org.maxsat.graph;

import java.util.Objects;

/**
 * Arco non orientato tra due clausole, memorizzato con source &lt; target.
 * Il peso è positivo e finito; 1.0 nei grafi non pesati.
 */
public final class ClauseEdge {

    /** Clausola con indice minore (1-based) */
    private final int source;

    /** Clausola con indice maggiore (1-based) */
    private final int target;

    private final double weight;

    /**
     * @throws IllegalArgumentException se gli estremi coincidono o il peso non è positivo e finito
     */
    public ClauseEdge(int source, int target, double weight) {
        if (source == target) {
            throw new IllegalArgumentException("Cappio non ammesso sulla clausola " + source);
        }
        if (!Double.isFinite(weight) || weight <= 0) {
            throw new IllegalArgumentException("Peso arco (" + source + "," + target + ") non valido: " + weight);
        }
        this.source = Math.min(source, target);
        this.target = Math.max(source, target);
        this.weight = weight;
    }

    public static ClauseEdge of(int source, int target) {
        return new ClauseEdge(source, target, 1.0);
    }

    public int getSource() {
        return source;
    }

    public int getTarget() {
        return target;
    }

    public double getWeight() {
        return weight;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        ClauseEdge other = (ClauseEdge) obj;
        return source == other.source &&
                target == other.target &&
                Double.compare(weight, other.weight) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, weight);
    }

    @Override
    public String toString() {
        return "(" + source + "," + target + ", " + weight + ")";
    }
}
