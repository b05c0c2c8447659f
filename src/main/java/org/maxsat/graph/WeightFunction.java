package org.maxsat.graph;

/**
 * Trasformazione numero di conflitti -> peso dell'arco.
 *
 * Il risultato non è considerato affidabile: il {@link ConflictGraphBuilder}
 * sostituisce con il conteggio grezzo ogni valore non finito o non positivo,
 * e qualsiasi eccezione sollevata dalla funzione.
 */
@FunctionalInterface
public interface WeightFunction {

    double apply(int conflicts);

    /** Peso uguale al numero di conflitti. */
    static WeightFunction identity() {
        return conflicts -> conflicts;
    }
}
