package org.maxsat.community;

/**
 * Criterio di aggregazione dei voti dei vicini durante la propagazione.
 */
public enum VoteMode {

    /** Ogni vicino vale un voto per la propria etichetta */
    UNIT,

    /** Ogni vicino vota con il peso dell'arco che lo collega (1.0 sui grafi non pesati) */
    EDGE_WEIGHT
}
