package org.maxsat.graph;

import java.util.Locale;

/**
 * Trasformazioni di peso usate negli esperimenti sul grafo pesato.
 */
public enum StandardWeightFunction implements WeightFunction {

    /** x */
    LINEAR("linear") {
        @Override
        public double apply(int conflicts) {
            return conflicts;
        }
    },

    /** x^2: enfatizza le coppie con molti conflitti */
    QUADRATIC("quadratic") {
        @Override
        public double apply(int conflicts) {
            return (double) conflicts * conflicts;
        }
    },

    /** x^3 */
    CUBIC("cubic") {
        @Override
        public double apply(int conflicts) {
            return Math.pow(conflicts, 3);
        }
    },

    /** 2^x */
    EXPONENTIAL("exponential") {
        @Override
        public double apply(int conflicts) {
            return Math.pow(2.0, conflicts);
        }
    },

    /** ln(x + 1): attenua le differenze */
    LOGARITHMIC("log") {
        @Override
        public double apply(int conflicts) {
            return Math.log(conflicts + 1.0);
        }
    };

    private final String flag;

    StandardWeightFunction(String flag) {
        this.flag = flag;
    }

    /** @return nome usato dall'opzione -w della linea di comando */
    public String getFlag() {
        return flag;
    }

    /**
     * Risolve il nome da linea di comando (case insensitive).
     *
     * @throws IllegalArgumentException se il nome non corrisponde a nessuna funzione
     */
    public static StandardWeightFunction fromFlag(String flag) {
        if (flag != null) {
            String normalized = flag.trim().toLowerCase(Locale.ROOT);
            for (StandardWeightFunction function : values()) {
                if (function.flag.equals(normalized)) {
                    return function;
                }
            }
        }
        throw new IllegalArgumentException("Funzione di peso sconosciuta: " + flag
                + ". Supportate: linear, quadratic, cubic, exponential, log");
    }
}
