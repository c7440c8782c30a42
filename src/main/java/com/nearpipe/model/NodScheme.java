package com.nearpipe.model;

/**
 * Patron de nodding usado cuando el header no trae ESO SEQ NODPOS.
 */
public enum NodScheme {
    ABBA, ABAB;

    public static NodScheme parse(String literal) {
        if ("ABBA".equals(literal)) return ABBA;
        if ("ABAB".equals(literal)) return ABAB;
        throw new IllegalArgumentException("Scheme keyword should be set to 'ABBA' or 'ABAB', got '" + literal + "'");
    }

    /** Nod inferido a partir de la posicion del fichero en la lista ordenada. */
    public Nod nodFor(int sequenceIndex) {
        if (this == ABBA) {
            int pos = sequenceIndex % 4;
            return (pos == 0 || pos == 3) ? Nod.A : Nod.B;
        }
        return (sequenceIndex % 2 == 0) ? Nod.A : Nod.B;
    }
}
