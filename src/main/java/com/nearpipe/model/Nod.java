package com.nearpipe.model;

public enum Nod {
    A, B;

    /** Valor de la clave ESO SEQ NODPOS; null si no es A ni B. */
    public static Nod fromHeaderValue(Object value) {
        if (value == null) return null;
        String v = value.toString().trim().toUpperCase();
        if (v.equals("A")) return A;
        if (v.equals("B")) return B;
        return null;
    }
}
