package com.nearpipe.model;

public enum StreamKey {
    NOD_A_CHOP_A(Nod.A, Chop.A),
    NOD_A_CHOP_B(Nod.A, Chop.B),
    NOD_B_CHOP_A(Nod.B, Chop.A),
    NOD_B_CHOP_B(Nod.B, Chop.B);

    public final Nod nod;
    public final Chop chop;

    StreamKey(Nod nod, Chop chop) {
        this.nod = nod;
        this.chop = chop;
    }

    public static StreamKey of(Nod nod, Chop chop) {
        for (StreamKey k : values()) {
            if (k.nod == nod && k.chop == chop) return k;
        }
        throw new IllegalArgumentException("Unknown stream " + nod + "/" + chop);
    }

    /** Etiqueta de procedencia que se anota al cerrar el stream. */
    public String provenanceLabel() {
        return "Nod " + nod + ", Chop " + chop;
    }
}
