package com.nearpipe.model;

public enum Chop {
    A("HCYCLE1"),
    B("HCYCLE2");

    public final String frameType;

    Chop(String frameType) {
        this.frameType = frameType;
    }

    public static Chop fromFrameType(Object value) {
        if (value == null) return null;
        String v = value.toString().trim();
        for (Chop c : values()) {
            if (c.frameType.equals(v)) return c;
        }
        return null;
    }
}
