package com.nearpipe.model;

public class Diagnostic {
    public enum Severity { INFO, WARNING }

    public enum Code {
        NOD_KEY_MISSING,
        NOD_VALUE_INVALID,
        CHOP_DISABLED,
        CHOP_CYCLES_SKIPPED,
        FRAMES_PREAVERAGED,
        CHOP_TAG_UNRECOGNIZED,
        CHOP_COUNT_MISMATCH,
        STATIC_ATTRIBUTE_CHANGED,
        STATIC_KEY_MISSING,
        NON_STATIC_KEY_MISSING,
        STREAM_EMPTY,
        STREAM_RESUMED
    }

    public final Severity severity;
    public final Code code;
    public final String context;

    public Diagnostic(Severity severity, Code code, String context) {
        this.severity = severity;
        this.code = code;
        this.context = context;
    }

    @Override
    public String toString() {
        return severity + " " + code + ": " + context;
    }
}
