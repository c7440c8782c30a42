package com.nearpipe.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class RunSummary {
    public final int filesProcessed;
    public final long framesIndexed;
    public final Map<StreamKey, Integer> framesPerStream;
    public final List<Diagnostic> diagnostics;

    public RunSummary(int filesProcessed, long framesIndexed, EnumMap<StreamKey, Integer> framesPerStream,
                      List<Diagnostic> diagnostics) {
        this.filesProcessed = filesProcessed;
        this.framesIndexed = framesIndexed;
        this.framesPerStream = Collections.unmodifiableMap(new EnumMap<>(framesPerStream));
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }
}
