package com.nearpipe.model;

public enum PipelineState {
    UNINITIALIZED, VALIDATED, DECOMPRESSING, PROCESSING, FINALIZING, DONE
}
