package com.nearpipe.service;

/** Condicion fatal durante la ejecucion: el pipeline se aborta y los streams no se cierran. */
public class PipelineException extends Exception {
    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
