package com.nearpipe.service;

/**
 * Estado de una ejecucion que depende del orden total de los ficheros:
 * contador global INDEX y posicion del fichero actual.
 * Solo lo toca el hilo de procesado, no necesita sincronizacion.
 */
public class RunContext {
    public final Diagnostics diagnostics;
    private final int fileCount;

    private final long firstIndex;
    private long frameCounter;
    private int fileIndex = -1;

    public RunContext(Diagnostics diagnostics, int fileCount) {
        this(diagnostics, fileCount, 0);
    }

    /** @param firstIndex primer INDEX de la ejecucion; &gt; 0 al anexar a streams ya persistidos */
    public RunContext(Diagnostics diagnostics, int fileCount, long firstIndex) {
        if (firstIndex < 0) throw new IllegalArgumentException("First INDEX should not be negative, got " + firstIndex);
        this.diagnostics = diagnostics;
        this.fileCount = fileCount;
        this.firstIndex = firstIndex;
        this.frameCounter = firstIndex;
    }

    /** Devuelve el siguiente INDEX global y avanza el contador. */
    public long nextFrameIndex() { return frameCounter++; }

    /** INDEX que recibira el proximo frame. */
    public long peekFrameIndex() { return frameCounter; }

    /** Frames indexados en esta ejecucion. */
    public long framesIndexed() { return frameCounter - firstIndex; }

    public void beginFile(int index) {
        if (index <= fileIndex) throw new IllegalStateException("Files must be processed in order: " + index + " after " + fileIndex);
        this.fileIndex = index;
    }

    public int fileIndex() { return fileIndex; }

    public boolean isLastFile() { return fileIndex == fileCount - 1; }
}
