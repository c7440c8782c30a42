package com.nearpipe.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Contenido crudo de un fichero de exposicion: header general y los N frames
 * (el frame promedio del final ya viene excluido).
 */
public class RawExposure {

    public static class RawFrame {
        public final Map<String, Object> header;
        public final Object kernel; // plano 2D tal como lo entrega el lector (short[][], int[][], float[][]...)

        public RawFrame(Map<String, Object> header, Object kernel) {
            this.header = Collections.unmodifiableMap(header);
            this.kernel = kernel;
        }
    }

    public final String fileName;
    public final Map<String, Object> primaryHeader;
    public final List<RawFrame> frames;

    public RawExposure(String fileName, Map<String, Object> primaryHeader, List<RawFrame> frames) {
        this.fileName = fileName;
        this.primaryHeader = Collections.unmodifiableMap(primaryHeader);
        this.frames = Collections.unmodifiableList(frames);
    }

    public int frameCount() { return frames.size(); }
}
