package com.nearpipe.service;

import com.nearpipe.model.Burst;
import com.nearpipe.model.Chop;
import com.nearpipe.model.CompositeHeader;
import com.nearpipe.model.Diagnostic.Code;
import com.nearpipe.model.Nod;
import com.nearpipe.model.RawExposure;
import com.nearpipe.model.RawExposure.RawFrame;
import ij.ImageStack;
import ij.process.FloatProcessor;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;

/**
 * Separa los frames de un fichero en chop A (HCYCLE1) y chop B (HCYCLE2) segun la
 * etiqueta del header de cada frame. Los frames con etiqueta desconocida se descartan.
 * La ocupacion de cada cubo se lleva con un contador, no mirando el contenido de los pixeles.
 */
public class FrameClassifier {

    public static final String KEY_FRAME_TYPE = "ESO DET FRAM TYPE";

    public Burst classify(RawExposure exposure, CompositeHeader header, Nod nod, RunContext ctx) {
        int[] dims = dimensions(exposure.frames.get(0).kernel);
        int width = dims[0], height = dims[1];

        ImageStack chopA = new ImageStack(width, height);
        ImageStack chopB = new ImageStack(width, height);
        List<Chop> order = new ArrayList<>(exposure.frameCount());
        int dropped = 0;

        for (int i = 0; i < exposure.frameCount(); i++) {
            RawFrame frame = exposure.frames.get(i);
            Object tag = frame.header.get(KEY_FRAME_TYPE);
            Chop chop = Chop.fromFrameType(tag);
            if (chop == null) {
                ctx.diagnostics.warn(Code.CHOP_TAG_UNRECOGNIZED, String.format(
                        "%s: the chop position (=%s) of frame %d could not be read from its header (value: %s)",
                        exposure.fileName, KEY_FRAME_TYPE, i, tag));
                dropped++;
                continue;
            }
            int[] d = dimensions(frame.kernel);
            if (d[0] != width || d[1] != height) {
                throw new IllegalArgumentException(String.format("%s: frame %d is %dx%d, expected %dx%d",
                        exposure.fileName, i, d[0], d[1], width, height));
            }
            ImageStack target = chop == Chop.A ? chopA : chopB;
            target.addSlice(exposure.fileName + ":" + i, toPixels(frame.kernel, width, height));
            order.add(chop);
        }

        if (chopA.getSize() != chopB.getSize()) {
            ctx.diagnostics.warn(Code.CHOP_COUNT_MISMATCH, String.format("%s: the number of frames is not equal for chop A (%d) and chop B (%d)",
                    exposure.fileName, chopA.getSize(), chopB.getSize()));
        }
        return new Burst(exposure.fileName, header, nod, chopA, chopB, order, dropped);
    }

    /** {ancho, alto} de un plano 2D. */
    public static int[] dimensions(Object k) {
        if (!(k instanceof Object[]) || ((Object[]) k).length == 0) {
            throw new IllegalArgumentException("Frame data should be a 2D array, got " + (k == null ? "null" : k.getClass().getSimpleName()));
        }
        Object[] rows = (Object[]) k;
        return new int[] { Array.getLength(rows[0]), rows.length };
    }

    // Plano 2D -> pixels float de un FloatProcessor (fila a fila)
    static float[] toPixels(Object k, int w, int h) {
        FloatProcessor ip = new FloatProcessor(w, h);
        float[] px = (float[]) ip.getPixels();
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            for (int y = 0; y < h; y++) for (int x = 0; x < w; x++) px[y * w + x] = s[y][x] & 0xFFFF;
        } else if (k instanceof int[][]) {
            int[][] s = (int[][]) k;
            for (int y = 0; y < h; y++) for (int x = 0; x < w; x++) px[y * w + x] = s[y][x];
        } else if (k instanceof float[][]) {
            float[][] s = (float[][]) k;
            for (int y = 0; y < h; y++) System.arraycopy(s[y], 0, px, y * w, w);
        } else if (k instanceof double[][]) {
            double[][] s = (double[][]) k;
            for (int y = 0; y < h; y++) for (int x = 0; x < w; x++) px[y * w + x] = (float) s[y][x];
        } else if (k instanceof byte[][]) {
            byte[][] s = (byte[][]) k;
            for (int y = 0; y < h; y++) for (int x = 0; x < w; x++) px[y * w + x] = s[y][x] & 0xFF;
        } else if (k instanceof long[][]) {
            long[][] s = (long[][]) k;
            for (int y = 0; y < h; y++) for (int x = 0; x < w; x++) px[y * w + x] = s[y][x];
        } else {
            throw new IllegalArgumentException("Unsupported frame data type " + k.getClass().getSimpleName());
        }
        return px;
    }
}
