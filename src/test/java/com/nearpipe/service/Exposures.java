package com.nearpipe.service;

import com.nearpipe.model.AttributeSpec;
import com.nearpipe.model.AttributeSpec.Kind;
import com.nearpipe.model.AttributeSpec.Source;
import com.nearpipe.model.InstrumentConfig;
import com.nearpipe.model.MissingKeyPolicy;
import com.nearpipe.model.RawExposure;
import com.nearpipe.model.RawExposure.RawFrame;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Ficheros de exposicion sinteticos para los tests. */
final class Exposures {

    static final int WIDTH = 3;
    static final int HEIGHT = 2;

    private Exposures() {}

    static Map<String, Object> map(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
        return m;
    }

    static Map<String, Object> primaryHeader(Object... extra) {
        Map<String, Object> m = map("SIMPLE", true, "BITPIX", 32L, "NAXIS", 0L,
                "INSTRUME", "VISIR", "ESO DET SEQ1 DIT", 0.025, "RA", 83.8, "DEC", -5.4);
        m.putAll(map(extra));
        return m;
    }

    static RawFrame frame(String type, float value) {
        float[][] px = new float[HEIGHT][WIDTH];
        for (float[] row : px) Arrays.fill(row, value);
        return new RawFrame(map("XTENSION", "IMAGE", "BITPIX", -32L, "NAXIS", 2L,
                "NAXIS1", (long) WIDTH, "NAXIS2", (long) HEIGHT, FrameClassifier.KEY_FRAME_TYPE, type), px);
    }

    static RawExposure exposure(String name, Map<String, Object> primary, RawFrame... frames) {
        return new RawExposure(name, primary, Arrays.asList(frames));
    }

    /** Burst estandar de 4 frames alternando HCYCLE1/HCYCLE2. */
    static RawExposure chopped(String name, Map<String, Object> primary) {
        return exposure(name, primary,
                frame("HCYCLE1", 1), frame("HCYCLE2", 2), frame("HCYCLE1", 3), frame("HCYCLE2", 4));
    }

    static InstrumentConfig config(MissingKeyPolicy policy) {
        List<AttributeSpec> table = Arrays.asList(
                new AttributeSpec("INSTRUMENT", Kind.STATIC, Source.fromHeaderKey("INSTRUME"), true),
                new AttributeSpec("DIT", Kind.STATIC, Source.fromHeaderKey("ESO DET SEQ1 DIT"), true),
                new AttributeSpec("FILTER", Kind.STATIC, Source.fromHeaderKey("ESO INS FILT1 NAME"), false),
                new AttributeSpec("PUPIL", Kind.STATIC, Source.notApplicable(), false),
                new AttributeSpec("RA", Kind.NON_STATIC, Source.fromHeaderKey("RA"), true),
                new AttributeSpec("PARANG_START", Kind.NON_STATIC, Source.fromHeaderKey("ESO ADA POSANG"), false),
                new AttributeSpec("DITHER_X", Kind.NON_STATIC, Source.notApplicable(), false));
        return new InstrumentConfig(2, 0.045, table, policy);
    }

    static InstrumentConfig config() {
        return config(MissingKeyPolicy.LAST_FILE_ONLY);
    }

    /** Lector falso: devuelve la exposicion registrada para cada nombre de fichero. */
    static class FakeReader implements ExposureReader {
        final Map<String, RawExposure> byName = new HashMap<>();
        final List<String> readOrder = new ArrayList<>();

        FakeReader add(RawExposure e) {
            byName.put(e.fileName, e);
            return this;
        }

        @Override
        public RawExposure read(Path file) throws IOException {
            String name = file.getFileName().toString();
            readOrder.add(name);
            RawExposure e = byName.get(name);
            if (e == null) throw new IOException("No fixture for " + name);
            return e;
        }
    }
}
