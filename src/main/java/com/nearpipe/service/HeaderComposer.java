package com.nearpipe.service;

import com.nearpipe.model.CompositeHeader;
import com.nearpipe.model.Diagnostic.Code;
import com.nearpipe.model.Nod;
import com.nearpipe.model.NodScheme;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Construye el header compuesto de un fichero y decide su posicion de nod.
 */
public class HeaderComposer {

    public static final String KEY_NODPOS = "ESO SEQ NODPOS";
    public static final String KEY_CHOP_ENABLED = "ESO DET CHOP ST";
    public static final String KEY_CHOP_SKIPPED = "ESO DET CHOP CYCSKIP";
    public static final String KEY_CHOP_AVERAGED = "ESO DET CHOP CYCSUM";

    private static final Pattern AXIS_KEY = Pattern.compile("NAXIS\\d*");

    public static class Result {
        public final CompositeHeader header;
        public final Nod nod;

        Result(CompositeHeader header, Nod nod) {
            this.header = header;
            this.nod = nod;
        }
    }

    private final NodScheme scheme;

    public HeaderComposer(NodScheme scheme) {
        this.scheme = scheme;
    }

    public Result compose(String fileName, Map<String, Object> fileHeader, Map<String, Object> firstFrameHeader,
                          int width, int height, int frameCount, int sequenceIndex, RunContext ctx) {
        CompositeHeader header = merge(fileHeader, firstFrameHeader, width, height, frameCount);
        Nod nod = resolveNod(fileName, header, sequenceIndex, ctx);
        checkHeader(fileName, header, ctx);
        return new Result(header, nod);
    }

    /**
     * Header general + header del primer frame (gana el del frame) con los ejes del cubo
     * (NAXIS=3, NAXIS1, NAXIS2, NAXIS3) en el sitio de los ejes originales.
     */
    public static CompositeHeader merge(Map<String, Object> fileHeader, Map<String, Object> firstFrameHeader,
                                        int width, int height, int frameCount) {
        LinkedHashMap<String, Object> merged = new LinkedHashMap<>(fileHeader);
        merged.putAll(firstFrameHeader);

        List<Map.Entry<String, Object>> rest = new ArrayList<>();
        int axisAt = -1;
        int bitpixAt = -1;
        for (Map.Entry<String, Object> e : merged.entrySet()) {
            if (AXIS_KEY.matcher(e.getKey()).matches()) {
                if (axisAt < 0) axisAt = rest.size();
                continue;
            }
            if (e.getKey().equals("BITPIX")) bitpixAt = rest.size() + 1;
            rest.add(e);
        }
        if (axisAt < 0) axisAt = Math.max(bitpixAt, 0);

        LinkedHashMap<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i <= rest.size(); i++) {
            if (i == axisAt) {
                out.put("NAXIS", 3L);
                out.put("NAXIS1", (long) width);
                out.put("NAXIS2", (long) height);
                out.put("NAXIS3", (long) frameCount);
            }
            if (i < rest.size()) out.put(rest.get(i).getKey(), rest.get(i).getValue());
        }
        return new CompositeHeader(out);
    }

    Nod resolveNod(String fileName, CompositeHeader header, int sequenceIndex, RunContext ctx) {
        if (header.containsKey(KEY_NODPOS)) {
            Nod nod = Nod.fromHeaderValue(header.get(KEY_NODPOS));
            if (nod != null) return nod;
            ctx.diagnostics.warn(Code.NOD_VALUE_INVALID, String.format("%s: %s = '%s' is not A or B, assuming %s nod scheme",
                    fileName, KEY_NODPOS, header.get(KEY_NODPOS), scheme));
            return scheme.nodFor(sequenceIndex);
        }
        // solo se avisa en el primer fichero de la secuencia
        if (sequenceIndex == 0) {
            ctx.diagnostics.warn(Code.NOD_KEY_MISSING, String.format("%s: keyword '%s' cannot be found, assuming %s nod scheme",
                    fileName, KEY_NODPOS, scheme));
        }
        return scheme.nodFor(sequenceIndex);
    }

    // Avisos del instrumento: no cambian el procesado
    void checkHeader(String fileName, CompositeHeader header, RunContext ctx) {
        if (header.containsKey(KEY_CHOP_ENABLED) && isFalse(header.get(KEY_CHOP_ENABLED))) {
            ctx.diagnostics.warn(Code.CHOP_DISABLED, fileName + ": chopping has been set to disabled");
        }
        if (header.containsKey(KEY_CHOP_SKIPPED)) {
            long skipped = asLong(header.get(KEY_CHOP_SKIPPED));
            if (skipped != 0) {
                ctx.diagnostics.warn(Code.CHOP_CYCLES_SKIPPED, fileName + ": " + skipped + " chop cycles have been skipped during operation");
            }
        }
        if (header.containsKey(KEY_CHOP_AVERAGED) && isTrue(header.get(KEY_CHOP_AVERAGED))) {
            ctx.diagnostics.warn(Code.FRAMES_PREAVERAGED, fileName + ": frames have been averaged by the instrument, chop/nod separation is probably invalid");
        }
    }

    private static boolean isTrue(Object v) {
        return Boolean.TRUE.equals(v) || "T".equals(String.valueOf(v).trim());
    }

    private static boolean isFalse(Object v) {
        return Boolean.FALSE.equals(v) || "F".equals(String.valueOf(v).trim());
    }

    private static long asLong(Object v) {
        if (v instanceof Number) return ((Number) v).longValue();
        try {
            return Long.parseLong(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
