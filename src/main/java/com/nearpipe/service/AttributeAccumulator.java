package com.nearpipe.service;

import com.nearpipe.model.AttributeSpec;
import com.nearpipe.model.Burst;
import com.nearpipe.model.Chop;
import com.nearpipe.model.CompositeHeader;
import com.nearpipe.model.Diagnostic.Code;
import com.nearpipe.model.InstrumentConfig;
import com.nearpipe.model.MissingKeyPolicy;
import com.nearpipe.model.StreamKey;
import com.nearpipe.store.FrameStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reglas de fusion de atributos por stream:
 * <ul>
 *   <li>estaticos: se crean la primera vez; si cambian se avisa y se sobrescriben,</li>
 *   <li>no estaticos: un valor por frame enviado al stream, en el mismo orden que los frames
 *       (null si el fichero no trae la clave),</li>
 *   <li>extra: INDEX global por frame, FILES por fichero y PIXSCALE constante.</li>
 * </ul>
 */
public class AttributeAccumulator {

    public static final String INDEX = "INDEX";
    public static final String FILES = "FILES";
    public static final String PIXSCALE = "PIXSCALE";

    public enum StaticOutcome { CREATED, UNCHANGED, UPDATED }

    private final InstrumentConfig config;
    private final List<AttributeSpec> staticSpecs;
    private final List<AttributeSpec> nonStaticSpecs;

    private final Set<StreamKey> missingReported = EnumSet.noneOf(StreamKey.class);
    private final Set<String> nonStaticMissingReported = new HashSet<>();

    public AttributeAccumulator(InstrumentConfig config, boolean checkAll) {
        this.config = config;
        this.staticSpecs = config.select(AttributeSpec.Kind.STATIC, checkAll);
        this.nonStaticSpecs = config.select(AttributeSpec.Kind.NON_STATIC, checkAll);
    }

    public StaticOutcome recordStatic(FrameStream stream, String name, Object value, String fileName, Diagnostics diagnostics) {
        if (!stream.hasStaticAttribute(name)) {
            stream.putStaticAttribute(name, value);
            return StaticOutcome.CREATED;
        }
        Object previous = stream.getStaticAttribute(name);
        if (sameValue(previous, value)) return StaticOutcome.UNCHANGED;

        diagnostics.warn(Code.STATIC_ATTRIBUTE_CHANGED, String.format(
                "Static attribute %s has changed (%s -> %s). Possibly the file %s does not belong to the data set '%s'. Attribute value is updated.",
                name, previous, value, fileName, stream.name()));
        stream.putStaticAttribute(name, value);
        return StaticOutcome.UPDATED;
    }

    public void appendNonStatic(FrameStream stream, String name, Object value) {
        stream.appendAttribute(name, value);
    }

    // --- POR FICHERO ---

    public void applyStatic(Map<StreamKey, FrameStream> touched, CompositeHeader header, String fileName, RunContext ctx) {
        List<String> missing = new ArrayList<>();
        for (AttributeSpec spec : staticSpecs) {
            if (!spec.source.isApplicable()) continue;
            String key = spec.source.headerKey();
            if (!header.containsKey(key)) {
                missing.add(spec.name + " (=" + key + ")");
                continue;
            }
            for (FrameStream stream : touched.values()) {
                recordStatic(stream, spec.name, header.get(key), fileName, ctx.diagnostics);
            }
        }
        if (!missing.isEmpty()) reportMissing(touched, missing, fileName, ctx);
    }

    private void reportMissing(Map<StreamKey, FrameStream> touched, List<String> missing, String fileName, RunContext ctx) {
        MissingKeyPolicy policy = config.missingKeyPolicy;
        if (policy == MissingKeyPolicy.LAST_FILE_ONLY && !ctx.isLastFile()) return;

        for (Map.Entry<StreamKey, FrameStream> e : touched.entrySet()) {
            if (policy == MissingKeyPolicy.LAST_FILE_ONLY && !missingReported.add(e.getKey())) continue;
            ctx.diagnostics.warn(Code.STATIC_KEY_MISSING, String.format("%s: static attributes %s not found in the FITS header (stream '%s')",
                    fileName, missing, e.getValue().name()));
        }
    }

    public void applyNonStatic(Map<StreamKey, FrameStream> touched, Burst burst, RunContext ctx) {
        for (AttributeSpec spec : nonStaticSpecs) {
            if (!spec.source.isApplicable()) continue;
            String key = spec.source.headerKey();
            // sin clave se anexa null por frame: el atributo sigue alineado con la pila
            Object value = null;
            if (burst.header.containsKey(key)) {
                value = burst.header.get(key);
            } else if (nonStaticMissingReported.add(spec.name)) {
                ctx.diagnostics.warn(Code.NON_STATIC_KEY_MISSING, String.format("%s: non-static attribute %s (=%s) not found in the FITS header",
                        burst.fileName, spec.name, key));
            }
            for (Map.Entry<StreamKey, FrameStream> e : touched.entrySet()) {
                int frames = burst.count(e.getKey().chop);
                for (int i = 0; i < frames; i++) appendNonStatic(e.getValue(), spec.name, value);
            }
        }
    }

    public void recordExtra(Map<StreamKey, FrameStream> touched, Burst burst, Path source, RunContext ctx) {
        for (Chop chop : burst.acquisitionOrder) {
            long index = ctx.nextFrameIndex();
            FrameStream stream = touched.get(StreamKey.of(burst.nod, chop));
            appendNonStatic(stream, INDEX, index);
        }
        for (FrameStream stream : touched.values()) {
            appendNonStatic(stream, FILES, source.toString());
            recordStatic(stream, PIXSCALE, config.pixelScale, burst.fileName, ctx.diagnostics);
        }
    }

    static boolean sameValue(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue()) == 0;
        }
        return Objects.equals(a, b);
    }
}
