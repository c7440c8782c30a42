package com.nearpipe.service;

import static com.nearpipe.NearPipeline.LOGGER;

import com.nearpipe.model.Burst;
import com.nearpipe.model.Chop;
import com.nearpipe.model.Diagnostic.Code;
import com.nearpipe.model.Nod;
import com.nearpipe.model.StreamKey;
import com.nearpipe.store.DataStore;
import com.nearpipe.store.FrameStream;
import java.io.IOException;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

/**
 * Los cuatro streams de salida, uno por pareja (nod, chop).
 */
public class OutputRouter {
    private static final Marker IT = MarkerManager.getMarker(OutputRouter.class.getSimpleName());

    public static final String HISTORY_MODULE = "NearInitializationModule";

    private final EnumMap<StreamKey, FrameStream> streams = new EnumMap<>(StreamKey.class);

    public OutputRouter(DataStore store, Map<StreamKey, String> names) throws IOException {
        validateNames(names);
        for (StreamKey key : StreamKey.values()) {
            streams.put(key, store.open(names.get(key)));
        }
    }

    public static void validateNames(Map<StreamKey, String> names) {
        Set<String> seen = new HashSet<>();
        for (StreamKey key : StreamKey.values()) {
            String name = names.get(key);
            if (name == null || name.trim().isEmpty()) {
                throw new IllegalArgumentException("Output stream for " + key.provenanceLabel() + " has no name");
            }
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Output streams should have different names, '" + name + "' is used twice");
            }
        }
    }

    public FrameStream stream(StreamKey key) { return streams.get(key); }

    public void clearAll() throws IOException {
        for (FrameStream s : streams.values()) s.clear();
    }

    public void resumeAll() throws IOException {
        for (FrameStream s : streams.values()) s.resume();
    }

    /**
     * Anexa chop A y chop B a los streams del nod del burst.
     * @return los dos streams tocados
     */
    public EnumMap<StreamKey, FrameStream> route(Burst burst) {
        EnumMap<StreamKey, FrameStream> touched = new EnumMap<>(StreamKey.class);
        for (Chop chop : Chop.values()) {
            StreamKey key = StreamKey.of(burst.nod, chop);
            FrameStream s = streams.get(key);
            s.append(burst.stack(chop));
            touched.put(key, s);
        }
        return touched;
    }

    /** Solo se guardan los streams del nod que ha recibido datos. */
    public void flush(Nod nod) throws IOException {
        for (Chop chop : Chop.values()) streams.get(StreamKey.of(nod, chop)).flush();
    }

    public void reportEmptyStreams(Diagnostics diagnostics) {
        for (Map.Entry<StreamKey, FrameStream> e : streams.entrySet()) {
            if (e.getValue().frameCount() == 0) {
                diagnostics.warn(Code.STREAM_EMPTY, String.format("The output stream '%s' is empty. There is no nodding position %s. "
                        + "Add input files that contain both nod A and nod B.", e.getValue().name(), e.getKey().nod));
            }
        }
    }

    public void finish() throws IOException {
        for (Map.Entry<StreamKey, FrameStream> e : streams.entrySet()) {
            FrameStream s = e.getValue();
            s.addHistory(HISTORY_MODULE, e.getKey().provenanceLabel());
            s.close();
            LOGGER.info(IT, "Stream '{}' cerrado: {} frames ({})", s.name(), s.frameCount(), e.getKey().provenanceLabel());
        }
    }

    /** Siguiente INDEX libre: 1 + el mayor INDEX ya guardado en los cuatro streams (0 si no hay). */
    public long nextIndex() {
        long next = 0;
        for (FrameStream s : streams.values()) {
            for (Object v : s.getAttributeData(AttributeAccumulator.INDEX)) {
                if (v instanceof Number) next = Math.max(next, ((Number) v).longValue() + 1);
            }
        }
        return next;
    }

    /** Tras {@link #resumeAll()}: una nota por stream que ya traia frames. */
    public void reportResumedStreams(Diagnostics diagnostics, long nextIndex) {
        for (Map.Entry<StreamKey, FrameStream> e : streams.entrySet()) {
            FrameStream s = e.getValue();
            if (s.frameCount() == 0) continue;
            diagnostics.info(Code.STREAM_RESUMED, String.format("Output stream '%s' (%s) already holds %d frames, appending from INDEX %d",
                    s.name(), e.getKey().provenanceLabel(), s.frameCount(), nextIndex));
        }
    }

    public EnumMap<StreamKey, Integer> frameCounts() {
        EnumMap<StreamKey, Integer> counts = new EnumMap<>(StreamKey.class);
        for (Map.Entry<StreamKey, FrameStream> e : streams.entrySet()) counts.put(e.getKey(), e.getValue().frameCount());
        return counts;
    }
}
