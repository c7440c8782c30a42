package com.nearpipe.service;

import static com.nearpipe.service.Exposures.chopped;
import static com.nearpipe.service.Exposures.primaryHeader;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.nearpipe.model.Burst;
import com.nearpipe.model.CompositeHeader;
import com.nearpipe.model.Diagnostic.Code;
import com.nearpipe.model.Nod;
import com.nearpipe.model.RawExposure;
import com.nearpipe.model.StreamKey;
import com.nearpipe.store.FrameStream;
import com.nearpipe.store.InMemoryDataStore;
import com.nearpipe.store.InMemoryDataStore.MemoryStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OutputRouterTest {

    private InMemoryDataStore store;
    private OutputRouter router;

    private static EnumMap<StreamKey, String> names(String a, String b, String c, String d) {
        EnumMap<StreamKey, String> m = new EnumMap<>(StreamKey.class);
        m.put(StreamKey.NOD_A_CHOP_A, a);
        m.put(StreamKey.NOD_A_CHOP_B, b);
        m.put(StreamKey.NOD_B_CHOP_A, c);
        m.put(StreamKey.NOD_B_CHOP_B, d);
        return m;
    }

    private static Burst burst(String name, Nod nod) {
        RunContext ctx = new RunContext(new Diagnostics(), 1);
        ctx.beginFile(0);
        RawExposure e = chopped(name, primaryHeader());
        CompositeHeader h = HeaderComposer.merge(e.primaryHeader, e.frames.get(0).header,
                Exposures.WIDTH, Exposures.HEIGHT, e.frameCount());
        return new FrameClassifier().classify(e, h, nod, ctx);
    }

    @BeforeEach
    void setUp() throws IOException {
        store = new InMemoryDataStore();
        router = new OutputRouter(store, names("aa", "ab", "ba", "bb"));
    }

    @Test
    void duplicateNamesAreFatal() {
        assertThrows(IllegalArgumentException.class,
                () -> new OutputRouter(new InMemoryDataStore(), names("aa", "ab", "aa", "bb")));
        assertThrows(IllegalArgumentException.class,
                () -> OutputRouter.validateNames(names("aa", "ab", "ba", "")));
    }

    @Test
    void burstGoesToTheStreamsOfItsNod() {
        Map<StreamKey, FrameStream> touched = router.route(burst("f0.fits", Nod.B));
        assertEquals(Arrays.asList(StreamKey.NOD_B_CHOP_A, StreamKey.NOD_B_CHOP_B), Arrays.asList(touched.keySet().toArray()));
        assertEquals(0, router.stream(StreamKey.NOD_A_CHOP_A).frameCount());
        assertEquals(0, router.stream(StreamKey.NOD_A_CHOP_B).frameCount());
        assertEquals(2, router.stream(StreamKey.NOD_B_CHOP_A).frameCount());
        assertEquals(2, router.stream(StreamKey.NOD_B_CHOP_B).frameCount());
        assertEquals(3, router.stream(StreamKey.NOD_B_CHOP_A).frames().getWidth());
    }

    @Test
    void flushOnlyTouchesOneNod() throws IOException {
        router.route(burst("f0.fits", Nod.A));
        router.flush(Nod.A);
        assertEquals(1, store.open("aa").flushCount());
        assertEquals(1, store.open("ab").flushCount());
        assertEquals(0, store.open("ba").flushCount());
        assertEquals(0, store.open("bb").flushCount());
    }

    @Test
    void emptyStreamsAreReported() {
        router.route(burst("f0.fits", Nod.A));
        Diagnostics d = new Diagnostics();
        router.reportEmptyStreams(d);
        assertEquals(2, d.count(Code.STREAM_EMPTY));
        assertTrue(d.of(Code.STREAM_EMPTY).get(0).context.contains("'ba'"));
    }

    @Test
    void finishLabelsAndClosesEveryStream() throws IOException {
        router.route(burst("f0.fits", Nod.A));
        router.finish();
        for (StreamKey key : StreamKey.values()) {
            MemoryStream s = (MemoryStream) router.stream(key);
            assertTrue(s.isClosed());
            assertEquals(Arrays.asList(OutputRouter.HISTORY_MODULE + ": " + key.provenanceLabel()), s.history());
        }
        assertThrows(IllegalStateException.class, () -> router.route(burst("f1.fits", Nod.A)));
    }

    @Test
    void nextIndexFollowsTheLargestStoredIndex() {
        assertEquals(0, router.nextIndex());
        router.stream(StreamKey.NOD_A_CHOP_B).appendAttribute("INDEX", 3L);
        router.stream(StreamKey.NOD_B_CHOP_A).appendAttribute("INDEX", 7L);
        router.stream(StreamKey.NOD_B_CHOP_A).appendAttribute("INDEX", 5L);
        assertEquals(8, router.nextIndex());
    }

    @Test
    void clearDropsPreviousContent() throws IOException {
        router.route(burst("f0.fits", Nod.A));
        router.stream(StreamKey.NOD_A_CHOP_A).putStaticAttribute("DIT", 0.1);
        router.clearAll();
        assertEquals(0, router.stream(StreamKey.NOD_A_CHOP_A).frameCount());
        assertTrue(router.stream(StreamKey.NOD_A_CHOP_A).staticAttributes().isEmpty());
    }
}
