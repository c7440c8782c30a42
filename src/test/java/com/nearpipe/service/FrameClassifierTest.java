package com.nearpipe.service;

import static com.nearpipe.service.Exposures.exposure;
import static com.nearpipe.service.Exposures.frame;
import static com.nearpipe.service.Exposures.primaryHeader;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.nearpipe.model.Burst;
import com.nearpipe.model.Chop;
import com.nearpipe.model.CompositeHeader;
import com.nearpipe.model.Diagnostic.Code;
import com.nearpipe.model.Nod;
import com.nearpipe.model.RawExposure;
import com.nearpipe.model.RawExposure.RawFrame;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FrameClassifierTest {

    private RunContext ctx;

    @BeforeEach
    void setUp() {
        ctx = new RunContext(new Diagnostics(), 1);
        ctx.beginFile(0);
    }

    private Burst classify(RawExposure e) {
        CompositeHeader h = HeaderComposer.merge(e.primaryHeader, e.frames.get(0).header,
                Exposures.WIDTH, Exposures.HEIGHT, e.frameCount());
        return new FrameClassifier().classify(e, h, Nod.A, ctx);
    }

    private static float firstPixel(Burst b, Chop chop, int slice) {
        return ((float[]) b.stack(chop).getPixels(slice))[0];
    }

    @Test
    void unknownTagIsDroppedAndBucketsStayBalanced() {
        Burst b = classify(exposure("f.fits", primaryHeader(),
                frame("HCYCLE1", 1), frame("HCYCLE2", 2), frame("HCYCLE1", 3), frame("INT", 4), frame("HCYCLE2", 5)));

        assertEquals(2, b.count(Chop.A));
        assertEquals(2, b.count(Chop.B));
        assertEquals(1, b.droppedFrames);
        assertEquals(1f, firstPixel(b, Chop.A, 1));
        assertEquals(3f, firstPixel(b, Chop.A, 2));
        assertEquals(2f, firstPixel(b, Chop.B, 1));
        assertEquals(5f, firstPixel(b, Chop.B, 2));
        assertEquals(Arrays.asList(Chop.A, Chop.B, Chop.A, Chop.B), b.acquisitionOrder);

        assertEquals(1, ctx.diagnostics.count(Code.CHOP_TAG_UNRECOGNIZED));
        assertEquals(0, ctx.diagnostics.count(Code.CHOP_COUNT_MISMATCH));
    }

    @Test
    void unevenBucketsWarn() {
        Burst b = classify(exposure("f.fits", primaryHeader(),
                frame("HCYCLE1", 1), frame("HCYCLE1", 2), frame("HCYCLE2", 3)));
        assertEquals(2, b.count(Chop.A));
        assertEquals(1, b.count(Chop.B));
        assertEquals(1, ctx.diagnostics.count(Code.CHOP_COUNT_MISMATCH));
    }

    @Test
    void allZeroFramesAreKept() {
        Burst b = classify(exposure("f.fits", primaryHeader(), frame("HCYCLE1", 0), frame("HCYCLE2", 0)));
        assertEquals(1, b.count(Chop.A));
        assertEquals(1, b.count(Chop.B));
        assertEquals(2, b.classifiedCount());
    }

    @Test
    void missingTagCountsAsUnrecognized() {
        RawFrame untagged = new RawFrame(Exposures.map("NAXIS", 2L), new float[Exposures.HEIGHT][Exposures.WIDTH]);
        Burst b = classify(exposure("f.fits", primaryHeader(), frame("HCYCLE1", 1), untagged, frame("HCYCLE2", 1)));
        assertEquals(2, b.classifiedCount());
        assertEquals(1, ctx.diagnostics.count(Code.CHOP_TAG_UNRECOGNIZED));
    }

    @Test
    void integerPlanesAreConverted() {
        short[][] s = { { (short) -1, 0, 7 }, { 1, 2, 3 } };
        int[][] i = { { -5, 0, 7 }, { 1, 2, 3 } };
        assertArrayEquals(new float[] { 65535f, 0f, 7f, 1f, 2f, 3f }, FrameClassifier.toPixels(s, 3, 2));
        assertArrayEquals(new float[] { -5f, 0f, 7f, 1f, 2f, 3f }, FrameClassifier.toPixels(i, 3, 2));
        assertArrayEquals(new int[] { 3, 2 }, FrameClassifier.dimensions(i));
    }

    @Test
    void frameOfAnotherSizeIsRejected() {
        RawFrame big = new RawFrame(Exposures.map(FrameClassifier.KEY_FRAME_TYPE, "HCYCLE2"), new float[4][4]);
        assertThrows(IllegalArgumentException.class,
                () -> classify(exposure("f.fits", primaryHeader(), frame("HCYCLE1", 1), big)));
    }
}
