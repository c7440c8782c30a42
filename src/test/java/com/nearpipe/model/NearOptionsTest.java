package com.nearpipe.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Paths;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class NearOptionsTest {

    private static Properties base() {
        Properties p = new Properties();
        p.setProperty("input.dir", "/data/visir");
        return p;
    }

    @Test
    void defaultsMatchTheReadingModule() {
        NearOptions o = NearOptions.fromProperties(base());
        assertEquals(Paths.get("/data/visir"), o.inputDir);
        assertEquals("noda_chopa", o.tag(StreamKey.NOD_A_CHOP_A));
        assertEquals("nodb_chopb", o.tag(StreamKey.NOD_B_CHOP_B));
        assertEquals("ABBA", o.scheme);
        assertTrue(o.check);
        assertTrue(o.overwrite);
    }

    @Test
    void readsEveryOption() {
        Properties p = base();
        p.setProperty("tag.noda_chopa", "a1");
        p.setProperty("tag.nodb_chopa", "b1");
        p.setProperty("scheme", "ABAB");
        p.setProperty("check", "False");
        p.setProperty("overwrite", "false");
        NearOptions o = NearOptions.fromProperties(p);
        assertEquals("a1", o.tag(StreamKey.NOD_A_CHOP_A));
        assertEquals("b1", o.tag(StreamKey.NOD_B_CHOP_A));
        assertEquals("ABAB", o.scheme);
        assertFalse(o.check);
        assertFalse(o.overwrite);
    }

    @Test
    void nonBooleanFlagIsFatal() {
        Properties p = base();
        p.setProperty("check", "yes");
        assertThrows(IllegalArgumentException.class, () -> NearOptions.fromProperties(p));
    }

    @Test
    void inputDirIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> NearOptions.fromProperties(new Properties()));
    }
}
