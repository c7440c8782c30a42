package com.nearpipe.model;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Opciones de construccion del modulo de inicializacion NEAR.
 * Los flags son {@link Boolean} para poder detectar valores ausentes al validar.
 */
public class NearOptions {
    public Path inputDir;
    public Path outputDir;

    public String tagNodAChopA = "noda_chopa";
    public String tagNodAChopB = "noda_chopb";
    public String tagNodBChopA = "nodb_chopa";
    public String tagNodBChopB = "nodb_chopb";

    public String scheme = "ABBA";
    public Boolean check = Boolean.TRUE;
    public Boolean overwrite = Boolean.TRUE;

    public String tag(StreamKey key) {
        switch (key) {
            case NOD_A_CHOP_A: return tagNodAChopA;
            case NOD_A_CHOP_B: return tagNodAChopB;
            case NOD_B_CHOP_A: return tagNodBChopA;
            default: return tagNodBChopB;
        }
    }

    public static NearOptions fromProperties(Properties p) {
        NearOptions o = new NearOptions();
        String in = p.getProperty("input.dir");
        if (in == null || in.trim().isEmpty()) throw new IllegalArgumentException("input.dir is required");
        o.inputDir = Paths.get(in.trim());
        String out = p.getProperty("output.dir");
        if (out != null && !out.trim().isEmpty()) o.outputDir = Paths.get(out.trim());

        o.tagNodAChopA = p.getProperty("tag.noda_chopa", o.tagNodAChopA).trim();
        o.tagNodAChopB = p.getProperty("tag.noda_chopb", o.tagNodAChopB).trim();
        o.tagNodBChopA = p.getProperty("tag.nodb_chopa", o.tagNodBChopA).trim();
        o.tagNodBChopB = p.getProperty("tag.nodb_chopb", o.tagNodBChopB).trim();
        o.scheme = p.getProperty("scheme", o.scheme).trim();
        o.check = parseFlag("check", p.getProperty("check"), o.check);
        o.overwrite = parseFlag("overwrite", p.getProperty("overwrite"), o.overwrite);
        return o;
    }

    static Boolean parseFlag(String name, String raw, Boolean def) {
        if (raw == null) return def;
        String v = raw.trim();
        if (v.equalsIgnoreCase("true")) return Boolean.TRUE;
        if (v.equalsIgnoreCase("false")) return Boolean.FALSE;
        throw new IllegalArgumentException(name + " should be set to 'true' or 'false', got '" + raw + "'");
    }
}
