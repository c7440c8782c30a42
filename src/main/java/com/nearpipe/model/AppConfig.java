package com.nearpipe.model;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.prefs.Preferences;

public class AppConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    // Claves de preferencias
    private static final String KEY_CPU = "cpu";
    private static final String KEY_SCALE = "pixel_scale";
    private static final String KEY_MISSING_POLICY = "missing_key_policy";

    private static final String ATTRIBUTE_TABLE = "/near-attributes.properties";

    // VISIR (modo NEAR): 0.045"/px
    private static final double DEFAULT_PIXEL_SCALE = 0.045;

    // --- GETTERS & SETTERS ---
    public static int getCpuCount() { return prefs.getInt(KEY_CPU, Runtime.getRuntime().availableProcessors()); }
    public static void setCpuCount(int v) { prefs.putInt(KEY_CPU, v); }

    public static double getPixelScale() { return prefs.getDouble(KEY_SCALE, DEFAULT_PIXEL_SCALE); }
    public static void setPixelScale(double v) { prefs.putDouble(KEY_SCALE, v); }

    public static MissingKeyPolicy getMissingKeyPolicy() {
        return MissingKeyPolicy.valueOf(prefs.get(KEY_MISSING_POLICY, MissingKeyPolicy.LAST_FILE_ONLY.name()));
    }
    public static void setMissingKeyPolicy(MissingKeyPolicy v) { prefs.put(KEY_MISSING_POLICY, v.name()); }

    // --- TABLA DE ATRIBUTOS ---
    public static List<AttributeSpec> getAttributeTable() throws IOException {
        try (InputStream in = AppConfig.class.getResourceAsStream(ATTRIBUTE_TABLE)) {
            if (in == null) throw new IOException("Attribute table not found on classpath: " + ATTRIBUTE_TABLE);
            return AttributeSpec.loadTable(in);
        }
    }

    public static InstrumentConfig instrumentConfig() throws IOException {
        return new InstrumentConfig(getCpuCount(), getPixelScale(), getAttributeTable(), getMissingKeyPolicy());
    }
}
