package com.nearpipe.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Header compuesto de un fichero de exposicion: header general + header del primer frame
 * + dimensiones del cubo. Solo lectura una vez construido.
 *
 * Los valores se guardan normalizados: String, Boolean, Long o Double.
 */
public class CompositeHeader {

    private static final String SEPARATOR = " = ";

    private final Map<String, Object> cards;

    public CompositeHeader(Map<String, Object> cards) {
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : cards.entrySet()) {
            copy.put(e.getKey(), normalize(e.getValue()));
        }
        this.cards = Collections.unmodifiableMap(copy);
    }

    public boolean containsKey(String key) { return cards.containsKey(key); }

    public Object get(String key) { return cards.get(key); }

    public Set<String> keys() { return cards.keySet(); }

    /** Volcado "CLAVE = valor" en el orden del header. */
    public List<String> toCardLines() {
        List<String> lines = new ArrayList<>(cards.size());
        for (Map.Entry<String, Object> e : cards.entrySet()) {
            lines.add(e.getKey() + SEPARATOR + formatValue(e.getValue()));
        }
        return lines;
    }

    public static CompositeHeader fromCardLines(List<String> lines) {
        LinkedHashMap<String, Object> parsed = new LinkedHashMap<>();
        for (String line : lines) {
            int idx = line.indexOf(SEPARATOR);
            if (idx <= 0) throw new IllegalArgumentException("Malformed header line: " + line);
            String key = line.substring(0, idx);
            String raw = line.substring(idx + SEPARATOR.length());
            parsed.put(key, parseFormatted(raw));
        }
        return new CompositeHeader(parsed);
    }

    // --- FORMATO DE VALORES ---

    static String formatValue(Object v) {
        if (v == null) return "''";
        if (v instanceof Boolean) return ((Boolean) v) ? "T" : "F";
        if (v instanceof Long || v instanceof Double) return v.toString();
        return "'" + v.toString().replace("'", "''") + "'";
    }

    static Object parseFormatted(String raw) {
        if (raw.length() >= 2 && raw.startsWith("'") && raw.endsWith("'")) {
            return raw.substring(1, raw.length() - 1).replace("''", "'");
        }
        return valueOf(raw);
    }

    /**
     * Interpreta un valor FITS sin comillas: T/F, entero o real (admite exponente D).
     * Si no es nada de eso se devuelve el texto tal cual.
     */
    public static Object valueOf(String raw) {
        if (raw == null) return null;
        String v = raw.trim();
        if (v.equals("T")) return Boolean.TRUE;
        if (v.equals("F")) return Boolean.FALSE;
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException ignored) {
            // no es entero, probamos real
        }
        try {
            return Double.parseDouble(v.replace('D', 'E').replace('d', 'e'));
        } catch (NumberFormatException ignored) {
            return v;
        }
    }

    static Object normalize(Object v) {
        if (v instanceof Integer || v instanceof Short || v instanceof Byte) return ((Number) v).longValue();
        if (v instanceof Float) return ((Float) v).doubleValue();
        if (v == null || v instanceof Boolean || v instanceof Long || v instanceof Double) return v;
        return v.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompositeHeader)) return false;
        CompositeHeader other = (CompositeHeader) o;
        return new ArrayList<>(cards.entrySet()).equals(new ArrayList<>(other.cards.entrySet()));
    }

    @Override
    public int hashCode() { return cards.hashCode(); }
}
