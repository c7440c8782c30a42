package com.nearpipe.service;

import com.nearpipe.model.CompositeHeader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.Cursor;

/**
 * Conversion entre {@link Header} de nom.tam.fits y mapas clave -> valor.
 * Las claves HIERARCH se devuelven en forma ESO con espacios ("ESO SEQ NODPOS").
 */
public final class FitsHeaders {

    private static final String HIERARCH = "HIERARCH";
    private static final Set<String> COMMENTARY = new HashSet<>(Arrays.asList("COMMENT", "HISTORY", "END", "CONTINUE"));

    private FitsHeaders() {}

    public static String normalizeKey(String key) {
        String k = key.trim();
        if (k.length() > HIERARCH.length() && k.startsWith(HIERARCH)
                && (k.charAt(HIERARCH.length()) == '.' || k.charAt(HIERARCH.length()) == ' ')) {
            k = k.substring(HIERARCH.length() + 1).replace('.', ' ').trim();
        }
        return k;
    }

    /** Forma que acepta {@link Header#addValue} para una clave larga. */
    public static String hierarchKey(String key) {
        return HIERARCH + "." + key.trim().replace(' ', '.');
    }

    public static Map<String, Object> toMap(Header header) {
        Map<String, Object> map = new LinkedHashMap<>();
        Cursor<String, HeaderCard> it = header.iterator();
        while (it.hasNext()) {
            HeaderCard card = it.next();
            String key = card.getKey();
            if (key == null || key.trim().isEmpty() || COMMENTARY.contains(key.trim())) continue;
            String raw = card.getValue();
            if (raw == null) continue;
            Object value = card.isStringValue() ? raw : CompositeHeader.valueOf(raw);
            map.put(normalizeKey(key), value);
        }
        return map;
    }

    public static List<String> history(Header header) {
        List<String> lines = new ArrayList<>();
        Cursor<String, HeaderCard> it = header.iterator();
        while (it.hasNext()) {
            HeaderCard card = it.next();
            if ("HISTORY".equals(card.getKey()) && card.getComment() != null) {
                lines.add(card.getComment().trim());
            }
        }
        return lines;
    }
}
