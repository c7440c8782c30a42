package com.nearpipe.model;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.TreeSet;

/**
 * Entrada de la tabla de atributos, resuelta una sola vez al arrancar.
 * El origen es una clave del header FITS o "no aplica" (valor None en la tabla).
 */
public class AttributeSpec {

    public enum Kind { STATIC, NON_STATIC }

    public static class Source {
        private static final Source NOT_APPLICABLE = new Source(null);
        private final String headerKey;

        private Source(String headerKey) { this.headerKey = headerKey; }

        public static Source fromHeaderKey(String key) {
            if (key == null || key.isEmpty()) throw new IllegalArgumentException("Header key is empty");
            return new Source(key);
        }

        public static Source notApplicable() { return NOT_APPLICABLE; }

        public boolean isApplicable() { return headerKey != null; }

        public String headerKey() { return headerKey; }

        @Override
        public String toString() { return isApplicable() ? headerKey : "None"; }
    }

    private static final String NOT_APPLICABLE = "None";

    public final String name;
    public final Kind kind;
    public final Source source;
    public final boolean required;

    public AttributeSpec(String name, Kind kind, Source source, boolean required) {
        this.name = name;
        this.kind = kind;
        this.source = source;
        this.required = required;
    }

    /** Formato: {@code tipo | clave FITS | requerido}, p.ej. {@code static | ESO DET SEQ1 DIT | true}. */
    public static AttributeSpec parse(String name, String definition) {
        String[] parts = definition.split("\\|");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Attribute " + name + " should be 'kind | key | required', got: " + definition);
        }
        String kindText = parts[0].trim();
        Kind kind;
        if (kindText.equals("static")) kind = Kind.STATIC;
        else if (kindText.equals("non-static")) kind = Kind.NON_STATIC;
        else throw new IllegalArgumentException("Unknown attribute kind for " + name + ": " + kindText);

        String key = parts[1].trim();
        Source source = key.equals(NOT_APPLICABLE) ? Source.notApplicable() : Source.fromHeaderKey(key);

        String req = parts[2].trim();
        if (!req.equals("true") && !req.equals("false")) {
            throw new IllegalArgumentException("Required flag for " + name + " should be 'true' or 'false', got: " + req);
        }
        return new AttributeSpec(name, kind, source, Boolean.parseBoolean(req));
    }

    /** Carga la tabla completa, ordenada por nombre para que el recorrido sea determinista. */
    public static List<AttributeSpec> loadTable(InputStream in) throws IOException {
        Properties props = new Properties();
        props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        List<AttributeSpec> table = new ArrayList<>();
        for (String name : new TreeSet<>(props.stringPropertyNames())) {
            table.add(parse(name, props.getProperty(name)));
        }
        return table;
    }

    @Override
    public String toString() {
        return name + "(" + kind + ", " + source + (required ? ", required" : "") + ")";
    }
}
