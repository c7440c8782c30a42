package com.nearpipe.service;

import static com.nearpipe.NearPipeline.LOGGER;

import com.nearpipe.model.Diagnostic;
import com.nearpipe.model.Diagnostic.Code;
import com.nearpipe.model.Diagnostic.Severity;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

/**
 * Acumula los avisos no fatales de una ejecucion (y alguna nota informativa). Cada entrada tambien se loguea.
 */
public class Diagnostics {
    private static final Marker IT = MarkerManager.getMarker(Diagnostics.class.getSimpleName());

    private final List<Diagnostic> entries = new ArrayList<>();

    public Diagnostic warn(Code code, String context) {
        return report(Severity.WARNING, code, context);
    }

    public Diagnostic info(Code code, String context) {
        return report(Severity.INFO, code, context);
    }

    public Diagnostic report(Severity severity, Code code, String context) {
        Diagnostic d = new Diagnostic(severity, code, context);
        entries.add(d);
        if (severity == Severity.WARNING) LOGGER.warn(IT, "{}: {}", code, context);
        else LOGGER.info(IT, "{}: {}", code, context);
        return d;
    }

    public List<Diagnostic> all() { return Collections.unmodifiableList(entries); }

    public List<Diagnostic> of(Code code) {
        List<Diagnostic> out = new ArrayList<>();
        for (Diagnostic d : entries) if (d.code == code) out.add(d);
        return out;
    }

    public int count(Code code) { return of(code).size(); }
}
