package com.nearpipe.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Valores que el pipeline consume del proveedor de configuracion. */
public class InstrumentConfig {
    public final int cpuCount;
    public final double pixelScale;
    public final List<AttributeSpec> attributes;
    public final MissingKeyPolicy missingKeyPolicy;

    public InstrumentConfig(int cpuCount, double pixelScale, List<AttributeSpec> attributes, MissingKeyPolicy missingKeyPolicy) {
        if (cpuCount < 1) throw new IllegalArgumentException("CPU count should be at least 1, got " + cpuCount);
        this.cpuCount = cpuCount;
        this.pixelScale = pixelScale;
        this.attributes = Collections.unmodifiableList(new ArrayList<>(attributes));
        this.missingKeyPolicy = missingKeyPolicy;
    }

    /** Atributos de un tipo; con {@code checkAll=false} solo los marcados como requeridos. */
    public List<AttributeSpec> select(AttributeSpec.Kind kind, boolean checkAll) {
        List<AttributeSpec> out = new ArrayList<>();
        for (AttributeSpec a : attributes) {
            if (a.kind != kind) continue;
            if (!checkAll && !a.required) continue;
            out.add(a);
        }
        return out;
    }
}
