package com.nearpipe.model;

import ij.ImageStack;
import java.util.Collections;
import java.util.List;

/**
 * Frames de un fichero ya clasificados en chop A / chop B, con su nod y su header.
 * Solo vive mientras se procesa ese fichero.
 */
public class Burst {
    public final String fileName;
    public final CompositeHeader header;
    public final Nod nod;
    public final ImageStack chopA;
    public final ImageStack chopB;
    public final List<Chop> acquisitionOrder; // chop de cada frame clasificado, en orden de adquisicion
    public final int droppedFrames;

    public Burst(String fileName, CompositeHeader header, Nod nod, ImageStack chopA, ImageStack chopB,
                 List<Chop> acquisitionOrder, int droppedFrames) {
        this.fileName = fileName;
        this.header = header;
        this.nod = nod;
        this.chopA = chopA;
        this.chopB = chopB;
        this.acquisitionOrder = Collections.unmodifiableList(acquisitionOrder);
        this.droppedFrames = droppedFrames;
    }

    public ImageStack stack(Chop chop) {
        return chop == Chop.A ? chopA : chopB;
    }

    public int count(Chop chop) {
        return stack(chop).getSize();
    }

    public int classifiedCount() {
        return acquisitionOrder.size();
    }
}
