package com.nearpipe.store;

import java.io.IOException;
import java.util.List;

/**
 * Base de datos de salida: streams de frames con nombre y streams de texto auxiliares.
 */
public interface DataStore {

    /** Abre (o crea) el stream con ese nombre. Dos llamadas con el mismo nombre devuelven el mismo stream. */
    FrameStream open(String name) throws IOException;

    void putText(String name, List<String> lines) throws IOException;

    /** @return las lineas guardadas, o null si no existe */
    List<String> getText(String name) throws IOException;
}
