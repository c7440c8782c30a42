package com.nearpipe.model;

/** Cuando avisar de una clave estatica que falta en el header. */
public enum MissingKeyPolicy {
    LAST_FILE_ONLY,
    EVERY_FILE
}
