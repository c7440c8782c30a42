package com.nearpipe.service;

import java.io.IOException;
import java.util.List;

public interface CommandRunner {
    /**
     * Ejecuta el comando y espera a que termine.
     * @return codigo de salida
     * @throws IOException si el comando no se puede arrancar (p.ej. no esta instalado)
     */
    int run(List<String> command) throws IOException, InterruptedException;
}
