package com.nearpipe.service;

import static com.nearpipe.NearPipeline.LOGGER;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

/**
 * Descomprime en el sitio los ficheros {@code .fits.Z} del directorio de entrada.
 * Los ficheros se reparten en lotes del tamano del presupuesto de CPUs; cada lote
 * se ejecuta en paralelo y se espera a que termine entero antes de lanzar el siguiente.
 */
public class DecompressionScheduler {
    private static final Marker IT = MarkerManager.getMarker(DecompressionScheduler.class.getSimpleName());

    public static final String COMPRESSED_SUFFIX = ".fits.Z";

    private final int workers;
    private final CommandRunner runner;

    public DecompressionScheduler(int workers, CommandRunner runner) {
        if (workers < 1) throw new IllegalArgumentException("Worker count should be at least 1, got " + workers);
        this.workers = workers;
        this.runner = runner;
    }

    public List<Path> findCompressed(Path dir) throws IOException {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(p -> p.getFileName().toString().endsWith(COMPRESSED_SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    public List<List<Path>> batches(List<Path> files) {
        List<List<Path>> out = new ArrayList<>();
        for (int i = 0; i < files.size(); i += workers) {
            out.add(Collections.unmodifiableList(new ArrayList<>(files.subList(i, Math.min(i + workers, files.size())))));
        }
        return out;
    }

    /** @return numero de ficheros descomprimidos */
    public int uncompress(Path dir) throws IOException, PipelineException {
        List<Path> compressed = findCompressed(dir);
        if (compressed.isEmpty()) return 0;

        List<List<Path>> batches = batches(compressed);
        LOGGER.info(IT, "Descomprimiendo {} ficheros en {} lotes de hasta {}", compressed.size(), batches.size(), workers);

        ExecutorService exec = Executors.newFixedThreadPool(workers);
        try {
            int b = 0;
            for (List<Path> batch : batches) {
                List<Callable<Void>> tasks = new ArrayList<>(batch.size());
                for (Path file : batch) {
                    tasks.add(() -> {
                        uncompressOne(file);
                        return null;
                    });
                }
                // invokeAll bloquea hasta que todo el lote ha terminado
                List<Future<Void>> results = exec.invokeAll(tasks);
                for (int i = 0; i < results.size(); i++) {
                    try {
                        results.get(i).get();
                    } catch (ExecutionException e) {
                        throw new PipelineException("Could not uncompress " + batch.get(i), e.getCause());
                    }
                }
                LOGGER.info(IT, "Lote {}/{} descomprimido", ++b, batches.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("Interrupted while uncompressing input files", e);
        } finally {
            exec.shutdownNow();
        }
        return compressed.size();
    }

    void uncompressOne(Path file) throws IOException, InterruptedException {
        List<String> primary = Arrays.asList("uncompress", file.toString());
        int code;
        try {
            code = runner.run(primary);
        } catch (IOException notInstalled) {
            // Sin 'uncompress' en el sistema: gunzip tambien entiende .Z
            LOGGER.debug(IT, "uncompress no disponible ({}), usando gunzip", notInstalled.getMessage());
            List<String> fallback = Arrays.asList("gunzip", "-d", file.toString());
            code = runner.run(fallback);
        }
        if (code != 0) throw new IOException("Decompression of " + file + " exited with code " + code);
    }
}
