package com.nearpipe.main;

import static com.nearpipe.NearPipeline.LOGGER;

import com.nearpipe.NearPipeline;
import com.nearpipe.model.AppConfig;
import com.nearpipe.model.NearOptions;
import com.nearpipe.model.RunSummary;
import com.nearpipe.model.StreamKey;
import com.nearpipe.service.NearInitializationPipeline;
import com.nearpipe.service.PipelineException;
import com.nearpipe.store.FitsDataStore;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

public class NearPipelineApp {
    private static final Marker IT = MarkerManager.getMarker(NearPipelineApp.class.getSimpleName());

    public static void main(String[] args) {
        if (args.length != 1) {
            System.err.println("Uso: " + NearPipeline.ID + " <run.properties>");
            System.exit(2);
        }
        try {
            Properties props = new Properties();
            try (Reader r = Files.newBufferedReader(Paths.get(args[0]), StandardCharsets.UTF_8)) {
                props.load(r);
            }
            NearOptions options = NearOptions.fromProperties(props);
            Path out = options.outputDir != null ? options.outputDir : options.inputDir.resolve("near_out");
            LOGGER.info(IT, "{}: {} -> {}", NearPipeline.NAME, options.inputDir, out);

            RunSummary summary = new NearInitializationPipeline(options, AppConfig.instrumentConfig(), new FitsDataStore(out)).run();

            LOGGER.info(IT, "{} ficheros, {} frames indexados, {} avisos", summary.filesProcessed, summary.framesIndexed, summary.diagnostics.size());
            for (StreamKey key : StreamKey.values()) {
                LOGGER.info(IT, "  {} -> {}: {} frames", key.provenanceLabel(), options.tag(key), summary.framesPerStream.get(key));
            }
        } catch (IllegalArgumentException e) {
            LOGGER.error(IT, "Configuracion invalida: {}", e.getMessage());
            System.exit(2);
        } catch (IOException | PipelineException e) {
            LOGGER.error(IT, "Ejecucion abortada: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
