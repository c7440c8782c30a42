package com.nearpipe.service;

import static com.nearpipe.NearPipeline.LOGGER;

import com.nearpipe.model.Burst;
import com.nearpipe.model.InstrumentConfig;
import com.nearpipe.model.NearOptions;
import com.nearpipe.model.NodScheme;
import com.nearpipe.model.PipelineState;
import com.nearpipe.model.RawExposure;
import com.nearpipe.model.RunSummary;
import com.nearpipe.model.StreamKey;
import com.nearpipe.store.DataStore;
import com.nearpipe.store.FrameStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

/**
 * Lee los ficheros burst de VISIR (modo NEAR) de un directorio y reparte sus frames
 * en cuatro streams segun la posicion de nod y de chop:
 * nod A / chop A, nod A / chop B, nod B / chop A y nod B / chop B.
 *
 * <p>Los ficheros se procesan de uno en uno en orden lexicografico; ese orden fija la
 * inferencia de nod cuando falta ESO SEQ NODPOS y el contador global INDEX.
 */
public class NearInitializationPipeline {
    private static final Marker IT = MarkerManager.getMarker(NearInitializationPipeline.class.getSimpleName());

    public static final String INPUT_SUFFIX = ".fits";
    public static final String HEADER_STREAM_PREFIX = "fits_header/";

    private final NearOptions options;
    private final InstrumentConfig config;
    private final DataStore store;
    private final ExposureReader reader;
    private final CommandRunner commandRunner;

    private PipelineState state = PipelineState.UNINITIALIZED;
    private NodScheme scheme;
    private OutputRouter router;
    private Diagnostics diagnostics;
    private long firstIndex;
    private RunContext context;

    public NearInitializationPipeline(NearOptions options, InstrumentConfig config, DataStore store) {
        this(options, config, store, new FitsExposureReader(), new ProcessCommandRunner());
    }

    public NearInitializationPipeline(NearOptions options, InstrumentConfig config, DataStore store,
                                      ExposureReader reader, CommandRunner commandRunner) {
        this.options = options;
        this.config = config;
        this.store = store;
        this.reader = reader;
        this.commandRunner = commandRunner;
    }

    public PipelineState state() { return state; }

    /** Contexto de la ultima ejecucion (tambien si abortó), o null si no ha empezado a procesar. */
    public RunContext context() { return context; }

    public OutputRouter router() { return router; }

    public RunSummary run() throws IOException, PipelineException {
        initialize();

        state = PipelineState.DECOMPRESSING;
        new DecompressionScheduler(config.cpuCount, commandRunner).uncompress(options.inputDir);

        List<Path> files = listInputFiles(options.inputDir);
        if (files.isEmpty()) throw new PipelineException("No FITS files found in " + options.inputDir);

        state = PipelineState.PROCESSING;
        context = new RunContext(diagnostics, files.size(), firstIndex);
        HeaderComposer composer = new HeaderComposer(scheme);
        FrameClassifier classifier = new FrameClassifier();
        AttributeAccumulator attributes = new AttributeAccumulator(config, options.check);

        LOGGER.info(IT, "Procesando {} ficheros de {} (esquema {}, check={})", files.size(), options.inputDir, scheme, options.check);
        for (int i = 0; i < files.size(); i++) {
            context.beginFile(i);
            processFile(files.get(i), composer, classifier, attributes);
            LOGGER.info(IT, "[{}/{}] {}", i + 1, files.size(), files.get(i).getFileName());
        }

        state = PipelineState.FINALIZING;
        router.finish();
        state = PipelineState.DONE;

        return new RunSummary(files.size(), context.framesIndexed(), router.frameCounts(), new ArrayList<>(context.diagnostics.all()));
    }

    /** Uninitialized -> Validated: nombres distintos, esquema valido, flags definidos. */
    void initialize() throws IOException {
        if (state != PipelineState.UNINITIALIZED) throw new IllegalStateException("Pipeline already ran (state " + state + ")");

        EnumMap<StreamKey, String> names = new EnumMap<>(StreamKey.class);
        for (StreamKey key : StreamKey.values()) names.put(key, options.tag(key));
        OutputRouter.validateNames(names);

        scheme = NodScheme.parse(options.scheme);
        if (options.check == null) throw new IllegalArgumentException("Check flag should be set to 'true' or 'false'");
        if (options.overwrite == null) throw new IllegalArgumentException("Overwrite flag should be set to 'true' or 'false'");
        if (options.inputDir == null || !Files.isDirectory(options.inputDir)) {
            throw new IllegalArgumentException("Input directory does not exist: " + options.inputDir);
        }

        diagnostics = new Diagnostics();
        router = new OutputRouter(store, names);
        if (options.overwrite) {
            router.clearAll();
        } else {
            // anexando: el INDEX global continua tras el mayor ya persistido
            router.resumeAll();
            firstIndex = router.nextIndex();
            router.reportResumedStreams(diagnostics, firstIndex);
        }
        state = PipelineState.VALIDATED;
    }

    static List<Path> listInputFiles(Path dir) throws IOException {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(INPUT_SUFFIX))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }

    private void processFile(Path file, HeaderComposer composer, FrameClassifier classifier,
                             AttributeAccumulator attributes) throws IOException {
        RawExposure exposure = reader.read(file);
        if (exposure.frameCount() == 0) throw new IOException("File " + file + " contains no frames");

        int[] dims = FrameClassifier.dimensions(exposure.frames.get(0).kernel);
        HeaderComposer.Result composed = composer.compose(exposure.fileName, exposure.primaryHeader,
                exposure.frames.get(0).header, dims[0], dims[1], exposure.frameCount(), context.fileIndex(), context);

        Burst burst = classifier.classify(exposure, composed.header, composed.nod, context);
        store.putText(HEADER_STREAM_PREFIX + exposure.fileName, burst.header.toCardLines());

        EnumMap<StreamKey, FrameStream> touched = router.route(burst);
        attributes.applyStatic(touched, burst.header, exposure.fileName, context);
        attributes.applyNonStatic(touched, burst, context);
        attributes.recordExtra(touched, burst, file, context);

        if (context.isLastFile()) router.reportEmptyStreams(context.diagnostics);
        router.flush(burst.nod);
    }
}
