package com.quire.runner;

import com.quire.config.QuireConfig;
import com.quire.document.Notebook;
import com.quire.document.load.LocalNotebookRepository;
import com.quire.document.load.NotebookSink;
import com.quire.document.load.NotebookSource;
import com.quire.engine.EngineOptions;
import com.quire.engine.EngineRegistry;
import com.quire.parameterize.BuiltinParameters;
import com.quire.parameterize.ParameterInjector;
import com.quire.parameterize.ParameterInspector;
import com.quire.parameterize.PathTemplates;
import com.quire.parameterize.TranslatorParameterInspector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs one notebook end to end: load, inject parameters, record run metadata, clear stale error
 * markers, execute through the engine registry, mark and raise the first failure, persist.
 * <p>
 * A failing cell raises {@link NotebookExecutionException} after the marked notebook has been saved.
 * Engine failures ({@code NoSuchEngineException}, {@code EngineExecutionException}) propagate without
 * the final save.
 */
public final class NotebookRunner {

    private static final Logger log = LoggerFactory.getLogger(NotebookRunner.class);

    private final EngineRegistry engines;
    private final NotebookSource source;
    private final NotebookSink sink;
    private final ParameterInspector inspector;
    private final ParameterInjector injector;
    private final int ioRetries;

    public NotebookRunner(EngineRegistry engines, NotebookSource source, NotebookSink sink,
                          ParameterInspector inspector, ParameterInjector injector, QuireConfig config) {
        this.engines = Objects.requireNonNull(engines, "engines");
        this.source = Objects.requireNonNull(source, "source");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.inspector = Objects.requireNonNull(inspector, "inspector");
        this.injector = Objects.requireNonNull(injector, "injector");
        this.ioRetries = Objects.requireNonNull(config, "config").getIoRetries();
    }

    /** Local files, the shared engine registry, translator-based inspection and environment config. */
    public static NotebookRunner withDefaults() {
        LocalNotebookRepository repository = new LocalNotebookRepository();
        return new NotebookRunner(EngineRegistry.getInstance(), repository, repository,
                new TranslatorParameterInspector(), new ParameterInjector(), QuireConfig.fromEnvironment());
    }

    /**
     * @return the executed (or, with {@code prepareOnly}, prepared) notebook
     * @throws NotebookExecutionException when a cell failed; the marked notebook is already saved
     */
    public Notebook execute(ExecutionRequest request) {
        Objects.requireNonNull(request, "request");
        Map<String, Object> parameters = request.getParameters();

        Map<String, Object> pathParameters = BuiltinParameters.add(parameters);
        String inputPath = PathTemplates.resolve(request.getInputPath(), pathParameters);
        String outputPath = PathTemplates.resolve(request.getOutputPath(), pathParameters);

        log.info("Input Notebook:  {}", inputPath);
        if (outputPath == null) {
            log.info("Output Notebook: not persisted");
        } else {
            log.info("Output Notebook: {}", outputPath);
        }
        if (request.getCwd() != null) {
            log.info("Working directory: {}", request.getCwd());
        }

        Notebook notebook = Retry.call(ioRetries, () -> source.load(inputPath));

        if (!parameters.isEmpty()) {
            Set<String> declared = inspector.inferDeclaredParameters(
                    notebook, request.getKernelName(), request.getLanguage());
            for (String name : ParameterInjector.unknownParameters(declared, parameters)) {
                log.warn("Passed unknown parameter: {}", name);
            }
            injector.inject(notebook, parameters, request.isReportMode(),
                    request.isObfuscateSensitiveParameters(), request.getSensitiveParameterPatterns(),
                    request.getLanguage());
        }

        prepareMetadata(notebook, inputPath, outputPath, request.isReportMode());
        ErrorMarkers.clear(notebook);

        if (!request.isPrepareOnly()) {
            notebook = run(notebook, request, inputPath, outputPath);
            ExecutionErrors.raiseForExecutionErrors(notebook, outputPath, sink);
        }

        if (outputPath != null) {
            sink.store(notebook, outputPath);
        }
        return notebook;
    }

    private Notebook run(Notebook notebook, ExecutionRequest request, String inputPath, String outputPath) {
        String engineName = request.getEngineName();
        String kernelName = engines.resolveKernelName(engineName, notebook, request.getKernelName());
        log.debug("Executing with engine={} kernel={}", engineName != null ? engineName : engines.getDefaultEngineName(),
                kernelName);

        EngineOptions options = EngineOptions.builder()
                .inputPath(inputPath)
                .outputPath(request.isRequestSaveOnCellExecute() ? outputPath : null)
                .sink(sink)
                .kernelName(kernelName)
                .progressBar(request.isProgressBar())
                .logOutput(request.isLogOutput())
                .startTimeout(Duration.ofSeconds(request.getStartTimeout()))
                .executionTimeout(request.getExecutionTimeout() != null
                        ? Duration.ofSeconds(request.getExecutionTimeout()) : null)
                .stdoutFile(request.getStdoutFile())
                .stderrFile(request.getStderrFile())
                .cwd(request.getCwd())
                .autosaveInterval(Duration.ofSeconds(request.getAutosaveCellEvery()))
                .extras(request.getExtras())
                .build();

        try (WorkingDirectory ignored = request.getCwd() != null ? WorkingDirectory.enter(request.getCwd()) : null) {
            return engines.execute(engineName, notebook, options);
        }
    }

    private static void prepareMetadata(Notebook notebook, String inputPath, String outputPath, boolean reportMode) {
        Map<String, Object> ns = notebook.namespace();
        ns.put(Notebook.INPUT_PATH, inputPath);
        ns.put(Notebook.OUTPUT_PATH, outputPath);
        if (reportMode) {
            ParameterInjector.hideCodeSources(notebook);
        }
    }
}
