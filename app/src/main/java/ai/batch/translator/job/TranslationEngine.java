package ai.batch.translator.job;

import ai.batch.translator.config.TranslatorConfig;
import ai.batch.translator.progress.ProgressEvent;
import ai.batch.translator.progress.ProgressReporter;
import ai.batch.translator.translate.Translator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the batch-translation core: {@link #start} runs one job to completion on the calling thread and
 * {@link #stop} cancels it from any other thread. At most one job runs at a time.
 */
public class TranslationEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationEngine.class);

    private final TranslatorSource translatorSource;
    private final ProgressReporter reporter;
    private final WorkspacePaths paths;
    private final RateLimiter rateLimiter;
    private final AtomicReference<CancellationSignal> activeSignal = new AtomicReference<>();

    public TranslationEngine(TranslatorSource translatorSource, ProgressReporter reporter, WorkspacePaths paths) {
        this(translatorSource, reporter, paths, new RateLimiter());
    }

    TranslationEngine(TranslatorSource translatorSource,
                      ProgressReporter reporter,
                      WorkspacePaths paths,
                      RateLimiter rateLimiter) {
        this.translatorSource = Objects.requireNonNull(translatorSource, "translatorSource");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.paths = Objects.requireNonNull(paths, "paths");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
    }

    /**
     * Translates {@code inputFile} and blocks until every dispatched batch has finished.
     *
     * @throws IOException if the input file cannot be read; no batch is dispatched in that case
     * @throws IllegalStateException if another job is running, or a worker failed unexpectedly
     */
    public JobOutcome start(TranslatorConfig config, Path inputFile) throws IOException {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(inputFile, "inputFile");
        CancellationSignal signal = new CancellationSignal();
        if (!activeSignal.compareAndSet(null, signal)) {
            throw new IllegalStateException("A translation job is already running");
        }
        try {
            String content = Files.readString(inputFile, StandardCharsets.UTF_8);
            PartitionResult partition = new LinePartitioner(config.batchSize()).partition(content);
            Translator translator = translatorSource.create(config);
            LOGGER.debug("Starting job for {} with {}", inputFile, config);
            return new TranslationJob(partition, config, translator, rateLimiter, signal, reporter, paths).run();
        } finally {
            activeSignal.compareAndSet(signal, null);
        }
    }

    /**
     * Requests cancellation of the running job. Returns {@code false} when no job is running.
     */
    public boolean stop() {
        CancellationSignal signal = activeSignal.get();
        if (signal == null) {
            return false;
        }
        if (signal.requestStop()) {
            LOGGER.info("Stop requested");
            reporter.report(ProgressEvent.aggregate(0, 0, "Stopped."));
        }
        return true;
    }

    public boolean isRunning() {
        return activeSignal.get() != null;
    }
}
