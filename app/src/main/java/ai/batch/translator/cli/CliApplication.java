package ai.batch.translator.cli;

import ai.batch.translator.audit.AuditReport;
import ai.batch.translator.audit.IdRangeExtractor;
import ai.batch.translator.audit.TranslationAuditor;
import ai.batch.translator.config.Config;
import ai.batch.translator.config.ConfigFileStore;
import ai.batch.translator.config.ConfigLoader;
import ai.batch.translator.config.StoredSettings;
import ai.batch.translator.config.SystemEnvironmentReader;
import ai.batch.translator.config.TranslatorConfig;
import ai.batch.translator.job.JobOutcome;
import ai.batch.translator.job.TranslationEngine;
import ai.batch.translator.job.WorkspacePaths;
import ai.batch.translator.logging.LoggingConfigurator;
import ai.batch.translator.models.ModelCatalogClient;
import ai.batch.translator.progress.LoggingProgressReporter;
import ai.batch.translator.progress.ProgressReporter;
import ai.batch.translator.translate.TranslationException;
import ai.batch.translator.translate.TranslatorFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and the selected operation.
 */
public final class CliApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CANCELLED = 130;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final ConfigLoader configLoader;
    private final ConfigFileStore configFileStore;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ProgressReporter progressReporter;

    public CliApplication() {
        this(new ObjectMapper());
    }

    private CliApplication(ObjectMapper objectMapper) {
        this(new ConfigLoader(new SystemEnvironmentReader(), new ConfigFileStore(objectMapper)),
                new ConfigFileStore(objectMapper),
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build(),
                objectMapper,
                new LoggingProgressReporter());
    }

    CliApplication(ConfigLoader configLoader,
                   ConfigFileStore configFileStore,
                   HttpClient httpClient,
                   ObjectMapper objectMapper,
                   ProgressReporter progressReporter) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.configFileStore = Objects.requireNonNull(configFileStore, "configFileStore");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.progressReporter = Objects.requireNonNull(progressReporter, "progressReporter");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException | UncheckedIOException ex) {
            commandLine.getErr().println(ex.getMessage());
            return EXIT_FAILURE;
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Running in {} mode (translationMode={}, workDir={})",
                config.mode(), config.translationMode(), config.workDir());

        try {
            return switch (config.mode()) {
                case TRANSLATE -> translate(config);
                case MODELS -> listModels(config, commandLine.getOut());
                case AUDIT -> audit(config);
                case EXTRACT -> extract(config);
            };
        } catch (IOException | UncheckedIOException ex) {
            LOGGER.error("I/O failure: {}", ex.getMessage());
            return EXIT_FAILURE;
        } catch (TranslationException | IllegalStateException ex) {
            LOGGER.error("{}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private int translate(Config config) throws IOException {
        Path inputFile = config.inputFile().orElseThrow();
        TranslatorConfig translatorConfig = config.translatorConfig();
        Files.createDirectories(config.workDir());
        if (config.saveConfig()) {
            configFileStore.save(config.configFile(),
                    StoredSettings.from(translatorConfig, inputFile.toAbsolutePath().toString()));
        }

        TranslatorFactory factory = new TranslatorFactory(httpClient, objectMapper);
        TranslationEngine engine = new TranslationEngine(
                jobConfig -> factory.select(config.translationMode(), jobConfig),
                progressReporter,
                new WorkspacePaths(config.workDir()));

        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> stopOnShutdown(engine, finished), "translator-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        JobOutcome outcome;
        try {
            outcome = engine.start(translatorConfig, inputFile);
        } finally {
            finished.countDown();
            removeShutdownHook(shutdownHook);
        }

        LOGGER.info("Job {}: {}/{} batches, {} lines", outcome.status(), outcome.completedBatches(),
                outcome.totalBatches(), outcome.lineCount());
        return outcome.isCompleted() ? EXIT_OK : EXIT_CANCELLED;
    }

    private int listModels(Config config, PrintWriter out) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        List<String> models = new ModelCatalogClient(httpClient, objectMapper)
                .listModels(translatorConfig.baseUrl(), translatorConfig.apiKey());
        models.forEach(out::println);
        out.flush();
        LOGGER.info("{} models available at {}", models.size(), translatorConfig.baseUrl());
        return EXIT_OK;
    }

    private int audit(Config config) throws IOException {
        Path translated = config.inputFile().orElseThrow();
        Path source = config.sourceFile().orElseThrow();
        AuditReport report = new TranslationAuditor().audit(translated, source);
        if (report.firstId() == null) {
            LOGGER.warn("{} contains no numbered lines", translated);
            return EXIT_OK;
        }
        LOGGER.info("ID range: {} -> {}", report.firstId(), report.lastId());
        for (AuditReport.IdGap gap : report.gaps()) {
            if (gap.size() == 1) {
                LOGGER.warn("Missing ID: {}", gap.fromId());
            } else {
                LOGGER.warn("Missing IDs {}-{} ({} IDs)", gap.fromId(), gap.toId(), gap.size());
            }
        }
        for (AuditReport.SuspiciousLine line : report.suspicious()) {
            LOGGER.warn("ID {} looks untranslated: source='{}' translated='{}'", line.id(),
                    abbreviate(line.sourceText()), abbreviate(line.translatedText()));
        }
        LOGGER.info("{} missing IDs, {} suspicious lines", report.missingIdCount(), report.suspicious().size());
        return EXIT_OK;
    }

    private int extract(Config config) throws IOException {
        new IdRangeExtractor().extract(config.inputFile().orElseThrow(), config.outputFile().orElseThrow(),
                config.idRange().orElseThrow());
        return EXIT_OK;
    }

    private static void stopOnShutdown(TranslationEngine engine, CountDownLatch finished) {
        if (!engine.stop()) {
            return;
        }
        try {
            if (!finished.await(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Workers did not finish within {}s", SHUTDOWN_GRACE.toSeconds());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException ex) {
            LOGGER.debug("JVM shutdown in progress; keeping shutdown hook");
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 50 ? text : text.substring(0, 50) + "...";
    }
}
