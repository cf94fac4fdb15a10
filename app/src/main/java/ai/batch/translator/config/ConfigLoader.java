package ai.batch.translator.config;

import ai.batch.translator.cli.CliArguments;
import ai.batch.translator.translate.TranslationMode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments, environment variables, the stored config file and
 * defaults, in that order of precedence.
 */
public class ConfigLoader {

    static final String ENV_BASE_URL = "TRANSLATOR_BASE_URL";
    static final String ENV_API_KEY = "TRANSLATOR_API_KEY";
    static final String ENV_MODEL = "TRANSLATOR_MODEL";
    static final String ENV_THREADS = "TRANSLATOR_THREADS";
    static final String ENV_BATCH_SIZE = "TRANSLATOR_BATCH_SIZE";
    static final String ENV_DELAY = "TRANSLATOR_DELAY";
    static final String ENV_WORK_DIR = "TRANSLATOR_WORK_DIR";
    static final String ENV_TRANSLATION_MODE = "TRANSLATION_MODE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    static final String DEFAULT_BASE_URL = "https://api.mistral.ai/v1";
    static final String DEFAULT_MODEL = "mistral-large-latest";
    static final double DEFAULT_TEMPERATURE = 0.2;
    static final int DEFAULT_MAX_TOKENS = 4096;
    static final double DEFAULT_TOP_P = 1.0;
    static final boolean DEFAULT_STREAM = true;
    static final int DEFAULT_THREADS = 1;
    static final int DEFAULT_BATCH_SIZE = 50;
    static final double DEFAULT_DELAY_SECONDS = 1.3;
    static final long DEFAULT_RETRY_BACKOFF_MILLIS = 1000;
    static final String DEFAULT_SYSTEM_PROMPT = """
            # ROLE: Master of Game Localization (English to Vietnamese)

            # CONTEXT: Game translation, Vietnamese language.

            ## 1. TRANSCREATION & STYLE (THE 'SMOOTH' FACTOR):
            - TRANSLATE NATURALLY: DO NOT TRANSLATE WORD-FOR-WORD. Rewrite the sentence so that it sounds natural, like standard Vietnamese.
            - EVOCATIVE PROSE: Use rich, sharp, and mysterious vocabulary fitting for a dying world. Avoid passive voice (e.g., 'Bị/Được') unless necessary.
            - CONTEXTUAL ADAPTATION: If a sentence is an idiom or joke, replace it with a Vietnamese equivalent that carries the same vibe.

            ## 2. PRONOUNS & VIBE:
            - Choose the appropriate personal pronoun depending on the context and gender.
            - Character Voice: A child should sound innocent, a general should sound stern, and a villain should sound menacing.

            ## 3. FINAL EXECUTION:
            Translate ALL lines, without omitting anything. Make the translation smooth, impressive, and engaging. Start now.""";

    private final EnvironmentReader environmentReader;
    private final ConfigFileStore configFileStore;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this(environmentReader, new ConfigFileStore());
    }

    public ConfigLoader(EnvironmentReader environmentReader, ConfigFileStore configFileStore) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
        this.configFileStore = Objects.requireNonNull(configFileStore, "configFileStore");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Mode mode = arguments.mode() != null ? arguments.mode() : Mode.TRANSLATE;
        TranslationMode translationMode = resolveTranslationMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        Path workDir = Optional.ofNullable(arguments.workDir())
                .or(() -> environmentReader.get(ENV_WORK_DIR).filter(ConfigLoader::isNotBlank).map(String::trim).map(Path::of))
                .orElse(Path.of("."));
        Path configFile = arguments.configFile() != null ? arguments.configFile() : workDir.resolve("config.json");
        StoredSettings stored = configFileStore.load(configFile).orElse(StoredSettings.empty());

        String baseUrl = firstNonBlank(arguments.baseUrl(), ENV_BASE_URL, stored.baseUrl(), DEFAULT_BASE_URL);
        String apiKey = environmentReader.get(ENV_API_KEY)
                .filter(ConfigLoader::isNotBlank)
                .or(() -> Optional.ofNullable(stored.apiKey()).filter(ConfigLoader::isNotBlank))
                .orElse("");
        String model = firstNonBlank(arguments.model(), ENV_MODEL, stored.model(), DEFAULT_MODEL);
        String systemPrompt = resolveSystemPrompt(arguments.systemPromptFile(), stored.systemPrompt());

        SamplingOptions sampling = new SamplingOptions(
                first(arguments.temperature(), stored.temperature()).or(() -> Optional.of(DEFAULT_TEMPERATURE)),
                first(arguments.maxTokens(), stored.maxTokens()).or(() -> Optional.of(DEFAULT_MAX_TOKENS)),
                first(arguments.topP(), stored.topP()).or(() -> Optional.of(DEFAULT_TOP_P)),
                first(arguments.topK(), stored.topK()).filter(value -> value > 0));

        boolean stream = first(arguments.stream(), stored.stream()).orElse(DEFAULT_STREAM);
        int threads = Optional.ofNullable(arguments.threads())
                .or(() -> environmentReader.get(ENV_THREADS).filter(ConfigLoader::isNotBlank)
                        .map(raw -> parsePositiveInteger(raw, ENV_THREADS)))
                .or(() -> Optional.ofNullable(stored.threads()))
                .orElse(DEFAULT_THREADS);
        int batchSize = Optional.ofNullable(arguments.batchSize())
                .or(() -> environmentReader.get(ENV_BATCH_SIZE).filter(ConfigLoader::isNotBlank)
                        .map(raw -> parsePositiveInteger(raw, ENV_BATCH_SIZE)))
                .or(() -> Optional.ofNullable(stored.batchSize()))
                .orElse(DEFAULT_BATCH_SIZE);
        double delay = Optional.ofNullable(arguments.delay())
                .or(() -> environmentReader.get(ENV_DELAY).filter(ConfigLoader::isNotBlank)
                        .map(raw -> parseDouble(raw, ENV_DELAY)))
                .or(() -> Optional.ofNullable(stored.delay()))
                .orElse(DEFAULT_DELAY_SECONDS);
        long retryBackoffMillis = Optional.ofNullable(arguments.retryBackoffMillis())
                .orElse(DEFAULT_RETRY_BACKOFF_MILLIS);
        if (retryBackoffMillis < 0) {
            throw new IllegalArgumentException("--retry-backoff-millis must be zero or greater");
        }

        TranslatorConfig translatorConfig = new TranslatorConfig(baseUrl, apiKey, model, systemPrompt, sampling, stream,
                threads, batchSize, delay, Duration.ofMillis(retryBackoffMillis));

        Optional<Path> inputFile = Optional.ofNullable(arguments.file());
        if (inputFile.isEmpty() && mode == Mode.TRANSLATE) {
            inputFile = Optional.ofNullable(stored.lastFile()).filter(ConfigLoader::isNotBlank).map(Path::of);
        }
        Optional<IdRange> idRange = resolveIdRange(arguments);

        boolean needsKey = mode == Mode.MODELS
                || (mode == Mode.TRANSLATE && translationMode == TranslationMode.PRODUCTION);
        if (needsKey && !translatorConfig.hasApiKey()) {
            throw new IllegalStateException(ENV_API_KEY + " (or api_key in " + configFile
                    + ") must be provided unless running in dry-run or mock mode");
        }

        return new Config(mode, logFormat, translationMode, workDir, configFile, arguments.saveConfig(), inputFile,
                Optional.ofNullable(arguments.source()), Optional.ofNullable(arguments.output()), idRange,
                translatorConfig);
    }

    private TranslationMode resolveTranslationMode(CliArguments arguments) {
        TranslationMode cliMode = arguments.translationMode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_TRANSLATION_MODE)
                .filter(ConfigLoader::isNotBlank)
                .map(TranslationMode::from)
                .orElse(TranslationMode.PRODUCTION);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private static String resolveSystemPrompt(Path promptFile, String storedPrompt) {
        if (promptFile != null) {
            try {
                return Files.readString(promptFile, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to read system prompt file: " + promptFile, ex);
            }
        }
        return isNotBlank(storedPrompt) ? storedPrompt : DEFAULT_SYSTEM_PROMPT;
    }

    private static Optional<IdRange> resolveIdRange(CliArguments arguments) {
        Long from = arguments.fromId();
        Long to = arguments.toId();
        if (from == null && to == null) {
            return Optional.empty();
        }
        if (from == null || to == null) {
            throw new IllegalArgumentException("--from-id and --to-id must be given together");
        }
        return Optional.of(new IdRange(from, to));
    }

    private String firstNonBlank(String cliValue, String envKey, String storedValue, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .or(() -> Optional.ofNullable(storedValue).filter(ConfigLoader::isNotBlank))
                .orElse(defaultValue);
    }

    private static <T> Optional<T> first(T cliValue, T storedValue) {
        return Optional.ofNullable(cliValue).or(() -> Optional.ofNullable(storedValue));
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static int parsePositiveInteger(String raw, String key) {
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 1) {
                throw new IllegalArgumentException(key + " must be at least 1");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static double parseDouble(String raw, String key) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be a number: " + raw, ex);
        }
    }
}
