package ai.batch.translator.cli;

import ai.batch.translator.config.LogFormat;
import ai.batch.translator.config.Mode;
import ai.batch.translator.translate.TranslationMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "ai-batch-translator", mixinStandardHelpOptions = true,
        description = "Translates ID:::Text line files through an OpenAI-compatible chat-completion API")
public class CliArguments {

    @CommandLine.Option(names = "--mode", converter = ModeConverter.class, description = "Operation: translate, models, audit or extract")
    private Mode mode;

    @CommandLine.Option(names = "--file", description = "Input file (translate, audit, extract)", paramLabel = "FILE")
    private Path file;

    @CommandLine.Option(names = "--source", description = "Untranslated source file to audit against", paramLabel = "FILE")
    private Path source;

    @CommandLine.Option(names = "--output", description = "Output file for extract mode", paramLabel = "FILE")
    private Path output;

    @CommandLine.Option(names = "--from-id", description = "First ID to extract (inclusive)", paramLabel = "ID")
    private Long fromId;

    @CommandLine.Option(names = "--to-id", description = "Last ID to extract (inclusive)", paramLabel = "ID")
    private Long toId;

    @CommandLine.Option(names = "--base-url", description = "Base URL of the OpenAI-compatible API", paramLabel = "URL")
    private String baseUrl;

    @CommandLine.Option(names = "--model", description = "Model name", paramLabel = "MODEL")
    private String model;

    @CommandLine.Option(names = "--system-prompt-file", description = "File holding the system prompt", paramLabel = "FILE")
    private Path systemPromptFile;

    @CommandLine.Option(names = "--temperature", description = "Sampling temperature", paramLabel = "VALUE")
    private Double temperature;

    @CommandLine.Option(names = "--max-tokens", description = "Maximum tokens per completion", paramLabel = "COUNT")
    private Integer maxTokens;

    @CommandLine.Option(names = "--top-p", description = "Nucleus sampling probability", paramLabel = "VALUE")
    private Double topP;

    @CommandLine.Option(names = "--top-k", description = "Top-k sampling", paramLabel = "COUNT")
    private Integer topK;

    @CommandLine.Option(names = "--stream", negatable = true, description = "Request streaming completions")
    private Boolean stream;

    @CommandLine.Option(names = "--threads", description = "Number of batches in flight at once", paramLabel = "COUNT")
    private Integer threads;

    @CommandLine.Option(names = "--batch-size", description = "Lines per request", paramLabel = "COUNT")
    private Integer batchSize;

    @CommandLine.Option(names = "--delay", description = "Minimum seconds between request dispatches", paramLabel = "SECONDS")
    private Double delay;

    @CommandLine.Option(names = "--retry-backoff-millis", description = "Pause between attempts of a failed batch", paramLabel = "MILLIS")
    private Long retryBackoffMillis;

    @CommandLine.Option(names = "--work-dir", description = "Directory for config, snapshot, worker log and output files", paramLabel = "DIR")
    private Path workDir;

    @CommandLine.Option(names = "--config-file", description = "Settings file (defaults to config.json in the work directory)", paramLabel = "FILE")
    private Path configFile;

    @CommandLine.Option(names = "--save-config", description = "Persist the resolved settings to the config file")
    private boolean saveConfig;

    @CommandLine.Option(names = "--translation-mode", description = "Translation execution mode: production, dry-run, or mock", converter = TranslationModeConverter.class)
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Mode mode() {
        return mode;
    }

    public Path file() {
        return file;
    }

    public Path source() {
        return source;
    }

    public Path output() {
        return output;
    }

    public Long fromId() {
        return fromId;
    }

    public Long toId() {
        return toId;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public String model() {
        return model;
    }

    public Path systemPromptFile() {
        return systemPromptFile;
    }

    public Double temperature() {
        return temperature;
    }

    public Integer maxTokens() {
        return maxTokens;
    }

    public Double topP() {
        return topP;
    }

    public Integer topK() {
        return topK;
    }

    public Boolean stream() {
        return stream;
    }

    public Integer threads() {
        return threads;
    }

    public Integer batchSize() {
        return batchSize;
    }

    public Double delay() {
        return delay;
    }

    public Long retryBackoffMillis() {
        return retryBackoffMillis;
    }

    public Path workDir() {
        return workDir;
    }

    public Path configFile() {
        return configFile;
    }

    public boolean saveConfig() {
        return saveConfig;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
