package ai.batch.translator.config;

import ai.batch.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments, environment values and the
 * stored config file.
 */
public record Config(
        Mode mode,
        LogFormat logFormat,
        TranslationMode translationMode,
        Path workDir,
        Path configFile,
        boolean saveConfig,
        Optional<Path> inputFile,
        Optional<Path> sourceFile,
        Optional<Path> outputFile,
        Optional<IdRange> idRange,
        TranslatorConfig translatorConfig
) {

    public Config {
        Objects.requireNonNull(mode, "mode");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        Objects.requireNonNull(translationMode, "translationMode");
        workDir = Objects.requireNonNull(workDir, "workDir").toAbsolutePath().normalize();
        Objects.requireNonNull(configFile, "configFile");
        inputFile = inputFile == null ? Optional.empty() : inputFile;
        sourceFile = sourceFile == null ? Optional.empty() : sourceFile;
        outputFile = outputFile == null ? Optional.empty() : outputFile;
        idRange = idRange == null ? Optional.empty() : idRange;
        Objects.requireNonNull(translatorConfig, "translatorConfig");

        switch (mode) {
            case TRANSLATE -> requirePresent(inputFile, "--file is required in translate mode");
            case AUDIT -> {
                requirePresent(inputFile, "--file is required in audit mode");
                requirePresent(sourceFile, "--source is required in audit mode");
            }
            case EXTRACT -> {
                requirePresent(inputFile, "--file is required in extract mode");
                requirePresent(outputFile, "--output is required in extract mode");
                requirePresent(idRange, "--from-id and --to-id are required in extract mode");
            }
            case MODELS -> {
            }
        }
    }

    private static void requirePresent(Optional<?> value, String message) {
        if (value.isEmpty()) {
            throw new IllegalArgumentException(message);
        }
    }
}
