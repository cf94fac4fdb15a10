package ai.batch.translator.translate;

import ai.batch.translator.config.TranslatorConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.util.Objects;

/**
 * Provides translator instances based on the desired execution mode.
 */
public class TranslatorFactory {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Translator dryRunTranslator;
    private final Translator mockTranslator;

    public TranslatorFactory(HttpClient httpClient, ObjectMapper objectMapper) {
        this(httpClient, objectMapper, new PassThroughTranslator(), new MockTranslator());
    }

    public TranslatorFactory(HttpClient httpClient,
                             ObjectMapper objectMapper,
                             Translator dryRunTranslator,
                             Translator mockTranslator) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.dryRunTranslator = Objects.requireNonNull(dryRunTranslator, "dryRunTranslator");
        this.mockTranslator = Objects.requireNonNull(mockTranslator, "mockTranslator");
    }

    public Translator select(TranslationMode mode, TranslatorConfig config) {
        return switch (mode) {
            case PRODUCTION -> new ChatCompletionClient(config, httpClient, objectMapper);
            case DRY_RUN -> dryRunTranslator;
            case MOCK -> mockTranslator;
        };
    }
}
