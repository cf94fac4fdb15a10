package ai.batch.translator.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * On-disk shape of {@code config.json}. Every field is optional; missing values fall back to defaults.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoredSettings(
        @JsonProperty("base_url") String baseUrl,
        @JsonProperty("api_key") String apiKey,
        @JsonProperty("model") String model,
        @JsonProperty("system_prompt") String systemPrompt,
        @JsonProperty("temperature") Double temperature,
        @JsonProperty("max_tokens") Integer maxTokens,
        @JsonProperty("top_p") Double topP,
        @JsonProperty("top_k") Integer topK,
        @JsonProperty("stream") Boolean stream,
        @JsonProperty("threads") Integer threads,
        @JsonProperty("batch_size") Integer batchSize,
        @JsonProperty("delay") Double delay,
        @JsonProperty("last_file") String lastFile
) {

    public static StoredSettings empty() {
        return new StoredSettings(null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public static StoredSettings from(TranslatorConfig config, String lastFile) {
        SamplingOptions sampling = config.sampling();
        return new StoredSettings(
                config.baseUrl(),
                config.apiKey().isEmpty() ? null : config.apiKey(),
                config.model(),
                config.systemPrompt(),
                sampling.temperature().orElse(null),
                sampling.maxTokens().orElse(null),
                sampling.topP().orElse(null),
                sampling.topK().orElse(null),
                config.stream(),
                config.threads(),
                config.batchSize(),
                config.delaySeconds(),
                lastFile);
    }
}
