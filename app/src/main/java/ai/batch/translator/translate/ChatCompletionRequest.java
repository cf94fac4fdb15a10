package ai.batch.translator.translate;

import ai.batch.translator.config.SamplingOptions;
import ai.batch.translator.config.TranslatorConfig;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/**
 * Body of {@code POST /chat/completions}. Unset sampling parameters are left out of the payload.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatCompletionRequest(
        @JsonProperty("model") String model,
        @JsonProperty("messages") List<ChatMessage> messages,
        @JsonProperty("stream") boolean stream,
        @JsonProperty("temperature") Double temperature,
        @JsonProperty("max_tokens") Integer maxTokens,
        @JsonProperty("top_p") Double topP,
        @JsonProperty("top_k") Integer topK
) {

    static final String FORMAT_REMINDER = "REMINDER: Format 'ID:::TranslatedText'.";

    public ChatCompletionRequest {
        Objects.requireNonNull(model, "model");
        messages = List.copyOf(Objects.requireNonNull(messages, "messages"));
    }

    public static ChatCompletionRequest forBatch(TranslatorConfig config, List<String> sourceLines) {
        String userContent = String.join("\n", sourceLines) + "\n\n" + FORMAT_REMINDER;
        SamplingOptions sampling = config.sampling();
        return new ChatCompletionRequest(
                config.model(),
                List.of(ChatMessage.system(config.systemPrompt()), ChatMessage.user(userContent)),
                config.stream(),
                sampling.temperature().orElse(null),
                sampling.maxTokens().orElse(null),
                sampling.topP().orElse(null),
                sampling.topK().orElse(null));
    }
}
