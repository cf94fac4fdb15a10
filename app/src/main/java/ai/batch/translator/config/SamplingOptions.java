package ai.batch.translator.config;

import java.util.Optional;

/**
 * Optional sampling parameters forwarded to the chat-completion endpoint. Absent values are not sent.
 */
public record SamplingOptions(Optional<Double> temperature,
                              Optional<Integer> maxTokens,
                              Optional<Double> topP,
                              Optional<Integer> topK) {

    public SamplingOptions {
        temperature = temperature == null ? Optional.empty() : temperature;
        maxTokens = maxTokens == null ? Optional.empty() : maxTokens;
        topP = topP == null ? Optional.empty() : topP;
        topK = topK == null ? Optional.empty() : topK;
        maxTokens.filter(value -> value < 1).ifPresent(value -> {
            throw new IllegalArgumentException("maxTokens must be at least 1");
        });
    }

    public static SamplingOptions none() {
        return new SamplingOptions(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }
}
