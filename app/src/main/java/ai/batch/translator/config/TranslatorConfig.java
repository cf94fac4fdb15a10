package ai.batch.translator.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of one translation job. Immutable and shared read-only by every worker of the job.
 */
public record TranslatorConfig(
        String baseUrl,
        String apiKey,
        String model,
        String systemPrompt,
        SamplingOptions sampling,
        boolean stream,
        int threads,
        int batchSize,
        double delaySeconds,
        Duration retryBackoff
) {

    public TranslatorConfig {
        baseUrl = normalizeBaseUrl(requireNonBlank(baseUrl, "baseUrl"));
        apiKey = apiKey == null ? "" : apiKey.trim();
        model = requireNonBlank(model, "model");
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        sampling = sampling == null ? SamplingOptions.none() : sampling;
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1");
        }
        batchSize = Math.max(1, batchSize);
        if (Double.isNaN(delaySeconds) || delaySeconds < 0) {
            throw new IllegalArgumentException("delaySeconds must be zero or greater");
        }
        retryBackoff = Objects.requireNonNull(retryBackoff, "retryBackoff");
        if (retryBackoff.isNegative()) {
            throw new IllegalArgumentException("retryBackoff must not be negative");
        }
    }

    /**
     * Minimum spacing between two request dispatches; zero disables pacing.
     */
    public Duration pacingDelay() {
        return Duration.ofNanos(Math.round(delaySeconds * 1_000_000_000d));
    }

    public String chatCompletionsUrl() {
        return baseUrl + "/chat/completions";
    }

    public boolean hasApiKey() {
        return !apiKey.isEmpty();
    }

    @Override
    public String toString() {
        return "TranslatorConfig[baseUrl=" + baseUrl
                + ", apiKey=" + (hasApiKey() ? "****" : "<none>")
                + ", model=" + model
                + ", sampling=" + sampling
                + ", stream=" + stream
                + ", threads=" + threads
                + ", batchSize=" + batchSize
                + ", delaySeconds=" + delaySeconds
                + ", retryBackoff=" + retryBackoff + "]";
    }

    private static String normalizeBaseUrl(String url) {
        String normalized = url.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
