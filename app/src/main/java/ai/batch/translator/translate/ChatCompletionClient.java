package ai.batch.translator.translate;

import ai.batch.translator.config.TranslatorConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translator backed by an OpenAI-compatible {@code /chat/completions} endpoint.
 *
 * <p>In streaming mode every decoded fragment is forwarded to the listener as it arrives; in non-streaming mode
 * the listener is told how many characters arrived. Either way the returned lines are produced by
 * {@link TranslationMapper}.
 */
public class ChatCompletionClient implements Translator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatCompletionClient.class);
    private static final int READ_CHUNK_SIZE = 8192;

    private final TranslatorConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TranslationMapper mapper;

    public ChatCompletionClient(TranslatorConfig config, HttpClient httpClient, ObjectMapper objectMapper) {
        this(config, httpClient, objectMapper, new TranslationMapper());
    }

    ChatCompletionClient(TranslatorConfig config,
                         HttpClient httpClient,
                         ObjectMapper objectMapper,
                         TranslationMapper mapper) {
        this.config = Objects.requireNonNull(config, "config");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public List<String> translate(List<String> sourceLines, TranslationListener listener) {
        if (sourceLines == null || sourceLines.isEmpty()) {
            return List.of();
        }
        TranslationListener target = listener == null ? TranslationListener.NONE : listener;
        HttpRequest request = buildRequest(ChatCompletionRequest.forBatch(config, sourceLines));
        String content;
        try {
            content = config.stream() ? sendStreaming(request, target) : sendBuffered(request, target);
        } catch (IOException ex) {
            throw new TranslationException("Request to " + config.chatCompletionsUrl() + " failed: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TranslationException("Request interrupted", ex);
        }
        return mapper.map(sourceLines, content);
    }

    private HttpRequest buildRequest(ChatCompletionRequest body) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException ex) {
            throw new TranslationException("Failed to encode request body", ex);
        }
        return HttpRequest.newBuilder(URI.create(config.chatCompletionsUrl()))
                .header("Authorization", "Bearer " + config.apiKey())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
                .build();
    }

    private String sendBuffered(HttpRequest request, TranslationListener listener)
            throws IOException, InterruptedException {
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        requireSuccess(response.statusCode());
        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (JsonProcessingException ex) {
            throw new TranslationException("Unreadable response body: " + ex.getOriginalMessage(), ex);
        }
        JsonNode contentNode = root.path("choices").path(0).path("message").path("content");
        if (!contentNode.isTextual()) {
            LOGGER.warn("Response carried no message content; keeping source lines");
            return "";
        }
        String content = contentNode.asText();
        listener.onReceived(content.length());
        return content;
    }

    private String sendStreaming(HttpRequest request, TranslationListener listener)
            throws IOException, InterruptedException {
        HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        try (InputStream body = response.body()) {
            requireSuccess(response.statusCode());
            StreamingResponseDecoder decoder = new StreamingResponseDecoder(objectMapper, listener::onFragment);
            byte[] buffer = new byte[READ_CHUNK_SIZE];
            int read;
            while (!decoder.isDone() && (read = body.read(buffer)) != -1) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Streaming read interrupted");
                }
                decoder.feed(buffer, 0, read);
            }
            return decoder.finish();
        }
    }

    private static void requireSuccess(int statusCode) {
        if (statusCode < 200 || statusCode >= 300) {
            throw new TranslationException("API Status: " + statusCode);
        }
    }
}
