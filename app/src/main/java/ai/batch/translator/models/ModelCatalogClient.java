package ai.batch.translator.models;

import ai.batch.translator.translate.TranslationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the model IDs offered by an OpenAI-compatible endpoint.
 */
public class ModelCatalogClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModelCatalogClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public ModelCatalogClient(HttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Returns the sorted model IDs. Accepts both {@code {"data":[{"id":..}]}} and a bare {@code [{"id":..}]} array.
     */
    public List<String> listModels(String baseUrl, String apiKey) {
        String url = stripTrailingSlashes(Objects.requireNonNull(baseUrl, "baseUrl")) + "/models";
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .header("Authorization", "Bearer " + (apiKey == null ? "" : apiKey))
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new TranslationException("Request to " + url + " failed: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TranslationException("Request interrupted", ex);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new TranslationException("Failed to fetch models: " + response.statusCode());
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (JsonProcessingException ex) {
            throw new TranslationException("Unreadable model list: " + ex.getOriginalMessage(), ex);
        }
        JsonNode entries = root.has("data") ? root.get("data") : root;
        List<String> models = new ArrayList<>();
        if (entries.isArray()) {
            for (JsonNode entry : entries) {
                JsonNode id = entry.path("id");
                if (id.isTextual()) {
                    models.add(id.asText());
                }
            }
        }
        Collections.sort(models);
        LOGGER.debug("Fetched {} models from {}", models.size(), url);
        return models;
    }

    private static String stripTrailingSlashes(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
