package com.openforge.docrouter.memory;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Calls the /embeddings endpoint with the shared HttpClient and Jackson.
 * Only present when the Milvus similarity lookup is enabled.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "docrouter.milvus.enabled", havingValue = "true")
public class EmbeddingClient {

    private static final int MAX_INPUT_CHARS = 8000;

    private final HttpClient          httpClient;
    private final ObjectMapper        objectMapper;
    private final EmbeddingProperties props;

    public EmbeddingClient(HttpClient httpClient,
                           ObjectMapper objectMapper,
                           EmbeddingProperties props) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.props        = props;
    }

    /**
     * @return float vector of {@link EmbeddingProperties#dimensions()} elements
     * @throws EmbeddingException on transport, HTTP or parse failure
     */
    public List<Float> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot embed blank text");
        }
        String input = text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) : text;

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(props.baseUrl() + "/embeddings"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + props.apiKey())
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(
                        serialize(new Request(input, props.model(), props.dimensions()))))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted calling embedding API", e);
        } catch (IOException e) {
            throw new EmbeddingException("Network error calling embedding API", e);
        }

        int status = response.statusCode();
        if (status == 429) throw new EmbeddingException("Embedding API rate-limited");
        if (status < 200 || status >= 300) {
            throw new EmbeddingException("Embedding API returned HTTP %d: %s".formatted(status, response.body()));
        }
        try {
            List<Float> vector = objectMapper.readValue(response.body(), Response.class).firstEmbedding();
            log.debug("[Embed] model={} input-length={} dim={}", props.model(), input.length(), vector.size());
            return vector;
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to parse embedding response", e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to serialize embedding request", e);
        }
    }

    // ── Wire format ──────────────────────────────────────────────────────────

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Request(String input, String model, Integer dimensions) {}

    record Response(List<Data> data, String model) {

        List<Float> firstEmbedding() {
            if (data == null || data.isEmpty()) {
                throw new EmbeddingException("Embedding response contained no data");
            }
            return data.get(0).embedding();
        }

        record Data(int index, List<Float> embedding) {}
    }

    public static class EmbeddingException extends RuntimeException {
        public EmbeddingException(String message) { super(message); }
        public EmbeddingException(String message, Throwable cause) { super(message, cause); }
    }
}
