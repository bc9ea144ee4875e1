package com.openforge.docrouter.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * OpenAI-compatible embedding endpoint used by the Milvus similarity lookup.
 *
 * docrouter:
 *   embedding:
 *     base-url: https://api.openai.com/v1
 *     api-key: ${EMBEDDING_API_KEY:sk-placeholder}
 *     model: text-embedding-3-small
 *     dimensions: 1536
 *     timeout-seconds: 10
 */
@ConfigurationProperties(prefix = "docrouter.embedding")
public record EmbeddingProperties(
        @DefaultValue("https://api.openai.com/v1") String baseUrl,
        String apiKey,
        @DefaultValue("text-embedding-3-small") String model,
        @DefaultValue("1536") int dimensions,
        @DefaultValue("10")   int timeoutSeconds
) {}
