package com.shoplytic.rag.service;

import com.shoplytic.rag.config.RagConfig;
import com.google.genai.Client;
import com.google.genai.types.ContentEmbedding;
import com.google.genai.types.EmbedContentResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * Embeds search queries with the Vertex AI text embedding model.
 * Query embeddings are cached in Redis when a template is available.
 */
@Slf4j
@Service
public class EmbeddingService {

    private static final String QUERY_CACHE_PREFIX = "query_embedding:";

    private final Client client;
    private final RagConfig ragConfig;
    @Nullable
    private final RedisTemplate<String, Object> redisTemplate;
    private final String embeddingModel;

    @Autowired
    public EmbeddingService(
            RagConfig ragConfig,
            @Autowired(required = false) @Nullable RedisTemplate<String, Object> redisTemplate,
            @Value("${vertex.ai.project-id:}") String projectId,
            @Value("${vertex.ai.location:us-central1}") String location) {
        this(ragConfig, redisTemplate, createClient(projectId, location));
    }

    EmbeddingService(RagConfig ragConfig, @Nullable RedisTemplate<String, Object> redisTemplate,
                     @Nullable Client client) {
        this.ragConfig = ragConfig;
        this.redisTemplate = redisTemplate;
        this.embeddingModel = ragConfig.getEmbedding().getModel();
        this.client = client;

        if (redisTemplate == null) {
            log.warn("Redis not available - query embedding caching disabled");
        }
    }

    private static Client createClient(String projectId, String location) {
        if (projectId == null || projectId.isBlank()) {
            log.warn("Vertex AI not configured for embeddings - projectId is empty");
            return null;
        }
        Client client = Client.builder()
                .project(projectId)
                .location(location)
                .vertexAI(true)
                .build();
        log.info("Initialized embedding client: project={}, location={}", projectId, location);
        return client;
    }

    /**
     * @throws RetrievalException when no client is configured or the call fails
     */
    public List<Float> embedQuery(String query) {
        if (client == null) {
            throw new RetrievalException("Embedding client is not configured");
        }

        String cacheKey = QUERY_CACHE_PREFIX + embeddingModel + ":"
                + UUID.nameUUIDFromBytes(query.getBytes(StandardCharsets.UTF_8));
        if (redisTemplate != null) {
            List<Float> cached = readCache(cacheKey);
            if (cached != null) {
                log.debug("Cache hit for query embedding");
                return cached;
            }
        }

        EmbedContentResponse response;
        try {
            response = client.models.embedContent(embeddingModel, query, null);
        } catch (RuntimeException e) {
            throw new RetrievalException("Embedding request failed: " + e.getMessage(), e);
        }

        List<Float> embedding = response.embeddings()
                .filter(list -> !list.isEmpty())
                .map(list -> list.get(0))
                .flatMap(ContentEmbedding::values)
                .orElse(List.of());
        if (embedding.isEmpty()) {
            throw new RetrievalException("Embedding response contained no values");
        }

        if (redisTemplate != null) {
            writeCache(cacheKey, embedding);
        }
        return embedding;
    }

    @SuppressWarnings("unchecked")
    private List<Float> readCache(String key) {
        try {
            Object cached = redisTemplate.opsForValue().get(key);
            if (cached instanceof List<?> values) {
                // Redis JSON deserializes numbers as Double
                return ((List<Number>) values).stream().map(Number::floatValue).toList();
            }
        } catch (RuntimeException e) {
            log.warn("Embedding cache read failed: {}", e.getMessage());
        }
        return null;
    }

    private void writeCache(String key, List<Float> embedding) {
        try {
            redisTemplate.opsForValue().set(key, embedding, ragConfig.getCache().getQueryEmbeddingTtl());
        } catch (RuntimeException e) {
            log.warn("Embedding cache write failed: {}", e.getMessage());
        }
    }

    public boolean isAvailable() {
        return client != null && ragConfig.isEnabled();
    }
}
