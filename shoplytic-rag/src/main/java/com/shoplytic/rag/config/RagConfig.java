package com.shoplytic.rag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for retrieval.
 * Maps to shoplytic.rag.* properties in application.properties.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "shoplytic.rag")
public class RagConfig {

    private boolean enabled = true;

    private Embedding embedding = new Embedding();
    private VectorSearch vectorSearch = new VectorSearch();
    private Index handbook = new Index();
    private Index products = new Index();
    private Cache cache = new Cache();

    @Data
    public static class Embedding {
        /** Vertex AI embedding model */
        private String model = "text-embedding-004";
    }

    @Data
    public static class VectorSearch {
        /** Public endpoint host for queries, e.g. 123456.us-central1-xxx.vdb.vertexai.goog */
        private String apiEndpoint;
    }

    @Data
    public static class Index {
        /** Index endpoint resource name */
        private String indexEndpoint;
        /** Deployed index id within the endpoint */
        private String deployedIndexId;
    }

    @Data
    public static class Cache {
        private Duration queryEmbeddingTtl = Duration.ofHours(1);
    }

    public Index indexFor(VectorCollection collection) {
        return switch (collection) {
            case HANDBOOK -> handbook;
            case PRODUCTS -> products;
        };
    }
}
