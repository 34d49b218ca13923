package com.shoplytic.rag.service;

import com.shoplytic.rag.config.RagConfig;
import com.shoplytic.rag.config.VectorCollection;
import com.shoplytic.rag.dto.Neighbor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.auth.oauth2.GoogleCredentials;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.*;

/**
 * Queries Vertex AI Vector Search over REST.
 * <p>
 * Each datapoint carries its text in {@code embedding_metadata.content};
 * the remaining metadata fields and the categorical restricts become the
 * document metadata. Neighbors are returned closest first.
 */
@Slf4j
@Service
public class VectorSearchService {

    private static final String CONTENT_FIELD = "content";

    private final RagConfig ragConfig;
    private final EmbeddingService embeddingService;
    private final ObjectMapper objectMapper;
    private final RestTemplate restTemplate;
    private GoogleCredentials credentials;
    private String apiHost;

    public VectorSearchService(RagConfig ragConfig, EmbeddingService embeddingService, ObjectMapper objectMapper) {
        this.ragConfig = ragConfig;
        this.embeddingService = embeddingService;
        this.objectMapper = objectMapper;
        this.restTemplate = new RestTemplate();

        initializeClient();
    }

    private void initializeClient() {
        String apiEndpoint = ragConfig.getVectorSearch().getApiEndpoint();
        if (apiEndpoint == null || apiEndpoint.isBlank()) {
            log.warn("Vector Search API endpoint not configured");
            return;
        }

        try {
            credentials = GoogleCredentials.getApplicationDefault()
                    .createScoped("https://www.googleapis.com/auth/cloud-platform");
            apiHost = apiEndpoint.contains(":")
                    ? apiEndpoint.substring(0, apiEndpoint.indexOf(':'))
                    : apiEndpoint;
            log.info("Initialized Vector Search REST client: host={}", apiHost);
        } catch (IOException e) {
            log.error("Failed to initialize Vector Search client: {}", e.getMessage());
        }
    }

    /**
     * Finds the {@code k} nearest documents to the query in the collection,
     * restricted to documents whose metadata equals every given filter value.
     *
     * @throws RetrievalException if the store is unavailable or the call fails
     */
    public List<Neighbor> findNeighbors(VectorCollection collection, String query, int k,
                                        Map<String, String> equalityFilters) {
        RagConfig.Index index = ragConfig.indexFor(collection);
        if (!isAvailable(collection)) {
            throw new RetrievalException("Vector Search is not configured for " + collection);
        }

        List<Float> embedding = embeddingService.embedQuery(query);
        String requestJson = buildRequest(index.getDeployedIndexId(), embedding, k, equalityFilters);
        String url = String.format("https://%s/v1/%s:findNeighbors", apiHost, index.getIndexEndpoint());

        try {
            credentials.refreshIfExpired();
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.setBearerAuth(credentials.getAccessToken().getTokenValue());

            long startTime = System.currentTimeMillis();
            ResponseEntity<String> response = restTemplate.exchange(
                    url, HttpMethod.POST, new HttpEntity<>(requestJson, headers), String.class);
            long searchTime = System.currentTimeMillis() - startTime;

            List<Neighbor> neighbors = parseResponse(response.getBody());
            log.info("Vector search: collection={}, k={}, filters={}, returned={} in {}ms",
                    collection, k, equalityFilters, neighbors.size(), searchTime);
            return neighbors;
        } catch (IOException | RestClientException e) {
            throw new RetrievalException("Vector search failed: " + e.getMessage(), e);
        }
    }

    String buildRequest(String deployedIndexId, List<? extends Number> embedding, int k,
                        Map<String, String> equalityFilters) {
        ObjectNode requestBody = objectMapper.createObjectNode();
        requestBody.put("deployed_index_id", deployedIndexId);
        requestBody.put("return_full_datapoint", true);

        ObjectNode query = objectMapper.createObjectNode();
        query.put("neighbor_count", k);

        ObjectNode datapoint = objectMapper.createObjectNode();
        datapoint.put("datapoint_id", "query-" + UUID.randomUUID());
        ArrayNode featureVector = datapoint.putArray("feature_vector");
        for (Number value : embedding) {
            featureVector.add(value.doubleValue());
        }

        if (equalityFilters != null && !equalityFilters.isEmpty()) {
            ArrayNode restricts = datapoint.putArray("restricts");
            equalityFilters.forEach((namespace, value) -> {
                ObjectNode allow = restricts.addObject();
                allow.put("namespace", namespace);
                allow.putArray("allow_list").add(value);
            });
        }

        query.set("datapoint", datapoint);
        requestBody.putArray("queries").add(query);

        try {
            return objectMapper.writeValueAsString(requestBody);
        } catch (JsonProcessingException e) {
            throw new RetrievalException("Could not serialize vector search request", e);
        }
    }

    List<Neighbor> parseResponse(String responseBody) throws IOException {
        List<Neighbor> results = new ArrayList<>();
        if (responseBody == null || responseBody.isBlank()) {
            return results;
        }

        JsonNode nearestNeighbors = objectMapper.readTree(responseBody).path("nearestNeighbors");
        for (JsonNode nn : nearestNeighbors) {
            for (JsonNode neighbor : nn.path("neighbors")) {
                JsonNode datapointNode = neighbor.path("datapoint");
                if (datapointNode.isMissingNode()) {
                    continue;
                }

                Map<String, Object> metadata = new LinkedHashMap<>();
                for (JsonNode restrict : datapointNode.path("restricts")) {
                    JsonNode allowList = restrict.path("allowList");
                    if (allowList.isArray() && !allowList.isEmpty()) {
                        metadata.put(restrict.path("namespace").asText(), allowList.get(0).asText());
                    }
                }

                String content = "";
                JsonNode embeddingMetadata = datapointNode.path("embeddingMetadata");
                Iterator<Map.Entry<String, JsonNode>> fields = embeddingMetadata.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    if (CONTENT_FIELD.equals(field.getKey())) {
                        content = field.getValue().asText();
                    } else {
                        metadata.put(field.getKey(), objectMapper.treeToValue(field.getValue(), Object.class));
                    }
                }

                results.add(new Neighbor(
                        datapointNode.path("datapointId").asText(),
                        content,
                        metadata,
                        neighbor.path("distance").asDouble()));
            }
        }

        results.sort(Comparator.comparingDouble(Neighbor::distance));
        return results;
    }

    public boolean isAvailable(VectorCollection collection) {
        RagConfig.Index index = ragConfig.indexFor(collection);
        return ragConfig.isEnabled()
                && credentials != null
                && index.getIndexEndpoint() != null
                && index.getDeployedIndexId() != null;
    }
}
