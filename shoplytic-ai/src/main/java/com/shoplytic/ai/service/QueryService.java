package com.shoplytic.ai.service;

import com.shoplytic.ai.agent.Orchestrator;
import com.shoplytic.ai.agent.OrchestratorResult;
import com.shoplytic.ai.config.AgentProperties;
import com.shoplytic.ai.dto.QueryRequest;
import com.shoplytic.ai.dto.QueryResponse;
import com.shoplytic.ai.dto.SourceDTO;
import com.shoplytic.kafka.dto.KafkaEvents.AIQueryEvent;
import com.shoplytic.kafka.producer.EventProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Answers one user query: routes it, publishes the query event and shapes
 * the response.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryService {

    static final String SESSION_MDC_KEY = "sessionId";

    private final Orchestrator orchestrator;
    private final EventProducer eventProducer;
    private final AgentProperties properties;

    public QueryResponse answer(QueryRequest request, String sessionId) {
        MDC.put(SESSION_MDC_KEY, sessionId);
        try {
            double minSimilarity = request.getMinSimilarity() != null
                    ? request.getMinSimilarity()
                    : properties.getDefaultSimilarityThreshold();

            log.info("Query received: query={}, minSimilarity={}", truncate(request.getQuery(), 100), minSimilarity);
            long start = System.currentTimeMillis();

            OrchestratorResult result = orchestrator.route(request.getQuery(), sessionId, minSimilarity);

            long processingTimeMs = System.currentTimeMillis() - start;
            log.info("Query answered: routingMode={}, agentsUsed={}, sources={}, processingTimeMs={}",
                    result.routingMode().value(), result.agentsUsed(), result.sources().size(), processingTimeMs);

            publishQueryEvent(request, sessionId, result, processingTimeMs);

            Map<String, Object> input = result.searchParameters().isEmpty()
                    ? Map.of("query", request.getQuery())
                    : result.searchParameters();

            return QueryResponse.builder()
                    .input(input)
                    .answer(result.response())
                    .agentsUsed(result.agentsUsed())
                    .routingMode(result.routingMode().value())
                    .sources(result.sources().stream().map(SourceDTO::fromResult).toList())
                    .sessionId(sessionId)
                    .build();
        } finally {
            MDC.remove(SESSION_MDC_KEY);
        }
    }

    private void publishQueryEvent(QueryRequest request, String sessionId, OrchestratorResult result,
                                   long processingTimeMs) {
        try {
            eventProducer.publishQueryEvent(AIQueryEvent.builder()
                    .eventId(UUID.randomUUID().toString())
                    .traceId(result.traceId())
                    .sessionId(sessionId)
                    .query(request.getQuery())
                    .routingMode(result.routingMode().value())
                    .agentsUsed(result.agentsUsed())
                    .searchParameters(result.searchParameters())
                    .sourcesCount(result.sources().size())
                    .processingTimeMs(processingTimeMs)
                    .timestamp(Instant.now().toString())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Failed to publish query event: {}", e.getMessage());
        }
    }

    private static String truncate(String str, int maxLength) {
        if (str == null) return null;
        return str.length() > maxLength ? str.substring(0, maxLength) + "..." : str;
    }
}
