package com.shoplytic.kafka.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Event payloads published to Kafka.
 */
public class KafkaEvents {

    private KafkaEvents() {}

    /**
     * One answered query as seen by the orchestrator.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AIQueryEvent {
        private String eventId;
        private String traceId;
        private String sessionId;
        private String query;
        private String routingMode;             // direct, single, sequential, parallel
        private List<String> agentsUsed;
        private Map<String, Object> searchParameters;
        private int sourcesCount;
        private long processingTimeMs;
        private String timestamp;               // ISO-8601 format
    }

    /**
     * Quality scores for one answer, each on a 1-10 scale.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class QualityScoreEvent {
        private String eventId;
        private String traceId;
        private String sessionId;
        private List<String> agentsUsed;
        private double relevance;
        private double accuracy;
        private double completeness;
        private double clarity;
        private double helpfulness;
        private double overallQuality;
        private String reasoning;
        private String timestamp;
    }
}
