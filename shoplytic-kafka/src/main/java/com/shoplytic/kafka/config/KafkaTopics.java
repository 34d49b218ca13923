package com.shoplytic.kafka.config;

/**
 * Kafka topic names for Shoplytic.
 */
public final class KafkaTopics {

    private KafkaTopics() {} // Prevent instantiation

    /** One record per answered query: routing mode, handlers, search parameters, latency */
    public static final String AI_EVENTS = "ai-events";

    /** LLM-as-judge quality scores per answered query */
    public static final String QUALITY_SCORES = "quality-scores";
}
