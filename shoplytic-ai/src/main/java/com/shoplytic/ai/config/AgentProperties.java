package com.shoplytic.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Limits and defaults for the orchestrator and its handlers.
 * Maps to shoplytic.agent.* properties in application.properties.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "shoplytic.agent")
public class AgentProperties {

    /** Model round trips a handler may take before giving up */
    private int maxSteps = 6;

    private Duration llmTimeout = Duration.ofSeconds(20);
    private Duration dbTimeout = Duration.ofSeconds(5);
    private Duration searchTimeout = Duration.ofSeconds(15);
    private Duration ordersTimeout = Duration.ofSeconds(10);
    private Duration purchaseTimeout = Duration.ofSeconds(15);

    private int maxTokensOrchestrator = 512;
    private int maxTokensAgent = 1024;
    private float temperature = 0.2f;

    /** Used when a query does not name its own threshold */
    private double defaultSimilarityThreshold = 0.7;

    private int memoryMaxTurns = 10;
    private int handbookResults = 3;
    private int productResults = 5;
    private int recentOrders = 5;
}
