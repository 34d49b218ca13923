package com.shoplytic.ai.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shoplytic.ai.concurrent.TimeLimitedExecutor;
import com.shoplytic.ai.config.AgentProperties;
import com.shoplytic.ai.config.AiConfig;
import com.shoplytic.ai.model.ChatMessage;
import com.shoplytic.ai.model.ModelProvider;
import com.shoplytic.ai.model.ModelRequest;
import com.shoplytic.ai.model.ModelResponse;
import com.shoplytic.ai.model.ToolChoice;
import com.shoplytic.kafka.dto.KafkaEvents.QualityScoreEvent;
import com.shoplytic.kafka.producer.EventProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Scores answers with a model acting as judge and publishes the scores.
 * <p>
 * Runs after the answer has been returned; any failure is logged and dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QualityEvaluationService {

    static final int MAX_RESPONSE_CHARS = 2000;
    static final double DEFAULT_SCORE = 5.0;

    static final String JUDGE_SYSTEM_PROMPT = "You are an expert evaluator. Always respond with valid JSON only.";

    private static final String EVALUATION_PROMPT = """
            You are an expert evaluator for an e-commerce chatbot called Shoplytic.
            Your task is to evaluate the quality of the chatbot's response to a user query.

            **User Query:**
            %s

            **Chatbot Response:**
            %s

            **Agents Used:**
            %s

            Evaluate the response on the following dimensions, scoring each from 1 to 10:

            1. **Relevance**: How relevant is the response to the user's query?
            2. **Accuracy**: Is the information provided factually correct?
            3. **Completeness**: Does the response fully address the user's request?
            4. **Clarity**: Is the response clear and easy to understand?
            5. **Helpfulness**: How helpful is the response in achieving the user's goal?

            Respond with a JSON object in this exact format:
            {
                "overall_quality": <1-10>,
                "relevance": {"score": <1-10>, "reasoning": "<brief explanation>"},
                "accuracy": {"score": <1-10>, "reasoning": "<brief explanation>"},
                "completeness": {"score": <1-10>, "reasoning": "<brief explanation>"},
                "clarity": {"score": <1-10>, "reasoning": "<brief explanation>"},
                "helpfulness": {"score": <1-10>, "reasoning": "<brief explanation>"},
                "overall_reasoning": "<brief overall assessment>"
            }

            Return ONLY the JSON object, no other text.""";

    private final ModelProvider modelProvider;
    private final TimeLimitedExecutor timeLimitedExecutor;
    private final EventProducer eventProducer;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;

    public record EvaluationRequest(String traceId, String sessionId, String query, String response,
                                    List<String> agentsUsed) {
    }

    @Async(AiConfig.AGENT_EXECUTOR)
    public void evaluateAsync(EvaluationRequest request) {
        evaluate(request);
    }

    void evaluate(EvaluationRequest request) {
        try {
            QualityScoreEvent scores = score(request);
            eventProducer.publishQualityScores(scores);
            log.info("Quality evaluated: traceId={}, overall={}", request.traceId(), scores.getOverallQuality());
        } catch (Exception e) {
            log.warn("Quality evaluation failed for traceId={}: {}", request.traceId(), e.getMessage());
        }
    }

    QualityScoreEvent score(EvaluationRequest request) throws Exception {
        String response = request.response() == null ? "" : request.response();
        if (response.length() > MAX_RESPONSE_CHARS) {
            response = response.substring(0, MAX_RESPONSE_CHARS);
        }
        String agents = request.agentsUsed().isEmpty() ? "none" : String.join(", ", request.agentsUsed());

        ModelRequest judgeRequest = ModelRequest.builder()
                .message(ChatMessage.system(JUDGE_SYSTEM_PROMPT))
                .message(ChatMessage.user(String.format(EVALUATION_PROMPT, request.query(), response, agents)))
                .toolChoice(ToolChoice.NONE)
                .temperature(properties.getTemperature())
                .jsonResponse(true)
                .build();

        ModelResponse judged = timeLimitedExecutor.call("quality evaluation", properties.getLlmTimeout(),
                () -> modelProvider.complete(judgeRequest));
        if (judged.content().isBlank()) {
            throw new IllegalStateException("judge returned an empty response");
        }
        JsonNode result = objectMapper.readTree(judged.content());

        return QualityScoreEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .traceId(request.traceId())
                .sessionId(request.sessionId())
                .agentsUsed(request.agentsUsed())
                .relevance(dimension(result, "relevance"))
                .accuracy(dimension(result, "accuracy"))
                .completeness(dimension(result, "completeness"))
                .clarity(dimension(result, "clarity"))
                .helpfulness(dimension(result, "helpfulness"))
                .overallQuality(result.path("overall_quality").asDouble(DEFAULT_SCORE))
                .reasoning(result.path("overall_reasoning").asText(""))
                .timestamp(Instant.now().toString())
                .build();
    }

    private static double dimension(JsonNode result, String name) {
        JsonNode node = result.path(name);
        if (node.isNumber()) {
            return node.asDouble();
        }
        return node.path("score").asDouble(DEFAULT_SCORE);
    }
}
