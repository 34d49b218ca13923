package com.shoplytic.ai.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shoplytic.ai.concurrent.MdcAwareExecutor;
import com.shoplytic.ai.concurrent.TimeLimitedExecutor;
import com.shoplytic.ai.config.AgentProperties;
import com.shoplytic.ai.exception.OperationTimeoutException;
import com.shoplytic.ai.memory.ConversationMemory;
import com.shoplytic.ai.model.ChatMessage;
import com.shoplytic.ai.model.ModelProvider;
import com.shoplytic.ai.model.ModelProviderException;
import com.shoplytic.ai.model.ModelRequest;
import com.shoplytic.ai.model.ModelResponse;
import com.shoplytic.ai.model.ParameterSchema;
import com.shoplytic.ai.model.ToolCall;
import com.shoplytic.ai.model.ToolChoice;
import com.shoplytic.ai.model.ToolSpec;
import com.shoplytic.ai.service.QualityEvaluationService;
import com.shoplytic.ai.service.QualityEvaluationService.EvaluationRequest;
import com.shoplytic.rag.dto.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Routes a query to the handlers, runs them and assembles the answer.
 * <p>
 * The routing model sees one function per handler and picks which to call.
 * No call means it answered directly (greetings). Several calls to the order
 * handler are merged into one carrying the user's original query. Calls to
 * different handlers run in parallel, repeated calls to one handler run in
 * turn, each seeing the previous handler's answer. Unless exactly one handler
 * ran, a final model call summarizes the handler outputs without tools.
 */
@Slf4j
@Service
public class Orchestrator {

    static final String ROUTING_PROMPT =
            "You are Shoplytic's orchestrator. Route queries to sub-agents. "
                    + "ALWAYS call a routing function (except greetings).\n\n"
                    + "ROUTING:\n"
                    + "- query_general_info: Policies, FAQs, shipping/returns, company info\n"
                    + "- query_order_agent: Products, orders, cart, purchasing, shipping info, vouchers\n\n"
                    + "CRITICAL: All product-related queries → query_order_agent. "
                    + "Never answer product questions directly.\n\n"
                    + "Use parallel for independent questions, sequential for dependent ones.";

    static final String SYNTHESIS_PROMPT = "You are summarizing tool results for the user. Do NOT call any tools.";

    private static final String ORCHESTRATOR = "Orchestrator";

    private final ModelProvider modelProvider;
    private final Map<AgentType, SubAgent> agents;
    private final ConversationMemory memory;
    private final QualityEvaluationService evaluationService;
    private final TimeLimitedExecutor timeLimitedExecutor;
    private final MdcAwareExecutor agentExecutor;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;

    public Orchestrator(ModelProvider modelProvider, List<SubAgent> subAgents, ConversationMemory memory,
                        QualityEvaluationService evaluationService, TimeLimitedExecutor timeLimitedExecutor,
                        MdcAwareExecutor agentExecutor, AgentProperties properties, ObjectMapper objectMapper) {
        this.modelProvider = modelProvider;
        this.agents = new EnumMap<>(AgentType.class);
        subAgents.forEach(agent -> agents.put(agent.type(), agent));
        this.memory = memory;
        this.evaluationService = evaluationService;
        this.timeLimitedExecutor = timeLimitedExecutor;
        this.agentExecutor = agentExecutor;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * One handler invocation decided by the routing model.
     */
    record RoutedCall(ToolCall call, AgentType agent, String query) {
    }

    public OrchestratorResult route(String query, String sessionId, double minSimilarity) {
        String traceId = UUID.randomUUID().toString();
        List<ChatMessage> history = memory.messages(sessionId);
        List<ChatMessage> messages = new ArrayList<>(history);
        messages.add(ChatMessage.user(query));

        ModelResponse routing;
        try {
            routing = callModel("routing", ModelRequest.builder()
                    .message(ChatMessage.system(ROUTING_PROMPT))
                    .messages(messages)
                    .tools(routingTools())
                    .toolChoice(ToolChoice.AUTO)
                    .maxOutputTokens(properties.getMaxTokensOrchestrator())
                    .temperature(properties.getTemperature())
                    .build());
        } catch (OperationTimeoutException e) {
            return fail(traceId, query, sessionId, ToolLoop.TIMEOUT_MESSAGE);
        } catch (ModelProviderException e) {
            log.error("Routing call failed: {}", e.getMessage());
            return fail(traceId, query, sessionId, ToolLoop.UNAVAILABLE_MESSAGE);
        }

        List<RoutedCall> calls = collapse(toRoutedCalls(routing.toolCalls(), query), query);
        log.info("Routing decided: proposedCalls={}, routedCalls={}", routing.toolCalls().size(),
                calls.stream().map(call -> call.agent().value()).toList());

        if (calls.isEmpty()) {
            return complete(traceId, query, sessionId, routing.content(), RoutingMode.DIRECT,
                    List.of(), List.of(), Map.of());
        }

        RoutingMode mode = RoutingClassifier.classify(calls.stream().map(RoutedCall::agent).toList());
        List<AgentResult> results = mode == RoutingMode.PARALLEL
                ? runParallel(calls, sessionId, history, minSimilarity)
                : runSequential(calls, sessionId, history, minSimilarity);

        List<SearchResult> sources = new ArrayList<>();
        Map<String, Object> searchParameters = new LinkedHashMap<>();
        for (AgentResult result : results) {
            sources.addAll(result.sources());
            searchParameters.putAll(result.searchParameters());
        }

        String response;
        if (mode == RoutingMode.SINGLE) {
            response = results.get(0).response();
        } else {
            response = synthesize(messages, routing.content(), calls, results);
        }

        List<String> agentsUsed = calls.stream()
                .map(call -> call.agent().value())
                .distinct()
                .toList();
        return complete(traceId, query, sessionId, response, mode, agentsUsed, sources, searchParameters);
    }

    List<RoutedCall> toRoutedCalls(List<ToolCall> toolCalls, String originalQuery) {
        List<RoutedCall> calls = new ArrayList<>();
        for (ToolCall call : toolCalls) {
            Optional<AgentType> agent = AgentType.fromFunctionName(call.name());
            if (agent.isEmpty()) {
                log.warn("Routing model called unknown function '{}', ignoring it", call.name());
                continue;
            }
            Object subQuery = CallSignatures.arguments(objectMapper, ORCHESTRATOR, call).get("query");
            String routedQuery = subQuery instanceof String text && !text.isBlank() ? text : originalQuery;
            calls.add(new RoutedCall(call, agent.get(), routedQuery));
        }
        return calls;
    }

    /**
     * Merges repeated calls to a collapsible handler into its first call,
     * which is given the original query and moved to the front.
     */
    List<RoutedCall> collapse(List<RoutedCall> calls, String originalQuery) {
        List<RoutedCall> result = new ArrayList<>(calls);
        for (AgentType agent : AgentType.values()) {
            if (!agent.collapsible()) {
                continue;
            }
            List<RoutedCall> forAgent = result.stream().filter(call -> call.agent() == agent).toList();
            if (forAgent.size() <= 1) {
                continue;
            }
            ToolCall first = forAgent.get(0).call();
            RoutedCall merged = new RoutedCall(
                    new ToolCall(first.id(), first.name(), queryArguments(originalQuery)), agent, originalQuery);
            result.removeIf(call -> call.agent() == agent);
            result.add(0, merged);
            log.info("Collapsed {} {} calls into 1 with original query", forAgent.size(), agent.value());
        }
        return result;
    }

    private List<AgentResult> runSequential(List<RoutedCall> calls, String sessionId, List<ChatMessage> history,
                                            double minSimilarity) {
        List<ChatMessage> context = new ArrayList<>(history);
        List<AgentResult> results = new ArrayList<>();
        for (RoutedCall call : calls) {
            AgentResult result = agentFor(call).invoke(call.query(), sessionId, List.copyOf(context), minSimilarity);
            results.add(result);
            context.add(ChatMessage.user(call.query()));
            context.add(ChatMessage.assistant(result.response()));
        }
        return results;
    }

    private List<AgentResult> runParallel(List<RoutedCall> calls, String sessionId, List<ChatMessage> history,
                                          double minSimilarity) {
        List<CompletableFuture<AgentResult>> futures = calls.stream()
                .map(call -> CompletableFuture.supplyAsync(
                        () -> agentFor(call).invoke(call.query(), sessionId, history, minSimilarity), agentExecutor))
                .toList();
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private String synthesize(List<ChatMessage> messages, String routingText, List<RoutedCall> calls,
                              List<AgentResult> results) {
        ModelRequest.ModelRequestBuilder request = ModelRequest.builder()
                .message(ChatMessage.system(SYNTHESIS_PROMPT))
                .messages(messages)
                .message(ChatMessage.assistant(routingText, calls.stream().map(RoutedCall::call).toList()))
                .toolChoice(ToolChoice.NONE)
                .maxOutputTokens(properties.getMaxTokensAgent())
                .temperature(properties.getTemperature());
        for (int i = 0; i < calls.size(); i++) {
            request.message(ChatMessage.tool(calls.get(i).call(), results.get(i).response()));
        }

        try {
            return callModel("synthesis", request.build()).content();
        } catch (OperationTimeoutException e) {
            return ToolLoop.TIMEOUT_MESSAGE;
        } catch (ModelProviderException e) {
            log.error("Synthesis call failed: {}", e.getMessage());
            return ToolLoop.UNAVAILABLE_MESSAGE;
        }
    }

    private ModelResponse callModel(String purpose, ModelRequest request) {
        return timeLimitedExecutor.call(ORCHESTRATOR + " " + purpose + " call", properties.getLlmTimeout(),
                () -> modelProvider.complete(request));
    }

    private OrchestratorResult fail(String traceId, String query, String sessionId, String message) {
        memory.addTurn(sessionId, query, message, List.of());
        return new OrchestratorResult(traceId, message, RoutingMode.DIRECT, List.of(), List.of(), Map.of());
    }

    private OrchestratorResult complete(String traceId, String query, String sessionId, String response,
                                        RoutingMode mode, List<String> agentsUsed, List<SearchResult> sources,
                                        Map<String, Object> searchParameters) {
        memory.addTurn(sessionId, query, response, sources);

        try {
            evaluationService.evaluateAsync(new EvaluationRequest(traceId, sessionId, query, response, agentsUsed));
        } catch (RuntimeException e) {
            log.warn("Could not schedule quality evaluation: {}", e.getMessage());
        }

        return new OrchestratorResult(traceId, response, mode, agentsUsed, sources, searchParameters);
    }

    private SubAgent agentFor(RoutedCall call) {
        SubAgent agent = agents.get(call.agent());
        if (agent == null) {
            throw new IllegalStateException("No handler registered for " + call.agent());
        }
        return agent;
    }

    private String queryArguments(String query) {
        try {
            return objectMapper.writeValueAsString(Map.of("query", query));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize routing arguments", e);
        }
    }

    static List<ToolSpec> routingTools() {
        return Arrays.stream(AgentType.values())
                .map(agent -> new ToolSpec(agent.functionName(), agent.description(),
                        ParameterSchema.object(null,
                                Map.of("query", ParameterSchema.string(agent.queryDescription())),
                                List.of("query"))))
                .toList();
    }
}
