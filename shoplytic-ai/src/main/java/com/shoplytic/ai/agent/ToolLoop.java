package com.shoplytic.ai.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shoplytic.ai.concurrent.TimeLimitedExecutor;
import com.shoplytic.ai.config.AgentProperties;
import com.shoplytic.ai.exception.OperationTimeoutException;
import com.shoplytic.ai.model.ChatMessage;
import com.shoplytic.ai.model.ModelProvider;
import com.shoplytic.ai.model.ModelProviderException;
import com.shoplytic.ai.model.ModelRequest;
import com.shoplytic.ai.model.ModelResponse;
import com.shoplytic.ai.model.ToolCall;
import com.shoplytic.ai.tool.ToolContext;
import com.shoplytic.ai.tool.ToolExecution;
import com.shoplytic.ai.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Bounded function-calling loop shared by the handlers.
 * <p>
 * Each step asks the model for its next move. A reply without tool calls ends
 * the loop with that text; otherwise every proposed call is executed and its
 * result appended to the conversation for the next step. Two identical calls
 * in one step abort the turn with an
 * {@link com.shoplytic.ai.exception.AgentProtocolException}.
 */
@Slf4j
public class ToolLoop {

    static final String TIMEOUT_MESSAGE =
            "I apologize, but the request took too long to process. Please try again.";
    static final String TOO_MANY_STEPS_MESSAGE =
            "I apologize, but the request took too many steps to complete. Please try again.";
    static final String UNAVAILABLE_MESSAGE =
            "I'm sorry, I couldn't process your request right now. Please try again later.";

    private final String agentName;
    private final ModelProvider modelProvider;
    private final ToolRegistry toolRegistry;
    private final TimeLimitedExecutor timeLimitedExecutor;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;

    public ToolLoop(String agentName, ModelProvider modelProvider, ToolRegistry toolRegistry,
                    TimeLimitedExecutor timeLimitedExecutor, AgentProperties properties, ObjectMapper objectMapper) {
        this.agentName = agentName;
        this.modelProvider = modelProvider;
        this.toolRegistry = toolRegistry;
        this.timeLimitedExecutor = timeLimitedExecutor;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public AgentResult run(List<ChatMessage> initialMessages, ToolContext context) {
        LoopState state = new LoopState(initialMessages);
        while (state.step() < properties.getMaxSteps()) {
            Optional<String> answer = step(state, context);
            if (answer.isPresent()) {
                log.info("{} finished after {} step(s)", agentName, state.step());
                return state.finish(answer.get());
            }
        }
        log.warn("{} exhausted {} steps without a final answer", agentName, properties.getMaxSteps());
        return state.finish(TOO_MANY_STEPS_MESSAGE);
    }

    /**
     * Performs one model round trip and runs the tools it asked for.
     *
     * @return the final answer when the model stopped calling tools
     */
    Optional<String> step(LoopState state, ToolContext context) {
        ModelRequest request = ModelRequest.builder()
                .messages(state.messages())
                .tools(toolRegistry.specs())
                .maxOutputTokens(properties.getMaxTokensAgent())
                .temperature(properties.getTemperature())
                .build();

        ModelResponse response;
        try {
            response = timeLimitedExecutor.call(agentName + " model call", properties.getLlmTimeout(),
                    () -> modelProvider.complete(request));
        } catch (OperationTimeoutException e) {
            return Optional.of(TIMEOUT_MESSAGE);
        } catch (ModelProviderException e) {
            log.error("{} model call failed: {}", agentName, e.getMessage());
            return Optional.of(UNAVAILABLE_MESSAGE);
        }
        state.advance();

        if (!response.hasToolCalls()) {
            log.debug("{} step {}: no tool calls", agentName, state.step());
            return Optional.of(response.content());
        }

        List<ToolCall> calls = response.toolCalls();
        log.info("{} step {}: {} tool call(s) {}", agentName, state.step(), calls.size(),
                calls.stream().map(ToolCall::name).toList());
        CallSignatures.requireDistinct(objectMapper, agentName, calls);

        state.append(ChatMessage.assistant(response.content(), calls));
        for (ToolCall call : calls) {
            state.recordSearch(toolRegistry.searchParameters(call, context));
            ToolExecution execution = toolRegistry.execute(call, context);
            state.addSources(execution.sources());
            state.append(ChatMessage.tool(call, execution.result()));
        }
        return Optional.empty();
    }
}
