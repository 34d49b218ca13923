package com.shoplytic.ai.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shoplytic.ai.concurrent.TimeLimitedExecutor;
import com.shoplytic.ai.config.AgentProperties;
import com.shoplytic.ai.exception.AgentProtocolException;
import com.shoplytic.ai.model.ChatMessage;
import com.shoplytic.ai.model.ModelProviderException;
import com.shoplytic.ai.model.ModelResponse;
import com.shoplytic.ai.model.ParameterSchema;
import com.shoplytic.ai.model.ToolCall;
import com.shoplytic.ai.model.ToolSpec;
import com.shoplytic.ai.tool.ToolContext;
import com.shoplytic.ai.tool.ToolExecution;
import com.shoplytic.ai.tool.ToolRegistry;
import com.shoplytic.rag.dto.SearchResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.shoplytic.ai.agent.ScriptedModelProvider.call;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolLoopTest {

    private static final ToolContext CONTEXT = new ToolContext("session_abc", "red hoodie", 0.7);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ExecutorService executor;
    private AgentProperties properties;
    private ScriptedModelProvider provider;
    private RecordingRegistry registry;
    private ToolLoop loop;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        properties = new AgentProperties();
        provider = new ScriptedModelProvider();
        registry = new RecordingRegistry();
        loop = new ToolLoop("TestAgent", provider, registry, new TimeLimitedExecutor(executor), properties,
                objectMapper);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private List<ChatMessage> start() {
        return List.of(ChatMessage.system("You help."), ChatMessage.user("find me a red hoodie"));
    }

    @Test
    void answerWithoutToolCallsEndsTheLoopImmediately() {
        provider.thenText("Hello there!");

        AgentResult result = loop.run(start(), CONTEXT);

        assertThat(result.response()).isEqualTo("Hello there!");
        assertThat(provider.requests()).hasSize(1);
        assertThat(registry.executed).isEmpty();
    }

    @Test
    void toolResultsAreFedBackToTheModel() {
        provider.thenCalls(call("c1", "lookup", "{\"query\":\"hoodie\"}"))
                .thenText("Found it.");

        AgentResult result = loop.run(start(), CONTEXT);

        assertThat(result.response()).isEqualTo("Found it.");
        List<ChatMessage> secondRequest = provider.requests().get(1).getMessages();
        ChatMessage assistant = secondRequest.get(secondRequest.size() - 2);
        ChatMessage toolResult = secondRequest.get(secondRequest.size() - 1);
        assertThat(assistant.toolCalls()).extracting(ToolCall::id).containsExactly("c1");
        assertThat(toolResult.role()).isEqualTo(ChatMessage.Role.TOOL);
        assertThat(toolResult.toolCallId()).isEqualTo("c1");
        assertThat(toolResult.content()).isEqualTo("result of lookup");
    }

    @Test
    @DisplayName("A model that never stops calling tools is cut off after exactly maxSteps round trips")
    void loopIsBoundedByMaxSteps() {
        properties.setMaxSteps(3);
        for (int i = 0; i < 10; i++) {
            provider.thenCalls(call("c" + i, "lookup", "{\"query\":\"q" + i + "\"}"));
        }

        AgentResult result = loop.run(start(), CONTEXT);

        assertThat(result.response()).isEqualTo(ToolLoop.TOO_MANY_STEPS_MESSAGE);
        assertThat(provider.requests()).hasSize(3);
        assertThat(registry.executed).hasSize(3);
    }

    @Test
    void identicalCallsInOneStepAbortTheTurn() {
        provider.thenCalls(
                call("c1", "lookup", "{\"query\":\"hoodie\",\"k\":3}"),
                call("c2", "lookup", "{\"k\":3,\"query\":\"hoodie\"}"));

        assertThatThrownBy(() -> loop.run(start(), CONTEXT))
                .isInstanceOf(AgentProtocolException.class)
                .hasMessageContaining("duplicate tool calls with same args");
        assertThat(registry.executed).isEmpty();
    }

    @Test
    void sameToolWithDifferentArgumentsIsAllowed() {
        provider.thenCalls(
                        call("c1", "lookup", "{\"query\":\"hoodie\"}"),
                        call("c2", "lookup", "{\"query\":\"jacket\"}"))
                .thenText("Both found.");

        AgentResult result = loop.run(start(), CONTEXT);

        assertThat(result.response()).isEqualTo("Both found.");
        assertThat(registry.executed).extracting(ToolCall::id).containsExactly("c1", "c2");
    }

    @Test
    void malformedArgumentsAbortTheTurn() {
        provider.thenCalls(call("c1", "lookup", "{not json"));

        assertThatThrownBy(() -> loop.run(start(), CONTEXT))
                .isInstanceOf(AgentProtocolException.class)
                .hasMessageContaining("malformed arguments");
    }

    @Test
    void slowModelCallReturnsTheTimeoutApology() {
        properties.setLlmTimeout(Duration.ofMillis(50));
        provider.then(() -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ModelResponse.text("too late");
        });

        AgentResult result = loop.run(start(), CONTEXT);

        assertThat(result.response()).isEqualTo(ToolLoop.TIMEOUT_MESSAGE);
    }

    @Test
    void providerFailureReturnsTheUnavailableApology() {
        provider.then(() -> {
            throw new ModelProviderException("quota exceeded");
        });

        AgentResult result = loop.run(start(), CONTEXT);

        assertThat(result.response()).isEqualTo(ToolLoop.UNAVAILABLE_MESSAGE);
    }

    @Test
    void sourcesAndSearchParametersAccumulateAcrossSteps() {
        provider.thenCalls(call("c1", "lookup", "{\"query\":\"hoodie\"}"))
                .thenCalls(call("c2", "lookup", "{\"query\":\"jacket\"}"))
                .thenText("Done.");

        AgentResult result = loop.run(start(), CONTEXT);

        assertThat(result.sources()).extracting(SearchResult::getContent).containsExactly("hoodie", "jacket");
        assertThat(result.searchParameters()).containsEntry("query", "jacket");
    }

    private class RecordingRegistry implements ToolRegistry {

        private final List<ToolCall> executed = new ArrayList<>();

        @Override
        public List<ToolSpec> specs() {
            return List.of(new ToolSpec("lookup", "Looks things up",
                    ParameterSchema.object(null, Map.of("query", ParameterSchema.string("what")), List.of("query"))));
        }

        @Override
        public ToolExecution execute(ToolCall call, ToolContext context) {
            executed.add(call);
            Object query = argument(call);
            SearchResult source = SearchResult.builder()
                    .id(call.id())
                    .content(String.valueOf(query))
                    .metadata(Map.of("product_id", 1))
                    .similarity(0.9)
                    .build();
            return new ToolExecution("result of " + call.name(), List.of(source));
        }

        @Override
        public Map<String, Object> searchParameters(ToolCall call, ToolContext context) {
            return Map.of("query", argument(call));
        }

        private Object argument(ToolCall call) {
            try {
                return objectMapper.readTree(call.argumentsJson()).path("query").asText();
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }
    }
}
