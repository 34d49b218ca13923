package com.shoplytic.ai.service;

import com.shoplytic.ai.agent.Orchestrator;
import com.shoplytic.ai.agent.OrchestratorResult;
import com.shoplytic.ai.agent.RoutingMode;
import com.shoplytic.ai.config.AgentProperties;
import com.shoplytic.ai.dto.QueryRequest;
import com.shoplytic.ai.dto.QueryResponse;
import com.shoplytic.kafka.dto.KafkaEvents.AIQueryEvent;
import com.shoplytic.kafka.producer.EventProducer;
import com.shoplytic.rag.dto.SearchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueryServiceTest {

    private static final String SESSION = "session_0123456789abcdef";

    @Mock
    private Orchestrator orchestrator;

    @Mock
    private EventProducer eventProducer;

    private QueryService queryService;

    @BeforeEach
    void setUp() {
        queryService = new QueryService(orchestrator, eventProducer, new AgentProperties());
    }

    @Test
    void inputFallsBackToTheQueryWhenNoSearchRan() {
        when(orchestrator.route("hello", SESSION, 0.7)).thenReturn(new OrchestratorResult(
                "trace-1", "Hi there!", RoutingMode.DIRECT, List.of(), List.of(), Map.of()));

        QueryResponse response = queryService.answer(QueryRequest.builder().query("hello").build(), SESSION);

        assertThat(response.getInput()).isEqualTo(Map.of("query", "hello"));
        assertThat(response.getRoutingMode()).isEqualTo("direct");
        assertThat(response.getSessionId()).isEqualTo(SESSION);
    }

    @Test
    void searchParametersAndSourcesAreEchoed() {
        SearchResult source = SearchResult.builder()
                .id("p7")
                .content("Fleece hoodie")
                .metadata(Map.of("product_id", 7))
                .similarity(0.83)
                .build();
        when(orchestrator.route("hoodies under 50", SESSION, 0.4)).thenReturn(new OrchestratorResult(
                "trace-2", "Found one.", RoutingMode.SINGLE, List.of("order"), List.of(source),
                Map.of("query", "hoodies", "max_price", 50.0)));

        QueryResponse response = queryService.answer(
                QueryRequest.builder().query("hoodies under 50").minSimilarity(0.4).build(), SESSION);

        assertThat(response.getInput()).containsEntry("max_price", 50.0);
        assertThat(response.getAgentsUsed()).containsExactly("order");
        assertThat(response.getSources()).singleElement().satisfies(dto -> {
            assertThat(dto.getContent()).isEqualTo("Fleece hoodie");
            assertThat(dto.getSimilarity()).isEqualTo(0.83);
        });

        ArgumentCaptor<AIQueryEvent> event = ArgumentCaptor.forClass(AIQueryEvent.class);
        verify(eventProducer).publishQueryEvent(event.capture());
        assertThat(event.getValue().getTraceId()).isEqualTo("trace-2");
        assertThat(event.getValue().getRoutingMode()).isEqualTo("single");
        assertThat(event.getValue().getSourcesCount()).isEqualTo(1);
    }

    @Test
    void eventFailureDoesNotFailTheAnswer() {
        when(orchestrator.route("hi", SESSION, 0.7)).thenReturn(new OrchestratorResult(
                "trace-3", "Hello!", RoutingMode.DIRECT, List.of(), List.of(), Map.of()));
        doThrow(new IllegalStateException("broker down")).when(eventProducer).publishQueryEvent(any());

        QueryResponse response = queryService.answer(QueryRequest.builder().query("hi").build(), SESSION);

        assertThat(response.getAnswer()).isEqualTo("Hello!");
    }

    @Test
    void sessionIsClearedFromTheLoggingContextAfterwards() {
        when(orchestrator.route("hi", SESSION, 0.7)).thenReturn(new OrchestratorResult(
                "trace-4", "Hello!", RoutingMode.DIRECT, List.of(), List.of(), Map.of()));

        queryService.answer(QueryRequest.builder().query("hi").build(), SESSION);

        assertThat(MDC.get("sessionId")).isNull();
    }
}
