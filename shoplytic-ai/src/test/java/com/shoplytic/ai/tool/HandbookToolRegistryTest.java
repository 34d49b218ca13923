package com.shoplytic.ai.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shoplytic.ai.concurrent.TimeLimitedExecutor;
import com.shoplytic.ai.config.AgentProperties;
import com.shoplytic.ai.model.ToolCall;
import com.shoplytic.rag.dto.SearchResult;
import com.shoplytic.rag.service.RetrievalException;
import com.shoplytic.rag.service.RetrievalService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HandbookToolRegistryTest {

    private static final ToolContext CONTEXT = new ToolContext("session_abc", "what is the return policy", 0.6);

    @Mock
    private RetrievalService retrievalService;

    private ExecutorService executor;
    private HandbookToolRegistry registry;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        registry = new HandbookToolRegistry(retrievalService, new TimeLimitedExecutor(executor),
                new AgentProperties(), new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void retrievesWithDefaultCountAndTurnThreshold() {
        SearchResult section = SearchResult.builder()
                .id("h1")
                .content("Items can be returned within 30 days.")
                .metadata(Map.of("handbook_name", "Customer Handbook", "Header 1", "Returns", "Header 2", "Window"))
                .similarity(0.91)
                .build();
        when(retrievalService.retrieveHandbook("return window", 3, 0.6)).thenReturn(List.of(section));

        ToolExecution execution = registry.execute(
                new ToolCall("c1", "retrieve_handbook_info", "{\"query\":\"return window\"}"), CONTEXT);

        assertThat(execution.result()).isEqualTo("Source: Customer Handbook\n"
                + "Section: Returns Window\n"
                + "Content: Items can be returned within 30 days.");
        assertThat(execution.sources()).containsExactly(section);
    }

    @Test
    void noMatchesIsSaidPlainly() {
        when(retrievalService.retrieveHandbook("what is the return policy", 3, 0.6)).thenReturn(List.of());

        ToolExecution execution = registry.execute(new ToolCall("c1", "retrieve_handbook_info", "{}"), CONTEXT);

        assertThat(execution.result()).isEqualTo("No relevant information found.");
    }

    @Test
    void retrievalOutageIsReportedToTheModel() {
        when(retrievalService.retrieveHandbook(anyString(), anyInt(), anyDouble()))
                .thenThrow(new RetrievalException("embedding endpoint down"));

        ToolExecution execution = registry.execute(
                new ToolCall("c1", "retrieve_handbook_info", "{\"query\":\"returns\",\"k\":5}"), CONTEXT);

        assertThat(execution.result())
                .isEqualTo("Error: Handbook search is currently unavailable. Please try again later.");
    }
}
