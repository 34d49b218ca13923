package com.shoplytic.ai.tool;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shoplytic.ai.concurrent.TimeLimitedExecutor;
import com.shoplytic.ai.config.AgentProperties;
import com.shoplytic.ai.exception.OperationTimeoutException;
import com.shoplytic.ai.model.ParameterSchema;
import com.shoplytic.ai.model.ToolCall;
import com.shoplytic.ai.model.ToolSpec;
import com.shoplytic.rag.dto.SearchResult;
import com.shoplytic.rag.service.RetrievalException;
import com.shoplytic.rag.service.RetrievalService;
import com.shoplytic.rag.service.SearchResultFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * The general-info handler's single tool: retrieval from the customer handbook.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HandbookToolRegistry implements ToolRegistry {

    static final String AGENT = "GeneralInfoAgent";
    static final String RETRIEVE_HANDBOOK_INFO = "retrieve_handbook_info";

    private final RetrievalService retrievalService;
    private final TimeLimitedExecutor timeLimitedExecutor;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;

    @JsonIgnoreProperties(ignoreUnknown = true)
    record HandbookQuery(@JsonProperty("query") String query, @JsonProperty("k") Integer k) {
    }

    @Override
    public List<ToolSpec> specs() {
        return List.of(new ToolSpec(RETRIEVE_HANDBOOK_INFO,
                "Retrieve information from the general customer handbook. Use this tool to answer questions about "
                        + "company policies, product offerings, refund policies, shipping information, and general "
                        + "company information.",
                ParameterSchema.object(null, Map.of(
                        "query", ParameterSchema.string("The search query to find relevant handbook information"),
                        "k", ParameterSchema.integer("Number of results to return (default "
                                + properties.getHandbookResults() + ")")),
                        List.of("query"))));
    }

    @Override
    public ToolExecution execute(ToolCall call, ToolContext context) {
        if (!RETRIEVE_HANDBOOK_INFO.equals(call.name())) {
            log.warn("Unknown handbook tool requested: {}", call.name());
            return ToolExecution.of("Error: Unknown function '" + call.name() + "'");
        }

        HandbookQuery args = ToolArguments.bind(objectMapper, AGENT, call, HandbookQuery.class);
        String query = args.query() == null || args.query().isBlank() ? context.query() : args.query();
        int k = args.k() == null || args.k() <= 0 ? properties.getHandbookResults() : args.k();

        try {
            List<SearchResult> results = timeLimitedExecutor.call(RETRIEVE_HANDBOOK_INFO, properties.getSearchTimeout(),
                    () -> retrievalService.retrieveHandbook(query, k, context.minSimilarity()));
            return new ToolExecution(SearchResultFormatter.handbook(results), results);
        } catch (OperationTimeoutException e) {
            return ToolExecution.of("Error: Handbook search timed out. Please try again.");
        } catch (RetrievalException e) {
            log.error("Handbook retrieval failed: {}", e.getMessage());
            return ToolExecution.of("Error: Handbook search is currently unavailable. Please try again later.");
        }
    }
}
