package com.shoplytic.ai.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.genai.types.Candidate;
import com.google.genai.types.Content;
import com.google.genai.types.FunctionCall;
import com.google.genai.types.FunctionResponse;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.Part;
import com.google.genai.types.Schema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeminiModelProviderTest {

    private final GeminiModelProvider provider = new GeminiModelProvider(null, new ObjectMapper(), "gemini-test");

    @Test
    void unconfiguredClientFailsWithProviderException() {
        ModelRequest request = ModelRequest.builder().message(ChatMessage.user("hi")).build();

        assertThatThrownBy(() -> provider.complete(request)).isInstanceOf(ModelProviderException.class);
    }

    @Test
    void consecutiveToolResultsAreSentAsOneTurn() {
        ToolCall cart = new ToolCall("c1", "view_cart", "{}");
        ToolCall orders = new ToolCall("c2", "get_orders", "{\"order_id\":3}");

        List<Content> contents = provider.toContents(List.of(
                ChatMessage.system("You help."),
                ChatMessage.user("cart and order 3 please"),
                ChatMessage.assistant("", List.of(cart, orders)),
                ChatMessage.tool(cart, "Your cart is empty."),
                ChatMessage.tool(orders, "Order #3")));

        assertThat(contents).hasSize(3);
        assertThat(contents).extracting(content -> content.role().orElse(""))
                .containsExactly("user", "model", "user");

        List<Part> modelParts = contents.get(1).parts().orElseThrow();
        assertThat(modelParts).hasSize(2);
        FunctionCall second = modelParts.get(1).functionCall().orElseThrow();
        assertThat(second.name()).contains("get_orders");
        assertThat(second.args().orElseThrow()).containsEntry("order_id", 3);

        List<Part> responses = contents.get(2).parts().orElseThrow();
        assertThat(responses).hasSize(2);
        FunctionResponse first = responses.get(0).functionResponse().orElseThrow();
        assertThat(first.name()).contains("view_cart");
        assertThat(first.response().orElseThrow()).containsEntry("result", "Your cart is empty.");
    }

    @Test
    void systemMessagesBecomeTheSystemInstruction() {
        GenerateContentConfig config = provider.buildConfig(ModelRequest.builder()
                .message(ChatMessage.system("You are an evaluator."))
                .message(ChatMessage.user("score this"))
                .jsonResponse(true)
                .maxOutputTokens(256)
                .build());

        Content instruction = config.systemInstruction().orElseThrow();
        assertThat(instruction.parts().orElseThrow().get(0).text()).contains("You are an evaluator.");
        assertThat(config.responseMimeType()).contains("application/json");
        assertThat(config.maxOutputTokens()).contains(256);
        assertThat(config.tools()).isEmpty();
    }

    @Test
    void toolsAreDeclaredWhenPresent() {
        GenerateContentConfig config = provider.buildConfig(ModelRequest.builder()
                .message(ChatMessage.user("hoodies"))
                .tool(new ToolSpec("search_products", "Search the catalog",
                        ParameterSchema.object(null, Map.of("query", ParameterSchema.string("what")), List.of("query"))))
                .build());

        assertThat(config.tools().orElseThrow().get(0).functionDeclarations().orElseThrow())
                .extracting(declaration -> declaration.name().orElse(""))
                .containsExactly("search_products");
        assertThat(config.toolConfig()).isPresent();
    }

    @Test
    void schemaCarriesEnumsAndRequiredFields() {
        Schema schema = GeminiModelProvider.toSchema(ParameterSchema.object(null, Map.of(
                        "category", ParameterSchema.oneOf("Category", List.of("Clothing", "Electronics"))),
                List.of("category")));

        Schema category = schema.properties().orElseThrow().get("category");
        assertThat(category.enum_()).contains(List.of("Clothing", "Electronics"));
        assertThat(category.description()).contains("Category");
        assertThat(schema.required()).contains(List.of("category"));
    }

    @Test
    void functionCallsWithoutIdGetOne() {
        GenerateContentResponse response = GenerateContentResponse.builder()
                .candidates(List.of(Candidate.builder()
                        .content(Content.builder()
                                .role("model")
                                .parts(List.of(
                                        Part.builder().text("Let me check. ").build(),
                                        Part.builder().functionCall(FunctionCall.builder()
                                                .name("view_cart")
                                                .args(Map.of())
                                                .build()).build()))
                                .build())
                        .build()))
                .build();

        ModelResponse result = provider.toModelResponse(response);

        assertThat(result.content()).isEqualTo("Let me check. ");
        assertThat(result.toolCalls()).hasSize(1);
        assertThat(result.toolCalls().get(0).id()).startsWith("call_");
        assertThat(result.toolCalls().get(0).argumentsJson()).isEqualTo("{}");
    }

    @Test
    void emptyCandidatesYieldEmptyText() {
        ModelResponse result = provider.toModelResponse(GenerateContentResponse.builder().build());

        assertThat(result.content()).isEmpty();
        assertThat(result.hasToolCalls()).isFalse();
    }
}
