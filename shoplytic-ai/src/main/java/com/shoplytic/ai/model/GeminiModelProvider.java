package com.shoplytic.ai.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.genai.Client;
import com.google.genai.types.Candidate;
import com.google.genai.types.Content;
import com.google.genai.types.FunctionCall;
import com.google.genai.types.FunctionCallingConfig;
import com.google.genai.types.FunctionDeclaration;
import com.google.genai.types.FunctionResponse;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.Part;
import com.google.genai.types.Schema;
import com.google.genai.types.Tool;
import com.google.genai.types.ToolConfig;
import com.google.genai.types.Type;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link ModelProvider} backed by Gemini on Vertex AI.
 * <p>
 * System messages become the system instruction, assistant messages become
 * {@code model} turns and consecutive tool results are sent back together as
 * one turn of function responses.
 */
@Slf4j
@Service
public class GeminiModelProvider implements ModelProvider {

    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {
    };

    @Nullable
    private final Client client;
    private final ObjectMapper objectMapper;
    private final String modelName;

    @Autowired
    public GeminiModelProvider(
            ObjectMapper objectMapper,
            @Value("${vertex.ai.project-id:}") String projectId,
            @Value("${vertex.ai.location:us-central1}") String location,
            @Value("${vertex.ai.model:gemini-2.0-flash}") String modelName) {
        this(createClient(projectId, location, modelName), objectMapper, modelName);
    }

    GeminiModelProvider(@Nullable Client client, ObjectMapper objectMapper, String modelName) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.modelName = modelName;
    }

    private static Client createClient(String projectId, String location, String modelName) {
        if (projectId == null || projectId.isBlank()) {
            log.warn("Vertex AI not configured - projectId is empty. Set vertex.ai.project-id property.");
            return null;
        }
        try {
            Client client = Client.builder()
                    .project(projectId)
                    .location(location)
                    .vertexAI(true)
                    .build();
            log.info("Initialized Gemini client for Vertex AI: project={}, location={}, model={}",
                    projectId, location, modelName);
            return client;
        } catch (Exception e) {
            log.error("Failed to initialize Gemini client: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public ModelResponse complete(ModelRequest request) {
        if (client == null) {
            throw new ModelProviderException("Gemini client is not configured");
        }

        GenerateContentConfig config = buildConfig(request);
        List<Content> contents = toContents(request.getMessages());

        GenerateContentResponse response;
        try {
            response = client.models.generateContent(modelName, contents, config);
        } catch (Exception e) {
            throw new ModelProviderException("Gemini call failed: " + e.getMessage(), e);
        }
        return toModelResponse(response);
    }

    GenerateContentConfig buildConfig(ModelRequest request) {
        GenerateContentConfig.Builder builder = GenerateContentConfig.builder();

        StringBuilder systemInstruction = new StringBuilder();
        for (ChatMessage message : request.getMessages()) {
            if (message.role() == ChatMessage.Role.SYSTEM && message.content() != null) {
                if (systemInstruction.length() > 0) {
                    systemInstruction.append("\n");
                }
                systemInstruction.append(message.content());
            }
        }
        if (systemInstruction.length() > 0) {
            builder.systemInstruction(Content.builder()
                    .parts(List.of(Part.builder().text(systemInstruction.toString()).build()))
                    .build());
        }

        if (request.hasTools()) {
            List<FunctionDeclaration> declarations = request.getTools().stream()
                    .map(GeminiModelProvider::toFunctionDeclaration)
                    .toList();
            builder.tools(List.of(Tool.builder().functionDeclarations(declarations).build()));
            builder.toolConfig(ToolConfig.builder()
                    .functionCallingConfig(FunctionCallingConfig.builder()
                            .mode(request.getToolChoice() == ToolChoice.NONE ? "NONE" : "AUTO")
                            .build())
                    .build());
        }

        if (request.getMaxOutputTokens() != null) {
            builder.maxOutputTokens(request.getMaxOutputTokens());
        }
        if (request.getTemperature() != null) {
            builder.temperature(request.getTemperature());
        }
        if (request.isJsonResponse()) {
            builder.responseMimeType("application/json");
        }
        return builder.build();
    }

    List<Content> toContents(List<ChatMessage> messages) {
        List<Content> contents = new ArrayList<>();
        List<Part> pendingResponses = new ArrayList<>();

        for (ChatMessage message : messages) {
            if (message.role() == ChatMessage.Role.TOOL) {
                pendingResponses.add(Part.builder()
                        .functionResponse(FunctionResponse.builder()
                                .id(message.toolCallId())
                                .name(message.toolName())
                                .response(Map.of("result", message.content() == null ? "" : message.content()))
                                .build())
                        .build());
                continue;
            }

            if (!pendingResponses.isEmpty()) {
                contents.add(Content.builder().role("user").parts(List.copyOf(pendingResponses)).build());
                pendingResponses.clear();
            }

            switch (message.role()) {
                case USER -> contents.add(Content.builder()
                        .role("user")
                        .parts(List.of(Part.builder().text(nullToEmpty(message.content())).build()))
                        .build());
                case ASSISTANT -> contents.add(toModelContent(message));
                default -> {
                    // system messages are carried by the system instruction
                }
            }
        }

        if (!pendingResponses.isEmpty()) {
            contents.add(Content.builder().role("user").parts(List.copyOf(pendingResponses)).build());
        }
        return contents;
    }

    private Content toModelContent(ChatMessage message) {
        List<Part> parts = new ArrayList<>();
        if (message.content() != null && !message.content().isBlank()) {
            parts.add(Part.builder().text(message.content()).build());
        }
        for (ToolCall call : message.toolCalls()) {
            parts.add(Part.builder()
                    .functionCall(FunctionCall.builder()
                            .id(call.id())
                            .name(call.name())
                            .args(parseArgs(call.argumentsJson()))
                            .build())
                    .build());
        }
        if (parts.isEmpty()) {
            parts.add(Part.builder().text("").build());
        }
        return Content.builder().role("model").parts(parts).build();
    }

    ModelResponse toModelResponse(GenerateContentResponse response) {
        Optional<List<Candidate>> candidates = response.candidates();
        if (candidates.isEmpty() || candidates.get().isEmpty()) {
            log.warn("Gemini returned no candidates");
            return ModelResponse.text("");
        }

        Optional<List<Part>> parts = candidates.get().get(0).content().flatMap(Content::parts);
        if (parts.isEmpty()) {
            return ModelResponse.text("");
        }

        StringBuilder text = new StringBuilder();
        List<ToolCall> toolCalls = new ArrayList<>();
        for (Part part : parts.get()) {
            part.text().ifPresent(text::append);
            Optional<FunctionCall> functionCall = part.functionCall();
            if (functionCall.isPresent()) {
                FunctionCall call = functionCall.get();
                String id = call.id().filter(value -> !value.isBlank())
                        .orElseGet(() -> "call_" + UUID.randomUUID().toString().substring(0, 8));
                toolCalls.add(new ToolCall(id, call.name().orElse("unknown"), writeArgs(call.args().orElse(Map.of()))));
            }
        }
        return new ModelResponse(text.toString(), toolCalls);
    }

    private Map<String, Object> parseArgs(String json) {
        try {
            return objectMapper.readValue(json, ARGS_TYPE);
        } catch (JsonProcessingException e) {
            throw new ModelProviderException("Tool call arguments are not a JSON object: " + json, e);
        }
    }

    private String writeArgs(Map<String, Object> args) {
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            throw new ModelProviderException("Could not serialize tool call arguments", e);
        }
    }

    static FunctionDeclaration toFunctionDeclaration(ToolSpec spec) {
        return FunctionDeclaration.builder()
                .name(spec.name())
                .description(spec.description())
                .parameters(toSchema(spec.parameters()))
                .build();
    }

    static Schema toSchema(ParameterSchema schema) {
        Schema.Builder builder = Schema.builder().type(switch (schema.kind()) {
            case OBJECT -> Type.Known.OBJECT;
            case STRING -> Type.Known.STRING;
            case INTEGER -> Type.Known.INTEGER;
            case NUMBER -> Type.Known.NUMBER;
            case BOOLEAN -> Type.Known.BOOLEAN;
        });

        if (schema.description() != null) {
            builder.description(schema.description());
        }
        if (!schema.enumValues().isEmpty()) {
            builder.format("enum").enum_(schema.enumValues());
        }
        if (schema.kind() == ParameterSchema.Kind.OBJECT) {
            Map<String, Schema> properties = new LinkedHashMap<>();
            schema.properties().forEach((name, property) -> properties.put(name, toSchema(property)));
            builder.properties(properties);
            if (!schema.required().isEmpty()) {
                builder.required(schema.required());
            }
        }
        return builder.build();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
