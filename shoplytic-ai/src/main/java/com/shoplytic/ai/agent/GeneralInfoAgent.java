package com.shoplytic.ai.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shoplytic.ai.concurrent.TimeLimitedExecutor;
import com.shoplytic.ai.config.AgentProperties;
import com.shoplytic.ai.model.ChatMessage;
import com.shoplytic.ai.model.ModelProvider;
import com.shoplytic.ai.tool.HandbookToolRegistry;
import com.shoplytic.ai.tool.ToolContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Answers policy, FAQ and company questions from the customer handbook.
 */
@Slf4j
@Component
public class GeneralInfoAgent implements SubAgent {

    static final String SYSTEM_PROMPT =
            "You are Shoplytic's customer service agent. Answer questions about Shoplytic's company policies, "
                    + "FAQs, shipping/returns, and general information using the provided handbook content. "
                    + "Look the answer up with retrieve_handbook_info before replying. "
                    + "You represent Shoplytic, not yourself. Be helpful and accurate.";

    private final ToolLoop toolLoop;

    public GeneralInfoAgent(ModelProvider modelProvider, HandbookToolRegistry toolRegistry,
                            TimeLimitedExecutor timeLimitedExecutor, AgentProperties properties,
                            ObjectMapper objectMapper) {
        this.toolLoop = new ToolLoop("GeneralInfoAgent", modelProvider, toolRegistry,
                timeLimitedExecutor, properties, objectMapper);
    }

    @Override
    public AgentType type() {
        return AgentType.GENERAL_INFO;
    }

    @Override
    public AgentResult invoke(String query, String sessionId, List<ChatMessage> history, double minSimilarity) {
        log.info("General info agent invoked: query='{}'", query);
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(SYSTEM_PROMPT));
        messages.addAll(history);
        messages.add(ChatMessage.user(query));
        return toolLoop.run(messages, new ToolContext(sessionId, query, minSimilarity));
    }
}
