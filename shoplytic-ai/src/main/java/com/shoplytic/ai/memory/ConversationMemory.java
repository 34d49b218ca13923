package com.shoplytic.ai.memory;

import com.shoplytic.ai.config.AgentProperties;
import com.shoplytic.ai.model.ChatMessage;
import com.shoplytic.rag.dto.SearchResult;
import com.shoplytic.rag.service.SearchResultFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * The last few turns of each session, kept in process.
 * <p>
 * When replayed as messages, a turn that returned catalog results has their
 * product ids appended to the assistant reply, so later turns can refer to
 * "the first one" or "that jacket" without searching again.
 */
@Slf4j
@Component
public class ConversationMemory {

    static final String PRODUCT_CONTEXT_HEADER = "\n\n[Previous search results with product_ids:]\n";
    static final String PRODUCT_SEPARATOR = "\n\n---\n\n";

    private final int maxTurns;
    private final Map<String, Deque<ConversationTurn>> sessions = new ConcurrentHashMap<>();

    public ConversationMemory(AgentProperties properties) {
        this.maxTurns = properties.getMemoryMaxTurns();
    }

    /**
     * Records a turn, evicting the oldest one once the session is full.
     * Sources that are not catalog items are dropped.
     */
    public void addTurn(String sessionId, String query, String response, List<SearchResult> sources) {
        List<SearchResult> productSources = sources == null ? List.of() : sources.stream()
                .filter(SearchResult::isProduct)
                .toList();

        Deque<ConversationTurn> turns = sessions.computeIfAbsent(sessionId, id -> new ArrayDeque<>());
        synchronized (turns) {
            turns.addLast(new ConversationTurn(query, response, productSources));
            while (turns.size() > maxTurns) {
                turns.removeFirst();
            }
        }
        log.debug("Stored turn: sessionId={}, productSources={}", sessionId, productSources.size());
    }

    public List<ConversationTurn> turns(String sessionId) {
        Deque<ConversationTurn> turns = sessions.get(sessionId);
        if (turns == null) {
            return List.of();
        }
        synchronized (turns) {
            return List.copyOf(turns);
        }
    }

    /**
     * The stored turns as alternating user and assistant messages, oldest first.
     */
    public List<ChatMessage> messages(String sessionId) {
        List<ChatMessage> messages = new ArrayList<>();
        for (ConversationTurn turn : turns(sessionId)) {
            messages.add(ChatMessage.user(turn.query()));
            messages.add(ChatMessage.assistant(withProductContext(turn)));
        }
        return messages;
    }

    private static String withProductContext(ConversationTurn turn) {
        String response = turn.response() == null ? "" : turn.response();
        if (turn.productSources().isEmpty()) {
            return response;
        }
        return response + PRODUCT_CONTEXT_HEADER + turn.productSources().stream()
                .map(SearchResultFormatter::productHeader)
                .collect(Collectors.joining(PRODUCT_SEPARATOR));
    }
}
