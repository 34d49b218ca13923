package com.shoplytic.ai.agent;

import com.shoplytic.ai.model.ChatMessage;
import com.shoplytic.rag.dto.SearchResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Progress of one handler invocation: the conversation so far, the number of
 * model round trips taken, and what the tools have retrieved.
 */
public final class LoopState {

    private final List<ChatMessage> messages;
    private final List<SearchResult> sources = new ArrayList<>();
    private final Map<String, Object> searchParameters = new LinkedHashMap<>();
    private int step;

    LoopState(List<ChatMessage> initialMessages) {
        this.messages = new ArrayList<>(initialMessages);
    }

    public List<ChatMessage> messages() {
        return Collections.unmodifiableList(messages);
    }

    public int step() {
        return step;
    }

    public List<SearchResult> sources() {
        return Collections.unmodifiableList(sources);
    }

    public Map<String, Object> searchParameters() {
        return Collections.unmodifiableMap(searchParameters);
    }

    void advance() {
        step++;
    }

    void append(ChatMessage message) {
        messages.add(message);
    }

    void addSources(List<SearchResult> results) {
        sources.addAll(results);
    }

    void recordSearch(Map<String, Object> parameters) {
        searchParameters.putAll(parameters);
    }

    AgentResult finish(String response) {
        return new AgentResult(response, sources, new LinkedHashMap<>(searchParameters));
    }
}
