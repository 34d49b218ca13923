package com.shoplytic.ai.agent;

import java.util.HashSet;
import java.util.List;

/**
 * Derives the routing mode from the handlers the routing model called.
 * Several calls spanning different handlers run in parallel; several calls
 * to one handler run one after the other.
 */
public final class RoutingClassifier {

    private RoutingClassifier() {
    }

    public static RoutingMode classify(List<AgentType> calledAgents) {
        if (calledAgents.isEmpty()) {
            return RoutingMode.DIRECT;
        }
        if (calledAgents.size() == 1) {
            return RoutingMode.SINGLE;
        }
        return new HashSet<>(calledAgents).size() > 1 ? RoutingMode.PARALLEL : RoutingMode.SEQUENTIAL;
    }
}
