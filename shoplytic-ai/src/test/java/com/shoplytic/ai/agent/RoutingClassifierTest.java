package com.shoplytic.ai.agent;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RoutingClassifierTest {

    @Test
    void noCallsIsDirect() {
        assertThat(RoutingClassifier.classify(List.of())).isEqualTo(RoutingMode.DIRECT);
    }

    @Test
    void oneCallIsSingle() {
        assertThat(RoutingClassifier.classify(List.of(AgentType.ORDER))).isEqualTo(RoutingMode.SINGLE);
    }

    @Test
    void differentHandlersRunInParallel() {
        assertThat(RoutingClassifier.classify(List.of(AgentType.GENERAL_INFO, AgentType.ORDER)))
                .isEqualTo(RoutingMode.PARALLEL);
    }

    @Test
    void repeatedHandlerRunsSequentially() {
        assertThat(RoutingClassifier.classify(List.of(AgentType.GENERAL_INFO, AgentType.GENERAL_INFO)))
                .isEqualTo(RoutingMode.SEQUENTIAL);
    }
}
