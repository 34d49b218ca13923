package com.shoplytic.ai.controller;

import com.shoplytic.ai.dto.QueryRequest;
import com.shoplytic.ai.dto.QueryResponse;
import com.shoplytic.ai.exception.AgentProtocolException;
import com.shoplytic.ai.exception.AiExceptionHandler;
import com.shoplytic.ai.service.QueryService;
import com.shoplytic.common.web.SessionIdResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class QueryControllerTest {

    @Mock
    private QueryService queryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new QueryController(queryService))
                .setControllerAdvice(new AiExceptionHandler())
                .build();
    }

    @Test
    void answersWithSnakeCaseFieldsAndTheDerivedSession() throws Exception {
        String session = SessionIdResolver.fromClientIp("203.0.113.7");
        when(queryService.answer(any(QueryRequest.class), eq(session))).thenReturn(QueryResponse.builder()
                .input(Map.of("query", "hello"))
                .answer("Hi!")
                .agentsUsed(List.of())
                .routingMode("direct")
                .sources(List.of())
                .sessionId(session)
                .build());

        mockMvc.perform(post("/user/query")
                        .header("X-Forwarded-For", "203.0.113.7, 10.0.0.1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"hello\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Hi!"))
                .andExpect(jsonPath("$.routing_mode").value("direct"))
                .andExpect(jsonPath("$.session_id").value(session))
                .andExpect(jsonPath("$.input.query").value("hello"));
    }

    @Test
    void blankQueryIsRejected() throws Exception {
        mockMvc.perform(post("/user/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.error").value("Please enter a question."));
    }

    @Test
    void thresholdOutsideRangeIsRejected() throws Exception {
        mockMvc.perform(post("/user/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"hoodies\",\"min_similarity\":1.5}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void protocolViolationBecomesAPoliteServerError() throws Exception {
        when(queryService.answer(any(QueryRequest.class), any()))
                .thenThrow(AgentProtocolException.duplicateToolCall("OrderAgent", "view_cart"));

        mockMvc.perform(post("/user/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"show my cart\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errorCode").value("AGENT_PROTOCOL_VIOLATION"));
    }
}
