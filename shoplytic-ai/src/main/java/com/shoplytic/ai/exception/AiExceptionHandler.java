package com.shoplytic.ai.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice(basePackages = "com.shoplytic.ai")
@Slf4j
public class AiExceptionHandler {

    @ExceptionHandler(AgentProtocolException.class)
    public ResponseEntity<Map<String, Object>> handleProtocolViolation(AgentProtocolException ex) {
        log.error("Agent protocol violation in {}: {}", ex.getAgent(), ex.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR,
                "Sorry, something went wrong while handling your request. Please rephrase it and try again.",
                "AGENT_PROTOCOL_VIOLATION");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getDefaultMessage())
                .orElse("The request is invalid.");
        return error(HttpStatus.BAD_REQUEST, message, "INVALID_REQUEST");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, String errorCode) {
        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", LocalDateTime.now());
        body.put("error", message);
        body.put("errorCode", errorCode);
        return ResponseEntity.status(status).body(body);
    }
}
