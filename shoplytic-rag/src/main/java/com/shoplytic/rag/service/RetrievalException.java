package com.shoplytic.rag.service;

/**
 * The vector store or embedding endpoint could not be reached or returned
 * an unusable response.
 */
public class RetrievalException extends RuntimeException {

    public RetrievalException(String message) {
        super(message);
    }

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
