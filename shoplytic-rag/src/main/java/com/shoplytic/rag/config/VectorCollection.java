package com.shoplytic.rag.config;

/**
 * The document collections that can be searched.
 */
public enum VectorCollection {
    HANDBOOK,
    PRODUCTS
}
