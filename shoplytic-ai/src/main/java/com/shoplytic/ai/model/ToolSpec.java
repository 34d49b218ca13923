package com.shoplytic.ai.model;

/**
 * Declaration of a callable tool as advertised to the model.
 */
public record ToolSpec(String name, String description, ParameterSchema parameters) {
}
