package com.shoplytic.ai.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider-neutral JSON schema subset used to declare tool parameters.
 */
public record ParameterSchema(
        Kind kind,
        String description,
        List<String> enumValues,
        Map<String, ParameterSchema> properties,
        List<String> required
) {

    public enum Kind {
        OBJECT,
        STRING,
        INTEGER,
        NUMBER,
        BOOLEAN
    }

    public ParameterSchema {
        enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
        properties = properties == null ? Map.of() : new LinkedHashMap<>(properties);
        required = required == null ? List.of() : List.copyOf(required);
    }

    public static ParameterSchema string(String description) {
        return new ParameterSchema(Kind.STRING, description, null, null, null);
    }

    public static ParameterSchema oneOf(String description, List<String> values) {
        return new ParameterSchema(Kind.STRING, description, values, null, null);
    }

    public static ParameterSchema integer(String description) {
        return new ParameterSchema(Kind.INTEGER, description, null, null, null);
    }

    public static ParameterSchema number(String description) {
        return new ParameterSchema(Kind.NUMBER, description, null, null, null);
    }

    public static ParameterSchema bool(String description) {
        return new ParameterSchema(Kind.BOOLEAN, description, null, null, null);
    }

    public static ParameterSchema object(String description, Map<String, ParameterSchema> properties,
                                         List<String> required) {
        return new ParameterSchema(Kind.OBJECT, description, null, properties, required);
    }

    public static ParameterSchema empty() {
        return object(null, Map.of(), List.of());
    }
}
