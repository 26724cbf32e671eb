package com.kbengine.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.kbengine.exception.ValidationException;

import java.util.Locale;

public enum RetrievalMode {
    VECTOR,
    GRAPH,
    HYBRID;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RetrievalMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return VECTOR;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown retrieval mode: " + value + " (expected vector, graph or hybrid)");
        }
    }
}
