package com.kbengine.model.graph;

import com.fasterxml.jackson.annotation.JsonValue;
import com.kbengine.exception.ValidationException;

public enum NodeKind {
    DOCUMENT("Document"),
    ENTITY("Entity"),
    CONCEPT("Concept"),
    EVENT("Event");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    /**
     * Label used by label-based graph databases and in rendered output.
     */
    @JsonValue
    public String label() {
        return label;
    }

    public boolean isDomain() {
        return this != DOCUMENT;
    }

    public static NodeKind fromValue(String value) {
        for (NodeKind kind : values()) {
            if (kind.label.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new ValidationException("Unknown node kind: " + value);
    }
}
