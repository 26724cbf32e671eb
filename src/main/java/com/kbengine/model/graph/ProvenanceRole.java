package com.kbengine.model.graph;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProvenanceRole {
    PRIMARY,
    REFERENCED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ProvenanceRole fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
