package com.kbengine.model;

import com.kbengine.exception.ValidationException;

import java.util.Locale;

public enum ChunkType {
    ENTITY("entity"),
    USE_CASE("use_case"),
    RULE("rule"),
    PROCESS("process"),
    DEFAULT("default");

    private final String label;

    ChunkType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ChunkType fromLabel(String value) {
        if (value == null) {
            return DEFAULT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ChunkType type : values()) {
            if (type.label.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new ValidationException("Unknown chunk type: " + value);
    }
}
