package com.kbengine.extraction;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DocumentKind {
    ENTITY("entity"),
    USE_CASE("use-case"),
    BUSINESS_RULE("business-rule"),
    PROCESS("process"),
    EVENT("event"),
    UNKNOWN("unknown");

    private final String value;

    DocumentKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static DocumentKind fromValue(String raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        return switch (normalized) {
            case "entity", "entidad" -> ENTITY;
            case "use-case", "usecase", "caso-de-uso" -> USE_CASE;
            case "business-rule", "rule", "regla", "regla-de-negocio" -> BUSINESS_RULE;
            case "process", "proceso" -> PROCESS;
            case "event", "evento" -> EVENT;
            default -> UNKNOWN;
        };
    }
}
