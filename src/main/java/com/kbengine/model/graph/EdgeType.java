package com.kbengine.model.graph;

import java.util.EnumSet;
import java.util.Set;

public enum EdgeType {
    CONTAINS,
    REFERENCES,
    PRODUCES,
    CONSUMES,
    EXTRACTED_FROM;

    public static final Set<EdgeType> DOMAIN = EnumSet.of(CONTAINS, REFERENCES, PRODUCES, CONSUMES);

    public boolean isDomain() {
        return this != EXTRACTED_FROM;
    }
}
