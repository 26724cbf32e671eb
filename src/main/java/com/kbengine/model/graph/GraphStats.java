package com.kbengine.model.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record GraphStats(
    @JsonProperty("entity_count")
    long entityCount,

    @JsonProperty("concept_count")
    long conceptCount,

    @JsonProperty("event_count")
    long eventCount,

    @JsonProperty("document_count")
    long documentCount
) {

    public static GraphStats fromCounts(Map<NodeKind, Long> counts) {
        return new GraphStats(
            counts.getOrDefault(NodeKind.ENTITY, 0L),
            counts.getOrDefault(NodeKind.CONCEPT, 0L),
            counts.getOrDefault(NodeKind.EVENT, 0L),
            counts.getOrDefault(NodeKind.DOCUMENT, 0L)
        );
    }
}
