package com.kbengine.model.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record GraphEdge(
    EdgeType type,

    @JsonProperty("from_id")
    String fromId,

    @JsonProperty("to_id")
    String toId,

    double confidence,

    @JsonProperty("source_doc_id")
    String sourceDocId,

    ProvenanceRole role,

    Map<String, Object> properties
) {

    public GraphEdge {
        properties = properties == null ? Map.of() : properties;
    }

    public String otherEnd(String nodeId) {
        return fromId.equals(nodeId) ? toId : fromId;
    }

    public boolean isOutgoingFrom(String nodeId) {
        return fromId.equals(nodeId);
    }
}
