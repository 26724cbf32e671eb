package com.kbengine.model.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.Map;
import java.util.UUID;

@Builder(toBuilder = true)
public record GraphNode(
    String id,

    NodeKind kind,

    String name,

    String description,

    double confidence,

    Map<String, Object> properties,

    @JsonProperty("source_document_id")
    String sourceDocumentId,

    @JsonProperty("source_chunk_id")
    UUID sourceChunkId
) {

    public GraphNode {
        properties = properties == null ? Map.of() : properties;
    }
}
