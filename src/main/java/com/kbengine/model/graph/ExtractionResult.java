package com.kbengine.model.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExtractionResult(
    @JsonProperty("nodes_created")
    int nodesCreated,

    @JsonProperty("edges_created")
    int edgesCreated,

    String strategy
) {

    public static ExtractionResult empty(String strategy) {
        return new ExtractionResult(0, 0, strategy);
    }
}
