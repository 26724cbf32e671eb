package com.kbengine.model.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record Neighborhood(
    GraphNode center,

    List<NodeRef> nodes,

    @JsonProperty("edge_types")
    List<EdgeType> edgeTypes
) {}
