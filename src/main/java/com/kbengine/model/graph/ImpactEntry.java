package com.kbengine.model.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ImpactEntry(
    @JsonProperty("node_type")
    NodeKind kind,

    String id,

    String name,

    ProvenanceRole role,

    double confidence
) {}
