package com.kbengine.model.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NodeRef(
    @JsonProperty("node_type")
    NodeKind kind,

    String id,

    String name
) {}
