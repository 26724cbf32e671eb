package com.kbengine.model.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProvenanceEntry(
    @JsonProperty("doc_id")
    String docId,

    String title,

    String path,

    ProvenanceRole role,

    double confidence
) {}
