package com.kbengine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RetrievalResponse(
    String query,

    List<DocumentReference> references,

    @JsonProperty("total_count")
    int totalCount,

    @JsonProperty("processing_time_ms")
    double processingTimeMs
) {}
