package com.kbengine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record DocumentReference(
    String url,

    @JsonProperty("document_path")
    String documentPath,

    String title,

    @JsonProperty("section_title")
    String sectionTitle,

    @JsonProperty("section_anchor")
    String sectionAnchor,

    double score,

    String snippet,

    String domain,

    List<String> tags,

    @JsonProperty("chunk_type")
    String chunkType,

    @JsonProperty("retrieval_mode")
    RetrievalMode retrievalMode,

    Map<String, Object> metadata
) {

    public DocumentReference withScoreAndMode(double newScore, RetrievalMode mode) {
        return new DocumentReference(url, documentPath, title, sectionTitle, sectionAnchor, newScore, snippet,
            domain, tags, chunkType, mode, metadata);
    }
}
