package com.kbengine.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kbengine.model.ContentFormat;
import com.kbengine.model.Document;
import com.kbengine.model.DocumentStatus;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record DocumentResponse(
    UUID id,

    String title,

    DocumentStatus status,

    ContentFormat format,

    @JsonProperty("document_path")
    String documentPath,

    @JsonProperty("external_id")
    String externalId,

    String domain,

    List<String> tags,

    @JsonProperty("content_hash")
    String contentHash,

    @JsonProperty("error_message")
    String errorMessage,

    @JsonProperty("created_at")
    OffsetDateTime createdAt,

    @JsonProperty("indexed_at")
    OffsetDateTime indexedAt
) {

    public static DocumentResponse from(Document document) {
        return new DocumentResponse(
            document.id(),
            document.title(),
            document.status(),
            document.format(),
            document.displayPath(),
            document.externalId(),
            document.domain(),
            document.tags(),
            document.contentHash(),
            document.errorMessage(),
            document.createdAt(),
            document.indexedAt()
        );
    }
}
