package com.kbengine.model;

import lombok.Builder;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Builder(toBuilder = true)
public record Document(
    UUID id,
    String title,
    String content,
    String contentHash,
    DocumentStatus status,
    ContentFormat format,
    String sourcePath,
    String relativePath,
    String externalId,
    String repoName,
    String domain,
    List<String> tags,
    Map<String, Object> metadata,
    String mimeType,
    String gitCommit,
    String gitRemoteUrl,
    String errorMessage,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt,
    OffsetDateTime indexedAt
) {

    public Document {
        tags = tags == null ? List.of() : List.copyOf(tags);
        metadata = metadata == null ? Map.of() : metadata;
        format = format == null ? ContentFormat.MARKDOWN : format;
        status = status == null ? DocumentStatus.PENDING : status;
    }

    public String kind() {
        Object kind = metadata.get("kind");
        return kind == null ? null : kind.toString();
    }

    /**
     * Path shown to readers: repository-relative when known, otherwise the absolute source path.
     */
    public String displayPath() {
        if (relativePath != null && !relativePath.isBlank()) {
            return relativePath;
        }
        return sourcePath == null ? "" : sourcePath;
    }
}
