package com.kbengine.model;

import lombok.Builder;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Builder(toBuilder = true)
public record Chunk(
    UUID id,
    UUID documentId,
    int sequence,
    List<String> headingPath,
    String sectionAnchor,
    String content,
    ChunkType chunkType,
    Map<String, Object> metadata
) {

    public Chunk {
        headingPath = headingPath == null ? List.of() : List.copyOf(headingPath);
        metadata = metadata == null ? Map.of() : metadata;
        chunkType = chunkType == null ? ChunkType.DEFAULT : chunkType;
    }

    public String sectionTitle() {
        return headingPath.isEmpty() ? null : headingPath.get(headingPath.size() - 1);
    }
}
