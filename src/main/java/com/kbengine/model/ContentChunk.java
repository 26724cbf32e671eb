package com.kbengine.model;

import java.util.List;

/**
 * Chunker output before persistence: text plus its position in the heading hierarchy.
 */
public record ContentChunk(
    int sequence,
    String content,
    List<String> headingPath,
    ChunkType chunkType
) {

    public ContentChunk {
        headingPath = headingPath == null ? List.of() : List.copyOf(headingPath);
    }
}
