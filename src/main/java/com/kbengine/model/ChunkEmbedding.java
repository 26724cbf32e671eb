package com.kbengine.model;

import java.util.Map;
import java.util.UUID;

public record ChunkEmbedding(
    UUID chunkId,
    UUID documentId,
    float[] vector,
    Map<String, Object> metadata
) {}
