package com.kbengine.model;

import java.util.UUID;

public record ScoredChunk(UUID chunkId, UUID documentId, double score) {}
