package com.kbengine.repository;

import com.kbengine.model.ChunkEmbedding;
import com.kbengine.model.ScoredChunk;
import com.kbengine.model.SearchFilters;

import java.util.List;
import java.util.UUID;

public interface VectorIndex {

    void upsert(List<ChunkEmbedding> embeddings);

    /**
     * Nearest chunks by cosine similarity, best first. Only hits scoring at least {@code threshold} are returned
     * when a threshold is given.
     */
    List<ScoredChunk> search(float[] queryVector, int limit, SearchFilters filters, Double threshold);

    int deleteByDocument(UUID documentId);

    void ping();
}
