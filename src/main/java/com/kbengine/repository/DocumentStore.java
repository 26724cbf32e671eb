package com.kbengine.repository;

import com.kbengine.model.Chunk;
import com.kbengine.model.Document;
import com.kbengine.model.DocumentStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DocumentStore {

    /**
     * Inserts the document, or replaces the stored row when a document with the same id exists.
     * A null id is assigned by the store.
     */
    Document save(Document document);

    Optional<Document> findById(UUID id);

    Optional<Document> findByExternalId(String externalId);

    List<Document> findByRepository(String repoName);

    /**
     * Documents whose title contains {@code text}, case-insensitively. At most {@code limit} rows are read.
     */
    List<Document> findByTitleContaining(String text, int limit);

    void updateStatus(UUID id, DocumentStatus status, String errorMessage);

    boolean delete(UUID id);

    List<Chunk> saveChunks(UUID documentId, List<Chunk> chunks);

    Optional<Chunk> findChunk(UUID chunkId);

    List<Chunk> findChunks(UUID documentId);

    int deleteChunks(UUID documentId);

    void ping();
}
