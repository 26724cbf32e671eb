package com.kbengine.indexing;

import com.kbengine.chunking.Chunker;
import com.kbengine.chunking.SectionAnchors;
import com.kbengine.embedding.TextEmbedder;
import com.kbengine.exception.EntityNotFoundException;
import com.kbengine.exception.PipelineException;
import com.kbengine.exception.ValidationException;
import com.kbengine.extraction.ExtractionStrategy;
import com.kbengine.model.Chunk;
import com.kbengine.model.ChunkEmbedding;
import com.kbengine.model.ContentChunk;
import com.kbengine.model.Document;
import com.kbengine.model.DocumentStatus;
import com.kbengine.model.graph.ExtractionResult;
import com.kbengine.repository.DocumentStore;
import com.kbengine.repository.VectorIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Keeps a document's chunks, embeddings and graph facts consistent across the stores.
 *
 * <p>Per document: PENDING, PROCESSING, then INDEXED or FAILED. Steps run strictly in order because later steps
 * read the ids and anchors written by earlier ones. Writers for the same document are serialized.
 */
@Slf4j
@Service
public class IndexationOrchestrator {

    private final DocumentStore documentStore;
    private final VectorIndex vectorIndex;
    private final Chunker chunker;
    private final TextEmbedder embedder;
    private final Optional<ExtractionStrategy> extractionStrategy;
    private final RepositoryScanner scanner;
    private final DocumentFactory documentFactory;

    private final Map<String, DocumentLock> documentLocks = new ConcurrentHashMap<>();

    public IndexationOrchestrator(
        DocumentStore documentStore,
        VectorIndex vectorIndex,
        Chunker chunker,
        TextEmbedder embedder,
        Optional<ExtractionStrategy> extractionStrategy,
        RepositoryScanner scanner,
        DocumentFactory documentFactory
    ) {
        this.documentStore = documentStore;
        this.vectorIndex = vectorIndex;
        this.chunker = chunker;
        this.embedder = embedder;
        this.extractionStrategy = extractionStrategy;
        this.scanner = scanner;
        this.documentFactory = documentFactory;
    }

    /**
     * Indexes a new document, or reindexes the stored one sharing its external id.
     */
    public Document index(Document document) {
        if (document.externalId() != null && document.id() == null) {
            Optional<Document> existing = documentStore.findByExternalId(document.externalId());
            if (existing.isPresent()) {
                return reindexDocument(document.toBuilder().id(existing.get().id()).build());
            }
        }
        return document.id() != null && documentStore.findById(document.id()).isPresent()
            ? reindexDocument(document)
            : indexDocument(document);
    }

    public Document indexDocument(Document document) {
        return withDocumentLock(document, () -> runPipeline(document));
    }

    /**
     * Delete-then-index under the same document id.
     */
    public Document reindexDocument(Document document) {
        if (document.id() == null) {
            throw new ValidationException("Reindex requires a document id");
        }
        return withDocumentLock(document, () -> {
            log.debug("Reindexing document {}", document.id());
            vectorIndex.deleteByDocument(document.id());
            extractionStrategy.ifPresent(strategy -> strategy.deleteByDocument(document.id().toString()));
            documentStore.deleteChunks(document.id());
            return runPipeline(document);
        });
    }

    public Document reindexDocument(UUID documentId) {
        Document stored = documentStore.findById(documentId)
            .orElseThrow(() -> new EntityNotFoundException("Document", documentId));
        return reindexDocument(stored);
    }

    /**
     * Removes the document and everything derived from it.
     *
     * @return false when the document does not exist
     */
    public boolean deleteDocument(UUID documentId) {
        Optional<Document> stored = documentStore.findById(documentId);
        if (stored.isEmpty()) {
            return false;
        }
        return withDocumentLock(stored.get(), () -> {
            int vectors = vectorIndex.deleteByDocument(documentId);
            extractionStrategy.ifPresent(strategy -> strategy.deleteByDocument(documentId.toString()));
            int chunks = documentStore.deleteChunks(documentId);
            boolean deleted = documentStore.delete(documentId);
            log.info("Deleted document {} ({} chunks, {} vectors)", documentId, chunks, vectors);
            return deleted;
        });
    }

    /**
     * Indexes one file, or every supported file below a directory treated as a repository named after it.
     */
    public IndexRepositoryResult indexPath(Path path) {
        if (Files.isDirectory(path)) {
            Path root = path.toAbsolutePath().normalize();
            return indexRepository(RepositoryConfig.builder()
                .name(root.getFileName() == null ? "root" : root.getFileName().toString())
                .localPath(root.toString())
                .build());
        }
        if (!Files.isRegularFile(path)) {
            throw new ValidationException("No such file or directory: " + path);
        }
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
        Document indexed = index(documentFactory.fromFile(path, content));
        return new IndexRepositoryResult(null, null, 1, indexed.status() == DocumentStatus.INDEXED ? 1 : 0, 0, List.of());
    }

    /**
     * Indexes every matching file. A failing file is logged and reported, never aborting the batch.
     */
    public IndexRepositoryResult indexRepository(RepositoryConfig config) {
        if (!scanner.isRepository(config)) {
            throw new ValidationException("Not a git repository: " + config.localPath());
        }
        String revision = scanner.currentRevision(config);
        String remoteUrl = scanner.remoteUrl(config);
        List<String> files = scanner.scanFiles(config);
        log.info("Indexing repository {} at {}: {} files", config.name(), abbreviate(revision), files.size());

        int indexed = 0;
        List<ItemError> errors = new ArrayList<>();
        for (String relativePath : files) {
            try {
                String content = scanner.readFile(config, relativePath);
                UUID existingId = documentStore.findByExternalId(config.externalId(relativePath))
                    .map(Document::id)
                    .orElse(null);
                Document document = documentFactory.fromRepositoryFile(
                    config, relativePath, content, revision, remoteUrl, existingId);
                if (existingId != null) {
                    reindexDocument(document);
                } else {
                    indexDocument(document);
                }
                indexed++;
            } catch (RuntimeException e) {
                log.error("Failed to index file {}: {}", relativePath, e.getMessage(), e);
                errors.add(new ItemError(relativePath, rootMessage(e)));
            }
        }

        log.info("Repository {} indexed: {} ok, {} failed", config.name(), indexed, errors.size());
        return new IndexRepositoryResult(config.name(), revision, files.size(), indexed, errors.size(), errors);
    }

    /**
     * Applies the changes since {@code sinceRevision}: deleted files are removed, unchanged content is skipped,
     * everything else is indexed or reindexed.
     */
    public SyncResult syncRepository(RepositoryConfig config, String sinceRevision) {
        if (sinceRevision == null || sinceRevision.isBlank()) {
            throw new ValidationException("A revision to sync from is required");
        }
        ChangeSet changes = scanner.changesSince(config, sinceRevision);
        String remoteUrl = scanner.remoteUrl(config);
        log.info("Syncing repository {} since {}: {} changed, {} deleted",
            config.name(), abbreviate(sinceRevision), changes.changed().size(), changes.deleted().size());

        int deleted = 0;
        int indexed = 0;
        int skipped = 0;
        List<ItemError> errors = new ArrayList<>();

        for (String relativePath : changes.deleted()) {
            try {
                Optional<Document> existing = documentStore.findByExternalId(config.externalId(relativePath));
                if (existing.isPresent() && deleteDocument(existing.get().id())) {
                    deleted++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to delete document for {}: {}", relativePath, e.getMessage(), e);
                errors.add(new ItemError(relativePath, rootMessage(e)));
            }
        }

        for (String relativePath : changes.changed()) {
            try {
                String content = scanner.readFile(config, relativePath);
                Optional<Document> existing = documentStore.findByExternalId(config.externalId(relativePath));
                if (existing.isPresent() && ContentHashes.sha256(content).equals(existing.get().contentHash())
                    && existing.get().status() == DocumentStatus.INDEXED) {
                    skipped++;
                    continue;
                }
                Document document = documentFactory.fromRepositoryFile(config, relativePath, content,
                    changes.currentRevision(), remoteUrl, existing.map(Document::id).orElse(null));
                if (existing.isPresent()) {
                    reindexDocument(document);
                } else {
                    indexDocument(document);
                }
                indexed++;
            } catch (RuntimeException e) {
                log.error("Failed to sync file {}: {}", relativePath, e.getMessage(), e);
                errors.add(new ItemError(relativePath, rootMessage(e)));
            }
        }

        log.info("Repository {} synced to {}: {} indexed, {} deleted, {} skipped, {} failed",
            config.name(), abbreviate(changes.currentRevision()), indexed, deleted, skipped, errors.size());
        return new SyncResult(indexed, deleted, skipped, changes.currentRevision(), errors);
    }

    private Document runPipeline(Document input) {
        Document document = input;
        try {
            log.debug("Step 1/9: hashing content of '{}'", document.title());
            document = document.toBuilder()
                .contentHash(ContentHashes.sha256(document.content()))
                .status(DocumentStatus.PROCESSING)
                .errorMessage(null)
                .build();

            log.debug("Step 2/9: saving document '{}'", document.title());
            document = documentStore.save(document);
            UUID documentId = document.id();

            log.debug("Step 3/9: chunking document {}", documentId);
            List<ContentChunk> contentChunks = chunker.chunk(document);

            log.debug("Step 4/9: computing anchors for {} chunks", contentChunks.size());
            List<Chunk> chunks = new ArrayList<>(contentChunks.size());
            for (ContentChunk contentChunk : contentChunks) {
                chunks.add(Chunk.builder()
                    .documentId(documentId)
                    .sequence(contentChunk.sequence())
                    .headingPath(contentChunk.headingPath())
                    .sectionAnchor(SectionAnchors.fromHeadingPath(contentChunk.headingPath()))
                    .content(contentChunk.content())
                    .chunkType(contentChunk.chunkType())
                    .build());
            }

            log.debug("Step 5/9: saving {} chunks", chunks.size());
            List<Chunk> saved = documentStore.saveChunks(documentId, chunks);

            log.debug("Step 6/9: embedding {} chunks", saved.size());
            List<float[]> vectors = saved.isEmpty()
                ? List.of()
                : embedder.embedAll(saved.stream().map(Chunk::content).toList());

            log.debug("Step 7/9: storing {} embeddings", vectors.size());
            if (!saved.isEmpty()) {
                vectorIndex.upsert(embeddings(document, saved, vectors));
            }

            if (extractionStrategy.isPresent()) {
                log.debug("Step 8/9: extracting graph facts from {}", documentId);
                ExtractionResult result = extractionStrategy.get().extractAndStore(document, saved);
                log.debug("Step 8/9: {} nodes, {} edges via {}",
                    result.nodesCreated(), result.edgesCreated(), result.strategy());
            }

            log.debug("Step 9/9: marking document {} indexed", documentId);
            documentStore.updateStatus(documentId, DocumentStatus.INDEXED, null);
            Document indexed = documentStore.findById(documentId)
                .orElseThrow(() -> new EntityNotFoundException("Document", documentId));

            log.info("Document indexed: {} '{}' ({} chunks)", documentId, indexed.title(), saved.size());
            return indexed;
        } catch (RuntimeException e) {
            markFailed(document, e);
            String documentId = document.id() == null ? null : document.id().toString();
            throw new PipelineException(documentId, "Failed to index document: " + rootMessage(e), e);
        }
    }

    private void markFailed(Document document, RuntimeException cause) {
        if (document.id() == null) {
            return;
        }
        try {
            documentStore.updateStatus(document.id(), DocumentStatus.FAILED, rootMessage(cause));
        } catch (RuntimeException secondary) {
            log.warn("Could not mark document {} as failed: {}", document.id(), secondary.getMessage());
        }
    }

    private List<ChunkEmbedding> embeddings(Document document, List<Chunk> chunks, List<float[]> vectors) {
        List<ChunkEmbedding> embeddings = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("document_id", document.id().toString());
            metadata.put("chunk_type", chunk.chunkType().label());
            metadata.put("sequence", chunk.sequence());
            if (document.domain() != null) {
                metadata.put("domain", document.domain());
            }
            metadata.put("tags", document.tags());
            embeddings.add(new ChunkEmbedding(chunk.id(), document.id(), vectors.get(i), metadata));
        }
        return embeddings;
    }

    private <T> T withDocumentLock(Document document, Supplier<T> action) {
        String key = document.externalId() != null ? document.externalId()
            : document.id() != null ? document.id().toString()
            : null;
        if (key == null) {
            return action.get();
        }
        DocumentLock entry = documentLocks.compute(key, (k, existing) -> {
            DocumentLock held = existing != null ? existing : new DocumentLock();
            held.holders++;
            return held;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            documentLocks.computeIfPresent(key, (k, held) -> --held.holders == 0 ? null : held);
        }
    }

    int lockedDocumentCount() {
        return documentLocks.size();
    }

    private static String rootMessage(Throwable e) {
        Throwable current = e;
        while (current instanceof PipelineException && current.getCause() != null) {
            current = current.getCause();
        }
        return current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
    }

    private static String abbreviate(String revision) {
        return revision != null && revision.length() > 8 ? revision.substring(0, 8) : revision;
    }

    /**
     * A per-document lock, dropped from the map once no thread holds or waits for it. The holder count is
     * only changed inside map compute calls.
     */
    private static final class DocumentLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
