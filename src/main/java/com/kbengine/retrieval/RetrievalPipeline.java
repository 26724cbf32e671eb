package com.kbengine.retrieval;

import com.kbengine.chunking.SectionAnchors;
import com.kbengine.config.SearchProperties;
import com.kbengine.embedding.TextEmbedder;
import com.kbengine.exception.ValidationException;
import com.kbengine.graph.GraphStore;
import com.kbengine.model.Chunk;
import com.kbengine.model.Document;
import com.kbengine.model.DocumentReference;
import com.kbengine.model.RetrievalMode;
import com.kbengine.model.RetrievalResponse;
import com.kbengine.model.ScoredChunk;
import com.kbengine.model.SearchFilters;
import com.kbengine.model.SearchRequest;
import com.kbengine.model.graph.GraphEdge;
import com.kbengine.model.graph.GraphNode;
import com.kbengine.repository.DocumentStore;
import com.kbengine.repository.VectorIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Answers a query with document references, from vector similarity, from the knowledge graph, or from both
 * fused by reciprocal rank.
 */
@Slf4j
@Service
public class RetrievalPipeline {

    static final String GRAPH_NODE_CHUNK_TYPE = "graph_node";

    private final TextEmbedder embedder;
    private final VectorIndex vectorIndex;
    private final DocumentStore documentStore;
    private final Optional<GraphStore> graphStore;
    private final SearchProperties properties;
    private final UrlResolver urlResolver;
    private final Executor executor;

    public RetrievalPipeline(
        TextEmbedder embedder,
        VectorIndex vectorIndex,
        DocumentStore documentStore,
        Optional<GraphStore> graphStore,
        SearchProperties properties,
        UrlResolver urlResolver,
        @Qualifier("retrievalTaskExecutor") Executor executor
    ) {
        this.embedder = embedder;
        this.vectorIndex = vectorIndex;
        this.documentStore = documentStore;
        this.graphStore = graphStore;
        this.properties = properties;
        this.urlResolver = urlResolver;
        this.executor = executor;
    }

    public RetrievalResponse search(SearchRequest request) {
        long started = System.nanoTime();
        validate(request);

        int limit = request.limit() != null ? request.limit() : properties.limit();
        Double threshold = request.threshold() != null ? request.threshold() : properties.threshold();

        List<DocumentReference> references = switch (request.mode()) {
            case VECTOR -> rank(vectorSearch(request.query(), request.filters(), limit, threshold), limit);
            case GRAPH -> rank(graphSearch(request.query(), request.filters(), limit), limit);
            case HYBRID -> hybridSearch(request.query(), request.filters(), limit, threshold);
        };

        double elapsedMs = (System.nanoTime() - started) / 1_000_000.0;
        log.debug("Search '{}' ({}) returned {} references in {} ms",
            request.query(), request.mode().value(), references.size(), elapsedMs);
        return new RetrievalResponse(request.query(), references, references.size(), elapsedMs);
    }

    private List<DocumentReference> hybridSearch(String query, SearchFilters filters, int limit, Double threshold) {
        CompletableFuture<List<DocumentReference>> vector =
            CompletableFuture.supplyAsync(() -> vectorSearch(query, filters, limit, threshold), executor);
        CompletableFuture<List<DocumentReference>> graph =
            CompletableFuture.supplyAsync(() -> graphSearch(query, filters, limit), executor);

        try {
            CompletableFuture.allOf(vector, graph).join();
            return ReciprocalRankFusion.fuse(
                List.of(rank(vector.join(), limit), rank(graph.join(), limit)), properties.rrfK(), limit);
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    List<DocumentReference> vectorSearch(String query, SearchFilters filters, int limit, Double threshold) {
        float[] queryVector = embedder.embedQuery(query);
        List<ScoredChunk> hits = vectorIndex.search(queryVector, limit, filters, threshold);

        List<DocumentReference> references = new ArrayList<>(hits.size());
        for (ScoredChunk hit : hits) {
            Optional<Chunk> chunk = documentStore.findChunk(hit.chunkId());
            if (chunk.isEmpty()) {
                log.warn("Skipping vector hit: chunk {} no longer exists", hit.chunkId());
                continue;
            }
            Optional<Document> document = documentStore.findById(chunk.get().documentId());
            if (document.isEmpty()) {
                log.warn("Skipping vector hit: document {} of chunk {} no longer exists",
                    chunk.get().documentId(), hit.chunkId());
                continue;
            }
            references.add(chunkReference(document.get(), chunk.get(), hit.score()));
        }
        return references;
    }

    List<DocumentReference> graphSearch(String query, SearchFilters filters, int limit) {
        if (graphStore.isEmpty()) {
            log.debug("Graph search skipped: no graph backend configured");
            return List.of();
        }
        GraphStore graph = graphStore.get();
        List<GraphNode> candidates = graph.findNodes(query, limit * properties.graphCandidatesFactor());

        Set<String> seen = new HashSet<>();
        List<DocumentReference> references = new ArrayList<>();
        for (GraphNode node : candidates) {
            if (references.size() >= limit) {
                break;
            }
            Optional<Resolution> resolution = resolve(node);
            if (resolution.isEmpty()) {
                log.warn("Skipping graph node {}: no document could be resolved", node.id());
                continue;
            }
            Resolution resolved = resolution.get();
            if (!seen.add(resolved.dedupKey())) {
                continue;
            }
            if (!matches(filters, resolved.document(), resolved.chunk())) {
                continue;
            }

            List<Map<String, Object>> relationships = relationships(graph, node);
            double score = Math.min(1.0, node.confidence() * (1 + 0.1 * relationships.size()));
            references.add(graphReference(node, resolved, relationships, score));
        }
        return references;
    }

    private Optional<Resolution> resolve(GraphNode node) {
        if (node.sourceChunkId() != null) {
            Optional<Chunk> chunk = documentStore.findChunk(node.sourceChunkId());
            Optional<Document> document = chunk.flatMap(c -> documentStore.findById(c.documentId()));
            if (document.isPresent()) {
                return Optional.of(new Resolution(document.get(), chunk.get(), "chunk:" + chunk.get().id(), "chunk"));
            }
        }
        UUID documentId = parseUuid(node.sourceDocumentId());
        if (documentId != null) {
            Optional<Document> document = documentStore.findById(documentId);
            if (document.isPresent()) {
                return Optional.of(new Resolution(document.get(), null, "doc:" + documentId, "document"));
            }
        }
        if (node.name() != null && !node.name().isBlank()) {
            List<Document> byTitle = documentStore.findByTitleContaining(node.name(), properties.titleFallbackLimit());
            if (!byTitle.isEmpty()) {
                return Optional.of(new Resolution(byTitle.get(0), null, "node:" + node.id(), "title"));
            }
        }
        return Optional.empty();
    }

    private List<Map<String, Object>> relationships(GraphStore graph, GraphNode node) {
        List<GraphEdge> edges = graph.findEdges(node.id());
        List<Map<String, Object>> summaries = new ArrayList<>();
        for (GraphEdge edge : edges) {
            if (summaries.size() >= properties.relationshipsPerNode()) {
                break;
            }
            String otherId = edge.otherEnd(node.id());
            String otherName = graph.getNode(otherId).map(GraphNode::name).orElse(otherId);

            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("type", edge.type().name());
            summary.put("direction", edge.isOutgoingFrom(node.id()) ? "outgoing" : "incoming");
            summary.put("related", otherName);
            summary.put("confidence", edge.confidence());
            summaries.add(summary);
        }
        return summaries;
    }

    private DocumentReference chunkReference(Document document, Chunk chunk, double score) {
        String anchor = anchorOf(chunk);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("document_id", document.id().toString());
        metadata.put("chunk_id", chunk.id().toString());
        metadata.put("sequence", chunk.sequence());
        metadata.put("heading_path", chunk.headingPath());

        return new DocumentReference(
            urlResolver.resolve(document, anchor),
            document.displayPath(),
            document.title(),
            chunk.sectionTitle(),
            anchor,
            score,
            Snippets.of(chunk.content(), properties.snippetLength()),
            document.domain(),
            document.tags(),
            chunk.chunkType().label(),
            RetrievalMode.VECTOR,
            metadata
        );
    }

    private DocumentReference graphReference(GraphNode node, Resolution resolved, List<Map<String, Object>> relationships,
                                             double score) {
        Document document = resolved.document();
        Chunk chunk = resolved.chunk();
        String anchor = chunk == null ? null : anchorOf(chunk);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("document_id", document.id().toString());
        if (chunk != null) {
            metadata.put("chunk_id", chunk.id().toString());
        }
        metadata.put("graph_node_id", node.id());
        metadata.put("node_type", node.kind().label());
        metadata.put("node_confidence", node.confidence());
        metadata.put("resolved_via", resolved.via());
        metadata.put("relationships", relationships);

        String snippetSource = chunk != null ? chunk.content()
            : node.description() != null && !node.description().isBlank() ? node.description()
            : "Graph node: " + node.name();

        return new DocumentReference(
            urlResolver.resolve(document, anchor),
            document.displayPath(),
            document.title(),
            chunk == null ? null : chunk.sectionTitle(),
            anchor,
            score,
            Snippets.of(snippetSource, properties.snippetLength()),
            document.domain(),
            document.tags(),
            chunk == null ? GRAPH_NODE_CHUNK_TYPE : chunk.chunkType().label(),
            RetrievalMode.GRAPH,
            metadata
        );
    }

    private static boolean matches(SearchFilters filters, Document document, Chunk chunk) {
        if (filters.hasDomain() && !filters.domain().equals(document.domain())) {
            return false;
        }
        if (!filters.tags().isEmpty() && filters.tags().stream().noneMatch(document.tags()::contains)) {
            return false;
        }
        if (!filters.documentIds().isEmpty() && !filters.documentIds().contains(document.id())) {
            return false;
        }
        return filters.chunkTypes().isEmpty() || chunk == null || filters.chunkTypes().contains(chunk.chunkType());
    }

    private static String anchorOf(Chunk chunk) {
        if (chunk.sectionAnchor() != null && !chunk.sectionAnchor().isBlank()) {
            return chunk.sectionAnchor();
        }
        return SectionAnchors.fromHeadingPath(chunk.headingPath());
    }

    private static List<DocumentReference> rank(List<DocumentReference> references, int limit) {
        return references.stream()
            .sorted(Comparator.comparingDouble(DocumentReference::score).reversed())
            .limit(limit)
            .toList();
    }

    private static UUID parseUuid(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed document id on graph node: {}", value);
            return null;
        }
    }

    private void validate(SearchRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            throw new ValidationException("Query must not be blank");
        }
        if (request.limit() != null && (request.limit() < 1 || request.limit() > 100)) {
            throw new ValidationException("Limit must be between 1 and 100, got " + request.limit());
        }
        if (request.threshold() != null && (request.threshold() < 0 || request.threshold() > 1)) {
            throw new ValidationException("Threshold must be between 0 and 1, got " + request.threshold());
        }
    }

    private record Resolution(Document document, Chunk chunk, String dedupKey, String via) {}
}
