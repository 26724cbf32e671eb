package com.kbengine.graph;

import com.kbengine.exception.ConfigurationException;
import com.kbengine.exception.EntityNotFoundException;
import com.kbengine.exception.ValidationException;
import com.kbengine.extraction.GraphWriteLock;
import com.kbengine.model.graph.EdgeType;
import com.kbengine.model.graph.GraphNode;
import com.kbengine.model.graph.GraphPath;
import com.kbengine.model.graph.GraphStats;
import com.kbengine.model.graph.ImpactEntry;
import com.kbengine.model.graph.Neighborhood;
import com.kbengine.model.graph.NodeInspection;
import com.kbengine.model.graph.NodeKind;
import com.kbengine.model.graph.ProvenanceEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operator-facing graph queries shared by the REST and command-line surfaces.
 */
@Slf4j
@Service
public class GraphQueryService {

    static final int MAX_DEPTH = 5;

    private final Optional<GraphStore> graphStore;
    private final Optional<GraphWriteLock> writeLock;

    public GraphQueryService(Optional<GraphStore> graphStore, Optional<GraphWriteLock> writeLock) {
        this.graphStore = graphStore;
        this.writeLock = writeLock;
    }

    public boolean isEnabled() {
        return graphStore.isPresent();
    }

    public List<GraphNode> listNodes(NodeKind kind) {
        if (kind == NodeKind.DOCUMENT) {
            throw new ValidationException("Document nodes are listed through impact and provenance queries");
        }
        return store().listNodes(kind);
    }

    public NodeInspection inspect(String nodeId, int depth) {
        checkDepth(depth);
        GraphStore store = store();
        GraphNode node = store.getNode(nodeId).orElseThrow(() -> new EntityNotFoundException("Node", nodeId));
        Neighborhood neighborhood = store.getNeighborhood(nodeId, depth, EdgeType.DOMAIN);
        return new NodeInspection(node, neighborhood, store.findEdges(nodeId), store.getNodeProvenance(nodeId));
    }

    public GraphPath path(String fromId, String toId, int maxDepth) {
        checkDepth(maxDepth);
        return store().findPath(fromId, toId, maxDepth)
            .orElseThrow(() -> new EntityNotFoundException("Path", fromId + " -> " + toId));
    }

    public List<ImpactEntry> impact(String documentId) {
        return store().getDocumentImpact(documentId);
    }

    public List<ProvenanceEntry> provenance(String nodeId) {
        GraphStore store = store();
        if (store.getNode(nodeId).isEmpty()) {
            throw new EntityNotFoundException("Node", nodeId);
        }
        return store.getNodeProvenance(nodeId);
    }

    public GraphStats stats() {
        return store().getStats();
    }

    public void deleteNode(String nodeId) {
        GraphStore store = store();
        boolean deleted = writeLock.map(lock -> lock.withLock(() -> store.deleteNode(nodeId)))
            .orElseGet(() -> store.deleteNode(nodeId));
        if (!deleted) {
            throw new EntityNotFoundException("Node", nodeId);
        }
        log.info("Deleted graph node {}", nodeId);
    }

    public List<Map<String, Object>> query(String rawQuery, Map<String, Object> parameters) {
        if (rawQuery == null || rawQuery.isBlank()) {
            throw new ValidationException("Query must not be blank");
        }
        return store().executeRawQuery(rawQuery, parameters == null ? Map.of() : parameters);
    }

    private GraphStore store() {
        return graphStore.orElseThrow(
            () -> new ConfigurationException("Graph backend is disabled (app.graph.backend=none)"));
    }

    private static void checkDepth(int depth) {
        if (depth < 1 || depth > MAX_DEPTH) {
            throw new ValidationException("Depth must be between 1 and " + MAX_DEPTH + ", got " + depth);
        }
    }
}
