package com.kbengine.graph;

import com.kbengine.model.graph.EdgeType;
import com.kbengine.model.graph.GraphEdge;
import com.kbengine.model.graph.GraphNode;
import com.kbengine.model.graph.GraphPath;
import com.kbengine.model.graph.GraphStats;
import com.kbengine.model.graph.ImpactEntry;
import com.kbengine.model.graph.Neighborhood;
import com.kbengine.model.graph.NodeKind;
import com.kbengine.model.graph.ProvenanceEntry;
import com.kbengine.model.graph.ProvenanceRole;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Provenance-aware knowledge graph.
 *
 * <p>Every domain node written by an extraction is linked to its source document through an
 * {@code EXTRACTED_FROM} edge carrying a {@link ProvenanceRole}. Domain edges carry the id of the
 * document that asserted them. Together these allow {@link #deleteBySourceDocument(String)} to remove
 * exactly one document's contribution.
 *
 * <p>Implementations must be safe to call from several threads.
 */
public interface GraphStore {

    /**
     * Creates or updates the node representing a source document. Always overwrites.
     */
    void upsertDocument(String docId, String title, String path, String kind);

    /**
     * Creates the node, or overwrites it only when {@code node.confidence()} is greater than or equal to the
     * stored confidence. A lower-confidence write leaves the stored node unchanged.
     */
    void upsertNode(GraphNode node);

    /**
     * Links a domain node to a document node. A no-op when either endpoint is missing.
     */
    void addProvenanceEdge(String nodeId, NodeKind nodeKind, String docId, ProvenanceRole role, double confidence);

    /**
     * Adds a domain relationship asserted by {@code sourceDocId}. A no-op when either endpoint is missing.
     * Re-adding the same (type, from, to, source) refreshes its attributes.
     */
    void addDomainEdge(EdgeType type, String fromId, String toId, Map<String, Object> attributes,
                       double confidence, String sourceDocId);

    /**
     * Removes one document's contribution: its domain edges, its provenance edges, the domain nodes left
     * without any provenance, and the document node itself. Idempotent.
     */
    void deleteBySourceDocument(String docId);

    Optional<GraphNode> getNode(String nodeId);

    /**
     * Domain nodes whose name contains {@code text}, case-insensitively, best confidence first.
     */
    List<GraphNode> findNodes(String text, int limit);

    List<GraphNode> listNodes(NodeKind kind);

    /**
     * Domain edges touching the node, in either direction.
     */
    List<GraphEdge> findEdges(String nodeId);

    Neighborhood getNeighborhood(String nodeId, int depth, Set<EdgeType> edgeTypes);

    Optional<GraphPath> findPath(String fromId, String toId, int maxDepth);

    List<ImpactEntry> getDocumentImpact(String docId);

    List<ProvenanceEntry> getNodeProvenance(String nodeId);

    GraphStats getStats();

    /**
     * Removes a single node and every edge touching it.
     *
     * @return false when no such node exists
     */
    boolean deleteNode(String nodeId);

    /**
     * Operator escape hatch: runs a backend-native query and returns raw rows.
     */
    List<Map<String, Object>> executeRawQuery(String query, Map<String, Object> parameters);

    /**
     * Throws {@link com.kbengine.exception.StoreUnavailableException} when the backend cannot be reached.
     */
    void ping();
}
