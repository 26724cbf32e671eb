package com.kbengine.graph;

import com.kbengine.exception.StoreUnavailableException;
import com.kbengine.exception.ValidationException;
import com.kbengine.infra.JsonColumns;
import com.kbengine.model.graph.EdgeType;
import com.kbengine.model.graph.GraphEdge;
import com.kbengine.model.graph.GraphNode;
import com.kbengine.model.graph.GraphPath;
import com.kbengine.model.graph.GraphStats;
import com.kbengine.model.graph.ImpactEntry;
import com.kbengine.model.graph.Neighborhood;
import com.kbengine.model.graph.NodeKind;
import com.kbengine.model.graph.NodeRef;
import com.kbengine.model.graph.ProvenanceEntry;
import com.kbengine.model.graph.ProvenanceRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Array;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Graph store on the relational database: nodes and edges tables with recursive CTEs for traversal.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcGraphStore implements GraphStore {

    private final JdbcClient jdbcClient;

    private final RowMapper<GraphNode> nodeRowMapper = (rs, rowNum) -> new GraphNode(
        rs.getString("id"),
        NodeKind.valueOf(rs.getString("kind")),
        rs.getString("name"),
        rs.getString("description"),
        rs.getDouble("confidence"),
        JsonColumns.readMap(rs.getString("properties")),
        rs.getString("source_document_id"),
        rs.getObject("source_chunk_id", UUID.class)
    );

    private final RowMapper<GraphEdge> edgeRowMapper = (rs, rowNum) -> {
        String role = rs.getString("role");
        return new GraphEdge(
            EdgeType.valueOf(rs.getString("edge_type")),
            rs.getString("from_id"),
            rs.getString("to_id"),
            rs.getDouble("confidence"),
            rs.getString("source_doc_id"),
            role != null ? ProvenanceRole.fromValue(role) : null,
            JsonColumns.readMap(rs.getString("properties"))
        );
    };

    private final RowMapper<NodeRef> nodeRefRowMapper = (rs, rowNum) -> new NodeRef(
        NodeKind.valueOf(rs.getString("kind")),
        rs.getString("id"),
        rs.getString("name")
    );

    @Override
    public void upsertDocument(String docId, String title, String path, String kind) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("path", path);
        properties.put("kind", kind);

        jdbcClient.sql("""
                INSERT INTO graph_nodes (id, kind, name, confidence, properties)
                VALUES (:id, 'DOCUMENT', :name, 1.0, CAST(:properties AS jsonb))
                ON CONFLICT (id) DO UPDATE SET
                    name = EXCLUDED.name,
                    properties = EXCLUDED.properties,
                    updated_at = NOW()
                """)
            .param("id", docId)
            .param("name", title)
            .param("properties", JsonColumns.write(properties))
            .update();
    }

    @Override
    public void upsertNode(GraphNode node) {
        if (node.kind() == NodeKind.DOCUMENT) {
            throw new ValidationException("Document nodes are written through upsertDocument");
        }

        // single statement: the row lock taken by ON CONFLICT makes compare-and-set atomic
        int rows = jdbcClient.sql("""
                INSERT INTO graph_nodes (id, kind, name, description, confidence, properties,
                                         source_document_id, source_chunk_id)
                VALUES (:id, :kind, :name, :description, :confidence, CAST(:properties AS jsonb),
                        :sourceDocumentId, :sourceChunkId)
                ON CONFLICT (id) DO UPDATE SET
                    kind = EXCLUDED.kind,
                    name = EXCLUDED.name,
                    description = EXCLUDED.description,
                    confidence = EXCLUDED.confidence,
                    properties = EXCLUDED.properties,
                    source_document_id = EXCLUDED.source_document_id,
                    source_chunk_id = EXCLUDED.source_chunk_id,
                    updated_at = NOW()
                WHERE graph_nodes.confidence <= EXCLUDED.confidence
                """)
            .param("id", node.id())
            .param("kind", node.kind().name())
            .param("name", node.name())
            .param("description", node.description())
            .param("confidence", node.confidence())
            .param("properties", JsonColumns.write(node.properties()))
            .param("sourceDocumentId", node.sourceDocumentId())
            .param("sourceChunkId", node.sourceChunkId())
            .update();

        if (rows == 0) {
            log.debug("Kept stored node {}: incoming confidence {} is lower", node.id(), node.confidence());
        }
    }

    @Override
    public void addProvenanceEdge(String nodeId, NodeKind nodeKind, String docId, ProvenanceRole role, double confidence) {
        jdbcClient.sql("""
                INSERT INTO graph_edges (edge_type, from_id, to_id, role, confidence, source_doc_id)
                SELECT 'EXTRACTED_FROM', n.id, d.id, :role, :confidence, d.id
                FROM graph_nodes n, graph_nodes d
                WHERE n.id = :nodeId AND n.kind = :nodeKind
                  AND d.id = :docId AND d.kind = 'DOCUMENT'
                ON CONFLICT (edge_type, from_id, to_id, source_doc_id) DO UPDATE SET
                    role = EXCLUDED.role,
                    confidence = EXCLUDED.confidence
                """)
            .param("nodeId", nodeId)
            .param("nodeKind", nodeKind.name())
            .param("docId", docId)
            .param("role", role.value())
            .param("confidence", confidence)
            .update();
    }

    @Override
    public void addDomainEdge(EdgeType type, String fromId, String toId, Map<String, Object> attributes,
                              double confidence, String sourceDocId) {
        if (!type.isDomain()) {
            throw new ValidationException("Provenance edges are written through addProvenanceEdge");
        }
        if (sourceDocId == null || sourceDocId.isBlank()) {
            throw new ValidationException("Domain edge " + type + " " + fromId + " -> " + toId + " has no source document");
        }

        jdbcClient.sql("""
                INSERT INTO graph_edges (edge_type, from_id, to_id, confidence, source_doc_id, properties)
                SELECT :type, a.id, b.id, :confidence, :sourceDocId, CAST(:properties AS jsonb)
                FROM graph_nodes a, graph_nodes b
                WHERE a.id = :fromId AND b.id = :toId
                ON CONFLICT (edge_type, from_id, to_id, source_doc_id) DO UPDATE SET
                    confidence = EXCLUDED.confidence,
                    properties = EXCLUDED.properties
                """)
            .param("type", type.name())
            .param("fromId", fromId)
            .param("toId", toId)
            .param("confidence", confidence)
            .param("sourceDocId", sourceDocId)
            .param("properties", JsonColumns.write(attributes))
            .update();
    }

    @Override
    @Transactional
    public void deleteBySourceDocument(String docId) {
        List<String> touched = jdbcClient.sql("""
                DELETE FROM graph_edges
                WHERE edge_type = 'EXTRACTED_FROM' AND to_id = :docId
                RETURNING from_id
                """)
            .param("docId", docId)
            .query(String.class)
            .list();

        int domainEdges = jdbcClient.sql("""
                DELETE FROM graph_edges
                WHERE source_doc_id = :docId AND edge_type <> 'EXTRACTED_FROM'
                """)
            .param("docId", docId)
            .update();

        int orphans = touched.isEmpty() ? 0 : jdbcClient.sql("""
                DELETE FROM graph_nodes n
                WHERE n.id IN (:ids)
                  AND n.kind <> 'DOCUMENT'
                  AND NOT EXISTS (
                      SELECT 1 FROM graph_edges e
                      WHERE e.from_id = n.id AND e.edge_type = 'EXTRACTED_FROM'
                  )
                """)
            .param("ids", touched.stream().distinct().toList())
            .update();

        jdbcClient.sql("DELETE FROM graph_nodes WHERE id = :docId AND kind = 'DOCUMENT'")
            .param("docId", docId)
            .update();

        log.info("Graph cleanup for {}: {} domain edges, {} provenance edges, {} orphan nodes removed",
            docId, domainEdges, touched.size(), orphans);
    }

    @Override
    public Optional<GraphNode> getNode(String nodeId) {
        return jdbcClient.sql("SELECT * FROM graph_nodes WHERE id = :id")
            .param("id", nodeId)
            .query(nodeRowMapper)
            .optional();
    }

    @Override
    public List<GraphNode> findNodes(String text, int limit) {
        if (text == null || text.isBlank() || limit <= 0) {
            return List.of();
        }
        return jdbcClient.sql("""
                SELECT * FROM graph_nodes
                WHERE kind <> 'DOCUMENT'
                  AND name ILIKE :pattern ESCAPE '\\'
                ORDER BY confidence DESC, name ASC
                LIMIT :limit
                """)
            .param("pattern", "%" + escapeLike(text.trim()) + "%")
            .param("limit", limit)
            .query(nodeRowMapper)
            .list();
    }

    @Override
    public List<GraphNode> listNodes(NodeKind kind) {
        if (kind == null) {
            return jdbcClient.sql("SELECT * FROM graph_nodes WHERE kind <> 'DOCUMENT' ORDER BY kind, id")
                .query(nodeRowMapper)
                .list();
        }
        return jdbcClient.sql("SELECT * FROM graph_nodes WHERE kind = :kind ORDER BY id")
            .param("kind", kind.name())
            .query(nodeRowMapper)
            .list();
    }

    @Override
    public List<GraphEdge> findEdges(String nodeId) {
        return jdbcClient.sql("""
                SELECT * FROM graph_edges
                WHERE (from_id = :id OR to_id = :id)
                  AND edge_type <> 'EXTRACTED_FROM'
                ORDER BY confidence DESC, id ASC
                """)
            .param("id", nodeId)
            .query(edgeRowMapper)
            .list();
    }

    @Override
    public Neighborhood getNeighborhood(String nodeId, int depth, Set<EdgeType> edgeTypes) {
        GraphNode center = getNode(nodeId).orElse(null);
        if (center == null) {
            return new Neighborhood(null, List.of(), List.of());
        }

        List<String> types = domainTypes(edgeTypes);

        List<NodeRef> nodes = jdbcClient.sql("""
                WITH RECURSIVE walk(node_id, depth, visited) AS (
                    SELECT CAST(:id AS text), 0, ARRAY[CAST(:id AS text)]
                    UNION ALL
                    SELECT nxt.id, w.depth + 1, w.visited || nxt.id
                    FROM walk w
                    JOIN graph_edges e ON (e.from_id = w.node_id OR e.to_id = w.node_id)
                    CROSS JOIN LATERAL (
                        SELECT CASE WHEN e.from_id = w.node_id THEN e.to_id ELSE e.from_id END AS id
                    ) nxt
                    WHERE w.depth < :depth
                      AND e.edge_type IN (:types)
                      AND NOT nxt.id = ANY (w.visited)
                )
                SELECT DISTINCT n.kind, n.id, n.name
                FROM walk w
                JOIN graph_nodes n ON n.id = w.node_id
                WHERE w.depth > 0
                ORDER BY n.kind, n.id
                """)
            .param("id", nodeId)
            .param("depth", Math.max(1, depth))
            .param("types", types)
            .query(nodeRefRowMapper)
            .list();

        List<EdgeType> centerEdgeTypes = jdbcClient.sql("""
                SELECT DISTINCT edge_type FROM graph_edges
                WHERE (from_id = :id OR to_id = :id) AND edge_type IN (:types)
                ORDER BY edge_type
                """)
            .param("id", nodeId)
            .param("types", types)
            .query((rs, rowNum) -> EdgeType.valueOf(rs.getString("edge_type")))
            .list();

        return new Neighborhood(center, nodes, centerEdgeTypes);
    }

    @Override
    public Optional<GraphPath> findPath(String fromId, String toId, int maxDepth) {
        if (getNode(fromId).isEmpty() || getNode(toId).isEmpty()) {
            return Optional.empty();
        }

        Optional<List<String>> ids = jdbcClient.sql("""
                WITH RECURSIVE walk(node_id, depth, visited) AS (
                    SELECT CAST(:fromId AS text), 0, ARRAY[CAST(:fromId AS text)]
                    UNION ALL
                    SELECT nxt.id, w.depth + 1, w.visited || nxt.id
                    FROM walk w
                    JOIN graph_edges e ON (e.from_id = w.node_id OR e.to_id = w.node_id)
                    CROSS JOIN LATERAL (
                        SELECT CASE WHEN e.from_id = w.node_id THEN e.to_id ELSE e.from_id END AS id
                    ) nxt
                    WHERE w.depth < :maxDepth
                      AND w.node_id <> :toId
                      AND e.edge_type <> 'EXTRACTED_FROM'
                      AND NOT nxt.id = ANY (w.visited)
                )
                SELECT visited FROM walk
                WHERE node_id = :toId
                ORDER BY depth ASC
                LIMIT 1
                """)
            .param("fromId", fromId)
            .param("toId", toId)
            .param("maxDepth", Math.max(1, maxDepth))
            .query((rs, rowNum) -> toStringList(rs.getArray("visited")))
            .optional();

        return ids.map(path -> new GraphPath(resolveRefs(path)));
    }

    @Override
    public List<ImpactEntry> getDocumentImpact(String docId) {
        return jdbcClient.sql("""
                SELECT n.kind, n.id, n.name, e.role, e.confidence
                FROM graph_edges e
                JOIN graph_nodes n ON n.id = e.from_id
                WHERE e.edge_type = 'EXTRACTED_FROM' AND e.to_id = :docId
                ORDER BY n.kind, n.id
                """)
            .param("docId", docId)
            .query((rs, rowNum) -> new ImpactEntry(
                NodeKind.valueOf(rs.getString("kind")),
                rs.getString("id"),
                rs.getString("name"),
                ProvenanceRole.fromValue(rs.getString("role")),
                rs.getDouble("confidence")
            ))
            .list();
    }

    @Override
    public List<ProvenanceEntry> getNodeProvenance(String nodeId) {
        return jdbcClient.sql("""
                SELECT d.id, d.name, d.properties ->> 'path' AS path, e.role, e.confidence
                FROM graph_edges e
                JOIN graph_nodes d ON d.id = e.to_id
                WHERE e.edge_type = 'EXTRACTED_FROM' AND e.from_id = :nodeId
                ORDER BY e.confidence DESC, d.id
                """)
            .param("nodeId", nodeId)
            .query((rs, rowNum) -> new ProvenanceEntry(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("path"),
                ProvenanceRole.fromValue(rs.getString("role")),
                rs.getDouble("confidence")
            ))
            .list();
    }

    @Override
    public GraphStats getStats() {
        Map<NodeKind, Long> counts = new EnumMap<>(NodeKind.class);
        jdbcClient.sql("SELECT kind, COUNT(*) AS cnt FROM graph_nodes GROUP BY kind")
            .query((rs, rowNum) -> Map.entry(NodeKind.valueOf(rs.getString("kind")), rs.getLong("cnt")))
            .list()
            .forEach(entry -> counts.put(entry.getKey(), entry.getValue()));
        return GraphStats.fromCounts(counts);
    }

    @Override
    public boolean deleteNode(String nodeId) {
        return jdbcClient.sql("DELETE FROM graph_nodes WHERE id = :id")
            .param("id", nodeId)
            .update() > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Map<String, Object>> executeRawQuery(String query, Map<String, Object> parameters) {
        var statement = jdbcClient.sql(query);
        if (parameters != null && !parameters.isEmpty()) {
            statement = statement.params(parameters);
        }
        return statement.query().listOfRows();
    }

    @Override
    public void ping() {
        try {
            jdbcClient.sql("SELECT COUNT(*) FROM graph_nodes WHERE false").query(Long.class).single();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("graph", e);
        }
    }

    private List<NodeRef> resolveRefs(List<String> ids) {
        Map<String, NodeRef> byId = jdbcClient.sql("SELECT kind, id, name FROM graph_nodes WHERE id IN (:ids)")
            .param("ids", ids)
            .query(nodeRefRowMapper)
            .list()
            .stream()
            .collect(Collectors.toMap(NodeRef::id, Function.identity()));

        List<NodeRef> ordered = new ArrayList<>(ids.size());
        for (String id : ids) {
            NodeRef ref = byId.get(id);
            if (ref != null) {
                ordered.add(ref);
            }
        }
        return ordered;
    }

    private static List<String> domainTypes(Set<EdgeType> requested) {
        Set<EdgeType> types = requested == null || requested.isEmpty() ? EdgeType.DOMAIN : requested;
        List<String> names = types.stream()
            .filter(EdgeType::isDomain)
            .map(EdgeType::name)
            .sorted()
            .toList();
        if (names.isEmpty()) {
            throw new ValidationException("Traversal is limited to domain edge types, got " + requested);
        }
        return names;
    }

    private static List<String> toStringList(Array array) throws SQLException {
        Object[] values = (Object[]) array.getArray();
        return Arrays.stream(values).map(String::valueOf).toList();
    }

    private static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
