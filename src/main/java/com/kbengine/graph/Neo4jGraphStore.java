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
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.types.Node;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Graph store on Neo4j. Node kinds map to labels, edge types to relationship types.
 */
@Slf4j
public class Neo4jGraphStore implements GraphStore {

    private static final String DOMAIN_LABELS = "n:Entity OR n:Concept OR n:Event";

    private final Driver driver;

    public Neo4jGraphStore(Driver driver) {
        this.driver = driver;
    }

    @PostConstruct
    public void init() {
        try (Session session = driver.session()) {
            for (NodeKind kind : NodeKind.values()) {
                session.run("CREATE CONSTRAINT " + kind.label().toLowerCase(Locale.ROOT) + "_id IF NOT EXISTS "
                    + "FOR (n:" + kind.label() + ") REQUIRE n.id IS UNIQUE");
            }
            log.info("Neo4j constraints ensured");
        } catch (Neo4jException e) {
            log.warn("Failed to create Neo4j constraints: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void close() {
        driver.close();
        log.info("Neo4j connection closed");
    }

    @Override
    public void upsertDocument(String docId, String title, String path, String kind) {
        write("""
                MERGE (d:Document {id: $id})
                SET d.name = $name, d.path = $path, d.kind = $kind, d.confidence = 1.0
                """,
            params("id", docId, "name", title, "path", path, "kind", kind));
    }

    @Override
    public void upsertNode(GraphNode node) {
        if (node.kind() == NodeKind.DOCUMENT) {
            throw new ValidationException("Document nodes are written through upsertDocument");
        }

        String label = node.kind().label();
        Map<String, Object> params = params(
            "id", node.id(),
            "name", node.name(),
            "description", node.description(),
            "confidence", node.confidence(),
            "properties", JsonColumns.write(node.properties()),
            "sourceDocumentId", node.sourceDocumentId(),
            "sourceChunkId", node.sourceChunkId() != null ? node.sourceChunkId().toString() : null
        );

        try (Session session = driver.session()) {
            boolean written = session.executeWrite(tx -> {
                // one node per id: a stored node under another kind is relabelled or kept, never duplicated
                List<Double> otherKind = tx.run("""
                        MATCH (n)
                        WHERE (%s) AND n.id = $id AND NOT n:%s
                        SET n.touchedAt = timestamp()
                        RETURN n.confidence AS confidence
                        """.formatted(DOMAIN_LABELS, label), params)
                    .list(record -> record.get("confidence").asDouble(1.0));
                if (!otherKind.isEmpty()) {
                    if (otherKind.get(0) > node.confidence()) {
                        return false;
                    }
                    tx.run("""
                            MATCH (n)
                            WHERE (%s) AND n.id = $id
                            REMOVE n:Entity:Concept:Event
                            SET n:%s
                            """.formatted(DOMAIN_LABELS, label), params).consume();
                }

                // the ON MATCH write takes the node lock before the confidence comparison
                return tx.run("""
                        MERGE (n:%s {id: $id})
                        ON CREATE SET n.confidence = $confidence
                        ON MATCH SET n.touchedAt = timestamp()
                        WITH n
                        WHERE n.confidence <= $confidence
                        SET n.name = $name, n.description = $description, n.confidence = $confidence,
                            n.properties = $properties, n.sourceDocumentId = $sourceDocumentId,
                            n.sourceChunkId = $sourceChunkId
                        RETURN n.id AS id
                        """.formatted(label), params)
                    .hasNext();
            });
            if (!written) {
                log.debug("Kept stored node {}: incoming confidence {} is lower", node.id(), node.confidence());
            }
        } catch (Neo4jException e) {
            throw new StoreUnavailableException("graph", e);
        }
    }

    @Override
    public void addProvenanceEdge(String nodeId, NodeKind nodeKind, String docId, ProvenanceRole role, double confidence) {
        write("""
                MATCH (n:%s {id: $nodeId}), (d:Document {id: $docId})
                MERGE (n)-[r:EXTRACTED_FROM {sourceDocId: $docId}]->(d)
                SET r.role = $role, r.confidence = $confidence
                """.formatted(nodeKind.label()),
            params("nodeId", nodeId, "docId", docId, "role", role.value(), "confidence", confidence));
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

        write("""
                MATCH (a {id: $fromId}), (b {id: $toId})
                MERGE (a)-[r:%s {sourceDocId: $sourceDocId}]->(b)
                SET r.confidence = $confidence, r.properties = $properties
                """.formatted(type.name()),
            params("fromId", fromId, "toId", toId, "sourceDocId", sourceDocId,
                "confidence", confidence, "properties", JsonColumns.write(attributes)));
    }

    @Override
    public void deleteBySourceDocument(String docId) {
        try (Session session = driver.session()) {
            session.executeWrite(tx -> {
                List<String> touched = tx.run("""
                        MATCH (n)-[r:EXTRACTED_FROM]->(d:Document {id: $docId})
                        DELETE r
                        RETURN DISTINCT n.id AS id
                        """, Map.of("docId", docId))
                    .list(record -> record.get("id").asString());
                tx.run("""
                        MATCH ()-[r]->()
                        WHERE r.sourceDocId = $docId AND type(r) <> 'EXTRACTED_FROM'
                        DELETE r
                        """, Map.of("docId", docId)).consume();
                tx.run("""
                        MATCH (n)
                        WHERE (%s) AND n.id IN $ids AND NOT EXISTS { (n)-[:EXTRACTED_FROM]->(:Document) }
                        DETACH DELETE n
                        """.formatted(DOMAIN_LABELS), Map.of("ids", touched)).consume();
                tx.run("MATCH (d:Document {id: $docId}) DETACH DELETE d", Map.of("docId", docId));
                return null;
            });
        } catch (Neo4jException e) {
            throw new StoreUnavailableException("graph", e);
        }
        log.info("Graph cleanup for {} completed", docId);
    }

    @Override
    public Optional<GraphNode> getNode(String nodeId) {
        return read("MATCH (n {id: $id}) RETURN n LIMIT 1", Map.of("id", nodeId),
            record -> toNode(record.get("n").asNode()))
            .stream()
            .findFirst();
    }

    @Override
    public List<GraphNode> findNodes(String text, int limit) {
        if (text == null || text.isBlank() || limit <= 0) {
            return List.of();
        }
        return read("""
                MATCH (n)
                WHERE (%s) AND toLower(n.name) CONTAINS toLower($text)
                RETURN n
                ORDER BY n.confidence DESC, n.name ASC
                LIMIT $limit
                """.formatted(DOMAIN_LABELS),
            Map.of("text", text.trim(), "limit", limit),
            record -> toNode(record.get("n").asNode()));
    }

    @Override
    public List<GraphNode> listNodes(NodeKind kind) {
        String match = kind == null ? "MATCH (n) WHERE " + DOMAIN_LABELS : "MATCH (n:" + kind.label() + ")";
        return read(match + " RETURN n ORDER BY labels(n)[0], n.id", Map.of(),
            record -> toNode(record.get("n").asNode()));
    }

    @Override
    public List<GraphEdge> findEdges(String nodeId) {
        return read("""
                MATCH (a)-[r]->(b)
                WHERE (a.id = $id OR b.id = $id) AND type(r) <> 'EXTRACTED_FROM'
                RETURN type(r) AS type, a.id AS fromId, b.id AS toId, r.confidence AS confidence,
                       r.sourceDocId AS sourceDocId, r.properties AS properties
                ORDER BY r.confidence DESC
                """,
            Map.of("id", nodeId),
            record -> new GraphEdge(
                EdgeType.valueOf(record.get("type").asString()),
                record.get("fromId").asString(),
                record.get("toId").asString(),
                record.get("confidence").asDouble(1.0),
                record.get("sourceDocId").asString(null),
                null,
                JsonColumns.readMap(record.get("properties").asString(null))
            ));
    }

    @Override
    public Neighborhood getNeighborhood(String nodeId, int depth, Set<EdgeType> edgeTypes) {
        GraphNode center = getNode(nodeId).orElse(null);
        if (center == null) {
            return new Neighborhood(null, List.of(), List.of());
        }
        String types = relationshipPattern(edgeTypes);

        List<NodeRef> nodes = read("""
                MATCH (c {id: $id})-[:%s*1..%d]-(n)
                WHERE n.id <> $id
                RETURN DISTINCT labels(n)[0] AS kind, n.id AS id, n.name AS name
                ORDER BY kind, id
                """.formatted(types, Math.max(1, depth)),
            Map.of("id", nodeId),
            this::toRef);

        List<EdgeType> centerTypes = read("""
                MATCH (c {id: $id})-[r:%s]-()
                RETURN DISTINCT type(r) AS type
                ORDER BY type
                """.formatted(types),
            Map.of("id", nodeId),
            record -> EdgeType.valueOf(record.get("type").asString()));

        return new Neighborhood(center, nodes, centerTypes);
    }

    @Override
    public Optional<GraphPath> findPath(String fromId, String toId, int maxDepth) {
        if (fromId.equals(toId)) {
            return getNode(fromId).map(n -> new GraphPath(List.of(new NodeRef(n.kind(), n.id(), n.name()))));
        }
        return read("""
                MATCH (a {id: $fromId}), (b {id: $toId})
                MATCH p = shortestPath((a)-[:%s*1..%d]-(b))
                RETURN [x IN nodes(p) | {kind: labels(x)[0], id: x.id, name: x.name}] AS steps
                """.formatted(relationshipPattern(EdgeType.DOMAIN), Math.max(1, maxDepth)),
            Map.of("fromId", fromId, "toId", toId),
            record -> new GraphPath(record.get("steps").asList(step -> new NodeRef(
                NodeKind.fromValue(step.get("kind").asString()),
                step.get("id").asString(),
                step.get("name").asString(null)
            ))))
            .stream()
            .findFirst();
    }

    @Override
    public List<ImpactEntry> getDocumentImpact(String docId) {
        return read("""
                MATCH (n)-[r:EXTRACTED_FROM]->(d:Document {id: $docId})
                RETURN labels(n)[0] AS kind, n.id AS id, n.name AS name, r.role AS role, r.confidence AS confidence
                ORDER BY kind, id
                """,
            Map.of("docId", docId),
            record -> new ImpactEntry(
                NodeKind.fromValue(record.get("kind").asString()),
                record.get("id").asString(),
                record.get("name").asString(null),
                ProvenanceRole.fromValue(record.get("role").asString()),
                record.get("confidence").asDouble(1.0)
            ));
    }

    @Override
    public List<ProvenanceEntry> getNodeProvenance(String nodeId) {
        return read("""
                MATCH (n {id: $nodeId})-[r:EXTRACTED_FROM]->(d:Document)
                RETURN d.id AS docId, d.name AS title, d.path AS path, r.role AS role, r.confidence AS confidence
                ORDER BY r.confidence DESC, d.id
                """,
            Map.of("nodeId", nodeId),
            record -> new ProvenanceEntry(
                record.get("docId").asString(),
                record.get("title").asString(null),
                record.get("path").asString(null),
                ProvenanceRole.fromValue(record.get("role").asString()),
                record.get("confidence").asDouble(1.0)
            ));
    }

    @Override
    public GraphStats getStats() {
        Map<NodeKind, Long> counts = new EnumMap<>(NodeKind.class);
        read("MATCH (n) RETURN labels(n)[0] AS kind, count(n) AS cnt", Map.of(),
            record -> Map.entry(record.get("kind").asString(), record.get("cnt").asLong()))
            .forEach(entry -> {
                for (NodeKind kind : NodeKind.values()) {
                    if (kind.label().equals(entry.getKey())) {
                        counts.put(kind, entry.getValue());
                    }
                }
            });
        return GraphStats.fromCounts(counts);
    }

    @Override
    public boolean deleteNode(String nodeId) {
        try (Session session = driver.session()) {
            return session.executeWrite(tx -> tx.run("""
                    MATCH (n {id: $id})
                    DETACH DELETE n
                    RETURN count(n) AS deleted
                    """, Map.of("id", nodeId)).single().get("deleted").asLong() > 0);
        } catch (Neo4jException e) {
            throw new StoreUnavailableException("graph", e);
        }
    }

    @Override
    public List<Map<String, Object>> executeRawQuery(String query, Map<String, Object> parameters) {
        Map<String, Object> safeParams = parameters == null ? Map.of() : parameters;
        try (Session session = driver.session()) {
            return session.executeWrite(tx -> tx.run(query, safeParams).list(this::toRow));
        } catch (Neo4jException e) {
            throw new ValidationException("Cypher query failed: " + e.getMessage());
        }
    }

    @Override
    public void ping() {
        try {
            driver.verifyConnectivity();
        } catch (Exception e) {
            throw new StoreUnavailableException("graph", e);
        }
    }

    private void write(String cypher, Map<String, Object> params) {
        try (Session session = driver.session()) {
            session.executeWriteWithoutResult(tx -> tx.run(cypher, params).consume());
        } catch (Neo4jException e) {
            throw new StoreUnavailableException("graph", e);
        }
    }

    private <T> List<T> read(String cypher, Map<String, Object> params, Function<Record, T> mapper) {
        try (Session session = driver.session()) {
            return session.executeRead(tx -> tx.run(cypher, params).list(mapper));
        } catch (Neo4jException e) {
            throw new StoreUnavailableException("graph", e);
        }
    }

    private GraphNode toNode(Node node) {
        String label = node.labels().iterator().next();
        String chunkId = node.get("sourceChunkId").asString(null);
        return new GraphNode(
            node.get("id").asString(),
            NodeKind.fromValue(label),
            node.get("name").asString(null),
            node.get("description").asString(null),
            node.get("confidence").asDouble(1.0),
            label.equals(NodeKind.DOCUMENT.label())
                ? documentProperties(node)
                : JsonColumns.readMap(node.get("properties").asString(null)),
            node.get("sourceDocumentId").asString(null),
            chunkId != null ? UUID.fromString(chunkId) : null
        );
    }

    private static Map<String, Object> documentProperties(Node node) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("path", node.get("path").asString(null));
        properties.put("kind", node.get("kind").asString(null));
        return properties;
    }

    private NodeRef toRef(Record record) {
        return new NodeRef(
            NodeKind.fromValue(record.get("kind").asString()),
            record.get("id").asString(),
            record.get("name").asString(null)
        );
    }

    private Map<String, Object> toRow(Record record) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String key : record.keys()) {
            Value value = record.get(key);
            if ("NODE".equals(value.type().name())) {
                Node node = value.asNode();
                Map<String, Object> properties = new LinkedHashMap<>(node.asMap());
                properties.put("labels", node.labels());
                row.put(key, properties);
            } else {
                row.put(key, value.asObject());
            }
        }
        return row;
    }

    private static String relationshipPattern(Set<EdgeType> requested) {
        Set<EdgeType> types = requested == null || requested.isEmpty() ? EdgeType.DOMAIN : requested;
        List<String> names = types.stream()
            .filter(EdgeType::isDomain)
            .map(EdgeType::name)
            .sorted()
            .collect(Collectors.toCollection(ArrayList::new));
        if (names.isEmpty()) {
            throw new ValidationException("Traversal is limited to domain edge types, got " + requested);
        }
        return String.join("|", names);
    }

    private static Map<String, Object> params(Object... keyValues) {
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            params.put((String) keyValues[i], keyValues[i + 1]);
        }
        return params;
    }
}
