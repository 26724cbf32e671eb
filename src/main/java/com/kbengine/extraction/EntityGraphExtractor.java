package com.kbengine.extraction;

import com.kbengine.graph.GraphStore;
import com.kbengine.model.Chunk;
import com.kbengine.model.Document;
import com.kbengine.model.graph.EdgeType;
import com.kbengine.model.graph.ExtractionResult;
import com.kbengine.model.graph.GraphNode;
import com.kbengine.model.graph.NodeKind;
import com.kbengine.model.graph.ProvenanceRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Writes an entity definition into the graph: the entity itself, its attributes and states as concepts,
 * the entities it points at as low-confidence stubs, and the events it emits or consumes.
 */
@Slf4j
@RequiredArgsConstructor
public class EntityGraphExtractor implements GraphExtractor {

    static final double PRIMARY_CONFIDENCE = 1.0;
    static final double CONCEPT_CONFIDENCE = 0.95;
    static final double EVENT_CONFIDENCE = 0.9;
    static final double STUB_CONFIDENCE = 0.7;
    static final double ATTRIBUTE_REFERENCE_CONFIDENCE = 0.9;
    static final double RELATION_CONFIDENCE = 0.95;

    private final GraphStore graphStore;
    private final EntityDocumentParser parser;

    @Override
    public String name() {
        return "entity";
    }

    @Override
    public boolean supports(Document document, KindDetection detection) {
        return detection.kind() == DocumentKind.ENTITY && detection.confidence() >= 0.5;
    }

    @Override
    public ExtractionResult extract(Document document, List<Chunk> chunks, KindDetection detection) {
        ParsedEntity entity = parser.parse(document);
        if (entity.name() == null || entity.name().isBlank()) {
            throw new IllegalStateException("Entity document has no name: " + document.displayPath());
        }

        String docId = document.id().toString();
        Counter counter = new Counter();

        graphStore.upsertDocument(docId, document.title(), document.displayPath(), DocumentKind.ENTITY.value());
        counter.node();

        String entityId = NodeIds.entity(entity.name());
        Map<String, Object> entityProperties = new LinkedHashMap<>();
        entityProperties.put("aliases", entity.aliases());
        putIfPresent(entityProperties, "code_class", entity.codeClass());
        putIfPresent(entityProperties, "code_table", entity.codeTable());
        primary(counter, docId, chunks, GraphNode.builder()
            .id(entityId)
            .kind(NodeKind.ENTITY)
            .name(entity.name())
            .description(entity.description())
            .confidence(PRIMARY_CONFIDENCE)
            .properties(entityProperties)
            .build());

        for (ParsedEntity.Attribute attribute : entity.attributes()) {
            String conceptId = NodeIds.attribute(entity.name(), attribute.name());
            Map<String, Object> properties = new LinkedHashMap<>();
            properties.put("entity", entity.name());
            putIfPresent(properties, "code", attribute.code());
            putIfPresent(properties, "type", attribute.type());
            putIfPresent(properties, "reference", attribute.referenceEntity());
            primary(counter, docId, chunks, GraphNode.builder()
                .id(conceptId)
                .kind(NodeKind.CONCEPT)
                .name(entity.name() + "." + attribute.name())
                .description(attribute.description())
                .confidence(CONCEPT_CONFIDENCE)
                .properties(properties)
                .build());
            edge(counter, EdgeType.CONTAINS, entityId, conceptId, Map.of(), PRIMARY_CONFIDENCE, docId);

            if (attribute.isReference() && stub(counter, docId, entity.name(), attribute.referenceEntity(),
                "Referenced by " + entity.name() + "." + attribute.name())) {
                edge(counter, EdgeType.REFERENCES, entityId, NodeIds.entity(attribute.referenceEntity()),
                    Map.of("via_attribute", attribute.code() != null ? attribute.code() : attribute.name()),
                    ATTRIBUTE_REFERENCE_CONFIDENCE, docId);
            }
        }

        for (ParsedEntity.State state : entity.states()) {
            String stateId = NodeIds.state(entity.name(), state.name());
            Map<String, Object> properties = new LinkedHashMap<>();
            properties.put("entity", entity.name());
            properties.put("is_initial", state.initial());
            properties.put("is_final", state.terminal());
            primary(counter, docId, chunks, GraphNode.builder()
                .id(stateId)
                .kind(NodeKind.CONCEPT)
                .name(entity.name() + "::" + state.name())
                .description(state.description())
                .confidence(CONCEPT_CONFIDENCE)
                .properties(properties)
                .build());
            edge(counter, EdgeType.CONTAINS, entityId, stateId, Map.of(), PRIMARY_CONFIDENCE, docId);
        }

        for (ParsedEntity.Relation relation : entity.relations()) {
            if (!stub(counter, docId, entity.name(), relation.targetEntity(),
                "Related to " + entity.name() + " via " + relation.name())) {
                continue;
            }
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("via_attribute", relation.code() != null ? relation.code() : relation.name());
            putIfPresent(attributes, "cardinality", relation.cardinality());
            putIfPresent(attributes, "description", relation.description());
            edge(counter, EdgeType.REFERENCES, entityId, NodeIds.entity(relation.targetEntity()),
                attributes, RELATION_CONFIDENCE, docId);
        }

        for (String event : entity.eventsEmitted()) {
            event(counter, docId, chunks, event, "Emitted by " + entity.name());
            edge(counter, EdgeType.PRODUCES, entityId, NodeIds.event(event), Map.of(), EVENT_CONFIDENCE, docId);
        }
        for (String event : entity.eventsConsumed()) {
            event(counter, docId, chunks, event, "Consumed by " + entity.name());
            edge(counter, EdgeType.CONSUMES, entityId, NodeIds.event(event), Map.of(), EVENT_CONFIDENCE, docId);
        }

        log.debug("Entity {} from document {}: {} attributes, {} states, {} relations",
            entity.name(), docId, entity.attributes().size(), entity.states().size(), entity.relations().size());
        return new ExtractionResult(counter.nodes, counter.edges, name());
    }

    private void primary(Counter counter, String docId, List<Chunk> chunks, GraphNode node) {
        GraphNode located = node.toBuilder()
            .sourceDocumentId(docId)
            .sourceChunkId(locateChunk(chunks, node.name()))
            .build();
        graphStore.upsertNode(located);
        graphStore.addProvenanceEdge(located.id(), located.kind(), docId, ProvenanceRole.PRIMARY, located.confidence());
        counter.node();
        counter.edge();
    }

    private void event(Counter counter, String docId, List<Chunk> chunks, String event, String description) {
        primary(counter, docId, chunks, GraphNode.builder()
            .id(NodeIds.event(event))
            .kind(NodeKind.EVENT)
            .name(event)
            .description(description)
            .confidence(EVENT_CONFIDENCE)
            .build());
    }

    /**
     * Writes a stub for an entity defined elsewhere. A reference back to the entity itself is skipped so the
     * primary provenance is never joined by a referenced one from the same document.
     */
    private boolean stub(Counter counter, String docId, String owner, String target, String description) {
        if (target == null || target.isBlank() || target.trim().equalsIgnoreCase(owner.trim())) {
            return false;
        }
        String stubId = NodeIds.entity(target);
        graphStore.upsertNode(GraphNode.builder()
            .id(stubId)
            .kind(NodeKind.ENTITY)
            .name(target.trim())
            .description(description)
            .confidence(STUB_CONFIDENCE)
            .properties(Map.of("stub", true))
            .build());
        graphStore.addProvenanceEdge(stubId, NodeKind.ENTITY, docId, ProvenanceRole.REFERENCED, STUB_CONFIDENCE);
        counter.node();
        counter.edge();
        return true;
    }

    private void edge(Counter counter, EdgeType type, String fromId, String toId, Map<String, Object> attributes,
                      double confidence, String docId) {
        graphStore.addDomainEdge(type, fromId, toId, attributes, confidence, docId);
        counter.edge();
    }

    static UUID locateChunk(List<Chunk> chunks, String name) {
        if (chunks == null || chunks.isEmpty()) {
            return null;
        }
        if (name != null) {
            String needle = name.toLowerCase(Locale.ROOT);
            for (Chunk chunk : chunks) {
                if (chunk.content() != null && chunk.content().toLowerCase(Locale.ROOT).contains(needle)) {
                    return chunk.id();
                }
            }
        }
        return chunks.get(0).id();
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private static final class Counter {
        private int nodes;
        private int edges;

        void node() {
            nodes++;
        }

        void edge() {
            edges++;
        }
    }
}
