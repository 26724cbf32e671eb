package com.kbengine.extraction;

import com.kbengine.graph.GraphStore;
import com.kbengine.model.Chunk;
import com.kbengine.model.Document;
import com.kbengine.model.graph.ExtractionResult;
import com.kbengine.model.graph.GraphNode;
import com.kbengine.model.graph.NodeKind;
import com.kbengine.model.graph.ProvenanceRole;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal representation used for every document no other extractor understands: the document node
 * plus one generic node with primary provenance, so deletion and impact queries still cover it.
 */
@RequiredArgsConstructor
public class DocumentNodeExtractor implements GraphExtractor {

    static final double CONFIDENCE = 0.5;

    private final GraphStore graphStore;

    @Override
    public String name() {
        return "document";
    }

    @Override
    public boolean supports(Document document, KindDetection detection) {
        return true;
    }

    @Override
    public ExtractionResult extract(Document document, List<Chunk> chunks, KindDetection detection) {
        String docId = document.id().toString();
        graphStore.upsertDocument(docId, document.title(), document.displayPath(), detection.kind().value());

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("document_kind", detection.kind().value());
        properties.put("path", document.displayPath());

        String nodeId = NodeIds.document(docId);
        graphStore.upsertNode(GraphNode.builder()
            .id(nodeId)
            .kind(NodeKind.ENTITY)
            .name(document.title())
            .description("Document: " + document.title())
            .confidence(CONFIDENCE)
            .properties(properties)
            .sourceDocumentId(docId)
            .sourceChunkId(chunks == null || chunks.isEmpty() ? null : chunks.get(0).id())
            .build());
        graphStore.addProvenanceEdge(nodeId, NodeKind.ENTITY, docId, ProvenanceRole.PRIMARY, CONFIDENCE);
        return new ExtractionResult(2, 1, name());
    }
}
