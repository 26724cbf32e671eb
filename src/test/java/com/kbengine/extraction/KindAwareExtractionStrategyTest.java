package com.kbengine.extraction;

import com.kbengine.graph.GraphStore;
import com.kbengine.model.Chunk;
import com.kbengine.model.Document;
import com.kbengine.model.graph.ExtractionResult;
import com.kbengine.model.graph.GraphNode;
import com.kbengine.model.graph.NodeKind;
import com.kbengine.model.graph.ProvenanceRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KindAwareExtractionStrategyTest {

    @Mock
    private GraphStore graphStore;

    @Mock
    private DocumentKindDetector detector;

    @Mock
    private GraphExtractor entityExtractor;

    private KindAwareExtractionStrategy strategy;

    private final Document document = Document.builder()
        .id(UUID.randomUUID())
        .title("Notes")
        .content("Some notes")
        .relativePath("notes/Notes.md")
        .build();

    private final Chunk chunk = Chunk.builder().id(UUID.randomUUID()).sequence(0).content("Some notes").build();

    @BeforeEach
    void setUp() {
        strategy = new KindAwareExtractionStrategy(graphStore, detector, List.of(entityExtractor),
            new DocumentNodeExtractor(graphStore), new GraphWriteLock());
    }

    @Test
    @DisplayName("The first supporting extractor handles the document")
    void delegatesToSupportingExtractor() {
        KindDetection detection = new KindDetection(DocumentKind.ENTITY, 1.0, "front-matter");
        ExtractionResult expected = new ExtractionResult(5, 7, "entity");
        when(detector.detect(document)).thenReturn(detection);
        when(entityExtractor.supports(document, detection)).thenReturn(true);
        when(entityExtractor.name()).thenReturn("entity");
        when(entityExtractor.extract(document, List.of(chunk), detection)).thenReturn(expected);

        assertThat(strategy.extractAndStore(document, List.of(chunk))).isEqualTo(expected);
        verify(graphStore, never()).deleteBySourceDocument(any());
    }

    @Test
    @DisplayName("Unsupported documents get the document node representation")
    void fallsBackToDocumentNode() {
        KindDetection detection = KindDetection.unknown();
        when(detector.detect(document)).thenReturn(detection);
        when(entityExtractor.supports(document, detection)).thenReturn(false);

        ExtractionResult result = strategy.extractAndStore(document, List.of(chunk));

        assertThat(result).isEqualTo(new ExtractionResult(2, 1, "document"));
        String docId = document.id().toString();
        verify(graphStore).upsertDocument(docId, "Notes", "notes/Notes.md", "unknown");

        ArgumentCaptor<GraphNode> node = ArgumentCaptor.forClass(GraphNode.class);
        verify(graphStore).upsertNode(node.capture());
        assertThat(node.getValue().id()).isEqualTo("doc:" + docId);
        assertThat(node.getValue().kind()).isEqualTo(NodeKind.ENTITY);
        assertThat(node.getValue().confidence()).isEqualTo(0.5);
        assertThat(node.getValue().description()).isEqualTo("Document: Notes");
        assertThat(node.getValue().sourceChunkId()).isEqualTo(chunk.id());
        verify(graphStore).addProvenanceEdge("doc:" + docId, NodeKind.ENTITY, docId, ProvenanceRole.PRIMARY, 0.5);
    }

    @Test
    @DisplayName("A failing extractor is cleaned up and degraded to the document node")
    void degradesOnFailure() {
        KindDetection detection = new KindDetection(DocumentKind.ENTITY, 0.8, "content");
        when(detector.detect(document)).thenReturn(detection);
        when(entityExtractor.supports(document, detection)).thenReturn(true);
        when(entityExtractor.name()).thenReturn("entity");
        when(entityExtractor.extract(any(), any(), any())).thenThrow(new IllegalStateException("malformed table"));

        ExtractionResult result = strategy.extractAndStore(document, List.of(chunk));

        assertThat(result.strategy()).isEqualTo("document");
        InOrder order = inOrder(graphStore);
        order.verify(graphStore).deleteBySourceDocument(document.id().toString());
        order.verify(graphStore).upsertDocument(any(), any(), any(), any());
    }

    @Test
    @DisplayName("A failure of the fallback itself propagates")
    void fallbackFailurePropagates() {
        KindDetection detection = KindDetection.unknown();
        when(detector.detect(document)).thenReturn(detection);
        when(entityExtractor.supports(document, detection)).thenReturn(false);
        doThrow(new IllegalStateException("graph down")).when(graphStore).upsertDocument(any(), any(), any(), any());

        assertThatThrownBy(() -> strategy.extractAndStore(document, List.of(chunk)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("graph down");
        verify(graphStore, never()).deleteBySourceDocument(any());
    }

    @Test
    @DisplayName("Deleting by document removes the document's graph contribution")
    void deleteByDocument() {
        strategy.deleteByDocument("doc-1");

        verify(graphStore).deleteBySourceDocument("doc-1");
    }

    @Test
    @DisplayName("Selection prefers earlier extractors")
    void selectionOrder() {
        GraphExtractor second = mock(GraphExtractor.class);
        KindAwareExtractionStrategy ordered = new KindAwareExtractionStrategy(graphStore, detector,
            List.of(entityExtractor, second), new DocumentNodeExtractor(graphStore), new GraphWriteLock());
        KindDetection detection = new KindDetection(DocumentKind.ENTITY, 1.0, "front-matter");
        when(entityExtractor.supports(document, detection)).thenReturn(true);

        assertThat(ordered.select(document, detection)).isSameAs(entityExtractor);
        verify(second, never()).supports(any(), any());
    }
}
