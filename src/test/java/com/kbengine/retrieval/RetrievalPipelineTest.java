package com.kbengine.retrieval;

import com.kbengine.config.SearchProperties;
import com.kbengine.config.UrlProperties;
import com.kbengine.embedding.TextEmbedder;
import com.kbengine.exception.ValidationException;
import com.kbengine.graph.GraphStore;
import com.kbengine.model.Chunk;
import com.kbengine.model.ChunkType;
import com.kbengine.model.Document;
import com.kbengine.model.DocumentReference;
import com.kbengine.model.RetrievalMode;
import com.kbengine.model.RetrievalResponse;
import com.kbengine.model.ScoredChunk;
import com.kbengine.model.SearchFilters;
import com.kbengine.model.SearchRequest;
import com.kbengine.model.graph.EdgeType;
import com.kbengine.model.graph.GraphEdge;
import com.kbengine.model.graph.GraphNode;
import com.kbengine.model.graph.NodeKind;
import com.kbengine.repository.DocumentStore;
import com.kbengine.repository.VectorIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetrievalPipelineTest {

    @Mock
    private TextEmbedder embedder;

    @Mock
    private VectorIndex vectorIndex;

    @Mock
    private DocumentStore documentStore;

    @Mock
    private GraphStore graphStore;

    private RetrievalPipeline pipeline;

    private final float[] queryVector = {0.1f, 0.2f};

    private final Document userDoc = Document.builder()
        .id(UUID.randomUUID())
        .title("User")
        .content("# User\nA person with an account.")
        .relativePath("entities/User.md")
        .domain("accounts")
        .tags(List.of("core"))
        .build();

    private final Chunk userChunk = Chunk.builder()
        .id(UUID.randomUUID())
        .documentId(userDoc.id())
        .sequence(0)
        .headingPath(List.of("User", "Attributes"))
        .content("| email | string |")
        .chunkType(ChunkType.ENTITY)
        .build();

    @BeforeEach
    void setUp() {
        pipeline = new RetrievalPipeline(embedder, vectorIndex, documentStore, Optional.of(graphStore),
            SearchProperties.defaults(), new UrlResolver(new UrlProperties(Map.of())), Runnable::run);
    }

    private GraphNode userNode(UUID chunkId) {
        return GraphNode.builder()
            .id("entity:User")
            .kind(NodeKind.ENTITY)
            .name("User")
            .description("A person with an account.")
            .confidence(1.0)
            .sourceDocumentId(userDoc.id().toString())
            .sourceChunkId(chunkId)
            .build();
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"  "})
        void rejectsBlankQuery(String query) {
            assertThatThrownBy(() -> pipeline.search(SearchRequest.of(query, RetrievalMode.VECTOR)))
                .isInstanceOf(ValidationException.class);
            verifyNoInteractions(embedder);
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 101})
        void rejectsLimit(int limit) {
            assertThatThrownBy(() -> pipeline.search(
                new SearchRequest("user", RetrievalMode.VECTOR, null, limit, null)))
                .isInstanceOf(ValidationException.class);
        }

        @ParameterizedTest
        @ValueSource(doubles = {-0.1, 1.5})
        void rejectsThreshold(double threshold) {
            assertThatThrownBy(() -> pipeline.search(
                new SearchRequest("user", RetrievalMode.VECTOR, null, null, threshold)))
                .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("Vector mode")
    class VectorMode {

        @Test
        @DisplayName("Hits become references with chunk location and metadata")
        void buildsReferences() {
            when(embedder.embedQuery("email")).thenReturn(queryVector);
            when(vectorIndex.search(queryVector, 10, SearchFilters.NONE, 0.5))
                .thenReturn(List.of(new ScoredChunk(userChunk.id(), userDoc.id(), 0.87)));
            when(documentStore.findChunk(userChunk.id())).thenReturn(Optional.of(userChunk));
            when(documentStore.findById(userDoc.id())).thenReturn(Optional.of(userDoc));

            RetrievalResponse response = pipeline.search(SearchRequest.of("email", RetrievalMode.VECTOR));

            assertThat(response.totalCount()).isEqualTo(1);
            DocumentReference reference = response.references().get(0);
            assertThat(reference.url()).isEqualTo("doc://" + userDoc.id() + "#attributes");
            assertThat(reference.sectionTitle()).isEqualTo("Attributes");
            assertThat(reference.score()).isEqualTo(0.87);
            assertThat(reference.chunkType()).isEqualTo("entity");
            assertThat(reference.retrievalMode()).isEqualTo(RetrievalMode.VECTOR);
            assertThat(reference.metadata())
                .containsEntry("document_id", userDoc.id().toString())
                .containsEntry("chunk_id", userChunk.id().toString());
            verifyNoInteractions(graphStore);
        }

        @Test
        @DisplayName("Hits whose chunk has disappeared are skipped")
        void skipsStaleHits() {
            UUID stale = UUID.randomUUID();
            when(embedder.embedQuery("email")).thenReturn(queryVector);
            when(vectorIndex.search(any(), anyInt(), any(), any()))
                .thenReturn(List.of(new ScoredChunk(stale, userDoc.id(), 0.9)));
            when(documentStore.findChunk(stale)).thenReturn(Optional.empty());

            assertThat(pipeline.search(SearchRequest.of("email", RetrievalMode.VECTOR)).references()).isEmpty();
        }

        @Test
        @DisplayName("An explicit threshold and limit override the defaults")
        void explicitParameters() {
            when(embedder.embedQuery("email")).thenReturn(queryVector);
            when(vectorIndex.search(queryVector, 3, SearchFilters.NONE, 0.0)).thenReturn(List.of());

            pipeline.search(new SearchRequest("email", RetrievalMode.VECTOR, null, 3, 0.0));

            verify(vectorIndex).search(queryVector, 3, SearchFilters.NONE, 0.0);
        }
    }

    @Nested
    @DisplayName("Graph mode")
    class GraphMode {

        @Test
        @DisplayName("Nodes resolve through their source chunk and carry relationship context")
        void resolvesThroughChunk() {
            GraphNode node = userNode(userChunk.id());
            when(graphStore.findNodes("user", 20)).thenReturn(List.of(node));
            when(documentStore.findChunk(userChunk.id())).thenReturn(Optional.of(userChunk));
            when(documentStore.findById(userDoc.id())).thenReturn(Optional.of(userDoc));
            when(graphStore.findEdges("entity:User")).thenReturn(List.of(
                new GraphEdge(EdgeType.REFERENCES, "entity:User", "entity:Order", 0.9, "d", null, Map.of()),
                new GraphEdge(EdgeType.REFERENCES, "entity:Invoice", "entity:User", 0.9, "d", null, Map.of())));
            when(graphStore.getNode("entity:Order")).thenReturn(Optional.of(GraphNode.builder()
                .id("entity:Order").kind(NodeKind.ENTITY).name("Order").confidence(1.0).build()));
            when(graphStore.getNode("entity:Invoice")).thenReturn(Optional.empty());

            RetrievalResponse response = pipeline.search(SearchRequest.of("user", RetrievalMode.GRAPH));

            DocumentReference reference = response.references().get(0);
            assertThat(reference.retrievalMode()).isEqualTo(RetrievalMode.GRAPH);
            assertThat(reference.score()).isEqualTo(1.0);
            assertThat(reference.snippet()).isEqualTo("| email | string |");
            assertThat(reference.chunkType()).isEqualTo("entity");
            assertThat(reference.metadata())
                .containsEntry("graph_node_id", "entity:User")
                .containsEntry("node_type", "Entity")
                .containsEntry("resolved_via", "chunk");
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> relationships = (List<Map<String, Object>>) reference.metadata().get("relationships");
            assertThat(relationships).extracting(r -> r.get("direction")).containsExactly("outgoing", "incoming");
            assertThat(relationships).extracting(r -> r.get("related")).containsExactly("Order", "entity:Invoice");
            verifyNoInteractions(embedder, vectorIndex);
        }

        @Test
        @DisplayName("Scores grow with the number of relationships but stay at most 1")
        void scoreFromConfidenceAndDegree() {
            GraphNode stub = GraphNode.builder().id("entity:Order").kind(NodeKind.ENTITY).name("Order")
                .confidence(0.7).sourceDocumentId(userDoc.id().toString()).build();
            when(graphStore.findNodes("order", 20)).thenReturn(List.of(stub));
            when(documentStore.findById(userDoc.id())).thenReturn(Optional.of(userDoc));
            when(graphStore.findEdges("entity:Order")).thenReturn(List.of(
                new GraphEdge(EdgeType.REFERENCES, "entity:User", "entity:Order", 0.9, "d", null, Map.of())));
            when(graphStore.getNode("entity:User")).thenReturn(Optional.of(userNode(null)));

            DocumentReference reference = pipeline.search(SearchRequest.of("order", RetrievalMode.GRAPH))
                .references().get(0);

            assertThat(reference.score()).isCloseTo(0.77, within(1e-9));
            assertThat(reference.metadata()).containsEntry("resolved_via", "document").doesNotContainKey("chunk_id");
            assertThat(reference.snippet()).isEqualTo("Graph node: Order");
        }

        @Test
        @DisplayName("Nodes resolved without a chunk describe themselves and are typed as graph nodes")
        void chunklessSnippet() {
            GraphNode described = userNode(null);
            when(graphStore.findNodes("user", 20)).thenReturn(List.of(described));
            when(documentStore.findById(userDoc.id())).thenReturn(Optional.of(userDoc));
            when(graphStore.findEdges("entity:User")).thenReturn(List.of());

            DocumentReference reference = pipeline.search(SearchRequest.of("user", RetrievalMode.GRAPH))
                .references().get(0);

            assertThat(reference.snippet()).isEqualTo("A person with an account.");
            assertThat(reference.chunkType()).isEqualTo("graph_node");
            assertThat(reference.sectionTitle()).isNull();
        }

        @Test
        @DisplayName("Nodes without a source fall back to a bounded title match, and duplicates collapse")
        void titleFallbackAndDedup() {
            GraphNode first = GraphNode.builder().id("entity:User").kind(NodeKind.ENTITY).name("User")
                .confidence(0.7).build();
            GraphNode sameDoc = GraphNode.builder().id("concept:User.email").kind(NodeKind.CONCEPT).name("User.email")
                .confidence(0.6).sourceDocumentId(userDoc.id().toString()).build();
            GraphNode twice = GraphNode.builder().id("concept:User.name").kind(NodeKind.CONCEPT).name("User.name")
                .confidence(0.6).sourceDocumentId(userDoc.id().toString()).build();
            when(graphStore.findNodes("user", 20)).thenReturn(List.of(first, sameDoc, twice));
            when(documentStore.findByTitleContaining("User", 1)).thenReturn(List.of(userDoc));
            when(documentStore.findById(userDoc.id())).thenReturn(Optional.of(userDoc));
            when(graphStore.findEdges(anyString())).thenReturn(List.of());

            List<DocumentReference> references = pipeline.search(SearchRequest.of("user", RetrievalMode.GRAPH))
                .references();

            assertThat(references).hasSize(2);
            assertThat(references.get(0).metadata()).containsEntry("resolved_via", "title");
            assertThat(references.get(1).metadata()).containsEntry("graph_node_id", "concept:User.email");
        }

        @Test
        @DisplayName("Filters apply to the resolved document")
        void appliesFilters() {
            when(graphStore.findNodes("user", 20)).thenReturn(List.of(userNode(userChunk.id())));
            when(documentStore.findChunk(userChunk.id())).thenReturn(Optional.of(userChunk));
            when(documentStore.findById(userDoc.id())).thenReturn(Optional.of(userDoc));

            SearchRequest request = new SearchRequest("user", RetrievalMode.GRAPH,
                new SearchFilters("billing", null, null, null), null, null);

            assertThat(pipeline.search(request).references()).isEmpty();
            verify(graphStore, never()).findEdges(any());
        }

        @Test
        @DisplayName("Without a graph backend graph search finds nothing")
        void noGraphBackend() {
            RetrievalPipeline withoutGraph = new RetrievalPipeline(embedder, vectorIndex, documentStore,
                Optional.empty(), SearchProperties.defaults(), new UrlResolver(new UrlProperties(Map.of())),
                Runnable::run);

            assertThat(withoutGraph.search(SearchRequest.of("user", RetrievalMode.GRAPH)).references()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Hybrid mode")
    class HybridMode {

        @Test
        @DisplayName("A document found by both legs is ranked first")
        void fusesBothLegs() {
            Document orderDoc = Document.builder().id(UUID.randomUUID()).title("Order").content("Order")
                .relativePath("entities/Order.md").build();
            Chunk orderChunk = Chunk.builder().id(UUID.randomUUID()).documentId(orderDoc.id()).sequence(0)
                .content("Order").build();
            Chunk userIntro = userChunk.toBuilder().id(UUID.randomUUID()).headingPath(List.of()).build();

            when(embedder.embedQuery("user")).thenReturn(queryVector);
            when(vectorIndex.search(eq(queryVector), eq(10), any(), eq(0.5))).thenReturn(List.of(
                new ScoredChunk(orderChunk.id(), orderDoc.id(), 0.9),
                new ScoredChunk(userIntro.id(), userDoc.id(), 0.8)));
            when(documentStore.findChunk(orderChunk.id())).thenReturn(Optional.of(orderChunk));
            when(documentStore.findChunk(userIntro.id())).thenReturn(Optional.of(userIntro));
            when(documentStore.findById(orderDoc.id())).thenReturn(Optional.of(orderDoc));
            when(documentStore.findById(userDoc.id())).thenReturn(Optional.of(userDoc));

            when(graphStore.findNodes("user", 20)).thenReturn(List.of(userNode(userIntro.id())));
            when(graphStore.findEdges("entity:User")).thenReturn(List.of());

            List<DocumentReference> references = pipeline.search(SearchRequest.of("user", RetrievalMode.HYBRID))
                .references();

            assertThat(references).extracting(DocumentReference::title).containsExactly("User", "Order");
            assertThat(references).extracting(DocumentReference::retrievalMode).containsOnly(RetrievalMode.HYBRID);
            assertThat(references.get(0).score()).isCloseTo(1.0 / 62 + 1.0 / 61,
                within(1e-12));
        }
    }
}
