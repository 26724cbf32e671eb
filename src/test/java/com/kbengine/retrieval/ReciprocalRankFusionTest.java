package com.kbengine.retrieval;

import com.kbengine.model.DocumentReference;
import com.kbengine.model.RetrievalMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ReciprocalRankFusionTest {

    private static DocumentReference reference(String url, RetrievalMode mode, double score) {
        return new DocumentReference(url, url, url, null, null, score, "", null, List.of(), null, mode, Map.of());
    }

    @Test
    @DisplayName("A reference ranked first by both lists outranks references found once")
    void sharedTopResultWins() {
        List<DocumentReference> vector = List.of(
            reference("u2", RetrievalMode.VECTOR, 0.9),
            reference("u1", RetrievalMode.VECTOR, 0.8));
        List<DocumentReference> graph = List.of(
            reference("u2", RetrievalMode.GRAPH, 1.0),
            reference("u3", RetrievalMode.GRAPH, 0.7));

        List<DocumentReference> fused = ReciprocalRankFusion.fuse(List.of(vector, graph), 60, 10);

        assertThat(fused).extracting(DocumentReference::url).containsExactly("u2", "u1", "u3");
        assertThat(fused.get(0).score()).isCloseTo(2.0 / 61, within(1e-12));
        assertThat(fused.get(1).score()).isCloseTo(1.0 / 62, within(1e-12));
        assertThat(fused).extracting(DocumentReference::retrievalMode).containsOnly(RetrievalMode.HYBRID);
    }

    @Test
    @DisplayName("The first occurrence of a URL supplies the reference details")
    void keepsFirstSeenReference() {
        DocumentReference fromVector = new DocumentReference("u1", "a.md", "From vector", "Intro", "intro", 0.9,
            "vector snippet", null, List.of(), "default", RetrievalMode.VECTOR, Map.of("chunk_id", "c1"));
        DocumentReference fromGraph = new DocumentReference("u1", "a.md", "From graph", null, null, 1.0,
            "graph snippet", null, List.of(), null, RetrievalMode.GRAPH, Map.of("graph_node_id", "entity:A"));

        List<DocumentReference> fused = ReciprocalRankFusion.fuse(List.of(List.of(fromVector), List.of(fromGraph)),
            ReciprocalRankFusion.DEFAULT_K, 10);

        assertThat(fused).singleElement().satisfies(reference -> {
            assertThat(reference.title()).isEqualTo("From vector");
            assertThat(reference.snippet()).isEqualTo("vector snippet");
            assertThat(reference.metadata()).containsKey("chunk_id");
        });
    }

    @Test
    @DisplayName("Ties keep the order in which references first appeared")
    void tiesAreStable() {
        List<DocumentReference> fused = ReciprocalRankFusion.fuse(List.of(
            List.of(reference("a", RetrievalMode.VECTOR, 0.1)),
            List.of(reference("b", RetrievalMode.GRAPH, 0.9))), 60, 10);

        assertThat(fused).extracting(DocumentReference::url).containsExactly("a", "b");
    }

    @Test
    @DisplayName("Results are truncated to the limit and empty inputs yield nothing")
    void limitAndEmpty() {
        List<DocumentReference> many = List.of(
            reference("a", RetrievalMode.VECTOR, 1),
            reference("b", RetrievalMode.VECTOR, 1),
            reference("c", RetrievalMode.VECTOR, 1));

        assertThat(ReciprocalRankFusion.fuse(List.of(many, List.of()), 60, 2))
            .extracting(DocumentReference::url).containsExactly("a", "b");
        assertThat(ReciprocalRankFusion.fuse(List.of(List.of(), List.of()), 60, 5)).isEmpty();
    }
}
