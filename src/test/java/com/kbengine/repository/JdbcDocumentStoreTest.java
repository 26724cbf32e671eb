package com.kbengine.repository;

import com.kbengine.exception.EntityNotFoundException;
import com.kbengine.model.Chunk;
import com.kbengine.model.ChunkType;
import com.kbengine.model.ContentFormat;
import com.kbengine.model.Document;
import com.kbengine.model.DocumentStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.simple.JdbcClient;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcDocumentStoreTest extends BaseIntegrationTest {

    @Autowired
    private DocumentStore documentStore;

    @Autowired
    private JdbcClient jdbcClient;

    @BeforeEach
    void cleanTables() {
        jdbcClient.sql("DELETE FROM chunk_embeddings").update();
        jdbcClient.sql("DELETE FROM documents").update();
    }

    private Document document(String title, String externalId) {
        return Document.builder()
            .title(title)
            .content("# " + title + "\n\nSome content")
            .format(ContentFormat.MARKDOWN)
            .externalId(externalId)
            .repoName("docs")
            .relativePath("entities/" + title + ".md")
            .domain("sales")
            .tags(List.of("core", "entity"))
            .metadata(Map.of("kind", "entity"))
            .build();
    }

    @Nested
    @DisplayName("Documents")
    class Documents {

        @Test
        @DisplayName("Saving assigns an id and round-trips every JSON column")
        void saveAssignsId() {
            Document saved = documentStore.save(document("User", "docs:entities/User.md"));

            assertThat(saved.id()).isNotNull();
            assertThat(saved.status()).isEqualTo(DocumentStatus.PENDING);
            assertThat(saved.createdAt()).isNotNull();

            Document loaded = documentStore.findById(saved.id()).orElseThrow();
            assertThat(loaded.tags()).containsExactly("core", "entity");
            assertThat(loaded.metadata()).containsEntry("kind", "entity");
            assertThat(loaded.kind()).isEqualTo("entity");
        }

        @Test
        @DisplayName("Saving with an existing id replaces the stored row")
        void saveReplaces() {
            Document saved = documentStore.save(document("User", "docs:entities/User.md"));

            documentStore.save(saved.toBuilder().content("changed").contentHash("abc").build());

            Document loaded = documentStore.findById(saved.id()).orElseThrow();
            assertThat(loaded.content()).isEqualTo("changed");
            assertThat(loaded.contentHash()).isEqualTo("abc");
        }

        @Test
        @DisplayName("External ids are unique")
        void externalIdIsUnique() {
            documentStore.save(document("User", "docs:entities/User.md"));

            assertThatThrownBy(() -> documentStore.save(document("User copy", "docs:entities/User.md")))
                .isInstanceOf(DuplicateKeyException.class);
        }

        @Test
        @DisplayName("Lookups by external id and repository")
        void lookups() {
            Document user = documentStore.save(document("User", "docs:entities/User.md"));
            documentStore.save(document("Order", "docs:entities/Order.md"));

            assertThat(documentStore.findByExternalId("docs:entities/User.md")).map(Document::id).contains(user.id());
            assertThat(documentStore.findByExternalId("docs:missing.md")).isEmpty();
            assertThat(documentStore.findByRepository("docs")).extracting(Document::title)
                .containsExactly("Order", "User");
        }

        @Test
        @DisplayName("Title search is case-insensitive, bounded and treats wildcards literally")
        void findByTitle() {
            documentStore.save(document("Order", "a"));
            documentStore.save(document("OrderLine", "b"));

            assertThat(documentStore.findByTitleContaining("order", 1)).extracting(Document::title)
                .containsExactly("Order");
            assertThat(documentStore.findByTitleContaining("order", 10)).hasSize(2);
            assertThat(documentStore.findByTitleContaining("_", 10)).isEmpty();
            assertThat(documentStore.findByTitleContaining(" ", 10)).isEmpty();
        }

        @Test
        @DisplayName("Status updates record the error and the indexing time")
        void updateStatus() {
            Document saved = documentStore.save(document("User", "x"));

            documentStore.updateStatus(saved.id(), DocumentStatus.FAILED, "boom");
            Document failed = documentStore.findById(saved.id()).orElseThrow();
            assertThat(failed.status()).isEqualTo(DocumentStatus.FAILED);
            assertThat(failed.errorMessage()).isEqualTo("boom");
            assertThat(failed.indexedAt()).isNull();

            documentStore.updateStatus(saved.id(), DocumentStatus.INDEXED, null);
            assertThat(documentStore.findById(saved.id()).orElseThrow().indexedAt()).isNotNull();
        }

        @Test
        @DisplayName("Updating the status of an unknown document fails")
        void updateStatusOfUnknown() {
            assertThatThrownBy(() -> documentStore.updateStatus(UUID.randomUUID(), DocumentStatus.INDEXED, null))
                .isInstanceOf(EntityNotFoundException.class);
        }

        @Test
        @DisplayName("Deleting a document removes its chunks")
        void deleteCascadesToChunks() {
            Document saved = documentStore.save(document("User", "x"));
            documentStore.saveChunks(saved.id(), List.of(Chunk.builder().sequence(0).content("a").build()));

            assertThat(documentStore.delete(saved.id())).isTrue();
            assertThat(documentStore.delete(saved.id())).isFalse();
            assertThat(documentStore.findChunks(saved.id())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Chunks")
    class Chunks {

        @Test
        @DisplayName("Chunks are stored with their headings and returned in sequence order")
        void saveAndFindChunks() {
            Document saved = documentStore.save(document("User", "x"));

            List<Chunk> chunks = documentStore.saveChunks(saved.id(), List.of(
                Chunk.builder().sequence(1).content("second").headingPath(List.of("User", "Attributes"))
                    .sectionAnchor("attributes").chunkType(ChunkType.ENTITY).build(),
                Chunk.builder().sequence(0).content("first").headingPath(List.of("User")).build()
            ));

            assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.id()).isNotNull());
            List<Chunk> loaded = documentStore.findChunks(saved.id());
            assertThat(loaded).extracting(Chunk::content).containsExactly("first", "second");
            assertThat(loaded.get(1).headingPath()).containsExactly("User", "Attributes");
            assertThat(loaded.get(1).chunkType()).isEqualTo(ChunkType.ENTITY);
            assertThat(loaded.get(1).sectionTitle()).isEqualTo("Attributes");

            assertThat(documentStore.findChunk(chunks.get(0).id())).map(Chunk::content).contains("second");
            assertThat(documentStore.deleteChunks(saved.id())).isEqualTo(2);
        }
    }

    @Test
    @DisplayName("Ping succeeds against a reachable database")
    void ping() {
        documentStore.ping();
    }
}
