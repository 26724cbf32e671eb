package com.kbengine.chunking;

import com.kbengine.config.ChunkingProperties;
import com.kbengine.model.ChunkType;
import com.kbengine.model.ContentChunk;
import com.kbengine.model.ContentFormat;
import com.kbengine.model.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class SectionChunkerTest {

    private static final String USER_GUIDE = """
        ---
        title: User
        ---
        # User
        A registered customer.

        ## Attributes
        - email

        ## Approval
        1. Submit the form
        2. Review the request
        3. Approve the account
        """;

    private static SectionChunker chunker(ChunkingProperties properties) {
        return new SectionChunker(
            List.of(new MarkdownContentParser(), new JsonContentParser(), new YamlContentParser(),
                new RstContentParser(), new PlainTextContentParser()),
            List.of(new EntityChunkingStrategy(), new UseCaseChunkingStrategy(), new RuleChunkingStrategy(),
                new ProcessChunkingStrategy()),
            properties);
    }

    private static Document markdown(String content, Map<String, Object> metadata) {
        return Document.builder().title("User").content(content).format(ContentFormat.MARKDOWN).metadata(metadata).build();
    }

    @Test
    @DisplayName("Sections become ordered chunks classified by the first accepting strategy")
    void classifiesSections() {
        List<ContentChunk> chunks = chunker(ChunkingProperties.defaults()).chunk(markdown(USER_GUIDE, Map.of()));

        assertThat(chunks).extracting(ContentChunk::sequence).containsExactly(0, 1, 2);
        assertThat(chunks).extracting(ContentChunk::headingPath).containsExactly(
            List.of("User"), List.of("User", "Attributes"), List.of("User", "Approval"));
        assertThat(chunks).extracting(ContentChunk::chunkType)
            .containsExactly(ChunkType.DEFAULT, ChunkType.ENTITY, ChunkType.PROCESS);
        assertThat(chunks.get(0).content()).isEqualTo("A registered customer.");
    }

    @Test
    @DisplayName("A declared document kind classifies every section")
    void declaredKind() {
        List<ContentChunk> chunks = chunker(ChunkingProperties.defaults())
            .chunk(markdown(USER_GUIDE, Map.of("kind", "entity")));

        assertThat(chunks).extracting(ContentChunk::chunkType).containsOnly(ChunkType.ENTITY);
    }

    @Test
    @DisplayName("Without semantic chunking the whole body is one section")
    void nonSemantic() {
        List<ContentChunk> chunks = chunker(new ChunkingProperties(2000, 200, false))
            .chunk(markdown(USER_GUIDE, Map.of()));

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).headingPath()).isEmpty();
        assertThat(chunks.get(0).content()).startsWith("# User").doesNotContain("title: User");
    }

    @Test
    @DisplayName("Blank documents produce no chunks")
    void blankDocument() {
        assertThat(chunker(ChunkingProperties.defaults()).chunk(markdown("  \n", Map.of()))).isEmpty();
    }

    @Test
    @DisplayName("Oversized sections are split into bounded pieces with contiguous sequences")
    void splitsOversizedSections() {
        String paragraphs = IntStream.range(0, 6)
            .mapToObj(i -> "Paragraph " + i + " describes how the billing service settles invoices each night.")
            .collect(Collectors.joining("\n\n"));
        ChunkingProperties small = new ChunkingProperties(100, 20, true);

        List<ContentChunk> chunks = chunker(small).chunk(markdown("# Billing\n" + paragraphs, Map.of()));

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(chunks).allSatisfy(chunk -> {
            assertThat(chunk.content().length()).isLessThanOrEqualTo(100);
            assertThat(chunk.headingPath()).containsExactly("Billing");
        });
        assertThat(chunks).extracting(ContentChunk::sequence)
            .containsExactlyElementsOf(IntStream.range(0, chunks.size()).boxed().toList());
    }

    @Test
    @DisplayName("Structured formats use their own parser")
    void dispatchesByFormat() {
        Document json = Document.builder()
            .title("svc")
            .content("{\"name\": \"billing\", \"config\": {\"port\": 8080}}")
            .format(ContentFormat.JSON)
            .build();

        List<ContentChunk> chunks = chunker(ChunkingProperties.defaults()).chunk(json);

        assertThat(chunks).extracting(ContentChunk::content).containsExactly("name: billing", "port: 8080");
        assertThat(chunks.get(1).headingPath()).containsExactly("config");
    }
}
