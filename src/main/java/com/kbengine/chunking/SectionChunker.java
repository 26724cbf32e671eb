package com.kbengine.chunking;

import com.kbengine.config.ChunkingProperties;
import com.kbengine.model.ChunkType;
import com.kbengine.model.ContentChunk;
import com.kbengine.model.ContentFormat;
import com.kbengine.model.Document;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.document.splitter.DocumentSplitters;
import dev.langchain4j.data.segment.TextSegment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Parses a document by format, classifies each section with the first accepting strategy and splits
 * oversized sections with overlap.
 */
@Slf4j
@Component
public class SectionChunker implements Chunker {

    private final Map<ContentFormat, ContentParser> parsers = new EnumMap<>(ContentFormat.class);
    private final List<ChunkingStrategy> strategies;
    private final DocumentSplitter splitter;
    private final ChunkingProperties properties;

    public SectionChunker(List<ContentParser> parsers, List<ChunkingStrategy> strategies, ChunkingProperties properties) {
        parsers.forEach(parser -> this.parsers.put(parser.format(), parser));
        this.strategies = List.copyOf(strategies);
        this.properties = properties;
        this.splitter = DocumentSplitters.recursive(properties.maxChunkSize(), properties.overlap());
    }

    @Override
    public List<ContentChunk> chunk(Document document) {
        if (document.content() == null || document.content().isBlank()) {
            return List.of();
        }

        List<Section> sections = properties.semantic()
            ? parserFor(document.format()).parse(document.content())
            : List.of(new Section(List.of(), bodyOf(document)));

        List<ContentChunk> chunks = new ArrayList<>();
        for (Section section : sections) {
            ChunkType type = classify(document, section);
            for (String piece : split(section.content())) {
                chunks.add(new ContentChunk(chunks.size(), piece, section.headingPath(), type));
            }
        }

        log.debug("Document '{}' split into {} chunks from {} sections", document.title(), chunks.size(), sections.size());
        return chunks;
    }

    private ContentParser parserFor(ContentFormat format) {
        ContentParser parser = parsers.get(format);
        return parser != null ? parser : parsers.get(ContentFormat.PLAINTEXT);
    }

    private String bodyOf(Document document) {
        return document.format() == ContentFormat.MARKDOWN ? FrontMatter.strip(document.content()) : document.content();
    }

    private ChunkType classify(Document document, Section section) {
        for (ChunkingStrategy strategy : strategies) {
            if (strategy.accepts(document, section)) {
                return strategy.chunkType();
            }
        }
        return ChunkType.DEFAULT;
    }

    private List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        if (text.length() <= properties.maxChunkSize()) {
            return List.of(text.strip());
        }
        return splitter.split(dev.langchain4j.data.document.Document.from(text))
            .stream()
            .map(TextSegment::text)
            .filter(s -> !s.isBlank())
            .toList();
    }
}
