package com.kbengine.chunking;

import com.kbengine.model.ChunkType;
import com.kbengine.model.Document;

import java.util.Locale;
import java.util.Set;

/**
 * Accepts sections of documents declared with one of {@code documentKinds}, or whose heading path
 * mentions one of {@code headingKeywords}.
 */
abstract class KeywordChunkingStrategy implements ChunkingStrategy {

    private final ChunkType chunkType;
    private final Set<String> documentKinds;
    private final Set<String> headingKeywords;

    protected KeywordChunkingStrategy(ChunkType chunkType, Set<String> documentKinds, Set<String> headingKeywords) {
        this.chunkType = chunkType;
        this.documentKinds = documentKinds;
        this.headingKeywords = headingKeywords;
    }

    @Override
    public ChunkType chunkType() {
        return chunkType;
    }

    @Override
    public boolean accepts(Document document, Section section) {
        String kind = document.kind();
        if (kind != null && documentKinds.contains(kind.toLowerCase(Locale.ROOT).replace('_', '-'))) {
            return true;
        }
        for (String heading : section.headingPath()) {
            String lower = heading.toLowerCase(Locale.ROOT);
            for (String keyword : headingKeywords) {
                if (lower.contains(keyword)) {
                    return true;
                }
            }
        }
        return matchesContent(section.content());
    }

    protected boolean matchesContent(String content) {
        return false;
    }
}
