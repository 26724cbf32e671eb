package com.kbengine.chunking;

import com.kbengine.model.ChunkType;
import com.kbengine.model.Document;

/**
 * Classifies a section. The first strategy that accepts a section decides its chunk type.
 */
public interface ChunkingStrategy {

    ChunkType chunkType();

    boolean accepts(Document document, Section section);
}
