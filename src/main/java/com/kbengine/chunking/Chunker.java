package com.kbengine.chunking;

import com.kbengine.model.ContentChunk;
import com.kbengine.model.Document;

import java.util.List;

public interface Chunker {

    /**
     * Splits a document into ordered chunks. Sequences are contiguous and start at 0.
     */
    List<ContentChunk> chunk(Document document);
}
