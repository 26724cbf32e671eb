package com.kbengine.extraction;

import com.kbengine.model.Chunk;
import com.kbengine.model.Document;
import com.kbengine.model.graph.ExtractionResult;

import java.util.List;

/**
 * Turns one indexed document into nodes and edges of the knowledge graph.
 * Node ids are derived from names only, so running an extraction twice writes the same graph.
 */
public interface ExtractionStrategy {

    /**
     * Writes the document's contribution to the graph. Never throws for malformed content;
     * a document that cannot be understood is still represented by a minimal node.
     */
    ExtractionResult extractAndStore(Document document, List<Chunk> chunks);

    /**
     * Removes everything the document contributed.
     */
    void deleteByDocument(String documentId);
}
