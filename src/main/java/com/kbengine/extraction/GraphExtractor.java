package com.kbengine.extraction;

import com.kbengine.model.Chunk;
import com.kbengine.model.Document;
import com.kbengine.model.graph.ExtractionResult;

import java.util.List;

/**
 * One way of reading a document into the graph. Extractors are tried in order and the first one
 * that supports the detected kind wins.
 */
public interface GraphExtractor {

    String name();

    boolean supports(Document document, KindDetection detection);

    ExtractionResult extract(Document document, List<Chunk> chunks, KindDetection detection);
}
