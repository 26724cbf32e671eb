package com.kbengine.extraction;

import com.kbengine.graph.GraphStore;
import com.kbengine.model.Chunk;
import com.kbengine.model.Document;
import com.kbengine.model.graph.ExtractionResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Detects the document kind, hands the document to the first extractor that supports it and falls back to
 * the minimal document node when none does or when extraction fails.
 */
@Slf4j
public class KindAwareExtractionStrategy implements ExtractionStrategy {

    private final GraphStore graphStore;
    private final DocumentKindDetector detector;
    private final List<GraphExtractor> extractors;
    private final GraphExtractor fallback;
    private final GraphWriteLock writeLock;

    public KindAwareExtractionStrategy(GraphStore graphStore, DocumentKindDetector detector,
                                       List<GraphExtractor> extractors, GraphExtractor fallback,
                                       GraphWriteLock writeLock) {
        this.graphStore = graphStore;
        this.detector = detector;
        this.extractors = List.copyOf(extractors);
        this.fallback = fallback;
        this.writeLock = writeLock;
    }

    @Override
    public ExtractionResult extractAndStore(Document document, List<Chunk> chunks) {
        KindDetection detection = detector.detect(document);
        GraphExtractor extractor = select(document, detection);
        log.debug("Document {} detected as {} ({}), extracting with {}",
            document.id(), detection.kind().value(), detection.confidence(), extractor.name());

        return writeLock.withLock(() -> {
            try {
                return extractor.extract(document, chunks, detection);
            } catch (RuntimeException e) {
                if (extractor == fallback) {
                    throw e;
                }
                log.warn("Extraction with {} failed for document {} ({}), degrading to {}: {}",
                    extractor.name(), document.id(), document.displayPath(), fallback.name(), e.getMessage());
                // drop whatever the failed attempt managed to write before degrading
                graphStore.deleteBySourceDocument(document.id().toString());
                return fallback.extract(document, chunks, detection);
            }
        });
    }

    @Override
    public void deleteByDocument(String documentId) {
        writeLock.withLock(() -> graphStore.deleteBySourceDocument(documentId));
    }

    GraphExtractor select(Document document, KindDetection detection) {
        for (GraphExtractor extractor : extractors) {
            if (extractor.supports(document, detection)) {
                return extractor;
            }
        }
        return fallback;
    }
}
