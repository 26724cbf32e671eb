package com.kbengine.health;

import com.kbengine.exception.StoreUnavailableException;
import com.kbengine.graph.GraphStore;
import com.kbengine.repository.DocumentStore;
import com.kbengine.repository.VectorIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Probes every configured store. Unreachable stores are reported by name, never masked.
 */
@Slf4j
@Service
public class ReadinessService {

    private final DocumentStore documentStore;
    private final VectorIndex vectorIndex;
    private final Optional<GraphStore> graphStore;

    public ReadinessService(DocumentStore documentStore, VectorIndex vectorIndex, Optional<GraphStore> graphStore) {
        this.documentStore = documentStore;
        this.vectorIndex = vectorIndex;
        this.graphStore = graphStore;
    }

    public ReadinessReport check() {
        Map<String, String> stores = new LinkedHashMap<>();
        List<String> unavailable = new ArrayList<>();

        probe("documents", documentStore::ping, stores, unavailable);
        probe("vectors", vectorIndex::ping, stores, unavailable);
        if (graphStore.isPresent()) {
            probe("graph", graphStore.get()::ping, stores, unavailable);
        } else {
            stores.put("graph", "skipped");
        }

        return new ReadinessReport(unavailable.isEmpty() ? "ready" : "not_ready", stores, unavailable);
    }

    private static void probe(String name, Runnable ping, Map<String, String> stores, List<String> unavailable) {
        try {
            ping.run();
            stores.put(name, "up");
        } catch (StoreUnavailableException e) {
            log.warn("Readiness probe failed for {}: {}", name, e.getMessage());
            stores.put(name, "down");
            unavailable.add(name);
        }
    }
}
