package com.kbengine.retrieval;

import com.kbengine.model.DocumentReference;
import com.kbengine.model.RetrievalMode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges ranked lists by URL. A reference at zero-based rank {@code r} in a list contributes {@code 1/(k+r+1)};
 * contributions of references sharing a URL are summed.
 */
public final class ReciprocalRankFusion {

    public static final int DEFAULT_K = 60;

    private ReciprocalRankFusion() {
    }

    public static List<DocumentReference> fuse(List<List<DocumentReference>> rankedLists, int k, int limit) {
        Map<String, DocumentReference> firstSeen = new LinkedHashMap<>();
        Map<String, Double> scores = new LinkedHashMap<>();

        for (List<DocumentReference> list : rankedLists) {
            for (int rank = 0; rank < list.size(); rank++) {
                DocumentReference reference = list.get(rank);
                firstSeen.putIfAbsent(reference.url(), reference);
                scores.merge(reference.url(), 1.0 / (k + rank + 1), Double::sum);
            }
        }

        List<DocumentReference> fused = new ArrayList<>(firstSeen.size());
        firstSeen.forEach((url, reference) -> fused.add(reference.withScoreAndMode(scores.get(url), RetrievalMode.HYBRID)));
        // stable sort keeps first-appearance order among ties
        fused.sort(Comparator.comparingDouble(DocumentReference::score).reversed());
        return fused.size() > limit ? List.copyOf(fused.subList(0, limit)) : List.copyOf(fused);
    }
}
