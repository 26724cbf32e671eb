package com.kbengine.model;

import java.util.List;
import java.util.UUID;

public record SearchFilters(
    String domain,
    List<String> tags,
    List<ChunkType> chunkTypes,
    List<UUID> documentIds
) {

    public static final SearchFilters NONE = new SearchFilters(null, List.of(), List.of(), List.of());

    public SearchFilters {
        tags = tags == null ? List.of() : List.copyOf(tags);
        chunkTypes = chunkTypes == null ? List.of() : List.copyOf(chunkTypes);
        documentIds = documentIds == null ? List.of() : List.copyOf(documentIds);
    }

    public boolean hasDomain() {
        return domain != null && !domain.isBlank();
    }
}
